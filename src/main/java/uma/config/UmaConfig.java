package uma.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uma.services.InMemoryNonceCache;
import uma.services.InMemoryPublicKeyCache;
import uma.services.NonceCache;
import uma.services.PublicKeyCache;
import uma.services.VersionNegotiator;

/**
 * The caches default to in-memory ones. Declare a {@link NonceCache} or {@link PublicKeyCache} bean to persist them.
 */
@Configuration
public class UmaConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VersionNegotiator versionNegotiator(AppProperties appProperties) {
        return new VersionNegotiator(appProperties.backCompatVersions());
    }

    @Bean
    @ConditionalOnMissingBean
    public NonceCache nonceCache(AppProperties appProperties, Clock clock) {
        return new InMemoryNonceCache(clock.instant().minus(appProperties.nonceMaxAge()).getEpochSecond());
    }

    @Bean
    @ConditionalOnMissingBean
    public PublicKeyCache publicKeyCache(AppProperties appProperties, Clock clock) {
        return new InMemoryPublicKeyCache(clock, appProperties.cacheKeysWithoutExpiration());
    }
}
