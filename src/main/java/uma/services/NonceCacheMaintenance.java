package uma.services;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uma.config.AppProperties;

/**
 * Slides the oldest accepted nonce timestamp forward so the cache does not grow without bound.
 */
@Service
@Slf4j
public class NonceCacheMaintenance {

    private final NonceCache nonceCache;
    private final AppProperties appProperties;
    private final Clock clock;

    public NonceCacheMaintenance(NonceCache nonceCache, AppProperties appProperties, Clock clock) {
        this.nonceCache = nonceCache;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${uma.nonce-purge-interval:PT5M}", initialDelayString = "${uma.nonce-purge-interval:PT5M}")
    public void purgeExpiredNonces() {
        final long cutoff = clock.instant().minus(appProperties.nonceMaxAge()).getEpochSecond();
        log.debug("Purging nonces older than cutoff={}", cutoff);
        nonceCache.purgeNoncesOlderThan(cutoff);
    }
}
