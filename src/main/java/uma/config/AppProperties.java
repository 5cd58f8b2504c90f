package uma.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param responseTimeout            allowed response time when fetching another VASP's public keys
 * @param backCompatVersions         the version advertised for each older supported major version
 * @param nonceMaxAge                how old a signature timestamp may be and still be accepted
 * @param noncePurgeInterval         how often nonces older than {@code nonceMaxAge} are purged
 * @param cacheKeysWithoutExpiration cache public keys that come without an expiration, and never expire them
 * @param keys                       this VASP's own keys, served at {@code /.well-known/lnurlpubkey}
 */
@ConfigurationProperties("uma")
@Validated
public record AppProperties(
    @DefaultValue("10s") @NotNull
    Duration responseTimeout,

    @DefaultValue("0.3")
    List<@Pattern(regexp = "\\d+\\.\\d+") String> backCompatVersions,

    @DefaultValue("1h") @NotNull
    Duration nonceMaxAge,

    @DefaultValue("PT5M") @NotNull
    Duration noncePurgeInterval,

    boolean cacheKeysWithoutExpiration,

    @DefaultValue @Valid
    Keys keys
) {

    /**
     * Either certificate chains or raw keys. Certificates win when both are set.
     *
     * @param signingCertificate    PEM chain
     * @param encryptionCertificate PEM chain
     * @param signingPubKey         hex encoded
     * @param encryptionPubKey      hex encoded
     * @param expirationTimestamp   unix seconds, advertised to other VASPs caching the keys
     */
    public record Keys(
        String signingCertificate,
        String encryptionCertificate,
        String signingPubKey,
        String encryptionPubKey,
        Long expirationTimestamp
    ) {

        public boolean hasSigningKey() {
            return signingCertificate != null || signingPubKey != null;
        }

        public boolean hasEncryptionKey() {
            return encryptionCertificate != null || encryptionPubKey != null;
        }
    }
}
