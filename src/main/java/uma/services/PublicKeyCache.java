package uma.services;

import java.util.Optional;
import uma.messages.PubKeyResponse;

/**
 * Public keys of other VASPs, keyed by their domain. Implementations must be thread-safe.
 */
public interface PublicKeyCache {

    /**
     * @return empty when nothing is cached for the domain or the cached keys expired
     */
    Optional<PubKeyResponse> getPublicKeysForVasp(String vaspDomain);

    /**
     * Silently ignores keys that already expired.
     */
    void addPublicKeysForVasp(String vaspDomain, PubKeyResponse pubKeyResponse);

    void removePublicKeysForVasp(String vaspDomain);

    void clear();
}
