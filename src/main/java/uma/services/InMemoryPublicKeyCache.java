package uma.services;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import uma.messages.PubKeyResponse;

@Slf4j
public class InMemoryPublicKeyCache implements PublicKeyCache {

    private final Map<String/*vaspDomain*/, PubKeyResponse> cache = new HashMap<>();
    private final Clock clock;
    private final boolean allowEntriesWithoutExpiration;

    /**
     * @param allowEntriesWithoutExpiration when set, keys without an expiration are cached and never expire,
     *                                      otherwise they are not cached at all
     */
    public InMemoryPublicKeyCache(Clock clock, boolean allowEntriesWithoutExpiration) {
        this.clock = clock;
        this.allowEntriesWithoutExpiration = allowEntriesWithoutExpiration;
    }

    @Override
    public synchronized Optional<PubKeyResponse> getPublicKeysForVasp(String vaspDomain) {
        final PubKeyResponse cached = cache.get(vaspDomain);
        if (cached == null) {
            return Optional.empty();
        }
        if (!isUsable(cached)) {
            log.debug("Evicting expired public keys for vaspDomain={}", vaspDomain);
            cache.remove(vaspDomain);
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    @Override
    public synchronized void addPublicKeysForVasp(String vaspDomain, PubKeyResponse pubKeyResponse) {
        if (!isUsable(pubKeyResponse)) {
            log.warn("Not caching public keys for vaspDomain={} with expirationTimestamp={}",
                vaspDomain, pubKeyResponse.expirationTimestamp());
            return;
        }
        cache.put(vaspDomain, pubKeyResponse);
    }

    @Override
    public synchronized void removePublicKeysForVasp(String vaspDomain) {
        cache.remove(vaspDomain);
    }

    @Override
    public synchronized void clear() {
        cache.clear();
    }

    private boolean isUsable(PubKeyResponse pubKeyResponse) {
        final Long expiration = pubKeyResponse.expirationTimestamp();
        if (expiration == null) {
            return allowEntriesWithoutExpiration;
        }
        return expiration > clock.instant().getEpochSecond();
    }
}
