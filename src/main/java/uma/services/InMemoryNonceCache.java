package uma.services;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import uma.errors.InvalidNonceException;
import uma.errors.InvalidNonceException.Reason;

/**
 * Keeps nonces in memory, so they are lost on restart.
 */
@Slf4j
public class InMemoryNonceCache implements NonceCache {

    private final Map<String, Long> timestampsByNonce = new HashMap<>();
    private long oldestValidTimestamp;

    /**
     * @param oldestValidTimestamp unix seconds, timestamps before it are rejected
     */
    public InMemoryNonceCache(long oldestValidTimestamp) {
        this.oldestValidTimestamp = oldestValidTimestamp;
    }

    @Override
    public synchronized void checkAndSaveNonce(String nonce, long timestamp) {
        if (timestamp < oldestValidTimestamp) {
            log.debug("Rejecting nonce={} with timestamp={} before oldestValidTimestamp={}",
                nonce, timestamp, oldestValidTimestamp);
            throw new InvalidNonceException(Reason.TIMESTAMP_TOO_OLD, nonce);
        }
        if (timestampsByNonce.putIfAbsent(nonce, timestamp) != null) {
            log.debug("Rejecting reused nonce={}", nonce);
            throw new InvalidNonceException(Reason.NONCE_ALREADY_USED, nonce);
        }
    }

    @Override
    public synchronized void purgeNoncesOlderThan(long timestamp) {
        final int before = timestampsByNonce.size();
        timestampsByNonce.values().removeIf(saved -> saved < timestamp);
        oldestValidTimestamp = timestamp;
        log.debug("Purged {} nonces older than timestamp={}", before - timestampsByNonce.size(), timestamp);
    }

    synchronized int size() {
        return timestampsByNonce.size();
    }
}
