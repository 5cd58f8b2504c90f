package uma.services;

import uma.errors.InvalidNonceException;

/**
 * Replay protection for signed messages. Implementations must be thread-safe, and deployments with more than
 * one instance should back it with shared storage.
 */
public interface NonceCache {

    /**
     * Saves the nonce unless it was seen before or its timestamp is older than the oldest accepted one.
     *
     * @param timestamp unix seconds the nonce was signed with
     * @throws InvalidNonceException when the nonce is rejected
     */
    void checkAndSaveNonce(String nonce, long timestamp);

    /**
     * Drops nonces older than the cutoff and stops accepting any timestamp before it.
     *
     * @param timestamp unix seconds
     */
    void purgeNoncesOlderThan(long timestamp);
}
