package uma.controllers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import uma.config.AppProperties;
import uma.config.AppProperties.Keys;
import uma.messages.PubKeyResponse;
import uma.messages.UmaUrls;

/**
 * Publishes this VASP's keys so other VASPs can verify its signatures and encrypt travel rule info to it.
 */
@RestController
@Slf4j
public class PubKeyController {

    private final AppProperties appProperties;

    public PubKeyController(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @GetMapping(value = UmaUrls.PUBKEY_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public PubKeyResponse publicKeys() {
        final Keys keys = appProperties.keys();
        if (!keys.hasSigningKey() || !keys.hasEncryptionKey()) {
            log.warn("Public keys were requested, but uma.keys is not configured");
            throw new PubKeysNotConfigured();
        }
        final PubKeyResponse response = new PubKeyResponse(
            keys.signingCertificate(),
            keys.encryptionCertificate(),
            keys.signingCertificate() == null ? keys.signingPubKey() : null,
            keys.encryptionCertificate() == null ? keys.encryptionPubKey() : null,
            keys.expirationTimestamp()
        );
        // misconfigured keys surface as INVALID_PUBKEY_FORMAT or CERT_CHAIN_INVALID
        response.signingKey();
        response.encryptionKey();
        return response;
    }
}
