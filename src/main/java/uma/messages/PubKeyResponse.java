package uma.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.io.IOException;
import java.io.StringReader;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.springframework.lang.Nullable;
import uma.crypto.PayloadSigner;
import uma.crypto.Secp256k1;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * A VASP's public keys, served at {@code /.well-known/lnurlpubkey}. A certificate, when present, is the source
 * of the key and wins over the raw key.
 *
 * @param signingCertificate    PEM chain whose first certificate holds the key that verifies this VASP's signatures
 * @param encryptionCertificate PEM chain whose first certificate holds the key travel rule info is encrypted to
 * @param signingPubKey         hex encoded
 * @param encryptionPubKey      hex encoded
 * @param expirationTimestamp   unix seconds until which the keys may be cached, null for no expiration
 */
@JsonInclude(Include.NON_NULL)
public record PubKeyResponse(
    @Nullable
    String signingCertificate,
    @Nullable
    String encryptionCertificate,
    @Nullable
    String signingPubKey,
    @Nullable
    String encryptionPubKey,
    @Nullable
    Long expirationTimestamp
) {

    public static PubKeyResponse ofKeys(byte[] signingPubKey, byte[] encryptionPubKey, @Nullable Long expirationTimestamp) {
        return new PubKeyResponse(null, null, Hex.toHexString(signingPubKey), Hex.toHexString(encryptionPubKey),
            expirationTimestamp);
    }

    public static PubKeyResponse ofCertificates(String signingCertificate, String encryptionCertificate,
        @Nullable Long expirationTimestamp
    ) {
        return new PubKeyResponse(signingCertificate, encryptionCertificate, null, null, expirationTimestamp);
    }

    /**
     * @return uncompressed secp256k1 key
     * @throws UmaException with {@link ErrorCode#INVALID_PUBKEY_FORMAT} when there is no usable key
     */
    public byte[] signingKey() {
        return effectiveKey(signingCertificate, signingPubKey, "signing");
    }

    /**
     * @return uncompressed secp256k1 key
     * @throws UmaException with {@link ErrorCode#INVALID_PUBKEY_FORMAT} when there is no usable key
     */
    public byte[] encryptionKey() {
        return effectiveKey(encryptionCertificate, encryptionPubKey, "encryption");
    }

    public String toJson() {
        return UmaJson.write(this);
    }

    public static PubKeyResponse fromJson(String json) {
        return UmaJson.read(json, PubKeyResponse.class, ErrorCode.INVALID_PUBKEY_FORMAT);
    }

    private static byte[] effectiveKey(@Nullable String certificateChain, @Nullable String hexKey, String purpose) {
        if (certificateChain != null) {
            return Secp256k1.uncompressed(keyOfFirstCertificate(certificateChain));
        }
        if (hexKey != null) {
            try {
                return Secp256k1.uncompressed(PayloadSigner.hexToBytes(hexKey));
            } catch (UmaException e) {
                throw new UmaException(ErrorCode.INVALID_PUBKEY_FORMAT, "Malformed %s public key".formatted(purpose), e);
            }
        }
        throw new UmaException(ErrorCode.INVALID_PUBKEY_FORMAT, "No %s public key".formatted(purpose));
    }

    private static byte[] keyOfFirstCertificate(String certificateChain) {
        try (PemReader pemReader = new PemReader(new StringReader(certificateChain))) {
            final PemObject pemObject = pemReader.readPemObject();
            if (pemObject == null || !"CERTIFICATE".equals(pemObject.getType())) {
                throw new UmaException(ErrorCode.CERT_CHAIN_INVALID, "Certificate chain has no certificate");
            }
            final X509CertificateHolder certificate = new X509CertificateHolder(pemObject.getContent());
            return certificate.getSubjectPublicKeyInfo().getPublicKeyData().getBytes();
        } catch (IOException e) {
            throw new UmaException(ErrorCode.CERT_CHAIN_INVALID, "Unable to read certificate chain", e);
        }
    }
}
