package uma.crypto;

import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * Hex facing wrappers over {@link Secp256k1}, in the encoding used on the wire.
 */
@Slf4j
public final class PayloadSigner {

    private PayloadSigner() {
    }

    /**
     * @return hex encoded DER signature
     */
    public static String sign(byte[] payload, byte[] privateKey) {
        return Hex.toHexString(Secp256k1.signEcdsa(payload, privateKey));
    }

    public static boolean verify(byte[] payload, String signature, byte[] publicKey) {
        if (signature == null || signature.isEmpty()) {
            return false;
        }
        final byte[] signatureBytes;
        try {
            signatureBytes = Hex.decode(signature);
        } catch (DecoderException e) {
            log.debug("Signature is not hex: {}", e.getMessage());
            return false;
        }
        return Secp256k1.verifyEcdsa(payload, signatureBytes, publicKey);
    }

    /**
     * Encrypts travel rule information to the receiver's encryption key.
     *
     * @return hex encoded ECIES ciphertext
     */
    public static String encrypt(String plaintext, byte[] recipientPublicKey) {
        return Hex.toHexString(Secp256k1.encryptEcies(plaintext.getBytes(StandardCharsets.UTF_8), recipientPublicKey));
    }

    public static String decrypt(String hexCiphertext, byte[] privateKey) {
        try {
            return new String(Secp256k1.decryptEcies(Hex.decode(hexCiphertext), privateKey), StandardCharsets.UTF_8);
        } catch (DecoderException e) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Ciphertext is not hex", e);
        }
    }

    /**
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} for text that is not hex
     */
    public static byte[] hexToBytes(String hex) {
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Not a hex string", e);
        }
    }
}
