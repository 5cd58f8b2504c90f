package uma.crypto;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * secp256k1 operations used by the protocol.
 * <p>
 * Signatures are ECDSA over the SHA-256 of the message, deterministic per RFC 6979, low-S, DER encoded.
 * Encryption is ECIES as produced by the eciesrs library: an ephemeral key agreement, HKDF-SHA256 over
 * {@code ephemeralPublicKey || sharedPoint} (both uncompressed), then AES-256-GCM with a 16 byte nonce.
 * Ciphertexts are laid out as {@code ephemeralPublicKey(65) || nonce(16) || tag(16) || encrypted}.
 */
@Slf4j
public final class Secp256k1 {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
        CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    public static final int PRIVATE_KEY_LENGTH = 32;
    static final int UNCOMPRESSED_PUBLIC_KEY_LENGTH = 65;
    static final int AES_NONCE_LENGTH = 16;
    static final int AES_TAG_LENGTH = 16;
    private static final int AES_KEY_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Secp256k1() {
    }

    /**
     * @return DER encoded signature
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} if the private key is not a valid scalar
     */
    public static byte[] signEcdsa(byte[] message, byte[] privateKey) {
        final ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(toScalar(privateKey), CURVE));
        final BigInteger[] rs = signer.generateSignature(sha256(message));
        final BigInteger s = rs[1].compareTo(HALF_CURVE_ORDER) > 0 ? CURVE.getN().subtract(rs[1]) : rs[1];

        final ASN1EncodableVector sequence = new ASN1EncodableVector();
        sequence.add(new ASN1Integer(rs[0]));
        sequence.add(new ASN1Integer(s));
        try {
            return new DERSequence(sequence).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new UmaException(ErrorCode.INTERNAL_ERROR, "Unable to encode signature", e);
        }
    }

    /**
     * Any malformed input, including a non-canonical DER encoding or a high-S signature, verifies as false.
     */
    public static boolean verifyEcdsa(byte[] message, byte[] signature, byte[] publicKey) {
        try {
            final ASN1Sequence sequence = ASN1Sequence.getInstance(ASN1Primitive.fromByteArray(signature));
            if (sequence.size() != 2) {
                return false;
            }
            final BigInteger r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getValue();
            final BigInteger s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getValue();
            if (!Arrays.equals(sequence.getEncoded(ASN1Encoding.DER), signature)
                || s.compareTo(HALF_CURVE_ORDER) > 0) {
                return false;
            }

            final ECDSASigner verifier = new ECDSASigner();
            verifier.init(false, new ECPublicKeyParameters(decodePoint(publicKey), CURVE));
            return verifier.verifySignature(sha256(message), r, s);
        } catch (IOException | RuntimeException e) {
            log.debug("Signature could not be checked: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @param publicKey uncompressed or compressed SEC1 encoding of the recipient's key
     */
    public static byte[] encryptEcies(byte[] plaintext, byte[] publicKey) {
        final ECPoint recipient = decodePoint(publicKey);

        final ECKeyPairGenerator generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(CURVE, RANDOM));
        final AsymmetricCipherKeyPair ephemeral = generator.generateKeyPair();
        final BigInteger ephemeralScalar = ((ECPrivateKeyParameters) ephemeral.getPrivate()).getD();
        final byte[] ephemeralPublicKey = ((ECPublicKeyParameters) ephemeral.getPublic()).getQ().getEncoded(false);

        final byte[] key = deriveKey(ephemeralPublicKey, recipient.multiply(ephemeralScalar).normalize());
        final byte[] nonce = new byte[AES_NONCE_LENGTH];
        RANDOM.nextBytes(nonce);

        // BouncyCastle appends the tag, the wire format puts it in front of the ciphertext
        final byte[] sealed = aesGcm(true, key, nonce, plaintext);
        final int encryptedLength = sealed.length - AES_TAG_LENGTH;

        final byte[] out = new byte[UNCOMPRESSED_PUBLIC_KEY_LENGTH + AES_NONCE_LENGTH + sealed.length];
        int offset = 0;
        System.arraycopy(ephemeralPublicKey, 0, out, offset, UNCOMPRESSED_PUBLIC_KEY_LENGTH);
        offset += UNCOMPRESSED_PUBLIC_KEY_LENGTH;
        System.arraycopy(nonce, 0, out, offset, AES_NONCE_LENGTH);
        offset += AES_NONCE_LENGTH;
        System.arraycopy(sealed, encryptedLength, out, offset, AES_TAG_LENGTH);
        offset += AES_TAG_LENGTH;
        System.arraycopy(sealed, 0, out, offset, encryptedLength);
        return out;
    }

    /**
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} if the ciphertext is truncated, was not
     *                      encrypted to this key, or was tampered with
     */
    public static byte[] decryptEcies(byte[] ciphertext, byte[] privateKey) {
        final int headerLength = UNCOMPRESSED_PUBLIC_KEY_LENGTH + AES_NONCE_LENGTH + AES_TAG_LENGTH;
        if (ciphertext.length < headerLength) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "ECIES ciphertext is too short");
        }
        final byte[] ephemeralPublicKey = Arrays.copyOfRange(ciphertext, 0, UNCOMPRESSED_PUBLIC_KEY_LENGTH);
        final byte[] nonce = Arrays.copyOfRange(ciphertext, UNCOMPRESSED_PUBLIC_KEY_LENGTH,
            UNCOMPRESSED_PUBLIC_KEY_LENGTH + AES_NONCE_LENGTH);

        final int encryptedLength = ciphertext.length - headerLength;
        final byte[] sealed = new byte[encryptedLength + AES_TAG_LENGTH];
        System.arraycopy(ciphertext, headerLength, sealed, 0, encryptedLength);
        System.arraycopy(ciphertext, UNCOMPRESSED_PUBLIC_KEY_LENGTH + AES_NONCE_LENGTH, sealed, encryptedLength,
            AES_TAG_LENGTH);

        final ECPoint shared = decodePoint(ephemeralPublicKey).multiply(toScalar(privateKey)).normalize();
        return aesGcm(false, deriveKey(ephemeralPublicKey, shared), nonce, sealed);
    }

    /**
     * @return the uncompressed encoding of the public key for the private key
     */
    public static byte[] publicKeyFor(byte[] privateKey) {
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), toScalar(privateKey)).normalize().getEncoded(false);
    }

    /**
     * @return the uncompressed encoding of an uncompressed or compressed public key
     * @throws UmaException with {@link ErrorCode#INVALID_PUBKEY_FORMAT} if it is not a point on the curve
     */
    public static byte[] uncompressed(byte[] publicKey) {
        return decodePoint(publicKey).getEncoded(false);
    }

    private static ECPoint decodePoint(byte[] publicKey) {
        try {
            return CURVE.getCurve().decodePoint(publicKey);
        } catch (IllegalArgumentException e) {
            throw new UmaException(ErrorCode.INVALID_PUBKEY_FORMAT, "Not a secp256k1 public key", e);
        }
    }

    private static BigInteger toScalar(byte[] privateKey) {
        if (privateKey == null || privateKey.length != PRIVATE_KEY_LENGTH) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Private key must be %d bytes".formatted(PRIVATE_KEY_LENGTH));
        }
        final BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(CURVE.getN()) >= 0) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Private key is out of range");
        }
        return d;
    }

    private static byte[] deriveKey(byte[] ephemeralPublicKey, ECPoint sharedPoint) {
        final byte[] sharedEncoded = sharedPoint.getEncoded(false);
        final byte[] ikm = new byte[ephemeralPublicKey.length + sharedEncoded.length];
        System.arraycopy(ephemeralPublicKey, 0, ikm, 0, ephemeralPublicKey.length);
        System.arraycopy(sharedEncoded, 0, ikm, ephemeralPublicKey.length, sharedEncoded.length);

        final HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ikm, null, null));
        final byte[] key = new byte[AES_KEY_LENGTH];
        hkdf.generateBytes(key, 0, key.length);
        return key;
    }

    private static byte[] aesGcm(boolean encrypt, byte[] key, byte[] nonce, byte[] input) {
        final GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
        cipher.init(encrypt, new AEADParameters(new KeyParameter(key), AES_TAG_LENGTH * 8, nonce));
        final byte[] out = new byte[cipher.getOutputSize(input.length)];
        try {
            final int written = cipher.processBytes(input, 0, input.length, out, 0);
            final int finished = cipher.doFinal(out, written);
            return written + finished == out.length ? out : Arrays.copyOf(out, written + finished);
        } catch (InvalidCipherTextException e) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Unable to decrypt ECIES ciphertext", e);
        }
    }

    private static byte[] sha256(byte[] message) {
        final SHA256Digest digest = new SHA256Digest();
        digest.update(message, 0, message.length);
        final byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
