package uma.messages;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;
import uma.crypto.PayloadSigner;
import uma.model.BackingSignature;

/**
 * A lnurlp request that carries every UMA field.
 */
public record UmaLnurlpRequest(
    String receiverAddress,
    String nonce,
    String signature,
    boolean isSubjectToTravelRule,
    String vaspDomain,
    long timestamp,
    String umaVersion,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public UmaLnurlpRequest {
        Objects.requireNonNull(receiverAddress, "receiverAddress");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(vaspDomain, "vaspDomain");
        Objects.requireNonNull(umaVersion, "umaVersion");
        backingSignatures = backingSignatures != null ? List.copyOf(backingSignatures) : null;
    }

    public LnurlpRequest toLnurlpRequest() {
        return new LnurlpRequest(receiverAddress, nonce, signature, isSubjectToTravelRule, vaspDomain, timestamp,
            umaVersion, backingSignatures);
    }

    public String encodeToUrl() {
        return toLnurlpRequest().encodeToUrl();
    }

    public byte[] signablePayload() {
        return (receiverAddress + "|" + nonce + "|" + timestamp).getBytes(StandardCharsets.UTF_8);
    }

    public UmaLnurlpRequest signedWith(String signature) {
        return new UmaLnurlpRequest(receiverAddress, nonce, signature, isSubjectToTravelRule, vaspDomain, timestamp,
            umaVersion, backingSignatures);
    }

    public UmaLnurlpRequest appendBackingSignature(byte[] signingPrivateKey, String domain) {
        final List<BackingSignature> appended = new ArrayList<>();
        if (backingSignatures != null) {
            appended.addAll(backingSignatures);
        }
        appended.add(new BackingSignature(domain, PayloadSigner.sign(signablePayload(), signingPrivateKey)));
        return new UmaLnurlpRequest(receiverAddress, nonce, signature, isSubjectToTravelRule, vaspDomain, timestamp,
            umaVersion, appended);
    }
}
