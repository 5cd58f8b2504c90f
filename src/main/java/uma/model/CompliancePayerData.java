package uma.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.errors.MissingRequiredFieldsException;

/**
 * Compliance data of the sender, carried under the {@code compliance} key of the payer data.
 *
 * @param utxos                   UTXOs of the sender's channels that might fund the payment
 * @param nodePubKey              the sender's node, if known, so the receiver can pre-screen its UTXOs
 * @param kycStatus               whether the sending VASP holds KYC information about the sender
 * @param encryptedTravelRuleInfo hex ECIES ciphertext of the travel rule information, encrypted to the receiver
 * @param utxoCallback            where the receiver posts its UTXOs once the payment completes
 * @param signature               hex signature over {@code payerIdentifier|nonce|timestamp}
 * @param signatureNonce
 * @param signatureTimestamp      unix seconds
 * @param travelRuleFormat        null for raw JSON or a custom format
 * @param backingSignatures
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
public record CompliancePayerData(
    List<String> utxos,
    @Nullable
    String nodePubKey,
    KycStatus kycStatus,
    @Nullable
    String encryptedTravelRuleInfo,
    String utxoCallback,
    String signature,
    String signatureNonce,
    Long signatureTimestamp,
    @Nullable
    TravelRuleFormat travelRuleFormat,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public CompliancePayerData {
        // absent utxos and utxoCallback decode as empty
        utxos = utxos != null ? List.copyOf(utxos) : List.of();
        utxoCallback = utxoCallback != null ? utxoCallback : "";

        final List<String> missing = new ArrayList<>();
        if (kycStatus == null) {
            missing.add("kycStatus");
        }
        if (signature == null) {
            missing.add("signature");
        }
        if (signatureNonce == null) {
            missing.add("signatureNonce");
        }
        if (signatureTimestamp == null) {
            missing.add("signatureTimestamp");
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Payer compliance data", missing);
        }
    }

    public CompliancePayerData signedWith(String signature) {
        return toBuilder().signature(signature).build();
    }

    public CompliancePayerData withBackingSignature(BackingSignature backingSignature) {
        final List<BackingSignature> appended = new ArrayList<>();
        if (backingSignatures != null) {
            appended.addAll(backingSignatures);
        }
        appended.add(backingSignature);
        return toBuilder().backingSignatures(List.copyOf(appended)).build();
    }
}
