package uma.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.errors.MissingRequiredFieldsException;

/**
 * Compliance data of the receiver, carried under the {@code compliance} key of the payee data.
 *
 * @param utxos              UTXOs of channels over which the receiver will likely receive the payment
 * @param nodePubKey
 * @param utxoCallback       where the sender posts its UTXOs once the payment completes
 * @param signature          hex signature over {@code payerIdentifier|payeeIdentifier|nonce|timestamp}
 * @param signatureNonce
 * @param signatureTimestamp unix seconds
 * @param backingSignatures
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
public record CompliancePayeeData(
    List<String> utxos,
    @Nullable
    String nodePubKey,
    String utxoCallback,
    String signature,
    String signatureNonce,
    Long signatureTimestamp,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public CompliancePayeeData {
        utxos = utxos != null ? List.copyOf(utxos) : List.of();
        utxoCallback = utxoCallback != null ? utxoCallback : "";

        final List<String> missing = new ArrayList<>();
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
            throw new MissingRequiredFieldsException("Payee compliance data", missing);
        }
    }

    public CompliancePayeeData signedWith(String signature) {
        return toBuilder().signature(signature).build();
    }

    public CompliancePayeeData withBackingSignature(BackingSignature backingSignature) {
        final List<BackingSignature> appended = new ArrayList<>();
        if (backingSignatures != null) {
            appended.addAll(backingSignatures);
        }
        appended.add(backingSignature);
        return toBuilder().backingSignatures(List.copyOf(appended)).build();
    }
}
