package uma.messages;

import java.util.List;
import java.util.Objects;
import uma.model.BackingSignature;
import uma.model.CompliancePayerData;

/**
 * A pay request known to carry the payer identifier and signed compliance data.
 *
 * @param source          the request as sent, either layout
 * @param payerIdentifier
 * @param compliance
 */
public record UmaPayRequest(
    PayRequest source,
    String payerIdentifier,
    CompliancePayerData compliance
) {

    public UmaPayRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(payerIdentifier, "payerIdentifier");
        Objects.requireNonNull(compliance, "compliance");
    }

    public PayRequest toPayRequest() {
        return source;
    }

    public byte[] signablePayload() {
        return source.signablePayload();
    }

    public List<BackingSignature> backingSignatures() {
        return compliance.backingSignatures() != null ? compliance.backingSignatures() : List.of();
    }

    public UmaPayRequest appendBackingSignature(byte[] signingPrivateKey, String domain) {
        return source.appendBackingSignature(signingPrivateKey, domain).toUmaPayRequest();
    }

    public String toJson() {
        return source.toJson();
    }
}
