package uma.messages;

import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;
import uma.model.BackingSignature;
import uma.model.CompliancePayeeData;

/**
 * A pay response known to carry everything UMA needs.
 *
 * @param source          the response as sent, either layout
 * @param paymentInfo
 * @param payeeIdentifier null for version 0 responses, which carry no payee data
 * @param compliance      null for version 0 responses
 */
public record UmaPayReqResponse(
    PayReqResponse source,
    PayReqResponsePaymentInfo paymentInfo,
    @Nullable
    String payeeIdentifier,
    @Nullable
    CompliancePayeeData compliance
) {

    public UmaPayReqResponse {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(paymentInfo, "paymentInfo");
    }

    public PayReqResponse toPayReqResponse() {
        return source;
    }

    public boolean isSigned() {
        return source instanceof PayReqResponseV1;
    }

    public List<BackingSignature> backingSignatures() {
        return compliance != null && compliance.backingSignatures() != null ? compliance.backingSignatures() : List.of();
    }

    public UmaPayReqResponse appendBackingSignature(byte[] signingPrivateKey, String domain, String payerIdentifier) {
        if (source instanceof PayReqResponseV1 v1) {
            return v1.appendBackingSignature(signingPrivateKey, domain, payerIdentifier).toUmaPayReqResponse();
        }
        return this;
    }

    public String toJson() {
        return source.toJson();
    }
}
