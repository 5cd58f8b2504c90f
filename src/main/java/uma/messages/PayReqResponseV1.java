package uma.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.crypto.PayloadSigner;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.errors.UmaException;
import uma.model.BackingSignature;
import uma.model.CompliancePayeeData;
import uma.model.PayeeData;
import uma.model.Route;

/**
 * Pay response of major version 1.
 *
 * @param encodedInvoice
 * @param paymentInfo    sent as {@code converted}
 * @param payeeData      the receiver data that the pay request asked for, with signed compliance data
 * @param routes
 * @param disposable     UMA receivers send {@code false}, see LUD-11
 * @param successAction  shown to the user once paid, see LUD-09
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(using = JsonDeserializer.None.class)
public record PayReqResponseV1(
    @JsonProperty("pr")
    String encodedInvoice,
    @JsonProperty("converted")
    @Nullable
    PayReqResponsePaymentInfo paymentInfo,
    @Nullable
    PayeeData payeeData,
    List<Route> routes,
    @Nullable
    Boolean disposable,
    @Nullable
    Map<String, String> successAction
) implements PayReqResponse {

    public PayReqResponseV1 {
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    @Override
    @JsonIgnore
    public boolean isUmaResponse() {
        return missingUmaFields().isEmpty();
    }

    @Override
    public UmaPayReqResponse toUmaPayReqResponse() {
        final List<String> missing = missingUmaFields();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Pay response", missing);
        }
        return new UmaPayReqResponse(this, paymentInfo, payeeData.identifier().get(), payeeData.compliance().get());
    }

    /**
     * Lower-cased {@code payerIdentifier|payeeIdentifier|nonce|timestamp}.
     */
    public byte[] signablePayload(String payerIdentifier) {
        if (payeeData == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, "Payee data is required for UMA");
        }
        final String payeeIdentifier = payeeData.identifier()
            .orElseThrow(() -> new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS,
                "Payee identifier is required for UMA"));
        final CompliancePayeeData compliance = payeeData.compliance()
            .orElseThrow(() -> new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS,
                "Compliance data is required"));
        return (payerIdentifier + "|" + payeeIdentifier + "|" + compliance.signatureNonce() + "|"
            + compliance.signatureTimestamp())
            .toLowerCase(Locale.ROOT)
            .getBytes(StandardCharsets.UTF_8);
    }

    public PayReqResponseV1 appendBackingSignature(byte[] signingPrivateKey, String domain, String payerIdentifier) {
        final String signature = PayloadSigner.sign(signablePayload(payerIdentifier), signingPrivateKey);
        final CompliancePayeeData compliance = payeeData.compliance().orElseThrow();
        return toBuilder()
            .payeeData(payeeData.withCompliance(compliance.withBackingSignature(new BackingSignature(domain, signature))))
            .build();
    }

    private List<String> missingUmaFields() {
        final List<String> missing = new ArrayList<>();
        if (paymentInfo == null) {
            missing.add("converted");
        }
        if (payeeData == null || payeeData.identifier().isEmpty()) {
            missing.add("payeeData.identifier");
        }
        if (payeeData == null || payeeData.compliance().isEmpty()) {
            missing.add("payeeData.compliance");
        }
        return missing;
    }
}
