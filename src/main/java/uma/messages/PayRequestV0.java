package uma.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.errors.UmaException;
import uma.model.CompliancePayerData;
import uma.model.CounterPartyDataOption;
import uma.model.PayerData;
import uma.model.SettlementInfo;

/**
 * Pay request of major version 0. Backing signatures and the newer optional fields do not exist here.
 *
 * @param currencyCode the currency the receiver will receive, which is also the currency of {@code amount}
 * @param amount       in the smallest unit of {@code currencyCode}
 * @param payerData
 */
@JsonDeserialize(using = JsonDeserializer.None.class)
public record PayRequestV0(
    @JsonProperty("currency")
    String currencyCode,
    long amount,
    PayerData payerData
) implements PayRequest {

    @Override
    public String sendingCurrencyCode() {
        return currencyCode;
    }

    @Override
    public String receivingCurrencyCode() {
        return currencyCode;
    }

    @Override
    public Map<String, CounterPartyDataOption> requestedPayeeData() {
        return null;
    }

    @Override
    public String comment() {
        return null;
    }

    @Override
    public String invoiceUUID() {
        return null;
    }

    @Override
    public SettlementInfo settlementInfo() {
        return null;
    }

    @Override
    @JsonIgnore
    public boolean isUmaRequest() {
        return payerData != null && payerData.identifier().isPresent() && payerData.compliance().isPresent();
    }

    /**
     * {@code payerIdentifier|nonce|timestamp}, or only the identifier when there is no compliance data.
     */
    @Override
    public byte[] signablePayload() {
        final String identifier = payerData != null ? payerData.identifier().orElse(null) : null;
        if (identifier == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, "Payer identifier is required for UMA");
        }
        return payerData.compliance()
            .map(compliance -> identifier + "|" + compliance.signatureNonce() + "|" + compliance.signatureTimestamp())
            .orElse(identifier)
            .getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public PayRequestV0 appendBackingSignature(byte[] signingPrivateKey, String domain) {
        return this;
    }

    @Override
    public Map<String, String> toQueryParamMap() {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_AMOUNT, Long.toString(amount));
        params.put(PARAM_CONVERT, currencyCode);
        if (payerData != null) {
            params.put(PARAM_PAYER_DATA, UmaJson.write(payerData));
        }
        return params;
    }

    @Override
    public UmaPayRequest toUmaPayRequest() {
        final List<String> missing = new ArrayList<>();
        if (payerData == null || payerData.identifier().isEmpty()) {
            missing.add("payerData.identifier");
        }
        if (payerData == null || payerData.compliance().isEmpty()) {
            missing.add("payerData.compliance");
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Pay request", missing);
        }
        final CompliancePayerData compliance = payerData.compliance().get();
        return new UmaPayRequest(this, payerData.identifier().get(), compliance);
    }
}
