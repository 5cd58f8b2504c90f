package uma.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
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
import uma.model.CompliancePayerData;
import uma.model.CounterPartyDataOption;
import uma.model.PayerData;
import uma.model.SettlementInfo;

/**
 * Pay request of major version 1.
 *
 * @param sendingCurrencyCode   currency of {@code amount}, null for millisatoshis
 * @param receivingCurrencyCode sent as {@code convert}
 * @param amount
 * @param payerData
 * @param requestedPayeeData    sent as {@code payeeData}
 * @param comment               at most {@code commentAllowed} characters of the lnurlp response
 * @param invoiceUUID           set when paying an UMA invoice
 * @param settlementInfo        sent as {@code settlement}, null to settle on lightning in BTC
 */
@Builder(toBuilder = true)
@JsonSerialize(using = PayRequestV1.Serializer.class)
@JsonDeserialize(using = PayRequestV1.Deserializer.class)
public record PayRequestV1(
    @Nullable
    String sendingCurrencyCode,
    @Nullable
    String receivingCurrencyCode,
    long amount,
    @Nullable
    PayerData payerData,
    @Nullable
    Map<String, CounterPartyDataOption> requestedPayeeData,
    @Nullable
    String comment,
    @Nullable
    String invoiceUUID,
    @Nullable
    SettlementInfo settlementInfo
) implements PayRequest {

    @Override
    public boolean isUmaRequest() {
        return payerData != null && payerData.identifier().isPresent() && payerData.compliance().isPresent();
    }

    /**
     * Lower-cased {@code payerIdentifier|nonce|timestamp}, with nonce and timestamp from the payer compliance data.
     */
    @Override
    public byte[] signablePayload() {
        if (payerData == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, "Payer data is required for UMA");
        }
        final String identifier = payerData.identifier()
            .orElseThrow(() -> new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS,
                "Payer identifier is required for UMA"));
        final CompliancePayerData compliance = payerData.compliance()
            .orElseThrow(() -> new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS,
                "Compliance data is required"));
        return (identifier + "|" + compliance.signatureNonce() + "|" + compliance.signatureTimestamp())
            .toLowerCase(Locale.ROOT)
            .getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public PayRequestV1 appendBackingSignature(byte[] signingPrivateKey, String domain) {
        final String signature = PayloadSigner.sign(signablePayload(), signingPrivateKey);
        final CompliancePayerData compliance = payerData.compliance().orElseThrow();
        return toBuilder()
            .payerData(payerData.withCompliance(compliance.withBackingSignature(new BackingSignature(domain, signature))))
            .build();
    }

    @Override
    public Map<String, String> toQueryParamMap() {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_AMOUNT, new Amount(amount, sendingCurrencyCode).toString());
        if (receivingCurrencyCode != null) {
            params.put(PARAM_CONVERT, receivingCurrencyCode);
        }
        if (payerData != null) {
            params.put(PARAM_PAYER_DATA, UmaJson.write(payerData));
        }
        if (requestedPayeeData != null) {
            params.put(PARAM_PAYEE_DATA, UmaJson.write(requestedPayeeData));
        }
        if (comment != null) {
            params.put(PARAM_COMMENT, comment);
        }
        if (invoiceUUID != null) {
            params.put(PARAM_INVOICE_UUID, invoiceUUID);
        }
        if (settlementInfo != null) {
            params.put(PARAM_SETTLEMENT, UmaJson.write(settlementInfo));
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
        return new UmaPayRequest(this, payerData.identifier().get(), payerData.compliance().get());
    }

    WireForm toWireForm() {
        return new WireForm(receivingCurrencyCode, new Amount(amount, sendingCurrencyCode).toString(), payerData,
            requestedPayeeData, comment, invoiceUUID, settlementInfo);
    }

    static PayRequestV1 fromWireForm(WireForm wire) {
        if (wire.amount() == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, "Amount is required");
        }
        final Amount amount = Amount.parse(wire.amount());
        return new PayRequestV1(amount.currencyCode(), wire.convert(), amount.value(), wire.payerData(),
            wire.payeeData(), wire.comment(), wire.invoiceUUID(), wire.settlement());
    }

    /**
     * The JSON layout, with the amount still multiplexed.
     */
    @JsonInclude(Include.NON_NULL)
    record WireForm(
        String convert,
        String amount,
        PayerData payerData,
        Map<String, CounterPartyDataOption> payeeData,
        String comment,
        String invoiceUUID,
        SettlementInfo settlement
    ) {

    }

    static class Serializer extends StdSerializer<PayRequestV1> {

        public Serializer() {
            super(PayRequestV1.class);
        }

        @Override
        public void serialize(PayRequestV1 value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(value.toWireForm(), gen);
        }
    }

    static class Deserializer extends StdDeserializer<PayRequestV1> {

        public Deserializer() {
            super(PayRequestV1.class);
        }

        @Override
        public PayRequestV1 deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return fromWireForm(ctxt.readValue(p, WireForm.class));
        }
    }
}
