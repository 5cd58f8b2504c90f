package uma.messages;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import uma.errors.ErrorCode;
import uma.errors.UmaException;
import uma.model.CounterPartyDataOption;
import uma.model.PayerData;
import uma.model.SettlementInfo;

/**
 * The request the sending VASP posts to the callback of a lnurlp response to get an invoice.
 * <p>
 * Major version 1 senders multiplex the sending currency into {@code amount} as {@code <amount>.<code>} and
 * name the receiving currency {@code convert}. Major version 0 senders send a flat {@code currency} key,
 * which is how the two layouts are told apart when parsing.
 */
@JsonDeserialize(using = PayRequest.Deserializer.class)
public sealed interface PayRequest permits PayRequestV0, PayRequestV1 {

    String PARAM_AMOUNT = "amount";
    String PARAM_CONVERT = "convert";
    String PARAM_PAYER_DATA = "payerData";
    String PARAM_PAYEE_DATA = "payeeData";
    String PARAM_COMMENT = "comment";
    String PARAM_INVOICE_UUID = "invoiceUUID";
    String PARAM_SETTLEMENT = "settlement";

    /**
     * In the smallest unit of {@link #sendingCurrencyCode()}, or in millisatoshis when that is null.
     */
    long amount();

    @Nullable
    PayerData payerData();

    /**
     * Currency of {@link #amount()}. Null means the amount is in millisatoshis and the sent amount is locked
     * on the sender side.
     */
    @Nullable
    String sendingCurrencyCode();

    /**
     * The currency the receiver will receive.
     */
    @Nullable
    String receivingCurrencyCode();

    @Nullable
    Map<String, CounterPartyDataOption> requestedPayeeData();

    @Nullable
    String comment();

    @Nullable
    String invoiceUUID();

    @Nullable
    SettlementInfo settlementInfo();

    boolean isUmaRequest();

    /**
     * @throws UmaException with {@link ErrorCode#MISSING_REQUIRED_UMA_PARAMETERS} when the payer identifier or
     *                      compliance data is absent
     */
    byte[] signablePayload();

    /**
     * Signs the same payload as the primary signature and appends it to the payer compliance data.
     */
    PayRequest appendBackingSignature(byte[] signingPrivateKey, String domain);

    /**
     * The GET form of the request.
     */
    Map<String, String> toQueryParamMap();

    UmaPayRequest toUmaPayRequest();

    default String toJson() {
        return UmaJson.write(this);
    }

    static PayRequest fromJson(String json) {
        return UmaJson.read(json, PayRequest.class, ErrorCode.PARSE_PAYREQ_REQUEST_ERROR);
    }

    /**
     * Parses the GET form, which is always major version 1.
     */
    static PayRequest fromQueryParamMap(Map<String, List<String>> queryParams) {
        final String amountText = first(queryParams, PARAM_AMOUNT);
        if (amountText == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, "Amount is required");
        }
        final Amount amount = Amount.parse(amountText);

        final String payerDataJson = first(queryParams, PARAM_PAYER_DATA);
        final String payeeDataJson = first(queryParams, PARAM_PAYEE_DATA);
        final String settlementJson = first(queryParams, PARAM_SETTLEMENT);
        return PayRequestV1.builder()
            .sendingCurrencyCode(amount.currencyCode())
            .receivingCurrencyCode(first(queryParams, PARAM_CONVERT))
            .amount(amount.value())
            .payerData(payerDataJson != null
                ? UmaJson.read(payerDataJson, PayerData.class, ErrorCode.PARSE_PAYREQ_REQUEST_ERROR)
                : null)
            .requestedPayeeData(payeeDataJson != null
                ? UmaJson.read(payeeDataJson, new TypeReference<Map<String, CounterPartyDataOption>>() {},
                    ErrorCode.PARSE_PAYREQ_REQUEST_ERROR)
                : null)
            .comment(first(queryParams, PARAM_COMMENT))
            .invoiceUUID(first(queryParams, PARAM_INVOICE_UUID))
            .settlementInfo(settlementJson != null
                ? UmaJson.read(settlementJson, SettlementInfo.class, ErrorCode.PARSE_PAYREQ_REQUEST_ERROR)
                : null)
            .build();
    }

    private static String first(Map<String, List<String>> queryParams, String name) {
        final List<String> values = queryParams.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * The multiplexed {@code amount} field, {@code <value>} or {@code <value>.<currencyCode>}.
     */
    record Amount(
        long value,
        @Nullable
        String currencyCode
    ) {

        /**
         * Splits on the first {@code .}.
         *
         * @throws UmaException with {@link ErrorCode#PARSE_PAYREQ_REQUEST_ERROR} when the value is not an integer
         */
        public static Amount parse(String text) {
            final int dot = text.indexOf('.');
            final String value = dot >= 0 ? text.substring(0, dot) : text;
            final String currencyCode = dot >= 0 ? text.substring(dot + 1) : null;
            try {
                return new Amount(Long.parseLong(value), currencyCode);
            } catch (NumberFormatException e) {
                throw new UmaException(ErrorCode.PARSE_PAYREQ_REQUEST_ERROR, "Invalid amount: " + text, e);
            }
        }

        @Override
        public String toString() {
            return currencyCode != null ? value + "." + currencyCode : Long.toString(value);
        }
    }

    class Deserializer extends StdDeserializer<PayRequest> {

        public Deserializer() {
            super(PayRequest.class);
        }

        @Override
        public PayRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            final JsonNode node = ctxt.readTree(p);
            return node.has("currency")
                ? ctxt.readTreeAsValue(node, PayRequestV0.class)
                : ctxt.readTreeAsValue(node, PayRequestV1.class);
        }
    }
}
