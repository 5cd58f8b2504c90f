package uma.messages;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.List;
import org.springframework.lang.Nullable;
import uma.errors.ErrorCode;
import uma.model.Route;

/**
 * The receiving VASP's answer to a pay request, carrying the invoice to pay. Version 0 responses have a
 * top-level {@code compliance} object, which is how the layouts are told apart when parsing.
 */
@JsonDeserialize(using = PayReqResponse.Deserializer.class)
public sealed interface PayReqResponse permits PayReqResponseV0, PayReqResponseV1 {

    /**
     * The BOLT11 invoice, sent as {@code pr}.
     */
    String encodedInvoice();

    @Nullable
    PayReqResponsePaymentInfo paymentInfo();

    /**
     * Always empty for UMA. Route hints travel in the invoice.
     */
    List<Route> routes();

    boolean isUmaResponse();

    UmaPayReqResponse toUmaPayReqResponse();

    default String toJson() {
        return UmaJson.write(this);
    }

    static PayReqResponse fromJson(String json) {
        return UmaJson.read(json, PayReqResponse.class, ErrorCode.PARSE_PAYREQ_RESPONSE_ERROR);
    }

    class Deserializer extends StdDeserializer<PayReqResponse> {

        public Deserializer() {
            super(PayReqResponse.class);
        }

        @Override
        public PayReqResponse deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            final JsonNode node = ctxt.readTree(p);
            return node.has("compliance")
                ? ctxt.readTreeAsValue(node, PayReqResponseV0.class)
                : ctxt.readTreeAsValue(node, PayReqResponseV1.class);
        }
    }
}
