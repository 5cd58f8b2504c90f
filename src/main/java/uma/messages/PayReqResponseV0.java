package uma.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import uma.errors.MissingRequiredFieldsException;
import uma.model.Route;

/**
 * Pay response of major version 0. It carries no signature.
 */
@JsonDeserialize(using = JsonDeserializer.None.class)
public record PayReqResponseV0(
    @JsonProperty("pr")
    String encodedInvoice,
    PayReqResponseCompliance compliance,
    PayReqResponsePaymentInfo paymentInfo,
    List<Route> routes
) implements PayReqResponse {

    public PayReqResponseV0 {
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    @Override
    @JsonIgnore
    public boolean isUmaResponse() {
        return compliance != null && paymentInfo != null;
    }

    @Override
    public UmaPayReqResponse toUmaPayReqResponse() {
        if (!isUmaResponse()) {
            throw new MissingRequiredFieldsException("Pay response", compliance == null
                ? List.of("compliance") : List.of("paymentInfo"));
        }
        return new UmaPayReqResponse(this, paymentInfo, null, null);
    }
}
