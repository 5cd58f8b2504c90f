package uma.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@JsonDeserialize(using = JsonDeserializer.None.class)
public record CurrencyV0(
    String code,
    String name,
    String symbol,
    @JsonProperty("multiplier")
    double millisatoshiPerUnit,
    long minSendable,
    long maxSendable,
    int decimals
) implements Currency {

}
