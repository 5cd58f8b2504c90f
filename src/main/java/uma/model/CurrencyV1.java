package uma.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@JsonDeserialize(using = JsonDeserializer.None.class)
public record CurrencyV1(
    String code,
    String name,
    String symbol,
    @JsonProperty("multiplier")
    double millisatoshiPerUnit,
    CurrencyConvertible convertible,
    int decimals
) implements Currency {

    @Override
    public long minSendable() {
        return convertible.min();
    }

    @Override
    public long maxSendable() {
        return convertible.max();
    }
}
