package uma.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * A currency the receiver can convert into. Protocol major 1 nests the sendable bounds under
 * {@code convertible}; major 0 sends them flat as {@code minSendable}/{@code maxSendable}.
 */
@JsonDeserialize(using = Currency.Deserializer.class)
public sealed interface Currency permits CurrencyV0, CurrencyV1 {

    String code();

    String name();

    String symbol();

    /**
     * Estimated millisatoshis per smallest unit of this currency, such as one cent for USD.
     */
    double millisatoshiPerUnit();

    /**
     * Digits after the decimal point, which also tells what the smallest unit is.
     */
    int decimals();

    long minSendable();

    long maxSendable();

    /**
     * Picks the layout that the given protocol version expects.
     */
    static Currency create(String code, String name, String symbol, double millisatoshiPerUnit, int decimals,
        long minSendable, long maxSendable, String umaVersion
    ) {
        if (Version.parse(umaVersion).major() < 1) {
            return new CurrencyV0(code, name, symbol, millisatoshiPerUnit, minSendable, maxSendable, decimals);
        }
        return new CurrencyV1(code, name, symbol, millisatoshiPerUnit,
            new CurrencyConvertible(minSendable, maxSendable), decimals);
    }

    class Deserializer extends StdDeserializer<Currency> {

        public Deserializer() {
            super(Currency.class);
        }

        @Override
        public Currency deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            final JsonNode node = ctxt.readTree(p);
            return node.has("minSendable")
                ? ctxt.readTreeAsValue(node, CurrencyV0.class)
                : ctxt.readTreeAsValue(node, CurrencyV1.class);
        }
    }
}
