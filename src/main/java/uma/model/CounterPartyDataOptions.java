package uma.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the {@code payerData}/{@code payeeData} option maps, keyed by the data field name.
 */
public final class CounterPartyDataOptions {

    private CounterPartyDataOptions() {
    }

    public static Map<String, CounterPartyDataOption> of(Map<String, Boolean> mandatoryByField) {
        final Map<String, CounterPartyDataOption> options = new LinkedHashMap<>();
        mandatoryByField.forEach((field, mandatory) -> options.put(field, new CounterPartyDataOption(mandatory)));
        return options;
    }
}
