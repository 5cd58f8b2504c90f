package uma.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonCreator.Mode;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

/**
 * A standardized format of the encrypted travel rule information, sent as {@code type@version} or just
 * {@code type}.
 *
 * @param type    such as {@code IVMS}
 * @param version such as {@code 101.2023}
 */
public record TravelRuleFormat(
    String type,
    @Nullable
    String version
) {

    @JsonCreator(mode = Mode.DELEGATING)
    public static TravelRuleFormat parse(String value) {
        final int at = value.indexOf('@');
        if (at == -1) {
            return new TravelRuleFormat(value, null);
        }
        return new TravelRuleFormat(value.substring(0, at), value.substring(at + 1));
    }

    @JsonValue
    @Override
    public String toString() {
        return version != null ? type + "@" + version : type;
    }
}
