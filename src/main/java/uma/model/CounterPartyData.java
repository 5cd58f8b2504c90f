package uma.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.lang.Nullable;
import uma.messages.UmaJson;

/**
 * The open {@code payerData}/{@code payeeData} objects. The fields the protocol reserves are typed; anything
 * else a counterparty sends is kept as-is in {@link #extraFields()} so it survives a round trip.
 *
 * @param <C> the compliance data type stored under {@value #COMPLIANCE}
 */
@EqualsAndHashCode
@ToString
public abstract class CounterPartyData<C> {

    public static final String IDENTIFIER = "identifier";
    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String COMPLIANCE = "compliance";

    private static final Set<String> RESERVED = Set.of(IDENTIFIER, NAME, EMAIL, COMPLIANCE);

    private final String identifier;
    private final String name;
    private final String email;
    private final C compliance;
    private final Map<String, JsonNode> extraFields;

    protected CounterPartyData(@Nullable String identifier, @Nullable String name, @Nullable String email,
        @Nullable C compliance, @Nullable Map<String, JsonNode> extraFields
    ) {
        this.identifier = identifier;
        this.name = name;
        this.email = email;
        this.compliance = compliance;
        this.extraFields = extraFields != null ? Map.copyOf(extraFields) : Map.of();
    }

    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<String> email() {
        return Optional.ofNullable(email);
    }

    public Optional<C> compliance() {
        return Optional.ofNullable(compliance);
    }

    public Map<String, JsonNode> extraFields() {
        return extraFields;
    }

    @JsonValue
    public Map<String, Object> toJsonMap() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        if (identifier != null) {
            fields.put(IDENTIFIER, identifier);
        }
        if (name != null) {
            fields.put(NAME, name);
        }
        if (email != null) {
            fields.put(EMAIL, email);
        }
        if (compliance != null) {
            fields.put(COMPLIANCE, compliance);
        }
        fields.putAll(extraFields);
        return fields;
    }

    protected static String textField(ObjectNode node, String key) {
        final JsonNode value = node.get(key);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    protected static <T> T objectField(ObjectNode node, String key, Class<T> type) {
        final JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return UmaJson.MAPPER.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed %s field: %s".formatted(key, e.getOriginalMessage()), e);
        }
    }

    protected static Map<String, JsonNode> unreservedFields(ObjectNode node) {
        final Map<String, JsonNode> extra = new LinkedHashMap<>();
        for (Iterator<Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            final Entry<String, JsonNode> field = it.next();
            if (!RESERVED.contains(field.getKey())) {
                extra.put(field.getKey(), field.getValue());
            }
        }
        return extra;
    }
}
