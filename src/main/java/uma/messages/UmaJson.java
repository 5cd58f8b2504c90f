package uma.messages;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * The mapper behind {@code toJson()} / {@code fromJson()} on protocol messages. Spring's own mapper is
 * configured to the same settings through {@code spring.jackson.*}.
 */
public final class UmaJson {

    public static final ObjectMapper MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .serializationInclusion(Include.NON_NULL)
        .findAndAddModules()
        .build();

    private UmaJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UmaException(ErrorCode.INTERNAL_ERROR, "Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @param parseErrorCode reported when the text is not valid JSON for the type
     * @throws UmaException with {@code parseErrorCode}, or the {@link UmaException} raised while building the value
     */
    public static <T> T read(String json, Class<T> type, ErrorCode parseErrorCode) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw parseFailure(e, type.getSimpleName(), parseErrorCode);
        }
    }

    public static <T> T read(String json, TypeReference<T> type, ErrorCode parseErrorCode) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw parseFailure(e, type.getType().getTypeName(), parseErrorCode);
        }
    }

    private static UmaException parseFailure(JsonProcessingException e, String typeName, ErrorCode parseErrorCode) {
        final UmaException cause = findUmaException(e);
        if (cause != null) {
            return cause;
        }
        return new UmaException(parseErrorCode, "Unable to parse %s: %s".formatted(typeName, e.getOriginalMessage()), e);
    }

    static UmaException findUmaException(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof UmaException umaException) {
                return umaException;
            }
        }
        return null;
    }
}
