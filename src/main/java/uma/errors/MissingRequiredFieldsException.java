package uma.errors;

import java.util.List;
import java.util.Map;

/**
 * A message could not be narrowed to its strict form because some protocol fields were absent.
 */
public class MissingRequiredFieldsException extends UmaException {

    private final List<String> missingFields;

    public MissingRequiredFieldsException(ErrorCode errorCode, String subject, List<String> missingFields) {
        super(errorCode, "%s is missing required fields: %s".formatted(subject, missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public MissingRequiredFieldsException(String subject, List<String> missingFields) {
        this(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS, subject, missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    @Override
    public Map<String, Object> getAdditionalParams() {
        return Map.of("missingFields", missingFields);
    }
}
