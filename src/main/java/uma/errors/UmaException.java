package uma.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.ToString;
import uma.messages.UmaJson;

/**
 * Base of every protocol failure. Carries the {@link ErrorCode} that decides the HTTP status and the
 * {@code code} field of the error body, plus any structured detail a VASP needs to build the response.
 */
@ToString
public class UmaException extends RuntimeException {

    public static final String STATUS_ERROR = "ERROR";

    private final ErrorCode errorCode;

    public UmaException(ErrorCode errorCode, String reason) {
        super(reason);
        this.errorCode = errorCode;
    }

    public UmaException(ErrorCode errorCode, String reason, Throwable cause) {
        super(reason, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getReason() {
        return getMessage();
    }

    /**
     * Extra fields merged into the error body. Subclasses contribute their structured detail here.
     */
    public Map<String, Object> getAdditionalParams() {
        return Collections.emptyMap();
    }

    public Map<String, Object> toErrorBody() {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", STATUS_ERROR);
        body.put("reason", getReason());
        body.put("code", errorCode.name());
        body.putAll(getAdditionalParams());
        return body;
    }

    public String toJson() {
        return UmaJson.write(toErrorBody());
    }

    public int toHttpStatusCode() {
        return errorCode.httpStatusCode();
    }
}
