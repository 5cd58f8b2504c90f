package uma.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonCreator.Mode;
import com.fasterxml.jackson.annotation.JsonValue;

public enum KycStatus {
    UNKNOWN("UNKNOWN"),
    NOT_VERIFIED("NOT_VERIFIED"),
    PENDING("PENDING"),
    VERIFIED("VERIFIED");

    private final String rawValue;

    KycStatus(String rawValue) {
        this.rawValue = rawValue;
    }

    @JsonValue
    public String rawValue() {
        return rawValue;
    }

    /**
     * Statuses this VASP does not know about are read as {@link #UNKNOWN}.
     */
    @JsonCreator(mode = Mode.DELEGATING)
    public static KycStatus fromRawValue(String rawValue) {
        for (KycStatus status : values()) {
            if (status.rawValue.equals(rawValue)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
