package uma.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionStatus {
    COMPLETED("COMPLETED"),
    FAILED("FAILED");

    private final String rawValue;

    TransactionStatus(String rawValue) {
        this.rawValue = rawValue;
    }

    @JsonValue
    public String rawValue() {
        return rawValue;
    }
}
