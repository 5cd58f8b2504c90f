package uma.errors;

import java.util.List;

/**
 * An invoice token or its TLV content could not be turned into an invoice. {@link #getKind()} tells a
 * transcription error apart from a malformed payload or an incomplete one.
 */
public class MalformedInvoiceException extends UmaException {

    public enum Kind {
        /**
         * Not a bech32 string at all: no separator, characters outside the alphabet, mixed case, wrong prefix
         */
        INVALID_TOKEN,
        CHECKSUM_MISMATCH,
        MALFORMED_TLV,
        MISSING_FIELDS
    }

    private final Kind kind;
    private final List<String> missingFields;

    public MalformedInvoiceException(Kind kind, String reason) {
        this(kind, reason, List.of(), null);
    }

    public MalformedInvoiceException(Kind kind, String reason, Throwable cause) {
        this(kind, reason, List.of(), cause);
    }

    private MalformedInvoiceException(Kind kind, String reason, List<String> missingFields, Throwable cause) {
        super(ErrorCode.INVALID_INVOICE, reason, cause);
        this.kind = kind;
        this.missingFields = List.copyOf(missingFields);
    }

    public static MalformedInvoiceException missingFields(List<String> missingFields) {
        return new MalformedInvoiceException(
            Kind.MISSING_FIELDS, "missing required fields: " + missingFields, missingFields, null);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
