package uma.errors;

/**
 * A replay check rejected a signed message before its signature was looked at.
 */
public class InvalidNonceException extends UmaException {

    public enum Reason {
        TIMESTAMP_TOO_OLD("Timestamp too old", ErrorCode.INVALID_TIMESTAMP),
        NONCE_ALREADY_USED("Nonce already used", ErrorCode.INVALID_NONCE);

        private final String message;
        private final ErrorCode errorCode;

        Reason(String message, ErrorCode errorCode) {
            this.message = message;
            this.errorCode = errorCode;
        }
    }

    private final Reason rejection;
    private final String nonce;

    public InvalidNonceException(Reason rejection, String nonce) {
        super(rejection.errorCode, rejection.message);
        this.rejection = rejection;
        this.nonce = nonce;
    }

    public Reason getRejection() {
        return rejection;
    }

    public String getNonce() {
        return nonce;
    }
}
