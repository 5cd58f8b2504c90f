package uma.errors;

import org.springframework.http.HttpStatus;

/**
 * Protocol error codes exchanged between VASPs, each with the HTTP status a VASP responds with.
 */
public enum ErrorCode {
    COUNTERPARTY_PUBKEY_FETCH_ERROR(HttpStatus.FAILED_DEPENDENCY),
    INVALID_PUBKEY_FORMAT(HttpStatus.BAD_REQUEST),
    CERT_CHAIN_INVALID(HttpStatus.BAD_REQUEST),
    CERT_CHAIN_EXPIRED(HttpStatus.BAD_REQUEST),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED),
    INVALID_TIMESTAMP(HttpStatus.BAD_REQUEST),
    INVALID_NONCE(HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    NON_UMA_LNURL_NOT_SUPPORTED(HttpStatus.FORBIDDEN),
    MISSING_REQUIRED_UMA_PARAMETERS(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_UMA_VERSION(HttpStatus.PRECONDITION_FAILED),
    PARSE_LNURLP_REQUEST_ERROR(HttpStatus.BAD_REQUEST),
    VELOCITY_LIMIT_EXCEEDED(HttpStatus.FORBIDDEN),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND),
    USER_NOT_READY(HttpStatus.FORBIDDEN),
    REQUEST_NOT_FOUND(HttpStatus.NOT_FOUND),
    PARSE_PAYREQ_REQUEST_ERROR(HttpStatus.BAD_REQUEST),
    AMOUNT_OUT_OF_RANGE(HttpStatus.BAD_REQUEST),
    INVALID_CURRENCY(HttpStatus.BAD_REQUEST),
    SENDER_NOT_ACCEPTED(HttpStatus.BAD_REQUEST),
    MISSING_MANDATORY_PAYER_DATA(HttpStatus.BAD_REQUEST),
    UNRECOGNIZED_MANDATORY_PAYEE_DATA_KEY(HttpStatus.NOT_IMPLEMENTED),
    PARSE_UTXO_CALLBACK_ERROR(HttpStatus.BAD_REQUEST),
    COUNTERPARTY_NOT_ALLOWED(HttpStatus.FORBIDDEN),
    PARSE_LNURLP_RESPONSE_ERROR(HttpStatus.BAD_REQUEST),
    PARSE_PAYREQ_RESPONSE_ERROR(HttpStatus.BAD_REQUEST),
    LNURLP_REQUEST_FAILED(HttpStatus.FAILED_DEPENDENCY),
    PAYREQ_REQUEST_FAILED(HttpStatus.FAILED_DEPENDENCY),
    NO_COMPATIBLE_UMA_VERSION(HttpStatus.FAILED_DEPENDENCY),
    INVALID_INVOICE(HttpStatus.BAD_REQUEST),
    INVOICE_EXPIRED(HttpStatus.BAD_REQUEST),
    QUOTE_EXPIRED(HttpStatus.BAD_REQUEST),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST_FORMAT(HttpStatus.BAD_REQUEST),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_IMPLEMENTED(HttpStatus.NOT_IMPLEMENTED),
    QUOTE_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public int httpStatusCode() {
        return httpStatus.value();
    }
}
