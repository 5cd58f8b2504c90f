package uma.errors;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.json.JSONException;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONAssert;
import org.skyscreamer.jsonassert.JSONCompareMode;
import uma.errors.InvalidNonceException.Reason;

class UmaExceptionTest {

    @Test
    void errorBodyCarriesCode() throws JSONException {
        final UmaException e = new UmaException(ErrorCode.INVALID_SIGNATURE, "Bad signature");

        assertThat(e.toHttpStatusCode()).isEqualTo(401);
        JSONAssert.assertEquals("""
            {"status": "ERROR", "reason": "Bad signature", "code": "INVALID_SIGNATURE"}
            """, e.toJson(), JSONCompareMode.STRICT);
    }

    @Test
    void unsupportedVersionListsSupportedMajors() throws JSONException {
        final UnsupportedVersionException e = new UnsupportedVersionException("2.0", Set.of(1, 0));

        assertThat(e.toHttpStatusCode()).isEqualTo(412);
        JSONAssert.assertEquals("""
            {
                "status": "ERROR",
                "reason": "Unsupported version: 2.0. Supported major versions: [0, 1]",
                "code": "UNSUPPORTED_UMA_VERSION",
                "supportedMajorVersions": [0, 1],
                "unsupportedVersion": "2.0"
            }
            """, e.toJson(), JSONCompareMode.STRICT);
    }

    @Test
    void missingFieldsAreNamed() {
        final MissingRequiredFieldsException e = new MissingRequiredFieldsException("Pay request", List.of("amount"));

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS);
        assertThat(e.toErrorBody()).containsEntry("missingFields", List.of("amount"));
    }

    @Test
    void nonceRejectionsMapToTheirCodes() {
        assertThat(new InvalidNonceException(Reason.TIMESTAMP_TOO_OLD, "1").getErrorCode())
            .isEqualTo(ErrorCode.INVALID_TIMESTAMP);
        assertThat(new InvalidNonceException(Reason.NONCE_ALREADY_USED, "1").getErrorCode())
            .isEqualTo(ErrorCode.INVALID_NONCE);
    }
}
