package uma.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.model.BackingSignature;
import uma.model.CounterPartyDataOption;
import uma.model.Currency;

/**
 * The receiving VASP's answer to a lnurlp request. A plain LNURL response leaves every UMA field unset.
 *
 * @param callback          where the sender posts the pay request
 * @param minSendable       in millisatoshis
 * @param maxSendable       in millisatoshis
 * @param metadata          LNURL metadata, a JSON encoded string
 * @param currencies        currencies the receiver can receive in
 * @param requiredPayerData payer data the sender must or may provide
 * @param compliance
 * @param umaVersion        the version chosen for the rest of the exchange
 * @param commentAllowed    how long a comment the pay request may carry
 * @param nostrPubkey
 * @param allowsNostr
 * @param tag               always {@value #PAY_REQUEST_TAG}
 * @param backingSignatures
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
public record LnurlpResponse(
    String callback,
    long minSendable,
    long maxSendable,
    String metadata,
    @Nullable
    List<Currency> currencies,
    @JsonProperty("payerData")
    @Nullable
    Map<String, CounterPartyDataOption> requiredPayerData,
    @Nullable
    LnurlComplianceResponse compliance,
    @Nullable
    String umaVersion,
    @Nullable
    Integer commentAllowed,
    @Nullable
    String nostrPubkey,
    @Nullable
    Boolean allowsNostr,
    String tag,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public static final String PAY_REQUEST_TAG = "payRequest";

    public LnurlpResponse {
        tag = tag != null ? tag : PAY_REQUEST_TAG;
    }

    @JsonIgnore
    public boolean isUmaResponse() {
        return missingUmaFields().isEmpty();
    }

    /**
     * @throws MissingRequiredFieldsException naming each absent UMA field
     */
    public UmaLnurlpResponse toUmaResponse() {
        final List<String> missing = missingUmaFields();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Lnurlp response", missing);
        }
        return new UmaLnurlpResponse(callback, minSendable, maxSendable, metadata, currencies, requiredPayerData,
            compliance, umaVersion, commentAllowed, nostrPubkey, allowsNostr, backingSignatures);
    }

    private List<String> missingUmaFields() {
        final List<String> missing = new ArrayList<>();
        if (currencies == null) {
            missing.add("currencies");
        }
        if (requiredPayerData == null) {
            missing.add("payerData");
        }
        if (compliance == null) {
            missing.add("compliance");
        }
        if (umaVersion == null) {
            missing.add("umaVersion");
        }
        return missing;
    }

    public String toJson() {
        return UmaJson.write(this);
    }

    public static LnurlpResponse fromJson(String json) {
        return UmaJson.read(json, LnurlpResponse.class, ErrorCode.PARSE_LNURLP_RESPONSE_ERROR);
    }
}
