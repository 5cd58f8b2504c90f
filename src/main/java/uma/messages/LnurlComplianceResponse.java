package uma.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.Builder;
import uma.model.KycStatus;

/**
 * Compliance part of a lnurlp response, signed by the receiving VASP.
 *
 * @param kycStatus             whether the receiving VASP holds KYC information about the receiver
 * @param isSubjectToTravelRule whether the receiving VASP needs travel rule information from the sender
 * @param receiverIdentifier
 * @param signature             over the lower-cased {@code receiverIdentifier|signatureNonce|signatureTimestamp}
 * @param signatureNonce
 * @param signatureTimestamp    unix seconds
 */
@Builder(toBuilder = true)
@JsonInclude(Include.NON_NULL)
public record LnurlComplianceResponse(
    KycStatus kycStatus,
    @JsonProperty("isSubjectToTravelRule")
    boolean isSubjectToTravelRule,
    String receiverIdentifier,
    String signature,
    String signatureNonce,
    long signatureTimestamp
) {

    public byte[] signablePayload() {
        return (receiverIdentifier + "|" + signatureNonce + "|" + signatureTimestamp)
            .toLowerCase(Locale.ROOT)
            .getBytes(StandardCharsets.UTF_8);
    }

    public LnurlComplianceResponse signedWith(String signature) {
        return toBuilder().signature(signature).build();
    }
}
