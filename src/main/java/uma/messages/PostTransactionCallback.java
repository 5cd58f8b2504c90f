package uma.messages;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.ArrayList;
import java.util.List;
import org.springframework.lang.Nullable;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.model.UtxoWithAmount;

/**
 * Sent by either VASP to the other's {@code utxoCallback} once a payment settles.
 *
 * @param utxos              UTXOs of the VASP sending the callback
 * @param vaspDomain         where the sending VASP publishes its keys
 * @param signature          over {@code signatureNonce|signatureTimestamp}
 * @param signatureNonce
 * @param signatureTimestamp unix seconds
 */
@JsonInclude(Include.NON_NULL)
public record PostTransactionCallback(
    List<UtxoWithAmount> utxos,
    @Nullable
    String vaspDomain,
    @Nullable
    String signature,
    @Nullable
    String signatureNonce,
    @Nullable
    Long signatureTimestamp
) {

    public PostTransactionCallback {
        utxos = utxos != null ? List.copyOf(utxos) : List.of();
    }

    @JsonIgnore
    public boolean isUmaCallback() {
        return missingUmaFields().isEmpty();
    }

    public UmaPostTransactionCallback toUmaCallback() {
        final List<String> missing = missingUmaFields();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Post transaction callback", missing);
        }
        return new UmaPostTransactionCallback(utxos, vaspDomain, signature, signatureNonce, signatureTimestamp);
    }

    private List<String> missingUmaFields() {
        final List<String> missing = new ArrayList<>();
        if (vaspDomain == null) {
            missing.add("vaspDomain");
        }
        if (signature == null) {
            missing.add("signature");
        }
        if (signatureNonce == null) {
            missing.add("signatureNonce");
        }
        if (signatureTimestamp == null) {
            missing.add("signatureTimestamp");
        }
        return missing;
    }

    public String toJson() {
        return UmaJson.write(this);
    }

    public static PostTransactionCallback fromJson(String json) {
        return UmaJson.read(json, PostTransactionCallback.class, ErrorCode.PARSE_UTXO_CALLBACK_ERROR);
    }
}
