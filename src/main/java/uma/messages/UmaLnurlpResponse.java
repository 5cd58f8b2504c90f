package uma.messages;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.lang.Nullable;
import uma.crypto.PayloadSigner;
import uma.model.BackingSignature;
import uma.model.CounterPartyDataOption;
import uma.model.Currency;

/**
 * A lnurlp response that carries every UMA field. Its signature lives in {@link #compliance()}.
 */
public record UmaLnurlpResponse(
    String callback,
    long minSendable,
    long maxSendable,
    String metadata,
    List<Currency> currencies,
    Map<String, CounterPartyDataOption> requiredPayerData,
    LnurlComplianceResponse compliance,
    String umaVersion,
    @Nullable
    Integer commentAllowed,
    @Nullable
    String nostrPubkey,
    @Nullable
    Boolean allowsNostr,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public UmaLnurlpResponse {
        Objects.requireNonNull(currencies, "currencies");
        Objects.requireNonNull(requiredPayerData, "requiredPayerData");
        Objects.requireNonNull(compliance, "compliance");
        Objects.requireNonNull(umaVersion, "umaVersion");
        currencies = List.copyOf(currencies);
        requiredPayerData = Map.copyOf(requiredPayerData);
        backingSignatures = backingSignatures != null ? List.copyOf(backingSignatures) : null;
    }

    public LnurlpResponse toLnurlpResponse() {
        return new LnurlpResponse(callback, minSendable, maxSendable, metadata, currencies, requiredPayerData,
            compliance, umaVersion, commentAllowed, nostrPubkey, allowsNostr, LnurlpResponse.PAY_REQUEST_TAG,
            backingSignatures);
    }

    public byte[] signablePayload() {
        return compliance.signablePayload();
    }

    public UmaLnurlpResponse appendBackingSignature(byte[] signingPrivateKey, String domain) {
        final List<BackingSignature> appended = new ArrayList<>();
        if (backingSignatures != null) {
            appended.addAll(backingSignatures);
        }
        appended.add(new BackingSignature(domain, PayloadSigner.sign(signablePayload(), signingPrivateKey)));
        return new UmaLnurlpResponse(callback, minSendable, maxSendable, metadata, currencies, requiredPayerData,
            compliance, umaVersion, commentAllowed, nostrPubkey, allowsNostr, appended);
    }

    public String toJson() {
        return toLnurlpResponse().toJson();
    }
}
