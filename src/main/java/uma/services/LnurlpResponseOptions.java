package uma.services;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.model.CounterPartyDataOption;
import uma.model.Currency;
import uma.model.KycStatus;

/**
 * What the receiving VASP puts into its lnurlp response.
 *
 * @param signingPrivateKey     signs the compliance response
 * @param requiresTravelRuleInfo
 * @param callback              where the sender posts its pay request
 * @param encodedMetadata       LNURL metadata
 * @param minSendableSats
 * @param maxSendableSats
 * @param payerDataOptions      {@code identifier} and {@code compliance} are added as mandatory for UMA requests
 * @param currencyOptions       currencies the receiver can receive in
 * @param receiverKycStatus
 * @param commentCharsAllowed
 * @param nostrPubkey
 */
@Builder
public record LnurlpResponseOptions(
    byte[] signingPrivateKey,
    boolean requiresTravelRuleInfo,
    String callback,
    String encodedMetadata,
    long minSendableSats,
    long maxSendableSats,
    @Nullable
    Map<String, CounterPartyDataOption> payerDataOptions,
    @Nullable
    List<Currency> currencyOptions,
    @Nullable
    KycStatus receiverKycStatus,
    @Nullable
    Integer commentCharsAllowed,
    @Nullable
    String nostrPubkey
) {

    public LnurlpResponseOptions {
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(encodedMetadata, "encodedMetadata");
        payerDataOptions = payerDataOptions != null ? payerDataOptions : Map.of();
        currencyOptions = currencyOptions != null ? currencyOptions : List.of();
        receiverKycStatus = receiverKycStatus != null ? receiverKycStatus : KycStatus.UNKNOWN;
    }
}
