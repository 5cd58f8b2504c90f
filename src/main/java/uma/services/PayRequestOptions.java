package uma.services;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import org.springframework.lang.Nullable;
import uma.model.CounterPartyDataOption;
import uma.model.KycStatus;
import uma.model.SettlementInfo;
import uma.model.TravelRuleFormat;

/**
 * What the sending VASP puts into its pay request.
 *
 * @param receiverEncryptionPubKey    travel rule info is encrypted to it
 * @param sendingVaspPrivateKey       signs the payer compliance data
 * @param receivingCurrencyCode
 * @param amount                      in the smallest unit of the receiving currency or in millisatoshis
 * @param isAmountInReceivingCurrency whether {@code amount} is in the receiving currency
 * @param payerIdentifier
 * @param payerKycStatus
 * @param utxoCallback                where the receiver posts its UTXOs once paid
 * @param travelRuleInfo              sent encrypted, null when not subject to the travel rule
 * @param payerUtxos
 * @param payerNodePubKey
 * @param payerName
 * @param payerEmail
 * @param travelRuleFormat
 * @param requestedPayeeData
 * @param comment
 * @param receiverUmaVersion          version agreed in the lnurlp exchange, selects the request layout
 * @param invoiceUUID
 * @param settlementInfo
 */
@Builder
public record PayRequestOptions(
    byte[] receiverEncryptionPubKey,
    byte[] sendingVaspPrivateKey,
    String receivingCurrencyCode,
    long amount,
    boolean isAmountInReceivingCurrency,
    String payerIdentifier,
    @Nullable
    KycStatus payerKycStatus,
    @Nullable
    String utxoCallback,
    @Nullable
    String travelRuleInfo,
    @Nullable
    List<String> payerUtxos,
    @Nullable
    String payerNodePubKey,
    @Nullable
    String payerName,
    @Nullable
    String payerEmail,
    @Nullable
    TravelRuleFormat travelRuleFormat,
    @Nullable
    Map<String, CounterPartyDataOption> requestedPayeeData,
    @Nullable
    String comment,
    @Nullable
    String receiverUmaVersion,
    @Nullable
    String invoiceUUID,
    @Nullable
    SettlementInfo settlementInfo
) {

    public PayRequestOptions {
        Objects.requireNonNull(receiverEncryptionPubKey, "receiverEncryptionPubKey");
        Objects.requireNonNull(sendingVaspPrivateKey, "sendingVaspPrivateKey");
        Objects.requireNonNull(receivingCurrencyCode, "receivingCurrencyCode");
        Objects.requireNonNull(payerIdentifier, "payerIdentifier");
        payerKycStatus = payerKycStatus != null ? payerKycStatus : KycStatus.UNKNOWN;
        utxoCallback = utxoCallback != null ? utxoCallback : "";
        payerUtxos = payerUtxos != null ? payerUtxos : List.of();
        receiverUmaVersion = receiverUmaVersion != null ? receiverUmaVersion : VersionNegotiator.UMA_VERSION_STRING;
    }
}
