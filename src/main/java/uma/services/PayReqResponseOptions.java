package uma.services;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * What the receiving VASP puts into its pay response.
 *
 * @param metadata                  the metadata of the lnurlp response, the payer data gets appended to it
 * @param receivingCurrencyCode     null to receive millisatoshis
 * @param receivingCurrencyDecimals
 * @param conversionRate            millisatoshis per smallest unit of the receiving currency
 * @param receiverFeesMillisats     fees charged on top of the converted amount
 * @param receiverChannelUtxos
 * @param receiverNodePubKey
 * @param utxoCallback              where the sender posts its UTXOs once paid
 * @param payeeIdentifier           the receiver's UMA address
 * @param payeeName
 * @param payeeEmail
 * @param signingPrivateKey         signs the payee compliance data
 * @param successAction
 */
@Builder
public record PayReqResponseOptions(
    String metadata,
    @Nullable
    String receivingCurrencyCode,
    int receivingCurrencyDecimals,
    double conversionRate,
    long receiverFeesMillisats,
    @Nullable
    List<String> receiverChannelUtxos,
    @Nullable
    String receiverNodePubKey,
    @Nullable
    String utxoCallback,
    @Nullable
    String payeeIdentifier,
    @Nullable
    String payeeName,
    @Nullable
    String payeeEmail,
    @Nullable
    byte[] signingPrivateKey,
    @Nullable
    Map<String, String> successAction
) {

    public PayReqResponseOptions {
        Objects.requireNonNull(metadata, "metadata");
        receiverChannelUtxos = receiverChannelUtxos != null ? receiverChannelUtxos : List.of();
        utxoCallback = utxoCallback != null ? utxoCallback : "";
    }
}
