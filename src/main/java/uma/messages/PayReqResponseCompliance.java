package uma.messages;

import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Receiver compliance data of a version 0 pay response.
 *
 * @param utxos        UTXOs of channels over which the receiver will likely receive the payment
 * @param nodePubKey
 * @param utxoCallback where the sender posts its UTXOs once the payment completes
 */
public record PayReqResponseCompliance(
    List<String> utxos,
    @Nullable
    String nodePubKey,
    String utxoCallback
) {

    public PayReqResponseCompliance {
        utxos = utxos != null ? List.copyOf(utxos) : List.of();
    }
}
