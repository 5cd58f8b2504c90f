package uma.model;

/**
 * @param utxo        channel UTXO in the form {@code txid:index}
 * @param amountMsats amount that moved through the UTXO
 */
public record UtxoWithAmount(
    String utxo,
    long amountMsats
) {

}
