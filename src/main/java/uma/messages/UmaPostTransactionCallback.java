package uma.messages;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import uma.model.UtxoWithAmount;

public record UmaPostTransactionCallback(
    List<UtxoWithAmount> utxos,
    String vaspDomain,
    String signature,
    String signatureNonce,
    long signatureTimestamp
) {

    public UmaPostTransactionCallback {
        utxos = List.copyOf(utxos);
        Objects.requireNonNull(vaspDomain, "vaspDomain");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(signatureNonce, "signatureNonce");
    }

    public byte[] signablePayload() {
        return (signatureNonce + "|" + signatureTimestamp).getBytes(StandardCharsets.UTF_8);
    }

    public UmaPostTransactionCallback signedWith(String signature) {
        return new UmaPostTransactionCallback(utxos, vaspDomain, signature, signatureNonce, signatureTimestamp);
    }

    public PostTransactionCallback toPostTransactionCallback() {
        return new PostTransactionCallback(utxos, vaspDomain, signature, signatureNonce, signatureTimestamp);
    }

    public String toJson() {
        return toPostTransactionCallback().toJson();
    }
}
