package uma.services;

import org.springframework.lang.Nullable;

/**
 * Creates the lightning invoice of a pay response, usually through the receiving VASP's node.
 */
@FunctionalInterface
public interface UmaInvoiceCreator {

    /**
     * @param metadata           to be hashed into the invoice description hash
     * @param receiverIdentifier the receiver's UMA address, when known
     * @return the encoded BOLT11 invoice
     */
    String createUmaInvoice(long amountMsats, String metadata, @Nullable String receiverIdentifier);
}
