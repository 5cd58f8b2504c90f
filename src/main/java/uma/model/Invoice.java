package uma.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.lang.Nullable;
import uma.codec.InvoiceTlvCodec;
import uma.errors.MalformedInvoiceException;

/**
 * An UMA invoice, exchanged as a bech32 token with the {@value InvoiceTlvCodec#BECH32_PREFIX} prefix.
 * Build through {@link #builder()}, which reports every missing required field at once.
 *
 * @param receiverUma           such as {@code $bob@vasp2.com}
 * @param invoiceUUID           identifies the invoice and proves payment
 * @param amount                in the smallest unit of the receiving currency
 * @param receivingCurrency
 * @param expiration            unix seconds
 * @param isSubjectToTravelRule
 * @param requiredPayerData     payer data the sender must provide
 * @param umaVersion            lowest minor of each supported major, comma separated
 * @param commentCharsAllowed
 * @param senderUma             when present, the invoice goes straight to the sending VASP
 * @param invoiceLimit          how many times the invoice can be paid
 * @param kycStatus
 * @param callback              where the sender posts the pay request
 * @param signature             receiver's signature over the TLV encoding without this field
 */
public record Invoice(
    String receiverUma,
    String invoiceUUID,
    long amount,
    InvoiceCurrency receivingCurrency,
    long expiration,
    boolean isSubjectToTravelRule,
    @Nullable
    Map<String, CounterPartyDataOption> requiredPayerData,
    String umaVersion,
    @Nullable
    Integer commentCharsAllowed,
    @Nullable
    String senderUma,
    @Nullable
    Integer invoiceLimit,
    @Nullable
    KycStatus kycStatus,
    String callback,
    @Nullable
    byte[] signature
) {

    public Invoice {
        Objects.requireNonNull(receiverUma, "receiverUma");
        Objects.requireNonNull(invoiceUUID, "invoiceUUID");
        Objects.requireNonNull(receivingCurrency, "receivingCurrency");
        Objects.requireNonNull(umaVersion, "umaVersion");
        Objects.requireNonNull(callback, "callback");
        requiredPayerData = requiredPayerData != null ? Map.copyOf(requiredPayerData) : null;
        signature = signature != null ? signature.clone() : null;
    }

    public static InvoiceBuilder builder() {
        return new InvoiceBuilder();
    }

    public InvoiceBuilder toBuilder() {
        return new InvoiceBuilder()
            .receiverUma(receiverUma)
            .invoiceUUID(invoiceUUID)
            .amount(amount)
            .receivingCurrency(receivingCurrency)
            .expiration(expiration)
            .isSubjectToTravelRule(isSubjectToTravelRule)
            .requiredPayerData(requiredPayerData)
            .umaVersion(umaVersion)
            .commentCharsAllowed(commentCharsAllowed)
            .senderUma(senderUma)
            .invoiceLimit(invoiceLimit)
            .kycStatus(kycStatus)
            .callback(callback)
            .signature(signature);
    }

    @Override
    public byte[] signature() {
        return signature != null ? signature.clone() : null;
    }

    public Invoice withSignature(byte[] signature) {
        return toBuilder().signature(signature).build();
    }

    public byte[] toTlv() {
        return InvoiceTlvCodec.encode(this);
    }

    /**
     * The bytes the receiver signs: the TLV encoding with the signature left out.
     */
    public byte[] signablePayload() {
        return toBuilder().signature(null).build().toTlv();
    }

    public String toBech32() {
        return InvoiceTlvCodec.toBech32(this);
    }

    public static Invoice fromTlv(byte[] tlv) {
        return InvoiceTlvCodec.decode(tlv);
    }

    /**
     * @throws MalformedInvoiceException telling a bad checksum apart from bad content and missing fields
     */
    public static Invoice fromBech32(String token) {
        return InvoiceTlvCodec.fromBech32(token);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Invoice other)) {
            return false;
        }
        return amount == other.amount
            && expiration == other.expiration
            && isSubjectToTravelRule == other.isSubjectToTravelRule
            && receiverUma.equals(other.receiverUma)
            && invoiceUUID.equals(other.invoiceUUID)
            && receivingCurrency.equals(other.receivingCurrency)
            && Objects.equals(requiredPayerData, other.requiredPayerData)
            && umaVersion.equals(other.umaVersion)
            && Objects.equals(commentCharsAllowed, other.commentCharsAllowed)
            && Objects.equals(senderUma, other.senderUma)
            && Objects.equals(invoiceLimit, other.invoiceLimit)
            && kycStatus == other.kycStatus
            && callback.equals(other.callback)
            && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(receiverUma, invoiceUUID, amount, receivingCurrency, expiration,
            isSubjectToTravelRule, requiredPayerData, umaVersion, commentCharsAllowed, senderUma, invoiceLimit,
            kycStatus, callback);
        return 31 * result + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "Invoice[receiverUma=%s, invoiceUUID=%s, amount=%d, receivingCurrency=%s, expiration=%d, umaVersion=%s, signed=%s]"
            .formatted(receiverUma, invoiceUUID, amount, receivingCurrency, expiration, umaVersion, signature != null);
    }

    /**
     * Collects fields in any order, as the TLV decoder meets them, and validates presence once in
     * {@link #build()}.
     */
    public static final class InvoiceBuilder {

        private String receiverUma;
        private String invoiceUUID;
        private Long amount;
        private InvoiceCurrency receivingCurrency;
        private Long expiration;
        private Boolean isSubjectToTravelRule;
        private Map<String, CounterPartyDataOption> requiredPayerData;
        private String umaVersion;
        private Integer commentCharsAllowed;
        private String senderUma;
        private Integer invoiceLimit;
        private KycStatus kycStatus;
        private String callback;
        private byte[] signature;

        private InvoiceBuilder() {
        }

        public InvoiceBuilder receiverUma(String receiverUma) {
            this.receiverUma = receiverUma;
            return this;
        }

        public InvoiceBuilder invoiceUUID(String invoiceUUID) {
            this.invoiceUUID = invoiceUUID;
            return this;
        }

        public InvoiceBuilder amount(long amount) {
            this.amount = amount;
            return this;
        }

        public InvoiceBuilder receivingCurrency(InvoiceCurrency receivingCurrency) {
            this.receivingCurrency = receivingCurrency;
            return this;
        }

        public InvoiceBuilder expiration(long expiration) {
            this.expiration = expiration;
            return this;
        }

        public InvoiceBuilder isSubjectToTravelRule(boolean isSubjectToTravelRule) {
            this.isSubjectToTravelRule = isSubjectToTravelRule;
            return this;
        }

        public InvoiceBuilder requiredPayerData(Map<String, CounterPartyDataOption> requiredPayerData) {
            this.requiredPayerData = requiredPayerData;
            return this;
        }

        public InvoiceBuilder umaVersion(String umaVersion) {
            this.umaVersion = umaVersion;
            return this;
        }

        public InvoiceBuilder commentCharsAllowed(Integer commentCharsAllowed) {
            this.commentCharsAllowed = commentCharsAllowed;
            return this;
        }

        public InvoiceBuilder senderUma(String senderUma) {
            this.senderUma = senderUma;
            return this;
        }

        public InvoiceBuilder invoiceLimit(Integer invoiceLimit) {
            this.invoiceLimit = invoiceLimit;
            return this;
        }

        public InvoiceBuilder kycStatus(KycStatus kycStatus) {
            this.kycStatus = kycStatus;
            return this;
        }

        public InvoiceBuilder callback(String callback) {
            this.callback = callback;
            return this;
        }

        public InvoiceBuilder signature(byte[] signature) {
            this.signature = signature;
            return this;
        }

        /**
         * @throws MalformedInvoiceException of kind {@link MalformedInvoiceException.Kind#MISSING_FIELDS}
         *                                   naming every absent required field
         */
        public Invoice build() {
            final List<String> missing = new ArrayList<>();
            if (receiverUma == null) {
                missing.add("receiverUma");
            }
            if (invoiceUUID == null) {
                missing.add("invoiceUUID");
            }
            if (amount == null) {
                missing.add("amount");
            }
            if (receivingCurrency == null) {
                missing.add("receivingCurrency");
            }
            if (expiration == null) {
                missing.add("expiration");
            }
            if (isSubjectToTravelRule == null) {
                missing.add("isSubjectToTravelRule");
            }
            if (umaVersion == null) {
                missing.add("umaVersion");
            }
            if (callback == null) {
                missing.add("callback");
            }
            if (!missing.isEmpty()) {
                throw MalformedInvoiceException.missingFields(missing);
            }
            return new Invoice(receiverUma, invoiceUUID, amount, receivingCurrency, expiration, isSubjectToTravelRule,
                requiredPayerData, umaVersion, commentCharsAllowed, senderUma, invoiceLimit, kycStatus, callback,
                signature);
        }
    }
}
