package uma.codec;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import uma.codec.Bech32.ChecksumMismatchException;
import uma.errors.MalformedInvoiceException;
import uma.errors.MalformedInvoiceException.Kind;
import uma.model.CounterPartyDataOption;
import uma.model.Invoice;
import uma.model.Invoice.InvoiceBuilder;
import uma.model.InvoiceCurrency;
import uma.model.KycStatus;

/**
 * Binary TLV layout of {@link Invoice} and its bech32 text form.
 */
@Slf4j
public final class InvoiceTlvCodec {

    public static final String BECH32_PREFIX = "uma";

    static final int TAG_RECEIVER_UMA = 0;
    static final int TAG_INVOICE_UUID = 1;
    static final int TAG_AMOUNT = 2;
    static final int TAG_RECEIVING_CURRENCY = 3;
    static final int TAG_EXPIRATION = 4;
    static final int TAG_IS_SUBJECT_TO_TRAVEL_RULE = 5;
    static final int TAG_REQUIRED_PAYER_DATA = 6;
    static final int TAG_UMA_VERSION = 7;
    static final int TAG_COMMENT_CHARS_ALLOWED = 8;
    static final int TAG_SENDER_UMA = 9;
    static final int TAG_INVOICE_LIMIT = 10;
    static final int TAG_KYC_STATUS = 11;
    static final int TAG_CALLBACK = 12;
    static final int TAG_SIGNATURE = 100;

    static final int TAG_CURRENCY_CODE = 0;
    static final int TAG_CURRENCY_NAME = 1;
    static final int TAG_CURRENCY_SYMBOL = 2;
    static final int TAG_CURRENCY_DECIMALS = 3;

    private InvoiceTlvCodec() {
    }

    public static byte[] encode(Invoice invoice) {
        return new TlvWriter()
            .putString(TAG_RECEIVER_UMA, invoice.receiverUma())
            .putString(TAG_INVOICE_UUID, invoice.invoiceUUID())
            .putNumber(TAG_AMOUNT, invoice.amount())
            .putBytes(TAG_RECEIVING_CURRENCY, encodeCurrency(invoice.receivingCurrency()))
            .putNumber(TAG_EXPIRATION, invoice.expiration())
            .putBoolean(TAG_IS_SUBJECT_TO_TRAVEL_RULE, invoice.isSubjectToTravelRule())
            .putBytes(TAG_REQUIRED_PAYER_DATA, encodeOptions(invoice.requiredPayerData()))
            .putString(TAG_UMA_VERSION, invoice.umaVersion())
            .putNumber(TAG_COMMENT_CHARS_ALLOWED, invoice.commentCharsAllowed())
            .putString(TAG_SENDER_UMA, invoice.senderUma())
            .putNumber(TAG_INVOICE_LIMIT, invoice.invoiceLimit())
            .putString(TAG_KYC_STATUS, invoice.kycStatus() != null ? invoice.kycStatus().rawValue() : null)
            .putString(TAG_CALLBACK, invoice.callback())
            .putBytes(TAG_SIGNATURE, invoice.signature())
            .toByteArray();
    }

    /**
     * Fields may arrive in any order and unknown tags are skipped.
     */
    public static Invoice decode(byte[] tlv) {
        final InvoiceBuilder builder = Invoice.builder();
        for (TlvRecord record : TlvReader.read(tlv)) {
            switch (record.tag()) {
                case TAG_RECEIVER_UMA -> builder.receiverUma(record.asString());
                case TAG_INVOICE_UUID -> builder.invoiceUUID(record.asString());
                case TAG_AMOUNT -> builder.amount(record.asLong());
                case TAG_RECEIVING_CURRENCY -> builder.receivingCurrency(decodeCurrency(record.value()));
                case TAG_EXPIRATION -> builder.expiration(record.asLong());
                case TAG_IS_SUBJECT_TO_TRAVEL_RULE -> builder.isSubjectToTravelRule(record.asBoolean());
                case TAG_REQUIRED_PAYER_DATA -> builder.requiredPayerData(decodeOptions(record.asString()));
                case TAG_UMA_VERSION -> builder.umaVersion(record.asString());
                case TAG_COMMENT_CHARS_ALLOWED -> builder.commentCharsAllowed(record.asInt());
                case TAG_SENDER_UMA -> builder.senderUma(record.asString());
                case TAG_INVOICE_LIMIT -> builder.invoiceLimit(record.asInt());
                case TAG_KYC_STATUS -> builder.kycStatus(KycStatus.fromRawValue(record.asString()));
                case TAG_CALLBACK -> builder.callback(record.asString());
                case TAG_SIGNATURE -> builder.signature(record.value());
                default -> log.debug("Skipping unknown invoice tag={}", record.tag());
            }
        }
        return builder.build();
    }

    public static String toBech32(Invoice invoice) {
        return Bech32.encode(BECH32_PREFIX, encode(invoice));
    }

    public static Invoice fromBech32(String token) {
        final Bech32.Decoded decoded;
        try {
            decoded = Bech32.decode(token);
        } catch (ChecksumMismatchException e) {
            throw new MalformedInvoiceException(Kind.CHECKSUM_MISMATCH, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedInvoiceException(Kind.INVALID_TOKEN, e.getMessage(), e);
        }
        if (!BECH32_PREFIX.equals(decoded.hrp())) {
            throw new MalformedInvoiceException(Kind.INVALID_TOKEN,
                "Expected prefix %s but was %s".formatted(BECH32_PREFIX, decoded.hrp()));
        }
        return decode(decoded.data());
    }

    private static byte[] encodeCurrency(InvoiceCurrency currency) {
        return new TlvWriter()
            .putString(TAG_CURRENCY_CODE, currency.code())
            .putString(TAG_CURRENCY_NAME, currency.name())
            .putString(TAG_CURRENCY_SYMBOL, currency.symbol())
            .putNumber(TAG_CURRENCY_DECIMALS, currency.decimals())
            .toByteArray();
    }

    private static InvoiceCurrency decodeCurrency(byte[] tlv) {
        final InvoiceCurrency.InvoiceCurrencyBuilder builder = InvoiceCurrency.builder();
        boolean hasCode = false;
        boolean hasDecimals = false;
        for (TlvRecord record : TlvReader.read(tlv)) {
            switch (record.tag()) {
                case TAG_CURRENCY_CODE -> {
                    builder.code(record.asString());
                    hasCode = true;
                }
                case TAG_CURRENCY_NAME -> builder.name(record.asString());
                case TAG_CURRENCY_SYMBOL -> builder.symbol(record.asString());
                case TAG_CURRENCY_DECIMALS -> {
                    builder.decimals(record.asInt());
                    hasDecimals = true;
                }
                default -> log.debug("Skipping unknown currency tag={}", record.tag());
            }
        }
        if (!hasCode || !hasDecimals) {
            throw MalformedInvoiceException.missingFields(
                hasCode ? List.of("receivingCurrency.decimals")
                    : hasDecimals ? List.of("receivingCurrency.code")
                        : List.of("receivingCurrency.code", "receivingCurrency.decimals"));
        }
        return builder.build();
    }

    private static byte[] encodeOptions(Map<String, CounterPartyDataOption> options) {
        if (options == null) {
            return null;
        }
        return new TreeMap<>(options).entrySet().stream()
            .map(entry -> entry.getKey() + ":" + (entry.getValue().mandatory() ? "1" : "0"))
            .collect(Collectors.joining(","))
            .getBytes(StandardCharsets.UTF_8);
    }

    private static Map<String, CounterPartyDataOption> decodeOptions(String encoded) {
        final Map<String, CounterPartyDataOption> options = new LinkedHashMap<>();
        if (encoded.isEmpty()) {
            return options;
        }
        for (String entry : encoded.split(",")) {
            final String[] parts = entry.split(":", -1);
            if (parts.length != 2) {
                log.debug("Skipping malformed payer data option entry={}", entry);
                continue;
            }
            options.put(parts[0], new CounterPartyDataOption("1".equals(parts[1])));
        }
        return options;
    }
}
