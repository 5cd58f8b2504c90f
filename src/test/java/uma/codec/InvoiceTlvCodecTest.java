package uma.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;
import uma.errors.MalformedInvoiceException;
import uma.errors.MalformedInvoiceException.Kind;
import uma.model.CounterPartyDataOption;
import uma.model.Invoice;
import uma.model.InvoiceCurrency;
import uma.model.KycStatus;

class InvoiceTlvCodecTest {

    static Invoice sampleInvoice() {
        return Invoice.builder()
            .receiverUma("$foo@bar.com")
            .invoiceUUID("c7c07fec-cf00-431c-916f-6c13fc4b69f9")
            .amount(1000)
            .receivingCurrency(InvoiceCurrency.builder()
                .code("USD")
                .name("US Dollar")
                .symbol("$")
                .decimals(2)
                .build())
            .expiration(1000000)
            .isSubjectToTravelRule(true)
            .requiredPayerData(Map.of(
                "name", new CounterPartyDataOption(false),
                "email", new CounterPartyDataOption(false),
                "compliance", new CounterPartyDataOption(true)))
            .umaVersion("0.3")
            .commentCharsAllowed(18)
            .senderUma("$foo@bar.com")
            .invoiceLimit(100)
            .kycStatus(KycStatus.VERIFIED)
            .callback("https://example.com/callback")
            .signature("signature".getBytes())
            .build();
    }

    @Test
    void decodesWhatItEncodes() {
        final Invoice invoice = sampleInvoice();

        assertThat(InvoiceTlvCodec.fromBech32(InvoiceTlvCodec.toBech32(invoice))).isEqualTo(invoice);
    }

    @Test
    void payerDataOptionsAreSortedByKey() {
        final byte[] tlv = InvoiceTlvCodec.encode(sampleInvoice());

        final TlvRecord options = TlvReader.read(tlv).stream()
            .filter(r -> r.tag() == InvoiceTlvCodec.TAG_REQUIRED_PAYER_DATA)
            .findFirst()
            .orElseThrow();
        assertThat(options.asString()).isEqualTo("compliance:1,email:0,name:0");
    }

    @Test
    void fieldsInAnyOrderAndUnknownTagsAreAccepted() {
        final byte[] currency = new TlvWriter()
            .putNumber(InvoiceTlvCodec.TAG_CURRENCY_DECIMALS, 8)
            .putString(InvoiceTlvCodec.TAG_CURRENCY_CODE, "SAT")
            .putString(InvoiceTlvCodec.TAG_CURRENCY_SYMBOL, "")
            .putString(InvoiceTlvCodec.TAG_CURRENCY_NAME, "Satoshi")
            .toByteArray();
        final byte[] tlv = new TlvWriter()
            .putString(InvoiceTlvCodec.TAG_CALLBACK, "https://vasp2.com/cb")
            .putString(55, "from the future")
            .putBoolean(InvoiceTlvCodec.TAG_IS_SUBJECT_TO_TRAVEL_RULE, false)
            .putString(InvoiceTlvCodec.TAG_UMA_VERSION, "1.0")
            .putNumber(InvoiceTlvCodec.TAG_EXPIRATION, 1_700_000_000L)
            .putBytes(InvoiceTlvCodec.TAG_RECEIVING_CURRENCY, currency)
            .putNumber(InvoiceTlvCodec.TAG_AMOUNT, 42)
            .putString(InvoiceTlvCodec.TAG_INVOICE_UUID, "uuid")
            .putString(InvoiceTlvCodec.TAG_RECEIVER_UMA, "$bob@vasp2.com")
            .toByteArray();

        final Invoice invoice = InvoiceTlvCodec.decode(tlv);

        assertThat(invoice.receiverUma()).isEqualTo("$bob@vasp2.com");
        assertThat(invoice.amount()).isEqualTo(42);
        assertThat(invoice.expiration()).isEqualTo(1_700_000_000L);
        assertThat(invoice.receivingCurrency().code()).isEqualTo("SAT");
        assertThat(invoice.receivingCurrency().decimals()).isEqualTo(8);
        assertThat(invoice.senderUma()).isNull();
        assertThat(invoice.signature()).isNull();
    }

    @Test
    void malformedPayerDataOptionsAreSkipped() {
        final byte[] currency = new TlvWriter()
            .putString(InvoiceTlvCodec.TAG_CURRENCY_CODE, "SAT")
            .putString(InvoiceTlvCodec.TAG_CURRENCY_NAME, "Satoshi")
            .putString(InvoiceTlvCodec.TAG_CURRENCY_SYMBOL, "")
            .putNumber(InvoiceTlvCodec.TAG_CURRENCY_DECIMALS, 0)
            .toByteArray();
        final byte[] tlv = new TlvWriter()
            .putString(InvoiceTlvCodec.TAG_RECEIVER_UMA, "$bob@vasp2.com")
            .putString(InvoiceTlvCodec.TAG_INVOICE_UUID, "uuid")
            .putNumber(InvoiceTlvCodec.TAG_AMOUNT, 42)
            .putBytes(InvoiceTlvCodec.TAG_RECEIVING_CURRENCY, currency)
            .putNumber(InvoiceTlvCodec.TAG_EXPIRATION, 1_700_000_000L)
            .putBoolean(InvoiceTlvCodec.TAG_IS_SUBJECT_TO_TRAVEL_RULE, false)
            .putString(InvoiceTlvCodec.TAG_REQUIRED_PAYER_DATA, "name:1,garbage,email:0:extra,compliance:")
            .putString(InvoiceTlvCodec.TAG_UMA_VERSION, "1.0")
            .putString(InvoiceTlvCodec.TAG_CALLBACK, "https://vasp2.com/cb")
            .toByteArray();

        final Invoice invoice = InvoiceTlvCodec.decode(tlv);

        assertThat(invoice.requiredPayerData()).containsOnly(
            Map.entry("name", new CounterPartyDataOption(true)),
            Map.entry("compliance", new CounterPartyDataOption(false)));
    }

    @Test
    void missingFieldsAreAllReported() {
        final byte[] tlv = new TlvWriter()
            .putString(InvoiceTlvCodec.TAG_RECEIVER_UMA, "$bob@vasp2.com")
            .putNumber(InvoiceTlvCodec.TAG_AMOUNT, 42)
            .toByteArray();

        assertThatThrownBy(() -> InvoiceTlvCodec.decode(tlv))
            .isInstanceOfSatisfying(MalformedInvoiceException.class, e -> {
                assertThat(e.getKind()).isEqualTo(Kind.MISSING_FIELDS);
                assertThat(e.getMissingFields()).containsExactly(
                    "invoiceUUID", "receivingCurrency", "expiration", "isSubjectToTravelRule", "umaVersion",
                    "callback");
            });
    }

    @Test
    void wrongPrefixIsInvalidToken() {
        final String token = Bech32.encode("lnurl", InvoiceTlvCodec.encode(sampleInvoice()));

        assertThatThrownBy(() -> InvoiceTlvCodec.fromBech32(token))
            .isInstanceOfSatisfying(MalformedInvoiceException.class,
                e -> assertThat(e.getKind()).isEqualTo(Kind.INVALID_TOKEN));
    }

    @Test
    void notBech32IsInvalidToken() {
        assertThatThrownBy(() -> InvoiceTlvCodec.fromBech32("not an invoice"))
            .isInstanceOfSatisfying(MalformedInvoiceException.class,
                e -> assertThat(e.getKind()).isEqualTo(Kind.INVALID_TOKEN));
    }
}
