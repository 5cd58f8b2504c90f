package uma.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uma.crypto.PayloadSigner;
import uma.crypto.TestKeys;
import uma.crypto.TestKeys.KeyPair;
import uma.errors.ErrorCode;
import uma.errors.InvalidNonceException;
import uma.errors.UmaException;
import uma.errors.UnsupportedVersionException;
import uma.messages.LnurlpRequest;
import uma.messages.LnurlpResponse;
import uma.messages.PayReqResponse;
import uma.messages.PayReqResponseV0;
import uma.messages.PayReqResponseV1;
import uma.messages.PayRequest;
import uma.messages.PayRequestV0;
import uma.messages.PayRequestV1;
import uma.messages.PubKeyResponse;
import uma.messages.UmaLnurlpRequest;
import uma.messages.UmaLnurlpResponse;
import uma.messages.UmaPayReqResponse;
import uma.messages.UmaPayRequest;
import uma.messages.UmaPostTransactionCallback;
import uma.model.CounterPartyDataOption;
import uma.model.Currency;
import uma.model.Invoice;
import uma.model.InvoiceCurrency;
import uma.model.KycStatus;
import uma.model.UtxoWithAmount;

class UmaProtocolHelperTest {

    private static final long NOW = 1_700_000_000L;
    private static final long KEY_EXPIRATION = NOW + 3600;
    private static final String SENDER_DOMAIN = "vasp1.com";
    private static final String RECEIVER_DOMAIN = "vasp2.com";
    private static final String BACKER_DOMAIN = "backer.com";
    private static final String PAYER = "$alice@vasp1.com";
    private static final String RECEIVER = "$bob@vasp2.com";

    private final KeyPair senderKeys = TestKeys.generate();
    private final KeyPair receiverKeys = TestKeys.fixed();
    private final KeyPair backerKeys = TestKeys.generate();

    private final Map<String, String> pubKeyBodies = new HashMap<>();
    private final List<String> requestedUrls = new ArrayList<>();

    private UmaProtocolHelper helper;
    private NonceCache nonceCache;

    @BeforeEach
    void setUp() {
        pubKeyBodies.put("https://vasp1.com/.well-known/lnurlpubkey",
            PubKeyResponse.ofKeys(senderKeys.publicKey(), senderKeys.publicKey(), KEY_EXPIRATION).toJson());
        pubKeyBodies.put("https://vasp2.com/.well-known/lnurlpubkey",
            PubKeyResponse.ofCertificates(TestKeys.CERT_CHAIN, TestKeys.CERT_CHAIN, KEY_EXPIRATION).toJson());
        pubKeyBodies.put("https://backer.com/.well-known/lnurlpubkey",
            PubKeyResponse.ofKeys(backerKeys.publicKey(), backerKeys.publicKey(), KEY_EXPIRATION).toJson());

        final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        final UmaRequester requester = url -> {
            requestedUrls.add(url);
            final String body = pubKeyBodies.get(url);
            if (body == null) {
                throw new UmaException(ErrorCode.COUNTERPARTY_PUBKEY_FETCH_ERROR, "No keys at " + url);
            }
            return body;
        };
        helper = new UmaProtocolHelper(new InMemoryPublicKeyCache(clock, false), requester,
            new VersionNegotiator(List.of("0.3")), clock);
        nonceCache = new InMemoryNonceCache(NOW - 3600);
    }

    private LnurlpResponseOptions lnurlpResponseOptions() {
        return LnurlpResponseOptions.builder()
            .signingPrivateKey(receiverKeys.privateKey())
            .requiresTravelRuleInfo(true)
            .callback("https://vasp2.com/api/uma/payreq/bob")
            .encodedMetadata("[[\"text/plain\",\"Pay to $bob\"]]")
            .minSendableSats(1)
            .maxSendableSats(10_000_000)
            .payerDataOptions(Map.of("name", new CounterPartyDataOption(false)))
            .currencyOptions(List.of(Currency.create("USD", "US Dollar", "$", 34_150, 2, 1, 10_000_000, "1.0")))
            .receiverKycStatus(KycStatus.VERIFIED)
            .build();
    }

    private PayRequestOptions.PayRequestOptionsBuilder payRequestOptions() {
        return PayRequestOptions.builder()
            .receiverEncryptionPubKey(receiverKeys.publicKey())
            .sendingVaspPrivateKey(senderKeys.privateKey())
            .receivingCurrencyCode("USD")
            .amount(100)
            .isAmountInReceivingCurrency(true)
            .payerIdentifier(PAYER)
            .payerKycStatus(KycStatus.VERIFIED)
            .utxoCallback("https://vasp1.com/api/uma/utxoCallback")
            .travelRuleInfo("{\"name\":\"Alice\"}");
    }

    private PayReqResponseOptions payReqResponseOptions() {
        return PayReqResponseOptions.builder()
            .metadata("[[\"text/plain\",\"Pay to $bob\"]]")
            .receivingCurrencyCode("USD")
            .receivingCurrencyDecimals(2)
            .conversionRate(34_150)
            .receiverFeesMillisats(2_000)
            .receiverChannelUtxos(List.of("abcd:1"))
            .utxoCallback("https://vasp2.com/api/uma/utxoCallback")
            .payeeIdentifier(RECEIVER)
            .signingPrivateKey(receiverKeys.privateKey())
            .build();
    }

    @Test
    void lnurlpRequestIsVerifiedOnce() {
        final String url = helper.getSignedLnurlpRequestUrl(senderKeys.privateKey(), RECEIVER, SENDER_DOMAIN, true);

        assertThat(url).startsWith("https://vasp2.com/.well-known/lnurlp/$bob?");
        assertThat(helper.isUmaLnurlpQuery(url)).isTrue();
        final UmaLnurlpRequest request = helper.parseLnurlpRequest(url).toUmaRequest();
        assertThat(request.umaVersion()).isEqualTo("1.0");
        assertThat(request.timestamp()).isEqualTo(NOW);

        final PubKeyResponse senderPubKeys = helper.fetchPublicKeysForVasp(request.vaspDomain());
        assertThat(helper.verifyUmaLnurlpQuerySignature(request, senderPubKeys, nonceCache)).isTrue();
        assertThatThrownBy(() -> helper.verifyUmaLnurlpQuerySignature(request, senderPubKeys, nonceCache))
            .isInstanceOf(InvalidNonceException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_NONCE);
    }

    @Test
    void lnurlpRequestSignedByAnotherKeyFails() {
        final String url = helper.getSignedLnurlpRequestUrl(backerKeys.privateKey(), RECEIVER, SENDER_DOMAIN, false);
        final UmaLnurlpRequest request = helper.parseLnurlpRequest(url).toUmaRequest();

        assertThat(helper.verifyUmaLnurlpQuerySignature(request, helper.fetchPublicKeysForVasp(SENDER_DOMAIN),
            nonceCache)).isFalse();
    }

    @Test
    void staleLnurlpRequestIsRejectedBeforeVerifying() {
        final String url = helper.getSignedLnurlpRequestUrl(senderKeys.privateKey(), RECEIVER, SENDER_DOMAIN, true);
        final UmaLnurlpRequest request = helper.parseLnurlpRequest(url).toUmaRequest();

        assertThatThrownBy(() -> helper.verifyUmaLnurlpQuerySignature(request,
            helper.fetchPublicKeysForVasp(SENDER_DOMAIN), new InMemoryNonceCache(NOW + 1)))
            .isInstanceOf(InvalidNonceException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_TIMESTAMP);
    }

    @Test
    void unsupportedVersionIsStillUma() {
        final String url = helper.getSignedLnurlpRequestUrl(senderKeys.privateKey(), RECEIVER, SENDER_DOMAIN, true,
            "2.0");

        assertThat(helper.isUmaLnurlpQuery(url)).isTrue();
        assertThatThrownBy(() -> helper.parseLnurlpRequest(url))
            .isInstanceOf(UnsupportedVersionException.class);
    }

    @Test
    void plainLnurlQueryIsNotUma() {
        final String url = "https://vasp2.com/.well-known/lnurlp/bob";

        assertThat(helper.isUmaLnurlpQuery(url)).isFalse();
        assertThat(helper.isUmaLnurlpQuery("https://vasp2.com/not/lnurlp")).isFalse();

        final LnurlpResponse response = helper.getLnurlpResponse(helper.parseLnurlpRequest(url),
            lnurlpResponseOptions());
        assertThat(response.isUmaResponse()).isFalse();
        assertThat(response.minSendable()).isEqualTo(1_000);
        assertThat(response.compliance()).isNull();
    }

    @Test
    void lnurlpResponseIsSignedByReceiver() {
        final String url = helper.getSignedLnurlpRequestUrl(senderKeys.privateKey(), RECEIVER, SENDER_DOMAIN, true,
            "0.3");
        final LnurlpRequest request = helper.parseLnurlpRequest(url);

        final LnurlpResponse response = helper.getLnurlpResponse(request, lnurlpResponseOptions());

        assertThat(response.umaVersion()).isEqualTo("0.3");
        assertThat(response.maxSendable()).isEqualTo(10_000_000_000L);
        assertThat(response.requiredPayerData())
            .containsEntry("identifier", new CounterPartyDataOption(true))
            .containsEntry("compliance", new CounterPartyDataOption(true))
            .containsEntry("name", new CounterPartyDataOption(false));
        final UmaLnurlpResponse parsed = helper.parseAsLnurlpResponse(response.toJson()).toUmaResponse();
        assertThat(parsed.compliance().receiverIdentifier()).isEqualTo(RECEIVER);
        assertThat(parsed.compliance().isSubjectToTravelRule()).isTrue();
        assertThat(helper.verifyLnurlpResponseSignature(parsed, helper.fetchPublicKeysForVasp(RECEIVER_DOMAIN),
            nonceCache)).isTrue();
    }

    @Test
    void payRequestCarriesSignedComplianceAndEncryptedTravelRuleInfo() {
        final PayRequest request = helper.getPayRequest(payRequestOptions().build());

        assertThat(request).isInstanceOf(PayRequestV1.class);
        final UmaPayRequest parsed = helper.parseAsPayRequest(request.toJson()).toUmaPayRequest();
        assertThat(parsed.toPayRequest().sendingCurrencyCode()).isEqualTo("USD");
        assertThat(parsed.compliance().signatureTimestamp()).isEqualTo(NOW);
        assertThat(PayloadSigner.decrypt(parsed.compliance().encryptedTravelRuleInfo(), receiverKeys.privateKey()))
            .isEqualTo("{\"name\":\"Alice\"}");
        assertThat(helper.verifyPayReqSignature(parsed, helper.fetchPublicKeysForVasp(SENDER_DOMAIN), nonceCache))
            .isTrue();
    }

    @Test
    void payRequestForOldReceiverUsesOldLayout() {
        final PayRequest request = helper.getPayRequest(payRequestOptions().receiverUmaVersion("0.3").build());

        assertThat(request).isInstanceOf(PayRequestV0.class);
        final PayRequest parsed = helper.parseAsPayRequest(request.toJson());
        assertThat(parsed).isInstanceOf(PayRequestV0.class);
        assertThat(helper.verifyPayReqSignature(parsed.toUmaPayRequest(),
            helper.fetchPublicKeysForVasp(SENDER_DOMAIN), nonceCache)).isTrue();

        final PayReqResponse response = helper.getPayReqResponse(parsed, payReqResponseOptions(),
            (amountMsats, metadata, receiverIdentifier) -> "lnbc1");
        assertThat(response).isInstanceOf(PayReqResponseV0.class);
        final UmaPayReqResponse umaResponse = helper.parseAsPayReqResponse(response.toJson()).toUmaPayReqResponse();
        assertThat(helper.verifyPayReqResponseSignature(umaResponse, helper.fetchPublicKeysForVasp(RECEIVER_DOMAIN),
            PAYER, nonceCache)).isTrue();
    }

    @Test
    void payResponseConvertsReceivingCurrencyAmount() {
        final PayRequest request = helper.getPayRequest(payRequestOptions().build());
        final List<Long> invoicedAmounts = new ArrayList<>();
        final List<String> invoicedMetadata = new ArrayList<>();

        final PayReqResponse response = helper.getPayReqResponse(request, payReqResponseOptions(),
            (amountMsats, metadata, receiverIdentifier) -> {
                invoicedAmounts.add(amountMsats);
                invoicedMetadata.add(metadata);
                return "lnbc3417000n1p";
            });

        assertThat(invoicedAmounts).containsExactly(100 * 34_150L + 2_000);
        assertThat(invoicedMetadata.get(0)).startsWith("[[\"text/plain\",\"Pay to $bob\"]]").contains(PAYER);
        assertThat(response).isInstanceOf(PayReqResponseV1.class);
        final UmaPayReqResponse parsed = helper.parseAsPayReqResponse(response.toJson()).toUmaPayReqResponse();
        assertThat(parsed.paymentInfo().amount()).isEqualTo(100);
        assertThat(parsed.paymentInfo().exchangeFeesMillisatoshi()).isEqualTo(2_000);
        assertThat(parsed.payeeIdentifier()).isEqualTo(RECEIVER);
        assertThat(parsed.compliance().utxos()).containsExactly("abcd:1");
        assertThat(helper.verifyPayReqResponseSignature(parsed, helper.fetchPublicKeysForVasp(RECEIVER_DOMAIN),
            PAYER, nonceCache)).isTrue();
        assertThat(helper.verifyPayReqResponseSignature(
            helper.parseAsPayReqResponse(response.toJson()).toUmaPayReqResponse(),
            helper.fetchPublicKeysForVasp(RECEIVER_DOMAIN), "$mallory@vasp1.com", new InMemoryNonceCache(0)))
            .isFalse();
    }

    @Test
    void payResponseDerivesReceivingAmountFromMillisats() {
        final PayRequest request = helper.getPayRequest(payRequestOptions()
            .amount(1_000_000)
            .isAmountInReceivingCurrency(false)
            .build());
        final List<Long> invoicedAmounts = new ArrayList<>();

        final PayReqResponse response = helper.getPayReqResponse(request, payReqResponseOptions(),
            (amountMsats, metadata, receiverIdentifier) -> {
                invoicedAmounts.add(amountMsats);
                return "lnbc1";
            });

        assertThat(invoicedAmounts).containsExactly(1_000_000L);
        assertThat(response.paymentInfo().amount()).isEqualTo(29);
    }

    @Test
    void millisatsBelowReceiverFeesAreRejected() {
        final PayRequest request = helper.getPayRequest(payRequestOptions()
            .amount(1_500)
            .isAmountInReceivingCurrency(false)
            .build());
        final List<Long> invoicedAmounts = new ArrayList<>();

        assertThatThrownBy(() -> helper.getPayReqResponse(request, payReqResponseOptions(),
            (amountMsats, metadata, receiverIdentifier) -> {
                invoicedAmounts.add(amountMsats);
                return "lnbc1";
            }))
            .isInstanceOf(UmaException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.AMOUNT_OUT_OF_RANGE);
        assertThat(invoicedAmounts).isEmpty();
    }

    @Test
    void asyncPayResponseMatchesSync() {
        final PayRequest request = helper.getPayRequest(payRequestOptions().build());

        final PayReqResponse response = helper.getPayReqResponseAsync(request, payReqResponseOptions(),
            (amountMsats, metadata, receiverIdentifier) -> "lnbc1").block();

        assertThat(response).isNotNull();
        assertThat(response.isUmaResponse()).isTrue();
    }

    @Test
    void backingSignaturesVerifyAgainstTheirOwnDomain() {
        final String url = helper.getSignedLnurlpRequestUrl(senderKeys.privateKey(), RECEIVER, SENDER_DOMAIN, true);
        final UmaLnurlpRequest request = helper.parseLnurlpRequest(url).toUmaRequest()
            .appendBackingSignature(backerKeys.privateKey(), BACKER_DOMAIN);

        final UmaLnurlpRequest parsed = helper.parseLnurlpRequest(request.encodeToUrl()).toUmaRequest();
        assertThat(parsed.backingSignatures()).hasSize(1);
        assertThat(helper.verifyUmaLnurlpQueryBackingSignatures(parsed)).isTrue();

        final UmaLnurlpRequest forged = parsed.appendBackingSignature(senderKeys.privateKey(), BACKER_DOMAIN);
        assertThat(helper.verifyUmaLnurlpQueryBackingSignatures(forged)).isFalse();
    }

    @Test
    void payRequestBackingSignatures() {
        final UmaPayRequest request = helper.getPayRequest(payRequestOptions().build()).toUmaPayRequest()
            .appendBackingSignature(backerKeys.privateKey(), BACKER_DOMAIN);

        final UmaPayRequest parsed = helper.parseAsPayRequest(request.toJson()).toUmaPayRequest();

        assertThat(helper.verifyPayReqBackingSignatures(parsed)).isTrue();
        assertThat(helper.verifyPayReqSignature(parsed, helper.fetchPublicKeysForVasp(SENDER_DOMAIN), nonceCache))
            .isTrue();
    }

    @Test
    void postTransactionCallback() {
        final UmaPostTransactionCallback callback = helper.getPostTransactionCallback(
            List.of(new UtxoWithAmount("abcd:1", 1_000)), RECEIVER_DOMAIN, receiverKeys.privateKey());

        final UmaPostTransactionCallback parsed = helper.parseAsPostTransactionCallback(callback.toJson())
            .toUmaCallback();

        assertThat(parsed.utxos()).containsExactly(new UtxoWithAmount("abcd:1", 1_000));
        assertThat(helper.verifyPostTransactionCallbackSignature(parsed,
            helper.fetchPublicKeysForVasp(parsed.vaspDomain()), nonceCache)).isTrue();
    }

    @Test
    void invoiceSignature() {
        final Invoice invoice = helper.createUmaInvoice(Invoice.builder()
            .receiverUma(RECEIVER)
            .invoiceUUID("c7c07fec-cf00-431c-916f-6c13fc4b69f9")
            .amount(1000)
            .receivingCurrency(InvoiceCurrency.builder().code("USD").name("US Dollar").symbol("$").decimals(2).build())
            .expiration(NOW + 600)
            .isSubjectToTravelRule(true)
            .umaVersion("0.3,1.0")
            .callback("https://vasp2.com/api/uma/pay/c7c07fec"), receiverKeys.privateKey());
        final PubKeyResponse receiverPubKeys = helper.fetchPublicKeysForVasp(RECEIVER_DOMAIN);

        final Invoice parsed = Invoice.fromBech32(invoice.toBech32());

        assertThat(helper.verifyUmaInvoiceSignature(parsed, receiverPubKeys)).isTrue();
        assertThat(helper.verifyUmaInvoiceSignature(parsed.toBuilder().amount(999).build(), receiverPubKeys))
            .isFalse();
        assertThat(helper.verifyUmaInvoiceSignature(parsed.withSignature(null), receiverPubKeys)).isFalse();
    }

    @Test
    void publicKeysAreCachedUntilExpiration() {
        helper.fetchPublicKeysForVasp(SENDER_DOMAIN);
        helper.fetchPublicKeysForVasp(SENDER_DOMAIN);
        helper.fetchPublicKeysForVaspAsync(SENDER_DOMAIN).block();

        assertThat(requestedUrls).containsExactly("https://vasp1.com/.well-known/lnurlpubkey");
    }

    @Test
    void fetchFailuresAreNotWrapped() {
        assertThatThrownBy(() -> helper.fetchPublicKeysForVasp("unknown.com"))
            .isInstanceOf(UmaException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.COUNTERPARTY_PUBKEY_FETCH_ERROR);
    }

    @Test
    void vaspDomainFromAddress() {
        assertThat(helper.getVaspDomainFromUmaAddress("$bob@vasp2.com")).isEqualTo("vasp2.com");
        assertThat(helper.getVaspDomainFromUmaAddress("$bob@localhost:8080")).isEqualTo("localhost:8080");
        assertThatThrownBy(() -> helper.getVaspDomainFromUmaAddress("$bob"))
            .isInstanceOf(UmaException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_INPUT);
    }
}
