package uma.services;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import uma.crypto.PayloadSigner;
import uma.crypto.Secp256k1;
import uma.errors.ErrorCode;
import uma.errors.UmaException;
import uma.errors.UnsupportedVersionException;
import uma.messages.LnurlComplianceResponse;
import uma.messages.LnurlpRequest;
import uma.messages.LnurlpResponse;
import uma.messages.PayReqResponse;
import uma.messages.PayReqResponseCompliance;
import uma.messages.PayReqResponsePaymentInfo;
import uma.messages.PayReqResponseV0;
import uma.messages.PayReqResponseV1;
import uma.messages.PayRequest;
import uma.messages.PayRequestV0;
import uma.messages.PayRequestV1;
import uma.messages.PostTransactionCallback;
import uma.messages.PubKeyResponse;
import uma.messages.UmaJson;
import uma.messages.UmaLnurlpRequest;
import uma.messages.UmaLnurlpResponse;
import uma.messages.UmaPayReqResponse;
import uma.messages.UmaPayRequest;
import uma.messages.UmaPostTransactionCallback;
import uma.messages.UmaUrls;
import uma.model.BackingSignature;
import uma.model.CompliancePayeeData;
import uma.model.CompliancePayerData;
import uma.model.CounterPartyData;
import uma.model.CounterPartyDataOption;
import uma.model.Invoice;
import uma.model.PayeeData;
import uma.model.PayerData;
import uma.model.UtxoWithAmount;

/**
 * Builds, signs, parses and verifies the messages of a payment on either side of it.
 * <p>
 * Every signature check first passes the message's nonce through the given {@link NonceCache}, so a replayed
 * message fails with {@link uma.errors.InvalidNonceException} before any cryptography runs.
 */
@Service
@Slf4j
public class UmaProtocolHelper {

    private final PublicKeyCache publicKeyCache;
    private final UmaRequester umaRequester;
    private final VersionNegotiator versionNegotiator;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public UmaProtocolHelper(PublicKeyCache publicKeyCache, UmaRequester umaRequester,
        VersionNegotiator versionNegotiator, Clock clock
    ) {
        this.publicKeyCache = publicKeyCache;
        this.umaRequester = umaRequester;
        this.versionNegotiator = versionNegotiator;
        this.clock = clock;
    }

    /**
     * Returns cached keys of the VASP or fetches them from its {@code /.well-known/lnurlpubkey}. Fetch failures
     * are not wrapped.
     */
    public PubKeyResponse fetchPublicKeysForVasp(String vaspDomain) {
        final Optional<PubKeyResponse> cached = publicKeyCache.getPublicKeysForVasp(vaspDomain);
        if (cached.isPresent()) {
            log.debug("Using cached public keys for vaspDomain={}", vaspDomain);
            return cached.get();
        }
        final String url = UmaUrls.pubKeyUrl(vaspDomain);
        log.debug("Fetching public keys for vaspDomain={} from url={}", vaspDomain, url);
        final PubKeyResponse fetched = PubKeyResponse.fromJson(umaRequester.makeGetRequest(url));
        publicKeyCache.addPublicKeysForVasp(vaspDomain, fetched);
        return fetched;
    }

    public Mono<PubKeyResponse> fetchPublicKeysForVaspAsync(String vaspDomain) {
        final Optional<PubKeyResponse> cached = publicKeyCache.getPublicKeysForVasp(vaspDomain);
        if (cached.isPresent()) {
            log.debug("Using cached public keys for vaspDomain={}", vaspDomain);
            return Mono.just(cached.get());
        }
        final String url = UmaUrls.pubKeyUrl(vaspDomain);
        log.debug("Fetching public keys for vaspDomain={} from url={}", vaspDomain, url);
        return umaRequester.makeGetRequestAsync(url)
            .map(PubKeyResponse::fromJson)
            .doOnNext(fetched -> publicKeyCache.addPublicKeysForVasp(vaspDomain, fetched));
    }

    public String getSignedLnurlpRequestUrl(byte[] signingPrivateKey, String receiverAddress,
        String senderVaspDomain, boolean isSubjectToTravelRule
    ) {
        return getSignedLnurlpRequestUrl(signingPrivateKey, receiverAddress, senderVaspDomain, isSubjectToTravelRule,
            VersionNegotiator.UMA_VERSION_STRING);
    }

    public String getSignedLnurlpRequestUrl(byte[] signingPrivateKey, String receiverAddress,
        String senderVaspDomain, boolean isSubjectToTravelRule, String umaVersion
    ) {
        final UmaLnurlpRequest unsigned = new UmaLnurlpRequest(receiverAddress, generateNonce(), "",
            isSubjectToTravelRule, senderVaspDomain, now(), umaVersion, null);
        return unsigned.signedWith(PayloadSigner.sign(unsigned.signablePayload(), signingPrivateKey))
            .encodeToUrl();
    }

    /**
     * @return whether the URL is a signed UMA lnurlp request, including one of a version this VASP cannot speak
     */
    public boolean isUmaLnurlpQuery(String url) {
        try {
            return parseLnurlpRequest(url).isUmaRequest();
        } catch (UnsupportedVersionException e) {
            return true;
        } catch (UmaException e) {
            log.debug("Not an UMA lnurlp query url={}: {}", url, e.getReason());
            return false;
        }
    }

    /**
     * @throws UnsupportedVersionException when the request names a version this VASP does not support
     * @throws UmaException                with {@link ErrorCode#PARSE_LNURLP_REQUEST_ERROR} for a malformed URL
     */
    public LnurlpRequest parseLnurlpRequest(String url) {
        final LnurlpRequest request = LnurlpRequest.decodeFromUrl(url);
        if (request.umaVersion() != null) {
            versionNegotiator.requireSupported(request.umaVersion());
        }
        return request;
    }

    public boolean verifyUmaLnurlpQuerySignature(UmaLnurlpRequest request, PubKeyResponse pubKeys,
        NonceCache nonceCache
    ) {
        nonceCache.checkAndSaveNonce(request.nonce(), request.timestamp());
        return verifySignature(request.signablePayload(), request.signature(), pubKeys.signingKey(),
            request.vaspDomain());
    }

    public boolean verifyUmaLnurlpQueryBackingSignatures(UmaLnurlpRequest request) {
        return verifyBackingSignatures(request.signablePayload(), request.backingSignatures());
    }

    /**
     * A plain LNURL request gets a plain LNURL response. An UMA request gets a signed compliance response and a
     * version no higher than the requested one.
     */
    public LnurlpResponse getLnurlpResponse(LnurlpRequest request, LnurlpResponseOptions options) {
        final LnurlpResponse.LnurlpResponseBuilder response = LnurlpResponse.builder()
            .callback(options.callback())
            .minSendable(options.minSendableSats() * 1000)
            .maxSendable(options.maxSendableSats() * 1000)
            .metadata(options.encodedMetadata())
            .commentAllowed(options.commentCharsAllowed())
            .nostrPubkey(options.nostrPubkey())
            .allowsNostr(options.nostrPubkey() != null ? true : null);
        if (!request.isUmaRequest()) {
            log.debug("Responding to non-UMA lnurlp request for receiverAddress={}", request.receiverAddress());
            return response.build();
        }

        final UmaLnurlpRequest umaRequest = request.toUmaRequest();
        final Map<String, CounterPartyDataOption> requiredPayerData =
            new LinkedHashMap<>(options.payerDataOptions());
        requiredPayerData.put(CounterPartyData.IDENTIFIER, new CounterPartyDataOption(true));
        requiredPayerData.put(CounterPartyData.COMPLIANCE, new CounterPartyDataOption(true));

        final LnurlComplianceResponse unsigned = LnurlComplianceResponse.builder()
            .kycStatus(options.receiverKycStatus())
            .isSubjectToTravelRule(options.requiresTravelRuleInfo())
            .receiverIdentifier(umaRequest.receiverAddress())
            .signature("")
            .signatureNonce(generateNonce())
            .signatureTimestamp(now())
            .build();
        final LnurlComplianceResponse compliance = unsigned.signedWith(
            PayloadSigner.sign(unsigned.signablePayload(), options.signingPrivateKey()));

        return response
            .currencies(options.currencyOptions())
            .requiredPayerData(requiredPayerData)
            .compliance(compliance)
            .umaVersion(versionNegotiator.selectResponseVersion(umaRequest.umaVersion()))
            .build();
    }

    public LnurlpResponse parseAsLnurlpResponse(String json) {
        return LnurlpResponse.fromJson(json);
    }

    public boolean verifyLnurlpResponseSignature(UmaLnurlpResponse response, PubKeyResponse pubKeys,
        NonceCache nonceCache
    ) {
        final LnurlComplianceResponse compliance = response.compliance();
        nonceCache.checkAndSaveNonce(compliance.signatureNonce(), compliance.signatureTimestamp());
        return verifySignature(compliance.signablePayload(), compliance.signature(), pubKeys.signingKey(),
            compliance.receiverIdentifier());
    }

    public boolean verifyLnurlpResponseBackingSignatures(UmaLnurlpResponse response) {
        return verifyBackingSignatures(response.signablePayload(), response.backingSignatures());
    }

    /**
     * Builds a pay request in the layout of {@link PayRequestOptions#receiverUmaVersion()}, with the travel rule
     * info encrypted to the receiver and the payer compliance data signed.
     */
    public PayRequest getPayRequest(PayRequestOptions options) {
        final CompliancePayerData unsignedCompliance = CompliancePayerData.builder()
            .utxos(options.payerUtxos())
            .nodePubKey(options.payerNodePubKey())
            .kycStatus(options.payerKycStatus())
            .encryptedTravelRuleInfo(options.travelRuleInfo() != null
                ? PayloadSigner.encrypt(options.travelRuleInfo(), options.receiverEncryptionPubKey())
                : null)
            .utxoCallback(options.utxoCallback())
            .signature("")
            .signatureNonce(generateNonce())
            .signatureTimestamp(now())
            .travelRuleFormat(options.travelRuleFormat())
            .build();
        final PayerData payerData = PayerData.builder()
            .identifier(options.payerIdentifier())
            .name(options.payerName())
            .email(options.payerEmail())
            .compliance(unsignedCompliance)
            .build();

        final PayRequest unsigned = versionNegotiator.umaMajorVersion(options.receiverUmaVersion()) < 1
            ? new PayRequestV0(options.receivingCurrencyCode(), options.amount(), payerData)
            : PayRequestV1.builder()
                .sendingCurrencyCode(options.isAmountInReceivingCurrency() ? options.receivingCurrencyCode() : null)
                .receivingCurrencyCode(options.receivingCurrencyCode())
                .amount(options.amount())
                .payerData(payerData)
                .requestedPayeeData(options.requestedPayeeData())
                .comment(options.comment())
                .invoiceUUID(options.invoiceUUID())
                .settlementInfo(options.settlementInfo())
                .build();

        final String signature = PayloadSigner.sign(unsigned.signablePayload(), options.sendingVaspPrivateKey());
        final PayerData signedPayerData = payerData.withCompliance(unsignedCompliance.signedWith(signature));
        if (unsigned instanceof PayRequestV1 v1) {
            return v1.toBuilder().payerData(signedPayerData).build();
        }
        return new PayRequestV0(options.receivingCurrencyCode(), options.amount(), signedPayerData);
    }

    public PayRequest parseAsPayRequest(String json) {
        return PayRequest.fromJson(json);
    }

    public boolean verifyPayReqSignature(UmaPayRequest request, PubKeyResponse pubKeys, NonceCache nonceCache) {
        final CompliancePayerData compliance = request.compliance();
        nonceCache.checkAndSaveNonce(compliance.signatureNonce(), compliance.signatureTimestamp());
        return verifySignature(request.signablePayload(), compliance.signature(), pubKeys.signingKey(),
            request.payerIdentifier());
    }

    public boolean verifyPayReqBackingSignatures(UmaPayRequest request) {
        return verifyBackingSignatures(request.signablePayload(), request.backingSignatures());
    }

    /**
     * Creates the invoice and answers in the layout of the request. When the request amount is in the receiving
     * currency, the invoice is for {@code round(amount * conversionRate) + fees} millisatoshis, otherwise it is for
     * the requested millisatoshis and the receiving amount is derived from it.
     */
    public PayReqResponse getPayReqResponse(PayRequest request, PayReqResponseOptions options,
        UmaInvoiceCreator invoiceCreator
    ) {
        final boolean amountInReceivingCurrency = request.sendingCurrencyCode() != null
            && request.sendingCurrencyCode().equals(options.receivingCurrencyCode());
        final long amountMsats;
        final long receivingAmount;
        if (amountInReceivingCurrency) {
            amountMsats = Math.round(request.amount() * options.conversionRate()) + options.receiverFeesMillisats();
            receivingAmount = request.amount();
        } else {
            if (request.amount() < options.receiverFeesMillisats()) {
                throw new UmaException(ErrorCode.AMOUNT_OUT_OF_RANGE,
                    "Sent amount " + request.amount() + " msats does not cover receiver fees of "
                        + options.receiverFeesMillisats() + " msats");
            }
            amountMsats = request.amount();
            receivingAmount = options.conversionRate() > 0
                ? Math.round((request.amount() - options.receiverFeesMillisats()) / options.conversionRate())
                : request.amount();
        }

        final String metadata = request.payerData() != null
            ? options.metadata() + UmaJson.write(request.payerData())
            : options.metadata();
        final String encodedInvoice = invoiceCreator.createUmaInvoice(amountMsats, metadata,
            options.payeeIdentifier());
        log.debug("Created invoice for amountMsats={} receivingAmount={}", amountMsats, receivingAmount);

        if (request instanceof PayRequestV0) {
            return new PayReqResponseV0(
                encodedInvoice,
                new PayReqResponseCompliance(options.receiverChannelUtxos(), options.receiverNodePubKey(),
                    options.utxoCallback()),
                new PayReqResponsePaymentInfo(null, options.receivingCurrencyCode(),
                    options.receivingCurrencyDecimals(), options.conversionRate(), options.receiverFeesMillisats()),
                List.of()
            );
        }

        final PayReqResponseV1.PayReqResponseV1Builder response = PayReqResponseV1.builder()
            .encodedInvoice(encodedInvoice)
            .routes(List.of())
            .disposable(false)
            .successAction(options.successAction());
        if (options.receivingCurrencyCode() != null) {
            response.paymentInfo(new PayReqResponsePaymentInfo(receivingAmount, options.receivingCurrencyCode(),
                options.receivingCurrencyDecimals(), options.conversionRate(), options.receiverFeesMillisats()));
        }
        if (!request.isUmaRequest()) {
            return response.build();
        }

        final String payerIdentifier = request.payerData().identifier().orElseThrow();
        if (options.payeeIdentifier() == null || options.signingPrivateKey() == null) {
            throw new UmaException(ErrorCode.MISSING_REQUIRED_UMA_PARAMETERS,
                "Payee identifier and signing key are required to answer an UMA pay request");
        }
        final CompliancePayeeData unsignedCompliance = CompliancePayeeData.builder()
            .utxos(options.receiverChannelUtxos())
            .nodePubKey(options.receiverNodePubKey())
            .utxoCallback(options.utxoCallback())
            .signature("")
            .signatureNonce(generateNonce())
            .signatureTimestamp(now())
            .build();
        final PayeeData payeeData = PayeeData.builder()
            .identifier(options.payeeIdentifier())
            .name(options.payeeName())
            .email(options.payeeEmail())
            .compliance(unsignedCompliance)
            .build();
        final PayReqResponseV1 unsigned = response.payeeData(payeeData).build();
        final String signature = PayloadSigner.sign(unsigned.signablePayload(payerIdentifier),
            options.signingPrivateKey());
        return unsigned.toBuilder()
            .payeeData(payeeData.withCompliance(unsignedCompliance.signedWith(signature)))
            .build();
    }

    public Mono<PayReqResponse> getPayReqResponseAsync(PayRequest request, PayReqResponseOptions options,
        UmaInvoiceCreator invoiceCreator
    ) {
        return Mono.fromCallable(() -> getPayReqResponse(request, options, invoiceCreator))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public PayReqResponse parseAsPayReqResponse(String json) {
        return PayReqResponse.fromJson(json);
    }

    /**
     * Version 0 responses carry no signature and always verify.
     */
    public boolean verifyPayReqResponseSignature(UmaPayReqResponse response, PubKeyResponse pubKeys,
        String payerIdentifier, NonceCache nonceCache
    ) {
        if (!(response.source() instanceof PayReqResponseV1 v1)) {
            return true;
        }
        final CompliancePayeeData compliance = response.compliance();
        nonceCache.checkAndSaveNonce(compliance.signatureNonce(), compliance.signatureTimestamp());
        return verifySignature(v1.signablePayload(payerIdentifier), compliance.signature(), pubKeys.signingKey(),
            response.payeeIdentifier());
    }

    public boolean verifyPayReqResponseBackingSignatures(UmaPayReqResponse response, String payerIdentifier) {
        if (!(response.source() instanceof PayReqResponseV1 v1)) {
            return true;
        }
        return verifyBackingSignatures(v1.signablePayload(payerIdentifier), response.backingSignatures());
    }

    public UmaPostTransactionCallback getPostTransactionCallback(List<UtxoWithAmount> utxos, String vaspDomain,
        byte[] signingPrivateKey
    ) {
        final UmaPostTransactionCallback unsigned = new UmaPostTransactionCallback(utxos, vaspDomain, "",
            generateNonce(), now());
        return unsigned.signedWith(PayloadSigner.sign(unsigned.signablePayload(), signingPrivateKey));
    }

    public PostTransactionCallback parseAsPostTransactionCallback(String json) {
        return PostTransactionCallback.fromJson(json);
    }

    public boolean verifyPostTransactionCallbackSignature(UmaPostTransactionCallback callback,
        PubKeyResponse pubKeys, NonceCache nonceCache
    ) {
        nonceCache.checkAndSaveNonce(callback.signatureNonce(), callback.signatureTimestamp());
        return verifySignature(callback.signablePayload(), callback.signature(), pubKeys.signingKey(),
            callback.vaspDomain());
    }

    public PubKeyResponse parseAsPubKeyResponse(String json) {
        return PubKeyResponse.fromJson(json);
    }

    /**
     * Signs the TLV encoding of the invoice without its signature.
     */
    public Invoice createUmaInvoice(Invoice.InvoiceBuilder invoiceBuilder, byte[] signingPrivateKey) {
        final Invoice unsigned = invoiceBuilder.signature(null).build();
        return unsigned.withSignature(Secp256k1.signEcdsa(unsigned.signablePayload(), signingPrivateKey));
    }

    public boolean verifyUmaInvoiceSignature(Invoice invoice, PubKeyResponse pubKeys) {
        final byte[] signature = invoice.signature();
        if (signature == null) {
            return false;
        }
        return Secp256k1.verifyEcdsa(invoice.signablePayload(), signature, pubKeys.signingKey());
    }

    /**
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} for an address without {@code @}
     */
    public String getVaspDomainFromUmaAddress(String umaAddress) {
        final int at = umaAddress.indexOf('@');
        if (at < 0) {
            throw new UmaException(ErrorCode.INVALID_INPUT,
                "Invalid UMA address: %s. Must be of format $user@domain.com".formatted(umaAddress));
        }
        return umaAddress.substring(at + 1);
    }

    private boolean verifySignature(byte[] payload, String signature, byte[] publicKey, String signer) {
        final boolean valid = PayloadSigner.verify(payload, signature, publicKey);
        if (!valid) {
            log.warn("Rejected signature of signer={}", signer);
        }
        return valid;
    }

    /**
     * Valid only if every backing signature verifies against the key of its own domain.
     */
    private boolean verifyBackingSignatures(byte[] payload, List<BackingSignature> backingSignatures) {
        if (backingSignatures == null) {
            return true;
        }
        for (BackingSignature backingSignature : backingSignatures) {
            final PubKeyResponse pubKeys = fetchPublicKeysForVasp(backingSignature.domain());
            if (!verifySignature(payload, backingSignature.signature(), pubKeys.signingKey(),
                backingSignature.domain())) {
                return false;
            }
        }
        return true;
    }

    private String generateNonce() {
        return Long.toUnsignedString(random.nextLong());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
