package uma.messages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;
import org.springframework.test.context.TestPropertySource;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.errors.UmaException;
import uma.model.CompliancePayeeData;
import uma.model.PayeeData;

@JsonTest
@TestPropertySource("")
class PayReqResponseTest {

    @Autowired
    private JacksonTester<PayReqResponse> json;

    @Autowired
    private JacksonTester<PayReqResponseV1> v1Json;

    private static PayReqResponsePaymentInfo paymentInfo() {
        return PayReqResponsePaymentInfo.builder()
            .amount(1000L)
            .currencyCode("USD")
            .decimals(2)
            .multiplier(34_150)
            .exchangeFeesMillisatoshi(2_000)
            .build();
    }

    @Test
    void serializeV1() throws IOException {
        final PayReqResponseV1 response = PayReqResponseV1.builder()
            .encodedInvoice("lnbc1000n1p")
            .paymentInfo(paymentInfo())
            .payeeData(PayeeData.builder()
                .identifier("$bob@vasp2.com")
                .compliance(CompliancePayeeData.builder()
                    .nodePubKey("02abc")
                    .utxoCallback("https://vasp2.com/utxo")
                    .signature("abcd")
                    .signatureNonce("1")
                    .signatureTimestamp(1_700_000_000L)
                    .build())
                .build())
            .disposable(false)
            .build();

        assertThat(v1Json.write(response))
            .isEqualToJson("""
                {
                    "pr": "lnbc1000n1p",
                    "converted": {
                        "amount": 1000,
                        "currencyCode": "USD",
                        "decimals": 2,
                        "multiplier": 34150.0,
                        "fee": 2000
                    },
                    "payeeData": {
                        "identifier": "$bob@vasp2.com",
                        "compliance": {
                            "utxos": [],
                            "nodePubKey": "02abc",
                            "utxoCallback": "https://vasp2.com/utxo",
                            "signature": "abcd",
                            "signatureNonce": "1",
                            "signatureTimestamp": 1700000000
                        }
                    },
                    "routes": [],
                    "disposable": false
                }
                """, JSONCompareMode.STRICT);
    }

    @Test
    void parseV0BySniffingCompliance() throws IOException {
        final PayReqResponse response = json.parseObject("""
            {
                "pr": "lnbc1000n1p",
                "compliance": {"utxos": ["abc:1"], "utxoCallback": "https://vasp2.com/utxo"},
                "paymentInfo": {"currencyCode": "USD", "decimals": 2, "multiplier": 34150, "fee": 0},
                "routes": []
            }
            """);

        assertThat(response).isInstanceOf(PayReqResponseV0.class);
        assertThat(response.isUmaResponse()).isTrue();
        final UmaPayReqResponse uma = response.toUmaPayReqResponse();
        assertThat(uma.isSigned()).isFalse();
        assertThat(uma.payeeIdentifier()).isNull();
        assertThat(uma.backingSignatures()).isEmpty();
        assertThat(uma.paymentInfo().currencyCode()).isEqualTo("USD");
    }

    @Test
    void plainLnurlResponseIsNotUma() {
        final PayReqResponse response = PayReqResponse.fromJson("""
            {"pr": "lnbc1000n1p", "routes": []}
            """);

        assertThat(response).isInstanceOf(PayReqResponseV1.class);
        assertThat(response.isUmaResponse()).isFalse();
        assertThatThrownBy(response::toUmaPayReqResponse)
            .isInstanceOfSatisfying(MissingRequiredFieldsException.class, e ->
                assertThat(e.getMissingFields())
                    .containsExactly("converted", "payeeData.identifier", "payeeData.compliance"));
    }

    @Test
    void incompletePayeeComplianceIsReported() {
        assertThatThrownBy(() -> PayReqResponse.fromJson("""
            {"pr": "lnbc1", "payeeData": {"identifier": "$bob@vasp2.com", "compliance": {"signature": "ab"}}}
            """))
            .isInstanceOfSatisfying(MissingRequiredFieldsException.class, e ->
                assertThat(e.getMissingFields()).containsExactly("signatureNonce", "signatureTimestamp"));
    }

    @Test
    void malformedJsonIsParseError() {
        assertThatThrownBy(() -> PayReqResponse.fromJson("[]"))
            .isInstanceOf(UmaException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PARSE_PAYREQ_RESPONSE_ERROR);
    }

    @Test
    void v1SignablePayloadIsLowerCased() {
        final PayReqResponseV1 response = PayReqResponseV1.builder()
            .encodedInvoice("lnbc1")
            .routes(List.of())
            .payeeData(PayeeData.builder()
                .identifier("$Bob@VASP2.com")
                .compliance(CompliancePayeeData.builder()
                    .signature("ab")
                    .signatureNonce("Nonce")
                    .signatureTimestamp(1L)
                    .build())
                .build())
            .build();

        assertThat(new String(response.signablePayload("$Alice@vasp1.com")))
            .isEqualTo("$alice@vasp1.com|$bob@vasp2.com|nonce|1");
    }
}
