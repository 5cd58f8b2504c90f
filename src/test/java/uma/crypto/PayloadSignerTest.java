package uma.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import uma.crypto.TestKeys.KeyPair;

class PayloadSignerTest {

    @Test
    void hexSignatureVerifies() {
        final KeyPair keys = TestKeys.fixed();
        final byte[] payload = "123|1700000000".getBytes(StandardCharsets.UTF_8);

        final String signature = PayloadSigner.sign(payload, keys.privateKey());

        assertThat(signature).matches("[0-9a-f]+");
        assertThat(PayloadSigner.verify(payload, signature, keys.publicKey())).isTrue();
    }

    @Test
    void missingOrNonHexSignatureIsInvalid() {
        final byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        final byte[] publicKey = TestKeys.fixed().publicKey();

        assertThat(PayloadSigner.verify(payload, null, publicKey)).isFalse();
        assertThat(PayloadSigner.verify(payload, "", publicKey)).isFalse();
        assertThat(PayloadSigner.verify(payload, "not hex", publicKey)).isFalse();
    }

    @Test
    void travelRuleInfoDecryptsWithReceiverKey() {
        final KeyPair receiver = TestKeys.generate();

        final String encrypted = PayloadSigner.encrypt("travel rule info", receiver.publicKey());

        assertThat(PayloadSigner.decrypt(encrypted, receiver.privateKey())).isEqualTo("travel rule info");
    }
}
