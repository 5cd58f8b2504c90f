package uma.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import uma.codec.Bech32.ChecksumMismatchException;

class Bech32Test {

    @Test
    void bip173Vectors() {
        assertThat(Bech32.decode("a12uel5l").hrp()).isEqualTo("a");
        assertThat(Bech32.decode("a12uel5l").data()).isEmpty();
        assertThat(Bech32.decode("A12UEL5L").hrp()).isEqualTo("a");
    }

    @Test
    void encodesPastSegwitLengthLimit() {
        final byte[] data = "x".repeat(200).getBytes(StandardCharsets.UTF_8);

        final String encoded = Bech32.encode("uma", data);

        assertThat(encoded).hasSizeGreaterThan(90).startsWith("uma1");
        assertThat(Bech32.decode(encoded).data()).isEqualTo(data);
    }

    @Test
    void changedCharacterIsChecksumMismatch() {
        final String encoded = Bech32.encode("uma", new byte[]{1, 2, 3, 4, 5});
        final int pos = "uma1".length() + 1;
        final char replacement = encoded.charAt(pos) == 'q' ? 'p' : 'q';
        final String tampered = encoded.substring(0, pos) + replacement + encoded.substring(pos + 1);

        assertThatThrownBy(() -> Bech32.decode(tampered))
            .isInstanceOf(ChecksumMismatchException.class);
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> Bech32.decode("A12uel5l"))
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(ChecksumMismatchException.class)
            .hasMessageContaining("Mixed case");
        assertThatThrownBy(() -> Bech32.decode("pzry9x0s0muk"))
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(ChecksumMismatchException.class);
        assertThatThrownBy(() -> Bech32.decode("uma1qqq"))
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(ChecksumMismatchException.class);
    }

    @Test
    void characterOutsideAlphabetIsChecksumMismatch() {
        assertThatThrownBy(() -> Bech32.decode("uma1qqqqqbqq"))
            .isInstanceOf(ChecksumMismatchException.class)
            .hasMessageContaining("Invalid character");
    }
}
