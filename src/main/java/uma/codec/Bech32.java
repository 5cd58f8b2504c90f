package uma.codec;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

/**
 * BIP-173 bech32 over arbitrary bytes. Unlike segwit addresses there is no overall length limit, since
 * invoices run well past 90 characters.
 */
public final class Bech32 {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final int CHECKSUM_LENGTH = 6;
    private static final char SEPARATOR = '1';

    public record Decoded(
        String hrp,
        byte[] data
    ) {

    }

    /**
     * The text was well-formed bech32 but its checksum did not match.
     */
    public static class ChecksumMismatchException extends IllegalArgumentException {

        public ChecksumMismatchException(String message) {
            super(message);
        }
    }

    private Bech32() {
    }

    public static String encode(String hrp, byte[] data) {
        final byte[] values = convertBits(data, 8, 5, true);
        final byte[] checksum = createChecksum(hrp, values);
        final StringBuilder sb = new StringBuilder(hrp.length() + 1 + values.length + CHECKSUM_LENGTH);
        sb.append(hrp).append(SEPARATOR);
        for (byte value : values) {
            sb.append(CHARSET.charAt(value));
        }
        for (byte value : checksum) {
            sb.append(CHARSET.charAt(value));
        }
        return sb.toString();
    }

    /**
     * A data character outside the bech32 alphabet can only be a transcription error, so it is reported as a
     * checksum mismatch like any other changed character.
     *
     * @throws ChecksumMismatchException when the data part does not carry a valid checksum
     * @throws IllegalArgumentException  for a missing separator, mixed case or an invalid prefix
     */
    public static Decoded decode(String bech) {
        if (!bech.equals(bech.toLowerCase(Locale.ROOT)) && !bech.equals(bech.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Mixed case in bech32 string");
        }
        final String lower = bech.toLowerCase(Locale.ROOT);
        final int pos = lower.lastIndexOf(SEPARATOR);
        if (pos < 1 || pos + 1 + CHECKSUM_LENGTH > lower.length()) {
            throw new IllegalArgumentException("Missing bech32 separator or checksum");
        }
        final String hrp = lower.substring(0, pos);
        for (int i = 0; i < hrp.length(); i++) {
            final char c = hrp.charAt(i);
            if (c < 33 || c > 126) {
                throw new IllegalArgumentException("Invalid character in bech32 prefix");
            }
        }
        final byte[] values = new byte[lower.length() - 1 - pos];
        for (int i = 0; i < values.length; i++) {
            final int v = CHARSET.indexOf(lower.charAt(pos + 1 + i));
            if (v == -1) {
                throw new ChecksumMismatchException("Invalid character in bech32 data: " + lower.charAt(pos + 1 + i));
            }
            values[i] = (byte) v;
        }
        if (polymod(concat(expandHrp(hrp), values)) != 1) {
            throw new ChecksumMismatchException("Bech32 checksum mismatch");
        }
        return new Decoded(hrp, convertBits(Arrays.copyOf(values, values.length - CHECKSUM_LENGTH), 5, 8, false));
    }

    private static int polymod(byte[] values) {
        int chk = 1;
        for (byte v : values) {
            final int top = chk >>> 25;
            chk = (chk & 0x1ffffff) << 5 ^ v;
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) {
                    chk ^= GENERATOR[i];
                }
            }
        }
        return chk;
    }

    private static byte[] expandHrp(String hrp) {
        final int len = hrp.length();
        final byte[] ret = new byte[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            ret[i] = (byte) (hrp.charAt(i) >> 5);
            ret[i + len + 1] = (byte) (hrp.charAt(i) & 0x1f);
        }
        return ret;
    }

    private static byte[] createChecksum(String hrp, byte[] values) {
        final byte[] enc = Arrays.copyOf(concat(expandHrp(hrp), values),
            hrp.length() * 2 + 1 + values.length + CHECKSUM_LENGTH);
        final int mod = polymod(enc) ^ 1;
        final byte[] ret = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            ret[i] = (byte) ((mod >>> 5 * (5 - i)) & 31);
        }
        return ret;
    }

    private static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final int maxv = (1 << toBits) - 1;
        for (byte value : data) {
            final int v = value & 0xff;
            if ((v >>> fromBits) != 0) {
                throw new IllegalArgumentException("Invalid data range for bit conversion");
            }
            acc = (acc << fromBits) | v;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxv);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new IllegalArgumentException("Invalid padding in bech32 data");
        }
        return out.toByteArray();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        final byte[] ret = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, ret, a.length, b.length);
        return ret;
    }
}
