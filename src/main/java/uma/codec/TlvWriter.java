package uma.codec;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.springframework.lang.Nullable;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * Appends {@code [tag][length][value]} records. Null values are skipped so optional fields simply do not
 * appear in the output.
 */
public final class TlvWriter {

    static final int MAX_VALUE_LENGTH = 0xff;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public TlvWriter putString(int tag, @Nullable String value) {
        return value == null ? this : putRecord(tag, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Written big-endian, signed, in the smallest of 1, 2, 4 or 8 bytes that holds the value.
     */
    public TlvWriter putNumber(int tag, @Nullable Number value) {
        if (value == null) {
            return this;
        }
        final long v = value.longValue();
        if (v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE) {
            return putRecord(tag, new byte[]{(byte) v});
        }
        if (v >= Short.MIN_VALUE && v <= Short.MAX_VALUE) {
            return putRecord(tag, ByteBuffer.allocate(Short.BYTES).putShort((short) v).array());
        }
        if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
            return putRecord(tag, ByteBuffer.allocate(Integer.BYTES).putInt((int) v).array());
        }
        return putRecord(tag, ByteBuffer.allocate(Long.BYTES).putLong(v).array());
    }

    public TlvWriter putBoolean(int tag, @Nullable Boolean value) {
        return value == null ? this : putRecord(tag, new byte[]{(byte) (value ? 1 : 0)});
    }

    public TlvWriter putBytes(int tag, @Nullable byte[] value) {
        return value == null ? this : putRecord(tag, value);
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    private TlvWriter putRecord(int tag, byte[] value) {
        if (value.length > MAX_VALUE_LENGTH) {
            throw new UmaException(ErrorCode.INVALID_INPUT,
                "Value of TLV tag %d is %d bytes, at most %d fit".formatted(tag, value.length, MAX_VALUE_LENGTH));
        }
        out.write(tag);
        out.write(value.length);
        out.writeBytes(value);
        return this;
    }
}
