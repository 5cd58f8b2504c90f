package uma.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import uma.errors.MalformedInvoiceException;
import uma.errors.MalformedInvoiceException.Kind;

/**
 * One decoded {@code [tag][length][value]} record. Numbers are read at whatever width they were written.
 */
public record TlvRecord(
    int tag,
    byte[] value
) {

    public String asString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public long asLong() {
        final ByteBuffer buffer = ByteBuffer.wrap(value);
        return switch (value.length) {
            case 1 -> buffer.get();
            case 2 -> buffer.getShort();
            case 4 -> buffer.getInt();
            case 8 -> buffer.getLong();
            default -> throw new MalformedInvoiceException(Kind.MALFORMED_TLV,
                "Number in TLV tag %d has unsupported width %d".formatted(tag, value.length));
        };
    }

    public int asInt() {
        final long v = asLong();
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new MalformedInvoiceException(Kind.MALFORMED_TLV, "Number in TLV tag %d is out of range".formatted(tag));
        }
        return (int) v;
    }

    public boolean asBoolean() {
        if (value.length != 1) {
            throw new MalformedInvoiceException(Kind.MALFORMED_TLV,
                "Boolean in TLV tag %d has length %d".formatted(tag, value.length));
        }
        return value[0] != 0;
    }
}
