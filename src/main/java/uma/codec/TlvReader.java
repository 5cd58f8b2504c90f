package uma.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import uma.errors.MalformedInvoiceException;
import uma.errors.MalformedInvoiceException.Kind;

/**
 * Splits a TLV byte string into its records. Reading runs until the bytes are exhausted.
 */
public final class TlvReader {

    private TlvReader() {
    }

    /**
     * @throws MalformedInvoiceException of kind {@link Kind#MALFORMED_TLV} when a record runs past the end
     */
    public static List<TlvRecord> read(byte[] bytes) {
        final List<TlvRecord> records = new ArrayList<>();
        int offset = 0;
        while (offset < bytes.length) {
            if (offset + 2 > bytes.length) {
                throw new MalformedInvoiceException(Kind.MALFORMED_TLV,
                    "Truncated TLV record header at offset " + offset);
            }
            final int tag = bytes[offset] & 0xff;
            final int length = bytes[offset + 1] & 0xff;
            final int valueOffset = offset + 2;
            if (valueOffset + length > bytes.length) {
                throw new MalformedInvoiceException(Kind.MALFORMED_TLV,
                    "TLV tag %d declares %d bytes but only %d remain".formatted(tag, length, bytes.length - valueOffset));
            }
            records.add(new TlvRecord(tag, Arrays.copyOfRange(bytes, valueOffset, valueOffset + length)));
            offset = valueOffset + length;
        }
        return records;
    }
}
