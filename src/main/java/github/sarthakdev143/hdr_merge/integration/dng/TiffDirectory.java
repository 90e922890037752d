package github.sarthakdev143.hdr_merge.integration.dng;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * One little-endian image file directory. Entries are kept sorted by tag; values longer than four
 * bytes are stored right after the directory.
 */
final class TiffDirectory {

    private static final int ENTRY_SIZE = 12;

    private final Map<Integer, Entry> entries = new TreeMap<>();

    void putShorts(int tag, int... values) {
        ByteBuffer buffer = allocate(values.length * 2);
        for (int value : values) {
            buffer.putShort((short) value);
        }
        entries.put(tag, new Entry(TiffTags.TYPE_SHORT, values.length, buffer.array()));
    }

    void putLongs(int tag, long... values) {
        ByteBuffer buffer = allocate(values.length * 4);
        for (long value : values) {
            buffer.putInt((int) value);
        }
        entries.put(tag, new Entry(TiffTags.TYPE_LONG, values.length, buffer.array()));
    }

    void putBytes(int tag, byte... values) {
        entries.put(tag, new Entry(TiffTags.TYPE_BYTE, values.length, values.clone()));
    }

    void putAscii(int tag, String value) {
        byte[] text = (value + "\0").getBytes(StandardCharsets.US_ASCII);
        entries.put(tag, new Entry(TiffTags.TYPE_ASCII, text.length, text));
    }

    /**
     * @param fractions numerator and denominator pairs
     */
    void putRationals(int tag, boolean signed, long... fractions) {
        if (fractions.length % 2 != 0) {
            throw new IllegalArgumentException("Rationals need numerator and denominator pairs.");
        }
        ByteBuffer buffer = allocate(fractions.length * 4);
        for (long value : fractions) {
            buffer.putInt((int) value);
        }
        int type = signed ? TiffTags.TYPE_SRATIONAL : TiffTags.TYPE_RATIONAL;
        entries.put(tag, new Entry(type, fractions.length / 2, buffer.array()));
    }

    int size() {
        int size = 2 + entries.size() * ENTRY_SIZE + 4;
        for (Entry entry : entries.values()) {
            if (entry.value.length > 4) {
                size += padded(entry.value.length);
            }
        }
        return size;
    }

    void write(ByteBuffer out, int offset, int nextDirectoryOffset) {
        out.position(offset);
        out.putShort((short) entries.size());
        int overflow = offset + 2 + entries.size() * ENTRY_SIZE + 4;
        for (Map.Entry<Integer, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            out.putShort(item.getKey().shortValue());
            out.putShort((short) entry.type);
            out.putInt(entry.count);
            if (entry.value.length <= 4) {
                byte[] inline = new byte[4];
                System.arraycopy(entry.value, 0, inline, 0, entry.value.length);
                out.put(inline);
            } else {
                out.putInt(overflow);
                int resume = out.position();
                out.position(overflow);
                out.put(entry.value);
                overflow += padded(entry.value.length);
                out.position(resume);
            }
        }
        out.putInt(nextDirectoryOffset);
    }

    private static int padded(int length) {
        return (length + 1) & ~1;
    }

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private record Entry(int type, int count, byte[] value) {
    }
}
