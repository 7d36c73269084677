package kvlite.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Tracks how far a stream has been checked for a complete value, so that each arrival of bytes
 * only has to look at what is new. Nothing is allocated for the elements it walks over; the
 * {@link RespCodec} builds the value once {@link #scan(ByteBuf)} reports it whole.
 * <p>
 * One scanner belongs to one stream. Offsets are kept relative to the reader index, so the
 * buffer may be compacted between calls as long as unread bytes are not consumed.
 */
public class RespFrameScanner {

    private final RespCodec codec;

    // Bytes past the reader index that belong to fully checked elements
    private int scanned = 0;
    // Elements still expected by each open aggregate, innermost last
    private long[] pending = new long[8];
    private int depth = 0;

    public RespFrameScanner(RespCodec codec) {
        this.codec = codec;
    }

    /**
     * Continues checking the value that starts at the reader index of {@code in}.
     *
     * @return the length in bytes of the value once it is complete, or -1 if more bytes are needed
     * @throws ProtocolException if the bytes are not a valid encoding
     */
    public int scan(ByteBuf in) {
        int base = in.readerIndex();
        int limit = in.writerIndex();

        while (true) {
            int pos = base + scanned;
            if (pos >= limit) return -1;

            RespType type = RespCodec.typeOf(in.getByte(pos));
            if (type == RespType.ARRAY || type == RespType.MAP) codec.checkDepth(depth + 1);
            int end = codec.lineEnd(in, pos + 1);
            if (end == -1) return -1;
            int next = end + 2;

            switch (type) {
                case INTEGER:
                    RespCodec.parseLong(line(in, pos + 1, end), "integer");
                    break;
                case BULK_STRING:
                    int len = codec.bulkLength(line(in, pos + 1, end));
                    if (len >= 0) {
                        if (limit - next < (long) len + 2) return -1;
                        RespCodec.checkPayloadEnd(in, next + len);
                        next += len + 2;
                    }
                    break;
                case ARRAY:
                case MAP:
                    long count = RespCodec.parseCount(line(in, pos + 1, end));
                    if (type == RespType.MAP) count *= 2;
                    if (count > 0) {
                        push(count);
                        scanned = next - base;
                        continue;
                    }
                    break;
                default:
                    break;
            }

            scanned = next - base;
            if (completeElement()) {
                int length = scanned;
                scanned = 0;
                return length;
            }
        }
    }

    int scannedBytes() {
        return scanned;
    }

    private void push(long count) {
        if (depth == pending.length) {
            pending = Arrays.copyOf(pending, depth * 2);
        }
        pending[depth++] = count;
    }

    /**
     * Counts one finished element against the open aggregates.
     *
     * @return true if that finished the outermost value
     */
    private boolean completeElement() {
        while (depth > 0) {
            if (--pending[depth - 1] > 0) return false;
            depth--;
        }
        return true;
    }

    private static String line(ByteBuf in, int from, int end) {
        return in.toString(from, end - from, StandardCharsets.UTF_8);
    }
}
