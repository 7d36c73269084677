package kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts between protocol bytes held in a {@link ByteBuf} and {@link RespValue}s.
 * <p>
 * Decoding is incremental: {@link #decode(ByteBuf)} either consumes exactly the bytes of one
 * complete value or, if the buffer does not hold a whole value yet, consumes nothing and returns
 * null. Malformed input fails with {@link ProtocolException}.
 */
public class RespCodec {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    // Aggregates are not presized past this, the count on the wire is untrusted.
    private static final int MAX_INITIAL_CAPACITY = 16;

    private final int maxNestingDepth;
    private final int maxBulkLength;
    private final int maxLineLength;

    public RespCodec() {
        this(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_LINE_LENGTH);
    }

    public RespCodec(int maxNestingDepth, int maxBulkLength, int maxLineLength) {
        if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        if (maxBulkLength < 0) throw new IllegalArgumentException("maxBulkLength must be >= 0");
        if (maxLineLength < 1) throw new IllegalArgumentException("maxLineLength must be >= 1");
        this.maxNestingDepth = maxNestingDepth;
        this.maxBulkLength = maxBulkLength;
        this.maxLineLength = maxLineLength;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    // --- DECODING ---

    /**
     * Decodes one value from the readable bytes of {@code in}.
     *
     * @return the value, or null if more bytes are needed (the reader index is left untouched)
     * @throws ProtocolException if the bytes are not a valid encoding
     */
    public RespValue decode(ByteBuf in) {
        int start = in.readerIndex();
        RespValue value = readValue(in, 0);
        if (value == null) {
            in.readerIndex(start);
        }
        return value;
    }

    private RespValue readValue(ByteBuf in, int depth) {
        if (!in.isReadable()) return null;

        RespType type = typeOf(in.readByte());

        String line;
        switch (type) {
            case SIMPLE_STRING:
                line = readLine(in);
                return line == null ? null : RespValue.simpleString(line);
            case ERROR:
                line = readLine(in);
                return line == null ? null : RespValue.error(line);
            case INTEGER:
                line = readLine(in);
                return line == null ? null : RespValue.integer(parseLong(line, "integer"));
            case BULK_STRING:
                return readBulkString(in);
            case ARRAY:
                return readArray(in, depth + 1);
            case MAP:
                return readMap(in, depth + 1);
            default:
                throw new ProtocolException("Bad Request: unsupported type " + type);
        }
    }

    private RespValue readBulkString(ByteBuf in) {
        String line = readLine(in);
        if (line == null) return null;

        int len = bulkLength(line);
        if (len == -1) return RespValue.nullBulkString();
        if (in.readableBytes() < (long) len + CRLF.length) return null;

        byte[] payload = new byte[len];
        in.readBytes(payload);
        checkPayloadEnd(in, in.readerIndex());
        in.skipBytes(CRLF.length);
        return RespValue.bulkString(payload);
    }

    private RespValue readArray(ByteBuf in, int depth) {
        checkDepth(depth);
        String line = readLine(in);
        if (line == null) return null;

        int count = parseCount(line);
        List<RespValue> elements = new ArrayList<>(Math.min(count, MAX_INITIAL_CAPACITY));
        for (int i = 0; i < count; i++) {
            RespValue element = readValue(in, depth);
            if (element == null) return null;
            elements.add(element);
        }
        return RespValue.array(elements);
    }

    private RespValue readMap(ByteBuf in, int depth) {
        checkDepth(depth);
        String line = readLine(in);
        if (line == null) return null;

        int count = parseCount(line);
        List<Map.Entry<RespValue, RespValue>> entries = new ArrayList<>(Math.min(count, MAX_INITIAL_CAPACITY));
        for (int i = 0; i < count; i++) {
            RespValue key = readValue(in, depth);
            if (key == null) return null;
            RespValue value = readValue(in, depth);
            if (value == null) return null;
            entries.add(RespValue.entry(key, value));
        }
        return RespValue.map(entries);
    }

    static RespType typeOf(byte tag) {
        RespType type = RespType.fromTag(tag);
        if (type == null) {
            throw new ProtocolException(String.format("Bad Request: unknown type tag 0x%02x", tag & 0xff));
        }
        return type;
    }

    void checkDepth(int depth) {
        if (depth > maxNestingDepth) {
            throw new ProtocolException("Bad Request: nesting deeper than " + maxNestingDepth);
        }
    }

    /**
     * Reads up to the next CRLF and returns the text before it, or null if no complete line is
     * buffered yet.
     */
    private String readLine(ByteBuf in) {
        int start = in.readerIndex();
        int end = lineEnd(in, start);
        if (end == -1) return null;

        String line = in.toString(start, end - start, StandardCharsets.UTF_8);
        in.readerIndex(end + CRLF.length);
        return line;
    }

    /**
     * Finds the line starting at {@code from}.
     *
     * @return index of the CR that ends the line, or -1 if its LF is not buffered yet
     */
    int lineEnd(ByteBuf in, int from) {
        int eol = in.indexOf(from, in.writerIndex(), LF);
        if (eol == -1) {
            // One byte of slack for a CR whose LF is still in flight
            if (in.writerIndex() - from > maxLineLength + 1) {
                throw new ProtocolException("Bad Request: line longer than " + maxLineLength + " bytes");
            }
            return -1;
        }
        if (eol == from || in.getByte(eol - 1) != CR) {
            throw new ProtocolException("Bad Request: line not terminated by CRLF");
        }

        int end = eol - 1;
        if (end - from > maxLineLength) {
            throw new ProtocolException("Bad Request: line longer than " + maxLineLength + " bytes");
        }
        if (in.indexOf(from, end, CR) != -1) {
            throw new ProtocolException("Bad Request: stray CR inside line");
        }
        return end;
    }

    /**
     * @return the payload length, or -1 for the absent bulk string
     */
    int bulkLength(String line) {
        long length = parseLong(line, "bulk length");
        if (length == -1) return -1;
        if (length < 0 || length > maxBulkLength) {
            throw new ProtocolException("Bad Request: invalid bulk length " + length);
        }
        return (int) length;
    }

    static void checkPayloadEnd(ByteBuf in, int index) {
        if (in.getByte(index) != CR || in.getByte(index + 1) != LF) {
            throw new ProtocolException("Bad Request: bulk string not terminated by CRLF");
        }
    }

    static long parseLong(String line, String what) {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Bad Request: invalid " + what + " '" + line + "'", e);
        }
    }

    static int parseCount(String line) {
        long count = parseLong(line, "count");
        if (count == -1) return 0;
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new ProtocolException("Bad Request: invalid count " + count);
        }
        return (int) count;
    }

    // --- ENCODING ---

    /**
     * Appends the encoding of {@code msg} to {@code out}. A null message is written as the absent
     * bulk string.
     *
     * @throws UnrecognizedTypeException if {@code msg} is not a {@link RespValue}
     */
    public void encode(Object msg, ByteBuf out) {
        if (msg == null) {
            out.writeBytes(NULL_BULK);
            return;
        }
        if (!(msg instanceof RespValue)) {
            throw new UnrecognizedTypeException(msg);
        }

        RespValue value = (RespValue) msg;
        switch (value.type()) {
            case SIMPLE_STRING:
                writeLine(out, RespType.SIMPLE_STRING, ((RespValue.SimpleString) value).getValue());
                break;
            case ERROR:
                writeLine(out, RespType.ERROR, ((RespValue.RespError) value).getMessage());
                break;
            case INTEGER:
                writeHeader(out, RespType.INTEGER, ((RespValue.RespInteger) value).getValue());
                break;
            case BULK_STRING:
                RespValue.BulkString bulk = (RespValue.BulkString) value;
                if (bulk.isNull()) {
                    out.writeBytes(NULL_BULK);
                } else {
                    writeHeader(out, RespType.BULK_STRING, bulk.getBytes().length);
                    out.writeBytes(bulk.getBytes());
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                RespValue.RespArray array = (RespValue.RespArray) value;
                writeHeader(out, RespType.ARRAY, array.size());
                for (RespValue element : array.getElements()) {
                    encode(element, out);
                }
                break;
            case MAP:
                RespValue.RespMap map = (RespValue.RespMap) value;
                writeHeader(out, RespType.MAP, map.size());
                for (Map.Entry<RespValue, RespValue> e : map.getEntries()) {
                    encode(e.getKey(), out);
                    encode(e.getValue(), out);
                }
                break;
            default:
                throw new UnrecognizedTypeException(value);
        }
    }

    /**
     * Encodes {@code msg} into a fresh byte array.
     */
    public byte[] encode(Object msg) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(msg, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    private static void writeLine(ByteBuf out, RespType type, String text) {
        out.writeByte(type.getTag());
        out.writeCharSequence(text, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    private static void writeHeader(ByteBuf out, RespType type, long number) {
        out.writeByte(type.getTag());
        out.writeCharSequence(Long.toString(number), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
