package kvlite.protocol;

import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully materialized protocol value.
 * <p>
 * The hierarchy is closed: the constructor is private, so the six nested classes are the only
 * variants and {@link #type()} can be switched over exhaustively.
 */
public abstract class RespValue {

    private RespValue() { }

    public abstract RespType type();

    // --- FACTORIES ---

    public static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    public static RespError error(String message) {
        return new RespError(message);
    }

    public static RespInteger integer(long value) {
        return new RespInteger(value);
    }

    public static BulkString bulkString(byte[] bytes) {
        return bytes == null ? BulkString.NULL : new BulkString(bytes);
    }

    public static BulkString bulkString(String text) {
        return text == null ? BulkString.NULL : new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    public static BulkString nullBulkString() {
        return BulkString.NULL;
    }

    public static RespArray array(List<? extends RespValue> elements) {
        return new RespArray(elements);
    }

    public static RespArray array(RespValue... elements) {
        return new RespArray(Arrays.asList(elements));
    }

    public static RespMap map(List<Map.Entry<RespValue, RespValue>> entries) {
        return new RespMap(entries);
    }

    public static Map.Entry<RespValue, RespValue> entry(RespValue key, RespValue value) {
        return new AbstractMap.SimpleImmutableEntry<>(key, value);
    }

    // --- VARIANTS ---

    public static final class SimpleString extends RespValue {
        private final String value;

        private SimpleString(String value) {
            Objects.requireNonNull(value, "value");
            if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("simple string must not contain CR or LF");
            }
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public RespType type() {
            return RespType.SIMPLE_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SimpleString && value.equals(((SimpleString) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "+" + value;
        }
    }

    /**
     * A failure carried back to the caller as a value. CR and LF in the message are replaced by
     * spaces so the message always fits on one protocol line.
     */
    public static final class RespError extends RespValue {
        private final String message;

        private RespError(String message) {
            Objects.requireNonNull(message, "message");
            this.message = message.replace('\r', ' ').replace('\n', ' ');
        }

        public String getMessage() {
            return message;
        }

        @Override
        public RespType type() {
            return RespType.ERROR;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RespError && message.equals(((RespError) o).message);
        }

        @Override
        public int hashCode() {
            return 31 + message.hashCode();
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }

    public static final class RespInteger extends RespValue {
        private final long value;

        private RespInteger(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public RespType type() {
            return RespType.INTEGER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RespInteger && value == ((RespInteger) o).value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return ":" + value;
        }
    }

    /**
     * Length-prefixed byte string. The absent marker ({@code $-1}) is {@link #NULL}, which is
     * distinct from an empty string.
     */
    public static final class BulkString extends RespValue {
        static final BulkString NULL = new BulkString(null);

        private final byte[] bytes;

        private BulkString(byte[] bytes) {
            this.bytes = bytes;
        }

        public boolean isNull() {
            return bytes == null;
        }

        /** Raw payload, or null for the absent marker. The array is not copied. */
        public byte[] getBytes() {
            return bytes;
        }

        public String asString() {
            return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public RespType type() {
            return RespType.BULK_STRING;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkString && Arrays.equals(bytes, ((BulkString) o).bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return bytes == null ? "$(nil)" : "$\"" + asString() + "\"";
        }
    }

    public static final class RespArray extends RespValue {
        private final List<RespValue> elements;

        private RespArray(List<? extends RespValue> elements) {
            Objects.requireNonNull(elements, "elements");
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<RespValue> getElements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        public RespValue get(int index) {
            return elements.get(index);
        }

        @Override
        public RespType type() {
            return RespType.ARRAY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RespArray && elements.equals(((RespArray) o).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "*" + elements;
        }
    }

    /**
     * Ordered key/value pairs. Arrival order is kept and duplicate keys are not collapsed.
     */
    public static final class RespMap extends RespValue {
        private final List<Map.Entry<RespValue, RespValue>> entries;

        private RespMap(List<Map.Entry<RespValue, RespValue>> entries) {
            Objects.requireNonNull(entries, "entries");
            this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        }

        public List<Map.Entry<RespValue, RespValue>> getEntries() {
            return entries;
        }

        public int size() {
            return entries.size();
        }

        /** First value stored under {@code key}, or null. */
        public RespValue get(RespValue key) {
            for (Map.Entry<RespValue, RespValue> e : entries) {
                if (e.getKey().equals(key)) return e.getValue();
            }
            return null;
        }

        @Override
        public RespType type() {
            return RespType.MAP;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RespMap && entries.equals(((RespMap) o).entries);
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return "%" + entries;
        }
    }
}
