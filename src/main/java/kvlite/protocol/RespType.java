package kvlite.protocol;

/**
 * The six value kinds of the wire protocol, keyed by their leading tag byte.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*'),
    MAP('%');

    private static final RespType[] BY_TAG = new RespType[128];

    static {
        for (RespType type : values()) {
            BY_TAG[type.tag] = type;
        }
    }

    private final byte tag;

    RespType(char tag) {
        this.tag = (byte) tag;
    }

    public byte getTag() {
        return tag;
    }

    /**
     * Returns the type for a tag byte, or null if the byte is not a known tag.
     */
    public static RespType fromTag(byte tag) {
        if (tag < 0) return null;
        return BY_TAG[tag];
    }
}
