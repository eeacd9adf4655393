package works.bsonic.spec;

/**
 * The one-byte type tag that precedes every element on the wire.
 */
public enum ElementType {
	DOUBLE(0x01),
	STRING(0x02),
	EMBEDDED_DOCUMENT(0x03),
	ARRAY(0x04),
	BINARY(0x05),
	UNDEFINED(0x06),
	OBJECT_ID(0x07),
	BOOLEAN(0x08),
	DATE_TIME(0x09),
	NULL(0x0A),
	REGULAR_EXPRESSION(0x0B),
	DB_POINTER(0x0C),
	JAVASCRIPT_CODE(0x0D),
	SYMBOL(0x0E),
	JAVASCRIPT_CODE_WITH_SCOPE(0x0F),
	INT32(0x10),
	TIMESTAMP(0x11),
	INT64(0x12),
	DECIMAL128(0x13),
	MAX_KEY(0x7F),
	MIN_KEY(0xFF),
	;

	private final byte tag;

	private static final ElementType[] BY_TAG = new ElementType[256];
	static {
		for (ElementType t : values()) {
			BY_TAG[t.tag & 0xFF] = t;
		}
	}

	ElementType(int tag) {
		this.tag = (byte) tag;
	}

	public byte tag() {
		return tag;
	}

	/**
	 * @return the type with the given tag, or null if the tag is not recognized.
	 */
	public static ElementType fromByte(byte tag) {
		return BY_TAG[tag & 0xFF];
	}

	/**
	 * @return the size of the value payload if it is the same for every value of this type,
	 * or -1 if the payload is length-prefixed or otherwise variable.
	 */
	public int fixedLength() {
		return switch (this) {
			case DOUBLE, DATE_TIME, INT64, TIMESTAMP -> 8;
			case INT32 -> 4;
			case BOOLEAN -> 1;
			case OBJECT_ID -> 12;
			case DECIMAL128 -> 16;
			case UNDEFINED, NULL, MIN_KEY, MAX_KEY -> 0;
			default -> -1;
		};
	}
}
