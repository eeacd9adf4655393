package works.bsonic.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * The input bytes are not well-formed BSON.
 * <p>
 * Always fatal to the decode in progress.
 */
public final class BsonFormatException extends BsonException {
	private final Kind kind;
	private final int offset;
	private final String key;
	private final String detail;

	public enum Kind {
		TRUNCATED,
		LENGTH_MISMATCH,
		INVALID_UTF8,
		UNTERMINATED_CSTRING,
		UNRECOGNIZED_ELEMENT_TYPE,
		INVALID_VALUE,
		TRAILING_BYTES,
		EXCESSIVE_NESTING,
	}

	/**
	 * @param offset absolute index into the underlying byte array, or -1 if unknown
	 * @param key the key of the element being decoded, or null if unknown
	 */
	public BsonFormatException(Kind kind, int offset, String key, String message) {
		super(describe(kind, offset, key, message));
		this.kind = requireNonNull(kind);
		this.offset = offset;
		this.key = key;
		this.detail = message;
	}

	public BsonFormatException(Kind kind, int offset, String message) {
		this(kind, offset, null, message);
	}

	public Kind kind() {
		return kind;
	}

	public int offset() {
		return offset;
	}

	/**
	 * @return the key of the offending element, or null if the failure
	 * happened before the key was known
	 */
	public String key() {
		return key;
	}

	/**
	 * @return an equivalent exception that also names the offending key
	 */
	public BsonFormatException withKey(String key) {
		if (this.key != null) {
			return this;
		}
		BsonFormatException result = new BsonFormatException(kind, offset, key, detail);
		result.initCause(this);
		return result;
	}

	private static String describe(Kind kind, int offset, String key, String message) {
		StringBuilder sb = new StringBuilder(kind.name());
		if (offset >= 0) {
			sb.append(" at offset ").append(offset);
		}
		if (key != null) {
			sb.append(" (key \"").append(key).append("\")");
		}
		return sb.append(": ").append(message).toString();
	}
}
