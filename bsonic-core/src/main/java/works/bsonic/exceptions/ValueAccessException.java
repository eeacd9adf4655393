package works.bsonic.exceptions;

/**
 * A typed getter on a document was asked for a key that is absent
 * or holds a value of a different type.
 */
public final class ValueAccessException extends BsonException {
	private final Kind kind;
	private final String key;

	public enum Kind {
		NOT_PRESENT,
		UNEXPECTED_TYPE,
	}

	/**
	 * @param key the key being accessed, or null for a value accessed directly
	 */
	public ValueAccessException(Kind kind, String key, String message) {
		super(key == null ? message : "key \"" + key + "\": " + message);
		this.kind = kind;
		this.key = key;
	}

	public static ValueAccessException notPresent(String key) {
		return new ValueAccessException(Kind.NOT_PRESENT, key, "not present");
	}

	public static ValueAccessException unexpectedType(String key, Object actual, Object expected) {
		return new ValueAccessException(Kind.UNEXPECTED_TYPE, key, "expected " + expected + " but found " + actual);
	}

	public Kind kind() {
		return kind;
	}

	public String key() {
		return key;
	}
}
