package works.bsonic.exceptions;

/**
 * The BSON data disagrees with the Java type it is being mapped to or from,
 * or the Java type itself cannot be mapped.
 */
public final class BsonMappingException extends BsonException {
	public BsonMappingException(String message) {
		super(message);
	}

	public BsonMappingException(Throwable cause) {
		super(cause);
	}

	public BsonMappingException(String message, Throwable cause) {
		super(message, cause);
	}

	public static BsonMappingException invalidType(String actual, String expected) {
		return new BsonMappingException("invalid type: " + actual + ", expected " + expected);
	}

	public static BsonMappingException missingField(String name) {
		return new BsonMappingException("missing field `" + name + "`");
	}
}
