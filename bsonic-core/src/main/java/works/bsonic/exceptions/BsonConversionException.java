package works.bsonic.exceptions;

/**
 * A value could not be converted to another representation without loss:
 * numeric overflow or inexactness, an unrepresentable date, a timestamp with a
 * non-zero increment, a binary with the wrong subtype for the requested UUID encoding.
 */
public final class BsonConversionException extends BsonException {
	public BsonConversionException(String message) {
		super(message);
	}

	public BsonConversionException(Throwable cause) {
		super(cause);
	}

	public BsonConversionException(String message, Throwable cause) {
		super(message, cause);
	}
}
