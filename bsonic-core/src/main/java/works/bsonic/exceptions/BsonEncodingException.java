package works.bsonic.exceptions;

/**
 * A value cannot be written because it would violate a wire-format invariant,
 * such as a NUL byte inside a key or regex.
 * Raised before any bytes are written.
 */
public final class BsonEncodingException extends BsonException {
	public BsonEncodingException(String message) {
		super(message);
	}

	public BsonEncodingException(Throwable cause) {
		super(cause);
	}

	public BsonEncodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
