package works.bsonic.exceptions;

import java.util.Optional;

/**
 * Root of every failure raised while reading, writing, or mapping BSON.
 * <p>
 * Carries an optional {@link ErrorPath} locating the failure within a nested value.
 * The path is built up as the exception unwinds through enclosing documents and arrays,
 * so code that catches and rethrows should call {@link #prependPathSegment} rather than wrapping.
 */
public sealed abstract class BsonException extends RuntimeException permits
	BsonFormatException,
	BsonConversionException,
	BsonEncodingException,
	BsonMappingException,
	ValueAccessException
{
	private ErrorPath path = null;

	protected BsonException(String message) {
		super(message);
	}

	protected BsonException(Throwable cause) {
		super(cause);
	}

	protected BsonException(String message, Throwable cause) {
		super(message, cause);
	}

	public Optional<ErrorPath> path() {
		return Optional.ofNullable(path);
	}

	/**
	 * Records that this failure happened inside the given field or element.
	 * Called innermost-first.
	 */
	public void prependPathSegment(ErrorPath.Segment segment) {
		path = (path == null) ? ErrorPath.of(segment) : path.prepend(segment);
	}

	@Override
	public String getMessage() {
		String message = super.getMessage();
		if (path == null) {
			return message;
		} else {
			return "at \"" + path + "\": " + message;
		}
	}
}
