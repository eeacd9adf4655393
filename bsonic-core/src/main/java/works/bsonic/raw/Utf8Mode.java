package works.bsonic.raw;

/**
 * How string payloads are decoded. Keys are always decoded strictly.
 */
public enum Utf8Mode {
	/**
	 * Invalid UTF-8 is a {@link works.bsonic.exceptions.BsonFormatException.Kind#INVALID_UTF8 format error}.
	 */
	STRICT,
	/**
	 * Invalid sequences are replaced with U+FFFD.
	 */
	LOSSY,
}
