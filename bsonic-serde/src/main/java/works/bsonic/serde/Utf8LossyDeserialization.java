package works.bsonic.serde;

import static java.util.Objects.requireNonNull;

/**
 * When deserializing from bytes, invalid UTF-8 in any string inside the wrapped value
 * is replaced with U+FFFD instead of causing an error.
 * Keys are still decoded strictly.
 * <p>
 * Has no effect on serialization, or on deserialization from a typed {@link works.bsonic.types.Bson} value.
 */
public record Utf8LossyDeserialization<T>(T value) {
	public static final String NEWTYPE_NAME = "$__bsonic_private_utf8_lossy";

	public Utf8LossyDeserialization {
		requireNonNull(value);
	}
}
