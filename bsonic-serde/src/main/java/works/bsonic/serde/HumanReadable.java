package works.bsonic.serde;

import static java.util.Objects.requireNonNull;

/**
 * Wrapping a value in {@code HumanReadable} makes it, and everything inside it,
 * use human-readable representations: RFC 3339 strings for date-times,
 * hex strings for ObjectIds, canonical strings for UUIDs.
 * <p>
 * Once a subtree is human-readable, nothing inside it can turn the mode back off.
 */
public record HumanReadable<T>(T value) {
	/**
	 * The newtype name that signals the mode switch to serializers and deserializers.
	 * User code must not use this name.
	 */
	public static final String NEWTYPE_NAME = "$__bsonic_private_human_readable";

	public HumanReadable {
		requireNonNull(value);
	}
}
