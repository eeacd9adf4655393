package works.bsonic.serde;

import works.bsonic.raw.RawDocument;

/**
 * Settings for one deserialization call.
 *
 * @param humanReadable   start in human-readable mode, as if the root value were wrapped in {@link HumanReadable}
 * @param trackErrorPath  attach the field/index path to errors raised inside nested values
 * @param utf8Lossy       when reading bytes, replace invalid UTF-8 in strings rather than failing,
 *                        as if the root value were wrapped in {@link Utf8LossyDeserialization}
 * @param maxNestingDepth documents and arrays nested deeper than this are rejected
 */
public record DeserializerOptions(
	boolean humanReadable,
	boolean trackErrorPath,
	boolean utf8Lossy,
	int maxNestingDepth
) {
	public static final DeserializerOptions DEFAULT = builder().build();

	public DeserializerOptions {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
		}
	}

	public DeserializerOptions withHumanReadable() {
		return humanReadable ? this : new DeserializerOptions(true, trackErrorPath, utf8Lossy, maxNestingDepth);
	}

	public DeserializerOptions withUtf8Lossy() {
		return utf8Lossy ? this : new DeserializerOptions(humanReadable, trackErrorPath, true, maxNestingDepth);
	}

	/**
	 * Applies the mode switch associated with a reserved newtype name, if any.
	 */
	public DeserializerOptions forNewtype(String name) {
		if (HumanReadable.NEWTYPE_NAME.equals(name)) {
			return withHumanReadable();
		} else if (Utf8LossyDeserialization.NEWTYPE_NAME.equals(name)) {
			return withUtf8Lossy();
		} else {
			return this;
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private boolean humanReadable = false;
		private boolean trackErrorPath = true;
		private boolean utf8Lossy = false;
		private int maxNestingDepth = RawDocument.MAX_NESTING_DEPTH;

		private Builder() { }

		public Builder humanReadable(boolean humanReadable) {
			this.humanReadable = humanReadable;
			return this;
		}

		public Builder trackErrorPath(boolean trackErrorPath) {
			this.trackErrorPath = trackErrorPath;
			return this;
		}

		public Builder utf8Lossy(boolean utf8Lossy) {
			this.utf8Lossy = utf8Lossy;
			return this;
		}

		public Builder maxNestingDepth(int maxNestingDepth) {
			this.maxNestingDepth = maxNestingDepth;
			return this;
		}

		public DeserializerOptions build() {
			return new DeserializerOptions(humanReadable, trackErrorPath, utf8Lossy, maxNestingDepth);
		}
	}
}
