package works.bsonic.serde;

/**
 * Settings for one serialization call.
 *
 * @param humanReadable  start in human-readable mode, as if the root value were wrapped in {@link HumanReadable}
 * @param trackErrorPath attach the field/index path to errors raised inside nested values
 */
public record SerializerOptions(
	boolean humanReadable,
	boolean trackErrorPath
) {
	public static final SerializerOptions DEFAULT = builder().build();

	public SerializerOptions withHumanReadable() {
		return humanReadable ? this : new SerializerOptions(true, trackErrorPath);
	}

	/**
	 * Applies the mode switch associated with a reserved newtype name, if any.
	 */
	public SerializerOptions forNewtype(String name) {
		return HumanReadable.NEWTYPE_NAME.equals(name) ? withHumanReadable() : this;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private boolean humanReadable = false;
		private boolean trackErrorPath = true;

		private Builder() { }

		public Builder humanReadable(boolean humanReadable) {
			this.humanReadable = humanReadable;
			return this;
		}

		public Builder trackErrorPath(boolean trackErrorPath) {
			this.trackErrorPath = trackErrorPath;
			return this;
		}

		public SerializerOptions build() {
			return new SerializerOptions(humanReadable, trackErrorPath);
		}
	}
}
