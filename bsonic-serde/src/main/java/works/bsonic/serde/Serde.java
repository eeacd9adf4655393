package works.bsonic.serde;

import static java.util.Objects.requireNonNull;

/**
 * A matched {@link Serialize}/{@link Deserialize} pair for one Java type.
 */
public interface Serde<T> extends Serialize<T>, Deserialize<T> {
	static <T> Serde<T> of(Serialize<T> serialize, Deserialize<T> deserialize) {
		requireNonNull(serialize);
		requireNonNull(deserialize);
		return new Serde<>() {
			@Override
			public void serialize(T value, Serializer serializer) {
				serialize.serialize(value, serializer);
			}

			@Override
			public T deserialize(Deserializer deserializer) {
				return deserialize.deserialize(deserializer);
			}
		};
	}
}
