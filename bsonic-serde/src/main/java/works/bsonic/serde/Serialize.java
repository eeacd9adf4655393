package works.bsonic.serde;

/**
 * Writes a value of type {@code T} by making exactly one call on a {@link Serializer}.
 */
@FunctionalInterface
public interface Serialize<T> {
	void serialize(T value, Serializer serializer);
}
