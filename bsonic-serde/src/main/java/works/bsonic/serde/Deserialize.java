package works.bsonic.serde;

/**
 * Reads a value of type {@code T} by making exactly one call on a {@link Deserializer}.
 */
@FunctionalInterface
public interface Deserialize<T> {
	T deserialize(Deserializer deserializer);
}
