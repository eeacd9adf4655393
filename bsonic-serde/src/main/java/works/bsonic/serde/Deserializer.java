package works.bsonic.serde;

import java.util.Optional;
import works.bsonic.raw.RawArrayBuf;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.types.Bson;

/**
 * Supplies exactly one value to a {@link Deserialize} implementation,
 * by calling back into a {@link Visitor} with whatever kind of value is present.
 */
public interface Deserializer {
	boolean isHumanReadable();

	<T> T deserializeAny(Visitor<T> visitor);

	/**
	 * Counterpart of {@link Serializer#serializeNewtype}.
	 */
	<T> T deserializeNewtype(String name, Deserialize<T> inner);

	/**
	 * @return empty if the value is BSON null; otherwise the result of {@code inner}
	 */
	<T> Optional<T> deserializeOption(Deserialize<T> inner);

	/**
	 * @throws works.bsonic.exceptions.BsonMappingException if the value is not a document
	 */
	RawDocumentBuf deserializeRawDocumentBuf();

	/**
	 * @throws works.bsonic.exceptions.BsonMappingException if the value is not an array
	 */
	RawArrayBuf deserializeRawArrayBuf();

	/**
	 * Materializes the whole value.
	 */
	default Bson deserializeBson() {
		return deserializeAny(new BsonVisitor());
	}
}
