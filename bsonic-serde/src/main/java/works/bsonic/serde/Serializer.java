package works.bsonic.serde;

import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.raw.RawArray;
import works.bsonic.raw.RawDocument;
import works.bsonic.types.Bson;

/**
 * Receives exactly one value from a {@link Serialize} implementation.
 * <p>
 * Implementations decide what "receiving" means: building a {@link Bson} tree,
 * or appending bytes to a buffer.
 */
public interface Serializer {
	/**
	 * @return true if values should use their textual representation
	 * (RFC 3339 dates, hex ObjectIds, string UUIDs) rather than their native BSON type
	 */
	boolean isHumanReadable();

	void serializeBoolean(boolean value);

	void serializeInt32(int value);

	void serializeInt64(long value);

	/**
	 * An unsigned 32-bit integer, given as its bits. Always fits in an int64.
	 */
	default void serializeU32(int bits) {
		serializeInt64(Integer.toUnsignedLong(bits));
	}

	/**
	 * An unsigned 64-bit integer, given as its bits.
	 *
	 * @throws BsonConversionException if the value exceeds {@link Long#MAX_VALUE}
	 */
	default void serializeU64(long bits) {
		if (bits < 0) {
			throw new BsonConversionException("cannot represent u64 " + Long.toUnsignedString(bits) + " as int64");
		}
		serializeInt64(bits);
	}

	void serializeDouble(double value);

	void serializeString(String value);

	/**
	 * Binary with the generic subtype.
	 */
	void serializeBytes(byte[] value);

	void serializeNull();

	/**
	 * Any already-typed value, including the extended types that have no dedicated method here.
	 */
	void serializeBson(Bson value);

	void serializeRawDocument(RawDocument value);

	void serializeRawArray(RawArray value);

	/**
	 * Serializes {@code value} as though it were not wrapped.
	 * Certain reserved names change how the wrapped value is serialized;
	 * see {@link HumanReadable#NEWTYPE_NAME}.
	 */
	<T> void serializeNewtype(String name, T value, Serialize<? super T> inner);

	DocumentSerializer serializeDocument();

	ArraySerializer serializeArray();
}
