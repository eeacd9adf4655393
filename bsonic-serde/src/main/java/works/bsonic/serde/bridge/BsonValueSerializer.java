package works.bsonic.serde.bridge;

import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawArray;
import works.bsonic.raw.RawDocument;
import works.bsonic.serde.ArraySerializer;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.SerializerOptions;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonNull;
import works.bsonic.types.BsonString;
import works.bsonic.types.Document;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Bson} tree from one value.
 * Each instance accepts exactly one value; retrieve it with {@link #result()}.
 */
public final class BsonValueSerializer implements Serializer {
	private final SerializerOptions options;
	private Bson result = null;

	public BsonValueSerializer(SerializerOptions options) {
		this.options = requireNonNull(options);
	}

	/**
	 * @throws BsonMappingException if nothing was serialized
	 */
	public Bson result() {
		if (result == null) {
			throw new BsonMappingException("No value was serialized");
		}
		return result;
	}

	private void set(Bson value) {
		if (result != null) {
			throw new BsonMappingException("A value was already serialized: " + result);
		}
		result = value;
	}

	@Override
	public boolean isHumanReadable() {
		return options.humanReadable();
	}

	@Override
	public void serializeBoolean(boolean value) {
		set(BsonBoolean.of(value));
	}

	@Override
	public void serializeInt32(int value) {
		set(new BsonInt32(value));
	}

	@Override
	public void serializeInt64(long value) {
		set(new BsonInt64(value));
	}

	@Override
	public void serializeDouble(double value) {
		set(new BsonDouble(value));
	}

	@Override
	public void serializeString(String value) {
		set(new BsonString(value));
	}

	@Override
	public void serializeBytes(byte[] value) {
		set(Binary.generic(value));
	}

	@Override
	public void serializeNull() {
		set(BsonNull.INSTANCE);
	}

	@Override
	public void serializeBson(Bson value) {
		set(requireNonNull(value));
	}

	@Override
	public void serializeRawDocument(RawDocument value) {
		set(value.toDocument());
	}

	@Override
	public void serializeRawArray(RawArray value) {
		set(value.toBsonArray());
	}

	@Override
	public <T> void serializeNewtype(String name, T value, Serialize<? super T> inner) {
		BsonValueSerializer child = new BsonValueSerializer(options.forNewtype(name));
		inner.serialize(value, child);
		set(child.result());
	}

	@Override
	public DocumentSerializer serializeDocument() {
		Document document = new Document();
		return new DocumentSerializer() {
			@Override
			public <T> void field(String key, T value, Serialize<? super T> serialize) {
				try {
					BsonValueSerializer child = new BsonValueSerializer(options);
					serialize.serialize(value, child);
					document.append(key, child.result());
				} catch (BsonException e) {
					ErrorPaths.field(options.trackErrorPath(), e, key);
					throw e;
				}
			}

			@Override
			public void end() {
				set(document);
			}
		};
	}

	@Override
	public ArraySerializer serializeArray() {
		BsonArray array = new BsonArray();
		return new ArraySerializer() {
			@Override
			public <T> void element(T value, Serialize<? super T> serialize) {
				int index = array.size();
				try {
					BsonValueSerializer child = new BsonValueSerializer(options);
					serialize.serialize(value, child);
					array.add(child.result());
				} catch (BsonException e) {
					ErrorPaths.index(options.trackErrorPath(), e, index);
					throw e;
				}
			}

			@Override
			public void end() {
				set(array);
			}
		};
	}
}
