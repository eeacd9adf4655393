package works.bsonic.serde.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawArray;
import works.bsonic.raw.RawDocument;
import works.bsonic.raw.RawWriter;
import works.bsonic.serde.ArraySerializer;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.SerializerOptions;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;

import static java.util.Objects.requireNonNull;
import static works.bsonic.spec.ElementType.ARRAY;
import static works.bsonic.spec.ElementType.EMBEDDED_DOCUMENT;

/**
 * Appends one value directly to a {@link RawWriter}, with no intermediate tree.
 * <p>
 * Inside a document, the element's type tag is written as a placeholder before the key,
 * and patched once the value announces its type.
 * At the top level, only a document is accepted.
 */
public final class RawSerializer implements Serializer {
	private final RawWriter writer;
	private final SerializerOptions options;
	/**
	 * Where to patch in the element type, or -1 at the top level.
	 */
	private final int tagPosition;
	private boolean written = false;

	public RawSerializer(RawWriter writer, SerializerOptions options) {
		this(writer, options, -1);
	}

	private RawSerializer(RawWriter writer, SerializerOptions options, int tagPosition) {
		this.writer = requireNonNull(writer);
		this.options = requireNonNull(options);
		this.tagPosition = tagPosition;
	}

	/**
	 * @throws BsonMappingException if nothing was serialized
	 */
	public void checkWritten() {
		if (!written) {
			throw new BsonMappingException("No value was serialized");
		}
	}

	private void begin(ElementType type) {
		if (written) {
			throw new BsonMappingException("A value was already serialized");
		}
		written = true;
		if (tagPosition < 0) {
			if (type != EMBEDDED_DOCUMENT) {
				throw new BsonMappingException("Top-level value must be a document; got " + type);
			}
		} else {
			writer.setByte(tagPosition, type.tag());
		}
	}

	@Override
	public boolean isHumanReadable() {
		return options.humanReadable();
	}

	@Override
	public void serializeBoolean(boolean value) {
		begin(ElementType.BOOLEAN);
		writer.writeByte(value ? 1 : 0);
	}

	@Override
	public void serializeInt32(int value) {
		begin(ElementType.INT32);
		writer.writeInt32(value);
	}

	@Override
	public void serializeInt64(long value) {
		begin(ElementType.INT64);
		writer.writeInt64(value);
	}

	@Override
	public void serializeDouble(double value) {
		begin(ElementType.DOUBLE);
		writer.writeDouble(value);
	}

	@Override
	public void serializeString(String value) {
		begin(ElementType.STRING);
		writer.writeString(value);
	}

	@Override
	public void serializeBytes(byte[] value) {
		serializeBson(new Binary(BinarySubtype.GENERIC, value));
	}

	@Override
	public void serializeNull() {
		begin(ElementType.NULL);
	}

	@Override
	public void serializeBson(Bson value) {
		begin(value.elementType());
		writer.writeValue(value);
	}

	@Override
	public void serializeRawDocument(RawDocument value) {
		begin(EMBEDDED_DOCUMENT);
		writer.writeRawDocument(value);
	}

	@Override
	public void serializeRawArray(RawArray value) {
		begin(ARRAY);
		writer.writeRawArray(value);
	}

	@Override
	public <T> void serializeNewtype(String name, T value, Serialize<? super T> inner) {
		if (written) {
			throw new BsonMappingException("A value was already serialized");
		}
		SerializerOptions innerOptions = options.forNewtype(name);
		if (innerOptions != options) {
			LOGGER.trace("Newtype {} switches to {}", name, innerOptions);
		}
		RawSerializer child = new RawSerializer(writer, innerOptions, tagPosition);
		inner.serialize(value, child);
		child.checkWritten();
		written = true;
	}

	@Override
	public DocumentSerializer serializeDocument() {
		begin(EMBEDDED_DOCUMENT);
		int start = writer.startDocument();
		return new DocumentSerializer() {
			@Override
			public <T> void field(String key, T value, Serialize<? super T> serialize) {
				try {
					writeMember(key, value, serialize);
				} catch (BsonException e) {
					ErrorPaths.field(options.trackErrorPath(), e, key);
					throw e;
				}
			}

			@Override
			public void end() {
				writer.endDocument(start);
			}
		};
	}

	@Override
	public ArraySerializer serializeArray() {
		begin(ARRAY);
		int start = writer.startDocument();
		return new ArraySerializer() {
			int index = 0;

			@Override
			public <T> void element(T value, Serialize<? super T> serialize) {
				try {
					writeMember(Integer.toString(index), value, serialize);
				} catch (BsonException e) {
					ErrorPaths.index(options.trackErrorPath(), e, index);
					throw e;
				}
				index++;
			}

			@Override
			public void end() {
				writer.endDocument(start);
			}
		};
	}

	private <T> void writeMember(String key, T value, Serialize<? super T> serialize) {
		int memberTagPosition = writer.size();
		writer.writeByte(0);
		writer.writeCString(key);
		RawSerializer child = new RawSerializer(writer, options, memberTagPosition);
		serialize.serialize(value, child);
		child.checkWritten();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RawSerializer.class);
}
