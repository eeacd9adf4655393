package works.bsonic.serde;

import java.lang.reflect.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawDocument;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.raw.RawWriter;
import works.bsonic.serde.bridge.BsonValueDeserializer;
import works.bsonic.serde.bridge.BsonValueSerializer;
import works.bsonic.serde.bridge.RawDeserializer;
import works.bsonic.serde.bridge.RawSerializer;
import works.bsonic.serde.mapping.SerdeRegistry;
import works.bsonic.types.Bson;
import works.bsonic.types.Document;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for converting Java objects to and from BSON.
 * <p>
 * There are two routes. The typed route builds or reads a {@link Bson} tree.
 * The raw route writes or reads encoded bytes directly, with no intermediate tree;
 * the top-level value on the raw route must be a document.
 * <p>
 * Thread-safe as long as the {@link SerdeRegistry} is not modified concurrently with use.
 */
public class BsonSerde {
	private final SerdeRegistry registry;

	public BsonSerde() {
		this(new SerdeRegistry());
	}

	public BsonSerde(SerdeRegistry registry) {
		this.registry = requireNonNull(registry);
	}

	public SerdeRegistry registry() {
		return registry;
	}

	//
	// Serialization to the typed model
	//

	public <T> Bson serializeToBson(T value, Serialize<? super T> serialize, SerializerOptions options) {
		LOGGER.debug("serializeToBson {} with {}", describe(value), options);
		BsonValueSerializer serializer = new BsonValueSerializer(options);
		serialize.serialize(value, serializer);
		return serializer.result();
	}

	public <T> Bson serializeToBson(T value, Class<T> type) {
		return serializeToBson(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public <T> Bson serializeToBson(T value, TypeReference<T> type) {
		return serializeToBson(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	/**
	 * Uses the mapping for the value's runtime class.
	 */
	public Bson serializeToBson(Object value) {
		return serializeToBson(value, SerializerOptions.DEFAULT);
	}

	public Bson serializeToBson(Object value, SerializerOptions options) {
		return serializeToBson(value, runtimeSerde(value), options);
	}

	/**
	 * @throws BsonMappingException if the value does not serialize to a document
	 */
	public <T> Document serializeToDocument(T value, Serialize<? super T> serialize, SerializerOptions options) {
		Bson result = serializeToBson(value, serialize, options);
		if (result instanceof Document document) {
			return document;
		}
		throw BsonMappingException.invalidType(result.elementType().toString(), "a document");
	}

	public <T> Document serializeToDocument(T value, Class<T> type) {
		return serializeToDocument(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public <T> Document serializeToDocument(T value, TypeReference<T> type) {
		return serializeToDocument(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public Document serializeToDocument(Object value) {
		return serializeToDocument(value, runtimeSerde(value), SerializerOptions.DEFAULT);
	}

	//
	// Serialization to bytes
	//

	/**
	 * @throws BsonMappingException if the value does not serialize to a document
	 */
	public <T> RawDocumentBuf serializeToRawDocumentBuf(T value, Serialize<? super T> serialize, SerializerOptions options) {
		return RawDocumentBuf.fromBytes(serializeToBytes(value, serialize, options));
	}

	public <T> RawDocumentBuf serializeToRawDocumentBuf(T value, Class<T> type) {
		return serializeToRawDocumentBuf(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public <T> RawDocumentBuf serializeToRawDocumentBuf(T value, TypeReference<T> type) {
		return serializeToRawDocumentBuf(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public RawDocumentBuf serializeToRawDocumentBuf(Object value) {
		return serializeToRawDocumentBuf(value, runtimeSerde(value), SerializerOptions.DEFAULT);
	}

	/**
	 * @throws BsonMappingException if the value does not serialize to a document
	 */
	public <T> byte[] serializeToBytes(T value, Serialize<? super T> serialize, SerializerOptions options) {
		LOGGER.debug("serializeToBytes {} with {}", describe(value), options);
		RawWriter writer = new RawWriter();
		RawSerializer serializer = new RawSerializer(writer, options);
		serialize.serialize(value, serializer);
		serializer.checkWritten();
		return writer.toByteArray();
	}

	public <T> byte[] serializeToBytes(T value, Class<T> type) {
		return serializeToBytes(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public <T> byte[] serializeToBytes(T value, TypeReference<T> type) {
		return serializeToBytes(value, registry.serdeFor(type), SerializerOptions.DEFAULT);
	}

	public byte[] serializeToBytes(Object value) {
		return serializeToBytes(value, SerializerOptions.DEFAULT);
	}

	public byte[] serializeToBytes(Object value, SerializerOptions options) {
		return serializeToBytes(value, runtimeSerde(value), options);
	}

	//
	// Deserialization from the typed model
	//

	public <T> T deserializeFromBson(Bson value, Deserialize<T> deserialize, DeserializerOptions options) {
		LOGGER.debug("deserializeFromBson {} with {}", value.elementType(), options);
		return deserialize.deserialize(new BsonValueDeserializer(value, options));
	}

	public <T> T deserializeFromBson(Bson value, Class<T> type) {
		return deserializeFromBson(value, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromBson(Bson value, TypeReference<T> type) {
		return deserializeFromBson(value, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromBson(Bson value, Class<T> type, DeserializerOptions options) {
		return deserializeFromBson(value, registry.serdeFor(type), options);
	}

	public <T> T deserializeFromDocument(Document document, Deserialize<T> deserialize, DeserializerOptions options) {
		return deserializeFromBson(document, deserialize, options);
	}

	public <T> T deserializeFromDocument(Document document, Class<T> type) {
		return deserializeFromBson(document, type);
	}

	public <T> T deserializeFromDocument(Document document, TypeReference<T> type) {
		return deserializeFromBson(document, type);
	}

	//
	// Deserialization from bytes
	//

	public <T> T deserializeFromRawDocument(RawDocument document, Deserialize<T> deserialize, DeserializerOptions options) {
		LOGGER.debug("deserializeFromRawDocument ({} bytes) with {}", document.length(), options);
		return deserialize.deserialize(new RawDeserializer(document, options));
	}

	public <T> T deserializeFromRawDocument(RawDocument document, Class<T> type) {
		return deserializeFromRawDocument(document, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromRawDocument(RawDocument document, TypeReference<T> type) {
		return deserializeFromRawDocument(document, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromRawDocument(RawDocument document, Class<T> type, DeserializerOptions options) {
		return deserializeFromRawDocument(document, registry.serdeFor(type), options);
	}

	/**
	 * @throws works.bsonic.exceptions.BsonFormatException if the bytes are not a well-formed document
	 */
	public <T> T deserializeFromBytes(byte[] bytes, Deserialize<T> deserialize, DeserializerOptions options) {
		return deserializeFromRawDocument(RawDocument.fromBytes(bytes), deserialize, options);
	}

	public <T> T deserializeFromBytes(byte[] bytes, Class<T> type) {
		return deserializeFromBytes(bytes, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromBytes(byte[] bytes, TypeReference<T> type) {
		return deserializeFromBytes(bytes, registry.serdeFor(type), DeserializerOptions.DEFAULT);
	}

	public <T> T deserializeFromBytes(byte[] bytes, Class<T> type, DeserializerOptions options) {
		return deserializeFromBytes(bytes, registry.serdeFor(type), options);
	}

	@SuppressWarnings("unchecked")
	private Serde<Object> runtimeSerde(Object value) {
		return (Serde<Object>) registry.serdeFor((Type) value.getClass());
	}

	private static String describe(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BsonSerde.class);
}
