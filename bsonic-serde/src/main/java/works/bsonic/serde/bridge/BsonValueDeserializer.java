package works.bsonic.serde.bridge;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawArrayBuf;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.serde.ArrayAccess;
import works.bsonic.serde.Deserialize;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.DeserializerOptions;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.Visitor;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonString;
import works.bsonic.types.Document;

import static java.util.Objects.requireNonNull;
import static works.bsonic.exceptions.BsonFormatException.Kind.EXCESSIVE_NESTING;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRAILING_BYTES;

/**
 * Supplies one value from an already-decoded {@link Bson} tree.
 * <p>
 * The {@link DeserializerOptions#utf8Lossy() utf8Lossy} option has no effect here,
 * because the strings have already been decoded.
 */
public final class BsonValueDeserializer implements Deserializer {
	private final Bson value;
	private final DeserializerOptions options;
	private final int depth;

	public BsonValueDeserializer(Bson value, DeserializerOptions options) {
		this(value, options, 0);
	}

	private BsonValueDeserializer(Bson value, DeserializerOptions options, int depth) {
		this.value = requireNonNull(value);
		this.options = requireNonNull(options);
		this.depth = depth;
	}

	@Override
	public boolean isHumanReadable() {
		return options.humanReadable();
	}

	@Override
	public <T> T deserializeAny(Visitor<T> visitor) {
		switch (value.elementType()) {
			case BOOLEAN:
				return visitor.visitBoolean(((BsonBoolean) value).value());
			case INT32:
				return visitor.visitInt32(((BsonInt32) value).value());
			case INT64:
				return visitor.visitInt64(((BsonInt64) value).value());
			case DOUBLE:
				return visitor.visitDouble(((BsonDouble) value).value());
			case STRING:
				return visitor.visitString(((BsonString) value).value());
			case BINARY:
				return visitor.visitBinary((Binary) value);
			case NULL:
				return visitor.visitNull();
			case EMBEDDED_DOCUMENT:
				checkDepth();
				return visitDocument((Document) value, visitor);
			case ARRAY:
				checkDepth();
				return visitArray((BsonArray) value, visitor);
			default:
				return visitor.visitOther(value);
		}
	}

	private void checkDepth() {
		if (depth > options.maxNestingDepth()) {
			throw new BsonFormatException(EXCESSIVE_NESTING, -1, "nesting exceeds " + options.maxNestingDepth() + " levels");
		}
	}

	private <T> T visitDocument(Document document, Visitor<T> visitor) {
		Iterator<Map.Entry<String, Bson>> entries = document.iterator();
		var access = new DocumentAccess() {
			Map.Entry<String, Bson> current = null;

			@Override
			public String nextKey() {
				if (current != null) {
					throw new IllegalStateException("Value for key \"" + current.getKey() + "\" was not consumed");
				}
				if (entries.hasNext()) {
					current = entries.next();
					return current.getKey();
				} else {
					return null;
				}
			}

			@Override
			public <V> V nextValue(Deserialize<V> deserialize) {
				Map.Entry<String, Bson> entry = take();
				try {
					return deserialize.deserialize(child(entry.getValue()));
				} catch (BsonException e) {
					ErrorPaths.field(options.trackErrorPath(), e, entry.getKey());
					throw e;
				}
			}

			@Override
			public void skipValue() {
				take();
			}

			private Map.Entry<String, Bson> take() {
				if (current == null) {
					throw new IllegalStateException("No key has been read");
				}
				Map.Entry<String, Bson> result = current;
				current = null;
				return result;
			}
		};
		T result = visitor.visitDocument(access);
		if (access.current != null || entries.hasNext()) {
			throw new BsonFormatException(TRAILING_BYTES, -1, "document has entries that were not consumed while deserializing " + visitor.expecting());
		}
		return result;
	}

	private <T> T visitArray(BsonArray array, Visitor<T> visitor) {
		Iterator<Bson> elements = array.iterator();
		T result = visitor.visitArray(new ArrayAccess() {
			int index = 0;

			@Override
			public boolean hasNext() {
				return elements.hasNext();
			}

			@Override
			public <V> V nextElement(Deserialize<V> deserialize) {
				Bson element = elements.next();
				int i = index++;
				try {
					return deserialize.deserialize(child(element));
				} catch (BsonException e) {
					ErrorPaths.index(options.trackErrorPath(), e, i);
					throw e;
				}
			}
		});
		if (elements.hasNext()) {
			throw new BsonFormatException(TRAILING_BYTES, -1, "array has elements that were not consumed while deserializing " + visitor.expecting());
		}
		return result;
	}

	private BsonValueDeserializer child(Bson childValue) {
		return new BsonValueDeserializer(childValue, options, depth + 1);
	}

	@Override
	public <T> T deserializeNewtype(String name, Deserialize<T> inner) {
		return inner.deserialize(new BsonValueDeserializer(value, options.forNewtype(name), depth));
	}

	@Override
	public <T> Optional<T> deserializeOption(Deserialize<T> inner) {
		if (value.elementType() == ElementType.NULL) {
			return Optional.empty();
		}
		return Optional.ofNullable(inner.deserialize(this));
	}

	@Override
	public RawDocumentBuf deserializeRawDocumentBuf() {
		if (value instanceof Document d) {
			return RawDocumentBuf.fromDocument(d);
		}
		throw BsonMappingException.invalidType(value.elementType().toString(), "a document");
	}

	@Override
	public RawArrayBuf deserializeRawArrayBuf() {
		if (value instanceof BsonArray a) {
			return RawArrayBuf.fromBsonArray(a);
		}
		throw BsonMappingException.invalidType(value.elementType().toString(), "an array");
	}
}
