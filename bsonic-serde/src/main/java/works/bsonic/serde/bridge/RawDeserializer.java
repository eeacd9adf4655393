package works.bsonic.serde.bridge;

import java.util.Optional;
import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawArrayBuf;
import works.bsonic.raw.RawBsonRef;
import works.bsonic.raw.RawDocument;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.raw.RawElement;
import works.bsonic.raw.RawElementIterator;
import works.bsonic.raw.Utf8Mode;
import works.bsonic.serde.ArrayAccess;
import works.bsonic.serde.Deserialize;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.DeserializerOptions;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.Visitor;
import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;
import static works.bsonic.exceptions.BsonFormatException.Kind.EXCESSIVE_NESTING;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRAILING_BYTES;

/**
 * Supplies one value directly from encoded bytes, without building a {@link works.bsonic.types.Bson} tree.
 * <p>
 * Elements are validated as they are reached, so a malformed element is reported
 * only if deserialization gets that far.
 * String contents are decoded when a visitor asks for them, using
 * the UTF-8 mode in effect at that point.
 * Skipped values are validated in full, strings included, before moving on.
 */
public final class RawDeserializer implements Deserializer {
	/**
	 * Null for the top-level document.
	 */
	private final RawBsonRef ref;
	private final RawDocument root;
	private final DeserializerOptions options;
	private final int depth;

	public RawDeserializer(RawDocument root, DeserializerOptions options) {
		this(null, requireNonNull(root), options, 0);
	}

	private RawDeserializer(RawBsonRef ref, RawDocument root, DeserializerOptions options, int depth) {
		this.ref = ref;
		this.root = root;
		this.options = requireNonNull(options);
		this.depth = depth;
	}

	private Utf8Mode utf8Mode() {
		return options.utf8Lossy() ? Utf8Mode.LOSSY : Utf8Mode.STRICT;
	}

	private ElementType type() {
		return ref == null ? ElementType.EMBEDDED_DOCUMENT : ref.elementType();
	}

	@Override
	public boolean isHumanReadable() {
		return options.humanReadable();
	}

	@Override
	public <T> T deserializeAny(Visitor<T> visitor) {
		if (ref == null) {
			return visitDocument(root, visitor);
		}
		RawBsonRef value = ref.withUtf8Mode(utf8Mode());
		switch (value.elementType()) {
			case BOOLEAN:
				return visitor.visitBoolean(value.asBoolean());
			case INT32:
				return visitor.visitInt32(value.asInt32());
			case INT64:
				return visitor.visitInt64(value.asInt64());
			case DOUBLE:
				return visitor.visitDouble(value.asDouble());
			case STRING:
				return visitor.visitString(value.asString());
			case BINARY:
				return visitor.visitBinary(value.asBinary().toBinary());
			case NULL:
				return visitor.visitNull();
			case EMBEDDED_DOCUMENT:
				checkDepth();
				return visitDocument(value.asDocument(), visitor);
			case ARRAY:
				checkDepth();
				return visitArray(value.asArray().asDocument(), visitor);
			default:
				return visitor.visitOther(value.toBson(remainingDepth()));
		}
	}

	/**
	 * @return how many more levels of nested containers a value at this depth may open
	 */
	private int remainingDepth() {
		return options.maxNestingDepth() - depth + 1;
	}

	private void checkDepth() {
		if (depth > options.maxNestingDepth()) {
			throw new BsonFormatException(EXCESSIVE_NESTING, -1, "nesting exceeds " + options.maxNestingDepth() + " levels");
		}
	}

	private <T> T visitDocument(RawDocument document, Visitor<T> visitor) {
		// Structure is always validated; string contents are checked on access.
		RawElementIterator elements = document.iterator(Utf8Mode.LOSSY);
		var access = new DocumentAccess() {
			RawElement current = null;

			@Override
			public String nextKey() {
				if (current != null) {
					throw new IllegalStateException("Value for key \"" + current.key() + "\" was not consumed");
				}
				if (elements.hasNext()) {
					current = elements.next();
					return current.key();
				} else {
					return null;
				}
			}

			@Override
			public <V> V nextValue(Deserialize<V> deserialize) {
				RawElement element = take();
				try {
					return deserialize.deserialize(child(element.value()));
				} catch (BsonException e) {
					ErrorPaths.field(options.trackErrorPath(), e, element.key());
					throw e;
				}
			}

			@Override
			public void skipValue() {
				RawElement element = take();
				try {
					child(element.value()).validate();
				} catch (BsonException e) {
					ErrorPaths.field(options.trackErrorPath(), e, element.key());
					throw e;
				}
			}

			private RawElement take() {
				if (current == null) {
					throw new IllegalStateException("No key has been read");
				}
				RawElement result = current;
				current = null;
				return result;
			}
		};
		T result = visitor.visitDocument(access);
		if (access.current != null || elements.hasNext()) {
			throw new BsonFormatException(TRAILING_BYTES, -1, "document has entries that were not consumed while deserializing " + visitor.expecting());
		}
		return result;
	}

	private <T> T visitArray(RawDocument array, Visitor<T> visitor) {
		RawElementIterator elements = array.iterator(Utf8Mode.LOSSY);
		T result = visitor.visitArray(new ArrayAccess() {
			int index = 0;

			@Override
			public boolean hasNext() {
				return elements.hasNext();
			}

			@Override
			public <V> V nextElement(Deserialize<V> deserialize) {
				int i = index++;
				try {
					return deserialize.deserialize(child(elements.next().value()));
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

	private void validate() {
		ref.withUtf8Mode(utf8Mode()).toBson(remainingDepth());
	}

	private RawDeserializer child(RawBsonRef value) {
		return new RawDeserializer(value, null, options, depth + 1);
	}

	@Override
	public <T> T deserializeNewtype(String name, Deserialize<T> inner) {
		return inner.deserialize(new RawDeserializer(ref, root, options.forNewtype(name), depth));
	}

	@Override
	public <T> Optional<T> deserializeOption(Deserialize<T> inner) {
		if (ref != null && ref.elementType() == ElementType.NULL) {
			return Optional.empty();
		}
		return Optional.ofNullable(inner.deserialize(this));
	}

	@Override
	public RawDocumentBuf deserializeRawDocumentBuf() {
		if (ref == null) {
			return RawDocumentBuf.fromRawDocument(root);
		} else if (ref.elementType() == ElementType.EMBEDDED_DOCUMENT) {
			return RawDocumentBuf.fromRawDocument(ref.asDocument());
		}
		throw BsonMappingException.invalidType(type().toString(), "a document");
	}

	@Override
	public RawArrayBuf deserializeRawArrayBuf() {
		if (ref != null && ref.elementType() == ElementType.ARRAY) {
			return RawArrayBuf.fromRawArray(ref.asArray());
		}
		throw BsonMappingException.invalidType(type().toString(), "an array");
	}
}
