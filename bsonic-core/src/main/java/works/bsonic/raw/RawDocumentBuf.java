package works.bsonic.raw;

import java.util.Arrays;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonString;
import works.bsonic.types.Document;

import static java.util.Objects.requireNonNull;

/**
 * An owned, growable encoded document that is valid after every operation.
 * <p>
 * Each {@code append} writes the new element after the terminator, then moves it down over the terminator,
 * re-adds the terminator, and rewrites the length prefix.
 * The existing bytes are untouched while the element is written,
 * so a value may be a view of this same buffer.
 * If an append fails (for example, because the key contains a NUL) the buffer is left exactly as it was.
 * <p>
 * Views returned by {@link #asRawDocument()} share this buffer's storage
 * and must not be used after a subsequent append.
 * Single-writer: callers must synchronize concurrent mutation externally.
 */
public final class RawDocumentBuf implements Iterable<RawElement> {
	private final RawWriter writer;

	public RawDocumentBuf() {
		writer = new RawWriter();
		int start = writer.startDocument();
		writer.endDocument(start);
	}

	private RawDocumentBuf(RawWriter writer) {
		this.writer = writer;
	}

	/**
	 * Takes a copy of {@code bytes}, checking only the length prefix and terminator.
	 */
	public static RawDocumentBuf fromBytes(byte[] bytes) {
		return fromRawDocument(RawDocument.fromBytes(bytes));
	}

	public static RawDocumentBuf fromRawDocument(RawDocument document) {
		RawWriter writer = new RawWriter(document.length());
		writer.writeRawDocument(document);
		return new RawDocumentBuf(writer);
	}

	public static RawDocumentBuf fromDocument(Document document) {
		RawWriter writer = new RawWriter();
		writer.writeDocument(document);
		return new RawDocumentBuf(writer);
	}

	public RawDocumentBuf append(String key, Bson value) {
		requireNonNull(value);
		return appendElement(key, value.elementType(), w -> w.writeValue(value));
	}

	public RawDocumentBuf append(String key, RawBsonRef value) {
		return appendElement(key, value.elementType(), w -> w.writeRawValue(value));
	}

	public RawDocumentBuf append(String key, RawDocument value) {
		return appendElement(key, ElementType.EMBEDDED_DOCUMENT, w -> w.writeRawDocument(value));
	}

	public RawDocumentBuf append(String key, RawArray value) {
		return appendElement(key, ElementType.ARRAY, w -> w.writeRawArray(value));
	}

	public RawDocumentBuf append(String key, RawDocumentBuf value) {
		return append(key, value.asRawDocument());
	}

	public RawDocumentBuf append(String key, RawArrayBuf value) {
		return append(key, value.asRawArray());
	}

	public RawDocumentBuf append(String key, String value) {
		return append(key, new BsonString(value));
	}

	public RawDocumentBuf append(String key, int value) {
		return append(key, new BsonInt32(value));
	}

	public RawDocumentBuf append(String key, long value) {
		return append(key, new BsonInt64(value));
	}

	public RawDocumentBuf append(String key, double value) {
		return append(key, new BsonDouble(value));
	}

	public RawDocumentBuf append(String key, boolean value) {
		return append(key, BsonBoolean.of(value));
	}

	interface PayloadWriter {
		void write(RawWriter writer);
	}

	RawDocumentBuf appendElement(String key, ElementType type, PayloadWriter payload) {
		requireNonNull(key);
		int originalSize = writer.size();
		try {
			writer.writeElementHeader(type, key);
			payload.write(writer);
		} catch (RuntimeException e) {
			LOGGER.debug("Rolling back failed append of key \"{}\"", key, e);
			writer.truncate(originalSize);
			throw e;
		}
		writer.deleteByte(originalSize - 1);
		writer.writeByte(0);
		writer.setInt32(0, writer.size());
		return this;
	}

	/**
	 * @return a view of the current contents, sharing storage with this buffer
	 */
	public RawDocument asRawDocument() {
		return RawDocument.fromBytes(writer.array(), 0, writer.size());
	}

	public Optional<RawBsonRef> get(String key) {
		return asRawDocument().get(key);
	}

	@Override
	public RawElementIterator iterator() {
		return asRawDocument().iterator();
	}

	public Document toDocument() {
		return asRawDocument().toDocument();
	}

	public int length() {
		return writer.size();
	}

	public boolean isEmpty() {
		return writer.size() == RawDocument.MIN_LENGTH;
	}

	public byte[] toByteArray() {
		return writer.toByteArray();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RawDocumentBuf other
			&& Arrays.equals(writer.array(), 0, writer.size(), other.writer.array(), 0, other.writer.size());
	}

	@Override
	public int hashCode() {
		return asRawDocument().hashCode();
	}

	@Override
	public String toString() {
		return "RawDocumentBuf(" + writer.size() + " bytes)";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RawDocumentBuf.class);
}
