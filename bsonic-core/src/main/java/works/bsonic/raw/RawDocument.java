package works.bsonic.raw;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.ValueAccessException;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Document;
import works.bsonic.types.ObjectId;
import works.bsonic.types.DateTime;
import works.bsonic.types.Timestamp;

import static works.bsonic.exceptions.BsonFormatException.Kind.LENGTH_MISMATCH;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRUNCATED;
import static works.bsonic.exceptions.BsonFormatException.Kind.INVALID_VALUE;

/**
 * A read-only view of an encoded document within a caller-owned byte array.
 * <p>
 * Construction checks only the length prefix and the terminator.
 * Elements are validated one at a time as they are reached by {@link #iterator()} or {@link #get(String)},
 * so a document whose tenth element is malformed still yields its first nine.
 * <p>
 * Nothing is copied: the caller must not modify the array while the view, or anything obtained from it, is in use.
 * A view that is never modified may be shared freely among threads.
 */
public final class RawDocument implements Iterable<RawElement> {
	/**
	 * Maximum depth of nested documents and arrays that {@link #toDocument()} will materialize.
	 */
	public static final int MAX_NESTING_DEPTH = 100;

	static final int MIN_LENGTH = 5;

	private final byte[] bytes;
	private final int offset;
	private final int length;

	private RawDocument(byte[] bytes, int offset, int length) {
		this.bytes = bytes;
		this.offset = offset;
		this.length = length;
	}

	/**
	 * @throws BsonFormatException if {@code bytes} is too short, its length prefix disagrees
	 * with its actual length, or it does not end with a zero byte
	 */
	public static RawDocument fromBytes(byte[] bytes) {
		return fromBytes(bytes, 0, bytes.length);
	}

	public static RawDocument fromBytes(byte[] bytes, int offset, int length) {
		if (offset < 0 || length < 0 || offset > bytes.length - length) {
			throw new IndexOutOfBoundsException("Range [" + offset + ", " + offset + "+" + length + ") is outside array of length " + bytes.length);
		}
		if (length < MIN_LENGTH) {
			throw new BsonFormatException(TRUNCATED, offset, "document requires at least " + MIN_LENGTH + " bytes; got " + length);
		}
		int declared = LittleEndian.readInt32(bytes, offset);
		if (declared != length) {
			throw new BsonFormatException(LENGTH_MISMATCH, offset, "length prefix " + declared + " does not match buffer length " + length);
		}
		if (bytes[offset + length - 1] != 0) {
			throw new BsonFormatException(INVALID_VALUE, offset + length - 1, "document not terminated with a zero byte");
		}
		return new RawDocument(bytes, offset, length);
	}

	byte[] bytes() {
		return bytes;
	}

	int offset() {
		return offset;
	}

	/**
	 * @return the total encoded length, including the length prefix and terminator
	 */
	public int length() {
		return length;
	}

	public boolean isEmpty() {
		return length == MIN_LENGTH;
	}

	@Override
	public RawElementIterator iterator() {
		return iterator(Utf8Mode.STRICT);
	}

	public RawElementIterator iterator(Utf8Mode mode) {
		return new RawElementIterator(bytes, offset, length, mode);
	}

	/**
	 * Scans linearly for the first element with the given key.
	 * Elements before it are validated; elements after it are not examined.
	 *
	 * @throws BsonFormatException if a malformed element is encountered before the key is found
	 */
	public Optional<RawBsonRef> get(String key) {
		RawElementIterator iter = iterator();
		while (iter.hasNext()) {
			RawElement element = iter.next();
			if (element.key().equals(key)) {
				return Optional.of(element.value());
			}
		}
		return Optional.empty();
	}

	public String getString(String key) {
		return getTyped(key, ElementType.STRING, RawBsonRef::asString);
	}

	public int getInt32(String key) {
		return getTyped(key, ElementType.INT32, RawBsonRef::asInt32);
	}

	public long getInt64(String key) {
		return getTyped(key, ElementType.INT64, RawBsonRef::asInt64);
	}

	public double getDouble(String key) {
		return getTyped(key, ElementType.DOUBLE, RawBsonRef::asDouble);
	}

	public boolean getBoolean(String key) {
		return getTyped(key, ElementType.BOOLEAN, RawBsonRef::asBoolean);
	}

	public RawDocument getDocument(String key) {
		return getTyped(key, ElementType.EMBEDDED_DOCUMENT, RawBsonRef::asDocument);
	}

	public RawArray getArray(String key) {
		return getTyped(key, ElementType.ARRAY, RawBsonRef::asArray);
	}

	public RawBinaryRef getBinary(String key) {
		return getTyped(key, ElementType.BINARY, RawBsonRef::asBinary);
	}

	public ObjectId getObjectId(String key) {
		return getTyped(key, ElementType.OBJECT_ID, RawBsonRef::asObjectId);
	}

	public DateTime getDateTime(String key) {
		return getTyped(key, ElementType.DATE_TIME, RawBsonRef::asDateTime);
	}

	public Timestamp getTimestamp(String key) {
		return getTyped(key, ElementType.TIMESTAMP, RawBsonRef::asTimestamp);
	}

	private <T> T getTyped(String key, ElementType expected, Function<RawBsonRef, T> extractor) {
		RawBsonRef value = get(key).orElseThrow(() -> ValueAccessException.notPresent(key));
		if (value.elementType() != expected) {
			throw ValueAccessException.unexpectedType(key, value.elementType(), expected);
		}
		return extractor.apply(value);
	}

	/**
	 * Validates and copies every element.
	 *
	 * @throws BsonFormatException if any element at any depth is malformed,
	 * or nesting exceeds {@link #MAX_NESTING_DEPTH}
	 */
	public Document toDocument() {
		return toDocument(Utf8Mode.STRICT);
	}

	public Document toDocument(Utf8Mode mode) {
		return toDocument(mode, MAX_NESTING_DEPTH);
	}

	Document toDocument(Utf8Mode mode, int remainingDepth) {
		Document result = new Document();
		RawElementIterator iter = iterator(mode);
		while (iter.hasNext()) {
			RawElement element = iter.next();
			result.append(element.key(), element.value().toBson(remainingDepth));
		}
		return result;
	}

	/**
	 * @return a copy of the encoded bytes
	 */
	public byte[] toByteArray() {
		return Arrays.copyOfRange(bytes, offset, offset + length);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RawDocument other
			&& Arrays.equals(bytes, offset, offset + length, other.bytes, other.offset, other.offset + other.length);
	}

	@Override
	public int hashCode() {
		int result = 1;
		for (int i = offset; i < offset + length; i++) {
			result = 31 * result + bytes[i];
		}
		return result;
	}

	@Override
	public String toString() {
		return "RawDocument(" + length + " bytes)";
	}
}
