package works.bsonic.raw;

import java.util.Arrays;
import java.util.Map;
import works.bsonic.exceptions.BsonEncodingException;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonJavaScriptCode;
import works.bsonic.types.BsonString;
import works.bsonic.types.BsonSymbol;
import works.bsonic.types.DateTime;
import works.bsonic.types.DbPointer;
import works.bsonic.types.Decimal128;
import works.bsonic.types.Document;
import works.bsonic.types.JavaScriptCodeWithScope;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Regex;
import works.bsonic.types.Timestamp;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A growable little-endian byte buffer with BSON-aware write operations.
 * <p>
 * Length prefixes are written as placeholders and patched afterward
 * with {@link #setInt32}; see {@link #startDocument()} and {@link #endDocument(int)}.
 * Not thread-safe.
 */
public final class RawWriter {
	private byte[] buffer;
	private int size = 0;

	public RawWriter() {
		this(64);
	}

	public RawWriter(int initialCapacity) {
		buffer = new byte[Math.max(initialCapacity, 16)];
	}

	public int size() {
		return size;
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(buffer, size);
	}

	/**
	 * The live backing array. Bytes at and beyond {@link #size()} are garbage,
	 * and the array is replaced whenever the buffer grows.
	 */
	byte[] array() {
		return buffer;
	}

	/**
	 * Discards everything written at or after {@code newSize}.
	 */
	public void truncate(int newSize) {
		if (newSize < 0 || newSize > size) {
			throw new IllegalArgumentException("Cannot truncate " + size + " bytes to " + newSize);
		}
		size = newSize;
	}

	/**
	 * Removes the byte at {@code position}, shifting every later byte down by one.
	 */
	public void deleteByte(int position) {
		checkPosition(position, 1);
		System.arraycopy(buffer, position + 1, buffer, position, size - position - 1);
		size--;
	}

	private void ensureCapacity(int additional) {
		long required = (long) size + additional;
		if (required > Integer.MAX_VALUE - 8) {
			throw new BsonEncodingException("BSON output exceeds maximum size");
		}
		if (required > buffer.length) {
			buffer = Arrays.copyOf(buffer, (int) Math.max(required, Math.min((long) buffer.length * 2, Integer.MAX_VALUE - 8)));
		}
	}

	public void writeByte(int b) {
		ensureCapacity(1);
		buffer[size++] = (byte) b;
	}

	public void writeBytes(byte[] bytes) {
		writeBytes(bytes, 0, bytes.length);
	}

	public void writeBytes(byte[] bytes, int offset, int length) {
		ensureCapacity(length);
		System.arraycopy(bytes, offset, buffer, size, length);
		size += length;
	}

	public void writeInt32(int value) {
		ensureCapacity(4);
		LittleEndian.writeInt32(buffer, size, value);
		size += 4;
	}

	public void writeInt64(long value) {
		writeInt32((int) value);
		writeInt32((int) (value >>> 32));
	}

	public void writeDouble(double value) {
		writeInt64(Double.doubleToRawLongBits(value));
	}

	public void setByte(int position, byte value) {
		checkPosition(position, 1);
		buffer[position] = value;
	}

	public void setInt32(int position, int value) {
		checkPosition(position, 4);
		LittleEndian.writeInt32(buffer, position, value);
	}

	private void checkPosition(int position, int width) {
		if (position < 0 || position + width > size) {
			throw new IndexOutOfBoundsException("Position " + position + " is outside the " + size + " bytes written");
		}
	}

	/**
	 * Writes UTF-8 bytes followed by a NUL terminator.
	 *
	 * @throws BsonEncodingException if {@code value} contains a NUL character; nothing is written
	 */
	public void writeCString(String value) {
		int nul = value.indexOf('\0');
		if (nul >= 0) {
			throw new BsonEncodingException("C-string contains a NUL character at index " + nul + ": \"" + value.replace("\0", "\\0") + "\"");
		}
		writeBytes(value.getBytes(UTF_8));
		writeByte(0);
	}

	/**
	 * Writes an int32 byte count (including the terminator), the UTF-8 bytes, and a NUL terminator.
	 * Embedded NUL characters are allowed.
	 */
	public void writeString(String value) {
		byte[] utf8 = value.getBytes(UTF_8);
		writeInt32(utf8.length + 1);
		writeBytes(utf8);
		writeByte(0);
	}

	/**
	 * Writes a placeholder length prefix.
	 *
	 * @return the position to pass to {@link #endDocument(int)}
	 */
	public int startDocument() {
		int start = size;
		writeInt32(0);
		return start;
	}

	/**
	 * Writes the terminator and patches the length prefix written by {@link #startDocument()}.
	 */
	public void endDocument(int start) {
		writeByte(0);
		setInt32(start, size - start);
	}

	public void writeDocument(Document document) {
		int start = startDocument();
		for (Map.Entry<String, Bson> entry : document) {
			writeElement(entry.getKey(), entry.getValue());
		}
		endDocument(start);
	}

	public void writeArray(BsonArray array) {
		int start = startDocument();
		int index = 0;
		for (Bson value : array) {
			writeElement(Integer.toString(index++), value);
		}
		endDocument(start);
	}

	/**
	 * Writes the type tag, key and payload of one element.
	 */
	public void writeElement(String key, Bson value) {
		writeByte(value.elementType().tag());
		writeCString(key);
		writeValue(value);
	}

	/**
	 * Writes the payload of {@code value} without a tag or key.
	 */
	public void writeValue(Bson value) {
		switch (value.elementType()) {
			case DOUBLE -> writeDouble(((BsonDouble) value).value());
			case STRING -> writeString(((BsonString) value).value());
			case EMBEDDED_DOCUMENT -> writeDocument((Document) value);
			case ARRAY -> writeArray((BsonArray) value);
			case BINARY -> writeBinary((Binary) value);
			case UNDEFINED, NULL, MIN_KEY, MAX_KEY -> { }
			case OBJECT_ID -> writeBytes(((ObjectId) value).toByteArray());
			case BOOLEAN -> writeByte(((BsonBoolean) value).value() ? 1 : 0);
			case DATE_TIME -> writeInt64(((DateTime) value).millis());
			case REGULAR_EXPRESSION -> {
				Regex regex = (Regex) value;
				// Check both before writing either
				checkNoNul(regex.pattern(), "regex pattern");
				checkNoNul(regex.options(), "regex options");
				writeCString(regex.pattern());
				writeCString(regex.options());
			}
			case DB_POINTER -> {
				DbPointer pointer = (DbPointer) value;
				writeString(pointer.namespace());
				writeBytes(pointer.id().toByteArray());
			}
			case JAVASCRIPT_CODE -> writeString(((BsonJavaScriptCode) value).code());
			case SYMBOL -> writeString(((BsonSymbol) value).symbol());
			case JAVASCRIPT_CODE_WITH_SCOPE -> {
				JavaScriptCodeWithScope cws = (JavaScriptCodeWithScope) value;
				int start = size;
				writeInt32(0);
				writeString(cws.code());
				writeDocument(cws.scope());
				setInt32(start, size - start);
			}
			case INT32 -> writeInt32(((BsonInt32) value).value());
			case TIMESTAMP -> {
				Timestamp ts = (Timestamp) value;
				writeInt32((int) ts.increment());
				writeInt32((int) ts.time());
			}
			case INT64 -> writeInt64(((BsonInt64) value).value());
			case DECIMAL128 -> writeBytes(((Decimal128) value).bytes());
		}
	}

	private void writeBinary(Binary binary) {
		byte[] bytes = binary.bytes();
		if (binary.subtype().equals(BinarySubtype.BINARY_OLD)) {
			writeInt32(bytes.length + 4);
			writeByte(binary.subtype().value());
			writeInt32(bytes.length);
		} else {
			writeInt32(bytes.length);
			writeByte(binary.subtype().value());
		}
		writeBytes(bytes);
	}

	private static void checkNoNul(String value, String what) {
		if (value.indexOf('\0') >= 0) {
			throw new BsonEncodingException(what + " contains a NUL character");
		}
	}

	/**
	 * Writes the tag and key of an element whose payload will be copied from elsewhere.
	 */
	public void writeElementHeader(ElementType type, String key) {
		writeByte(type.tag());
		writeCString(key);
	}

	/**
	 * Copies the payload bytes of {@code value} verbatim.
	 */
	public void writeRawValue(RawBsonRef value) {
		writeBytes(value.bytes(), value.valueOffset(), value.valueLength());
	}

	public void writeRawDocument(RawDocument document) {
		writeBytes(document.bytes(), document.offset(), document.length());
	}

	public void writeRawArray(RawArray array) {
		writeRawDocument(array.asDocument());
	}
}
