package works.bsonic.raw;

import java.util.Iterator;
import java.util.NoSuchElementException;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.spec.ElementType;

import static works.bsonic.exceptions.BsonFormatException.Kind.INVALID_VALUE;
import static works.bsonic.exceptions.BsonFormatException.Kind.LENGTH_MISMATCH;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRAILING_BYTES;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRUNCATED;
import static works.bsonic.exceptions.BsonFormatException.Kind.UNRECOGNIZED_ELEMENT_TYPE;
import static works.bsonic.exceptions.BsonFormatException.Kind.UNTERMINATED_CSTRING;

/**
 * Walks the elements of a document, validating exactly one element per call to {@link #next()}.
 * <p>
 * After {@link #next()} throws, the iterator is exhausted: {@link #hasNext()} returns false.
 * There is no attempt to resynchronize.
 */
public final class RawElementIterator implements Iterator<RawElement> {
	private final byte[] bytes;
	/**
	 * Index of the document's terminating zero byte.
	 */
	private final int limit;
	private final Utf8Mode mode;
	private int position;
	private boolean failed = false;

	RawElementIterator(byte[] bytes, int documentOffset, int documentLength, Utf8Mode mode) {
		this.bytes = bytes;
		this.limit = documentOffset + documentLength - 1;
		this.mode = mode;
		this.position = documentOffset + 4;
	}

	@Override
	public boolean hasNext() {
		return !failed && position < limit;
	}

	/**
	 * @throws BsonFormatException if the next element is malformed
	 */
	@Override
	public RawElement next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		try {
			return readElement();
		} catch (BsonFormatException e) {
			failed = true;
			throw e;
		}
	}

	private RawElement readElement() {
		int tagOffset = position;
		byte tag = bytes[tagOffset];
		if (tag == 0) {
			throw new BsonFormatException(TRAILING_BYTES, tagOffset, "document terminator found before end of document");
		}
		int keyStart = tagOffset + 1;
		int keyEnd = indexOfNul(keyStart, limit);
		if (keyEnd < 0) {
			throw new BsonFormatException(UNTERMINATED_CSTRING, keyStart, "key is not terminated");
		}
		String key = Utf8.decodeStrict(bytes, keyStart, keyEnd - keyStart);
		ElementType type = ElementType.fromByte(tag);
		if (type == null) {
			throw new BsonFormatException(UNRECOGNIZED_ELEMENT_TYPE, tagOffset, key, "unrecognized element type 0x" + Integer.toHexString(tag & 0xFF));
		}
		int valueStart = keyEnd + 1;
		int valueLength;
		try {
			valueLength = validateValue(type, valueStart);
		} catch (BsonFormatException e) {
			throw e.withKey(key);
		}
		position = valueStart + valueLength;
		return new RawElement(key, new RawBsonRef(type, bytes, valueStart, valueLength, mode));
	}

	/**
	 * @return the length of the value starting at {@code start}, after checking it
	 * lies entirely before the document terminator and is internally consistent
	 */
	private int validateValue(ElementType type, int start) {
		int fixed = type.fixedLength();
		if (fixed >= 0) {
			require(start, fixed);
			if (type == ElementType.BOOLEAN && (bytes[start] & 0xFE) != 0) {
				throw new BsonFormatException(INVALID_VALUE, start, "boolean must be 0 or 1; got " + bytes[start]);
			}
			return fixed;
		}
		return switch (type) {
			case STRING, JAVASCRIPT_CODE, SYMBOL -> validateString(start, mode);
			case EMBEDDED_DOCUMENT, ARRAY -> validateDocument(start);
			case BINARY -> validateBinary(start);
			case REGULAR_EXPRESSION -> {
				int patternEnd = validateCString(start);
				int optionsEnd = validateCString(patternEnd + 1);
				yield optionsEnd + 1 - start;
			}
			case DB_POINTER -> {
				int stringLength = validateString(start, mode);
				require(start + stringLength, 12);
				yield stringLength + 12;
			}
			case JAVASCRIPT_CODE_WITH_SCOPE -> validateCodeWithScope(start);
			default -> throw new IllegalStateException("Unexpected variable-length type " + type);
		};
	}

	private void require(int start, long needed) {
		if (start + needed > limit) {
			throw new BsonFormatException(TRUNCATED, start, "value needs " + needed + " bytes but only " + (limit - start) + " remain");
		}
	}

	private int readLength(int start) {
		require(start, 4);
		return LittleEndian.readInt32(bytes, start);
	}

	private int validateString(int start, Utf8Mode stringMode) {
		int declared = readLength(start);
		if (declared < 1) {
			throw new BsonFormatException(LENGTH_MISMATCH, start, "string length must be at least 1; got " + declared);
		}
		require(start + 4, declared);
		int terminator = start + 4 + declared - 1;
		if (bytes[terminator] != 0) {
			throw new BsonFormatException(UNTERMINATED_CSTRING, terminator, "string is not NUL-terminated");
		}
		if (stringMode == Utf8Mode.STRICT) {
			Utf8.decodeStrict(bytes, start + 4, declared - 1);
		}
		return 4 + declared;
	}

	private int validateDocument(int start) {
		int declared = readLength(start);
		if (declared < RawDocument.MIN_LENGTH) {
			throw new BsonFormatException(LENGTH_MISMATCH, start, "document length must be at least " + RawDocument.MIN_LENGTH + "; got " + declared);
		}
		require(start, declared);
		if (bytes[start + declared - 1] != 0) {
			throw new BsonFormatException(INVALID_VALUE, start + declared - 1, "embedded document not terminated with a zero byte");
		}
		return declared;
	}

	private int validateBinary(int start) {
		int declared = readLength(start);
		if (declared < 0) {
			throw new BsonFormatException(LENGTH_MISMATCH, start, "negative binary length " + declared);
		}
		require(start, 5L + declared);
		byte subtype = bytes[start + 4];
		if (subtype == BinarySubtype.BINARY_OLD.value()) {
			if (declared < 4) {
				throw new BsonFormatException(LENGTH_MISMATCH, start, "old binary subtype requires an inner length; total length is " + declared);
			}
			int inner = LittleEndian.readInt32(bytes, start + 5);
			if (inner != declared - 4) {
				throw new BsonFormatException(LENGTH_MISMATCH, start + 5, "old binary inner length " + inner + " does not match outer length " + declared);
			}
		}
		return 5 + declared;
	}

	/**
	 * @return the index of the terminating NUL
	 */
	private int validateCString(int start) {
		int end = indexOfNul(start, limit);
		if (end < 0) {
			throw new BsonFormatException(UNTERMINATED_CSTRING, start, "C-string is not terminated");
		}
		if (mode == Utf8Mode.STRICT) {
			Utf8.decodeStrict(bytes, start, end - start);
		}
		return end;
	}

	private int validateCodeWithScope(int start) {
		int declared = readLength(start);
		// int32 total + minimal string (5) + minimal document (5)
		if (declared < 14) {
			throw new BsonFormatException(LENGTH_MISMATCH, start, "code with scope length must be at least 14; got " + declared);
		}
		require(start, declared);
		int stringLength = validateString(start + 4, mode);
		int scopeLength = validateDocument(start + 4 + stringLength);
		if (4L + stringLength + scopeLength != declared) {
			throw new BsonFormatException(LENGTH_MISMATCH, start, "code with scope length " + declared
				+ " does not match its contents (" + (4L + stringLength + scopeLength) + ")");
		}
		return declared;
	}

	/**
	 * @return index of the first zero byte in [start, end), or -1
	 */
	private int indexOfNul(int start, int end) {
		for (int i = start; i < end; i++) {
			if (bytes[i] == 0) {
				return i;
			}
		}
		return -1;
	}
}
