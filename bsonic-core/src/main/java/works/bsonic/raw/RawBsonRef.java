package works.bsonic.raw;

import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.ValueAccessException;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonJavaScriptCode;
import works.bsonic.types.BsonMaxKey;
import works.bsonic.types.BsonMinKey;
import works.bsonic.types.BsonNull;
import works.bsonic.types.BsonString;
import works.bsonic.types.BsonSymbol;
import works.bsonic.types.BsonUndefined;
import works.bsonic.types.DateTime;
import works.bsonic.types.DbPointer;
import works.bsonic.types.Decimal128;
import works.bsonic.types.JavaScriptCodeWithScope;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Regex;
import works.bsonic.types.Timestamp;

import static works.bsonic.exceptions.BsonFormatException.Kind.EXCESSIVE_NESTING;

/**
 * A reference to one already-validated value inside a raw document.
 * <p>
 * Fixed-width scalars are decoded on each access. Documents, arrays and binaries
 * are returned as views of the same bytes; strings are decoded into new {@link String}s.
 */
public final class RawBsonRef {
	private final ElementType type;
	private final byte[] bytes;
	private final int valueOffset;
	private final int valueLength;
	private final Utf8Mode mode;

	RawBsonRef(ElementType type, byte[] bytes, int valueOffset, int valueLength, Utf8Mode mode) {
		this.type = type;
		this.bytes = bytes;
		this.valueOffset = valueOffset;
		this.valueLength = valueLength;
		this.mode = mode;
	}

	public ElementType elementType() {
		return type;
	}

	/**
	 * @return a reference to the same value whose string accessors decode using {@code mode}
	 */
	public RawBsonRef withUtf8Mode(Utf8Mode mode) {
		return mode == this.mode ? this : new RawBsonRef(type, bytes, valueOffset, valueLength, mode);
	}

	byte[] bytes() {
		return bytes;
	}

	int valueOffset() {
		return valueOffset;
	}

	int valueLength() {
		return valueLength;
	}

	/**
	 * @return a copy of the encoded payload, excluding tag and key
	 */
	public byte[] toByteArray() {
		return Arrays.copyOfRange(bytes, valueOffset, valueOffset + valueLength);
	}

	private void expect(ElementType expected) {
		if (type != expected) {
			throw ValueAccessException.unexpectedType(null, type, expected);
		}
	}

	public double asDouble() {
		expect(ElementType.DOUBLE);
		return LittleEndian.readDouble(bytes, valueOffset);
	}

	public String asString() {
		expect(ElementType.STRING);
		return readString(valueOffset);
	}

	public String asJavaScriptCode() {
		expect(ElementType.JAVASCRIPT_CODE);
		return readString(valueOffset);
	}

	public String asSymbol() {
		expect(ElementType.SYMBOL);
		return readString(valueOffset);
	}

	public RawDocument asDocument() {
		expect(ElementType.EMBEDDED_DOCUMENT);
		return RawDocument.fromBytes(bytes, valueOffset, valueLength);
	}

	public RawArray asArray() {
		expect(ElementType.ARRAY);
		return new RawArray(RawDocument.fromBytes(bytes, valueOffset, valueLength));
	}

	public RawBinaryRef asBinary() {
		expect(ElementType.BINARY);
		int length = LittleEndian.readInt32(bytes, valueOffset);
		BinarySubtype subtype = new BinarySubtype(bytes[valueOffset + 4]);
		if (subtype.equals(BinarySubtype.BINARY_OLD)) {
			return new RawBinaryRef(subtype, bytes, valueOffset + 9, length - 4);
		} else {
			return new RawBinaryRef(subtype, bytes, valueOffset + 5, length);
		}
	}

	public ObjectId asObjectId() {
		expect(ElementType.OBJECT_ID);
		return ObjectId.fromBytes(bytes, valueOffset);
	}

	public boolean asBoolean() {
		expect(ElementType.BOOLEAN);
		return bytes[valueOffset] != 0;
	}

	public DateTime asDateTime() {
		expect(ElementType.DATE_TIME);
		return DateTime.fromMillis(LittleEndian.readInt64(bytes, valueOffset));
	}

	public RawRegexRef asRegex() {
		expect(ElementType.REGULAR_EXPRESSION);
		int patternEnd = valueOffset;
		while (bytes[patternEnd] != 0) {
			patternEnd++;
		}
		int optionsEnd = valueOffset + valueLength - 1;
		return new RawRegexRef(
			decode(valueOffset, patternEnd - valueOffset),
			decode(patternEnd + 1, optionsEnd - patternEnd - 1));
	}

	public RawDbPointerRef asDbPointer() {
		expect(ElementType.DB_POINTER);
		int stringLength = LittleEndian.readInt32(bytes, valueOffset);
		return new RawDbPointerRef(readString(valueOffset), ObjectId.fromBytes(bytes, valueOffset + 4 + stringLength));
	}

	public RawJavaScriptCodeWithScopeRef asJavaScriptCodeWithScope() {
		expect(ElementType.JAVASCRIPT_CODE_WITH_SCOPE);
		int codeStart = valueOffset + 4;
		int scopeStart = codeStart + 4 + LittleEndian.readInt32(bytes, codeStart);
		int scopeLength = valueOffset + valueLength - scopeStart;
		return new RawJavaScriptCodeWithScopeRef(readString(codeStart), RawDocument.fromBytes(bytes, scopeStart, scopeLength));
	}

	public int asInt32() {
		expect(ElementType.INT32);
		return LittleEndian.readInt32(bytes, valueOffset);
	}

	public Timestamp asTimestamp() {
		expect(ElementType.TIMESTAMP);
		int increment = LittleEndian.readInt32(bytes, valueOffset);
		int time = LittleEndian.readInt32(bytes, valueOffset + 4);
		return Timestamp.fromBits(time, increment);
	}

	public long asInt64() {
		expect(ElementType.INT64);
		return LittleEndian.readInt64(bytes, valueOffset);
	}

	public Decimal128 asDecimal128() {
		expect(ElementType.DECIMAL128);
		return new Decimal128(Arrays.copyOfRange(bytes, valueOffset, valueOffset + Decimal128.LENGTH));
	}

	/**
	 * @param start offset of an int32-length-prefixed, NUL-terminated string
	 */
	private String readString(int start) {
		int declared = LittleEndian.readInt32(bytes, start);
		return decode(start + 4, declared - 1);
	}

	private String decode(int start, int length) {
		if (mode == Utf8Mode.LOSSY) {
			if (LOGGER.isDebugEnabled()) {
				int bad = Utf8.firstInvalid(bytes, start, length);
				if (bad >= 0) {
					LOGGER.debug("Replacing invalid UTF-8 starting at offset {}", bad);
				}
			}
			return Utf8.decodeLossy(bytes, start, length);
		} else {
			return Utf8.decodeStrict(bytes, start, length);
		}
	}

	/**
	 * Materializes this value, copying all bytes.
	 */
	public Bson toBson() {
		return toBson(RawDocument.MAX_NESTING_DEPTH);
	}

	/**
	 * Materializes this value, allowing at most {@code remainingDepth} levels of nested containers,
	 * this one included.
	 *
	 * @throws BsonFormatException of kind {@code EXCESSIVE_NESTING} if the value nests deeper
	 */
	public Bson toBson(int remainingDepth) {
		return switch (type) {
			case DOUBLE -> new BsonDouble(asDouble());
			case STRING -> new BsonString(asString());
			case EMBEDDED_DOCUMENT -> asDocument().toDocument(mode, descend(remainingDepth));
			case ARRAY -> asArray().toBsonArray(mode, descend(remainingDepth));
			case BINARY -> asBinary().toBinary();
			case UNDEFINED -> BsonUndefined.INSTANCE;
			case OBJECT_ID -> asObjectId();
			case BOOLEAN -> BsonBoolean.of(asBoolean());
			case DATE_TIME -> asDateTime();
			case NULL -> BsonNull.INSTANCE;
			case REGULAR_EXPRESSION -> {
				RawRegexRef regex = asRegex();
				yield new Regex(regex.pattern(), regex.options());
			}
			case DB_POINTER -> {
				RawDbPointerRef pointer = asDbPointer();
				yield new DbPointer(pointer.namespace(), pointer.id());
			}
			case JAVASCRIPT_CODE -> new BsonJavaScriptCode(asJavaScriptCode());
			case SYMBOL -> new BsonSymbol(asSymbol());
			case JAVASCRIPT_CODE_WITH_SCOPE -> {
				RawJavaScriptCodeWithScopeRef cws = asJavaScriptCodeWithScope();
				yield new JavaScriptCodeWithScope(cws.code(), cws.scope().toDocument(mode, descend(remainingDepth)));
			}
			case INT32 -> new BsonInt32(asInt32());
			case TIMESTAMP -> asTimestamp();
			case INT64 -> new BsonInt64(asInt64());
			case DECIMAL128 -> asDecimal128();
			case MIN_KEY -> BsonMinKey.INSTANCE;
			case MAX_KEY -> BsonMaxKey.INSTANCE;
		};
	}

	private int descend(int remainingDepth) {
		if (remainingDepth <= 0) {
			throw new BsonFormatException(EXCESSIVE_NESTING, valueOffset, "nesting exceeds the allowed depth");
		}
		return remainingDepth - 1;
	}

	@Override
	public String toString() {
		return "RawBsonRef(" + type + ", " + valueLength + " bytes)";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RawBsonRef.class);
}
