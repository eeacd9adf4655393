package works.bsonic.serde.mapping;

import java.util.Map;
import java.util.UUID;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawArrayBuf;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.Visitor;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.DateTime;
import works.bsonic.types.ObjectId;

import static java.util.Map.entry;

/**
 * Mappings for types that correspond to a single BSON value.
 */
final class ScalarSerdes {
	private ScalarSerdes() { }

	static final Serde<Boolean> BOOLEAN = Serde.of(
		(v, s) -> s.serializeBoolean(v),
		d -> d.deserializeAny(new Visitor<Boolean>() {
			@Override
			public String expecting() {
				return "a boolean";
			}

			@Override
			public Boolean visitBoolean(boolean value) {
				return value;
			}
		}));

	static final Serde<Long> LONG = Serde.of(
		(v, s) -> s.serializeInt64(v),
		d -> d.deserializeAny(new IntegerVisitor("an int64", Long.MIN_VALUE, Long.MAX_VALUE)));

	static final Serde<Integer> INT = Serde.of(
		(v, s) -> s.serializeInt32(v),
		d -> (int) (long) d.deserializeAny(new IntegerVisitor("an int32", Integer.MIN_VALUE, Integer.MAX_VALUE)));

	static final Serde<Short> SHORT = Serde.of(
		(v, s) -> s.serializeInt32(v),
		d -> (short) (long) d.deserializeAny(new IntegerVisitor("a 16-bit integer", Short.MIN_VALUE, Short.MAX_VALUE)));

	static final Serde<Byte> BYTE = Serde.of(
		(v, s) -> s.serializeInt32(v),
		d -> (byte) (long) d.deserializeAny(new IntegerVisitor("an 8-bit integer", Byte.MIN_VALUE, Byte.MAX_VALUE)));

	/**
	 * Unsigned 32-bit integer, held as the bits of an {@code int}.
	 */
	static final Serde<Integer> U32 = Serde.of(
		(v, s) -> s.serializeU32(v),
		d -> (int) (long) d.deserializeAny(new IntegerVisitor("a u32", 0, 0xFFFF_FFFFL)));

	/**
	 * Unsigned 64-bit integer, held as the bits of a {@code long}.
	 * Only values up to {@link Long#MAX_VALUE} can be represented in BSON.
	 */
	static final Serde<Long> U64 = Serde.of(
		(v, s) -> s.serializeU64(v),
		d -> d.deserializeAny(new IntegerVisitor("a u64", 0, Long.MAX_VALUE)));

	static final Serde<Double> DOUBLE = Serde.of(
		(v, s) -> s.serializeDouble(v),
		d -> d.deserializeAny(new Visitor<Double>() {
			@Override
			public String expecting() {
				return "a double";
			}

			@Override
			public Double visitDouble(double value) {
				return value;
			}

			@Override
			public Double visitInt32(int value) {
				return (double) value;
			}

			@Override
			public Double visitInt64(long value) {
				return (double) value;
			}
		}));

	static final Serde<Float> FLOAT = Serde.of(
		(v, s) -> s.serializeDouble(v),
		d -> (float) (double) DOUBLE.deserialize(d));

	static final Serde<String> STRING = Serde.of(
		(v, s) -> s.serializeString(v),
		d -> d.deserializeAny(new Visitor<String>() {
			@Override
			public String expecting() {
				return "a string";
			}

			@Override
			public String visitString(String value) {
				return value;
			}
		}));

	static final Serde<Character> CHAR = Serde.of(
		(v, s) -> s.serializeString(v.toString()),
		d -> d.deserializeAny(new Visitor<Character>() {
			@Override
			public String expecting() {
				return "a single character";
			}

			@Override
			public Character visitString(String value) {
				if (value.length() != 1) {
					throw unexpected("string \"" + value + "\"");
				}
				return value.charAt(0);
			}
		}));

	static final Serde<byte[]> BYTES = Serde.of(
		(v, s) -> s.serializeBytes(v),
		d -> d.deserializeAny(new Visitor<byte[]>() {
			@Override
			public String expecting() {
				return "generic binary";
			}

			@Override
			public byte[] visitBinary(Binary value) {
				if (!value.subtype().equals(BinarySubtype.GENERIC)) {
					throw unexpected("binary with subtype " + value.subtype());
				}
				return value.bytes();
			}
		}));

	/**
	 * Native ObjectId, or a hex string when human-readable.
	 * Either form is accepted when deserializing.
	 */
	static final Serde<ObjectId> OBJECT_ID = Serde.of(
		(v, s) -> {
			if (s.isHumanReadable()) {
				s.serializeString(v.toHex());
			} else {
				s.serializeBson(v);
			}
		},
		d -> d.deserializeAny(new Visitor<ObjectId>() {
			@Override
			public String expecting() {
				return "an ObjectId or hex string";
			}

			@Override
			public ObjectId visitString(String value) {
				return parseObjectId(value);
			}

			@Override
			public ObjectId visitOther(Bson value) {
				if (value instanceof ObjectId oid) {
					return oid;
				}
				return Visitor.super.visitOther(value);
			}
		}));

	/**
	 * Native DateTime, or an RFC 3339 string when human-readable.
	 * Either form is accepted when deserializing.
	 */
	static final Serde<DateTime> DATE_TIME = Serde.of(
		(v, s) -> {
			if (s.isHumanReadable()) {
				s.serializeString(v.tryToRfc3339String());
			} else {
				s.serializeBson(v);
			}
		},
		d -> d.deserializeAny(new Visitor<DateTime>() {
			@Override
			public String expecting() {
				return "a DateTime or RFC 3339 string";
			}

			@Override
			public DateTime visitString(String value) {
				return DateTime.parseRfc3339(value);
			}

			@Override
			public DateTime visitOther(Bson value) {
				if (value instanceof DateTime dt) {
					return dt;
				}
				return Visitor.super.visitOther(value);
			}
		}));

	/**
	 * Binary subtype 4, or the canonical string form when human-readable.
	 * Either form is accepted when deserializing.
	 */
	static final Serde<UUID> UUID_SERDE = Serde.of(
		(v, s) -> {
			if (s.isHumanReadable()) {
				s.serializeString(v.toString());
			} else {
				s.serializeBson(Binary.fromUuid(v));
			}
		},
		d -> d.deserializeAny(new Visitor<UUID>() {
			@Override
			public String expecting() {
				return "a UUID";
			}

			@Override
			public UUID visitString(String value) {
				try {
					return UUID.fromString(value);
				} catch (IllegalArgumentException e) {
					throw new BsonConversionException("Invalid UUID string \"" + value + "\"", e);
				}
			}

			@Override
			public UUID visitBinary(Binary value) {
				return value.toUuid();
			}
		}));

	static final Serde<RawDocumentBuf> RAW_DOCUMENT_BUF = Serde.of(
		(v, s) -> s.serializeRawDocument(v.asRawDocument()),
		Deserializer::deserializeRawDocumentBuf);

	static final Serde<RawArrayBuf> RAW_ARRAY_BUF = Serde.of(
		(v, s) -> s.serializeRawArray(v.asRawArray()),
		Deserializer::deserializeRawArrayBuf);

	static final Map<Class<?>, Serde<?>> BY_CLASS = Map.ofEntries(
		entry(boolean.class, BOOLEAN),
		entry(Boolean.class, BOOLEAN),
		entry(byte.class, BYTE),
		entry(Byte.class, BYTE),
		entry(short.class, SHORT),
		entry(Short.class, SHORT),
		entry(int.class, INT),
		entry(Integer.class, INT),
		entry(long.class, LONG),
		entry(Long.class, LONG),
		entry(float.class, FLOAT),
		entry(Float.class, FLOAT),
		entry(double.class, DOUBLE),
		entry(Double.class, DOUBLE),
		entry(char.class, CHAR),
		entry(Character.class, CHAR),
		entry(String.class, STRING),
		entry(byte[].class, BYTES),
		entry(ObjectId.class, OBJECT_ID),
		entry(DateTime.class, DATE_TIME),
		entry(UUID.class, UUID_SERDE),
		entry(RawDocumentBuf.class, RAW_DOCUMENT_BUF),
		entry(RawArrayBuf.class, RAW_ARRAY_BUF)
	);

	static ObjectId parseObjectId(String hex) {
		try {
			return ObjectId.parse(hex);
		} catch (IllegalArgumentException e) {
			throw new BsonConversionException("Invalid ObjectId hex string \"" + hex + "\"", e);
		}
	}

	/**
	 * Accepts int32 and int64 values in the given inclusive range.
	 */
	record IntegerVisitor(String expecting, long min, long max) implements Visitor<Long> {
		@Override
		public Long visitInt32(int value) {
			return check(value, "int32");
		}

		@Override
		public Long visitInt64(long value) {
			return check(value, "int64");
		}

		private long check(long value, String actualType) {
			if (value < min || value > max) {
				throw new BsonMappingException("invalid value: " + actualType + " `" + value + "`, expected " + expecting);
			}
			return value;
		}
	}
}
