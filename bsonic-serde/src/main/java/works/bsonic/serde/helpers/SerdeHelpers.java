package works.bsonic.serde.helpers;

import java.util.UUID;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.Visitor;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.DateTime;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Timestamp;
import works.bsonic.types.UuidRepresentation;

/**
 * Alternative representations for individual values.
 * <p>
 * Each conversion is available as a static method,
 * usable as a method reference wherever a {@link Serialize} or {@link works.bsonic.serde.Deserialize} is expected,
 * and as a nested class suitable for the record component annotations in
 * {@link works.bsonic.serde.mapping}.
 * <p>
 * Unsigned integers are passed as the bits of the corresponding signed type.
 * Conversions that would lose information throw {@link BsonConversionException}.
 */
public final class SerdeHelpers {
	private SerdeHelpers() { }

	private static final double TWO_TO_THE_64 = 0x1p64;
	private static final double TWO_TO_THE_63 = 0x1p63;

	//
	// Unsigned integers
	//

	public static void serializeU32AsI32(int bits, Serializer serializer) {
		if (bits < 0) {
			throw new BsonConversionException("cannot convert u32 " + Integer.toUnsignedString(bits) + " to i32");
		}
		serializer.serializeInt32(bits);
	}

	public static void serializeU32AsI64(int bits, Serializer serializer) {
		serializer.serializeInt64(Integer.toUnsignedLong(bits));
	}

	public static void serializeU64AsI32(long bits, Serializer serializer) {
		if (bits < 0 || bits > Integer.MAX_VALUE) {
			throw new BsonConversionException("cannot convert u64 " + Long.toUnsignedString(bits) + " to i32");
		}
		serializer.serializeInt32((int) bits);
	}

	public static void serializeU64AsI64(long bits, Serializer serializer) {
		if (bits < 0) {
			throw new BsonConversionException("cannot convert u64 " + Long.toUnsignedString(bits) + " to i64");
		}
		serializer.serializeInt64(bits);
	}

	public static void serializeU32AsF64(int bits, Serializer serializer) {
		serializer.serializeDouble(Integer.toUnsignedLong(bits));
	}

	/**
	 * Accepts a double that is within {@link Math#ulp(double) ulp(1.0)} of an integer in the u32 range.
	 */
	public static int deserializeU32FromF64(Deserializer deserializer) {
		double value = deserializer.deserializeAny(DOUBLE_VISITOR);
		double saturated = saturatingU32(value);
		if (Math.abs(value - saturated) <= Math.ulp(1.0)) {
			return (int) (long) saturated;
		}
		throw new BsonConversionException("cannot convert f64 " + value + " to u32");
	}

	/**
	 * @throws BsonConversionException if the double nearest the value is not exactly equal to it,
	 * or the value is the u64 maximum
	 */
	public static void serializeU64AsF64(long bits, Serializer serializer) {
		double value = unsignedToDouble(bits);
		if (bits == -1L || bits != saturatingU64(value)) {
			throw new BsonConversionException("cannot convert u64 " + Long.toUnsignedString(bits) + " to f64 without losing precision");
		}
		serializer.serializeDouble(value);
	}

	/**
	 * Accepts only non-negative whole numbers below 2<sup>64</sup>.
	 */
	public static long deserializeU64FromF64(Deserializer deserializer) {
		double value = deserializer.deserializeAny(DOUBLE_VISITOR);
		if (Double.isNaN(value) || value < 0 || value >= TWO_TO_THE_64 || value != Math.floor(value)) {
			throw new BsonConversionException("cannot convert f64 " + value + " to u64");
		}
		return saturatingU64(value);
	}

	static double unsignedToDouble(long bits) {
		if (bits >= 0) {
			return bits;
		}
		// Halve, keeping the low bit so rounding comes out the same, then double
		return (double) ((bits >>> 1) | (bits & 1)) * 2.0;
	}

	static double saturatingU32(double value) {
		if (Double.isNaN(value) || value <= 0) {
			return 0;
		}
		return Math.floor(Math.min(value, 0xFFFF_FFFFL));
	}

	/**
	 * @return the bits of the u64 nearest {@code value} toward zero, clamped to the u64 range
	 */
	static long saturatingU64(double value) {
		if (Double.isNaN(value) || value <= 0) {
			return 0;
		} else if (value >= TWO_TO_THE_64) {
			return -1L;
		} else if (value >= TWO_TO_THE_63) {
			return (long) (value - TWO_TO_THE_63) | Long.MIN_VALUE;
		} else {
			return (long) value;
		}
	}

	//
	// Timestamps
	//

	/**
	 * @throws BsonConversionException if the increment is not zero
	 */
	public static void serializeTimestampAsU32(Timestamp value, Serializer serializer) {
		if (value.increment() != 0) {
			throw new BsonConversionException("cannot convert Timestamp with a non-zero increment to u32: " + value);
		}
		serializer.serializeU32((int) value.time());
	}

	public static Timestamp deserializeTimestampFromU32(Deserializer deserializer) {
		long time = deserializer.deserializeAny(U32_VISITOR);
		return new Timestamp(time, 0);
	}

	public static void serializeU32AsTimestamp(int bits, Serializer serializer) {
		serializer.serializeBson(Timestamp.fromBits(bits, 0));
	}

	/**
	 * Ignores the increment.
	 */
	public static int deserializeU32FromTimestamp(Deserializer deserializer) {
		return (int) deserializer.deserializeAny(new OtherVisitor<>(Timestamp.class)).time();
	}

	//
	// ObjectIds
	//

	public static void serializeObjectIdAsHexString(ObjectId value, Serializer serializer) {
		serializer.serializeString(value.toHex());
	}

	public static ObjectId deserializeObjectIdFromHexString(Deserializer deserializer) {
		return parseObjectId(deserializer.deserializeAny(STRING_VISITOR));
	}

	public static void serializeHexStringAsObjectId(String value, Serializer serializer) {
		serializer.serializeBson(parseObjectId(value));
	}

	public static String deserializeHexStringFromObjectId(Deserializer deserializer) {
		return deserializer.deserializeAny(new OtherVisitor<>(ObjectId.class)).toHex();
	}

	private static ObjectId parseObjectId(String hex) {
		try {
			return ObjectId.parse(hex);
		} catch (IllegalArgumentException e) {
			throw new BsonConversionException("cannot convert \"" + hex + "\" to ObjectId", e);
		}
	}

	//
	// Date-times
	//

	public static void serializeDateTimeAsRfc3339String(DateTime value, Serializer serializer) {
		serializer.serializeString(value.tryToRfc3339String());
	}

	public static DateTime deserializeDateTimeFromRfc3339String(Deserializer deserializer) {
		return DateTime.parseRfc3339(deserializer.deserializeAny(STRING_VISITOR));
	}

	public static void serializeRfc3339StringAsDateTime(String value, Serializer serializer) {
		serializer.serializeBson(DateTime.parseRfc3339(value));
	}

	public static String deserializeRfc3339StringFromDateTime(Deserializer deserializer) {
		return deserializer.deserializeAny(new OtherVisitor<>(DateTime.class)).tryToRfc3339String();
	}

	public static void serializeI64AsDateTime(long millis, Serializer serializer) {
		serializer.serializeBson(DateTime.fromMillis(millis));
	}

	public static long deserializeI64FromDateTime(Deserializer deserializer) {
		return deserializer.deserializeAny(new OtherVisitor<>(DateTime.class)).millis();
	}

	//
	// UUIDs
	//

	/**
	 * Always binary subtype 4, even in human-readable mode.
	 */
	public static void serializeUuidAsBinary(UUID value, Serializer serializer) {
		serializeUuidAsBinary(value, UuidRepresentation.STANDARD, serializer);
	}

	public static UUID deserializeUuidFromBinary(Deserializer deserializer) {
		return deserializeUuidFromBinary(UuidRepresentation.STANDARD, deserializer);
	}

	public static void serializeUuidAsBinary(UUID value, UuidRepresentation representation, Serializer serializer) {
		serializer.serializeBson(Binary.fromUuidWithRepresentation(value, representation));
	}

	/**
	 * @throws BsonConversionException if the binary subtype doesn't match {@code representation}
	 */
	public static UUID deserializeUuidFromBinary(UuidRepresentation representation, Deserializer deserializer) {
		return deserializer.deserializeAny(BINARY_VISITOR).toUuidWithRepresentation(representation);
	}

	//
	// Classes for use with annotations
	//

	public static final class U32AsI32 implements Serialize<Integer> {
		@Override
		public void serialize(Integer value, Serializer serializer) {
			serializeU32AsI32(value, serializer);
		}
	}

	public static final class U32AsI64 implements Serialize<Integer> {
		@Override
		public void serialize(Integer value, Serializer serializer) {
			serializeU32AsI64(value, serializer);
		}
	}

	public static final class U64AsI32 implements Serialize<Long> {
		@Override
		public void serialize(Long value, Serializer serializer) {
			serializeU64AsI32(value, serializer);
		}
	}

	public static final class U64AsI64 implements Serialize<Long> {
		@Override
		public void serialize(Long value, Serializer serializer) {
			serializeU64AsI64(value, serializer);
		}
	}

	public static final class U32AsF64 implements Serde<Integer> {
		@Override
		public void serialize(Integer value, Serializer serializer) {
			serializeU32AsF64(value, serializer);
		}

		@Override
		public Integer deserialize(Deserializer deserializer) {
			return deserializeU32FromF64(deserializer);
		}
	}

	public static final class U64AsF64 implements Serde<Long> {
		@Override
		public void serialize(Long value, Serializer serializer) {
			serializeU64AsF64(value, serializer);
		}

		@Override
		public Long deserialize(Deserializer deserializer) {
			return deserializeU64FromF64(deserializer);
		}
	}

	public static final class TimestampAsU32 implements Serde<Timestamp> {
		@Override
		public void serialize(Timestamp value, Serializer serializer) {
			serializeTimestampAsU32(value, serializer);
		}

		@Override
		public Timestamp deserialize(Deserializer deserializer) {
			return deserializeTimestampFromU32(deserializer);
		}
	}

	public static final class U32AsTimestamp implements Serde<Integer> {
		@Override
		public void serialize(Integer value, Serializer serializer) {
			serializeU32AsTimestamp(value, serializer);
		}

		@Override
		public Integer deserialize(Deserializer deserializer) {
			return deserializeU32FromTimestamp(deserializer);
		}
	}

	public static final class ObjectIdAsHexString implements Serde<ObjectId> {
		@Override
		public void serialize(ObjectId value, Serializer serializer) {
			serializeObjectIdAsHexString(value, serializer);
		}

		@Override
		public ObjectId deserialize(Deserializer deserializer) {
			return deserializeObjectIdFromHexString(deserializer);
		}
	}

	public static final class HexStringAsObjectId implements Serde<String> {
		@Override
		public void serialize(String value, Serializer serializer) {
			serializeHexStringAsObjectId(value, serializer);
		}

		@Override
		public String deserialize(Deserializer deserializer) {
			return deserializeHexStringFromObjectId(deserializer);
		}
	}

	public static final class DateTimeAsRfc3339String implements Serde<DateTime> {
		@Override
		public void serialize(DateTime value, Serializer serializer) {
			serializeDateTimeAsRfc3339String(value, serializer);
		}

		@Override
		public DateTime deserialize(Deserializer deserializer) {
			return deserializeDateTimeFromRfc3339String(deserializer);
		}
	}

	public static final class Rfc3339StringAsDateTime implements Serde<String> {
		@Override
		public void serialize(String value, Serializer serializer) {
			serializeRfc3339StringAsDateTime(value, serializer);
		}

		@Override
		public String deserialize(Deserializer deserializer) {
			return deserializeRfc3339StringFromDateTime(deserializer);
		}
	}

	public static final class I64AsDateTime implements Serde<Long> {
		@Override
		public void serialize(Long value, Serializer serializer) {
			serializeI64AsDateTime(value, serializer);
		}

		@Override
		public Long deserialize(Deserializer deserializer) {
			return deserializeI64FromDateTime(deserializer);
		}
	}

	/**
	 * UUID as binary in a fixed representation.
	 */
	public abstract static class UuidAsBinaryWith implements Serde<UUID> {
		private final UuidRepresentation representation;

		protected UuidAsBinaryWith(UuidRepresentation representation) {
			this.representation = representation;
		}

		@Override
		public void serialize(UUID value, Serializer serializer) {
			serializeUuidAsBinary(value, representation, serializer);
		}

		@Override
		public UUID deserialize(Deserializer deserializer) {
			return deserializeUuidFromBinary(representation, deserializer);
		}
	}

	public static final class UuidAsBinary extends UuidAsBinaryWith {
		public UuidAsBinary() {
			super(UuidRepresentation.STANDARD);
		}
	}

	public static final class UuidAsJavaLegacyBinary extends UuidAsBinaryWith {
		public UuidAsJavaLegacyBinary() {
			super(UuidRepresentation.JAVA_LEGACY);
		}
	}

	public static final class UuidAsPythonLegacyBinary extends UuidAsBinaryWith {
		public UuidAsPythonLegacyBinary() {
			super(UuidRepresentation.PYTHON_LEGACY);
		}
	}

	public static final class UuidAsCSharpLegacyBinary extends UuidAsBinaryWith {
		public UuidAsCSharpLegacyBinary() {
			super(UuidRepresentation.C_SHARP_LEGACY);
		}
	}

	//
	// Visitors
	//

	private static final Visitor<Double> DOUBLE_VISITOR = new Visitor<>() {
		@Override
		public String expecting() {
			return "a double";
		}

		@Override
		public Double visitDouble(double value) {
			return value;
		}
	};

	private static final Visitor<String> STRING_VISITOR = new Visitor<>() {
		@Override
		public String expecting() {
			return "a string";
		}

		@Override
		public String visitString(String value) {
			return value;
		}
	};

	private static final Visitor<Binary> BINARY_VISITOR = new Visitor<>() {
		@Override
		public String expecting() {
			return "a binary";
		}

		@Override
		public Binary visitBinary(Binary value) {
			return value;
		}
	};

	private static final Visitor<Long> U32_VISITOR = new Visitor<>() {
		@Override
		public String expecting() {
			return "a u32";
		}

		@Override
		public Long visitInt32(int value) {
			return check(value);
		}

		@Override
		public Long visitInt64(long value) {
			return check(value);
		}

		private long check(long value) {
			if (value < 0 || value > 0xFFFF_FFFFL) {
				throw new BsonConversionException("cannot convert " + value + " to u32");
			}
			return value;
		}
	};

	/**
	 * Accepts values of one of the types that have no dedicated {@link Visitor} method.
	 */
	private record OtherVisitor<B extends Bson>(Class<B> type) implements Visitor<B> {
		@Override
		public String expecting() {
			return "a " + type.getSimpleName();
		}

		@Override
		public B visitOther(Bson value) {
			if (type.isInstance(value)) {
				return type.cast(value);
			}
			return Visitor.super.visitOther(value);
		}
	}
}
