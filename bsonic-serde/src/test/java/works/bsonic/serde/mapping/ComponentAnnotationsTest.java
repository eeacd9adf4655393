package works.bsonic.serde.mapping;

import java.lang.invoke.MethodHandles;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.BsonSerde;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.helpers.SerdeHelpers;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.types.Binary;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonString;
import works.bsonic.types.DateTime;
import works.bsonic.types.Document;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Timestamp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComponentAnnotationsTest {
	BsonSerde serde;

	@BeforeEach
	void setup() {
		serde = new BsonSerde(new SerdeRegistry().useLookup(MethodHandles.lookup()));
	}

	record Helpers(
		@SerdeWith(SerdeHelpers.U64AsF64.class) long big,
		@SerdeWith(SerdeHelpers.TimestampAsU32.class) Timestamp seconds,
		@SerdeWith(SerdeHelpers.HexStringAsObjectId.class) String idText,
		@SerdeWith(SerdeHelpers.ObjectIdAsHexString.class) ObjectId id,
		@SerdeWith(SerdeHelpers.I64AsDateTime.class) long millis,
		@SerdeWith(SerdeHelpers.Rfc3339StringAsDateTime.class) String when,
		@SerdeWith(SerdeHelpers.UuidAsJavaLegacyBinary.class) UUID legacy
	) { }

	@Test
	void helperClasses_applyPerComponent() {
		Helpers original = new Helpers(
			1L << 53,
			new Timestamp(99, 0),
			"507f1f77bcf86cd799439011",
			ObjectId.parse("507f1f77bcf86cd799439011"),
			1_591_700_287_095L,
			"2020-06-09T10:58:07.095Z",
			UUID.fromString("00112233-4455-6677-8899-aabbccddeeff"));
		Document document = serde.serializeToDocument(original, Helpers.class);
		assertEquals(new BsonDouble(0x1p53), document.get("big").orElseThrow());
		assertEquals(new BsonInt64(99), document.get("seconds").orElseThrow());
		assertEquals(ObjectId.parse(original.idText()), document.get("idText").orElseThrow());
		assertEquals(new BsonString(original.idText()), document.get("id").orElseThrow());
		assertEquals(DateTime.fromMillis(original.millis()), document.get("millis").orElseThrow());
		assertEquals(DateTime.fromMillis(original.millis()), document.get("when").orElseThrow());
		assertEquals(BinarySubtype.UUID_OLD, document.getBinary("legacy").subtype());

		assertEquals(original, serde.deserializeFromDocument(document, Helpers.class));
		assertEquals(original, serde.deserializeFromBytes(serde.serializeToBytes(original, Helpers.class), Helpers.class));
	}

	record SerializeOnly(@SerializeWith(SerdeHelpers.U32AsI32.class) int small) { }

	@Test
	void serializeWith_leavesDeserializationAlone() {
		Document document = serde.serializeToDocument(new SerializeOnly(7), SerializeOnly.class);
		assertEquals(new BsonInt32(7), document.get("small").orElseThrow());
		assertEquals(new SerializeOnly(7), serde.deserializeFromDocument(document, SerializeOnly.class));
		assertThrows(BsonConversionException.class, () -> serde.serializeToDocument(new SerializeOnly(-1), SerializeOnly.class));
	}

	/**
	 * Reads a string, ignoring case.
	 */
	static final class LowerCase implements Serde<String> {
		@Override
		public void serialize(String value, Serializer serializer) {
			serializer.serializeString(value);
		}

		@Override
		public String deserialize(Deserializer deserializer) {
			return text(deserializer).toLowerCase();
		}

		private static String text(Deserializer deserializer) {
			return ((BsonString) deserializer.deserializeBson()).value();
		}
	}

	record Shouting(@DeserializeWith(LowerCase.class) String word) { }

	@Test
	void deserializeWith_leavesSerializationAlone() {
		Document document = new Document().append("word", "HELLO");
		assertEquals(new Shouting("hello"), serde.deserializeFromDocument(document, Shouting.class));
		assertEquals(new Document().append("word", "Hi"), serde.serializeToDocument(new Shouting("Hi"), Shouting.class));
	}

	record BadUnsigned(@Unsigned String text) { }

	record BadNullable(@Nullable int value) { }

	@Test
	void misplacedAnnotations_fail() {
		assertThrows(BsonMappingException.class, () -> serde.registry().serdeFor(BadUnsigned.class));
		assertThrows(BsonMappingException.class, () -> serde.registry().serdeFor(BadNullable.class));
	}

	@Test
	void binaryField_roundTripsWithSubtype() {
		record HasBinary(Binary payload) { }
		HasBinary original = new HasBinary(new Binary(BinarySubtype.of(0x80), new byte[]{4, 5}));
		assertEquals(original, serde.deserializeFromBytes(serde.serializeToBytes(original, HasBinary.class), HasBinary.class));
	}
}
