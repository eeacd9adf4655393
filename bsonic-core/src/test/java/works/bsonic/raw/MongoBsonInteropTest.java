package works.bsonic.raw;

import java.util.UUID;
import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.junit.jupiter.api.Test;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.types.Binary;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonString;
import works.bsonic.types.DateTime;
import works.bsonic.types.Document;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Regex;
import works.bsonic.types.Timestamp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Uses the MongoDB Java driver's BSON library as an independent reference implementation.
 */
class MongoBsonInteropTest {
	static final String OID_HEX = "507f1f77bcf86cd799439011";

	@Test
	void ourBytes_readByMongo() {
		UUID uuid = UUID.randomUUID();
		Document doc = new Document()
			.append("s", "héllo")
			.append("i", 42)
			.append("l", 1L << 40)
			.append("d", 2.5)
			.append("b", true)
			.append("oid", ObjectId.parse(OID_HEX))
			.append("date", DateTime.fromMillis(-1234))
			.append("ts", new Timestamp(100, 7))
			.append("re", new Regex("^x", "i"))
			.append("uuid", Binary.fromUuid(uuid))
			.append("arr", BsonArray.of(new BsonInt32(1), new BsonString("two")))
			.append("nested", new Document().append("x", 1));

		RawBsonDocument theirs = new RawBsonDocument(doc.encode());
		assertEquals("héllo", theirs.getString("s").getValue());
		assertEquals(42, theirs.getInt32("i").getValue());
		assertEquals(1L << 40, theirs.getInt64("l").getValue());
		assertEquals(2.5, theirs.getDouble("d").getValue());
		assertEquals(true, theirs.getBoolean("b").getValue());
		assertEquals(OID_HEX, theirs.getObjectId("oid").getValue().toHexString());
		assertEquals(-1234, theirs.getDateTime("date").getValue());
		assertEquals(100, theirs.getTimestamp("ts").getTime());
		assertEquals(7, theirs.getTimestamp("ts").getInc());
		assertEquals("^x", theirs.getRegularExpression("re").getPattern());
		assertEquals(uuid, theirs.getBinary("uuid").asUuid());
		assertEquals(2, theirs.getArray("arr").size());
		assertEquals("two", theirs.getArray("arr").get(1).asString().getValue());
		assertEquals(1, theirs.getDocument("nested").getInt32("x").getValue());
	}

	@Test
	void mongoBytes_readByUs() {
		BsonDocument theirs = new BsonDocument()
			.append("s", new org.bson.BsonString("world"))
			.append("i", new org.bson.BsonInt32(-5))
			.append("l", new org.bson.BsonInt64(Long.MIN_VALUE))
			.append("oid", new org.bson.BsonObjectId(new org.bson.types.ObjectId(OID_HEX)))
			.append("date", new org.bson.BsonDateTime(1_000))
			.append("ts", new org.bson.BsonTimestamp(100, 7))
			.append("bin", new org.bson.BsonBinary((byte) 0x80, new byte[]{1, 2, 3}))
			.append("code", new org.bson.BsonJavaScriptWithScope("x", new BsonDocument("x", new org.bson.BsonInt32(1))))
			.append("arr", new org.bson.BsonArray(java.util.List.of(new org.bson.BsonInt32(9))))
			.append("null", org.bson.BsonNull.VALUE)
			.append("min", new org.bson.BsonMinKey())
			.append("max", new org.bson.BsonMaxKey());
		byte[] bytes = encode(theirs);

		RawDocument raw = RawDocument.fromBytes(bytes);
		assertEquals("world", raw.getString("s"));
		assertEquals(-5, raw.getInt32("i"));
		assertEquals(Long.MIN_VALUE, raw.getInt64("l"));
		assertEquals(ObjectId.parse(OID_HEX), raw.getObjectId("oid"));
		assertEquals(DateTime.fromMillis(1_000), raw.getDateTime("date"));
		assertEquals(new Timestamp(100, 7), raw.getTimestamp("ts"));
		assertEquals(BinarySubtype.of(0x80), raw.getBinary("bin").subtype());
		assertArrayEquals(new byte[]{1, 2, 3}, raw.getBinary("bin").toByteArray());
		assertEquals("x", raw.get("code").orElseThrow().asJavaScriptCodeWithScope().code());
		assertEquals(9, raw.getArray("arr").get(0).orElseThrow().asInt32());

		Document ours = raw.toDocument();
		assertArrayEquals(bytes, ours.encode());
		assertArrayEquals(bytes, RawDocumentBuf.fromDocument(ours).toByteArray());
	}

	private static byte[] encode(BsonDocument document) {
		BasicOutputBuffer buffer = new BasicOutputBuffer();
		try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
			new BsonDocumentCodec().encode(writer, document, EncoderContext.builder().build());
		}
		return buffer.toByteArray();
	}
}
