package works.bsonic.serde;

import java.lang.invoke.MethodHandles;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.serde.mapping.SerdeRegistry;
import works.bsonic.types.BsonString;
import works.bsonic.types.DateTime;
import works.bsonic.types.Document;
import works.bsonic.types.ObjectId;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bsonic.exceptions.BsonFormatException.Kind.INVALID_UTF8;

class ModeWrapperTest {
	BsonSerde serde;

	@BeforeEach
	void setup() {
		serde = new BsonSerde(new SerdeRegistry().useLookup(MethodHandles.lookup()));
	}

	record Event(ObjectId id, DateTime at, UUID uuid, String name) { }

	record Mixed(HumanReadable<Event> readable, Event plain) { }

	record Named(String name) { }

	record Count(int count) { }

	static final Event EVENT = new Event(
		ObjectId.parse("507f1f77bcf86cd799439011"),
		DateTime.fromMillis(1_591_700_287_095L),
		UUID.fromString("00112233-4455-6677-8899-aabbccddeeff"),
		"launch");

	static final TypeReference<HumanReadable<Event>> READABLE_EVENT = new TypeReference<HumanReadable<Event>>() { };

	@Test
	void humanReadable_usesStrings() {
		Document document = serde.serializeToDocument(new HumanReadable<>(EVENT), READABLE_EVENT);
		assertEquals(new BsonString("507f1f77bcf86cd799439011"), document.get("id").orElseThrow());
		assertEquals(new BsonString("2020-06-09T10:58:07.095Z"), document.get("at").orElseThrow());
		assertEquals(new BsonString("00112233-4455-6677-8899-aabbccddeeff"), document.get("uuid").orElseThrow());
	}

	@Test
	void humanReadable_isIdempotent() {
		byte[] first = serde.serializeToBytes(new HumanReadable<>(EVENT), READABLE_EVENT);
		HumanReadable<Event> decoded = serde.deserializeFromBytes(first, READABLE_EVENT);
		assertEquals(EVENT, decoded.value());
		byte[] second = serde.serializeToBytes(decoded, READABLE_EVENT);
		assertArrayEquals(first, second);
		assertArrayEquals(first, serde.serializeToDocument(decoded, READABLE_EVENT).encode());
	}

	@Test
	void humanReadable_appliesOnlyToItsSubtree() {
		Document document = serde.serializeToDocument(new Mixed(new HumanReadable<>(EVENT), EVENT), Mixed.class);
		assertEquals(new BsonString(EVENT.id().toHex()), document.getDocument("readable").get("id").orElseThrow());
		assertEquals(EVENT.id(), document.getDocument("plain").get("id").orElseThrow());
		assertEquals(EVENT.at(), document.getDocument("plain").get("at").orElseThrow());

		Mixed decoded = serde.deserializeFromBytes(document.encode(), Mixed.class);
		assertEquals(EVENT, decoded.readable().value());
		assertEquals(EVENT, decoded.plain());
	}

	@Test
	void humanReadableOption_matchesWrapper() {
		SerializerOptions readable = SerializerOptions.builder().humanReadable(true).build();
		Document document = serde.serializeToDocument(new HumanReadable<>(EVENT), serde.registry().serdeFor(READABLE_EVENT), readable);
		assertEquals(new BsonString(EVENT.id().toHex()), document.get("id").orElseThrow());

		Document viaOption = serde.serializeToDocument(EVENT, serde.registry().serdeFor(Event.class), readable);
		assertEquals(document, viaOption);
	}

	@Test
	void nativeForms_areReadEvenWhenExpectingText() {
		byte[] nativeBytes = serde.serializeToBytes(EVENT, Event.class);
		assertEquals(EVENT, serde.deserializeFromBytes(nativeBytes, READABLE_EVENT).value());
	}

	@Test
	void invalidUtf8_failsUnlessLossy() {
		byte[] bytes = new RawDocumentBuf().append("name", "aXb").toByteArray();
		// 4-byte length, tag, "name\0", 4-byte string length, then "aXb\0"
		assertEquals((byte) 'X', bytes[15]);
		bytes[15] = (byte) 0xFF;

		BsonFormatException e = assertThrows(BsonFormatException.class, () ->
			serde.deserializeFromBytes(bytes, Named.class));
		assertEquals(INVALID_UTF8, e.kind());
		assertEquals("name", e.path().orElseThrow().toString());

		Utf8LossyDeserialization<Named> lossy = serde.deserializeFromBytes(bytes, new TypeReference<Utf8LossyDeserialization<Named>>() { });
		assertEquals("a\uFFFDb", lossy.value().name());

		DeserializerOptions lossyOption = DeserializerOptions.builder().utf8Lossy(true).build();
		assertEquals(new Named("a\uFFFDb"), serde.deserializeFromBytes(bytes, Named.class, lossyOption));
	}

	@Test
	void invalidUtf8InSkippedField_failsUnlessLossy() {
		RawDocumentBuf nested = new RawDocumentBuf().append("inner", "aXb");
		for (RawDocumentBuf buf : new RawDocumentBuf[]{
			new RawDocumentBuf().append("count", 1).append("junk", "aXb"),
			new RawDocumentBuf().append("count", 1).append("junk", nested)
		}) {
			byte[] bytes = replaceX(buf.toByteArray());
			BsonFormatException e = assertThrows(BsonFormatException.class, () ->
				serde.deserializeFromBytes(bytes, Count.class));
			assertEquals(INVALID_UTF8, e.kind());
			assertTrue(e.path().orElseThrow().toString().startsWith("junk"));

			DeserializerOptions lossyOption = DeserializerOptions.builder().utf8Lossy(true).build();
			assertEquals(new Count(1), serde.deserializeFromBytes(bytes, Count.class, lossyOption));
		}
	}

	private static byte[] replaceX(byte[] bytes) {
		for (int i = 0; i < bytes.length; i++) {
			if (bytes[i] == 'X') {
				bytes[i] = (byte) 0xFF;
			}
		}
		return bytes;
	}

	@Test
	void utf8Lossy_isTransparentWhenSerializing() {
		TypeReference<Utf8LossyDeserialization<Named>> type = new TypeReference<Utf8LossyDeserialization<Named>>() { };
		assertArrayEquals(
			serde.serializeToBytes(new Named("x"), Named.class),
			serde.serializeToBytes(new Utf8LossyDeserialization<>(new Named("x")), type));
	}

	@Test
	void optionsForNewtype_switchOnlyOnReservedNames() {
		SerializerOptions plain = SerializerOptions.DEFAULT;
		assertTrue(plain.forNewtype(HumanReadable.NEWTYPE_NAME).humanReadable());
		assertFalse(plain.forNewtype("Meters").humanReadable());

		DeserializerOptions deserializerOptions = DeserializerOptions.DEFAULT;
		assertTrue(deserializerOptions.forNewtype(Utf8LossyDeserialization.NEWTYPE_NAME).utf8Lossy());
		assertFalse(deserializerOptions.forNewtype(Utf8LossyDeserialization.NEWTYPE_NAME).humanReadable());
		assertTrue(deserializerOptions.forNewtype(HumanReadable.NEWTYPE_NAME).humanReadable());
	}
}
