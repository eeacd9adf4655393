package works.bsonic.serde.bridge;

import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawWriter;
import works.bsonic.serde.ArraySerializer;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.HumanReadable;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.SerializerOptions;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonNull;
import works.bsonic.types.BsonString;
import works.bsonic.types.DateTime;
import works.bsonic.types.Document;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RawSerializerTest {

	/**
	 * Writes {@code {"a": 1, "list": ["x", null, {"d": <date>}], "wrapped": "w"}} by hand.
	 */
	static final Serialize<Object> HAND_WRITTEN = (ignored, s) -> {
		DocumentSerializer document = s.serializeDocument();
		document.field("a", 1, (v, ss) -> ss.serializeInt32(v));
		document.field("list", null, (v, ss) -> {
			ArraySerializer array = ss.serializeArray();
			array.element("x", (e, es) -> es.serializeString(e));
			array.element(null, (e, es) -> es.serializeNull());
			array.element(DateTime.fromMillis(3), (e, es) -> {
				DocumentSerializer inner = es.serializeDocument();
				inner.field("d", e, (dv, ds) -> ds.serializeBson(dv));
				inner.end();
			});
			array.end();
		});
		document.field("wrapped", "w", (v, ss) -> ss.serializeNewtype("Meters", v, (nv, ns) -> ns.serializeString(nv)));
		document.end();
	};

	static final Document EXPECTED = new Document()
		.append("a", 1)
		.append("list", BsonArray.of(new BsonString("x"), BsonNull.INSTANCE, new Document().append("d", DateTime.fromMillis(3))))
		.append("wrapped", "w");

	@Test
	void bytes_matchTypedRoute() {
		RawWriter writer = new RawWriter();
		RawSerializer raw = new RawSerializer(writer, SerializerOptions.DEFAULT);
		HAND_WRITTEN.serialize(null, raw);
		raw.checkWritten();
		assertArrayEquals(EXPECTED.encode(), writer.toByteArray());

		BsonValueSerializer typed = new BsonValueSerializer(SerializerOptions.DEFAULT);
		HAND_WRITTEN.serialize(null, typed);
		assertEquals(EXPECTED, typed.result());
	}

	@Test
	void topLevel_mustBeDocument() {
		RawSerializer raw = new RawSerializer(new RawWriter(), SerializerOptions.DEFAULT);
		assertThrows(BsonMappingException.class, () -> raw.serializeInt32(1));
	}

	@Test
	void topLevelNewtype_mustStillBeDocument() {
		RawSerializer raw = new RawSerializer(new RawWriter(), SerializerOptions.DEFAULT);
		assertThrows(BsonMappingException.class, () -> raw.serializeNewtype("N", "x", (v, s) -> s.serializeString(v)));
	}

	@Test
	void fieldWithNoValue_failsWithPath() {
		Serialize<Object> silent = (v, s) -> { };
		for (Serializer serializer : new Serializer[]{
			new RawSerializer(new RawWriter(), SerializerOptions.DEFAULT),
			new BsonValueSerializer(SerializerOptions.DEFAULT)
		}) {
			DocumentSerializer document = serializer.serializeDocument();
			BsonMappingException e = assertThrows(BsonMappingException.class, () -> document.field("quiet", "v", silent));
			assertEquals("quiet", e.path().orElseThrow().toString());
		}
	}

	@Test
	void secondValue_fails() {
		BsonValueSerializer typed = new BsonValueSerializer(SerializerOptions.DEFAULT);
		typed.serializeInt32(1);
		assertThrows(BsonMappingException.class, () -> typed.serializeInt32(2));
		assertEquals(new BsonInt32(1), typed.result());
	}

	@Test
	void humanReadableNewtype_switchesModeForSubtree() {
		BsonValueSerializer typed = new BsonValueSerializer(SerializerOptions.DEFAULT);
		typed.serializeNewtype(HumanReadable.NEWTYPE_NAME, null, (v, s) ->
			s.serializeString(Boolean.toString(s.isHumanReadable())));
		Bson result = typed.result();
		assertEquals(new BsonString("true"), result);
	}
}
