package works.bsonic.serde;

import java.lang.invoke.MethodHandles;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawDocument;
import works.bsonic.raw.RawDocumentBuf;
import works.bsonic.serde.mapping.SerdeRegistry;
import works.bsonic.serde.mapping.Unsigned;
import works.bsonic.types.BsonArray;
import works.bsonic.types.Document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ErrorPathTest {
	BsonSerde serde;

	@BeforeEach
	void setup() {
		serde = new BsonSerde(new SerdeRegistry().useLookup(MethodHandles.lookup()));
	}

	record Inner(int value) { }

	record Outer(Inner one, Inner two) { }

	record UnsignedInner(@Unsigned long value) { }

	record UnsignedOuter(UnsignedInner one, UnsignedInner two) { }

	record Listy(List<Inner> items) { }

	static final Document BAD_TWO = new Document()
		.append("one", new Document().append("value", 42))
		.append("two", new Document().append("value", "hello"));

	static final UnsignedOuter TOO_BIG = new UnsignedOuter(new UnsignedInner(1), new UnsignedInner(-1L));

	@Test
	void deserializeFromDocument_reportsPath() {
		BsonMappingException e = assertThrows(BsonMappingException.class, () ->
			serde.deserializeFromDocument(BAD_TWO, Outer.class));
		assertPath("two.value", e);
	}

	@Test
	void deserializeFromBytes_reportsPath() {
		BsonMappingException e = assertThrows(BsonMappingException.class, () ->
			serde.deserializeFromBytes(BAD_TWO.encode(), Outer.class));
		assertPath("two.value", e);
		assertEquals("at \"two.value\": invalid type: string \"hello\", expected an int32", e.getMessage());
	}

	@Test
	void serializeToBson_reportsPath() {
		BsonConversionException e = assertThrows(BsonConversionException.class, () ->
			serde.serializeToBson(TOO_BIG, UnsignedOuter.class));
		assertPath("two.value", e);
	}

	@Test
	void serializeToBytes_reportsPath() {
		BsonConversionException e = assertThrows(BsonConversionException.class, () ->
			serde.serializeToBytes(TOO_BIG, UnsignedOuter.class));
		assertPath("two.value", e);
	}

	@Test
	void arrayIndex_isReported() {
		Document document = new Document().append("items", BsonArray.of(
			new Document().append("value", 1),
			new Document().append("value", true)));
		BsonMappingException e = assertThrows(BsonMappingException.class, () ->
			serde.deserializeFromBytes(document.encode(), Listy.class));
		assertPath("items[1].value", e);
	}

	@Test
	void malformedNestedElement_reportsPath() {
		// A boolean byte of 2 inside "two"
		RawDocumentBuf inner = new RawDocumentBuf().append("value", true);
		byte[] innerBytes = inner.toByteArray();
		innerBytes[innerBytes.length - 2] = 2;
		RawDocumentBuf outer = new RawDocumentBuf()
			.append("one", new RawDocumentBuf().append("value", 1))
			.append("two", RawDocument.fromBytes(innerBytes));
		record BoolInner(boolean value) { }
		record BoolOuter(Inner one, BoolInner two) { }
		BsonFormatException e = assertThrows(BsonFormatException.class, () ->
			serde.deserializeFromBytes(outer.toByteArray(), BoolOuter.class));
		assertPath("two", e);
	}

	@Test
	void trackingDisabled_leavesNoPath() {
		DeserializerOptions options = DeserializerOptions.builder().trackErrorPath(false).build();
		BsonMappingException e = assertThrows(BsonMappingException.class, () ->
			serde.deserializeFromBytes(BAD_TWO.encode(), Outer.class, options));
		assertFalse(e.path().isPresent());
	}

	private static void assertPath(String expected, BsonException e) {
		assertEquals(expected, e.path().orElseThrow().toString());
	}
}
