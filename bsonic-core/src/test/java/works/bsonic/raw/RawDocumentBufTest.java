package works.bsonic.raw;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonEncodingException;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.types.Binary;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonNull;
import works.bsonic.types.BsonString;
import works.bsonic.types.DateTime;
import works.bsonic.types.Document;
import works.bsonic.types.ObjectId;
import works.bsonic.types.Regex;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RawDocumentBufTest {

	@Test
	void empty_isFiveBytes() {
		RawDocumentBuf buf = new RawDocumentBuf();
		assertArrayEquals(new byte[]{5, 0, 0, 0, 0}, buf.toByteArray());
		assertTrue(buf.isEmpty());
	}

	@Test
	void everyAppend_leavesValidDocument() {
		RawDocumentBuf buf = new RawDocumentBuf();
		Document expected = new Document();
		ObjectId id = new ObjectId();

		buf.append("s", "hello");
		expected.append("s", "hello");
		assertValid(buf, expected);

		buf.append("i", 42);
		expected.append("i", 42);
		assertValid(buf, expected);

		buf.append("l", 1L << 40);
		expected.append("l", 1L << 40);
		assertValid(buf, expected);

		buf.append("id", id);
		expected.append("id", id);
		assertValid(buf, expected);

		buf.append("when", DateTime.MAX);
		expected.append("when", DateTime.MAX);
		assertValid(buf, expected);

		buf.append("null", BsonNull.INSTANCE);
		expected.append("null", BsonNull.INSTANCE);
		assertValid(buf, expected);

		RawDocumentBuf nested = new RawDocumentBuf().append("inner", true);
		buf.append("doc", nested);
		expected.append("doc", new Document().append("inner", true));
		assertValid(buf, expected);

		assertEquals(expected.encode().length, buf.length());
		assertArrayEquals(expected.encode(), buf.toByteArray());
	}

	private static void assertValid(RawDocumentBuf buf, Document expected) {
		byte[] bytes = buf.toByteArray();
		assertEquals(bytes.length, bytes[0] & 0xFF | (bytes[1] & 0xFF) << 8 | (bytes[2] & 0xFF) << 16 | (bytes[3] & 0xFF) << 24);
		assertEquals(expected, RawDocument.fromBytes(bytes).toDocument());
	}

	@Test
	void nulInKey_rejectedAndBufferUnchanged() {
		RawDocumentBuf buf = new RawDocumentBuf().append("ok", 1);
		byte[] before = buf.toByteArray();
		assertThrows(BsonEncodingException.class, () -> buf.append("bad\0key", 2));
		assertArrayEquals(before, buf.toByteArray());
		buf.append("next", 3);
		assertEquals(3, buf.asRawDocument().getInt32("next"));
	}

	@Test
	void nulInNestedKey_rejectedAndBufferUnchanged() {
		RawDocumentBuf buf = new RawDocumentBuf().append("ok", 1);
		byte[] before = buf.toByteArray();
		Document bad = new Document().append("fine", 1).append("not\0fine", 2);
		assertThrows(BsonEncodingException.class, () -> buf.append("nested", bad));
		assertArrayEquals(before, buf.toByteArray());
		assertThrows(BsonEncodingException.class, () -> buf.append("re", new Regex("a\0", "")));
		assertArrayEquals(before, buf.toByteArray());
	}

	@Test
	void rawRefFromSameBuffer_canBeAppended() {
		RawDocumentBuf buf = new RawDocumentBuf().append("a", "copy me");
		buf.append("b", buf.get("a").orElseThrow());
		buf.append("self", buf);
		Document doc = buf.toDocument();
		assertEquals("copy me", doc.getString("b"));
		assertEquals(new Document().append("a", "copy me").append("b", "copy me"), doc.getDocument("self"));
	}

	@Test
	void arrayPush_synthesizesSequentialKeys() {
		RawArrayBuf array = new RawArrayBuf()
			.push("zero")
			.push(1)
			.push(new Binary(BinarySubtype.GENERIC, new byte[]{1, 2}));
		List<String> keys = new ArrayList<>();
		array.asRawDocumentBuf().forEach(e -> keys.add(e.key()));
		assertEquals(List.of("0", "1", "2"), keys);
		assertEquals(3, array.size());
		assertEquals(1, array.get(1).orElseThrow().asInt32());
		assertEquals(BsonArray.of(new BsonString("zero"), new BsonInt32(1), Binary.generic(new byte[]{1, 2})), array.toBsonArray());
	}

	@Test
	void arrayFromDocumentBuf_countsOnce() {
		RawDocumentBuf doc = new RawDocumentBuf().append("0", "a").append("1", "b");
		RawArrayBuf array = RawArrayBuf.fromRawDocumentBuf(doc);
		assertEquals(2, array.size());
		array.push("c");
		assertEquals("c", array.asRawArray().asDocument().getString("2"));
	}

	@Test
	void arrayNestedInDocument() {
		RawArrayBuf array = RawArrayBuf.of(List.of(new BsonInt32(5), new BsonInt32(6)));
		RawDocumentBuf doc = new RawDocumentBuf().append("xs", array);
		assertEquals(BsonArray.of(new BsonInt32(5), new BsonInt32(6)), doc.toDocument().getArray("xs"));
		assertEquals(2, doc.asRawDocument().getArray("xs").size());
	}

	@Test
	void appendViewOfItself_copiesPriorContents() {
		RawDocumentBuf buf = new RawDocumentBuf().append("a", 1);
		buf.append("self", buf.asRawDocument());
		Document expected = new Document().append("a", 1);
		assertEquals(new Document().append("a", 1).append("self", expected), buf.toDocument());
		assertEquals(buf.length(), RawDocument.fromBytes(buf.toByteArray()).length());
	}

	@Test
	void pushViewOfItself_copiesPriorContents() {
		RawArrayBuf array = new RawArrayBuf().push(1);
		array.push(array.asRawArray());
		array.push(array.asRawDocumentBuf());
		BsonArray inner = BsonArray.of(new BsonInt32(1));
		Document innerAsDocument = new Document().append("0", 1).append("1", inner);
		assertEquals(BsonArray.of(new BsonInt32(1), inner, innerAsDocument), array.toBsonArray());
		assertEquals(3, array.size());
	}

	@Test
	void appendElementOfItself_copiesValue() {
		RawDocumentBuf buf = new RawDocumentBuf().append("a", new Document().append("x", "y"));
		buf.append("b", buf.get("a").orElseThrow());
		assertEquals(buf.toDocument().getDocument("a"), buf.toDocument().getDocument("b"));
	}

	@Test
	void arrayDocumentBuf_isDetached() {
		RawArrayBuf array = new RawArrayBuf().push(1);
		array.asRawDocumentBuf().append("x", 2);
		array.push(3);
		List<String> keys = new ArrayList<>();
		array.asRawArray().asDocument().forEach(e -> keys.add(e.key()));
		assertEquals(List.of("0", "1"), keys);
		assertEquals(2, array.size());
	}

	@Test
	void arrayFromDocumentBuf_copiesArgument() {
		RawDocumentBuf doc = new RawDocumentBuf().append("0", "a");
		RawArrayBuf array = RawArrayBuf.fromRawDocumentBuf(doc);
		doc.append("x", "b");
		array.push("c");
		assertEquals(BsonArray.of(new BsonString("a"), new BsonString("c")), array.toBsonArray());
	}
}
