package works.bsonic.serde.mapping;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.BsonSerde;
import works.bsonic.types.BsonNull;
import works.bsonic.types.Document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SealedVariantTest {
	BsonSerde serde;

	@BeforeEach
	void setup() {
		serde = new BsonSerde(new SerdeRegistry().useLookup(MethodHandles.lookup()));
	}

	sealed interface Shape permits Circle, Square, Group, Blank { }

	record Circle(double radius) implements Shape { }

	record Square(double side) implements Shape { }

	record Group(String name, List<Shape> members) implements Shape { }

	record Blank() implements Shape { }

	record Drawing(Shape main, Optional<Shape> extra) { }

	sealed interface Odd permits NotRecord { }

	static final class NotRecord implements Odd { }

	static final Drawing DRAWING = new Drawing(
		new Group("g", List.of(new Circle(1.5), new Blank(), new Group("inner", List.of(new Square(2.0))))),
		Optional.of(new Square(3.0)));

	@Test
	void variant_isSingleFieldDocument() {
		Document document = serde.serializeToDocument(new Drawing(new Circle(1.5), Optional.empty()), Drawing.class);
		Document expected = new Document()
			.append("main", new Document().append("Circle", new Document().append("radius", 1.5)))
			.append("extra", BsonNull.INSTANCE);
		assertEquals(expected, document);
		assertEquals(new Document().append("Blank", new Document()), serde.serializeToDocument(new Blank(), Shape.class));
	}

	@Test
	void roundTrip_throughDocument() {
		Document document = serde.serializeToDocument(DRAWING, Drawing.class);
		assertEquals(DRAWING, serde.deserializeFromDocument(document, Drawing.class));
	}

	@Test
	void roundTrip_throughBytes() {
		byte[] bytes = serde.serializeToBytes(DRAWING, Drawing.class);
		assertEquals(DRAWING, serde.deserializeFromBytes(bytes, Drawing.class));
		assertEquals(serde.serializeToDocument(DRAWING, Drawing.class), Document.decode(bytes));
	}

	@Test
	void unknownVariant_fails() {
		Document document = new Document()
			.append("main", new Document().append("Triangle", new Document()))
			.append("extra", BsonNull.INSTANCE);
		BsonMappingException e = assertThrows(BsonMappingException.class, () ->
			serde.deserializeFromBytes(document.encode(), Drawing.class));
		assertTrue(e.getMessage().startsWith("at \"main\": unknown variant `Triangle`, expected one of "), e.getMessage());
		assertEquals("main", e.path().orElseThrow().toString());
	}

	@Test
	void variantDocument_needsExactlyOneField() {
		Document empty = new Document();
		assertThrows(BsonMappingException.class, () -> serde.deserializeFromDocument(empty, Shape.class));

		Document twoFields = new Document()
			.append("Circle", new Document().append("radius", 1.0))
			.append("Square", new Document().append("side", 1.0));
		assertThrows(BsonMappingException.class, () -> serde.deserializeFromDocument(twoFields, Shape.class));
		assertThrows(BsonMappingException.class, () -> serde.deserializeFromBytes(twoFields.encode(), Shape.class));
	}

	@Test
	void nonRecordPermittedSubclass_isRejected() {
		assertThrows(BsonMappingException.class, () -> serde.registry().serdeFor(Odd.class));
	}
}
