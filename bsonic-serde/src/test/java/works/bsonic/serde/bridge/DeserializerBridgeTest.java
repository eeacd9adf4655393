package works.bsonic.serde.bridge;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.bsonic.exceptions.BsonFormatException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.raw.RawDocument;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.DeserializerOptions;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.Visitor;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.Document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.bsonic.exceptions.BsonFormatException.Kind.TRAILING_BYTES;

/**
 * Behaviour shared by both {@link Deserializer} implementations.
 */
class DeserializerBridgeTest {
	static final Document SAMPLE = new Document()
		.append("first", 1)
		.append("second", 2)
		.append("list", BsonArray.of(new BsonInt32(3)));

	interface Factory {
		Deserializer over(Document document);
	}

	static Stream<Factory> factories() {
		return Stream.of(
			d -> new BsonValueDeserializer(d, DeserializerOptions.DEFAULT),
			d -> new RawDeserializer(RawDocument.fromBytes(d.encode()), DeserializerOptions.DEFAULT)
		);
	}

	@ParameterizedTest
	@MethodSource("factories")
	void bson_isMaterializedExactly(Factory factory) {
		assertEquals(SAMPLE, factory.over(SAMPLE).deserializeBson());
	}

	@ParameterizedTest
	@MethodSource("factories")
	void unconsumedEntries_fail(Factory factory) {
		BsonFormatException e = assertThrows(BsonFormatException.class, () ->
			factory.over(SAMPLE).deserializeAny(new Visitor<Integer>() {
				@Override
				public String expecting() {
					return "just the first entry";
				}

				@Override
				public Integer visitDocument(DocumentAccess document) {
					document.nextKey();
					return document.nextValue(d -> d.deserializeAny(this));
				}

				@Override
				public Integer visitInt32(int value) {
					return value;
				}
			}));
		assertEquals(TRAILING_BYTES, e.kind());
	}

	@ParameterizedTest
	@MethodSource("factories")
	void keysAndSkips_visitInOrder(Factory factory) {
		List<String> keys = factory.over(SAMPLE).deserializeAny(new Visitor<List<String>>() {
			@Override
			public String expecting() {
				return "any document";
			}

			@Override
			public List<String> visitDocument(DocumentAccess document) {
				Stream.Builder<String> result = Stream.builder();
				for (String key = document.nextKey(); key != null; key = document.nextKey()) {
					result.add(key);
					document.skipValue();
				}
				return result.build().toList();
			}
		});
		assertEquals(List.of("first", "second", "list"), keys);
	}

	@ParameterizedTest
	@MethodSource("factories")
	void rawArrayBuf_requiresArray(Factory factory) {
		assertThrows(BsonMappingException.class, () -> factory.over(SAMPLE).deserializeRawArrayBuf());
		assertEquals(SAMPLE.encode().length, factory.over(SAMPLE).deserializeRawDocumentBuf().length());
	}

	@ParameterizedTest
	@MethodSource("factories")
	void option_isEmptyOnlyForNull(Factory factory) {
		Deserializer deserializer = factory.over(SAMPLE);
		assertEquals(SAMPLE, deserializer.deserializeOption(Deserializer::deserializeBson).orElseThrow());
	}
}
