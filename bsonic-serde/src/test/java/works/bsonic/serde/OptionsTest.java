package works.bsonic.serde;

import org.junit.jupiter.api.Test;
import works.bsonic.raw.RawDocument;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptionsTest {
	@Test
	void serializerDefaults() {
		assertFalse(SerializerOptions.DEFAULT.humanReadable());
		assertTrue(SerializerOptions.DEFAULT.trackErrorPath());
	}

	@Test
	void deserializerDefaults() {
		DeserializerOptions options = DeserializerOptions.DEFAULT;
		assertFalse(options.humanReadable());
		assertTrue(options.trackErrorPath());
		assertFalse(options.utf8Lossy());
		assertEquals(RawDocument.MAX_NESTING_DEPTH, options.maxNestingDepth());
	}

	@Test
	void builder_setsEverything() {
		DeserializerOptions options = DeserializerOptions.builder()
			.humanReadable(true)
			.trackErrorPath(false)
			.utf8Lossy(true)
			.maxNestingDepth(7)
			.build();
		assertEquals(new DeserializerOptions(true, false, true, 7), options);
	}

	@Test
	void withers_returnSameInstanceWhenUnchanged() {
		SerializerOptions readable = SerializerOptions.DEFAULT.withHumanReadable();
		assertSame(readable, readable.withHumanReadable());
		DeserializerOptions lossy = DeserializerOptions.DEFAULT.withUtf8Lossy();
		assertSame(lossy, lossy.withUtf8Lossy());
	}

	@Test
	void nonPositiveDepth_isRejected() {
		assertThrows(IllegalArgumentException.class, () -> DeserializerOptions.builder().maxNestingDepth(0).build());
	}
}
