package works.bsonic.types;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObjectIdTest {

	@Test
	void hex_roundTrip() {
		ObjectId id = ObjectId.parse("507F1F77BCF86CD799439011");
		assertEquals("507f1f77bcf86cd799439011", id.toHex());
		assertEquals(id, ObjectId.parse(id.toHex()));
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "507f1f77bcf86cd79943901", "507f1f77bcf86cd7994390111", "zz7f1f77bcf86cd799439011"})
	void invalidHex_rejected(String hex) {
		assertThrows(IllegalArgumentException.class, () -> ObjectId.parse(hex));
	}

	@Test
	void generated_areDistinctWithCurrentTimestamp() {
		Set<ObjectId> seen = new HashSet<>();
		long before = System.currentTimeMillis() / 1000 * 1000;
		for (int i = 0; i < 1000; i++) {
			assertTrue(seen.add(new ObjectId()));
		}
		ObjectId id = new ObjectId();
		assertTrue(id.timestamp().millis() >= before);
		assertTrue(id.timestamp().millis() <= System.currentTimeMillis());
	}

	@Test
	void timestamp_isBigEndianSeconds() {
		assertEquals(0x507f1f77L * 1000, ObjectId.parse("507f1f77bcf86cd799439011").timestamp().millis());
	}
}
