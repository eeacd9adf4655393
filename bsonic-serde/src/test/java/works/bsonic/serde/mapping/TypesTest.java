package works.bsonic.serde.mapping;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.bsonic.serde.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TypesTest {
	record Pair<A, B>(A first, List<B> rest) { }

	@Test
	void resolvedType_equalsJdkType() {
		Type jdk = new TypeReference<Map<String, List<Integer>>>() { }.type();
		Type resolved = Types.resolve(jdk, Map.of());
		assertEquals(jdk, resolved);
		assertEquals(resolved, jdk);
		assertEquals(jdk.hashCode(), resolved.hashCode());
	}

	@Test
	void wildcards_resolveToUpperBound() {
		Type wild = new TypeReference<List<? extends Number>>() { }.type();
		Type expected = new TypeReference<List<Number>>() { }.type();
		assertEquals(expected, Types.resolve(wild, Map.of()));
	}

	@Test
	void componentTypes_useRecordTypeArguments() {
		Type pairType = new TypeReference<Pair<String, Long>>() { }.type();
		Map<String, Type> bindings = Types.bindingsFor(pairType);
		Type rest = Pair.class.getRecordComponents()[1].getGenericType();
		assertEquals(new TypeReference<List<Long>>() { }.type(), Types.resolve(rest, bindings));
		assertEquals(String.class, Types.resolve(Pair.class.getRecordComponents()[0].getGenericType(), bindings));
	}

	@Test
	void genericArrays_becomeArrayClasses() {
		Type array = new TypeReference<List<String>[]>() { }.type();
		assertEquals(List[].class, Types.rawClass(Types.resolve(array, Map.of())));
	}
}
