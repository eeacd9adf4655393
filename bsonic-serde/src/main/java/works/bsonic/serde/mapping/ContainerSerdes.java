package works.bsonic.serde.mapping;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.ArrayAccess;
import works.bsonic.serde.ArraySerializer;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.HumanReadable;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Utf8LossyDeserialization;
import works.bsonic.serde.Visitor;
import works.bsonic.types.Bson;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.stream.Collectors.joining;

/**
 * Mappings for types built from other types.
 */
final class ContainerSerdes {
	private ContainerSerdes() { }

	/**
	 * @param finisher turns the accumulated elements into the desired collection
	 */
	static <E, C extends Iterable<E>> Serde<C> iterable(Serde<E> elementSerde, Function<ArrayList<E>, C> finisher) {
		return Serde.of(
			(value, s) -> {
				ArraySerializer array = s.serializeArray();
				for (E element : value) {
					array.element(requireElement(element), elementSerde);
				}
				array.end();
			},
			d -> d.deserializeAny(new Visitor<C>() {
				@Override
				public String expecting() {
					return "an array";
				}

				@Override
				public C visitArray(ArrayAccess access) {
					ArrayList<E> result = new ArrayList<>();
					while (access.hasNext()) {
						result.add(access.nextElement(elementSerde));
					}
					return finisher.apply(result);
				}
			}));
	}

	static <E> Serde<List<E>> list(Serde<E> elementSerde) {
		return iterable(elementSerde, list -> unmodifiableList(list));
	}

	static <E> Serde<Set<E>> set(Serde<E> elementSerde) {
		return iterable(elementSerde, list -> unmodifiableSet(new LinkedHashSet<>(list)));
	}

	/**
	 * Java arrays of any component type, including primitives, except {@code byte[]}.
	 */
	static Serde<Object> array(Class<?> componentType, Serde<Object> elementSerde) {
		Serde<List<Object>> listSerde = list(elementSerde);
		return Serde.of(
			(value, s) -> {
				int length = Array.getLength(value);
				List<Object> elements = new ArrayList<>(length);
				for (int i = 0; i < length; i++) {
					elements.add(Array.get(value, i));
				}
				listSerde.serialize(elements, s);
			},
			d -> {
				List<Object> elements = listSerde.deserialize(d);
				Object result = Array.newInstance(componentType, elements.size());
				for (int i = 0; i < elements.size(); i++) {
					Array.set(result, i, elements.get(i));
				}
				return result;
			});
	}

	/**
	 * Maps with string keys, as documents. Entry order is preserved.
	 * If a key occurs more than once, the last value wins.
	 */
	static <V> Serde<Map<String, V>> stringMap(Serde<V> valueSerde) {
		return Serde.of(
			(value, s) -> {
				DocumentSerializer document = s.serializeDocument();
				value.forEach((k, v) -> document.field(k, requireElement(v), valueSerde));
				document.end();
			},
			d -> d.deserializeAny(new Visitor<Map<String, V>>() {
				@Override
				public String expecting() {
					return "a document";
				}

				@Override
				public Map<String, V> visitDocument(DocumentAccess access) {
					LinkedHashMap<String, V> result = new LinkedHashMap<>();
					for (String key = access.nextKey(); key != null; key = access.nextKey()) {
						result.put(key, access.nextValue(valueSerde));
					}
					return unmodifiableMap(result);
				}
			}));
	}

	/**
	 * An empty {@link Optional} is BSON null.
	 */
	static <T> Serde<Optional<T>> optional(Serde<T> inner) {
		return Serde.of(
			(value, s) -> {
				if (value.isPresent()) {
					inner.serialize(value.get(), s);
				} else {
					s.serializeNull();
				}
			},
			d -> d.deserializeOption(inner));
	}

	/**
	 * Wraps another serde so that Java {@code null} corresponds to BSON null.
	 */
	static <T> Serde<T> nullable(Serde<T> inner) {
		return Serde.of(
			(value, s) -> {
				if (value == null) {
					s.serializeNull();
				} else {
					inner.serialize(value, s);
				}
			},
			d -> d.deserializeOption(inner).orElse(null));
	}

	static <T> Serde<HumanReadable<T>> humanReadable(Serde<T> inner) {
		return Serde.of(
			(value, s) -> s.serializeNewtype(HumanReadable.NEWTYPE_NAME, value.value(), inner),
			d -> new HumanReadable<>(d.deserializeNewtype(HumanReadable.NEWTYPE_NAME, inner)));
	}

	/**
	 * Serialization passes straight through to the inner value.
	 */
	static <T> Serde<Utf8LossyDeserialization<T>> utf8Lossy(Serde<T> inner) {
		return Serde.of(
			(value, s) -> inner.serialize(value.value(), s),
			d -> new Utf8LossyDeserialization<>(d.deserializeNewtype(Utf8LossyDeserialization.NEWTYPE_NAME, inner)));
	}

	/**
	 * Enum constants by {@link Enum#name() name}.
	 */
	static <E extends Enum<E>> Serde<E> enumByName(Class<E> enumClass) {
		return Serde.of(
			(value, s) -> s.serializeString(value.name()),
			d -> d.deserializeAny(new Visitor<E>() {
				@Override
				public String expecting() {
					return Stream.of(enumClass.getEnumConstants())
						.map(Enum::name)
						.collect(joining("`, `", "one of `", "`"));
				}

				@Override
				public E visitString(String value) {
					try {
						return Enum.valueOf(enumClass, value);
					} catch (IllegalArgumentException e) {
						throw new BsonMappingException("unknown variant `" + value + "`, expected " + expecting(), e);
					}
				}
			}));
	}

	/**
	 * Any {@link Bson} type maps to itself.
	 */
	static <B extends Bson> Serde<B> bson(Class<B> bsonClass) {
		return Serde.of(
			(value, s) -> s.serializeBson(value),
			d -> {
				Bson value = d.deserializeBson();
				if (bsonClass.isInstance(value)) {
					return bsonClass.cast(value);
				}
				throw BsonMappingException.invalidType(value.elementType().toString(), bsonClass.getSimpleName());
			});
	}

	static <T> T requireElement(T element) {
		if (element == null) {
			throw new BsonMappingException("null element; use Optional to represent absent values");
		}
		return element;
	}
}
