package works.bsonic.serde.mapping;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.Deserialize;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.HumanReadable;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.TypeReference;
import works.bsonic.serde.Utf8LossyDeserialization;
import works.bsonic.types.Bson;

import static java.lang.invoke.MethodType.methodType;
import static java.util.Objects.requireNonNull;

/**
 * Determines the {@link Serde} to use for a given Java type, and memoizes it.
 * <p>
 * Built-in mappings cover primitives and their boxes, {@code String}, {@code byte[]},
 * enums, records, sealed interfaces of records, arrays, {@link List}, {@link Set}, {@link Collection}, {@link Iterable},
 * {@code Map<String, V>}, {@link Optional}, {@link java.util.UUID},
 * the {@link Bson} value types, and the raw buffer types.
 * Others can be added with {@link #register}.
 * <p>
 * Record components can be customized with {@link SerdeWith}, {@link SerializeWith},
 * {@link DeserializeWith}, {@link Unsigned}, and {@link Nullable}.
 */
public class SerdeRegistry {
	private final Map<Type, Serde<?>> memo = new HashMap<>();
	private final Map<Class<?>, Serde<?>> registered = new HashMap<>();
	private final Map<Package, Lookup> lookups = new HashMap<>();

	/**
	 * Uses {@code serde} for {@code type} exactly (not subtypes),
	 * taking precedence over built-in mappings.
	 *
	 * @return {@code this}
	 */
	public synchronized <T> SerdeRegistry register(Class<T> type, Serde<T> serde) {
		registered.put(requireNonNull(type), requireNonNull(serde));
		memo.clear();
		return this;
	}

	/**
	 * Uses the given {@link Lookup} object to find {@link MethodHandle}s
	 * for any class in the same package as the {@link Lookup}'s {@linkplain Lookup#lookupClass() lookup class}.
	 * Needed for records that are not public.
	 *
	 * @return {@code this}
	 */
	public synchronized SerdeRegistry useLookup(Lookup lookup) {
		lookups.put(requireNonNull(lookup.lookupClass().getPackage()), lookup);
		return this;
	}

	@SuppressWarnings("unchecked")
	public <T> Serde<T> serdeFor(Class<T> type) {
		return (Serde<T>) serdeFor((Type) type);
	}

	@SuppressWarnings("unchecked")
	public <T> Serde<T> serdeFor(TypeReference<T> type) {
		return (Serde<T>) serdeFor(type.type());
	}

	/**
	 * @throws BsonMappingException if the type can't be mapped
	 */
	public synchronized Serde<?> serdeFor(Type type) {
		Type resolved = Types.resolve(type, Map.of());
		Serde<?> existing = memo.get(resolved);
		if (existing != null) {
			return existing;
		}
		// Placeholder so recursive types can refer to themselves
		LazySerde lazy = new LazySerde(resolved);
		memo.put(resolved, lazy);
		try {
			Serde<?> result = compute(resolved);
			lazy.delegate = objectSerde(result);
			memo.put(resolved, result);
			LOGGER.debug("Mapped {} with {}", resolved, result);
			return result;
		} catch (RuntimeException e) {
			// Other entries may already refer to the placeholder
			memo.clear();
			throw e;
		}
	}

	private Serde<?> compute(Type type) {
		Class<?> raw = Types.rawClass(type);
		Serde<?> registeredSerde = registered.get(raw);
		if (registeredSerde != null) {
			return registeredSerde;
		}
		Serde<?> scalar = ScalarSerdes.BY_CLASS.get(raw);
		if (scalar != null) {
			return scalar;
		}
		if (Bson.class.isAssignableFrom(raw)) {
			return ContainerSerdes.bson(raw.asSubclass(Bson.class));
		} else if (raw == HumanReadable.class) {
			return ContainerSerdes.humanReadable(argumentSerde(type, 0));
		} else if (raw == Utf8LossyDeserialization.class) {
			return ContainerSerdes.utf8Lossy(argumentSerde(type, 0));
		} else if (raw == Optional.class) {
			return ContainerSerdes.optional(argumentSerde(type, 0));
		} else if (raw == List.class || raw == Collection.class || raw == Iterable.class) {
			return ContainerSerdes.list(argumentSerde(type, 0));
		} else if (raw == Set.class) {
			return ContainerSerdes.set(argumentSerde(type, 0));
		} else if (raw == Map.class) {
			Class<?> keyClass = Types.rawClass(Types.typeArgument(type, 0));
			if (keyClass != String.class) {
				throw new BsonMappingException("Map keys must be strings: " + type);
			}
			return ContainerSerdes.stringMap(argumentSerde(type, 1));
		} else if (raw.isArray()) {
			Type componentType = (type instanceof GenericArrayType g) ? g.getGenericComponentType() : raw.getComponentType();
			return ContainerSerdes.array(raw.getComponentType(), objectSerde(serdeFor(componentType)));
		} else if (raw.isEnum()) {
			return enumSerde(raw);
		} else if (raw.isRecord()) {
			return scanRecord(type, raw);
		} else if (raw.isInterface() && raw.isSealed()) {
			return scanVariants(raw);
		} else {
			throw new BsonMappingException("No mapping for type " + type);
		}
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static Serde<?> enumSerde(Class<?> raw) {
		return ContainerSerdes.enumByName((Class) raw);
	}

	private Serde<Object> argumentSerde(Type type, int index) {
		return objectSerde(serdeFor(Types.typeArgument(type, index)));
	}

	private VariantSerde scanVariants(Class<?> sealedType) {
		List<VariantSerde.Variant> variants = new ArrayList<>();
		for (Class<?> permitted : sealedType.getPermittedSubclasses()) {
			if (!permitted.isRecord()) {
				throw new BsonMappingException("Permitted subclass " + permitted.getName() + " of " + sealedType.getName() + " must be a record");
			}
			variants.add(new VariantSerde.Variant(permitted.getSimpleName(), permitted, objectSerde(serdeFor(permitted))));
		}
		return new VariantSerde(sealedType, variants);
	}

	private RecordSerde scanRecord(Type recordType, Class<?> recordClass) {
		Map<String, Type> bindings = Types.bindingsFor(recordType);
		RecordComponent[] components = recordClass.getRecordComponents();
		List<RecordSerde.Member> members = new ArrayList<>(components.length);
		for (RecordComponent c : components) {
			members.add(scanRecordComponent(c, bindings));
		}
		Class<?>[] ctorParameterTypes = Stream.of(components)
			.map(RecordComponent::getType)
			.toArray(Class<?>[]::new);
		MethodHandle constructor;
		try {
			constructor = lookupFor(recordClass).unreflectConstructor(recordClass.getDeclaredConstructor(ctorParameterTypes));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new BsonMappingException("Unable to access record constructor for " + recordClass
				+ "; for non-public records, register a Lookup with useLookup", e);
		}
		return new RecordSerde(recordClass, members, constructor.asType(constructor.type().generic()));
	}

	private RecordSerde.Member scanRecordComponent(RecordComponent c, Map<String, Type> bindings) {
		MethodHandle mh;
		try {
			mh = lookupFor(c.getDeclaringRecord()).unreflect(c.getAccessor());
		} catch (IllegalAccessException e) {
			throw new BsonMappingException("Unable to access record component accessor for " + c, e);
		}
		Type componentType = Types.resolve(c.getGenericType(), bindings);
		Class<?> componentClass = Types.rawClass(componentType);

		Serialize<Object> serialize;
		Deserialize<Object> deserialize;
		SerdeWith serdeWith = c.getAnnotation(SerdeWith.class);
		if (serdeWith != null) {
			Serde<Object> custom = objectSerde((Serde<?>) instantiate(serdeWith.value()));
			serialize = custom;
			deserialize = custom;
		} else {
			Supplier<Serde<Object>> standard = () -> standardComponentSerde(c, componentType, componentClass);
			SerializeWith serializeWith = c.getAnnotation(SerializeWith.class);
			DeserializeWith deserializeWith = c.getAnnotation(DeserializeWith.class);
			serialize = (serializeWith == null) ? standard.get() : uncheckedCast(instantiate(serializeWith.value()));
			deserialize = (deserializeWith == null) ? standard.get() : uncheckedCast(instantiate(deserializeWith.value()));
		}

		Supplier<Object> whenAbsent;
		if (c.isAnnotationPresent(Nullable.class)) {
			if (componentClass.isPrimitive()) {
				throw new BsonMappingException("Primitive component can't be @Nullable: " + c);
			}
			Serde<Object> nullable = ContainerSerdes.nullable(Serde.of(serialize, deserialize));
			serialize = nullable;
			deserialize = nullable;
			whenAbsent = () -> null;
		} else {
			serialize = nonNull(c.getName(), serialize);
			if (componentClass == Optional.class) {
				whenAbsent = Optional::empty;
			} else {
				whenAbsent = () -> { throw BsonMappingException.missingField(c.getName()); };
			}
		}
		return new RecordSerde.Member(
			c.getName(),
			mh.asType(methodType(Object.class, Object.class)),
			serialize,
			deserialize,
			whenAbsent);
	}

	private Serde<Object> standardComponentSerde(RecordComponent c, Type componentType, Class<?> componentClass) {
		if (c.isAnnotationPresent(Unsigned.class)) {
			if (componentClass == int.class || componentClass == Integer.class) {
				return objectSerde(ScalarSerdes.U32);
			} else if (componentClass == long.class || componentClass == Long.class) {
				return objectSerde(ScalarSerdes.U64);
			} else {
				throw new BsonMappingException("@Unsigned applies only to int and long components: " + c);
			}
		}
		return objectSerde(serdeFor(componentType));
	}

	private static Serialize<Object> nonNull(String componentName, Serialize<Object> inner) {
		return (value, serializer) -> {
			if (value == null) {
				throw new BsonMappingException("null value for component `" + componentName + "`; annotate it @Nullable or use Optional");
			}
			inner.serialize(value, serializer);
		};
	}

	private Object instantiate(Class<?> c) {
		try {
			return lookupFor(c).findConstructor(c, methodType(void.class)).invoke();
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new BsonMappingException("Unable to instantiate " + c.getName() + "; it needs an accessible no-argument constructor", e);
		}
	}

	/**
	 * @return a {@link Lookup} suitable for accessing members of the given class;
	 * if none has been configured, returns {@link MethodHandles#publicLookup()}
	 */
	private Lookup lookupFor(Class<?> c) {
		return lookups.getOrDefault(c.getPackage(), MethodHandles.publicLookup());
	}

	@SuppressWarnings("unchecked")
	private static <T> T uncheckedCast(Object o) {
		return (T) o;
	}

	@SuppressWarnings("unchecked")
	private static Serde<Object> objectSerde(Serde<?> serde) {
		return (Serde<Object>) serde;
	}

	/**
	 * Stands in for a serde that is still being computed.
	 */
	private static final class LazySerde implements Serde<Object> {
		final Type type;
		Serde<Object> delegate = null;

		LazySerde(Type type) {
			this.type = type;
		}

		private Serde<Object> delegate() {
			if (delegate == null) {
				throw new IllegalStateException("Serde for " + type + " used before it was ready");
			}
			return delegate;
		}

		@Override
		public void serialize(Object value, Serializer serializer) {
			delegate().serialize(value, serializer);
		}

		@Override
		public Object deserialize(Deserializer deserializer) {
			return delegate().deserialize(deserializer);
		}

		@Override
		public String toString() {
			return "LazySerde(" + type + ")";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SerdeRegistry.class);
}
