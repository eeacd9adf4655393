package works.bsonic.serde.mapping;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import works.bsonic.exceptions.BsonMappingException;

/**
 * Substitution of type variables, so a generic record's component types
 * can be known precisely.
 */
final class Types {
	private Types() { }

	static Class<?> rawClass(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType p) {
			return (Class<?>) p.getRawType();
		} else if (type instanceof GenericArrayType g) {
			return Array.newInstance(rawClass(g.getGenericComponentType()), 0).getClass();
		} else {
			throw new BsonMappingException("Type is not sufficiently specific: " + type);
		}
	}

	static Type typeArgument(Type type, int index) {
		if (type instanceof ParameterizedType p) {
			return p.getActualTypeArguments()[index];
		} else {
			throw new BsonMappingException("Raw type not supported; type arguments are required: " + type);
		}
	}

	/**
	 * @return the variable bindings implied by the given type's arguments, keyed by variable name
	 */
	static Map<String, Type> bindingsFor(Type type) {
		if (type instanceof ParameterizedType p) {
			TypeVariable<?>[] variables = ((Class<?>) p.getRawType()).getTypeParameters();
			Type[] arguments = p.getActualTypeArguments();
			Map<String, Type> result = new HashMap<>();
			for (int i = 0; i < variables.length; i++) {
				result.put(variables[i].getName(), arguments[i]);
			}
			return result;
		} else {
			return Map.of();
		}
	}

	/**
	 * Replaces variables with their bindings, and wildcards with their upper bounds.
	 * An unbound variable is replaced with its first bound.
	 */
	static Type resolve(Type type, Map<String, Type> bindings) {
		if (type instanceof Class<?>) {
			return type;
		} else if (type instanceof ParameterizedType p) {
			Type[] arguments = Stream.of(p.getActualTypeArguments())
				.map(a -> resolve(a, bindings))
				.toArray(Type[]::new);
			Type owner = p.getOwnerType() == null ? null : resolve(p.getOwnerType(), bindings);
			return new Parameterized((Class<?>) p.getRawType(), owner, arguments);
		} else if (type instanceof TypeVariable<?> v) {
			Type bound = bindings.get(v.getName());
			if (bound == null) {
				return resolve(v.getBounds()[0], Map.of());
			} else {
				return bound;
			}
		} else if (type instanceof WildcardType w) {
			return resolve(w.getUpperBounds()[0], bindings);
		} else if (type instanceof GenericArrayType g) {
			Type component = resolve(g.getGenericComponentType(), bindings);
			if (component instanceof Class<?> c) {
				return Array.newInstance(c, 0).getClass();
			} else {
				return new GenericArray(component);
			}
		} else {
			throw new BsonMappingException("Unexpected kind of type: " + type);
		}
	}

	/**
	 * Equal to, and hashes the same as, the JDK's own {@link ParameterizedType}s.
	 */
	static final class Parameterized implements ParameterizedType {
		private final Class<?> rawType;
		private final Type ownerType;
		private final Type[] arguments;

		Parameterized(Class<?> rawType, Type ownerType, Type[] arguments) {
			this.rawType = rawType;
			this.ownerType = ownerType;
			this.arguments = arguments;
		}

		@Override
		public Type[] getActualTypeArguments() {
			return arguments.clone();
		}

		@Override
		public Type getRawType() {
			return rawType;
		}

		@Override
		public Type getOwnerType() {
			return ownerType;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ParameterizedType that
				&& rawType.equals(that.getRawType())
				&& Objects.equals(ownerType, that.getOwnerType())
				&& Arrays.equals(arguments, that.getActualTypeArguments());
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(arguments) ^ Objects.hashCode(ownerType) ^ Objects.hashCode(rawType);
		}

		@Override
		public String toString() {
			return Stream.of(arguments)
				.map(Type::getTypeName)
				.collect(Collectors.joining(", ", rawType.getName() + "<", ">"));
		}
	}

	record GenericArray(Type genericComponentType) implements GenericArrayType {
		@Override
		public Type getGenericComponentType() {
			return genericComponentType;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof GenericArrayType that
				&& genericComponentType.equals(that.getGenericComponentType());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(genericComponentType);
		}

		@Override
		public String toString() {
			return genericComponentType.getTypeName() + "[]";
		}
	}
}
