package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * Deprecated reference to a document in another collection.
 */
public record DbPointer(String namespace, ObjectId id) implements Bson {
	public DbPointer {
		requireNonNull(namespace);
		requireNonNull(id);
	}

	@Override
	public ElementType elementType() {
		return ElementType.DB_POINTER;
	}
}
