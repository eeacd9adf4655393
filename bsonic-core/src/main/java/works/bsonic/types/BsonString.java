package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

public record BsonString(String value) implements Bson {
	public BsonString {
		requireNonNull(value);
	}

	@Override
	public ElementType elementType() {
		return ElementType.STRING;
	}
}
