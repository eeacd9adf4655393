package works.bsonic.types;

import works.bsonic.spec.ElementType;

public record BsonInt64(long value) implements Bson {
	@Override
	public ElementType elementType() {
		return ElementType.INT64;
	}
}
