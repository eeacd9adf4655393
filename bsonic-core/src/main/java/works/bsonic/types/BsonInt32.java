package works.bsonic.types;

import works.bsonic.spec.ElementType;

public record BsonInt32(int value) implements Bson {
	@Override
	public ElementType elementType() {
		return ElementType.INT32;
	}
}
