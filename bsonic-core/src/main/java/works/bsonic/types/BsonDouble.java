package works.bsonic.types;

import works.bsonic.spec.ElementType;

public record BsonDouble(double value) implements Bson {
	@Override
	public ElementType elementType() {
		return ElementType.DOUBLE;
	}
}
