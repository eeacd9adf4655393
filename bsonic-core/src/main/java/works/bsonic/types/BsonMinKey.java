package works.bsonic.types;

import works.bsonic.spec.ElementType;

public enum BsonMinKey implements Bson {
	INSTANCE;

	@Override
	public ElementType elementType() {
		return ElementType.MIN_KEY;
	}
}
