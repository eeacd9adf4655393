package works.bsonic.types;

import works.bsonic.spec.ElementType;

public enum BsonMaxKey implements Bson {
	INSTANCE;

	@Override
	public ElementType elementType() {
		return ElementType.MAX_KEY;
	}
}
