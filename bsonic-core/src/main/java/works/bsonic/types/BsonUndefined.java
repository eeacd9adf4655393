package works.bsonic.types;

import works.bsonic.spec.ElementType;

public enum BsonUndefined implements Bson {
	INSTANCE;

	@Override
	public ElementType elementType() {
		return ElementType.UNDEFINED;
	}
}
