package works.bsonic.types;

import works.bsonic.spec.ElementType;

public enum BsonNull implements Bson {
	INSTANCE;

	@Override
	public ElementType elementType() {
		return ElementType.NULL;
	}
}
