package works.bsonic.types;

import works.bsonic.spec.ElementType;

public record BsonBoolean(boolean value) implements Bson {
	public static final BsonBoolean TRUE = new BsonBoolean(true);
	public static final BsonBoolean FALSE = new BsonBoolean(false);

	public static BsonBoolean of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public ElementType elementType() {
		return ElementType.BOOLEAN;
	}
}
