package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * Deprecated wire type, read and written for compatibility.
 */
public record BsonSymbol(String symbol) implements Bson {
	public BsonSymbol {
		requireNonNull(symbol);
	}

	@Override
	public ElementType elementType() {
		return ElementType.SYMBOL;
	}
}
