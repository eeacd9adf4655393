package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

public record BsonJavaScriptCode(String code) implements Bson {
	public BsonJavaScriptCode {
		requireNonNull(code);
	}

	@Override
	public ElementType elementType() {
		return ElementType.JAVASCRIPT_CODE;
	}
}
