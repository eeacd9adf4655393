package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * The scope is copied on construction and on access.
 */
public record JavaScriptCodeWithScope(String code, Document scope) implements Bson {
	public JavaScriptCodeWithScope {
		requireNonNull(code);
		scope = scope.copy();
	}

	@Override
	public Document scope() {
		return scope.copy();
	}

	@Override
	public ElementType elementType() {
		return ElementType.JAVASCRIPT_CODE_WITH_SCOPE;
	}
}
