package works.bsonic.types;

import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * A regular expression as stored in BSON.
 * Neither the pattern nor the options may contain a NUL character;
 * this is checked when the value is encoded.
 * The options are kept exactly as given, so that decoding and re-encoding
 * preserves the original bytes.
 */
public record Regex(String pattern, String options) implements Bson {
	public Regex {
		requireNonNull(pattern);
		requireNonNull(options);
	}

	@Override
	public ElementType elementType() {
		return ElementType.REGULAR_EXPRESSION;
	}
}
