package works.bsonic.raw;

/**
 * @param scope a view of the same bytes as the enclosing document
 */
public record RawJavaScriptCodeWithScopeRef(String code, RawDocument scope) {
}
