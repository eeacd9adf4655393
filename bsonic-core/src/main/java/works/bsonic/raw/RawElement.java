package works.bsonic.raw;

/**
 * One key/value pair yielded by a {@link RawElementIterator}.
 */
public record RawElement(String key, RawBsonRef value) {
}
