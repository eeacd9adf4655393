/**
 * Encoded BSON, read and written in place.
 * <p>
 * {@link works.bsonic.raw.RawDocument} and {@link works.bsonic.raw.RawArray} are views over
 * bytes owned by someone else, validated one element at a time as they are iterated.
 * {@link works.bsonic.raw.RawDocumentBuf} and {@link works.bsonic.raw.RawArrayBuf}
 * own their bytes and hold a well-formed encoding after every operation.
 */
package works.bsonic.raw;
