package works.bsonic.raw;

import java.util.Iterator;
import java.util.Optional;
import works.bsonic.spec.ElementType;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonString;

import static java.util.Objects.requireNonNull;

/**
 * An owned, growable encoded array.
 * <p>
 * Keeps its own element count so each {@link #push} can synthesize the next key
 * without rescanning the buffer.
 */
public final class RawArrayBuf implements Iterable<RawBsonRef> {
	private final RawDocumentBuf inner;
	private int count;

	public RawArrayBuf() {
		this(new RawDocumentBuf(), 0);
	}

	private RawArrayBuf(RawDocumentBuf inner, int count) {
		this.inner = inner;
		this.count = count;
	}

	/**
	 * Copies {@code document}, counting its elements once.
	 * Existing keys are kept as they are.
	 */
	public static RawArrayBuf fromRawDocumentBuf(RawDocumentBuf document) {
		return fromRawDocument(document.asRawDocument());
	}

	public static RawArrayBuf fromRawArray(RawArray array) {
		return fromRawDocument(array.asDocument());
	}

	private static RawArrayBuf fromRawDocument(RawDocument document) {
		int count = 0;
		for (RawElementIterator iter = document.iterator(); iter.hasNext(); iter.next()) {
			count++;
		}
		return new RawArrayBuf(RawDocumentBuf.fromRawDocument(document), count);
	}

	public static RawArrayBuf fromBsonArray(BsonArray array) {
		return of(array);
	}

	public static RawArrayBuf of(Iterable<? extends Bson> values) {
		RawArrayBuf result = new RawArrayBuf();
		for (Bson value : values) {
			result.push(value);
		}
		return result;
	}

	private String nextKey() {
		return Integer.toString(count);
	}

	public RawArrayBuf push(Bson value) {
		requireNonNull(value);
		return pushElement(value.elementType(), w -> w.writeValue(value));
	}

	public RawArrayBuf push(RawBsonRef value) {
		return pushElement(value.elementType(), w -> w.writeRawValue(value));
	}

	public RawArrayBuf push(RawDocument value) {
		return pushElement(ElementType.EMBEDDED_DOCUMENT, w -> w.writeRawDocument(value));
	}

	public RawArrayBuf push(RawArray value) {
		return pushElement(ElementType.ARRAY, w -> w.writeRawArray(value));
	}

	public RawArrayBuf push(RawDocumentBuf value) {
		return push(value.asRawDocument());
	}

	public RawArrayBuf push(RawArrayBuf value) {
		return push(value.asRawArray());
	}

	public RawArrayBuf push(String value) {
		return push(new BsonString(value));
	}

	public RawArrayBuf push(int value) {
		return push(new BsonInt32(value));
	}

	public RawArrayBuf push(long value) {
		return push(new BsonInt64(value));
	}

	public RawArrayBuf push(double value) {
		return push(new BsonDouble(value));
	}

	public RawArrayBuf push(boolean value) {
		return push(BsonBoolean.of(value));
	}

	private RawArrayBuf pushElement(ElementType type, RawDocumentBuf.PayloadWriter payload) {
		inner.appendElement(nextKey(), type, payload);
		count++;
		return this;
	}

	public int size() {
		return count;
	}

	public boolean isEmpty() {
		return count == 0;
	}

	public Optional<RawBsonRef> get(int index) {
		return asRawArray().get(index);
	}

	/**
	 * @return a view of the current contents, sharing storage with this buffer
	 */
	public RawArray asRawArray() {
		return new RawArray(inner.asRawDocument());
	}

	/**
	 * @return a copy of the contents as a document whose keys are the indices
	 */
	public RawDocumentBuf asRawDocumentBuf() {
		return RawDocumentBuf.fromRawDocument(inner.asRawDocument());
	}

	@Override
	public Iterator<RawBsonRef> iterator() {
		return asRawArray().iterator();
	}

	public BsonArray toBsonArray() {
		return asRawArray().toBsonArray();
	}

	public byte[] toByteArray() {
		return inner.toByteArray();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RawArrayBuf other && inner.equals(other.inner);
	}

	@Override
	public int hashCode() {
		return inner.hashCode();
	}

	@Override
	public String toString() {
		return "RawArrayBuf(" + count + " elements, " + inner.length() + " bytes)";
	}
}
