package works.bsonic.raw;

import java.util.Iterator;
import java.util.Optional;
import works.bsonic.types.BsonArray;

/**
 * A read-only view of an encoded array.
 * <p>
 * On the wire an array is a document whose keys are expected to be {@code "0"}, {@code "1"}, ...;
 * this view ignores the keys and does not check that they are sequential.
 */
public final class RawArray implements Iterable<RawBsonRef> {
	private final RawDocument document;

	RawArray(RawDocument document) {
		this.document = document;
	}

	public static RawArray fromBytes(byte[] bytes) {
		return new RawArray(RawDocument.fromBytes(bytes));
	}

	/**
	 * @return the same bytes viewed as a document, keys included
	 */
	public RawDocument asDocument() {
		return document;
	}

	/**
	 * Iterates and counts; O(n).
	 */
	public Optional<RawBsonRef> get(int index) {
		if (index < 0) {
			return Optional.empty();
		}
		int i = 0;
		for (RawBsonRef value : this) {
			if (i++ == index) {
				return Optional.of(value);
			}
		}
		return Optional.empty();
	}

	/**
	 * Iterates and counts; O(n).
	 */
	public int size() {
		int result = 0;
		for (RawElementIterator iter = document.iterator(); iter.hasNext(); iter.next()) {
			result++;
		}
		return result;
	}

	public boolean isEmpty() {
		return document.isEmpty();
	}

	@Override
	public Iterator<RawBsonRef> iterator() {
		return iterator(Utf8Mode.STRICT);
	}

	public Iterator<RawBsonRef> iterator(Utf8Mode mode) {
		RawElementIterator elements = document.iterator(mode);
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return elements.hasNext();
			}

			@Override
			public RawBsonRef next() {
				return elements.next().value();
			}
		};
	}

	public BsonArray toBsonArray() {
		return toBsonArray(Utf8Mode.STRICT, RawDocument.MAX_NESTING_DEPTH);
	}

	BsonArray toBsonArray(Utf8Mode mode, int remainingDepth) {
		BsonArray result = new BsonArray();
		Iterator<RawBsonRef> iter = iterator(mode);
		while (iter.hasNext()) {
			result.add(iter.next().toBson(remainingDepth));
		}
		return result;
	}

	public byte[] toByteArray() {
		return document.toByteArray();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof RawArray other && document.equals(other.document);
	}

	@Override
	public int hashCode() {
		return document.hashCode();
	}

	@Override
	public String toString() {
		return "RawArray(" + document.length() + " bytes)";
	}
}
