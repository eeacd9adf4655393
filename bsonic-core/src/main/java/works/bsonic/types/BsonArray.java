package works.bsonic.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * An ordered list of {@link Bson} values.
 * On the wire this is a document whose keys are the decimal indices {@code "0"}, {@code "1"}, ...
 * <p>
 * Like {@link Document}, an array copies the nested containers it is given.
 */
public final class BsonArray implements Bson, Iterable<Bson> {
	private final List<Bson> values;

	public BsonArray() {
		values = new ArrayList<>();
	}

	public BsonArray(Collection<? extends Bson> initial) {
		values = new ArrayList<>(initial.size());
		initial.forEach(this::add);
	}

	public static BsonArray of(Bson... values) {
		return new BsonArray(List.of(values));
	}

	public BsonArray add(Bson value) {
		values.add(Document.owned(requireNonNull(value)));
		return this;
	}

	/**
	 * @return a deep copy: nested documents and arrays are copied too
	 */
	public BsonArray copy() {
		BsonArray result = new BsonArray();
		values.forEach(result::add);
		return result;
	}

	public Bson get(int index) {
		return values.get(index);
	}

	public int size() {
		return values.size();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public List<Bson> asList() {
		return Collections.unmodifiableList(values);
	}

	@Override
	public Iterator<Bson> iterator() {
		return asList().iterator();
	}

	@Override
	public ElementType elementType() {
		return ElementType.ARRAY;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BsonArray other && values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
