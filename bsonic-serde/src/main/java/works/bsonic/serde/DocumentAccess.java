package works.bsonic.serde;

/**
 * Sequential access to the entries of a document during deserialization.
 * Calls must alternate: {@link #nextKey()}, then {@link #nextValue} or {@link #skipValue()}.
 */
public interface DocumentAccess {
	/**
	 * @return the next key, or null if there are no more entries
	 */
	String nextKey();

	<T> T nextValue(Deserialize<T> deserialize);

	void skipValue();
}
