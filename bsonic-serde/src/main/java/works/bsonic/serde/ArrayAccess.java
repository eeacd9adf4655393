package works.bsonic.serde;

public interface ArrayAccess {
	boolean hasNext();

	<T> T nextElement(Deserialize<T> deserialize);
}
