package works.bsonic.serde;

public interface ArraySerializer {
	<T> void element(T value, Serialize<? super T> serialize);

	void end();
}
