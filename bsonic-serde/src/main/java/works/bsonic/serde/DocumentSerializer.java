package works.bsonic.serde;

public interface DocumentSerializer {
	<T> void field(String key, T value, Serialize<? super T> serialize);

	void end();
}
