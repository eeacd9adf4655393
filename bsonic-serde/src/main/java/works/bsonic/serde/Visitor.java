package works.bsonic.serde;

import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.types.Binary;
import works.bsonic.types.Bson;

/**
 * Receives one value from a {@link Deserializer}.
 * Every method rejects its value by default; implementations override the ones they accept.
 */
public interface Visitor<T> {
	/**
	 * @return a description of what this visitor accepts, used in error messages
	 */
	String expecting();

	default T visitBoolean(boolean value) {
		throw unexpected("boolean `" + value + "`");
	}

	default T visitInt32(int value) {
		throw unexpected("int32 `" + value + "`");
	}

	default T visitInt64(long value) {
		throw unexpected("int64 `" + value + "`");
	}

	default T visitDouble(double value) {
		throw unexpected("double `" + value + "`");
	}

	default T visitString(String value) {
		throw unexpected("string \"" + value + "\"");
	}

	default T visitBinary(Binary value) {
		throw unexpected("binary");
	}

	default T visitNull() {
		throw unexpected("null");
	}

	/**
	 * The visitor must consume every entry, by {@link DocumentAccess#nextValue} or {@link DocumentAccess#skipValue}.
	 */
	default T visitDocument(DocumentAccess document) {
		throw unexpected("document");
	}

	/**
	 * The visitor must consume every element.
	 */
	default T visitArray(ArrayAccess array) {
		throw unexpected("array");
	}

	/**
	 * Any value type without its own method, such as ObjectId, DateTime, or Timestamp.
	 */
	default T visitOther(Bson value) {
		throw unexpected(value.elementType().toString());
	}

	default BsonMappingException unexpected(String actual) {
		return BsonMappingException.invalidType(actual, expecting());
	}
}
