package works.bsonic.types;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import works.bsonic.exceptions.ValueAccessException;
import works.bsonic.raw.RawDocument;
import works.bsonic.raw.RawWriter;
import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * An insertion-ordered map from keys to {@link Bson} values.
 * <p>
 * Setting an existing key replaces its value but keeps its original position.
 * Keys are not checked for NUL characters until the document is {@link #encode() encoded}.
 * <p>
 * A document owns its values: nested documents and arrays are copied on the way in,
 * so no two containers share a child and no document can contain itself.
 * <p>
 * Two documents are equal only if they have the same entries in the same order.
 */
public final class Document implements Bson, Iterable<Map.Entry<String, Bson>> {
	private final LinkedHashMap<String, Bson> entries;

	public Document() {
		entries = new LinkedHashMap<>();
	}

	public Document(Map<String, ? extends Bson> initial) {
		entries = new LinkedHashMap<>();
		initial.forEach(this::append);
	}

	public Document append(String key, Bson value) {
		entries.put(requireNonNull(key), owned(requireNonNull(value)));
		return this;
	}

	/**
	 * @return a deep copy: nested documents and arrays are copied too
	 */
	public Document copy() {
		Document result = new Document();
		entries.forEach(result::append);
		return result;
	}

	static Bson owned(Bson value) {
		if (value instanceof Document d) {
			return d.copy();
		} else if (value instanceof BsonArray a) {
			return a.copy();
		} else {
			return value;
		}
	}

	public Document append(String key, String value) {
		return append(key, new BsonString(value));
	}

	public Document append(String key, int value) {
		return append(key, new BsonInt32(value));
	}

	public Document append(String key, long value) {
		return append(key, new BsonInt64(value));
	}

	public Document append(String key, double value) {
		return append(key, new BsonDouble(value));
	}

	public Document append(String key, boolean value) {
		return append(key, BsonBoolean.of(value));
	}

	public Optional<Bson> get(String key) {
		return Optional.ofNullable(entries.get(key));
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	public Optional<Bson> remove(String key) {
		return Optional.ofNullable(entries.remove(key));
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Set<String> keySet() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public Map<String, Bson> asMap() {
		return Collections.unmodifiableMap(entries);
	}

	@Override
	public Iterator<Map.Entry<String, Bson>> iterator() {
		return Collections.unmodifiableMap(entries).entrySet().iterator();
	}

	public String getString(String key) {
		return getTyped(key, ElementType.STRING, v -> ((BsonString) v).value());
	}

	public int getInt32(String key) {
		return getTyped(key, ElementType.INT32, v -> ((BsonInt32) v).value());
	}

	public long getInt64(String key) {
		return getTyped(key, ElementType.INT64, v -> ((BsonInt64) v).value());
	}

	public double getDouble(String key) {
		return getTyped(key, ElementType.DOUBLE, v -> ((BsonDouble) v).value());
	}

	public boolean getBoolean(String key) {
		return getTyped(key, ElementType.BOOLEAN, v -> ((BsonBoolean) v).value());
	}

	public Document getDocument(String key) {
		return getTyped(key, ElementType.EMBEDDED_DOCUMENT, v -> (Document) v);
	}

	public BsonArray getArray(String key) {
		return getTyped(key, ElementType.ARRAY, v -> (BsonArray) v);
	}

	public ObjectId getObjectId(String key) {
		return getTyped(key, ElementType.OBJECT_ID, v -> (ObjectId) v);
	}

	public DateTime getDateTime(String key) {
		return getTyped(key, ElementType.DATE_TIME, v -> (DateTime) v);
	}

	public Timestamp getTimestamp(String key) {
		return getTyped(key, ElementType.TIMESTAMP, v -> (Timestamp) v);
	}

	public Binary getBinary(String key) {
		return getTyped(key, ElementType.BINARY, v -> (Binary) v);
	}

	public boolean isNull(String key) {
		return getTyped(key, null, v -> v.elementType() == ElementType.NULL);
	}

	private <T> T getTyped(String key, ElementType expected, Function<Bson, T> extractor) {
		Bson value = entries.get(key);
		if (value == null) {
			throw ValueAccessException.notPresent(key);
		} else if (expected != null && value.elementType() != expected) {
			throw ValueAccessException.unexpectedType(key, value.elementType(), expected);
		}
		return extractor.apply(value);
	}

	/**
	 * @throws works.bsonic.exceptions.BsonEncodingException if any key, at any depth,
	 * or any regex contains a NUL character
	 */
	public byte[] encode() {
		RawWriter writer = new RawWriter();
		writer.writeDocument(this);
		return writer.toByteArray();
	}

	/**
	 * Strictly decodes a complete document, rejecting any bytes after it.
	 *
	 * @throws works.bsonic.exceptions.BsonFormatException if {@code bytes} is not a well-formed document
	 */
	public static Document decode(byte[] bytes) {
		return RawDocument.fromBytes(bytes).toDocument();
	}

	@Override
	public ElementType elementType() {
		return ElementType.EMBEDDED_DOCUMENT;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Document other) || entries.size() != other.entries.size()) {
			return false;
		}
		Iterator<Map.Entry<String, Bson>> mine = entries.entrySet().iterator();
		Iterator<Map.Entry<String, Bson>> theirs = other.entries.entrySet().iterator();
		while (mine.hasNext()) {
			if (!mine.next().equals(theirs.next())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		String separator = " ";
		for (Map.Entry<String, Bson> entry : entries.entrySet()) {
			sb.append(separator).append('"').append(entry.getKey()).append("\": ").append(entry.getValue());
			separator = ", ";
		}
		return sb.append(entries.isEmpty() ? "}" : " }").toString();
	}
}
