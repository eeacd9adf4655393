package works.bsonic.serde.mapping;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.Visitor;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A sealed interface whose permitted subclasses are records maps to a document
 * with exactly one field, named for the variant's {@link Class#getSimpleName() simple name},
 * holding the record itself: <code>{ "Circle": { "radius": 1.0 } }</code>.
 */
final class VariantSerde implements Serde<Object> {
	private final Class<?> sealedType;
	private final Map<String, Variant> byName;
	private final Map<Class<?>, Variant> byClass;

	record Variant(String name, Class<?> type, Serde<Object> serde) { }

	VariantSerde(Class<?> sealedType, List<Variant> variants) {
		this.sealedType = requireNonNull(sealedType);
		this.byName = new LinkedHashMap<>();
		this.byClass = new LinkedHashMap<>();
		for (Variant variant : variants) {
			if (byName.put(variant.name(), variant) != null) {
				throw new BsonMappingException("Two variants of " + sealedType.getSimpleName() + " are named " + variant.name());
			}
			byClass.put(variant.type(), variant);
		}
	}

	@Override
	public void serialize(Object value, Serializer serializer) {
		Variant variant = byClass.get(value.getClass());
		if (variant == null) {
			throw new BsonMappingException("Unexpected " + value.getClass().getName() + " for " + sealedType.getSimpleName());
		}
		DocumentSerializer document = serializer.serializeDocument();
		document.field(variant.name(), value, variant.serde());
		document.end();
	}

	@Override
	public Object deserialize(Deserializer deserializer) {
		return deserializer.deserializeAny(new Visitor<Object>() {
			@Override
			public String expecting() {
				return "a document with one of " + variantNames() + " for " + sealedType.getSimpleName();
			}

			@Override
			public Object visitDocument(DocumentAccess access) {
				String key = access.nextKey();
				if (key == null) {
					throw BsonMappingException.invalidType("empty document", expecting());
				}
				Variant variant = byName.get(key);
				if (variant == null) {
					throw new BsonMappingException("unknown variant `" + key + "`, expected one of " + variantNames());
				}
				Object result = access.nextValue(variant.serde());
				String extra = access.nextKey();
				if (extra != null) {
					throw new BsonMappingException("unexpected field `" + extra + "` after variant `" + key + "`");
				}
				return result;
			}
		});
	}

	private String variantNames() {
		return byName.keySet().stream().collect(joining("`, `", "`", "`"));
	}

	@Override
	public String toString() {
		return "VariantSerde(" + sealedType.getSimpleName() + ")";
	}
}
