package works.bsonic.serde.mapping;

import java.lang.invoke.MethodHandle;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.BsonMappingException;
import works.bsonic.serde.Deserialize;
import works.bsonic.serde.Deserializer;
import works.bsonic.serde.DocumentAccess;
import works.bsonic.serde.DocumentSerializer;
import works.bsonic.serde.Serde;
import works.bsonic.serde.Serialize;
import works.bsonic.serde.Serializer;
import works.bsonic.serde.Visitor;

import static java.util.Objects.requireNonNull;

/**
 * A record maps to a document with one field per component, in declaration order.
 * <p>
 * When deserializing, fields with no corresponding component are skipped,
 * and if a field occurs more than once, the last occurrence wins.
 */
final class RecordSerde implements Serde<Object> {
	private final Class<?> recordClass;
	private final List<Member> members;
	private final Map<String, Integer> indexByName;
	private final MethodHandle constructor;

	/**
	 * @param accessor takes the record as an {@code Object} and returns the component value as an {@code Object}
	 * @param whenAbsent supplies the value for a missing field,
	 *                   or throws if the field is required
	 */
	record Member(
		String name,
		MethodHandle accessor,
		Serialize<Object> serialize,
		Deserialize<Object> deserialize,
		Supplier<Object> whenAbsent
	) { }

	/**
	 * @param constructor the canonical constructor, taking and returning {@code Object}s
	 */
	RecordSerde(Class<?> recordClass, List<Member> members, MethodHandle constructor) {
		this.recordClass = requireNonNull(recordClass);
		this.members = List.copyOf(members);
		this.constructor = requireNonNull(constructor);
		this.indexByName = new HashMap<>();
		for (int i = 0; i < members.size(); i++) {
			indexByName.put(members.get(i).name(), i);
		}
	}

	@Override
	public void serialize(Object value, Serializer serializer) {
		DocumentSerializer document = serializer.serializeDocument();
		for (Member member : members) {
			document.field(member.name(), componentValue(member, value), member.serialize());
		}
		document.end();
	}

	private Object componentValue(Member member, Object record) {
		try {
			return member.accessor().invokeExact(record);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new BsonMappingException("Unable to access component " + member.name() + " of " + recordClass.getSimpleName(), e);
		}
	}

	@Override
	public Object deserialize(Deserializer deserializer) {
		return deserializer.deserializeAny(new Visitor<Object>() {
			@Override
			public String expecting() {
				return "a document for record " + recordClass.getSimpleName();
			}

			@Override
			public Object visitDocument(DocumentAccess access) {
				Object[] values = new Object[members.size()];
				boolean[] present = new boolean[members.size()];
				for (String key = access.nextKey(); key != null; key = access.nextKey()) {
					Integer index = indexByName.get(key);
					if (index == null) {
						LOGGER.trace("Skipping unknown field \"{}\" for {}", key, recordClass.getSimpleName());
						access.skipValue();
					} else {
						values[index] = access.nextValue(members.get(index).deserialize());
						present[index] = true;
					}
				}
				for (int i = 0; i < values.length; i++) {
					if (!present[i]) {
						values[i] = members.get(i).whenAbsent().get();
					}
				}
				return construct(values);
			}
		});
	}

	private Object construct(Object[] values) {
		try {
			return constructor.invokeWithArguments(values);
		} catch (BsonException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new BsonMappingException("Unable to construct " + recordClass.getSimpleName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public String toString() {
		return "RecordSerde(" + recordClass.getSimpleName() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordSerde.class);
}
