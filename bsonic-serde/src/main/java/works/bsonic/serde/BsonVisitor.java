package works.bsonic.serde;

import works.bsonic.types.Binary;
import works.bsonic.types.Bson;
import works.bsonic.types.BsonArray;
import works.bsonic.types.BsonBoolean;
import works.bsonic.types.BsonDouble;
import works.bsonic.types.BsonInt32;
import works.bsonic.types.BsonInt64;
import works.bsonic.types.BsonNull;
import works.bsonic.types.BsonString;
import works.bsonic.types.Document;

/**
 * Accepts anything, building the equivalent {@link Bson} tree.
 */
final class BsonVisitor implements Visitor<Bson> {
	@Override
	public String expecting() {
		return "any BSON value";
	}

	@Override
	public Bson visitBoolean(boolean value) {
		return BsonBoolean.of(value);
	}

	@Override
	public Bson visitInt32(int value) {
		return new BsonInt32(value);
	}

	@Override
	public Bson visitInt64(long value) {
		return new BsonInt64(value);
	}

	@Override
	public Bson visitDouble(double value) {
		return new BsonDouble(value);
	}

	@Override
	public Bson visitString(String value) {
		return new BsonString(value);
	}

	@Override
	public Bson visitBinary(Binary value) {
		return value;
	}

	@Override
	public Bson visitNull() {
		return BsonNull.INSTANCE;
	}

	@Override
	public Bson visitDocument(DocumentAccess document) {
		Document result = new Document();
		for (String key = document.nextKey(); key != null; key = document.nextKey()) {
			result.append(key, document.nextValue(Deserializer::deserializeBson));
		}
		return result;
	}

	@Override
	public Bson visitArray(ArrayAccess array) {
		BsonArray result = new BsonArray();
		while (array.hasNext()) {
			result.add(array.nextElement(Deserializer::deserializeBson));
		}
		return result;
	}

	@Override
	public Bson visitOther(Bson value) {
		return value;
	}
}
