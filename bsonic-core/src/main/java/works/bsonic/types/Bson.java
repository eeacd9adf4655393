package works.bsonic.types;

import works.bsonic.spec.ElementType;

/**
 * A fully materialized BSON value.
 * There is exactly one implementation for each wire type.
 * <p>
 * Containers ({@link Document}, {@link BsonArray}) own their children;
 * converting to or from the raw representation always copies.
 */
public sealed interface Bson permits
	BsonDouble,
	BsonString,
	Document,
	BsonArray,
	Binary,
	BsonUndefined,
	ObjectId,
	BsonBoolean,
	DateTime,
	BsonNull,
	Regex,
	DbPointer,
	BsonJavaScriptCode,
	BsonSymbol,
	JavaScriptCodeWithScope,
	BsonInt32,
	Timestamp,
	BsonInt64,
	Decimal128,
	BsonMinKey,
	BsonMaxKey
{
	ElementType elementType();
}
