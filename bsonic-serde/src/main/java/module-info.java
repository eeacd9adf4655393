/**
 * Maps Java objects to and from BSON.
 * <p>
 * Start with {@link works.bsonic.serde.BsonSerde}.
 * The {@link works.bsonic.serde.mapping.SerdeRegistry} derives mappings for Java types by reflection,
 * and {@link works.bsonic.serde.helpers} supplies alternative representations
 * that can be selected per record component.
 */
module works.bsonic.serde {
	requires org.slf4j;
	requires transitive works.bsonic.core;

	exports works.bsonic.serde;
	exports works.bsonic.serde.bridge;
	exports works.bsonic.serde.helpers;
	exports works.bsonic.serde.mapping;
}
