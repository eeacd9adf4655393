/**
 * Reflection-based mappings between Java types and BSON.
 * <p>
 * The {@link works.bsonic.serde.mapping.SerdeRegistry} finds or builds the
 * {@link works.bsonic.serde.Serde} for a type, guided by annotations on record components
 * such as {@link works.bsonic.serde.mapping.SerdeWith} and {@link works.bsonic.serde.mapping.Unsigned}.
 */
package works.bsonic.serde.mapping;
