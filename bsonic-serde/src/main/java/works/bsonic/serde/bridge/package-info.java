/**
 * The {@link works.bsonic.serde.Serializer} and {@link works.bsonic.serde.Deserializer} implementations:
 * one pair over the typed value model, and one pair over encoded bytes.
 */
package works.bsonic.serde.bridge;
