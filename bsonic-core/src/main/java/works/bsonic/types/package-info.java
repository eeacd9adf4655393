/**
 * The typed value model, rooted at {@link works.bsonic.types.Bson}.
 * <p>
 * Containers own their contents, so values can be built and modified freely
 * and converted to and from encoded bytes at any point.
 */
package works.bsonic.types;
