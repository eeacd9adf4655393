package works.bsonic.serde.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The {@code int} or {@code long} component holds the bits of an unsigned 32- or 64-bit integer.
 * Serialized as int64; a u64 above {@link Long#MAX_VALUE} cannot be serialized.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Unsigned {
}
