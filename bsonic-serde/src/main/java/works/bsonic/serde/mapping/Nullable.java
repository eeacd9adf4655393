package works.bsonic.serde.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * A {@code null} component value is represented as BSON null, and BSON null or a missing field deserializes to {@code null}.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Nullable {
}
