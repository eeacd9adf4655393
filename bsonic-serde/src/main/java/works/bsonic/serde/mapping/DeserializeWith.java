package works.bsonic.serde.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import works.bsonic.serde.Deserialize;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Like {@link SerdeWith}, but for deserialization only.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface DeserializeWith {
	Class<? extends Deserialize<?>> value();
}
