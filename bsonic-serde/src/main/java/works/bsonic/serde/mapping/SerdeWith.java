package works.bsonic.serde.mapping;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import works.bsonic.serde.Serde;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides both directions of the mapping for one record component.
 * The class must have a public no-argument constructor,
 * or be accessible via a {@link java.lang.invoke.MethodHandles.Lookup Lookup}
 * registered with {@link SerdeRegistry#useLookup}.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface SerdeWith {
	Class<? extends Serde<?>> value();
}
