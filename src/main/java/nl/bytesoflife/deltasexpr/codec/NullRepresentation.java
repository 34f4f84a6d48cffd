package nl.bytesoflife.deltasexpr.codec;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the text a {@link StringSerializable} type writes for an empty
 * {@code Optional}. Must not collide with any valid serialized value.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface NullRepresentation {

    String value();
}
