package dev.fumaz.graft.annotation;

import java.lang.annotation.*;

/**
 * Resolves a constructor parameter from the registration stored under the given key.
 */
@Target({ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {

    String value();

}
