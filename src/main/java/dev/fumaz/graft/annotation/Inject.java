package dev.fumaz.graft.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor used for constructor injection when a class declares more than one.
 */
@Target({ElementType.CONSTRUCTOR})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
}
