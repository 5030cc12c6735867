package com.toolport.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RequiresAuth {

    /** Provider alias known to the orchestrator, e.g. {@code google}. */
    String provider();

    String type() default "oauth2";

    /** Provider-specific identifier, for private providers. */
    String id() default "";

    String[] scopes() default {};
}
