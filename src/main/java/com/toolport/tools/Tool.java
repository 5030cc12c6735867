package com.toolport.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a tool. Parameters become the tool's inputs and the
 * return type its output; both are read by reflection at registration time.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Tool {

    /** Tool name; empty means the PascalCase form of the method name. */
    String name() default "";

    String description() default "";

    /** Description of the returned value. */
    String returns() default "";
}
