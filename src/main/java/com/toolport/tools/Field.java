package com.toolport.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Structured parameter descriptor. When present its description and default
 * take precedence over {@link Param}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Field {

    String name() default "";

    String description() default "";

    String defaultValue() default Param.UNSET;
}
