package com.toolport.tools;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a tool parameter. One text is the description; two texts are the
 * wire name followed by the description.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Param {

    String UNSET = "\u0000<unset>";

    String[] value() default {};

    /** JSON literal used when the input is absent; a bare word is read as a string. */
    String defaultValue() default UNSET;
}
