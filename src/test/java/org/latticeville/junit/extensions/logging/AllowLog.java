package org.latticeville.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tolerates matching WARN or ERROR events without requiring them.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Repeatable(AllowLogs.class)
public @interface AllowLog {

    LogLevel level();

    String loggerPattern() default ".*";

    String messagePattern() default ".*";
}
