package org.latticeville.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a log event the test must produce. Fails the test if the event is missing or
 * occurs a different number of times.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {

    LogLevel level();

    String loggerPattern() default ".*";

    String messagePattern() default ".*";

    /**
     * Exact number of matching events; {@code -1} means at least one.
     */
    int occurrences() default 1;
}
