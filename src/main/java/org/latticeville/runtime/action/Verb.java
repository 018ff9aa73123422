package org.latticeville.runtime.action;

/**
 * Verbs an agent can apply to an object.
 */
public enum Verb {
    USE,
    OPEN,
    CLOSE,
    TAKE,
    DROP
}
