package org.latticeville.runtime.model;

/**
 * The three kinds of nodes that can live in a world or belief tree.
 */
public enum NodeKind {
    AREA,
    OBJECT,
    AGENT
}
