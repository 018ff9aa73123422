package org.latticeville.runtime.model;

/**
 * An explicit, undirected connection between two areas.
 *
 * @param from One endpoint.
 * @param to   The other endpoint.
 */
public record LocationEdge(String from, String to) {

    @Override
    public String toString() {
        return from + "<->" + to;
    }
}
