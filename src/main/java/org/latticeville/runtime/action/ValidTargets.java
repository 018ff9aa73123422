package org.latticeville.runtime.action;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The per-agent, per-tick enumeration of admissible action arguments.
 *
 * @param locations Locations a MOVE may target.
 * @param objects   Objects an INTERACT may target.
 * @param agents    Agents a SAY may address.
 */
public record ValidTargets(SortedSet<String> locations, SortedSet<String> objects, SortedSet<String> agents) {

    /** Targets of an agent that may do nothing but idle. */
    public static final ValidTargets NONE = new ValidTargets(Collections.emptySortedSet(),
            Collections.emptySortedSet(), Collections.emptySortedSet());

    public ValidTargets {
        locations = freeze(locations);
        objects = freeze(objects);
        agents = freeze(agents);
    }

    /**
     * Creates targets from arbitrary collections.
     *
     * @param locations Reachable locations.
     * @param objects   Objects in the current area.
     * @param agents    Other agents in the current area.
     * @return The targets.
     */
    public static ValidTargets of(Collection<String> locations, Collection<String> objects, Collection<String> agents) {
        return new ValidTargets(new TreeSet<>(locations), new TreeSet<>(objects), new TreeSet<>(agents));
    }

    private static SortedSet<String> freeze(SortedSet<String> set) {
        return set == null || set.isEmpty()
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(set));
    }

    /**
     * @return Whether no argument at all is admissible.
     */
    public boolean isEmpty() {
        return locations.isEmpty() && objects.isEmpty() && agents.isEmpty();
    }
}
