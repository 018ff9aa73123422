package org.latticeville.runtime.event;

import java.util.Map;

import org.latticeville.runtime.model.BeliefSnapshot;
import org.latticeville.runtime.model.FrozenMaps;
import org.latticeville.runtime.model.WorldStateSnapshot;

/**
 * Full state carried by a payload: the canonical world and every agent's beliefs.
 *
 * @param world   The committed canonical state.
 * @param beliefs Belief snapshot per agent id, ascending.
 */
public record StateSnapshot(WorldStateSnapshot world, Map<String, BeliefSnapshot> beliefs) {

    public StateSnapshot {
        beliefs = FrozenMaps.copyOf(beliefs);
    }
}
