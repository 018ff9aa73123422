package org.latticeville.runtime.spi;

import java.util.List;
import java.util.Map;

import org.latticeville.runtime.model.FrozenMaps;
import org.latticeville.runtime.model.LocationEdge;
import org.latticeville.runtime.model.WorldTree;
import org.latticeville.runtime.objects.TransitionTable;

/**
 * A world as produced by an {@link IWorldLoader}.
 *
 * @param tree             The initial tree. Ownership passes to the simulation.
 * @param objectTypes      Type name per object id.
 * @param objectStates     Initial attributes per object id.
 * @param transitionTables Tables per object type name.
 * @param edges            Extra location edges on top of the tree's area hierarchy.
 * @param ambient          Initial ambient values such as {@code weather}.
 */
public record WorldDefinition(
        WorldTree tree,
        Map<String, String> objectTypes,
        Map<String, Map<String, String>> objectStates,
        Map<String, TransitionTable> transitionTables,
        List<LocationEdge> edges,
        Map<String, String> ambient) {

    public WorldDefinition {
        objectTypes = FrozenMaps.copyOf(objectTypes);
        objectStates = FrozenMaps.deepCopyOf(objectStates);
        transitionTables = FrozenMaps.copyOf(transitionTables);
        edges = edges != null ? List.copyOf(edges) : List.of();
        ambient = FrozenMaps.copyOf(ambient);
    }
}
