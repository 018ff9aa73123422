package org.latticeville.runtime.spi;

/**
 * Produces the initial world. Map-file formats live behind this interface.
 */
@FunctionalInterface
public interface IWorldLoader {

    /**
     * @return The world definition.
     * @throws org.latticeville.runtime.model.StructuralInvariantException if the world is malformed.
     */
    WorldDefinition load();
}
