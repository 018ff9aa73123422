package org.latticeville.runtime.dynamics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.latticeville.runtime.model.StructuralInvariantException;
import org.latticeville.runtime.spi.DynamicsContext;
import org.latticeville.runtime.spi.IRandomProvider;
import org.latticeville.runtime.spi.IWorldDynamics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates the configured world dynamics and runs them in order.
 * <p>
 * Each entry of the {@code dynamics} list names a class implementing
 * {@link IWorldDynamics} and its options. Plugin {@code i} receives the random stream
 * {@code deriveFor("dynamics", i)}, so adding a plugin at the end does not change the
 * behaviour of the ones before it.
 */
public class WorldDynamicsManager {

    private static final Logger LOG = LoggerFactory.getLogger(WorldDynamicsManager.class);

    private final List<IWorldDynamics> dynamics = new ArrayList<>();

    /**
     * @param random  Root random provider of the run.
     * @param configs The {@code dynamics} list.
     * @throws IllegalArgumentException if a plugin cannot be instantiated.
     */
    public WorldDynamicsManager(IRandomProvider random, List<? extends Config> configs) {
        for (int i = 0; i < configs.size(); i++) {
            dynamics.add(createDynamics(configs.get(i), random.deriveFor("dynamics", i)));
        }
    }

    /**
     * An empty manager; dynamics can be added programmatically.
     */
    public WorldDynamicsManager() {
    }

    private static IWorldDynamics createDynamics(Config config, IRandomProvider random) {
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            if (!IWorldDynamics.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IWorldDynamics");
            }
            IWorldDynamics plugin = (IWorldDynamics) clazz
                    .getConstructor(IRandomProvider.class, Config.class)
                    .newInstance(random, options);
            LOG.info("Loaded world dynamics: {}", clazz.getSimpleName());
            return plugin;
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate world dynamics: " + className, e);
        }
    }

    public void add(IWorldDynamics plugin) {
        dynamics.add(plugin);
    }

    /**
     * Runs all dynamics in configuration order. A failing plugin is skipped for this tick,
     * except for structural invariant violations, which are fatal to the run.
     *
     * @param context The tick's dynamics context.
     */
    public void applyAll(DynamicsContext context) {
        for (IWorldDynamics plugin : dynamics) {
            try {
                plugin.apply(context);
            } catch (StructuralInvariantException e) {
                throw e;
            } catch (Exception e) {
                LOG.warn("World dynamics '{}' failed at tick {}: {}",
                        plugin.getClass().getSimpleName(), context.getTick(), e.getMessage());
            }
        }
    }

    public List<IWorldDynamics> getDynamics() {
        return Collections.unmodifiableList(dynamics);
    }
}
