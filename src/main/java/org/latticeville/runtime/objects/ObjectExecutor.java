package org.latticeville.runtime.objects;

import java.util.Map;

import org.latticeville.runtime.action.Verb;
import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.model.CanonicalWorldState;
import org.latticeville.runtime.model.FrozenMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies INTERACT actions to objects through their type's transition table.
 * <p>
 * The table is consulted against the working copy's state at the moment the action runs,
 * so an interaction sees what earlier agents of the same tick left behind. With agents
 * processed in ascending id this makes outcomes reproducible. Two agents may both succeed
 * against an object whose table does not guard its own bounds.
 * <p>
 * A failed transition leaves the state untouched but still produces an event, so the
 * acting agent can remember the attempt.
 */
public class ObjectExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectExecutor.class);

    private final Map<String, TransitionTable> tables;

    /**
     * @param tables Transition tables keyed by object type name.
     */
    public ObjectExecutor(Map<String, TransitionTable> tables) {
        this.tables = FrozenMaps.copyOf(tables);
    }

    /**
     * @param working  The tick's working copy.
     * @param agentId  The acting agent.
     * @param objectId The target object.
     * @param verb     The verb.
     * @return The event describing the outcome.
     */
    public Event.ObjectStateChanged execute(CanonicalWorldState working, String agentId, String objectId, Verb verb) {
        Map<String, String> before = working.getObjectState(objectId);
        String type = working.getObjectType(objectId);
        TransitionTable table = type != null ? tables.get(type) : null;

        TransitionOutcome outcome;
        if (table == null) {
            String key = (type != null ? type : "object") + "." + verb.name().toLowerCase() + ".failed";
            outcome = new TransitionOutcome(before, false, key);
        } else {
            outcome = table.resolve(before, verb);
        }

        if (outcome.success()) {
            working.setObjectState(objectId, outcome.nextState());
        }
        LOG.debug("Agent {} {} {}: {} -> {} (success={})", agentId, verb, objectId, before,
                outcome.nextState(), outcome.success());
        return new Event.ObjectStateChanged(agentId, objectId, verb, before,
                outcome.success() ? outcome.nextState() : before, outcome.success(), outcome.narrationKey());
    }

    /**
     * @param type An object type name.
     * @return Whether a table is registered for the type.
     */
    public boolean hasTable(String type) {
        return tables.containsKey(type);
    }
}
