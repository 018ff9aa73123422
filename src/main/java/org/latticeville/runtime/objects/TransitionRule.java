package org.latticeville.runtime.objects;

import java.util.Map;

import org.latticeville.runtime.action.Verb;
import org.latticeville.runtime.model.FrozenMaps;

/**
 * One row of a transition table.
 *
 * @param verb         The verb the rule reacts to.
 * @param when         Attribute values the object must have for the rule to match.
 * @param set          Attribute values written on success.
 * @param success      Whether a match is a successful transition or a modeled failure.
 * @param narrationKey Template key describing the outcome.
 */
public record TransitionRule(Verb verb, Map<String, String> when, Map<String, String> set, boolean success,
                             String narrationKey) {

    public TransitionRule {
        if (verb == null) {
            throw new IllegalArgumentException("Transition rule needs a verb");
        }
        when = FrozenMaps.copyOf(when);
        set = FrozenMaps.copyOf(set);
    }

    /**
     * @param verb  The verb applied.
     * @param state The object's current attributes.
     * @return Whether this rule applies.
     */
    public boolean matches(Verb verb, Map<String, String> state) {
        if (this.verb != verb) {
            return false;
        }
        for (Map.Entry<String, String> condition : when.entrySet()) {
            if (!condition.getValue().equals(state.get(condition.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
