package org.latticeville.runtime.objects;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.latticeville.runtime.action.Verb;

/**
 * Deterministic {@code (state, verb) -> (nextState, success, narrationKey)} table of one
 * object type.
 * <p>
 * Rules are tried in declaration order and the first match wins. A verb with no matching
 * rule fails with the key {@code <type>.<verb>.failed}. The table alone is responsible for
 * the physical plausibility of its transitions, e.g. never letting a count drop below zero.
 */
public final class TransitionTable {

    private final String type;
    private final List<TransitionRule> rules;

    public TransitionTable(String type, List<TransitionRule> rules) {
        this.type = type;
        this.rules = List.copyOf(rules);
    }

    /**
     * @param type The object type name.
     * @return A builder for a table of that type.
     */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    /**
     * @param state The object's current attributes.
     * @param verb  The verb applied.
     * @return The outcome; failures carry the unchanged state.
     */
    public TransitionOutcome resolve(Map<String, String> state, Verb verb) {
        for (TransitionRule rule : rules) {
            if (rule.matches(verb, state)) {
                if (!rule.success()) {
                    return new TransitionOutcome(state, false, narrationKey(rule, verb, false));
                }
                Map<String, String> next = new LinkedHashMap<>(state);
                next.putAll(rule.set());
                return new TransitionOutcome(next, true, narrationKey(rule, verb, true));
            }
        }
        return new TransitionOutcome(state, false, defaultKey(verb, false));
    }

    private String narrationKey(TransitionRule rule, Verb verb, boolean success) {
        return rule.narrationKey() != null ? rule.narrationKey() : defaultKey(verb, success);
    }

    private String defaultKey(Verb verb, boolean success) {
        return type + "." + verb.name().toLowerCase() + (success ? ".succeeded" : ".failed");
    }

    public String getType() {
        return type;
    }

    public List<TransitionRule> getRules() {
        return rules;
    }

    /**
     * Fluent construction of tables in code, mostly for tests and built-in object types.
     */
    public static final class Builder {
        private final String type;
        private final List<TransitionRule> rules = new ArrayList<>();

        private Builder(String type) {
            this.type = type;
        }

        /**
         * Adds a successful transition.
         *
         * @param verb         The verb.
         * @param when         Required attributes.
         * @param set          Attributes written.
         * @param narrationKey Template key, or {@code null} for the default.
         * @return This builder.
         */
        public Builder on(Verb verb, Map<String, String> when, Map<String, String> set, String narrationKey) {
            rules.add(new TransitionRule(verb, when, set, true, narrationKey));
            return this;
        }

        /**
         * Adds an explicit failure, e.g. taking from an empty container.
         *
         * @param verb         The verb.
         * @param when         Required attributes.
         * @param narrationKey Template key, or {@code null} for the default.
         * @return This builder.
         */
        public Builder fail(Verb verb, Map<String, String> when, String narrationKey) {
            rules.add(new TransitionRule(verb, when, Map.of(), false, narrationKey));
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(type, rules);
        }
    }
}
