package org.latticeville.runtime.objects;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.latticeville.runtime.action.Verb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Reads transition tables from a HOCON block.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * fridge {
 *   rules = [
 *     { verb = TAKE, when { items = 1 }, set { items = 0 }, narration = "fridge.take" }
 *     { verb = TAKE, when { items = 0 }, success = false, narration = "fridge.empty" }
 *   ]
 * }
 * }</pre>
 * Attribute values are compared as strings, so {@code items = 1} and {@code items = "1"}
 * are equivalent.
 */
public final class TransitionTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionTableLoader.class);

    private TransitionTableLoader() {
    }

    /**
     * @param config Block whose top-level keys are object type names.
     * @return Tables keyed by type name.
     * @throws IllegalArgumentException if a rule names an unknown verb.
     */
    public static Map<String, TransitionTable> fromConfig(Config config) {
        Map<String, TransitionTable> tables = new LinkedHashMap<>();
        for (String type : config.root().keySet()) {
            Config typeConfig = config.getConfig("\"" + type + "\"");
            List<TransitionRule> rules = new ArrayList<>();
            if (typeConfig.hasPath("rules")) {
                for (Config ruleConfig : typeConfig.getConfigList("rules")) {
                    rules.add(parseRule(type, ruleConfig));
                }
            }
            tables.put(type, new TransitionTable(type, rules));
            LOG.debug("Loaded transition table '{}' with {} rules", type, rules.size());
        }
        return tables;
    }

    private static TransitionRule parseRule(String type, Config rule) {
        String verbName = rule.getString("verb");
        Verb verb;
        try {
            verb = Verb.valueOf(verbName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown verb '" + verbName + "' in transition table '" + type + "'", e);
        }
        Map<String, String> when = rule.hasPath("when") ? attributes(rule.getConfig("when")) : Map.of();
        Map<String, String> set = rule.hasPath("set") ? attributes(rule.getConfig("set")) : Map.of();
        boolean success = !rule.hasPath("success") || rule.getBoolean("success");
        String narration = rule.hasPath("narration") ? rule.getString("narration") : null;
        return new TransitionRule(verb, when, set, success, narration);
    }

    private static Map<String, String> attributes(Config block) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (String key : block.root().keySet()) {
            try {
                attributes.put(key, block.getString("\"" + key + "\""));
            } catch (ConfigException.WrongType e) {
                throw new IllegalArgumentException("Attribute '" + key + "' must be a scalar value", e);
            }
        }
        return attributes;
    }
}
