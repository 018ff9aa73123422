package org.latticeville.runtime.internal.services;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.latticeville.runtime.action.Action;
import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.model.IWorldReader;
import org.latticeville.runtime.spi.INarrationRenderer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Renders narration from {@code {placeholder}} templates.
 * <p>
 * Object interactions are looked up by their narration key first (e.g. {@code fridge.take}),
 * then by {@code object.succeeded} or {@code object.failed}. Placeholders that the context
 * cannot fill are left as they are.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * narration {
 *   templates {
 *     "move" = "{agent} walked from {from} to {to}."
 *     "fridge.take" = "{agent} took food from the {object}."
 *   }
 * }
 * }</pre>
 */
public class TemplateNarrationRenderer implements INarrationRenderer {

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry("move", "{agent} moved from {from} to {to}."),
            Map.entry("say", "{agent} says to {target}: \"{utterance}\""),
            Map.entry("weather", "The weather changed from {old} to {new}."),
            Map.entry("time", "The time is now {new}."),
            Map.entry("object.succeeded", "{agent} managed to {verb} the {object}."),
            Map.entry("object.failed", "{agent} tried to {verb} the {object} but failed."),
            Map.entry("action.idle", "{agent} waits."),
            Map.entry("action.move", "{agent} sets off towards {to}."),
            Map.entry("action.interact", "{agent} tries to {verb} the {object}."),
            Map.entry("action.say", "{agent} says to {target}: \"{utterance}\""));

    private final Map<String, String> templates;

    public TemplateNarrationRenderer() {
        this.templates = new LinkedHashMap<>(DEFAULTS);
    }

    /**
     * @param config The {@code narration} block; {@code templates} overrides or extends the defaults.
     */
    public TemplateNarrationRenderer(Config config) {
        this();
        if (config.hasPath("templates")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("templates").root().entrySet()) {
                templates.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
    }

    @Override
    public String narrate(Event event, IWorldReader world) {
        Map<String, String> values = new LinkedHashMap<>();
        String key;
        if (event instanceof Event.Moved moved) {
            key = "move";
            values.put("agent", world.nameOf(moved.agentId()));
            values.put("from", world.nameOf(moved.from()));
            values.put("to", world.nameOf(moved.to()));
        } else if (event instanceof Event.ObjectStateChanged changed) {
            key = templates.containsKey(changed.narrationKey())
                    ? changed.narrationKey()
                    : changed.success() ? "object.succeeded" : "object.failed";
            values.put("agent", world.nameOf(changed.agentId()));
            values.put("object", world.nameOf(changed.objectId()));
            values.put("verb", changed.verb().name().toLowerCase(Locale.ROOT));
        } else if (event instanceof Event.Said said) {
            key = "say";
            values.put("agent", world.nameOf(said.fromAgentId()));
            values.put("target", world.nameOf(said.toAgentId()));
            values.put("utterance", said.utterance());
        } else if (event instanceof Event.WeatherChanged weather) {
            key = "weather";
            values.put("old", weather.oldWeather());
            values.put("new", weather.newWeather());
        } else if (event instanceof Event.TimeAdvanced time) {
            key = "time";
            values.put("old", time.fromTime());
            values.put("new", time.toTime());
        } else {
            throw new IllegalArgumentException("Unsupported event " + event);
        }
        return render(key, values);
    }

    @Override
    public String narrate(Action action, String agentId, IWorldReader world) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("agent", world.nameOf(agentId));
        String key;
        if (action instanceof Action.Move move) {
            key = "action.move";
            values.put("to", world.nameOf(move.toLocationId()));
        } else if (action instanceof Action.Interact interact) {
            key = "action.interact";
            values.put("object", world.nameOf(interact.objectId()));
            values.put("verb", interact.verb().name().toLowerCase(Locale.ROOT));
        } else if (action instanceof Action.Say say) {
            key = "action.say";
            values.put("target", world.nameOf(say.toAgentId()));
            values.put("utterance", say.utterance());
        } else {
            key = "action.idle";
        }
        return render(key, values);
    }

    private String render(String key, Map<String, String> values) {
        String result = templates.get(key);
        for (Map.Entry<String, String> value : values.entrySet()) {
            result = result.replace("{" + value.getKey() + "}", String.valueOf(value.getValue()));
        }
        return result;
    }
}
