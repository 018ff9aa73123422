package org.latticeville.datapipeline.replay;

import java.lang.reflect.Type;
import java.util.Map;

import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.event.EventKind;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * Gson setup shared by the replay and memory logs.
 * <p>
 * Records serialize natively. The sealed {@link Event} hierarchy is written with an extra
 * {@code kind} discriminator and read back into the matching record.
 */
public final class ReplayJson {

    /**
     * Version of the record layout. Bumped whenever a persisted type changes shape.
     */
    public static final int SCHEMA_VERSION = 1;

    static final String KIND = "kind";

    private static final Map<EventKind, Class<? extends Event>> EVENT_TYPES = Map.of(
            EventKind.MOVE, Event.Moved.class,
            EventKind.OBJECT_STATE_CHANGED, Event.ObjectStateChanged.class,
            EventKind.SAY, Event.Said.class,
            EventKind.WEATHER_CHANGED, Event.WeatherChanged.class,
            EventKind.TIME_ADVANCED, Event.TimeAdvanced.class);

    private ReplayJson() {
    }

    /**
     * @return A Gson instance that can write and read tick payloads.
     */
    public static Gson create() {
        return new GsonBuilder()
                .registerTypeHierarchyAdapter(Event.class, new EventAdapter())
                .disableHtmlEscaping()
                .create();
    }

    private static final class EventAdapter implements JsonSerializer<Event>, JsonDeserializer<Event> {

        // Event records hold only strings, enums and string maps, so a plain Gson handles
        // their fields; going through the context would re-enter this adapter.
        private final Gson fieldsGson = new Gson();

        @Override
        public JsonElement serialize(Event event, Type type, JsonSerializationContext context) {
            JsonObject json = fieldsGson.toJsonTree(event).getAsJsonObject();
            json.addProperty(KIND, event.kind().name());
            return json;
        }

        @Override
        public Event deserialize(JsonElement element, Type type, JsonDeserializationContext context) {
            JsonObject json = element.getAsJsonObject();
            JsonElement kind = json.get(KIND);
            if (kind == null) {
                throw new JsonParseException("Event without '" + KIND + "': " + json);
            }
            Class<? extends Event> eventType;
            try {
                eventType = EVENT_TYPES.get(EventKind.valueOf(kind.getAsString()));
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Unknown event kind '" + kind.getAsString() + "'", e);
            }
            JsonObject fields = json.deepCopy();
            fields.remove(KIND);
            return fieldsGson.fromJson(fields, eventType);
        }
    }
}
