package org.latticeville.datapipeline.replay;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.latticeville.runtime.event.TickPayload;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;

/**
 * Reads a replay log written by {@link ReplayLogWriter}.
 * <p>
 * The header must come first. Every record must carry this reader's schema version; the
 * first one that does not stops the replay with a {@link ReplayMismatchException}, as does
 * any line that cannot be parsed.
 */
public class ReplayLogReader {

    private final Path path;
    private final int schemaVersion;
    private final Gson gson = ReplayJson.create();

    public ReplayLogReader(Path path) {
        this(path, ReplayJson.SCHEMA_VERSION);
    }

    ReplayLogReader(Path path, int schemaVersion) {
        this.path = path;
        this.schemaVersion = schemaVersion;
    }

    /**
     * @return The run metadata from the header.
     * @throws IOException             if the file cannot be read.
     * @throws ReplayMismatchException if the header is missing or has another schema version.
     */
    public Map<String, Object> readMetadata() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                throw new ReplayMismatchException("Replay log " + path + " is empty", 1);
            }
            JsonObject header = parse(line, 1);
            requireHeader(header, 1);
            JsonElement metadata = header.get(ReplayLogWriter.METADATA);
            if (metadata == null || metadata.isJsonNull()) {
                return new LinkedHashMap<>();
            }
            return gson.fromJson(metadata, new TypeToken<LinkedHashMap<String, Object>>() { }.getType());
        }
    }

    /**
     * Streams all tick payloads in file order.
     *
     * @param consumer Receives each payload.
     * @throws IOException             if the file cannot be read.
     * @throws ReplayMismatchException on the first record that cannot be replayed.
     */
    public void forEachTick(Consumer<TickPayload> consumer) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            long lineNumber = 1;
            if (line == null) {
                throw new ReplayMismatchException("Replay log " + path + " is empty", lineNumber);
            }
            requireHeader(parse(line, lineNumber), lineNumber);
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonObject record = parse(line, lineNumber);
                requireVersion(record, lineNumber);
                String type = stringOrNull(record, ReplayLogWriter.TYPE);
                if (!ReplayLogWriter.TICK.equals(type)) {
                    throw new ReplayMismatchException("Unexpected record type '" + type + "'", lineNumber);
                }
                try {
                    consumer.accept(gson.fromJson(record.get(ReplayLogWriter.PAYLOAD), TickPayload.class));
                } catch (JsonParseException e) {
                    throw new ReplayMismatchException("Malformed tick payload", lineNumber, e);
                }
            }
        }
    }

    /**
     * @return All tick payloads in file order.
     * @throws IOException if the file cannot be read.
     */
    public List<TickPayload> readAll() throws IOException {
        List<TickPayload> payloads = new ArrayList<>();
        forEachTick(payloads::add);
        return payloads;
    }

    private void requireHeader(JsonObject record, long lineNumber) {
        if (!ReplayLogWriter.HEADER.equals(stringOrNull(record, ReplayLogWriter.TYPE))) {
            throw new ReplayMismatchException("Replay log does not start with a header", lineNumber);
        }
        requireVersion(record, lineNumber);
    }

    private void requireVersion(JsonObject record, long lineNumber) {
        JsonElement version = record.get(ReplayLogWriter.SCHEMA_VERSION);
        if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()
                || version.getAsDouble() != schemaVersion) {
            throw new ReplayMismatchException("Schema version " + version + " does not match reader version "
                    + schemaVersion, lineNumber);
        }
    }

    private static JsonObject parse(String line, long lineNumber) {
        try {
            JsonElement element = JsonParser.parseString(line);
            if (!element.isJsonObject()) {
                throw new ReplayMismatchException("Record is not a JSON object", lineNumber);
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ReplayMismatchException("Unparseable record", lineNumber, e);
        }
    }

    private static String stringOrNull(JsonObject record, String key) {
        JsonElement element = record.get(key);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }
}
