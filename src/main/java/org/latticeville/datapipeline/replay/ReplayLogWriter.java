package org.latticeville.datapipeline.replay;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

import org.latticeville.runtime.event.TickPayload;
import org.latticeville.runtime.spi.ITickSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

/**
 * Writes a run as JSON Lines: one header record followed by one record per tick.
 * <pre>{@code
 * {"type":"header","schema_version":1,"metadata":{...}}
 * {"type":"tick","schema_version":1,"payload":{"tick":0,...}}
 * }</pre>
 * Every line is flushed as it is written, so a crashed run leaves a readable prefix.
 */
public class ReplayLogWriter implements ITickSink {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayLogWriter.class);

    static final String TYPE = "type";
    static final String SCHEMA_VERSION = "schema_version";
    static final String HEADER = "header";
    static final String TICK = "tick";
    static final String METADATA = "metadata";
    static final String PAYLOAD = "payload";

    private final Path path;
    private final Gson gson = ReplayJson.create();
    private final BufferedWriter writer;
    private long ticksWritten;

    /**
     * Creates the file (and its parent directories) and writes the header.
     *
     * @param path     Target file. Must not exist yet.
     * @param metadata Free-form run metadata such as seed and world name.
     * @throws IOException if the file cannot be created.
     */
    public ReplayLogWriter(Path path, Map<String, ?> metadata) throws IOException {
        this.path = path;
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        JsonObject header = new JsonObject();
        header.addProperty(TYPE, HEADER);
        header.addProperty(SCHEMA_VERSION, ReplayJson.SCHEMA_VERSION);
        header.add(METADATA, gson.toJsonTree(metadata));
        writeLine(header);
        LOG.info("Writing replay log to {}", path);
    }

    @Override
    public synchronized void onTick(TickPayload payload) throws IOException {
        JsonObject record = new JsonObject();
        record.addProperty(TYPE, TICK);
        record.addProperty(SCHEMA_VERSION, ReplayJson.SCHEMA_VERSION);
        record.add(PAYLOAD, gson.toJsonTree(payload));
        writeLine(record);
        ticksWritten++;
    }

    private void writeLine(JsonObject record) throws IOException {
        writer.write(gson.toJson(record));
        writer.newLine();
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        LOG.info("Replay log {} closed after {} ticks", path, ticksWritten);
    }

    public Path getPath() {
        return path;
    }
}
