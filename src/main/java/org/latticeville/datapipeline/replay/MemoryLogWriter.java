package org.latticeville.datapipeline.replay;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.latticeville.runtime.memory.MemoryView;
import org.latticeville.runtime.spi.IMemoryListener;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

/**
 * Appends every memory record of a run to a JSON Lines file as
 * {@code {"agent_id": ..., "record": {...}}}.
 */
public class MemoryLogWriter implements IMemoryListener, AutoCloseable {

    private final Gson gson = ReplayJson.create();
    private final BufferedWriter writer;

    /**
     * @param path Target file; created if missing, appended to otherwise.
     * @throws IOException if the file cannot be opened.
     */
    public MemoryLogWriter(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized void onMemory(String agentId, MemoryView record) throws IOException {
        JsonObject line = new JsonObject();
        line.addProperty("agent_id", agentId);
        line.add("record", gson.toJsonTree(record));
        writer.write(gson.toJson(line));
        writer.newLine();
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
