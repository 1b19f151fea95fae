package com.annal.persistence;

import com.annal.store.Document;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles persistence of the in-memory document store using a snapshot file
 * and a write-ahead log holding one committed transaction per line.
 */
public class PersistenceManager {
    private static final Logger LOGGER = Logger.getLogger(PersistenceManager.class.getName());

    private final Path baseDirectory;
    private final Path snapshotPath;
    private final Path walPath;
    private final DocumentCodec codec = new DocumentCodec();

    public PersistenceManager(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
        this.snapshotPath = baseDirectory.resolve("snapshot.json");
        this.walPath = baseDirectory.resolve("wal.log");
        try {
            Files.createDirectories(baseDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create persistence directory " + baseDirectory, e);
        }
    }

    /**
     * Reads the snapshot, then replays the log on top of it. Lines that do not
     * parse (a torn final append) are skipped with a warning.
     */
    public LoadedState load() {
        Map<String, Map<String, Document>> data = new LinkedHashMap<>();
        int replayed = 0;
        try {
            if (Files.exists(snapshotPath)) {
                try (Reader reader = Files.newBufferedReader(snapshotPath, StandardCharsets.UTF_8)) {
                    JsonElement root = JsonParser.parseReader(reader);
                    if (root != null && root.isJsonObject()) {
                        for (var collection : root.getAsJsonObject().entrySet()) {
                            Map<String, Document> docs = data.computeIfAbsent(collection.getKey(), k -> new LinkedHashMap<>());
                            for (JsonElement element : collection.getValue().getAsJsonArray()) {
                                Document doc = codec.toDocument(element.getAsJsonObject());
                                docs.put(doc.getId(), doc);
                            }
                        }
                    }
                }
            }
            if (Files.exists(walPath)) {
                try (BufferedReader reader = Files.newBufferedReader(walPath, StandardCharsets.UTF_8)) {
                    String line;
                    int lineNumber = 0;
                    while ((line = reader.readLine()) != null) {
                        lineNumber++;
                        if (line.isBlank()) {
                            continue;
                        }
                        List<Change> changes;
                        try {
                            changes = parseCommit(line);
                        } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
                            LOGGER.log(Level.WARNING, "Skipping unreadable log line " + lineNumber + " in " + walPath, e);
                            continue;
                        }
                        apply(data, changes);
                        replayed++;
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load persisted state from " + baseDirectory, e);
        }
        LOGGER.fine(() -> "Loaded " + data.size() + " collections from " + baseDirectory);
        return new LoadedState(data, replayed);
    }

    /** Appends one committed transaction as a single line. */
    public void appendCommit(List<Change> changes) throws IOException {
        if (changes.isEmpty()) {
            return;
        }
        JsonObject commit = new JsonObject();
        commit.addProperty("timestamp", System.currentTimeMillis());
        JsonArray array = new JsonArray();
        for (Change change : changes) {
            JsonObject c = new JsonObject();
            c.addProperty("collection", change.collection());
            c.addProperty("id", change.id());
            c.add("document", change.document() == null ? null : codec.encode(change.document().getFields()));
            array.add(c);
        }
        commit.add("changes", array);
        Files.writeString(walPath, codec.write(commit) + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Writes every collection to the snapshot file atomically and truncates the log.
     */
    public void saveSnapshot(Map<String, ? extends Collection<Document>> collections) throws IOException {
        JsonObject root = new JsonObject();
        for (var entry : collections.entrySet()) {
            JsonArray docs = new JsonArray();
            for (Document doc : entry.getValue()) {
                docs.add(codec.encode(doc.getFields()));
            }
            root.add(entry.getKey(), docs);
        }
        Files.createDirectories(baseDirectory);
        Path tmp = baseDirectory.resolve("snapshot.tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            writer.write(codec.write(root));
        }
        try {
            Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.deleteIfExists(walPath);
    }

    private List<Change> parseCommit(String line) {
        JsonObject commit = JsonParser.parseString(line).getAsJsonObject();
        List<Change> changes = new ArrayList<>();
        for (JsonElement element : commit.getAsJsonArray("changes")) {
            JsonObject c = element.getAsJsonObject();
            JsonElement doc = c.get("document");
            changes.add(new Change(
                    c.get("collection").getAsString(),
                    c.get("id").getAsString(),
                    doc == null || doc.isJsonNull() ? null : codec.toDocument(doc.getAsJsonObject())));
        }
        return changes;
    }

    private void apply(Map<String, Map<String, Document>> data, List<Change> changes) {
        for (Change change : changes) {
            Map<String, Document> docs = data.computeIfAbsent(change.collection(), k -> new LinkedHashMap<>());
            if (change.document() == null) {
                docs.remove(change.id());
            } else {
                docs.put(change.id(), change.document());
            }
        }
    }

    public record LoadedState(Map<String, Map<String, Document>> collections, int replayedCommits) {}

    /** A document written ({@code document != null}) or removed by a commit. */
    public record Change(String collection, String id, Document document) {}
}
