package com.example.hookhub.agent.history;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Received requests, one JSON file each under {@code <home>/history}.
 */
@Slf4j
public class HistoryStore {

    private static final String SUFFIX = ".json";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9-]+");

    private final Gson gson = new Gson();
    private final Path directory;

    public HistoryStore(Path home) throws IOException {
        this.directory = home.resolve("history");
        Files.createDirectories(directory);
    }

    /**
     * Saves the item under a fresh id.
     *
     * @return the id
     */
    public String add(HistoryItem item) throws IOException {
        String id = UUID.randomUUID().toString().substring(0, 8);
        Files.writeString(file(id), gson.toJson(item), StandardCharsets.UTF_8);
        item.setId(id);
        return id;
    }

    public Optional<HistoryItem> get(String id) throws IOException {
        Path file = file(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file, id));
    }

    /**
     * All items, oldest first. Unreadable files are skipped.
     */
    public List<HistoryItem> list() throws IOException {
        List<HistoryItem> items = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - SUFFIX.length());
                try {
                    HistoryItem item = read(file, id);
                    // the sort below needs a parseable timestamp
                    item.receivedAtInstant();
                    items.add(item);
                } catch (IOException | JsonParseException | DateTimeParseException e) {
                    log.warn("[History] Skipping unreadable item {}: {}", id, e.getMessage());
                }
            }
        }
        items.sort(Comparator.comparing(HistoryItem::receivedAtInstant));
        return items;
    }

    /**
     * @return false if there was no such item
     */
    public boolean delete(String id) throws IOException {
        return Files.deleteIfExists(file(id));
    }

    /**
     * @return number of items removed
     */
    public int clear() throws IOException {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Files.delete(file);
                removed++;
            }
        }
        return removed;
    }

    private HistoryItem read(Path file, String id) throws IOException {
        HistoryItem item = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), HistoryItem.class);
        if (item == null) {
            throw new IOException("Empty history file " + file);
        }
        item.setId(id);
        return item;
    }

    private Path file(String id) {
        if (id == null || !VALID_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid history id: " + id);
        }
        return directory.resolve(id + SUFFIX);
    }
}
