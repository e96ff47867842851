package com.example.hookhub.agent.profile;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named profiles kept in {@code <home>/profiles.json}.
 */
public class Profiles {

    public static final String DEFAULT_PROFILE = "default";

    private static final Type PROFILE_MAP = new TypeToken<Map<String, Profile>>() {
    }.getType();

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Path file;
    private Map<String, Profile> profiles;

    private Profiles(Path file, Map<String, Profile> profiles) {
        this.file = file;
        this.profiles = profiles;
    }

    /**
     * Reads the profiles file; a missing file means no profiles yet.
     */
    public static Profiles load(Path home) throws IOException {
        Path file = home.resolve("profiles.json");
        if (!Files.exists(file)) {
            return new Profiles(file, new TreeMap<>());
        }
        try {
            Map<String, Profile> stored = new Gson().fromJson(Files.readString(file, StandardCharsets.UTF_8),
                    PROFILE_MAP);
            return new Profiles(file, stored == null ? new TreeMap<>() : new TreeMap<>(stored));
        } catch (JsonParseException e) {
            throw new IOException("Unreadable profiles file " + file + ": " + e.getMessage(), e);
        }
    }

    public Optional<Profile> get(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    public Map<String, Profile> list() {
        return Collections.unmodifiableMap(profiles);
    }

    /**
     * @throws IllegalArgumentException if the name is taken
     */
    public void add(String name, Profile profile) throws IOException {
        if (profiles.containsKey(name)) {
            throw new IllegalArgumentException("profile " + name + " already exists");
        }
        Map<String, Profile> updated = new TreeMap<>(profiles);
        updated.put(name, profile);
        save(updated);
        profiles = updated;
    }

    /**
     * @throws IllegalArgumentException if there is no such profile
     */
    public void delete(String name) throws IOException {
        if (!profiles.containsKey(name)) {
            throw new IllegalArgumentException("profile " + name + " doesn't exist");
        }
        Map<String, Profile> updated = new TreeMap<>(profiles);
        updated.remove(name);
        save(updated);
        profiles = updated;
    }

    private void save(Map<String, Profile> updated) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(temp, gson.toJson(updated, PROFILE_MAP), StandardCharsets.UTF_8);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
