package io.github.drompincen.crewroom.persistence.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.drompincen.crewroom.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * One JSON file per record in a single directory, {@code <dir>/<id>.json}. Writes go to a temp
 * file in the same directory and are then renamed over the target, so a reader sees either the
 * old record or the new one.
 */
final class JsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    static final String EXTENSION = ".json";
    private static final Pattern VALID_ID = Pattern.compile("[a-z0-9][a-z0-9-]*");

    private final Path directory;
    private final String kind;
    private final ObjectMapper mapper;

    JsonFileStore(Path directory, String kind) {
        this.directory = directory;
        this.kind = kind;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create " + kind + " directory " + directory, e);
        }
    }

    Path directory() {
        return directory;
    }

    static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }

    Path fileFor(String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid " + kind + " id: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }

    void write(String id, Object record) {
        Path target = fileFor(id);
        Path tmp = directory.resolve("." + id + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmp, mapper.writeValueAsString(record), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {} {} to {}", kind, id, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to save " + kind + " '" + id + "'", e);
        }
    }

    <T> T read(Path file, Class<T> type) {
        try {
            return mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt " + kind + " record " + file, e);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + kind + " record " + file, e);
        }
    }

    /**
     * Record files, skipping dot-files such as leftover temp files.
     */
    List<Path> list() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                if (!file.getFileName().toString().startsWith(".")) files.add(file);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list " + kind + " records in " + directory, e);
        }
        return files;
    }

    void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete " + kind + " record " + file, e);
        }
    }

    static String idOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
