package com.finpal.assistant.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpal.assistant.security.IdentifierMasker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flat JSON document mapping a key to a value, stored as a single object in one file.
 * Every read loads the whole file and every write rewrites it. Access within one process is
 * serialised on a per-store lock.
 * <p>
 * Entries are converted one at a time: an entry that does not fit {@code T} is skipped on read
 * and written back untouched, so one malformed entry never hides or drops the others. A file
 * that is not a JSON object at all reads as empty, and writes to it fail with
 * {@link StorageException} instead of replacing it.
 */
public class JsonDocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Class<T> valueType;
    private final Object lock = new Object();

    public JsonDocumentStore(Path path, ObjectMapper objectMapper, Class<T> valueType) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.valueType = valueType;
    }

    public Path path() {
        return path;
    }

    /** Every readable entry; malformed entries are left out. */
    public Map<String, T> load() {
        synchronized (lock) {
            Map<String, T> document = new LinkedHashMap<>();
            readEntries(false).forEach((key, node) -> {
                T value = convert(key, node);
                if (value != null) {
                    document.put(key, value);
                }
            });
            return document;
        }
    }

    public Optional<T> get(String key) {
        synchronized (lock) {
            return Optional.ofNullable(convert(key, readEntries(false).get(key)));
        }
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    public void put(String key, T value) {
        synchronized (lock) {
            Map<String, JsonNode> entries = readEntries(true);
            entries.put(key, objectMapper.valueToTree(value));
            write(entries);
        }
    }

    /**
     * Stores {@code value} only when {@code key} has no entry yet; returns whether it was stored.
     * An existing entry counts even when it cannot be read as {@code T}.
     */
    public boolean putIfAbsent(String key, T value) {
        synchronized (lock) {
            Map<String, JsonNode> entries = readEntries(true);
            JsonNode existing = entries.get(key);
            if (existing != null && !existing.isNull()) {
                return false;
            }
            entries.put(key, objectMapper.valueToTree(value));
            write(entries);
            return true;
        }
    }

    /**
     * Read-modify-write of a single entry. {@code remapping} receives the current value
     * ({@code null} when missing or unreadable) and returns the value to store.
     */
    public T update(String key, UnaryOperator<T> remapping) {
        synchronized (lock) {
            Map<String, JsonNode> entries = readEntries(true);
            T updated = remapping.apply(convert(key, entries.get(key)));
            entries.put(key, objectMapper.valueToTree(updated));
            write(entries);
            return updated;
        }
    }

    /** Writes {@code seed} as the whole document if the file does not exist yet. */
    public boolean initializeIfMissing(Map<String, T> seed) {
        synchronized (lock) {
            if (Files.exists(path)) {
                return false;
            }
            Map<String, JsonNode> entries = new LinkedHashMap<>();
            seed.forEach((key, value) -> entries.put(key, objectMapper.valueToTree(value)));
            write(entries);
            return true;
        }
    }

    private Map<String, JsonNode> readEntries(boolean forWrite) {
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            return entries;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            if (forWrite) {
                throw new StorageException("Refusing to overwrite unparsable store " + path, ex);
            }
            log.warn("Store {} unreadable, treating as empty: {}", path, ex.getMessage());
            return entries;
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return entries;
        }
        if (!root.isObject()) {
            if (forWrite) {
                throw new StorageException("Refusing to overwrite store " + path + ": top level is not a JSON object");
            }
            log.warn("Store {} is not a JSON object, treating as empty", path);
            return entries;
        }
        root.fields().forEachRemaining(field -> entries.put(field.getKey(), field.getValue()));
        return entries;
    }

    private T convert(String key, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, valueType);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Store {} entry {} skipped: {}", path, IdentifierMasker.mask(key), ex.getMessage());
            return null;
        }
    }

    private void write(Map<String, JsonNode> entries) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), entries);
            log.debug("Store {} written ({} entries)", path, entries.size());
        } catch (IOException ex) {
            throw new StorageException("Failed to write " + path, ex);
        }
    }
}
