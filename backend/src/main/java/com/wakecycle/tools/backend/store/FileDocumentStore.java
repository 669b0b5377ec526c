package com.wakecycle.tools.backend.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * {@link DocumentStore} keeping each document as a pretty-printed JSON file.
 *
 * <p>Writes go to a temporary file next to the target which is then moved over it, so readers
 * only ever see a complete document. Every read-modify-write cycle for a key runs under that
 * key's lock; writers in other processes are not coordinated.</p>
 */
public class FileDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    // Mode for documents created from scratch; an existing document keeps its own mode
    static final Set<PosixFilePermission> NEW_DOCUMENT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final Map<DocumentKey, Path> locations;
    private final Map<DocumentKey, ReentrantLock> locks = new EnumMap<>(DocumentKey.class);
    private final ObjectMapper objectMapper;

    public FileDocumentStore(Map<DocumentKey, Path> locations, ObjectMapper objectMapper) {
        this.locations = new EnumMap<>(DocumentKey.class);
        for (DocumentKey key : DocumentKey.values()) {
            Path path = locations.get(key);
            if (path == null) {
                throw new IllegalArgumentException("No location configured for " + key.label() + " document");
            }
            this.locations.put(key, path);
            this.locks.put(key, new ReentrantLock());
        }
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path pathOf(DocumentKey key) {
        return locations.get(key);
    }

    @Override
    public <T> LoadResult<T> load(DocumentKey key, Class<T> type) {
        Path path = pathOf(key);
        if (!Files.exists(path)) {
            return LoadResult.absent();
        }
        try {
            T document = objectMapper.readValue(path.toFile(), type);
            if (document == null) {
                return LoadResult.malformed(new IOException("Document is null: " + path));
            }
            return LoadResult.found(document);
        } catch (IOException e) {
            return LoadResult.malformed(e);
        }
    }

    @Override
    public <T> T loadOrDefault(DocumentKey key, Class<T> type, Supplier<T> defaults) {
        LoadResult<T> result = load(key, type);
        if (result.kind() == LoadResult.Kind.MALFORMED) {
            log.warn("Error loading {}: {}", pathOf(key),
                    result.error().map(Exception::getMessage).orElse("unknown error"));
        }
        return result.orElseGet(defaults);
    }

    @Override
    public void save(DocumentKey key, Object document) {
        Path target = pathOf(key).toAbsolutePath();
        Path temp = null;
        try {
            Path dir = target.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            applyPermissions(temp, target);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard(temp);
            throw new DocumentStoreException("Failed to write " + key.label() + " document to " + target, e);
        }
    }

    @Override
    public <T, R> R update(DocumentKey key, Class<T> type, Supplier<T> defaults, Function<T, R> mutation) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            T document = loadOrDefault(key, type, defaults);
            R result = mutation.apply(document);
            save(key, document);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T replace(DocumentKey key, Class<T> type, Supplier<T> defaults, UnaryOperator<T> replacement) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            T next = replacement.apply(loadOrDefault(key, type, defaults));
            save(key, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(DocumentKey key) {
        return Files.exists(pathOf(key));
    }

    // createTempFile yields an owner-only file on POSIX file systems
    private void applyPermissions(Path temp, Path target) throws IOException {
        if (!Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : NEW_DOCUMENT_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private void discard(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
