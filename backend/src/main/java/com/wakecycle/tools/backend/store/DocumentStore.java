package com.wakecycle.tools.backend.store;

import java.nio.file.Path;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Load/save access to the named JSON documents.
 */
public interface DocumentStore {

    /**
     * Read a document without applying any fallback.
     */
    <T> LoadResult<T> load(DocumentKey key, Class<T> type);

    /**
     * Read a document, substituting {@code defaults} when it is absent or malformed.
     * Malformed documents are logged.
     */
    <T> T loadOrDefault(DocumentKey key, Class<T> type, Supplier<T> defaults);

    /**
     * Replace a document atomically.
     *
     * @throws DocumentStoreException if the document could not be written
     */
    void save(DocumentKey key, Object document);

    /**
     * Load (or default), mutate and save a document while holding the key's lock.
     * Nothing is written when {@code mutation} throws.
     */
    <T, R> R update(DocumentKey key, Class<T> type, Supplier<T> defaults, Function<T, R> mutation);

    /**
     * Like {@link #update} but persists whatever {@code replacement} returns instead of the
     * loaded document.
     */
    <T> T replace(DocumentKey key, Class<T> type, Supplier<T> defaults, UnaryOperator<T> replacement);

    boolean exists(DocumentKey key);

    /**
     * Backing location of a document.
     */
    Path pathOf(DocumentKey key);
}
