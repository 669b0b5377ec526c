package com.wakecycle.tools.backend.store;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of reading a document: found, absent, or present but unparseable.
 * The caller decides what to substitute for the last two.
 */
public final class LoadResult<T> {

    public enum Kind {
        FOUND,
        ABSENT,
        MALFORMED
    }

    private final Kind kind;
    private final T document;
    private final Exception error;

    private LoadResult(Kind kind, T document, Exception error) {
        this.kind = kind;
        this.document = document;
        this.error = error;
    }

    public static <T> LoadResult<T> found(T document) {
        return new LoadResult<>(Kind.FOUND, Objects.requireNonNull(document, "document"), null);
    }

    public static <T> LoadResult<T> absent() {
        return new LoadResult<>(Kind.ABSENT, null, null);
    }

    public static <T> LoadResult<T> malformed(Exception error) {
        return new LoadResult<>(Kind.MALFORMED, null, Objects.requireNonNull(error, "error"));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public Optional<T> document() {
        return Optional.ofNullable(document);
    }

    public Optional<Exception> error() {
        return Optional.ofNullable(error);
    }

    public T orElseGet(Supplier<? extends T> defaults) {
        return kind == Kind.FOUND ? document : defaults.get();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FOUND -> "LoadResult[FOUND]";
            case ABSENT -> "LoadResult[ABSENT]";
            case MALFORMED -> "LoadResult[MALFORMED: " + error.getMessage() + "]";
        };
    }
}
