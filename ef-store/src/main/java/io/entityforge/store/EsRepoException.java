package io.entityforge.store;

import java.util.Optional;

/** Root of the repository error taxonomy. */
public class EsRepoException extends RuntimeException {

    public EsRepoException(String message) {
        super(message);
    }

    public EsRepoException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean wasNotFound() {
        return false;
    }

    public boolean wasConcurrentModification() {
        return false;
    }

    /** True when a unique constraint on {@code column} rejected the write. */
    public boolean wasDuplicate(String column) {
        return false;
    }

    public Optional<String> duplicateValue() {
        return Optional.empty();
    }
}
