package io.entityforge.store;

import java.util.Optional;

/** Failure while persisting a child collection of an aggregate. */
public class NestedEntityException extends EsRepoException {

    private final String collection;
    private final EsRepoException child;

    public NestedEntityException(String collection, EsRepoException child) {
        super("nested collection '" + collection + "' failed: " + child.getMessage(), child);
        this.collection = collection;
        this.child = child;
    }

    public String collection() {
        return collection;
    }

    public EsRepoException child() {
        return child;
    }

    @Override
    public boolean wasNotFound() {
        return child.wasNotFound();
    }

    @Override
    public boolean wasConcurrentModification() {
        return child.wasConcurrentModification();
    }

    @Override
    public boolean wasDuplicate(String column) {
        return child.wasDuplicate(column);
    }

    @Override
    public Optional<String> duplicateValue() {
        return child.duplicateValue();
    }
}
