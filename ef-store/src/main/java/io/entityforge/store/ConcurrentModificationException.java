package io.entityforge.store;

/**
 * Another transaction appended events to the same entity first.
 * Reload the entity and retry the mutation.
 */
public class ConcurrentModificationException extends EsRepoException {

    public ConcurrentModificationException(String table, Object entityId, Throwable cause) {
        super("concurrent modification of '" + table + "' entity " + entityId, cause);
    }

    @Override
    public boolean wasConcurrentModification() {
        return true;
    }
}
