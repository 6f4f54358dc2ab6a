package io.entityforge.store.pagination;

/** A cursor token was malformed or was produced for a different sort column. */
public class CursorDestructureException extends RuntimeException {

    public CursorDestructureException(String message) {
        super(message);
    }

    public CursorDestructureException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CursorDestructureException mismatch(String expected, String actual) {
        return new CursorDestructureException("cursor sorts by '" + actual + "', query sorts by '" + expected + "'");
    }
}
