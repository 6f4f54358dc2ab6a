package io.entityforge.store;

import java.util.Optional;

/** A unique index column rejected the value being written. */
public class ConstraintViolationException extends EsRepoException {

    private final String column;
    private final String value;

    public ConstraintViolationException(String table, String column, String value, Throwable cause) {
        super("duplicate value for '" + table + "." + column + "'" + (value == null ? "" : ": " + value), cause);
        this.column = column;
        this.value = value;
    }

    /** Column name, or {@code null} when the database error did not identify it. */
    public String column() {
        return column;
    }

    @Override
    public boolean wasDuplicate(String column) {
        return column.equalsIgnoreCase(this.column);
    }

    @Override
    public Optional<String> duplicateValue() {
        return Optional.ofNullable(value);
    }
}
