package io.entityforge.store;

public class EntityNotFoundException extends EsRepoException {

    private final String table;
    private final String column;
    private final Object value;

    public EntityNotFoundException(String table, String column, Object value) {
        super("no entity in '" + table + "' with " + column + " = " + value);
        this.table = table;
        this.column = column;
        this.value = value;
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }

    public Object value() {
        return value;
    }

    @Override
    public boolean wasNotFound() {
        return true;
    }
}
