package io.entityforge.store.pagination;

/** SQL fragments shared by the list query variants. */
public final class ListQueries {

    /** Which query shape serves a filtered list call. */
    public enum QueryPath { PLAIN_SORT, SINGLE_FILTER, NULLABLE_FILTERS }

    private ListQueries() {}

    public static QueryPath pathFor(Filters filters) {
        return switch (filters.activeCount()) {
            case 0 -> QueryPath.PLAIN_SORT;
            case 1 -> QueryPath.SINGLE_FILTER;
            default -> QueryPath.NULLABLE_FILTERS;
        };
    }

    /**
     * Rows strictly after the cursor. Binds value, value, id; or only id when sorting by id.
     */
    public static String afterCursor(String sortColumn, ListDirection direction) {
        var op = direction.comparator();
        if ("id".equals(sortColumn)) return "id " + op + " ?";
        return "(" + sortColumn + " " + op + " ? OR (" + sortColumn + " = ? AND id " + op + " ?))";
    }

    public static String orderBy(String alias, String sortColumn, ListDirection direction) {
        var prefix = alias == null ? "" : alias + ".";
        var dir = direction.keyword();
        if ("id".equals(sortColumn)) return prefix + "id " + dir;
        return prefix + sortColumn + " " + dir + ", " + prefix + "id " + dir;
    }

    /** Predicate that is true when the bound value is null. Binds the value twice. */
    public static String nullableEq(String column, String castType) {
        return "COALESCE(" + column + " = CAST(? AS " + castType + "), CAST(? AS " + castType + ") IS NULL)";
    }
}
