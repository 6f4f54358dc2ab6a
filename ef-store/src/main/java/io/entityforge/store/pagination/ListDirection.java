package io.entityforge.store.pagination;

public enum ListDirection {
    ASCENDING("ASC", ">"),
    DESCENDING("DESC", "<");

    private final String keyword;
    private final String comparator;

    ListDirection(String keyword, String comparator) {
        this.keyword = keyword;
        this.comparator = comparator;
    }

    public String keyword() {
        return keyword;
    }

    /** Operator selecting rows strictly after a cursor in this direction. */
    public String comparator() {
        return comparator;
    }
}
