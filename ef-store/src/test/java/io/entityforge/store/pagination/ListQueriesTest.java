package io.entityforge.store.pagination;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListQueriesTest {

    @Test
    void afterCursor_predicates() {
        assertThat(ListQueries.afterCursor("name", ListDirection.ASCENDING))
                .isEqualTo("(name > ? OR (name = ? AND id > ?))");
        assertThat(ListQueries.afterCursor("name", ListDirection.DESCENDING))
                .isEqualTo("(name < ? OR (name = ? AND id < ?))");
        assertThat(ListQueries.afterCursor("id", ListDirection.ASCENDING)).isEqualTo("id > ?");
    }

    @Test
    void orderBy_appliesDirectionToIdTieBreak() {
        assertThat(ListQueries.orderBy("i", "created_at", ListDirection.DESCENDING))
                .isEqualTo("i.created_at DESC, i.id DESC");
        assertThat(ListQueries.orderBy(null, "id", ListDirection.ASCENDING)).isEqualTo("id ASC");
    }

    @Test
    void nullableEq_predicate() {
        assertThat(ListQueries.nullableEq("status", "VARCHAR"))
                .isEqualTo("COALESCE(status = CAST(? AS VARCHAR), CAST(? AS VARCHAR) IS NULL)");
    }

    @Test
    void pathFor_countsOnlyFiltersWithValues() {
        assertThat(ListQueries.pathFor(Filters.none())).isEqualTo(ListQueries.QueryPath.PLAIN_SORT);
        assertThat(ListQueries.pathFor(Filters.builder().eq("a", 1).eq("b", null).build()))
                .isEqualTo(ListQueries.QueryPath.SINGLE_FILTER);
        assertThat(ListQueries.pathFor(Filters.builder().eq("a", 1).eq("b", 2).build()))
                .isEqualTo(ListQueries.QueryPath.NULLABLE_FILTERS);
    }
}
