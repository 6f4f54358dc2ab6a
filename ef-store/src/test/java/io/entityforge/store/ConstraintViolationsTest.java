package io.entityforge.store;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConstraintViolationsTest {

    private final Map<String, String> constraints = Map.of(
            "users_pkey", "id",
            "users_name_key", "name",
            "users_email_key", "email");

    @Test
    void translate_postgresMessage() {
        var cause = new SQLException("""
                ERROR: duplicate key value violates unique constraint "users_email_key"
                  Detail: Key (email)=(bob@example.com) already exists.""", "23505");
        var e = new DuplicateKeyException("PreparedStatementCallback; SQL [INSERT INTO users ...]", cause);

        var violation = ConstraintViolations.translate("users", constraints, e);

        assertThat(violation.column()).isEqualTo("email");
        assertThat(violation.duplicateValue()).contains("bob@example.com");
    }

    @Test
    void translate_h2UniqueIndexMessage() {
        var cause = new SQLException(
                "Unique index or primary key violation: \"PUBLIC.USERS_NAME_KEY_INDEX_4 ON PUBLIC.USERS(NAME NULLS FIRST) VALUES ( /* 1 */ 'Bob' )\"",
                "23505");
        var e = new DuplicateKeyException("insert", cause);

        var violation = ConstraintViolations.translate("users", constraints, e);

        assertThat(violation.wasDuplicate("name")).isTrue();
        assertThat(violation.duplicateValue()).contains("Bob");
    }

    @Test
    void translate_h2PrimaryKeyWithoutConstraintName() {
        var cause = new SQLException(
                "Unique index or primary key violation: \"PRIMARY KEY ON PUBLIC.USERS(ID) ( /* key:1 */ 1)\"", "23505");

        var violation = ConstraintViolations.translate("users", constraints, new DuplicateKeyException("insert", cause));

        assertThat(violation.wasDuplicate("id")).isTrue();
    }

    @Test
    void translate_unknownMessageKeepsColumnUnset() {
        var violation = ConstraintViolations.translate("users", constraints,
                new DuplicateKeyException("something odd"));

        assertThat(violation.column()).isNull();
        assertThat(violation.wasDuplicate("name")).isFalse();
        assertThat(violation.duplicateValue()).isEmpty();
    }
}
