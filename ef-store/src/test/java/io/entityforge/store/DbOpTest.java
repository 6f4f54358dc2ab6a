package io.entityforge.store;

import io.entityforge.store.fixtures.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DbOpTest {

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void audit(AtomicOperation op, String message) {
        op.jdbc().update("INSERT INTO audit_log (message, logged_at) VALUES (?, ?)", message, Timestamp.from(op.now()));
    }

    @Test
    void commit_makesWritesVisible() {
        try (var op = db.ops().begin()) {
            audit(op, "hello");
            assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isZero();
            op.commit();
        }

        assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isEqualTo(1);
    }

    @Test
    void close_withoutCommitRollsBack() {
        try (var op = db.ops().begin()) {
            audit(op, "lost");
        }

        assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isZero();
    }

    @Test
    void now_isReadOnceAndTruncatedToMicros() {
        db.clock().set(Instant.parse("2025-06-01T08:00:00.123456789Z"));
        try (var op = db.ops().begin()) {
            db.clock().advance(Duration.ofMinutes(10));

            assertThat(op.now()).isEqualTo(Instant.parse("2025-06-01T08:00:00.123456Z"));
        }
    }

    @Test
    void beginWithTime_usesGivenInstant() {
        var at = Instant.parse("2030-01-01T00:00:00Z");
        try (var op = db.ops().beginWithTime(at)) {
            assertThat(op.now()).isEqualTo(at);
        }
    }

    @Test
    void beginWithDbTime_readsDatabaseClock() {
        try (var op = db.ops().beginWithDbTime()) {
            assertThat(op.now()).isNotNull().isAfter(Instant.parse("2020-01-01T00:00:00Z"));
        }
    }

    @Test
    void commit_rejectsFurtherUse() {
        var op = db.ops().begin();
        op.commit();

        assertThat(op.isActive()).isFalse();
        assertThatThrownBy(op::jdbc).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(op::commit).isInstanceOf(IllegalStateException.class);
        op.close();
    }

    @Test
    void inTransaction_rollsBackOnException() {
        assertThatThrownBy(() -> db.ops().inTransaction(op -> {
            audit(op, "doomed");
            throw new IllegalStateException("boom");
        })).hasMessage("boom");

        assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isZero();
    }

    @Test
    void pool_joinsTransactionOpenOnThread() {
        try (var op = db.ops().begin()) {
            audit(op, "pending");

            assertThat(db.ops().pool().queryForObject("SELECT COUNT(*) FROM audit_log", Integer.class)).isEqualTo(1);
            assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isZero();
        }
    }

    @Test
    void begin_whileOpen_suspendsOuterUntilInnerFinishes() {
        try (var outer = db.ops().begin()) {
            audit(outer, "outer");
            try (var inner = db.ops().begin()) {
                assertThatThrownBy(outer::jdbc).isInstanceOf(IllegalStateException.class);
                audit(inner, "inner");
                inner.commit();
            }
            assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isEqualTo(1);
            audit(outer, "outer again");
            outer.rollback();
        }

        assertThat(db.ops().pool().queryForObject("SELECT message FROM audit_log", String.class)).isEqualTo("inner");
    }

    @Test
    void rollback_marksOpRolledBack() {
        var op = db.ops().begin();
        audit(op, "body");
        op.rollback();

        assertThat(op.state()).isEqualTo(DbOp.State.ROLLED_BACK);
        assertThatThrownBy(op::commit).isInstanceOf(IllegalStateException.class);
        assertThat(db.count("SELECT COUNT(*) FROM audit_log")).isZero();
    }
}
