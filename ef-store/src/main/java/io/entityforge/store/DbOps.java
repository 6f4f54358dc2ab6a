package io.entityforge.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcTransactionManager;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/** Entry point for transactions and pooled reads over one {@link DataSource}. */
public final class DbOps {

    private final DataSource dataSource;
    private final Clock clock;
    private final JdbcTemplate pool;
    private final JdbcTransactionManager txManager;
    private final boolean dbTime;

    public DbOps(DataSource dataSource, Clock clock) {
        this(dataSource, clock, false);
    }

    /**
     * @param dbTime when true {@link #begin()} takes its time from the database instead of {@code clock}
     */
    public DbOps(DataSource dataSource, Clock clock, boolean dbTime) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.clock = Objects.requireNonNull(clock);
        this.dbTime = dbTime;
        this.txManager = new JdbcTransactionManager(dataSource);
        this.pool = new JdbcTemplate(dataSource);
        this.pool.setExceptionTranslator(txManager.getExceptionTranslator());
    }

    /** Opens a transaction whose time is read once from the clock (or the database, if so configured). */
    public DbOp begin() {
        if (dbTime) return beginWithDbTime();
        return new DbOp(txManager, jdbc -> clock.instant());
    }

    public DbOp beginWithTime(Instant now) {
        Objects.requireNonNull(now);
        return new DbOp(txManager, jdbc -> now);
    }

    /** Opens a transaction whose time is the database's {@code CURRENT_TIMESTAMP}. */
    public DbOp beginWithDbTime() {
        return new DbOp(txManager,
                jdbc -> jdbc.queryForObject("SELECT CURRENT_TIMESTAMP", Timestamp.class).toInstant());
    }

    /** Runs {@code body} in a fresh transaction and commits it when the body returns normally. */
    public <T> T inTransaction(Function<DbOp, T> body) {
        try (var op = begin()) {
            T result = body.apply(op);
            op.commit();
            return result;
        }
    }

    /**
     * Pooled access for single-statement reads. Joins the {@link DbOp} open on the calling
     * thread, if any, and runs in auto-commit mode otherwise.
     */
    public JdbcTemplate pool() {
        return pool;
    }

    public Clock clock() {
        return clock;
    }

    public JdbcTransactionManager transactionManager() {
        return txManager;
    }

    public DataSource dataSource() {
        return dataSource;
    }
}
