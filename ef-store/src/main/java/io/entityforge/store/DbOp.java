package io.entityforge.store;

import io.entityforge.store.hooks.CommitHook;
import io.entityforge.store.hooks.CommitHooks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Function;

/**
 * One database transaction, started through the {@link DbOps} transaction manager.
 *
 * <pre>{@code
 * try (var op = dbOps.begin()) {
 *     users.updateInOp(op, user);
 *     orders.createInOp(op, newOrder);
 *     op.commit();
 * }
 * }</pre>
 *
 * Closing without {@link #commit()} rolls back. The transaction is bound to the thread
 * that began it; a {@code DbOp} begun while another is open suspends the outer one until
 * it finishes. Not thread-safe.
 */
public final class DbOp implements AtomicOperation, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DbOp.class);

    private static final TransactionDefinition NEW_TRANSACTION =
            new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

    enum State { ACTIVE, COMMITTED, ROLLED_BACK }

    private final JdbcTransactionManager txManager;
    private final TransactionStatus status;
    private final Object boundResource;
    private final JdbcTemplate jdbc;
    private final CommitHooks hooks = new CommitHooks();
    private final Instant now;
    private State state = State.ACTIVE;

    DbOp(JdbcTransactionManager txManager, Function<JdbcOperations, Instant> timeSource) {
        this.txManager = txManager;
        this.status = txManager.getTransaction(NEW_TRANSACTION);
        this.boundResource = TransactionSynchronizationManager.getResource(txManager.getDataSource());
        TransactionSynchronizationManager.registerSynchronization(new HookSynchronization());
        this.jdbc = new JdbcTemplate(txManager.getDataSource());
        this.jdbc.setExceptionTranslator(txManager.getExceptionTranslator());
        try {
            this.now = Objects.requireNonNull(timeSource.apply(jdbc), "transaction time").truncatedTo(ChronoUnit.MICROS);
        } catch (RuntimeException e) {
            txManager.rollback(status);
            throw e;
        }
    }

    @Override
    public JdbcOperations jdbc() {
        checkActive();
        if (TransactionSynchronizationManager.getResource(txManager.getDataSource()) != boundResource) {
            throw new IllegalStateException("DbOp is suspended or used outside the thread that began it");
        }
        return jdbc;
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public void addCommitHook(CommitHook hook) {
        checkActive();
        hooks.add(hook);
    }

    public int pendingHooks() {
        return hooks.size();
    }

    State state() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    /**
     * Runs pre-commit hooks, commits, then runs post-commit hooks.
     * Any failure before the commit itself rolls the transaction back and propagates.
     */
    public void commit() {
        checkActive();
        try {
            txManager.commit(status);
        } catch (RuntimeException e) {
            log.warn("transaction rolled back after failure: {}", e.getMessage());
            throw e;
        }
    }

    public void rollback() {
        checkActive();
        txManager.rollback(status);
    }

    @Override
    public void close() {
        if (state == State.ACTIVE && !status.isCompleted()) {
            log.debug("rolling back uncommitted transaction");
            txManager.rollback(status);
        }
    }

    private void checkActive() {
        if (state != State.ACTIVE) throw new IllegalStateException("DbOp is " + state);
    }

    /** Ties the commit hooks to the phases of the underlying transaction. */
    private final class HookSynchronization implements TransactionSynchronization {

        @Override
        public void beforeCommit(boolean readOnly) {
            hooks.executePreCommit(DbOp.this);
        }

        @Override
        public void afterCommit() {
            state = State.COMMITTED;
            hooks.executePostCommit();
        }

        @Override
        public void afterCompletion(int completionStatus) {
            if (completionStatus != STATUS_COMMITTED) {
                state = State.ROLLED_BACK;
                hooks.clear();
            }
        }
    }
}
