package io.entityforge.store;

import io.entityforge.store.hooks.CommitHook;
import org.springframework.jdbc.core.JdbcOperations;

import java.time.Instant;

/**
 * A handle bound to one open database transaction.
 *
 * Write operations only accept this type, so a pooled {@code JdbcTemplate} cannot be
 * passed where atomicity is required.
 */
public interface AtomicOperation {

    /** Statements issued here run inside the transaction. */
    JdbcOperations jdbc();

    /** Timestamp shared by every write of this transaction. */
    Instant now();

    void addCommitHook(CommitHook hook);
}
