package io.entityforge.store.hooks;

import io.entityforge.store.AtomicOperation;
import org.springframework.jdbc.core.JdbcOperations;

import java.time.Instant;

/** Transaction access handed to {@link CommitHook#preCommit}. */
public final class HookOperation implements AtomicOperation {

    private final JdbcOperations jdbc;
    private final Instant now;

    HookOperation(JdbcOperations jdbc, Instant now) {
        this.jdbc = jdbc;
        this.now = now;
    }

    @Override
    public JdbcOperations jdbc() {
        return jdbc;
    }

    @Override
    public Instant now() {
        return now;
    }

    /** @throws IllegalStateException always, the hook phase is already running */
    @Override
    public void addCommitHook(CommitHook hook) {
        throw new IllegalStateException("commit hooks cannot be added during pre-commit: " + hook.getClass().getName());
    }
}
