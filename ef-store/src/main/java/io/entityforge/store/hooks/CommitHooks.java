package io.entityforge.store.hooks;

import io.entityforge.store.AtomicOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Pending hooks of one transaction, in registration order. */
public final class CommitHooks {
    private static final Logger log = LoggerFactory.getLogger(CommitHooks.class);

    private final List<CommitHook> hooks = new ArrayList<>();

    /** Registers {@code hook}, or merges it into the latest pending hook of the same class. */
    public void add(CommitHook hook) {
        Objects.requireNonNull(hook);
        for (int i = hooks.size() - 1; i >= 0; i--) {
            var pending = hooks.get(i);
            if (pending.getClass() == hook.getClass()) {
                if (pending.merge(hook)) {
                    log.debug("merged commit hook {}", hook.getClass().getSimpleName());
                    return;
                }
                break;
            }
        }
        hooks.add(hook);
    }

    public int size() {
        return hooks.size();
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }

    /** Runs every pre-commit phase against {@code op}; the first failure propagates. */
    public void executePreCommit(AtomicOperation op) {
        var hookOp = new HookOperation(op.jdbc(), op.now());
        for (var hook : hooks) {
            hook.preCommit(hookOp);
        }
    }

    /** Runs every post-commit phase; failures are logged and do not stop the rest. */
    public void executePostCommit() {
        for (var hook : hooks) {
            try {
                hook.postCommit();
            } catch (RuntimeException e) {
                log.warn("post-commit hook {} failed", hook.getClass().getName(), e);
            }
        }
        hooks.clear();
    }

    public void clear() {
        hooks.clear();
    }
}
