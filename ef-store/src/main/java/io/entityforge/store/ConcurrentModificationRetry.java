package io.entityforge.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs a load-mutate-update unit again when it lost a race with another writer.
 *
 * <pre>{@code
 * ConcurrentModificationRetry.retry(() -> {
 *     var user = users.findById(id);
 *     user.updateName(name);
 *     return users.update(user);
 * });
 * }</pre>
 *
 * The repository never retries on its own. The supplier must reload the entity on every
 * attempt, since a failed write leaves the in-memory copy stale.
 */
public final class ConcurrentModificationRetry {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentModificationRetry.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private ConcurrentModificationRetry() {
    }

    public static <T> T retry(Supplier<T> attempt) {
        return retry(DEFAULT_MAX_ATTEMPTS, attempt);
    }

    /** Retries while the failure is a {@link EsRepoException#wasConcurrentModification() concurrent modification}. */
    public static <T> T retry(int maxAttempts, Supplier<T> attempt) {
        return run(maxAttempts, attempt,
                e -> e instanceof EsRepoException repo && repo.wasConcurrentModification());
    }

    /** Retries on any runtime failure; the last one propagates. */
    public static <T> T retryOnAnyError(int maxAttempts, Supplier<T> attempt) {
        return run(maxAttempts, attempt, e -> true);
    }

    private static <T> T run(int maxAttempts, Supplier<T> attempt, Predicate<RuntimeException> retryable) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        for (int n = 1; ; n++) {
            try {
                return attempt.get();
            } catch (RuntimeException e) {
                if (n == maxAttempts || !retryable.test(e)) throw e;
                log.warn("attempt {} of {} failed, retrying: {}", n, maxAttempts, e.getMessage());
            }
        }
    }
}
