package io.entityforge.store.hooks;

/**
 * Work tied to the commit of a {@link io.entityforge.store.DbOp}.
 *
 * <ul>
 *   <li>{@link #preCommit} runs inside the transaction, right before it commits. Throwing
 *       rolls the transaction back.</li>
 *   <li>{@link #postCommit} runs after a successful commit. Failures are logged and ignored.</li>
 *   <li>{@link #merge} lets a newly added hook fold into a pending one of the same type.</li>
 * </ul>
 */
public interface CommitHook {

    default void preCommit(HookOperation op) {
    }

    default void postCommit() {
    }

    /**
     * Absorb {@code other}, a hook of the same class registered after this one.
     *
     * <pre>{@code
     * public boolean merge(CommitHook other) {
     *     if (!(other instanceof OutboxHook o)) return false;
     *     messages.addAll(o.messages);
     *     return true;
     * }
     * }</pre>
     *
     * @return true when {@code other} has been merged and must not run on its own
     */
    default boolean merge(CommitHook other) {
        return false;
    }
}
