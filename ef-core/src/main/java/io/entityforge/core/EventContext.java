package io.entityforge.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-thread stack of {@link ContextData} that gets attached to events when they are pushed.
 *
 * <pre>{@code
 * try (var ctx = EventContext.fork()) {
 *     ctx.insert("request_id", requestId);
 *     user.updateName("Bob");     // pending event carries request_id
 * }
 * }</pre>
 *
 * Frames are thread-confined. To carry the caller's data into another thread use
 * {@link #wrap(Runnable)} or {@link #seed(ContextData)} with {@link #current()}.
 */
public final class EventContext implements AutoCloseable {

    private static final ThreadLocal<Deque<EventContext>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private final Thread owner;
    private ContextData data;
    private boolean closed;

    private EventContext(ContextData data) {
        this.owner = Thread.currentThread();
        this.data = data;
    }

    /** Data of the innermost open frame on this thread, or empty. */
    public static ContextData current() {
        var top = STACK.get().peek();
        return top == null ? ContextData.empty() : top.data;
    }

    /** Opens a child frame that starts with a copy of the current data. */
    public static EventContext fork() {
        return push(current());
    }

    /** Opens a frame holding exactly {@code data}, typically captured on another thread. */
    public static EventContext seed(ContextData data) {
        return push(Objects.requireNonNull(data));
    }

    public static Runnable wrap(Runnable body) {
        var captured = current();
        return () -> {
            try (var ignored = seed(captured)) {
                body.run();
            }
        };
    }

    public static <T> Supplier<T> wrap(Supplier<T> body) {
        var captured = current();
        return () -> {
            try (var ignored = seed(captured)) {
                return body.get();
            }
        };
    }

    private static EventContext push(ContextData data) {
        var ctx = new EventContext(data);
        STACK.get().push(ctx);
        return ctx;
    }

    public EventContext insert(String key, Object value) {
        checkUsable();
        data = data.with(key, value);
        return this;
    }

    public EventContext idempotencyKey(String key) {
        return insert(ContextData.IDEMPOTENCY_KEY, key);
    }

    public ContextData data() {
        return data;
    }

    @Override
    public void close() {
        if (closed) return;
        checkUsable();
        closed = true;
        var stack = STACK.get();
        for (Iterator<EventContext> it = stack.iterator(); it.hasNext(); ) {
            if (it.next() == this) {
                it.remove();
                break;
            }
        }
        if (stack.isEmpty()) STACK.remove();
    }

    private void checkUsable() {
        if (closed) throw new IllegalStateException("event context already closed");
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("event context used outside of its owning thread");
        }
    }
}
