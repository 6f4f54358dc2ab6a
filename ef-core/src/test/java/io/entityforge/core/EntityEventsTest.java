package io.entityforge.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityEventsTest {

    private final AccountId id = AccountId.random();
    private final Instant t0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void init_keepsInitialEventsPending() {
        var events = EntityEvents.<AccountId, AccountEvent>init(id, List.of(new AccountEvent.Opened(id, "ann")));

        assertThat(events.anyNew()).isTrue();
        assertThat(events.lenPersisted()).isZero();
        assertThat(events.nextSequence()).isEqualTo(1);
        assertThat(events.all()).containsExactly(new AccountEvent.Opened(id, "ann"));
    }

    @Test
    void markNewEventsPersistedAt_assignsContiguousSequences() {
        var events = EntityEvents.<AccountId, AccountEvent>init(id, List.of(new AccountEvent.Opened(id, "ann")));
        events.markNewEventsPersistedAt(t0);

        events.push(new AccountEvent.Renamed("bob"));
        events.push(new AccountEvent.Closed());
        var marked = events.markNewEventsPersistedAt(t0.plusSeconds(5));

        assertThat(marked).extracting(PersistedEvent::sequence).containsExactly(2, 3);
        assertThat(events.anyNew()).isFalse();
        assertThat(events.lenPersisted()).isEqualTo(3);
        assertThat(events.entityFirstPersistedAt()).contains(t0);
        assertThat(events.entityLastModifiedAt()).contains(t0.plusSeconds(5));
        assertThat(events.lastPersisted(2)).extracting(PersistedEvent::event)
                .containsExactly(new AccountEvent.Renamed("bob"), new AccountEvent.Closed());
    }

    @Test
    void loadPersisted_rejectsSequenceGaps() {
        var rows = List.of(
                new PersistedEvent<AccountEvent>(new AccountEvent.Opened(id, "ann"), 1, t0, null),
                new PersistedEvent<AccountEvent>(new AccountEvent.Closed(), 3, t0, null));

        assertThatThrownBy(() -> EntityEvents.loadPersisted(id, rows))
                .isInstanceOf(EntityHydrationException.class)
                .extracting(e -> ((EntityHydrationException) e).reason())
                .isEqualTo(EntityHydrationException.Reason.SEQUENCE_GAP);
    }

    @Test
    void loadPersisted_rejectsEmptyHistory() {
        assertThatThrownBy(() -> EntityEvents.<AccountId, AccountEvent>loadPersisted(id, List.of()))
                .isInstanceOf(EntityHydrationException.class);
    }

    @Test
    void push_capturesCurrentContext() {
        var events = EntityEvents.<AccountId, AccountEvent>init(id, List.of());
        try (var ctx = EventContext.fork()) {
            ctx.insert("request_id", "r-1");
            events.push(new AccountEvent.Renamed("bob"));
        }
        events.push(new AccountEvent.Closed());

        assertThat(events.pending().get(0).context().get("request_id")).contains("r-1");
        assertThat(events.pending().get(1).context().isEmpty()).isTrue();
    }

    @Test
    void fold_visitsEventsOldestFirst() {
        var events = EntityEvents.<AccountId, AccountEvent>init(id, List.of(new AccountEvent.Opened(id, "ann")));
        events.markNewEventsPersistedAt(t0);
        events.push(new AccountEvent.Renamed("bob"));

        String owner = events.fold(null, (acc, e) -> {
            if (e instanceof AccountEvent.Opened o) return o.owner();
            if (e instanceof AccountEvent.Renamed r) return r.owner();
            return acc;
        });

        assertThat(owner).isEqualTo("bob");
    }
}
