package io.entityforge.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdempotencyGuardTest {

    private final AccountId id = AccountId.random();

    private EntityEvents<AccountId, AccountEvent> opened() {
        var events = EntityEvents.<AccountId, AccountEvent>init(id, List.of(new AccountEvent.Opened(id, "ann")));
        events.markNewEventsPersistedAt(Instant.EPOCH);
        return events;
    }

    private static boolean rename(EntityEvents<AccountId, AccountEvent> events, String owner) {
        if (events.guard()
                .ignoreIf(e -> e instanceof AccountEvent.Renamed r && r.owner().equals(owner))
                .until(e -> e instanceof AccountEvent.Renamed)
                .alreadyApplied()) {
            return false;
        }
        events.push(new AccountEvent.Renamed(owner));
        return true;
    }

    @Test
    void alreadyApplied_seesPendingDuplicates() {
        var events = opened();

        assertThat(rename(events, "bob")).isTrue();
        assertThat(rename(events, "bob")).isFalse();
        assertThat(events.len()).isEqualTo(2);
    }

    @Test
    void alreadyApplied_boundaryAllowsReapplyingOlderValue() {
        var events = opened();

        assertThat(rename(events, "alice")).isTrue();
        assertThat(rename(events, "carol")).isTrue();
        assertThat(rename(events, "alice")).isTrue();
        assertThat(events.pending()).hasSize(3);
    }

    @Test
    void alreadyApplied_withoutBoundaryScansWholeHistory() {
        var events = opened();
        events.push(new AccountEvent.Renamed("alice"));
        events.push(new AccountEvent.Renamed("carol"));

        boolean applied = events.guard()
                .ignoreIf(e -> e instanceof AccountEvent.Renamed r && r.owner().equals("alice"))
                .alreadyApplied();

        assertThat(applied).isTrue();
    }

    @Test
    void alreadyApplied_persistedKeyMatchesAcrossBoundary() {
        var events = opened();
        try (var ctx = EventContext.fork()) {
            ctx.idempotencyKey("req-1");
            assertThat(rename(events, "alice")).isTrue();
        }
        assertThat(rename(events, "carol")).isTrue();
        events.markNewEventsPersistedAt(Instant.EPOCH);

        try (var ctx = EventContext.fork()) {
            ctx.idempotencyKey("req-1");
            assertThat(rename(events, "dave")).isFalse();
        }
        try (var ctx = EventContext.fork()) {
            ctx.idempotencyKey("req-2");
            assertThat(rename(events, "dave")).isTrue();
        }
    }

    @Test
    void alreadyApplied_pendingEventsOfSameRequestDoNotMatchKey() {
        var events = opened();
        try (var ctx = EventContext.fork()) {
            ctx.idempotencyKey("req-1");

            assertThat(rename(events, "alice")).isTrue();
            assertThat(events.guard().shouldExecute()).isTrue();
            events.push(new AccountEvent.Closed());
        }

        assertThat(events.pending()).hasSize(2);
    }

    @Test
    void idempotencyKey_explicitKeyOverridesContext() {
        var events = opened();
        try (var ctx = EventContext.fork()) {
            ctx.idempotencyKey("req-9");
            events.push(new AccountEvent.Closed());
        }
        assertThat(events.guard().idempotencyKey("req-9").alreadyApplied()).isFalse();

        events.markNewEventsPersistedAt(Instant.EPOCH);

        assertThat(events.guard().idempotencyKey("req-9").alreadyApplied()).isTrue();
        assertThat(events.guard().idempotencyKey("other").shouldExecute()).isTrue();
    }

    @Test
    void idempotent_reportsOutcome() {
        Idempotent<String> done = Idempotent.executed("x");
        Idempotent<String> skipped = Idempotent.alreadyApplied();

        assertThat(done.didExecute()).isTrue();
        assertThat(done.unwrap()).isEqualTo("x");
        assertThat(skipped.wasAlreadyApplied()).isTrue();
        assertThatThrownBy(skipped::unwrap)
                .isInstanceOf(NoSuchElementException.class);
    }
}
