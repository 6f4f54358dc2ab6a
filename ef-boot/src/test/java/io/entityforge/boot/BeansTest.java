package io.entityforge.boot;

import io.entityforge.core.ArtificialClock;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BeansTest {

    private final Beans beans = new Beans();

    @Test
    void clock_realtimeByDefault() {
        var clock = beans.clock(new EntityForgeProperties());

        assertThat(clock).isEqualTo(Clock.systemUTC());
    }

    @Test
    void clock_artificialStartsAtConfiguredInstant() {
        var props = new EntityForgeProperties();
        props.getClock().setMode(EntityForgeProperties.ClockMode.ARTIFICIAL);
        props.getClock().setStart(Instant.parse("2024-02-29T12:00:00Z"));

        var clock = beans.clock(props);

        assertThat(clock).isInstanceOf(ArtificialClock.class);
        assertThat(clock.instant()).isEqualTo(Instant.parse("2024-02-29T12:00:00Z"));
    }

    @Test
    void dbOps_usesGivenClock() {
        var clock = new ArtificialClock(Instant.EPOCH);

        var ops = beans.dbOps(mock(DataSource.class), clock, new EntityForgeProperties());

        assertThat(ops.clock()).isSameAs(clock);
    }
}
