package io.entityforge.boot;

import io.entityforge.core.ArtificialClock;
import io.entityforge.store.DbOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;

@Configuration
public class Beans {
    private static final Logger log = LoggerFactory.getLogger(Beans.class);

    @Bean
    Clock clock(EntityForgeProperties props) {
        var clock = props.getClock();
        return switch (clock.getMode()) {
            case REALTIME -> Clock.systemUTC();
            case ARTIFICIAL -> {
                var start = clock.getStart() != null ? clock.getStart() : Instant.now();
                log.info("using artificial clock starting at {}", start);
                yield new ArtificialClock(start);
            }
        };
    }

    @Bean
    DbOps dbOps(DataSource dataSource, Clock clock, EntityForgeProperties props) {
        return new DbOps(dataSource, clock, props.isDbTime());
    }
}
