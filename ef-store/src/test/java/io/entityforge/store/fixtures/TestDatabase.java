package io.entityforge.store.fixtures;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.entityforge.core.ArtificialClock;
import io.entityforge.store.DbOps;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/** Fresh in-memory H2 database per instance, with the fixture tables. */
public final class TestDatabase implements AutoCloseable {

    public static final Instant START = Instant.parse("2025-06-01T08:00:00.123456Z");

    private final EmbeddedDatabase db;
    private final ArtificialClock clock = new ArtificialClock(START);
    private final ObjectMapper json = new ObjectMapper();
    private final DbOps ops;
    private final TransactionTemplate outside;

    public TestDatabase() {
        this.db = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        this.ops = new DbOps(db, clock);
        this.outside = new TransactionTemplate(ops.transactionManager());
        this.outside.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public DbOps ops() {
        return ops;
    }

    public ArtificialClock clock() {
        return clock;
    }

    public ObjectMapper json() {
        return json;
    }

    public UserRepository users() {
        return new UserRepository(ops, json);
    }

    public OrderRepository orders() {
        return new OrderRepository(ops, json, new OrderItemRepository(ops, json));
    }

    public CustomerRepository customers() {
        return new CustomerRepository(ops, json);
    }

    /** Counts committed rows only, outside any transaction open on this thread. */
    public int count(String sql, Object... args) {
        return outside.execute(status -> ops.pool().queryForObject(sql, Integer.class, args));
    }

    @Override
    public void close() {
        db.shutdown();
    }
}
