package io.entityforge.store.fixtures;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.entityforge.store.Column;
import io.entityforge.store.DbOps;
import io.entityforge.store.EntitySchema;
import io.entityforge.store.EsRepository;
import io.entityforge.store.NestedCollection;

import java.util.List;

public final class OrderRepository extends EsRepository<OrderId, OrderEvent, Order, NewOrder> {

    public static final EntitySchema<OrderId, OrderEvent, Order, NewOrder> SCHEMA =
            EntitySchema.<OrderId, OrderEvent, Order, NewOrder>builder("orders", OrderEvent.class, OrderId::new, Order::hydrate)
                    .column(Column.of("customer", String.class, Order::customer)
                            .onCreate(NewOrder::customer)
                            .immutable().listFor())
                    .column(Column.of("item_count", Integer.class, Order::itemCount)
                            .onCreate(NewOrder::itemCount))
                    .build();

    public OrderRepository(DbOps ops, ObjectMapper json, OrderItemRepository items) {
        super(ops, json, SCHEMA);
        nest(new NestedCollection<>("items", Order::items, items));
    }

    public List<Order> findWithAtLeastItems(int count) {
        return query("item_count >= ?", count);
    }
}
