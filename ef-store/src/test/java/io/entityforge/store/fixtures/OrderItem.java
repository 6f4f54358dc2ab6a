package io.entityforge.store.fixtures;

import io.entityforge.core.EntityEvents;
import io.entityforge.core.EsEntity;
import io.entityforge.core.Hydration;
import io.entityforge.core.Idempotent;

public final class OrderItem implements EsEntity<OrderItemId, OrderItemEvent> {

    private final EntityEvents<OrderItemId, OrderItemEvent> events;
    private OrderId orderId;
    private String sku;
    private Integer quantity;

    private OrderItem(EntityEvents<OrderItemId, OrderItemEvent> events) {
        this.events = events;
    }

    public static OrderItem hydrate(EntityEvents<OrderItemId, OrderItemEvent> events) {
        Hydration.requireNotEmpty(events);
        var item = new OrderItem(events);
        for (var event : events.all()) {
            if (event instanceof OrderItemEvent.Initialized e) {
                item.orderId = e.orderId();
                item.sku = e.sku();
                item.quantity = e.quantity();
            } else if (event instanceof OrderItemEvent.QuantityChanged e) {
                item.quantity = e.quantity();
            }
        }
        Hydration.require(item.orderId, "orderId");
        return item;
    }

    public Idempotent<Void> changeQuantity(int newQuantity) {
        if (quantity == newQuantity) return Idempotent.alreadyApplied();
        events.push(new OrderItemEvent.QuantityChanged(newQuantity));
        quantity = newQuantity;
        return Idempotent.executed();
    }

    public OrderId orderId() {
        return orderId;
    }

    public String sku() {
        return sku;
    }

    public Integer quantity() {
        return quantity;
    }

    @Override
    public EntityEvents<OrderItemId, OrderItemEvent> events() {
        return events;
    }
}
