package io.entityforge.store.fixtures;

import io.entityforge.core.EntityEvents;
import io.entityforge.core.IntoEvents;

import java.util.List;

public record NewOrderItem(OrderItemId id, OrderId orderId, String sku, int quantity)
        implements IntoEvents<OrderItemId, OrderItemEvent> {

    @Override
    public EntityEvents<OrderItemId, OrderItemEvent> intoEvents() {
        return EntityEvents.init(id, List.of(new OrderItemEvent.Initialized(id, orderId, sku, quantity)));
    }
}
