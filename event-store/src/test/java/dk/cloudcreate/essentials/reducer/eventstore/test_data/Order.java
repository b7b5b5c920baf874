package dk.cloudcreate.essentials.reducer.eventstore.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;

/**
 * Immutable order aggregate
 */
public final class Order {
    public static final EventStoreId ORDERS = EventStoreId.of("ORDERS");

    public final String               orderId;
    public final String               customerId;
    public final Map<String, Integer> productAndQuantity;
    public final boolean              accepted;
    public final long                 version;

    public Order(String orderId, String customerId, Map<String, Integer> productAndQuantity, boolean accepted, long version) {
        this.orderId = orderId;
        this.customerId = customerId;
        this.productAndQuantity = Map.copyOf(productAndQuantity);
        this.accepted = accepted;
        this.version = version;
    }

    public static final Reducer<Order, OrderEvent> REDUCER = (order, event) -> {
        var payload = event.payload();
        if (payload instanceof OrderEvent.OrderAdded) {
            return new Order(event.aggregateId(), ((OrderEvent.OrderAdded) payload).customerId, Map.of(), false, event.version());
        }
        var products = new HashMap<>(order.productAndQuantity);
        if (payload instanceof OrderEvent.ProductAddedToOrder) {
            var added = (OrderEvent.ProductAddedToOrder) payload;
            products.merge(added.productId, added.quantity, Integer::sum);
            return new Order(order.orderId, order.customerId, products, order.accepted, event.version());
        }
        if (payload instanceof OrderEvent.ProductRemovedFromOrder) {
            products.remove(((OrderEvent.ProductRemovedFromOrder) payload).productId);
            return new Order(order.orderId, order.customerId, products, order.accepted, event.version());
        }
        if (payload instanceof OrderEvent.OrderAccepted) {
            return new Order(order.orderId, order.customerId, products, true, event.version());
        }
        throw new IllegalArgumentException("Unsupported event " + event.type());
    };

    public static EventStore<OrderEvent, Order> newOrderEventStore() {
        return new EventStore<OrderEvent, Order>(ORDERS, OrderEvent.EVENT_TYPES, REDUCER);
    }
}
