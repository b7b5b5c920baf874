package dk.cloudcreate.essentials.reducer.eventstore.inmemory.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.time.OffsetDateTime;
import java.util.List;

public class OrderEvent {
    public static final EventStoreId ORDERS                 = EventStoreId.of("ORDERS");
    public static final String       ORDER_ADDED            = "ORDER_ADDED";
    public static final String       PRODUCT_ADDED_TO_ORDER = "PRODUCT_ADDED_TO_ORDER";

    public static class OrderAdded extends OrderEvent {
        public final String customerId;

        public OrderAdded(String customerId) {
            this.customerId = customerId;
        }
    }

    public static class ProductAddedToOrder extends OrderEvent {
        public final String productId;
        public final int    quantity;

        public ProductAddedToOrder(String productId, int quantity) {
            this.productId = productId;
            this.quantity = quantity;
        }
    }

    /**
     * Number of products ordered, per order
     */
    public static EventStore<OrderEvent, Integer> newOrderEventStore(EventStoreId eventStoreId) {
        return new EventStore<OrderEvent, Integer>(eventStoreId,
                                                   List.of(EventType.of(ORDER_ADDED, OrderAdded.class),
                                                           EventType.of(PRODUCT_ADDED_TO_ORDER, ProductAddedToOrder.class)),
                                                   (quantity, event) -> event.payload() instanceof ProductAddedToOrder
                                                                        ? quantity + ((ProductAddedToOrder) event.payload()).quantity
                                                                        : 0);
    }

    public static EventDetail<OrderEvent> orderAdded(String orderId, OffsetDateTime timestamp) {
        return EventDetail.of(orderId, 1, ORDER_ADDED, timestamp, new OrderAdded("customer-" + orderId));
    }

    public static EventDetail<OrderEvent> productAdded(String orderId, long version, int quantity) {
        return EventDetail.<OrderEvent>builder()
                          .aggregateId(orderId)
                          .version(version)
                          .type(PRODUCT_ADDED_TO_ORDER)
                          .payload(new ProductAddedToOrder("product-" + version, quantity))
                          .build();
    }
}
