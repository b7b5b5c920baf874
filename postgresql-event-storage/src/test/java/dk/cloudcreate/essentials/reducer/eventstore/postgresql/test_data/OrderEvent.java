package dk.cloudcreate.essentials.reducer.eventstore.postgresql.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.time.*;
import java.util.*;

public class OrderEvent {
    public static final EventStoreId ORDERS                 = EventStoreId.of("ORDERS");
    public static final String       ORDER_ADDED            = "ORDER_ADDED";
    public static final String       PRODUCT_ADDED_TO_ORDER = "PRODUCT_ADDED_TO_ORDER";

    public static final List<EventType<? extends OrderEvent>> EVENT_TYPES = List.of(EventType.of(ORDER_ADDED, OrderAdded.class),
                                                                                   EventType.of(PRODUCT_ADDED_TO_ORDER, ProductAddedToOrder.class));

    public static class OrderAdded extends OrderEvent {
        public String customerId;
        public long   orderNumber;

        public OrderAdded() {
        }

        public OrderAdded(String customerId, long orderNumber) {
            this.customerId = customerId;
            this.orderNumber = orderNumber;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OrderAdded)) return false;
            var that = (OrderAdded) o;
            return orderNumber == that.orderNumber && Objects.equals(customerId, that.customerId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(customerId, orderNumber);
        }
    }

    public static class ProductAddedToOrder extends OrderEvent {
        public String productId;
        public int    quantity;

        public ProductAddedToOrder() {
        }

        public ProductAddedToOrder(String productId, int quantity) {
            this.productId = productId;
            this.quantity = quantity;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ProductAddedToOrder)) return false;
            var that = (ProductAddedToOrder) o;
            return quantity == that.quantity && Objects.equals(productId, that.productId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(productId, quantity);
        }
    }

    /**
     * Total quantity ordered, per order
     */
    public static final Reducer<Integer, OrderEvent> REDUCER = (quantity, event) -> event.payload() instanceof ProductAddedToOrder
                                                                                     ? quantity + ((ProductAddedToOrder) event.payload()).quantity
                                                                                     : 0;

    public static EventStore<OrderEvent, Integer> newOrderEventStore(EventStoreId eventStoreId) {
        return new EventStore<OrderEvent, Integer>(eventStoreId, EVENT_TYPES, REDUCER);
    }

    public static EventDetail<OrderEvent> orderAdded(String orderId, OffsetDateTime timestamp) {
        return EventDetail.of(orderId, 1, ORDER_ADDED, timestamp, new OrderAdded("customer-" + orderId, 1234));
    }

    public static EventDetail<OrderEvent> orderAdded(String orderId) {
        return orderAdded(orderId, OffsetDateTime.now(Clock.systemUTC()));
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
