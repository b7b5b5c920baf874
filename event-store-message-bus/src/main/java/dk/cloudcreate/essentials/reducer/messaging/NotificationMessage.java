package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.EventDetail;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Notifies that an event was pushed to an event store
 *
 * @param <PAYLOAD> the event payload type
 */
public final class NotificationMessage<PAYLOAD> implements EventStoreMessage<PAYLOAD> {
    private final EventStoreId         eventStoreId;
    private final EventDetail<PAYLOAD> event;

    public NotificationMessage(EventStoreId eventStoreId, EventDetail<PAYLOAD> event) {
        this.eventStoreId = requireNonNull(eventStoreId, "No eventStoreId provided");
        this.event = requireNonNull(event, "No event provided");
    }

    public static <PAYLOAD> NotificationMessage<PAYLOAD> of(EventStoreId eventStoreId, EventDetail<PAYLOAD> event) {
        return new NotificationMessage<>(eventStoreId, event);
    }

    @Override
    public EventStoreId eventStoreId() {
        return eventStoreId;
    }

    @Override
    public EventDetail<PAYLOAD> event() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotificationMessage)) return false;
        var that = (NotificationMessage<?>) o;
        return eventStoreId.equals(that.eventStoreId) && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventStoreId, event);
    }

    @Override
    public String toString() {
        return "NotificationMessage{" +
                "eventStoreId=" + eventStoreId +
                ", event=" + event +
                '}';
    }
}
