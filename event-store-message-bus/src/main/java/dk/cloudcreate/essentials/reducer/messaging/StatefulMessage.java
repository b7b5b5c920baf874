package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.EventDetail;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Notifies that an event was pushed to an event store and carries the aggregate as it was right after the event
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public final class StatefulMessage<PAYLOAD, AGGREGATE> implements EventStoreMessage<PAYLOAD> {
    private final EventStoreId         eventStoreId;
    private final EventDetail<PAYLOAD> event;
    private final AGGREGATE            aggregate;

    public StatefulMessage(EventStoreId eventStoreId, EventDetail<PAYLOAD> event, AGGREGATE aggregate) {
        this.eventStoreId = requireNonNull(eventStoreId, "No eventStoreId provided");
        this.event = requireNonNull(event, "No event provided");
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
    }

    public static <PAYLOAD, AGGREGATE> StatefulMessage<PAYLOAD, AGGREGATE> of(EventStoreId eventStoreId, EventDetail<PAYLOAD> event, AGGREGATE aggregate) {
        return new StatefulMessage<>(eventStoreId, event, aggregate);
    }

    @Override
    public EventStoreId eventStoreId() {
        return eventStoreId;
    }

    @Override
    public EventDetail<PAYLOAD> event() {
        return event;
    }

    public AGGREGATE aggregate() {
        return aggregate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatefulMessage)) return false;
        var that = (StatefulMessage<?, ?>) o;
        return eventStoreId.equals(that.eventStoreId) && event.equals(that.event) && aggregate.equals(that.aggregate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventStoreId, event, aggregate);
    }

    @Override
    public String toString() {
        return "StatefulMessage{" +
                "eventStoreId=" + eventStoreId +
                ", event=" + event +
                ", aggregate=" + aggregate +
                '}';
    }
}
