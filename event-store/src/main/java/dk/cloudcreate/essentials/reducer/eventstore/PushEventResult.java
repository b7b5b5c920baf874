package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The stored event and, when it could be computed, the aggregate after the event was applied
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public final class PushEventResult<PAYLOAD, AGGREGATE> {
    private final EventDetail<PAYLOAD> event;
    private final AGGREGATE            nextAggregate;

    public PushEventResult(EventDetail<PAYLOAD> event, Optional<AGGREGATE> nextAggregate) {
        this.event = requireNonNull(event, "No event provided");
        this.nextAggregate = requireNonNull(nextAggregate, "No nextAggregate option provided").orElse(null);
    }

    public EventDetail<PAYLOAD> event() {
        return event;
    }

    /**
     * @return the aggregate after the event was applied. Empty if the push neither supplied a previous aggregate nor stored the first event of the aggregate
     */
    public Optional<AGGREGATE> nextAggregate() {
        return Optional.ofNullable(nextAggregate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PushEventResult)) return false;
        var that = (PushEventResult<?, ?>) o;
        return event.equals(that.event) && Objects.equals(nextAggregate, that.nextAggregate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, nextAggregate);
    }

    @Override
    public String toString() {
        return "PushEventResult{" +
                "event=" + event +
                ", nextAggregate=" + nextAggregate +
                '}';
    }
}
