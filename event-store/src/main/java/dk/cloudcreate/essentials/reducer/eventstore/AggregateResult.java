package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Result of {@link EventStore#getAggregate(String, GetAggregateOptions)}.<br>
 * {@link #aggregate()} and {@link #lastEvent()} are empty when no events exist for the aggregate id
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public final class AggregateResult<PAYLOAD, AGGREGATE> {
    private final AGGREGATE                  aggregate;
    private final List<EventDetail<PAYLOAD>> events;

    public AggregateResult(Optional<AGGREGATE> aggregate, List<EventDetail<PAYLOAD>> events) {
        this.aggregate = requireNonNull(aggregate, "No aggregate option provided").orElse(null);
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    public Optional<AGGREGATE> aggregate() {
        return Optional.ofNullable(aggregate);
    }

    public List<EventDetail<PAYLOAD>> events() {
        return events;
    }

    public Optional<EventDetail<PAYLOAD>> lastEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    @Override
    public String toString() {
        return "AggregateResult{" +
                "aggregate=" + aggregate +
                ", events=" + events.size() +
                '}';
    }
}
