package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Result of {@link EventStore#getExistingAggregate(String, GetAggregateOptions)}, which always contains an aggregate and at least one event
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public final class ExistingAggregateResult<PAYLOAD, AGGREGATE> {
    private final AGGREGATE                  aggregate;
    private final List<EventDetail<PAYLOAD>> events;

    public ExistingAggregateResult(AGGREGATE aggregate, List<EventDetail<PAYLOAD>> events) {
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        if (this.events.isEmpty()) {
            throw new IllegalArgumentException("An existing aggregate requires at least one event");
        }
    }

    public AGGREGATE aggregate() {
        return aggregate;
    }

    public List<EventDetail<PAYLOAD>> events() {
        return events;
    }

    public EventDetail<PAYLOAD> lastEvent() {
        return events.get(events.size() - 1);
    }

    @Override
    public String toString() {
        return "ExistingAggregateResult{" +
                "aggregate=" + aggregate +
                ", events=" + events.size() +
                '}';
    }
}
