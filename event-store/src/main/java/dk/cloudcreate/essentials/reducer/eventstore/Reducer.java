package dk.cloudcreate.essentials.reducer.eventstore;

/**
 * Pure fold function that applies an event to the previous aggregate state.
 *
 * @param <AGGREGATE> the aggregate type
 * @param <PAYLOAD>   the event payload type
 */
@FunctionalInterface
public interface Reducer<AGGREGATE, PAYLOAD> {
    /**
     * @param previousAggregate the aggregate state before the event or <code>null</code> when the event is the first event (version 1)
     * @param event             the event to apply
     * @return the aggregate state after the event has been applied
     */
    AGGREGATE reduce(AGGREGATE previousAggregate, EventDetail<PAYLOAD> event);
}
