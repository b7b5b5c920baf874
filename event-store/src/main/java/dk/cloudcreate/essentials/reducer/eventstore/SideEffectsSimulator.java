package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.*;

/**
 * Merges an event into the keyed collection of effective events used by {@link EventStore#simulateAggregate(List, SimulationOptions)}.<br>
 * Implementations must not mutate the <code>indexedEvents</code> argument.
 *
 * @param <PAYLOAD> the event payload type
 */
@FunctionalInterface
public interface SideEffectsSimulator<PAYLOAD> {
    Map<String, EventDetail<PAYLOAD>> simulateSideEffect(Map<String, EventDetail<PAYLOAD>> indexedEvents, EventDetail<PAYLOAD> event);

    /**
     * Keys the events by {@link EventDetail#version()}, so a later event with the same version replaces the earlier one
     *
     * @param <PAYLOAD> the event payload type
     * @return the default simulator
     */
    static <PAYLOAD> SideEffectsSimulator<PAYLOAD> indexByVersion() {
        return (indexedEvents, event) -> {
            var simulatedEvents = new LinkedHashMap<>(indexedEvents);
            simulatedEvents.put(String.valueOf(event.version()), event);
            return simulatedEvents;
        };
    }
}
