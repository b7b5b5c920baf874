package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Result of {@link EventStore#pushEventGroup(List)}: one {@link PushEventResult} per {@link GroupedEvent},
 * in the order the grouped events were provided
 */
public final class PushEventGroupResult {
    private final List<PushEventResult<?, ?>> eventGroup;

    public PushEventGroupResult(List<PushEventResult<?, ?>> eventGroup) {
        this.eventGroup = List.copyOf(requireNonNull(eventGroup, "No eventGroup provided"));
    }

    public List<PushEventResult<?, ?>> eventGroup() {
        return eventGroup;
    }

    public int size() {
        return eventGroup.size();
    }

    /**
     * Typed access to the result for the grouped event at <code>index</code>
     */
    @SuppressWarnings("unchecked")
    public <PAYLOAD, AGGREGATE> PushEventResult<PAYLOAD, AGGREGATE> get(int index) {
        return (PushEventResult<PAYLOAD, AGGREGATE>) eventGroup.get(index);
    }

    @Override
    public String toString() {
        return "PushEventGroupResult{eventGroup=" + eventGroup + '}';
    }
}
