package dk.cloudcreate.essentials.reducer.eventstore.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.storage.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Minimal storage adapter that records the calls made to it and can be told to fail the next grouped push
 */
public class TestEventStorageAdapter implements EventStorageAdapter {
    private final Map<String, TreeMap<Long, EventDetail<?>>> events = new HashMap<>();
    public final  List<PushEventContext>                     pushEventContexts = new ArrayList<>();
    public final  List<List<GroupedEvent<?, ?>>>             pushedGroups      = new ArrayList<>();
    public final  List<EventsQueryOptions>                   queries           = new ArrayList<>();
    private       RuntimeException                           nextGroupPushFailure;
    private volatile boolean                                 transactionActive;

    /**
     * Simulate that the calling thread has an uncommitted transaction
     */
    public void setTransactionActive(boolean transactionActive) {
        this.transactionActive = transactionActive;
    }

    @Override
    public boolean isTransactionActiveOnCurrentThread() {
        return transactionActive;
    }

    public synchronized void failNextGroupPush(RuntimeException failure) {
        nextGroupPushFailure = failure;
    }

    @Override
    public synchronized <PAYLOAD> EventDetail<PAYLOAD> pushEvent(EventDetail<PAYLOAD> event, PushEventContext context) {
        pushEventContexts.add(context);
        var stream = events.computeIfAbsent(key(context.eventStoreId(), event.aggregateId()), k -> new TreeMap<>());
        if (stream.containsKey(event.version()) && !context.force()) {
            throw new EventAlreadyExistsException(context.eventStoreId(), event.aggregateId(), event.version());
        }
        stream.put(event.version(), event);
        return event;
    }

    @Override
    public synchronized List<EventDetail<?>> pushEventGroup(List<GroupedEvent<?, ?>> groupedEvents) {
        pushedGroups.add(groupedEvents);
        if (nextGroupPushFailure != null) {
            var failure = nextGroupPushFailure;
            nextGroupPushFailure = null;
            throw failure;
        }
        for (var groupedEvent : groupedEvents) {
            var stream = events.get(key(groupedEvent.eventStoreId(), groupedEvent.event().aggregateId()));
            if (stream != null && stream.containsKey(groupedEvent.event().version())) {
                throw new EventAlreadyExistsException(groupedEvent.eventStoreId(), groupedEvent.event().aggregateId(), groupedEvent.event().version());
            }
        }
        groupedEvents.forEach(groupedEvent -> events.computeIfAbsent(key(groupedEvent.eventStoreId(), groupedEvent.event().aggregateId()), k -> new TreeMap<>())
                                                    .put(groupedEvent.event().version(), groupedEvent.event()));
        return groupedEvents.stream().map(GroupedEvent::event).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized <PAYLOAD> List<EventDetail<PAYLOAD>> getEvents(String aggregateId, EventStoreId eventStoreId, EventsQueryOptions options) {
        queries.add(options);
        var stream = events.getOrDefault(key(eventStoreId, aggregateId), new TreeMap<>());
        return stream.values()
                     .stream()
                     .filter(event -> options.includesVersion(event.version()))
                     .map(event -> (EventDetail<PAYLOAD>) event)
                     .collect(Collectors.toList());
    }

    @Override
    public synchronized ListAggregateIdsResult listAggregateIds(EventStoreId eventStoreId, ListAggregateIdsOptions options) {
        var prefix = eventStoreId + "#";
        var aggregateIds = events.entrySet()
                                 .stream()
                                 .filter(entry -> entry.getKey().startsWith(prefix) && !entry.getValue().isEmpty())
                                 .map(entry -> new ListAggregateIdsResult.ListedAggregateId(entry.getKey().substring(prefix.length()),
                                                                                            entry.getValue().firstEntry().getValue().timestamp()))
                                 .collect(Collectors.toList());
        return new ListAggregateIdsResult(aggregateIds, Optional.empty());
    }

    private static String key(EventStoreId eventStoreId, String aggregateId) {
        return eventStoreId + "#" + aggregateId;
    }
}
