package dk.cloudcreate.essentials.reducer.eventstore.inmemory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.storage.*;
import dk.cloudcreate.essentials.reducer.eventstore.storage.ListAggregateIdsResult.ListedAggregateId;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import org.slf4j.*;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventStorageAdapter} that keeps all events in memory. Intended for tests and for applications that don't need durability.<br>
 * All reads and writes are serialized using a lock per adapter instance.<br>
 * {@link #pushEventGroup(List)} supports groups spanning several {@link InMemoryEventStorageAdapter} instances: the locks of all involved
 * adapters are acquired (in a fixed order) and every event is validated before any event is written.
 */
public class InMemoryEventStorageAdapter implements EventStorageAdapter {
    private static final Logger     log               = LoggerFactory.getLogger(InMemoryEventStorageAdapter.class);
    private static final AtomicLong lockOrderSequence = new AtomicLong();

    private final long          lockOrder = lockOrderSequence.incrementAndGet();
    private final ReentrantLock lock      = new ReentrantLock();
    private final ObjectMapper  objectMapper;
    /**
     * Key: {@link EventStoreId}<br>
     * Value: the events of each aggregate, keyed by aggregate id and sorted by version
     */
    private final Map<EventStoreId, Map<String, TreeMap<Long, EventDetail<?>>>> events = new HashMap<>();

    public InMemoryEventStorageAdapter() {
        this(new ObjectMapper());
    }

    /**
     * @param objectMapper the {@link ObjectMapper} used to write and read the <code>listAggregateIds</code> page tokens
     */
    public InMemoryEventStorageAdapter(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create an adapter that initially contains the provided events
     *
     * @param initialEvents key: the event store id, value: the events of that event store
     */
    public InMemoryEventStorageAdapter(Map<EventStoreId, List<EventDetail<?>>> initialEvents) {
        this();
        requireNonNull(initialEvents, "No initialEvents provided");
        initialEvents.forEach((eventStoreId, eventsToAdd) -> eventsToAdd.forEach(event -> {
            var aggregateEvents = aggregateEvents(eventStoreId, event.aggregateId());
            if (aggregateEvents.containsKey(event.version())) {
                throw new EventAlreadyExistsException(eventStoreId, event.aggregateId(), event.version());
            }
            aggregateEvents.put(event.version(), event);
        }));
        log.debug("Initialized with {} event(s)", initialEvents.values().stream().mapToInt(List::size).sum());
    }

    @Override
    public <PAYLOAD> EventDetail<PAYLOAD> pushEvent(EventDetail<PAYLOAD> event, PushEventContext context) {
        requireNonNull(event, "No event provided");
        requireNonNull(context, "No context provided");
        lock.lock();
        try {
            var aggregateEvents = aggregateEvents(context.eventStoreId(), event.aggregateId());
            if (!context.force() && aggregateEvents.containsKey(event.version())) {
                throw new EventAlreadyExistsException(context.eventStoreId(), event.aggregateId(), event.version());
            }
            aggregateEvents.put(event.version(), event);
            log.trace("[{}] Stored event '{}' version {} for aggregate '{}'", context.eventStoreId(), event.type(), event.version(), event.aggregateId());
            return event;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<EventDetail<?>> pushEventGroup(List<GroupedEvent<?, ?>> groupedEvents) {
        requireNonNull(groupedEvents, "No groupedEvents provided");
        var adapters = new TreeMap<Long, InMemoryEventStorageAdapter>();
        for (var groupedEvent : groupedEvents) {
            var adapter = groupedEvent.eventStorageAdapter();
            if (!(adapter instanceof InMemoryEventStorageAdapter)) {
                throw new EventStoreException(msg("Cannot push an event group containing event store '{}' using storage adapter '{}' together with an {}",
                                                  groupedEvent.eventStoreId(),
                                                  adapter.getClass().getName(),
                                                  InMemoryEventStorageAdapter.class.getSimpleName()));
            }
            var inMemoryAdapter = (InMemoryEventStorageAdapter) adapter;
            adapters.put(inMemoryAdapter.lockOrder, inMemoryAdapter);
        }

        var lockedAdapters = new ArrayList<InMemoryEventStorageAdapter>(adapters.size());
        try {
            for (var adapter : adapters.values()) {
                adapter.lock.lock();
                lockedAdapters.add(adapter);
            }
            var keysInGroup = new HashSet<String>();
            for (var groupedEvent : groupedEvents) {
                var event   = groupedEvent.event();
                var adapter = (InMemoryEventStorageAdapter) groupedEvent.eventStorageAdapter();
                var key     = groupedEvent.eventStoreId() + "#" + event.aggregateId() + "#" + event.version();
                if (!keysInGroup.add(key) || adapter.containsEvent(groupedEvent.eventStoreId(), event.aggregateId(), event.version())) {
                    throw new EventAlreadyExistsException(groupedEvent.eventStoreId(), event.aggregateId(), event.version());
                }
            }
            var storedEvents = new ArrayList<EventDetail<?>>(groupedEvents.size());
            for (var groupedEvent : groupedEvents) {
                var event   = groupedEvent.event();
                var adapter = (InMemoryEventStorageAdapter) groupedEvent.eventStorageAdapter();
                adapter.aggregateEvents(groupedEvent.eventStoreId(), event.aggregateId()).put(event.version(), event);
                storedEvents.add(event);
            }
            log.debug("Stored event group with {} event(s) across {} adapter(s)", storedEvents.size(), adapters.size());
            return storedEvents;
        } finally {
            for (var index = lockedAdapters.size() - 1; index >= 0; index--) {
                lockedAdapters.get(index).lock.unlock();
            }
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <PAYLOAD> List<EventDetail<PAYLOAD>> getEvents(String aggregateId, EventStoreId eventStoreId, EventsQueryOptions options) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(eventStoreId, "No eventStoreId provided");
        requireNonNull(options, "No options provided");
        List<EventDetail<PAYLOAD>> matchingEvents;
        lock.lock();
        try {
            var aggregates = events.get(eventStoreId);
            var aggregateEvents = aggregates != null ? aggregates.get(aggregateId) : null;
            if (aggregateEvents == null) {
                return List.of();
            }
            matchingEvents = aggregateEvents.values()
                                            .stream()
                                            .filter(event -> options.includesVersion(event.version()))
                                            .map(event -> (EventDetail<PAYLOAD>) event)
                                            .collect(Collectors.toCollection(ArrayList::new));
        } finally {
            lock.unlock();
        }
        if (options.reverse()) {
            Collections.reverse(matchingEvents);
        }
        var limit = options.limit().orElse(Integer.MAX_VALUE);
        return List.copyOf(limit < matchingEvents.size() ? matchingEvents.subList(0, limit) : matchingEvents);
    }

    @Override
    public ListAggregateIdsResult listAggregateIds(EventStoreId eventStoreId, ListAggregateIdsOptions options) {
        requireNonNull(eventStoreId, "No eventStoreId provided");
        requireNonNull(options, "No options provided");
        var pageToken = options.pageToken()
                               .map(this::readPageToken)
                               .orElseGet(() -> PageToken.from(options));

        List<ListedAggregateId> aggregateIds;
        lock.lock();
        try {
            aggregateIds = events.getOrDefault(eventStoreId, Map.of())
                                 .entrySet()
                                 .stream()
                                 .filter(entry -> entry.getValue().containsKey(EventDetail.FIRST_VERSION))
                                 .map(entry -> new ListedAggregateId(entry.getKey(), entry.getValue().get(EventDetail.FIRST_VERSION).timestamp()))
                                 .collect(Collectors.toCollection(ArrayList::new));
        } finally {
            lock.unlock();
        }

        var initialEventAfter  = pageToken.initialEventAfter();
        var initialEventBefore = pageToken.initialEventBefore();
        var sortedAggregateIds = aggregateIds.stream()
                                             .filter(aggregateId -> initialEventAfter.map(after -> aggregateId.initialEventTimestamp().isAfter(after)).orElse(true))
                                             .filter(aggregateId -> initialEventBefore.map(before -> aggregateId.initialEventTimestamp().isBefore(before)).orElse(true))
                                             .sorted(Comparator.comparing(ListedAggregateId::initialEventTimestamp, OffsetDateTime.timeLineOrder())
                                                               .thenComparing(ListedAggregateId::aggregateId))
                                             .collect(Collectors.toCollection(ArrayList::new));
        if (pageToken.reverse) {
            Collections.reverse(sortedAggregateIds);
        }

        var fromIndex = 0;
        if (pageToken.lastEvaluatedKey != null) {
            for (var index = 0; index < sortedAggregateIds.size(); index++) {
                if (sortedAggregateIds.get(index).aggregateId().equals(pageToken.lastEvaluatedKey)) {
                    fromIndex = index + 1;
                    break;
                }
            }
        }
        var toIndex = pageToken.limit != null ? Math.min(fromIndex + pageToken.limit, sortedAggregateIds.size()) : sortedAggregateIds.size();
        var page    = fromIndex < toIndex ? sortedAggregateIds.subList(fromIndex, toIndex) : List.<ListedAggregateId>of();

        Optional<String> nextPageToken = Optional.empty();
        if (toIndex < sortedAggregateIds.size() && !page.isEmpty()) {
            nextPageToken = Optional.of(writePageToken(pageToken.continueAfter(page.get(page.size() - 1).aggregateId())));
        }
        return new ListAggregateIdsResult(page, nextPageToken);
    }

    private boolean containsEvent(EventStoreId eventStoreId, String aggregateId, long version) {
        var aggregates = events.get(eventStoreId);
        if (aggregates == null) {
            return false;
        }
        var aggregateEvents = aggregates.get(aggregateId);
        return aggregateEvents != null && aggregateEvents.containsKey(version);
    }

    private TreeMap<Long, EventDetail<?>> aggregateEvents(EventStoreId eventStoreId, String aggregateId) {
        return events.computeIfAbsent(eventStoreId, id -> new HashMap<>())
                     .computeIfAbsent(aggregateId, id -> new TreeMap<>());
    }

    private PageToken readPageToken(String pageToken) {
        try {
            return objectMapper.readValue(pageToken, PageToken.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(msg("Invalid page token '{}'", pageToken), e);
        }
    }

    private String writePageToken(PageToken pageToken) {
        try {
            return objectMapper.writeValueAsString(pageToken);
        } catch (JsonProcessingException e) {
            throw new EventStoreException(msg("Failed to write page token {}", pageToken), e);
        }
    }

    @Override
    public String toString() {
        return "InMemoryEventStorageAdapter{" +
                "lockOrder=" + lockOrder +
                '}';
    }

    /**
     * The <code>listAggregateIds</code> query and the position reached, serialized as JSON
     */
    static class PageToken {
        public Integer limit;
        public String  initialEventAfter;
        public String  initialEventBefore;
        public boolean reverse;
        public String  lastEvaluatedKey;

        static PageToken from(ListAggregateIdsOptions options) {
            var pageToken = new PageToken();
            pageToken.limit = options.limit().orElse(null);
            pageToken.initialEventAfter = options.initialEventAfter().map(OffsetDateTime::toString).orElse(null);
            pageToken.initialEventBefore = options.initialEventBefore().map(OffsetDateTime::toString).orElse(null);
            pageToken.reverse = options.reverse();
            return pageToken;
        }

        PageToken continueAfter(String aggregateId) {
            var pageToken = new PageToken();
            pageToken.limit = limit;
            pageToken.initialEventAfter = initialEventAfter;
            pageToken.initialEventBefore = initialEventBefore;
            pageToken.reverse = reverse;
            pageToken.lastEvaluatedKey = aggregateId;
            return pageToken;
        }

        Optional<OffsetDateTime> initialEventAfter() {
            return Optional.ofNullable(initialEventAfter).map(OffsetDateTime::parse);
        }

        Optional<OffsetDateTime> initialEventBefore() {
            return Optional.ofNullable(initialEventBefore).map(OffsetDateTime::parse);
        }

        @Override
        public String toString() {
            return "PageToken{" +
                    "limit=" + limit +
                    ", initialEventAfter='" + initialEventAfter + '\'' +
                    ", initialEventBefore='" + initialEventBefore + '\'' +
                    ", reverse=" + reverse +
                    ", lastEvaluatedKey='" + lastEvaluatedKey + '\'' +
                    '}';
        }
    }
}
