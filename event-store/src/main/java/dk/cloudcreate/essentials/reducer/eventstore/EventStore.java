package dk.cloudcreate.essentials.reducer.eventstore;

import dk.cloudcreate.essentials.reducer.eventstore.storage.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import org.slf4j.*;
import reactor.core.publisher.*;
import reactor.core.scheduler.*;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event store binds a {@link Reducer} and a {@link SideEffectsSimulator} to an {@link EventStorageAdapter} and exposes
 * the operations to push events, build aggregates from their events and simulate aggregates.<br>
 * <br>
 * The storage adapter may be set after construction using {@link #setEventStorageAdapter(EventStorageAdapter)}. Every operation
 * that requires storage fails with {@link UndefinedEventStorageAdapterException} while no adapter is set.<br>
 * <br>
 * All operations are blocking. An {@link EventStore} instance holds no per-call state and can be shared by many threads.<br>
 * Example:
 * <pre>{@code
 * var counters = new EventStore<CounterEvent, Counter>(EventStoreId.of("COUNTERS"),
 *                                                      List.of(EventType.of("COUNTER_INCREMENTED", CounterIncremented.class)),
 *                                                      (counter, event) -> new Counter(counter == null ? 1 : counter.count + 1));
 * counters.setEventStorageAdapter(new InMemoryEventStorageAdapter());
 * var result = counters.pushEvent(EventDetail.of("counter-1", 1, "COUNTER_INCREMENTED", OffsetDateTime.now(), new CounterIncremented()));
 * }</pre>
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
public class EventStore<PAYLOAD, AGGREGATE> {
    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    private final EventStoreId                                eventStoreId;
    private final List<EventType<? extends PAYLOAD>>          eventTypes;
    private final Reducer<AGGREGATE, PAYLOAD>                 reducer;
    private final SideEffectsSimulator<PAYLOAD>               simulateSideEffect;
    private volatile EventStorageAdapter                      eventStorageAdapter;
    private volatile OnEventPushed<PAYLOAD, AGGREGATE>        onEventPushed;

    /**
     * Create an {@link EventStore} without a storage adapter, using the {@link SideEffectsSimulator#indexByVersion()} simulator
     */
    public EventStore(EventStoreId eventStoreId,
                      List<EventType<? extends PAYLOAD>> eventTypes,
                      Reducer<AGGREGATE, PAYLOAD> reducer) {
        this(eventStoreId,
             eventTypes,
             reducer,
             SideEffectsSimulator.indexByVersion(),
             null);
    }

    /**
     * @param eventStoreId        the unique id of the event store
     * @param eventTypes          the event types admissible in this event store
     * @param reducer             the reducer that applies events to aggregates
     * @param simulateSideEffect  the simulator used by {@link #simulateAggregate(List, SimulationOptions)}
     * @param eventStorageAdapter the storage adapter. May be null, in which case it must be set using {@link #setEventStorageAdapter(EventStorageAdapter)}
     */
    public EventStore(EventStoreId eventStoreId,
                      List<EventType<? extends PAYLOAD>> eventTypes,
                      Reducer<AGGREGATE, PAYLOAD> reducer,
                      SideEffectsSimulator<PAYLOAD> simulateSideEffect,
                      EventStorageAdapter eventStorageAdapter) {
        this.eventStoreId = requireNonNull(eventStoreId, "No eventStoreId provided");
        this.eventTypes = List.copyOf(requireNonNull(eventTypes, "No eventTypes provided"));
        this.reducer = requireNonNull(reducer, "No reducer provided");
        this.simulateSideEffect = requireNonNull(simulateSideEffect, "No simulateSideEffect provided");
        this.eventStorageAdapter = eventStorageAdapter;
        var duplicateTypes = this.eventTypes.stream()
                                            .collect(Collectors.groupingBy(EventType::type, Collectors.counting()))
                                            .entrySet()
                                            .stream()
                                            .filter(entry -> entry.getValue() > 1)
                                            .map(Map.Entry::getKey)
                                            .collect(Collectors.toList());
        if (!duplicateTypes.isEmpty()) {
            throw new IllegalArgumentException(msg("Event store '{}' has duplicate event types: {}", eventStoreId, duplicateTypes));
        }
    }

    public EventStoreId getEventStoreId() {
        return eventStoreId;
    }

    public List<EventType<? extends PAYLOAD>> getEventTypes() {
        return eventTypes;
    }

    public Optional<EventType<? extends PAYLOAD>> getEventType(String type) {
        requireNonNull(type, "No type provided");
        return eventTypes.stream()
                         .filter(eventType -> eventType.type().equals(type))
                         .findFirst();
    }

    public Reducer<AGGREGATE, PAYLOAD> getReducer() {
        return reducer;
    }

    public SideEffectsSimulator<PAYLOAD> getSimulateSideEffect() {
        return simulateSideEffect;
    }

    public Optional<EventStorageAdapter> getEventStorageAdapter() {
        return Optional.ofNullable(eventStorageAdapter);
    }

    /**
     * Get the storage adapter or fail
     *
     * @return the storage adapter
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public EventStorageAdapter requireEventStorageAdapter() {
        var adapter = eventStorageAdapter;
        if (adapter == null) {
            throw new UndefinedEventStorageAdapterException(eventStoreId);
        }
        return adapter;
    }

    public EventStore<PAYLOAD, AGGREGATE> setEventStorageAdapter(EventStorageAdapter eventStorageAdapter) {
        this.eventStorageAdapter = requireNonNull(eventStorageAdapter, "No eventStorageAdapter provided");
        log.debug("[{}] Using event storage adapter '{}'", eventStoreId, eventStorageAdapter.getClass().getSimpleName());
        return this;
    }

    public Optional<OnEventPushed<PAYLOAD, AGGREGATE>> getOnEventPushed() {
        return Optional.ofNullable(onEventPushed);
    }

    /**
     * Set the callback that's called, and awaited, after every successful push to this event store
     *
     * @param onEventPushed the callback
     * @return this event store instance
     */
    public EventStore<PAYLOAD, AGGREGATE> setOnEventPushed(OnEventPushed<PAYLOAD, AGGREGATE> onEventPushed) {
        this.onEventPushed = requireNonNull(onEventPushed, "No onEventPushed provided");
        return this;
    }

    public EventStore<PAYLOAD, AGGREGATE> removeOnEventPushed() {
        this.onEventPushed = null;
        return this;
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------------

    public List<EventDetail<PAYLOAD>> getEvents(String aggregateId) {
        return getEvents(aggregateId, EventsQueryOptions.all());
    }

    /**
     * Get the events of an aggregate from the storage adapter
     *
     * @param aggregateId the aggregate id
     * @param options     version range, limit and ordering
     * @return the events
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public List<EventDetail<PAYLOAD>> getEvents(String aggregateId, EventsQueryOptions options) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(options, "No options provided");
        var adapter = requireEventStorageAdapter();
        log.trace("[{}] Getting events for aggregate '{}' using {}", eventStoreId, aggregateId, options);
        return adapter.getEvents(aggregateId, eventStoreId, options);
    }

    public PushEventResult<PAYLOAD, AGGREGATE> pushEvent(EventDetail<PAYLOAD> event) {
        return pushEvent(event, PushEventOptions.none());
    }

    /**
     * Push a single event.<br>
     * The next aggregate is computed if the <code>options</code> contain the previous aggregate or if the event is the first event of the aggregate.
     * The {@link OnEventPushed} callback, if any, is called with the result before this method returns.
     *
     * @param event   the event to push
     * @param options the previous aggregate and force flag
     * @return the stored event and next aggregate
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     * @throws EventAlreadyExistsException           if the storage adapter already contains an event with the same aggregate id and version
     */
    public PushEventResult<PAYLOAD, AGGREGATE> pushEvent(EventDetail<PAYLOAD> event, PushEventOptions<AGGREGATE> options) {
        requireNonNull(event, "No event provided");
        requireNonNull(options, "No options provided");
        var adapter = requireEventStorageAdapter();

        log.debug("[{}] Pushing event '{}' with version {} for aggregate '{}'{}",
                  eventStoreId,
                  event.type(),
                  event.version(),
                  event.aggregateId(),
                  options.force() ? " (forced)" : "");
        var storedEvent = adapter.pushEvent(event, new PushEventContext(eventStoreId, options.force()));
        var result      = toPushEventResult(storedEvent, options.prevAggregate());

        var hook = onEventPushed;
        if (hook != null) {
            log.trace("[{}] Calling onEventPushed for aggregate '{}' version {}", eventStoreId, storedEvent.aggregateId(), storedEvent.version());
            hook.onEventPushed(result);
        }
        return result;
    }

    public GroupedEvent<PAYLOAD, AGGREGATE> groupEvent(EventDetail<PAYLOAD> event) {
        return groupEvent(event, null);
    }

    /**
     * Bind an event to this event store so it can be pushed atomically together with other events using {@link #pushEventGroup(List)}
     *
     * @param event         the event
     * @param prevAggregate the aggregate state before the event. May be null
     * @return the grouped event
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public GroupedEvent<PAYLOAD, AGGREGATE> groupEvent(EventDetail<PAYLOAD> event, AGGREGATE prevAggregate) {
        requireNonNull(event, "No event provided");
        requireEventStorageAdapter();
        return new GroupedEvent<>(this, event, prevAggregate);
    }

    public static PushEventGroupResult pushEventGroup(GroupedEvent<?, ?> groupedEvent, GroupedEvent<?, ?>... additionalGroupedEvents) {
        requireNonNull(groupedEvent, "No groupedEvent provided");
        requireNonNull(additionalGroupedEvents, "No additionalGroupedEvents provided");
        var groupedEvents = new ArrayList<GroupedEvent<?, ?>>(additionalGroupedEvents.length + 1);
        groupedEvents.add(groupedEvent);
        groupedEvents.addAll(Arrays.asList(additionalGroupedEvents));
        return pushEventGroup(groupedEvents);
    }

    /**
     * Push the grouped events in one atomic operation, see {@link #pushEventGroup(Scheduler, List)}.<br>
     * The {@link OnEventPushed} callbacks run concurrently on {@link Schedulers#boundedElastic()}, unless the storage adapter of the
     * first grouped event reports an active transaction on the calling thread ({@link EventStorageAdapter#isTransactionActiveOnCurrentThread()}).
     * In that case the events aren't committed yet, so the callbacks run one after the other on the calling thread, where the transaction is visible.
     *
     * @param groupedEvents the grouped events, at least one
     * @return the results in the same order as the <code>groupedEvents</code>
     */
    public static PushEventGroupResult pushEventGroup(List<? extends GroupedEvent<?, ?>> groupedEvents) {
        requireNonNull(groupedEvents, "No groupedEvents provided");
        var hookScheduler = !groupedEvents.isEmpty() && groupedEvents.get(0).eventStorageAdapter().isTransactionActiveOnCurrentThread() ?
                            Schedulers.immediate() :
                            Schedulers.boundedElastic();
        return pushEventGroup(hookScheduler, groupedEvents);
    }

    /**
     * Push events, that may belong to different aggregates and event stores, in one atomic operation.<br>
     * The storage adapter of the first grouped event stores the whole group. After the events have been stored, the next aggregate
     * of every grouped event is computed by its own event store, and the {@link OnEventPushed} callbacks of the event stores are
     * called concurrently on the <code>hookScheduler</code>. This method returns after all callbacks have completed.
     * If any callback fails, the first failure (in grouped event order) is rethrown and the other failures are added to it as suppressed exceptions.
     *
     * @param hookScheduler the scheduler the {@link OnEventPushed} callbacks run on
     * @param groupedEvents the grouped events, at least one
     * @return the results in the same order as the <code>groupedEvents</code>
     * @throws IllegalArgumentException if <code>groupedEvents</code> is empty
     */
    public static PushEventGroupResult pushEventGroup(Scheduler hookScheduler, List<? extends GroupedEvent<?, ?>> groupedEvents) {
        requireNonNull(hookScheduler, "No hookScheduler provided");
        requireNonNull(groupedEvents, "No groupedEvents provided");
        if (groupedEvents.isEmpty()) {
            throw new IllegalArgumentException("No grouped events provided. pushEventGroup requires at least one grouped event");
        }
        List<GroupedEvent<?, ?>> group = List.copyOf(groupedEvents);
        var adapter = group.get(0).eventStorageAdapter();

        log.debug("Pushing event group with {} event(s): {}", group.size(), group);
        var storedEvents = adapter.pushEventGroup(group);
        if (storedEvents.size() != group.size()) {
            throw new EventStoreException(msg("Storage adapter '{}' returned {} stored event(s) for an event group with {} event(s)",
                                              adapter.getClass().getName(),
                                              storedEvents.size(),
                                              group.size()));
        }

        var results         = new ArrayList<PushEventResult<?, ?>>(group.size());
        var hookInvocations = new ArrayList<HookInvocation>(group.size());
        for (var index = 0; index < group.size(); index++) {
            results.add(reduceGroupedEvent(group.get(index), storedEvents.get(index), hookInvocations));
        }
        awaitHookInvocations(hookScheduler, hookInvocations);
        return new PushEventGroupResult(results);
    }

    @SuppressWarnings("unchecked")
    private static <P, A> PushEventResult<P, A> reduceGroupedEvent(GroupedEvent<P, A> groupedEvent,
                                                                   EventDetail<?> storedEvent,
                                                                   List<HookInvocation> hookInvocations) {
        var eventStore = groupedEvent.eventStore();
        var result     = eventStore.toPushEventResult((EventDetail<P>) storedEvent, groupedEvent.prevAggregate());
        eventStore.getOnEventPushed()
                  .ifPresent(hook -> hookInvocations.add(new HookInvocation(eventStore.getEventStoreId(),
                                                                            storedEvent,
                                                                            () -> hook.onEventPushed(result))));
        return result;
    }

    private static void awaitHookInvocations(Scheduler hookScheduler, List<HookInvocation> hookInvocations) {
        if (hookInvocations.isEmpty()) {
            return;
        }
        var failures = new AtomicReferenceArray<Throwable>(hookInvocations.size());
        var join = Flux.range(0, hookInvocations.size())
            .flatMap(index -> {
                         var hookInvocation = hookInvocations.get(index);
                         return Mono.fromRunnable(hookInvocation.hook)
                                    .subscribeOn(hookScheduler)
                                    .onErrorResume(e -> {
                                        log.error(msg("[{}] onEventPushed failed for aggregate '{}' version {}",
                                                      hookInvocation.eventStoreId,
                                                      hookInvocation.event.aggregateId(),
                                                      hookInvocation.event.version()), e);
                                        failures.set(index, e);
                                        return Mono.empty();
                                    });
                     },
                     hookInvocations.size())
            .then()
            .toFuture();
        try {
            join.get();
        } catch (InterruptedException e) {
            join.cancel(true);
            Thread.currentThread().interrupt();
            throw new EventStoreException("Interrupted while waiting for the onEventPushed callbacks to complete", e);
        } catch (ExecutionException e) {
            throw new EventStoreException("Failed while waiting for the onEventPushed callbacks to complete", e.getCause());
        }

        Throwable firstFailure = null;
        for (var index = 0; index < failures.length(); index++) {
            var failure = failures.get(index);
            if (failure == null) {
                continue;
            }
            if (firstFailure == null) {
                firstFailure = failure;
            } else {
                firstFailure.addSuppressed(failure);
            }
        }
        if (firstFailure instanceof RuntimeException) {
            throw (RuntimeException) firstFailure;
        }
        if (firstFailure instanceof Error) {
            throw (Error) firstFailure;
        }
        if (firstFailure != null) {
            throw new EventStoreException("onEventPushed failed", firstFailure);
        }
    }

    public ListAggregateIdsResult listAggregateIds() {
        return listAggregateIds(ListAggregateIdsOptions.none());
    }

    /**
     * List the ids of the aggregates in this event store
     *
     * @param options filtering and paging
     * @return a page of aggregate ids
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public ListAggregateIdsResult listAggregateIds(ListAggregateIdsOptions options) {
        requireNonNull(options, "No options provided");
        var adapter = requireEventStorageAdapter();
        log.trace("[{}] Listing aggregate ids using {}", eventStoreId, options);
        return adapter.listAggregateIds(eventStoreId, options);
    }

    public Optional<AGGREGATE> buildAggregate(List<EventDetail<PAYLOAD>> events) {
        return buildAggregate(events, null);
    }

    /**
     * Apply the <code>events</code>, in the given order, to the <code>aggregate</code> using the {@link Reducer}
     *
     * @param events    the events to apply
     * @param aggregate the initial aggregate. May be null
     * @return the resulting aggregate. Empty if there were no events and no initial aggregate
     */
    public Optional<AGGREGATE> buildAggregate(List<EventDetail<PAYLOAD>> events, AGGREGATE aggregate) {
        requireNonNull(events, "No events provided");
        var currentAggregate = aggregate;
        for (var event : events) {
            currentAggregate = reducer.reduce(currentAggregate, event);
        }
        return Optional.ofNullable(currentAggregate);
    }

    public AggregateResult<PAYLOAD, AGGREGATE> getAggregate(String aggregateId) {
        return getAggregate(aggregateId, GetAggregateOptions.latest());
    }

    /**
     * Load the events of the aggregate, up to {@link GetAggregateOptions#maxVersion()}, and build the aggregate from them
     *
     * @param aggregateId the aggregate id
     * @param options     the maximum version
     * @return the aggregate and its events
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public AggregateResult<PAYLOAD, AGGREGATE> getAggregate(String aggregateId, GetAggregateOptions options) {
        requireNonNull(options, "No options provided");
        var events = getEvents(aggregateId, EventsQueryOptions.all().withMaxVersion(options.maxVersion()));
        log.trace("[{}] Building aggregate '{}' from {} event(s)", eventStoreId, aggregateId, events.size());
        return new AggregateResult<>(buildAggregate(events), events);
    }

    public ExistingAggregateResult<PAYLOAD, AGGREGATE> getExistingAggregate(String aggregateId) {
        return getExistingAggregate(aggregateId, GetAggregateOptions.latest());
    }

    /**
     * Same as {@link #getAggregate(String, GetAggregateOptions)} but fails if the aggregate has no events
     *
     * @throws AggregateNotFoundException            if there are no events for the aggregate id, or the {@link Reducer} didn't produce an aggregate from them
     * @throws UndefinedEventStorageAdapterException if no storage adapter has been set
     */
    public ExistingAggregateResult<PAYLOAD, AGGREGATE> getExistingAggregate(String aggregateId, GetAggregateOptions options) {
        var result = getAggregate(aggregateId, options);
        if (result.events().isEmpty() || result.aggregate().isEmpty()) {
            throw new AggregateNotFoundException(aggregateId, eventStoreId);
        }
        return new ExistingAggregateResult<>(result.aggregate().get(), result.events());
    }

    public Optional<AGGREGATE> simulateAggregate(List<EventDetail<PAYLOAD>> events) {
        return simulateAggregate(events, SimulationOptions.none());
    }

    /**
     * Build a hypothetical aggregate from the <code>events</code> without touching storage:
     * <ol>
     *     <li>merge the events using the {@link SideEffectsSimulator}</li>
     *     <li>drop the events with a timestamp after {@link SimulationOptions#simulationDate()}</li>
     *     <li>sort the remaining events by timestamp and renumber their versions from 1</li>
     *     <li>build the aggregate from the renumbered events</li>
     * </ol>
     *
     * @param events  the events
     * @param options the simulation date
     * @return the simulated aggregate. Empty if no events remained
     */
    public Optional<AGGREGATE> simulateAggregate(List<EventDetail<PAYLOAD>> events, SimulationOptions options) {
        requireNonNull(events, "No events provided");
        requireNonNull(options, "No options provided");

        Map<String, EventDetail<PAYLOAD>> simulatedEvents = new LinkedHashMap<>();
        for (var event : events) {
            simulatedEvents = simulateSideEffect.simulateSideEffect(simulatedEvents, event);
        }

        var simulationDate = options.simulationDate();
        // Stable sort: events with the same timestamp keep their simulated order
        var sortedEvents = simulatedEvents.values()
                                          .stream()
                                          .filter(event -> simulationDate.map(date -> !event.timestamp().isAfter(date)).orElse(true))
                                          .sorted(Comparator.comparing(EventDetail::timestamp, OffsetDateTime.timeLineOrder()))
                                          .collect(Collectors.toList());

        var renumberedEvents = new ArrayList<EventDetail<PAYLOAD>>(sortedEvents.size());
        for (var index = 0; index < sortedEvents.size(); index++) {
            renumberedEvents.add(sortedEvents.get(index).withVersion(index + 1));
        }
        log.trace("[{}] Simulating aggregate from {} of {} event(s)", eventStoreId, renumberedEvents.size(), events.size());
        return buildAggregate(renumberedEvents);
    }

    private PushEventResult<PAYLOAD, AGGREGATE> toPushEventResult(EventDetail<PAYLOAD> storedEvent, Optional<AGGREGATE> prevAggregate) {
        if (prevAggregate.isPresent() || storedEvent.version() == EventDetail.FIRST_VERSION) {
            return new PushEventResult<>(storedEvent, Optional.ofNullable(reducer.reduce(prevAggregate.orElse(null), storedEvent)));
        }
        return new PushEventResult<>(storedEvent, Optional.empty());
    }

    @Override
    public String toString() {
        return "EventStore{" +
                "eventStoreId=" + eventStoreId +
                ", eventTypes=" + eventTypes.stream().map(EventType::type).collect(Collectors.toList()) +
                '}';
    }

    private static final class HookInvocation {
        private final EventStoreId   eventStoreId;
        private final EventDetail<?> event;
        private final Runnable       hook;

        private HookInvocation(EventStoreId eventStoreId, EventDetail<?> event, Runnable hook) {
            this.eventStoreId = eventStoreId;
            this.event = event;
            this.hook = hook;
        }
    }
}
