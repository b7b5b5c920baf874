package dk.cloudcreate.essentials.reducer.messaging.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;

public class Counter {
    public static final EventStoreId COUNTERS            = EventStoreId.of("COUNTERS");
    public static final String       COUNTER_CREATED     = "COUNTER_CREATED";
    public static final String       COUNTER_INCREMENTED = "COUNTER_INCREMENTED";

    public final String counterId;
    public final int    count;
    public final long   version;

    public Counter(String counterId, int count, long version) {
        this.counterId = counterId;
        this.count = count;
        this.version = version;
    }

    public static class CounterEvent {
    }

    public static class CounterCreated extends CounterEvent {
    }

    public static class CounterIncremented extends CounterEvent {
    }

    public static final Reducer<Counter, CounterEvent> REDUCER = (counter, event) -> counter == null
                                                                                     ? new Counter(event.aggregateId(), 0, event.version())
                                                                                     : new Counter(counter.counterId, counter.count + 1, event.version());

    public static EventStore<CounterEvent, Counter> newCounterEventStore(EventStoreId eventStoreId) {
        return new EventStore<CounterEvent, Counter>(eventStoreId,
                                                     List.of(EventType.of(COUNTER_CREATED, CounterCreated.class),
                                                             EventType.of(COUNTER_INCREMENTED, CounterIncremented.class)),
                                                     REDUCER);
    }

    public static EventDetail<CounterEvent> created(String counterId) {
        return EventDetail.<CounterEvent>builder()
                          .aggregateId(counterId)
                          .version(1)
                          .type(COUNTER_CREATED)
                          .payload(new CounterCreated())
                          .build();
    }

    public static EventDetail<CounterEvent> incremented(String counterId, long version) {
        return EventDetail.<CounterEvent>builder()
                          .aggregateId(counterId)
                          .version(version)
                          .type(COUNTER_INCREMENTED)
                          .payload(new CounterIncremented())
                          .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Counter)) return false;
        var counter = (Counter) o;
        return count == counter.count && version == counter.version && counterId.equals(counter.counterId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counterId, count, version);
    }

    @Override
    public String toString() {
        return "Counter{" +
                "counterId='" + counterId + '\'' +
                ", count=" + count +
                ", version=" + version +
                '}';
    }
}
