package dk.cloudcreate.essentials.reducer.eventstore.test_data;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;

import java.util.*;

/**
 * Aggregate counting the events applied to it
 */
public final class Counter {
    public static final EventStoreId COUNTERS            = EventStoreId.of("COUNTERS");
    public static final String       COUNTER_INCREMENTED = "COUNTER_INCREMENTED";

    public final String aggregateId;
    public final long   count;

    public Counter(String aggregateId, long count) {
        this.aggregateId = aggregateId;
        this.count = count;
    }

    public static final Reducer<Counter, CounterIncremented> REDUCER =
            (counter, event) -> new Counter(event.aggregateId(), (counter == null ? 0 : counter.count) + 1);

    public static EventStore<CounterIncremented, Counter> newCounterEventStore() {
        return new EventStore<CounterIncremented, Counter>(COUNTERS,
                                                           List.of(EventType.of(COUNTER_INCREMENTED, CounterIncremented.class)),
                                                           REDUCER);
    }

    public static EventDetail<CounterIncremented> incremented(String aggregateId, long version) {
        return EventDetail.<CounterIncremented>builder()
                          .aggregateId(aggregateId)
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
        return count == counter.count && aggregateId.equals(counter.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, count);
    }

    @Override
    public String toString() {
        return "Counter{" + aggregateId + "=" + count + '}';
    }

    public static final class CounterIncremented {
        @Override
        public boolean equals(Object o) {
            return o instanceof CounterIncremented;
        }

        @Override
        public int hashCode() {
            return CounterIncremented.class.hashCode();
        }
    }
}
