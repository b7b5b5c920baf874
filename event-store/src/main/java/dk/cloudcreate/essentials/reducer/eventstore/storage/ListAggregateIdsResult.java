package dk.cloudcreate.essentials.reducer.eventstore.storage;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A page of aggregate ids returned by {@link EventStorageAdapter#listAggregateIds(dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId, ListAggregateIdsOptions)}
 */
public final class ListAggregateIdsResult {
    private final List<ListedAggregateId> aggregateIds;
    private final String                  nextPageToken;

    public ListAggregateIdsResult(List<ListedAggregateId> aggregateIds, Optional<String> nextPageToken) {
        this.aggregateIds = List.copyOf(requireNonNull(aggregateIds, "No aggregateIds provided"));
        this.nextPageToken = requireNonNull(nextPageToken, "No nextPageToken option provided").orElse(null);
    }

    public List<ListedAggregateId> aggregateIds() {
        return aggregateIds;
    }

    /**
     * @return the token for the next page. Empty when this is the last page
     */
    public Optional<String> nextPageToken() {
        return Optional.ofNullable(nextPageToken);
    }

    @Override
    public String toString() {
        return "ListAggregateIdsResult{" +
                "aggregateIds=" + aggregateIds +
                ", nextPageToken='" + nextPageToken + '\'' +
                '}';
    }

    /**
     * An aggregate id and the timestamp of the aggregate's first event
     */
    public static final class ListedAggregateId {
        private final String         aggregateId;
        private final OffsetDateTime initialEventTimestamp;

        public ListedAggregateId(String aggregateId, OffsetDateTime initialEventTimestamp) {
            this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
            this.initialEventTimestamp = requireNonNull(initialEventTimestamp, "No initialEventTimestamp provided");
        }

        public String aggregateId() {
            return aggregateId;
        }

        public OffsetDateTime initialEventTimestamp() {
            return initialEventTimestamp;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ListedAggregateId)) return false;
            var that = (ListedAggregateId) o;
            return aggregateId.equals(that.aggregateId) && initialEventTimestamp.isEqual(that.initialEventTimestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateId, initialEventTimestamp.toInstant());
        }

        @Override
        public String toString() {
            return aggregateId + "@" + initialEventTimestamp;
        }
    }
}
