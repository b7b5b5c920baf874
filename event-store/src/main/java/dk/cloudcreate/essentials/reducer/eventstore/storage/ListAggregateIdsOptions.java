package dk.cloudcreate.essentials.reducer.eventstore.storage;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Options for {@link EventStorageAdapter#listAggregateIds(dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId, ListAggregateIdsOptions)}.<br>
 * When a <code>pageToken</code> is provided the storage adapter continues the listing the token was issued for,
 * using the filters encoded in the token.
 */
public final class ListAggregateIdsOptions {
    public static final int DEFAULT_LIST_AGGREGATE_IDS_LIMIT = 100;

    private static final ListAggregateIdsOptions NONE = new ListAggregateIdsOptions(null, null, null, null, false);

    private final Integer        limit;
    private final String         pageToken;
    private final OffsetDateTime initialEventAfter;
    private final OffsetDateTime initialEventBefore;
    private final boolean        reverse;

    private ListAggregateIdsOptions(Integer limit, String pageToken, OffsetDateTime initialEventAfter, OffsetDateTime initialEventBefore, boolean reverse) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException(msg("limit must be >= 1 but was {}", limit));
        }
        this.limit = limit;
        this.pageToken = pageToken;
        this.initialEventAfter = initialEventAfter;
        this.initialEventBefore = initialEventBefore;
        this.reverse = reverse;
    }

    public static ListAggregateIdsOptions none() {
        return NONE;
    }

    public static ListAggregateIdsOptions nextPage(String pageToken) {
        return new ListAggregateIdsOptions(null, pageToken, null, null, false);
    }

    public ListAggregateIdsOptions withLimit(int limit) {
        return new ListAggregateIdsOptions(limit, pageToken, initialEventAfter, initialEventBefore, reverse);
    }

    public ListAggregateIdsOptions withPageToken(String pageToken) {
        return new ListAggregateIdsOptions(limit, pageToken, initialEventAfter, initialEventBefore, reverse);
    }

    /**
     * Only list aggregates whose first event is strictly after <code>initialEventAfter</code>
     */
    public ListAggregateIdsOptions withInitialEventAfter(OffsetDateTime initialEventAfter) {
        return new ListAggregateIdsOptions(limit, pageToken, initialEventAfter, initialEventBefore, reverse);
    }

    /**
     * Only list aggregates whose first event is strictly before <code>initialEventBefore</code>
     */
    public ListAggregateIdsOptions withInitialEventBefore(OffsetDateTime initialEventBefore) {
        return new ListAggregateIdsOptions(limit, pageToken, initialEventAfter, initialEventBefore, reverse);
    }

    public ListAggregateIdsOptions reversed() {
        return new ListAggregateIdsOptions(limit, pageToken, initialEventAfter, initialEventBefore, true);
    }

    public Optional<Integer> limit() {
        return Optional.ofNullable(limit);
    }

    public Optional<String> pageToken() {
        return Optional.ofNullable(pageToken);
    }

    public Optional<OffsetDateTime> initialEventAfter() {
        return Optional.ofNullable(initialEventAfter);
    }

    public Optional<OffsetDateTime> initialEventBefore() {
        return Optional.ofNullable(initialEventBefore);
    }

    public boolean reverse() {
        return reverse;
    }

    @Override
    public String toString() {
        return "ListAggregateIdsOptions{" +
                "limit=" + limit +
                ", pageToken='" + pageToken + '\'' +
                ", initialEventAfter=" + initialEventAfter +
                ", initialEventBefore=" + initialEventBefore +
                ", reverse=" + reverse +
                '}';
    }
}
