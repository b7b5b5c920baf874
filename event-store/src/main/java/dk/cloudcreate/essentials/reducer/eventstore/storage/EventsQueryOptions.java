package dk.cloudcreate.essentials.reducer.eventstore.storage;

import dk.cloudcreate.essentials.reducer.eventstore.EventDetail;
import dk.cloudcreate.essentials.types.LongRange;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Query options for {@link EventStorageAdapter#getEvents(String, dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId, EventsQueryOptions)}.<br>
 * <code>minVersion</code> and <code>maxVersion</code> are inclusive. The <code>limit</code> is applied after ordering, so
 * <code>EventsQueryOptions.all().reversed().withLimit(1)</code> returns the latest event.
 */
public final class EventsQueryOptions {
    private static final EventsQueryOptions ALL = new EventsQueryOptions(null, null, null, false);

    private final Long    minVersion;
    private final Long    maxVersion;
    private final Integer limit;
    private final boolean reverse;

    private EventsQueryOptions(Long minVersion, Long maxVersion, Integer limit, boolean reverse) {
        if (minVersion != null && minVersion < 1) {
            throw new IllegalArgumentException(msg("minVersion must be >= 1 but was {}", minVersion));
        }
        if (maxVersion != null && maxVersion < 1) {
            throw new IllegalArgumentException(msg("maxVersion must be >= 1 but was {}", maxVersion));
        }
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException(msg("limit must be >= 1 but was {}", limit));
        }
        this.minVersion = minVersion;
        this.maxVersion = maxVersion;
        this.limit = limit;
        this.reverse = reverse;
    }

    public static EventsQueryOptions all() {
        return ALL;
    }

    public EventsQueryOptions withMinVersion(long minVersion) {
        return new EventsQueryOptions(minVersion, maxVersion, limit, reverse);
    }

    public EventsQueryOptions withMaxVersion(long maxVersion) {
        return new EventsQueryOptions(minVersion, maxVersion, limit, reverse);
    }

    public EventsQueryOptions withMaxVersion(Optional<Long> maxVersion) {
        return new EventsQueryOptions(minVersion, maxVersion.orElse(null), limit, reverse);
    }

    public EventsQueryOptions withLimit(int limit) {
        return new EventsQueryOptions(minVersion, maxVersion, limit, reverse);
    }

    public EventsQueryOptions reversed() {
        return new EventsQueryOptions(minVersion, maxVersion, limit, true);
    }

    public Optional<Long> minVersion() {
        return Optional.ofNullable(minVersion);
    }

    public Optional<Long> maxVersion() {
        return Optional.ofNullable(maxVersion);
    }

    public Optional<Integer> limit() {
        return Optional.ofNullable(limit);
    }

    public boolean reverse() {
        return reverse;
    }

    /**
     * The inclusive version range covered by these options. Without a <code>minVersion</code> the range starts at {@link EventDetail#FIRST_VERSION}
     * and without a <code>maxVersion</code> the range is open ended.
     *
     * @return the version range or {@link Optional#empty()} if <code>maxVersion</code> is lower than the start of the range, in which case no version matches
     */
    public Optional<LongRange> versionRange() {
        var fromInclusive = minVersion != null ? minVersion : EventDetail.FIRST_VERSION;
        if (maxVersion == null) {
            return Optional.of(LongRange.from(fromInclusive));
        }
        if (maxVersion < fromInclusive) {
            return Optional.empty();
        }
        return Optional.of(LongRange.between(fromInclusive, maxVersion));
    }

    /**
     * @return true if the event version is inside the {@link #versionRange()} of these options
     */
    public boolean includesVersion(long version) {
        return versionRange().map(range -> version >= range.fromInclusive && (!range.isClosedRange() || version <= range.toInclusive))
                             .orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventsQueryOptions)) return false;
        var that = (EventsQueryOptions) o;
        return reverse == that.reverse &&
                Objects.equals(minVersion, that.minVersion) &&
                Objects.equals(maxVersion, that.maxVersion) &&
                Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minVersion, maxVersion, limit, reverse);
    }

    @Override
    public String toString() {
        return "EventsQueryOptions{" +
                "minVersion=" + minVersion +
                ", maxVersion=" + maxVersion +
                ", limit=" + limit +
                ", reverse=" + reverse +
                '}';
    }
}
