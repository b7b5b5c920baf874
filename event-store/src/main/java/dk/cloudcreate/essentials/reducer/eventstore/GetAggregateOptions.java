package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Options for {@link EventStore#getAggregate(String, GetAggregateOptions)} and {@link EventStore#getExistingAggregate(String, GetAggregateOptions)}
 */
public final class GetAggregateOptions {
    private static final GetAggregateOptions LATEST = new GetAggregateOptions(null);

    private final Long maxVersion;

    private GetAggregateOptions(Long maxVersion) {
        if (maxVersion != null && maxVersion < EventDetail.FIRST_VERSION) {
            throw new IllegalArgumentException(msg("maxVersion must be >= {} but was {}", EventDetail.FIRST_VERSION, maxVersion));
        }
        this.maxVersion = maxVersion;
    }

    /**
     * Build the aggregate from all its events
     */
    public static GetAggregateOptions latest() {
        return LATEST;
    }

    /**
     * Build the aggregate from the events with a version less than or equal to <code>maxVersion</code>
     */
    public static GetAggregateOptions upToVersion(long maxVersion) {
        return new GetAggregateOptions(maxVersion);
    }

    public Optional<Long> maxVersion() {
        return Optional.ofNullable(maxVersion);
    }

    @Override
    public String toString() {
        return "GetAggregateOptions{maxVersion=" + maxVersion + '}';
    }
}
