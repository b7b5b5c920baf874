package dk.cloudcreate.essentials.reducer.eventstore;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable, versioned fact belonging to exactly one aggregate.<br>
 * The identity of an event is the combination of {@link #aggregateId()} and {@link #version()}.<br>
 * The {@link #payload()} and {@link #metadata()} are opaque to the {@link EventStore}.<br>
 * Example:
 * <pre>{@code
 * var event = EventDetail.<CounterEvent>builder()
 *                        .aggregateId("counter-1")
 *                        .version(1)
 *                        .type("COUNTER_CREATED")
 *                        .payload(new CounterCreated(0))
 *                        .build();
 * }</pre>
 *
 * @param <PAYLOAD> the payload type
 */
public final class EventDetail<PAYLOAD> {
    public static final long FIRST_VERSION = 1;

    private final String              aggregateId;
    private final long                version;
    private final String              type;
    private final OffsetDateTime      timestamp;
    private final PAYLOAD             payload;
    private final Map<String, Object> metadata;

    private EventDetail(String aggregateId,
                        long version,
                        String type,
                        OffsetDateTime timestamp,
                        PAYLOAD payload,
                        Map<String, Object> metadata) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        if (aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId cannot be blank");
        }
        if (version < FIRST_VERSION) {
            throw new IllegalArgumentException(msg("version must be >= {} but was {} for aggregate '{}'", FIRST_VERSION, version, aggregateId));
        }
        this.version = version;
        this.type = requireNonNull(type, "No type provided");
        if (type.isBlank()) {
            throw new IllegalArgumentException(msg("type cannot be blank for aggregate '{}' version {}", aggregateId, version));
        }
        this.timestamp = requireNonNull(timestamp, "No timestamp provided").withOffsetSameInstant(ZoneOffset.UTC);
        this.payload = payload;
        this.metadata = Map.copyOf(requireNonNull(metadata, "No metadata provided"));
    }

    public static <PAYLOAD> EventDetail<PAYLOAD> of(String aggregateId,
                                                    long version,
                                                    String type,
                                                    OffsetDateTime timestamp,
                                                    PAYLOAD payload) {
        return new EventDetail<>(aggregateId, version, type, timestamp, payload, Map.of());
    }

    public static <PAYLOAD> Builder<PAYLOAD> builder() {
        return new Builder<>();
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long version() {
        return version;
    }

    public String type() {
        return type;
    }

    /**
     * @return the timestamp of the event, always with offset {@link ZoneOffset#UTC}
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    /**
     * @return the payload. May be null for events that carry no payload
     */
    public PAYLOAD payload() {
        return payload;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Create a copy of this event with a different version
     *
     * @param version the new version
     * @return the copy
     */
    public EventDetail<PAYLOAD> withVersion(long version) {
        return new EventDetail<>(aggregateId, version, type, timestamp, payload, metadata);
    }

    /**
     * Copy this event into a {@link Builder}
     */
    public Builder<PAYLOAD> toBuilder() {
        return new Builder<PAYLOAD>().aggregateId(aggregateId)
                                     .version(version)
                                     .type(type)
                                     .timestamp(timestamp)
                                     .payload(payload)
                                     .metadata(metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventDetail)) return false;
        var that = (EventDetail<?>) o;
        return version == that.version &&
                aggregateId.equals(that.aggregateId) &&
                type.equals(that.type) &&
                timestamp.equals(that.timestamp) &&
                Objects.equals(payload, that.payload) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, type, timestamp, payload, metadata);
    }

    @Override
    public String toString() {
        return "EventDetail{" +
                "aggregateId='" + aggregateId + '\'' +
                ", version=" + version +
                ", type='" + type + '\'' +
                ", timestamp=" + timestamp +
                ", payload=" + payload +
                ", metadata=" + metadata +
                '}';
    }

    public static final class Builder<PAYLOAD> {
        private String              aggregateId;
        private long                version;
        private String              type;
        private OffsetDateTime      timestamp;
        private PAYLOAD             payload;
        private Map<String, Object> metadata = Map.of();

        private Builder() {
        }

        public Builder<PAYLOAD> aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder<PAYLOAD> version(long version) {
            this.version = version;
            return this;
        }

        public Builder<PAYLOAD> type(String type) {
            this.type = type;
            return this;
        }

        /**
         * If no timestamp is provided, {@link #build()} uses the current time (truncated to microseconds)
         */
        public Builder<PAYLOAD> timestamp(OffsetDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder<PAYLOAD> payload(PAYLOAD payload) {
            this.payload = payload;
            return this;
        }

        public Builder<PAYLOAD> metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public EventDetail<PAYLOAD> build() {
            return new EventDetail<>(aggregateId,
                                     version,
                                     type,
                                     timestamp != null ? timestamp : OffsetDateTime.now(Clock.systemUTC()).truncatedTo(ChronoUnit.MICROS),
                                     payload,
                                     metadata);
        }
    }
}
