package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * One admissible event type of an {@link EventStore}: the <code>type</code> name written to {@link EventDetail#type()}
 * and the Java type of the matching {@link EventDetail#payload()}.<br>
 * The {@link EventStore} never validates payloads against the {@link EventType}; serializing storage adapters use the
 * {@link #payloadType()} to deserialize stored payloads.
 *
 * @param <PAYLOAD> the payload type
 */
public final class EventType<PAYLOAD> {
    private final String         type;
    private final Class<PAYLOAD> payloadType;

    private EventType(String type, Class<PAYLOAD> payloadType) {
        this.type = requireNonNull(type, "No type provided");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        this.payloadType = requireNonNull(payloadType, "No payloadType provided");
    }

    public static <PAYLOAD> EventType<PAYLOAD> of(String type, Class<PAYLOAD> payloadType) {
        return new EventType<>(type, payloadType);
    }

    public String type() {
        return type;
    }

    public Class<PAYLOAD> payloadType() {
        return payloadType;
    }

    public boolean isTypeOf(EventDetail<?> event) {
        requireNonNull(event, "No event provided");
        return type.equals(event.type());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventType)) return false;
        var that = (EventType<?>) o;
        return type.equals(that.type) && payloadType.equals(that.payloadType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payloadType);
    }

    @Override
    public String toString() {
        return "EventType{" + type + " -> " + payloadType.getName() + "}";
    }
}
