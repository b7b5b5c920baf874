package dk.cloudcreate.essentials.reducer.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Jackson based serializer for event payloads and metadata.<br>
 * The Java type a payload is deserialized into is resolved from the {@link EventType}'s of the event stores
 * registered using {@link #registerEventStore(EventStore)}. Payloads of event types that haven't been registered are deserialized
 * into plain Jackson types ({@link Map}, {@link List}, {@link String}, {@link Number} or {@link Boolean}).
 */
public class JSONEventSerializer {
    private static final Logger                              log           = LoggerFactory.getLogger(JSONEventSerializer.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper                                       objectMapper;
    private final ConcurrentMap<EventStoreId, Map<String, Class<?>>> payloadTypes = new ConcurrentHashMap<>();

    public JSONEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JSONEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * {@link ObjectMapper} with the {@link JavaTimeModule} registered, ISO-8601 dates and lenient handling of unknown properties
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule())
                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                 .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                                 .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                 .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Register the payload types of all the event types of the <code>eventStore</code>
     */
    public JSONEventSerializer registerEventStore(EventStore<?, ?> eventStore) {
        requireNonNull(eventStore, "No eventStore provided");
        var typesForStore = new HashMap<String, Class<?>>();
        eventStore.getEventTypes().forEach(eventType -> typesForStore.put(eventType.type(), eventType.payloadType()));
        payloadTypes.put(eventStore.getEventStoreId(), Map.copyOf(typesForStore));
        log.debug("Registered {} event type(s) for event store '{}'", typesForStore.size(), eventStore.getEventStoreId());
        return this;
    }

    public Optional<Class<?>> resolvePayloadType(EventStoreId eventStoreId, String eventType) {
        requireNonNull(eventStoreId, "No eventStoreId provided");
        requireNonNull(eventType, "No eventType provided");
        return Optional.ofNullable(payloadTypes.getOrDefault(eventStoreId, Map.of()).get(eventType));
    }

    /**
     * @return the JSON or <code>null</code> if the <code>payload</code> is <code>null</code>
     * @throws JSONSerializationException if the payload couldn't be serialized
     */
    public String serializePayload(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize payload of type '{}'", payload.getClass().getName()), e);
        }
    }

    /**
     * @throws JSONDeserializationException if the json couldn't be deserialized into the payload type registered for the event type
     */
    public Object deserializePayload(EventStoreId eventStoreId, String eventType, String json) {
        if (json == null) {
            return null;
        }
        Class<?> payloadType = resolvePayloadType(eventStoreId, eventType).orElse(Object.class);
        try {
            return objectMapper.readValue(json, payloadType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("[{}] Failed to deserialize payload of event type '{}' into '{}'",
                                                       eventStoreId,
                                                       eventType,
                                                       payloadType.getName()),
                                                   e);
        }
    }

    public String serializeMetadata(Map<String, Object> metadata) {
        requireNonNull(metadata, "No metadata provided");
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException("Failed to serialize event metadata", e);
        }
    }

    public Map<String, Object> deserializeMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException("Failed to deserialize event metadata", e);
        }
    }
}
