package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import dk.cloudcreate.essentials.reducer.eventstore.types.EventStoreId;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Base class for channels that publish messages about events pushed to a fixed set of source event stores.<br>
 * The {@link MessageChannelAdapter} can be set after construction, but must be set before the first message is published.<br>
 * After {@link #connectSourceEventStores()} every successful push to a source event store is published automatically.
 *
 * @param <MESSAGE> the message type
 */
public abstract class MessageChannel<MESSAGE extends EventStoreMessage<?>> {
    private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);

    private final    String                           messageChannelId;
    private final    List<EventStore<?, ?>>           sourceEventStores;
    private volatile MessageChannelAdapter<MESSAGE> messageChannelAdapter;

    protected MessageChannel(String messageChannelId, List<? extends EventStore<?, ?>> sourceEventStores) {
        this(messageChannelId, sourceEventStores, null);
    }

    /**
     * @param messageChannelId      the id of the channel
     * @param sourceEventStores     the event stores whose events may be published on this channel
     * @param messageChannelAdapter the transport, may be <code>null</code> and set later using {@link #setMessageChannelAdapter(MessageChannelAdapter)}
     */
    protected MessageChannel(String messageChannelId,
                             List<? extends EventStore<?, ?>> sourceEventStores,
                             MessageChannelAdapter<MESSAGE> messageChannelAdapter) {
        this.messageChannelId = requireNonNull(messageChannelId, "No messageChannelId provided");
        this.sourceEventStores = List.copyOf(requireNonNull(sourceEventStores, "No sourceEventStores provided"));
        this.messageChannelAdapter = messageChannelAdapter;
    }

    public String getMessageChannelId() {
        return messageChannelId;
    }

    public List<EventStore<?, ?>> getSourceEventStores() {
        return sourceEventStores;
    }

    public Optional<MessageChannelAdapter<MESSAGE>> getMessageChannelAdapter() {
        return Optional.ofNullable(messageChannelAdapter);
    }

    /**
     * @throws UndefinedMessageChannelAdapterException if no adapter has been set
     */
    public MessageChannelAdapter<MESSAGE> requireMessageChannelAdapter() {
        var adapter = messageChannelAdapter;
        if (adapter == null) {
            throw new UndefinedMessageChannelAdapterException(messageChannelId);
        }
        return adapter;
    }

    public void setMessageChannelAdapter(MessageChannelAdapter<MESSAGE> messageChannelAdapter) {
        this.messageChannelAdapter = requireNonNull(messageChannelAdapter, "No messageChannelAdapter provided");
        log.info("[{}] Using message channel adapter {}", messageChannelId, messageChannelAdapter.getClass().getSimpleName());
    }

    /**
     * @param eventStoreId the id of a source event store
     * @return the source event store
     * @throws EventStoreNotFoundException if the event store isn't a source event store of this channel
     */
    @SuppressWarnings("unchecked")
    public <PAYLOAD, AGGREGATE> EventStore<PAYLOAD, AGGREGATE> getEventStore(EventStoreId eventStoreId) {
        requireNonNull(eventStoreId, "No eventStoreId provided");
        return (EventStore<PAYLOAD, AGGREGATE>) sourceEventStores.stream()
                                                                 .filter(eventStore -> eventStore.getEventStoreId().equals(eventStoreId))
                                                                 .findFirst()
                                                                 .orElseThrow(() -> new EventStoreNotFoundException(eventStoreId, messageChannelId));
    }

    /**
     * @throws EventStoreNotFoundException             if the message comes from an event store that isn't a source event store
     * @throws UndefinedMessageChannelAdapterException if no adapter has been set
     */
    public void publishMessage(MESSAGE message) {
        requireNonNull(message, "No message provided");
        getEventStore(message.eventStoreId());
        var adapter = requireMessageChannelAdapter();
        log.debug("[{}] Publishing message '{}'", messageChannelId, message.messageDeduplicationId());
        adapter.publishMessage(message);
    }

    public void publishMessages(List<? extends MESSAGE> messages) {
        requireNonNull(messages, "No messages provided");
        messages.forEach(message -> getEventStore(message.eventStoreId()));
        var adapter = requireMessageChannelAdapter();
        log.debug("[{}] Publishing {} message(s)", messageChannelId, messages.size());
        adapter.publishMessages(messages);
    }

    /**
     * Install an {@link OnEventPushed} hook on every source event store, so every successful push is published on this channel.<br>
     * Any hook already set on a source event store is replaced.
     */
    public void connectSourceEventStores() {
        sourceEventStores.forEach(this::connect);
        log.info("[{}] Connected to source event stores {}", messageChannelId, sourceEventStoreIds());
    }

    /**
     * Remove the {@link OnEventPushed} hook from every source event store
     */
    public void disconnectSourceEventStores() {
        sourceEventStores.forEach(EventStore::removeOnEventPushed);
        log.info("[{}] Disconnected from source event stores {}", messageChannelId, sourceEventStoreIds());
    }

    private <PAYLOAD, AGGREGATE> void connect(EventStore<PAYLOAD, AGGREGATE> eventStore) {
        eventStore.setOnEventPushed(pushEventResult -> onEventPushed(eventStore, pushEventResult));
    }

    private List<EventStoreId> sourceEventStoreIds() {
        var eventStoreIds = new ArrayList<EventStoreId>();
        sourceEventStores.forEach(eventStore -> eventStoreIds.add(eventStore.getEventStoreId()));
        return eventStoreIds;
    }

    /**
     * Publish the message matching a successful push to a connected source event store
     */
    protected abstract <PAYLOAD, AGGREGATE> void onEventPushed(EventStore<PAYLOAD, AGGREGATE> eventStore, PushEventResult<PAYLOAD, AGGREGATE> pushEventResult);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "messageChannelId='" + messageChannelId + '\'' +
                ", sourceEventStores=" + sourceEventStoreIds() +
                '}';
    }
}
