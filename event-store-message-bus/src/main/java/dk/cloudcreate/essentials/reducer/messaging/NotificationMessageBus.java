package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.*;

import java.util.List;

/**
 * Publishes a {@link NotificationMessage} for every event pushed to a connected source event store
 */
public class NotificationMessageBus extends MessageChannel<NotificationMessage<?>> {
    public NotificationMessageBus(String messageChannelId, List<? extends EventStore<?, ?>> sourceEventStores) {
        super(messageChannelId, sourceEventStores);
    }

    public NotificationMessageBus(String messageChannelId,
                                  List<? extends EventStore<?, ?>> sourceEventStores,
                                  MessageChannelAdapter<NotificationMessage<?>> messageChannelAdapter) {
        super(messageChannelId, sourceEventStores, messageChannelAdapter);
    }

    @Override
    protected <PAYLOAD, AGGREGATE> void onEventPushed(EventStore<PAYLOAD, AGGREGATE> eventStore, PushEventResult<PAYLOAD, AGGREGATE> pushEventResult) {
        publishMessage(NotificationMessage.of(eventStore.getEventStoreId(), pushEventResult.event()));
    }
}
