package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Publishes a {@link StatefulMessage} for every event pushed to a connected source event store.<br>
 * When the push didn't compute the next aggregate, the aggregate is rebuilt from the source event store up to the version of the pushed event.
 */
public class StatefulMessageBus extends MessageChannel<StatefulMessage<?, ?>> {
    private static final Logger log = LoggerFactory.getLogger(StatefulMessageBus.class);

    public StatefulMessageBus(String messageChannelId, List<? extends EventStore<?, ?>> sourceEventStores) {
        super(messageChannelId, sourceEventStores);
    }

    public StatefulMessageBus(String messageChannelId,
                              List<? extends EventStore<?, ?>> sourceEventStores,
                              MessageChannelAdapter<StatefulMessage<?, ?>> messageChannelAdapter) {
        super(messageChannelId, sourceEventStores, messageChannelAdapter);
    }

    /**
     * Rebuild the aggregate the notified event belongs to, as it was right after the event, and publish it
     *
     * @param notificationMessage the notification about a pushed event
     * @return the published message
     * @throws EventStoreNotFoundException if the event store isn't a source event store
     * @throws AggregateNotFoundException  if the event store contains no events for the aggregate
     */
    public <PAYLOAD, AGGREGATE> StatefulMessage<PAYLOAD, AGGREGATE> getAggregateAndPublishMessage(NotificationMessage<PAYLOAD> notificationMessage) {
        requireNonNull(notificationMessage, "No notificationMessage provided");
        EventStore<PAYLOAD, AGGREGATE> eventStore = getEventStore(notificationMessage.eventStoreId());
        var event = notificationMessage.event();
        log.debug("[{}] Rebuilding aggregate '{}' up to version {} from event store '{}'",
                  getMessageChannelId(),
                  event.aggregateId(),
                  event.version(),
                  eventStore.getEventStoreId());
        var aggregate = eventStore.getExistingAggregate(event.aggregateId(), GetAggregateOptions.upToVersion(event.version()))
                                  .aggregate();
        var statefulMessage = StatefulMessage.of(eventStore.getEventStoreId(), event, aggregate);
        publishMessage(statefulMessage);
        return statefulMessage;
    }

    @Override
    protected <PAYLOAD, AGGREGATE> void onEventPushed(EventStore<PAYLOAD, AGGREGATE> eventStore, PushEventResult<PAYLOAD, AGGREGATE> pushEventResult) {
        var nextAggregate = pushEventResult.nextAggregate();
        if (nextAggregate.isPresent()) {
            publishMessage(StatefulMessage.of(eventStore.getEventStoreId(), pushEventResult.event(), nextAggregate.get()));
        } else {
            getAggregateAndPublishMessage(NotificationMessage.of(eventStore.getEventStoreId(), pushEventResult.event()));
        }
    }
}
