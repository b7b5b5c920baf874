package dk.cloudcreate.essentials.reducer.messaging;

import java.util.List;

/**
 * Transport behind a {@link MessageChannel}
 *
 * @param <MESSAGE> the message type
 */
public interface MessageChannelAdapter<MESSAGE extends EventStoreMessage<?>> {
    void publishMessage(MESSAGE message);

    /**
     * Publish the messages in order.<br>
     * The default implementation publishes them one at a time.
     */
    default void publishMessages(List<? extends MESSAGE> messages) {
        messages.forEach(this::publishMessage);
    }
}
