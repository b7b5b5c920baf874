package dk.cloudcreate.essentials.reducer.messaging;

import dk.cloudcreate.essentials.reducer.eventstore.EventStoreException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a {@link MessageChannel} is asked to publish before a {@link MessageChannelAdapter} has been set
 */
public class UndefinedMessageChannelAdapterException extends EventStoreException {
    public final String messageChannelId;

    public UndefinedMessageChannelAdapterException(String messageChannelId) {
        super(msg("No message channel adapter has been set on message channel '{}'", messageChannelId));
        this.messageChannelId = messageChannelId;
    }
}
