package dk.cloudcreate.essentials.reducer.commands;

import dk.cloudcreate.essentials.reducer.eventstore.*;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;
import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A command runs a {@link CommandHandler} against its required event stores.<br>
 * If the handler fails with an {@link EventAlreadyExistsException} (directly or as the cause of another exception), which happens
 * when another writer pushed an event for the same aggregate version first, the handler is run again until
 * {@link #getEventAlreadyExistsRetries()} retries have been used. Any other exception is rethrown immediately.<br>
 * Example:
 * <pre>{@code
 * var incrementCounter = new Command<String, Counter>("INCREMENT_COUNTER",
 *                                                     List.of(counters),
 *                                                     (counterId, eventStores) -> {
 *                                                         EventStore<CounterEvent, Counter> store = eventStores.get(0);
 *                                                         var existing = store.getExistingAggregate(counterId);
 *                                                         return store.pushEvent(incremented(counterId, existing.lastEvent().version() + 1),
 *                                                                                PushEventOptions.withPrevAggregate(existing.aggregate()))
 *                                                                     .nextAggregate().get();
 *                                                     });
 * var counter = incrementCounter.handle("counter-1");
 * }</pre>
 *
 * @param <INPUT>  the command input type
 * @param <OUTPUT> the command output type
 */
public class Command<INPUT, OUTPUT> {
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    public static final int DEFAULT_EVENT_ALREADY_EXISTS_RETRIES = 2;

    private final String                         commandId;
    private final RequiredEventStores            requiredEventStores;
    private final int                            eventAlreadyExistsRetries;
    private final OnEventAlreadyExists           onEventAlreadyExists;
    private final CommandHandler<INPUT, OUTPUT> handler;

    public Command(String commandId,
                   List<? extends EventStore<?, ?>> requiredEventStores,
                   CommandHandler<INPUT, OUTPUT> handler) {
        this(commandId,
             requiredEventStores,
             DEFAULT_EVENT_ALREADY_EXISTS_RETRIES,
             OnEventAlreadyExists.noop(),
             handler);
    }

    /**
     * @param commandId                 the id of the command
     * @param requiredEventStores       the event stores the handler operates on
     * @param eventAlreadyExistsRetries the number of times the handler is retried after an {@link EventAlreadyExistsException}
     * @param onEventAlreadyExists      called before each retry
     * @param handler                   the command logic
     */
    public Command(String commandId,
                   List<? extends EventStore<?, ?>> requiredEventStores,
                   int eventAlreadyExistsRetries,
                   OnEventAlreadyExists onEventAlreadyExists,
                   CommandHandler<INPUT, OUTPUT> handler) {
        this.commandId = requireNonNull(commandId, "No commandId provided");
        this.requiredEventStores = new RequiredEventStores(requireNonNull(requiredEventStores, "No requiredEventStores provided"));
        if (eventAlreadyExistsRetries < 0) {
            throw new IllegalArgumentException(msg("eventAlreadyExistsRetries must be >= 0 but was {}", eventAlreadyExistsRetries));
        }
        this.eventAlreadyExistsRetries = eventAlreadyExistsRetries;
        this.onEventAlreadyExists = requireNonNull(onEventAlreadyExists, "No onEventAlreadyExists provided");
        this.handler = requireNonNull(handler, "No handler provided");
    }

    /**
     * Run the handler with the <code>input</code>, retrying on {@link EventAlreadyExistsException}
     *
     * @param input the command input
     * @return the handler output
     */
    public OUTPUT handle(INPUT input) {
        var attemptNumber = 1;
        var retriesLeft   = eventAlreadyExistsRetries;
        while (true) {
            try {
                log.debug("[{}] Handling attempt {}", commandId, attemptNumber);
                return handler.handle(input, requiredEventStores);
            } catch (RuntimeException e) {
                var eventAlreadyExists = EventAlreadyExistsException.findEventAlreadyExistsException(e);
                if (eventAlreadyExists.isEmpty()) {
                    throw e;
                }
                if (retriesLeft == 0) {
                    log.debug("[{}] Attempt {} failed as the event already exists and no retries are left", commandId, attemptNumber);
                    throw e;
                }
                log.debug("[{}] Attempt {} failed as the event already exists. Retries left: {}", commandId, attemptNumber, retriesLeft);
                onEventAlreadyExists.onEventAlreadyExists(eventAlreadyExists.get(), attemptNumber, retriesLeft);
                attemptNumber++;
                retriesLeft--;
            }
        }
    }

    public String getCommandId() {
        return commandId;
    }

    public RequiredEventStores getRequiredEventStores() {
        return requiredEventStores;
    }

    public int getEventAlreadyExistsRetries() {
        return eventAlreadyExistsRetries;
    }

    @Override
    public String toString() {
        return "Command{" +
                "commandId='" + commandId + '\'' +
                ", requiredEventStores=" + requiredEventStores +
                ", eventAlreadyExistsRetries=" + eventAlreadyExistsRetries +
                '}';
    }
}
