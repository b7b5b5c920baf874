package dk.cloudcreate.essentials.reducer.commands;

import dk.cloudcreate.essentials.reducer.eventstore.EventAlreadyExistsException;

/**
 * Called by a {@link Command} before it retries a handler that failed with an {@link EventAlreadyExistsException}
 */
@FunctionalInterface
public interface OnEventAlreadyExists {
    /**
     * @param exception     the exception that failed the attempt
     * @param attemptNumber the number of the failed attempt, starting at 1
     * @param retriesLeft   the number of retries left, including the retry about to be made
     */
    void onEventAlreadyExists(EventAlreadyExistsException exception, int attemptNumber, int retriesLeft);

    static OnEventAlreadyExists noop() {
        return (exception, attemptNumber, retriesLeft) -> {
        };
    }
}
