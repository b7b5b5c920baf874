package dk.cloudcreate.essentials.reducer.eventstore;

/**
 * Callback invoked by the {@link EventStore} after an event has been stored.<br>
 * The callback is awaited, so any exception it throws fails the push that triggered it.
 *
 * @param <PAYLOAD>   the event payload type
 * @param <AGGREGATE> the aggregate type
 */
@FunctionalInterface
public interface OnEventPushed<PAYLOAD, AGGREGATE> {
    void onEventPushed(PushEventResult<PAYLOAD, AGGREGATE> pushEventResult);
}
