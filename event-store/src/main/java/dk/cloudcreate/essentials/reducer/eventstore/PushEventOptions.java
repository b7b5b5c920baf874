package dk.cloudcreate.essentials.reducer.eventstore;

import java.util.Optional;

/**
 * Options for {@link EventStore#pushEvent(EventDetail, PushEventOptions)}
 *
 * @param <AGGREGATE> the aggregate type
 */
public final class PushEventOptions<AGGREGATE> {
    private final AGGREGATE prevAggregate;
    private final boolean   force;

    private PushEventOptions(AGGREGATE prevAggregate, boolean force) {
        this.prevAggregate = prevAggregate;
        this.force = force;
    }

    public static <AGGREGATE> PushEventOptions<AGGREGATE> none() {
        return new PushEventOptions<>(null, false);
    }

    /**
     * @param prevAggregate the aggregate state before the pushed event, which allows the {@link EventStore} to compute the next aggregate
     */
    public static <AGGREGATE> PushEventOptions<AGGREGATE> withPrevAggregate(AGGREGATE prevAggregate) {
        return new PushEventOptions<>(prevAggregate, false);
    }

    /**
     * Overwrite any existing event with the same aggregate id and version
     */
    public static <AGGREGATE> PushEventOptions<AGGREGATE> forced() {
        return new PushEventOptions<>(null, true);
    }

    public static <AGGREGATE> PushEventOptions<AGGREGATE> of(AGGREGATE prevAggregate, boolean force) {
        return new PushEventOptions<>(prevAggregate, force);
    }

    public Optional<AGGREGATE> prevAggregate() {
        return Optional.ofNullable(prevAggregate);
    }

    public boolean force() {
        return force;
    }

    @Override
    public String toString() {
        return "PushEventOptions{" +
                "prevAggregate=" + prevAggregate +
                ", force=" + force +
                '}';
    }
}
