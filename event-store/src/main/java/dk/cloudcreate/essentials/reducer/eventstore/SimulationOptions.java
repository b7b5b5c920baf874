package dk.cloudcreate.essentials.reducer.eventstore;

import java.time.OffsetDateTime;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Options for {@link EventStore#simulateAggregate(java.util.List, SimulationOptions)}
 */
public final class SimulationOptions {
    private static final SimulationOptions NONE = new SimulationOptions(null);

    private final OffsetDateTime simulationDate;

    private SimulationOptions(OffsetDateTime simulationDate) {
        this.simulationDate = simulationDate;
    }

    public static SimulationOptions none() {
        return NONE;
    }

    /**
     * Only events with a timestamp at or before <code>simulationDate</code> take part in the simulation
     */
    public static SimulationOptions asOf(OffsetDateTime simulationDate) {
        return new SimulationOptions(requireNonNull(simulationDate, "No simulationDate provided"));
    }

    public Optional<OffsetDateTime> simulationDate() {
        return Optional.ofNullable(simulationDate);
    }

    @Override
    public String toString() {
        return "SimulationOptions{simulationDate=" + simulationDate + '}';
    }
}
