package dk.cloudcreate.essentials.reducer.commands;

/**
 * The business logic of a {@link Command}: loads aggregates from, and pushes events to, the command's required event stores
 *
 * @param <INPUT>  the command input type
 * @param <OUTPUT> the command output type
 */
@FunctionalInterface
public interface CommandHandler<INPUT, OUTPUT> {
    OUTPUT handle(INPUT input, RequiredEventStores requiredEventStores);
}
