package kvserver.commands;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/**
 * Maps a decoded command to its implementation by case-insensitive name
 * and turns command failures into error replies. Shared by all
 * connections; holds no per-request state.
 */
public final class CommandDispatcher {
    private static final Logger LOGGER = LogManager.getLogger(
            CommandDispatcher.class);

    private final ImmutableMap<String, AbstractCommand> commands;

    public CommandDispatcher(final Store store) {
        Preconditions.checkNotNull(store);

        final ImmutableMap.Builder<String, AbstractCommand> builder =
                ImmutableMap.builder();
        for (AbstractCommand command : new AbstractCommand[] {
                new CommandPing(store),
                new CommandEcho(store),
                new CommandSet(store),
                new CommandGet(store) }) {
            builder.put(command.getName(), command);
        }
        commands = builder.build();
    }

    /**
     * Execute a command and produce its reply. Never throws for bad client
     * input; those come back as error replies.
     */
    public Reply dispatch(final Command command) {
        Preconditions.checkArgument(!command.isEmpty(),
                "cannot dispatch an empty command");

        final AbstractCommand handler = commands.get(command.getName());
        try {
            if (handler == null) {
                throw CommandException.unknownCommand(
                        command.getElementAsString(0));
            }
            return handler.process(command);
        } catch (CommandException e) {
            LOGGER.trace("Rejected " + command + ": " + e.getMessage());
            return Reply.error(e.getMessage());
        }
    }
}
