package kvserver.commands;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/** Base of every command: validates its own arguments and runs them. */
public abstract class AbstractCommand {
    private final Store store;

    AbstractCommand(final Store store) {
        this.store = store;
    }

    protected final Store getStore() {
        return store;
    }

    /** Upper-case name the command is registered under. */
    abstract String getName();

    /**
     * Execute the command.
     *
     * @param command decoded request whose name matches {@link #getName()}
     * @return reply to send back.
     * @throws CommandException if the arguments are not acceptable; the
     *          store is left untouched in that case.
     */
    abstract Reply process(Command command) throws CommandException;

    protected final void checkArity(final Command command, final int arity)
            throws CommandException {
        if (command.size() != arity) {
            throw CommandException.wrongArity(getName());
        }
    }
}
