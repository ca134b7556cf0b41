package kvserver.commands;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/** ECHO message: returns message as a bulk string, byte for byte. */
public final class CommandEcho extends AbstractCommand {
    public CommandEcho(final Store store) {
        super(store);
    }

    @Override
    String getName() {
        return "ECHO";
    }

    @Override
    Reply process(final Command command) throws CommandException {
        checkArity(command, 2);
        return Reply.bulk(command.getElement(1));
    }
}
