package kvserver.commands;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/** PING [anything ...]: always answers PONG. */
public final class CommandPing extends AbstractCommand {
    public CommandPing(final Store store) {
        super(store);
    }

    @Override
    String getName() {
        return "PING";
    }

    @Override
    Reply process(final Command command) {
        return Reply.PONG;
    }
}
