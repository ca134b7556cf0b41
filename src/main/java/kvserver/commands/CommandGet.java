package kvserver.commands;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/**
 * GET key: the stored value as a bulk string, or a null bulk string when
 * the key is missing or expired. An expired entry is removed by the store
 * as part of the lookup.
 */
public final class CommandGet extends AbstractCommand {
    private static final Logger LOGGER = LogManager.getLogger(
            CommandGet.class);

    public CommandGet(final Store store) {
        super(store);
    }

    @Override
    String getName() {
        return "GET";
    }

    @Override
    Reply process(final Command command) throws CommandException {
        checkArity(command, 2);

        final String key = command.getElementAsString(1);
        final byte[] value = getStore().get(key);
        if (value == null) {
            LOGGER.trace("get: miss for key: " + key);
            return Reply.NULL_BULK;
        }
        LOGGER.trace("get: hit for key: " + key + " bytes: " + value.length);
        return Reply.bulk(value);
    }
}
