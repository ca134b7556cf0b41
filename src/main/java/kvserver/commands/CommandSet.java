package kvserver.commands;

import java.time.Duration;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.CharMatcher;
import com.google.common.primitives.Longs;

import kvserver.protocol.Command;
import kvserver.protocol.Reply;
import kvserver.store.Store;

/**
 * SET key value [EX seconds | PX milliseconds]: stores the value,
 * overwriting any previous one, optionally with a time to live.
 */
public final class CommandSet extends AbstractCommand {
    private static final Logger LOGGER = LogManager.getLogger(
            CommandSet.class);

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    public CommandSet(final Store store) {
        super(store);
    }

    @Override
    String getName() {
        return "SET";
    }

    @Override
    Reply process(final Command command) throws CommandException {
        if (command.size() != 3 && command.size() != 5) {
            throw CommandException.wrongArity(getName());
        }

        Duration ttl = null;
        if (command.size() == 5) {
            ttl = parseTtl(command.getElementAsString(3),
                    command.getElementAsString(4));
        }

        final String key = command.getElementAsString(1);
        final byte[] value = command.getElement(2);
        getStore().set(key, value, ttl);
        LOGGER.trace("set: key: " + key + " bytes: " + value.length
                + " ttl: " + ttl);
        return Reply.OK;
    }

    private Duration parseTtl(final String option, final String amount)
            throws CommandException {
        final String unit = option.toUpperCase(Locale.ROOT);
        if (!unit.equals("EX") && !unit.equals("PX")) {
            throw CommandException.unsupportedOption(option);
        }

        // Longs.tryParse alone would also take a leading minus sign.
        final Long n = DIGITS.matchesAllOf(amount) ? Longs.tryParse(amount)
                : null;
        if (n == null) {
            throw CommandException.notAnInteger();
        }
        if (n == 0) {
            throw CommandException.invalidExpireTime(getName());
        }

        try {
            final Duration ttl = unit.equals("EX") ? Duration.ofSeconds(n)
                    : Duration.ofMillis(n);
            // The store keeps expiry in ticker nanos.
            ttl.toNanos();
            return ttl;
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime(getName());
        }
    }
}
