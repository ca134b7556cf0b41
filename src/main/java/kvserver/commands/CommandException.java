package kvserver.commands;

import java.util.Locale;

/**
 * A request that was framed correctly but cannot be executed. Reported to
 * the client as an error reply; the connection stays usable.
 */
public final class CommandException extends Exception {
    private static final long serialVersionUID = -2206937717436553810L;

    CommandException(final String message) {
        super(message);
    }

    static CommandException unknownCommand(final String name) {
        return new CommandException("unknown command '" + name + "'");
    }

    static CommandException wrongArity(final String name) {
        return new CommandException("wrong number of arguments for '"
                + name.toLowerCase(Locale.ROOT) + "' command");
    }

    static CommandException notAnInteger() {
        return new CommandException(
                "value is not an integer or out of range");
    }

    static CommandException unsupportedOption(final String option) {
        return new CommandException("unsupported option '" + option + "'");
    }

    static CommandException invalidExpireTime(final String name) {
        return new CommandException("invalid expire time in '"
                + name.toLowerCase(Locale.ROOT) + "' command");
    }
}
