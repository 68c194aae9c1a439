package io.slotkv.server.command;

/**
 * Command-level failure reported to the client as {@code -ERR <message>}.
 * The connection stays open.
 */
public class CommandException extends RuntimeException {

    public static final String NOT_INTEGER = "value is not an integer or out of range";
    public static final String SYNTAX = "syntax error";

    public CommandException(String message) {
        super(message);
    }

    public static CommandException wrongArity(String commandName) {
        return new CommandException("wrong number of arguments for '" + commandName.toLowerCase() + "' command");
    }
}
