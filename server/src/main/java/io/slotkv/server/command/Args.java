package io.slotkv.server.command;

import io.slotkv.core.Bytes;

/** Argument parsing helpers shared by the command families. */
final class Args {

    private Args() {
    }

    static long parseLong(Bytes raw) {
        String s = raw.utf8();
        if (s.isEmpty() || s.length() > 20 || s.charAt(0) == '+') {
            throw new CommandException(CommandException.NOT_INTEGER);
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new CommandException(CommandException.NOT_INTEGER);
        }
    }

    /** Expiry argument: must parse and be strictly positive. */
    static long parseExpire(Bytes raw, String commandName) {
        long v = parseLong(raw);
        if (v <= 0) throw invalidExpire(commandName);
        return v;
    }

    /** Absolute deadline from a relative amount in the given unit, guarding overflow. */
    static long deadline(long nowMillis, long amount, long unitMillis, String commandName) {
        try {
            return Math.addExact(nowMillis, Math.multiplyExact(amount, unitMillis));
        } catch (ArithmeticException e) {
            throw invalidExpire(commandName);
        }
    }

    static CommandException invalidExpire(String commandName) {
        return new CommandException("invalid expire time in '" + commandName.toLowerCase() + "' command");
    }
}
