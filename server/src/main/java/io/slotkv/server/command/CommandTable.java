package io.slotkv.server.command;

import io.slotkv.server.command.CommandSpec.Flag;
import io.slotkv.server.command.CommandSpec.Rewriter;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name -> {@link CommandSpec} registry, filled by the command families at startup.
 */
public final class CommandTable {

    private final Map<String, CommandSpec> specs = new TreeMap<>();

    /** Register a keyless command. */
    public void register(String name, int arity, CommandHandler handler, Flag... flags) {
        add(new CommandSpec(name, arity, flagSet(flags), -1, -1, 0, handler, null));
    }

    /** Register a command whose single key is the first argument. */
    public void registerKeyed(String name, int arity, CommandHandler handler, Flag... flags) {
        add(new CommandSpec(name, arity, flagSet(flags), 0, 0, 1, handler, null));
    }

    /** Register a command whose arguments are all keys. */
    public void registerMultiKey(String name, int arity, CommandHandler handler, Flag... flags) {
        add(new CommandSpec(name, arity, flagSet(flags), 0, -1, 1, handler, null));
    }

    /** Register a single-key command that is rewritten before execution and replication. */
    public void registerRewritten(String name, int arity, CommandHandler handler, Rewriter rewriter, Flag... flags) {
        add(new CommandSpec(name, arity, flagSet(flags), 0, 0, 1, handler, rewriter));
    }

    public void add(CommandSpec spec) {
        if (specs.putIfAbsent(spec.name(), spec) != null) {
            throw new IllegalStateException("duplicate command " + spec.name());
        }
    }

    /** @return the command definition, or null for unknown commands */
    public CommandSpec lookup(String upperCaseName) {
        return specs.get(upperCaseName);
    }

    public Collection<CommandSpec> all() {
        return specs.values();
    }

    private static EnumSet<Flag> flagSet(Flag... flags) {
        EnumSet<Flag> set = EnumSet.noneOf(Flag.class);
        set.addAll(Arrays.asList(flags));
        return set;
    }
}
