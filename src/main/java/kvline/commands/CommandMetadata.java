package kvline.commands;

import java.util.Collections;
import java.util.Set;

public class CommandMetadata {
    public static final String FLAG_WRITE = "write";
    public static final String FLAG_READONLY = "readonly";

    private final int arity;
    private final Set<String> flags;

    public CommandMetadata(int arity, Set<String> flags) {
        this.arity = arity;
        this.flags = flags != null ? flags : Collections.emptySet();
    }

    /** Minimum number of arguments after the command name. */
    public int getArity() {
        return arity;
    }

    public Set<String> getFlags() {
        return flags;
    }

    public boolean isWrite() {
        return flags.contains(FLAG_WRITE);
    }
}
