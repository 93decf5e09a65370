package kvline.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One decoded input line: either a command with its arguments, or a protocol error
 * to report back without touching the store.
 */
public final class CommandLine {
    public static final String ERR_EMPTY = "empty command";
    public static final String ERR_TOO_LONG = "line too long";

    private final String command;
    private final List<String> args;
    private final String protocolError;

    private CommandLine(String command, List<String> args, String protocolError) {
        this.command = command;
        this.args = args;
        this.protocolError = protocolError;
    }

    /**
     * Splits on single spaces. Runs of spaces produce empty tokens, which keeps
     * the exact spacing of a multi-word SET value.
     */
    public static CommandLine parse(String line) {
        if (line.trim().isEmpty()) {
            return error(ERR_EMPTY);
        }
        String[] parts = line.split(" ", -1);
        List<String> args = Collections.unmodifiableList(Arrays.asList(parts).subList(1, parts.length));
        return new CommandLine(parts[0], args, null);
    }

    public static CommandLine error(String protocolError) {
        return new CommandLine(null, Collections.emptyList(), protocolError);
    }

    public boolean isProtocolError() {
        return protocolError != null;
    }

    public String getProtocolError() {
        return protocolError;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return isProtocolError() ? "<" + protocolError + ">" : command + " " + args;
    }
}
