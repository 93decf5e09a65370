package kvline.commands;

import kvline.db.StoreException;
import java.util.List;

/** Argument helpers shared by the command classes. */
public final class Args {

    private Args() {
    }

    public static long parseLong(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw StoreException.notAnInteger();
        }
    }

    /** Joins {@code args[from..]} with single spaces, so multi-word values survive the line split. */
    public static String joinFrom(List<String> args, int from) {
        return String.join(" ", args.subList(from, args.size()));
    }

    public static List<String> tail(List<String> args, int from) {
        return args.subList(from, args.size());
    }
}
