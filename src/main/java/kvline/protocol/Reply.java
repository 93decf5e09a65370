package kvline.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single response line.
 *
 * <p>Rendering rules, shared by every command:
 * <pre>
 *   status   OK
 *   bulk     "value"
 *   integer  (integer) 42
 *   nil      (nil)
 *   array    1) "a" 2) "b"      or (empty list or set)
 *   error    ERROR: message
 * </pre>
 */
public final class Reply {

    public enum Type {
        STATUS,
        BULK,
        INTEGER,
        NIL,
        ARRAY,
        ERROR
    }

    public static final String NIL_TEXT = "(nil)";
    public static final String EMPTY_TEXT = "(empty list or set)";
    public static final String ERROR_PREFIX = "ERROR: ";

    private static final Reply OK = new Reply(Type.STATUS, "OK", 0, null);
    private static final Reply NIL = new Reply(Type.NIL, null, 0, null);

    private final Type type;
    private final String text;
    private final long number;
    private final List<String> elements;

    private Reply(Type type, String text, long number, List<String> elements) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.elements = elements;
    }

    // --- FACTORIES ---

    public static Reply ok() {
        return OK;
    }

    public static Reply status(String s) {
        return new Reply(Type.STATUS, s, 0, null);
    }

    /** A quoted value, or nil when {@code s} is null. */
    public static Reply bulkString(String s) {
        if (s == null) return NIL;
        return new Reply(Type.BULK, s, 0, null);
    }

    public static Reply integer(long i) {
        return new Reply(Type.INTEGER, null, i, null);
    }

    public static Reply nil() {
        return NIL;
    }

    /** A multi-element reply, or nil when {@code items} is null. */
    public static Reply array(Collection<String> items) {
        if (items == null) return NIL;
        return new Reply(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Reply error(String msg) {
        return new Reply(Type.ERROR, msg, 0, null);
    }

    // --- ACCESSORS ---

    public Type getType() {
        return type;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public long getNumber() {
        return number;
    }

    public List<String> getElements() {
        return elements == null ? Collections.emptyList() : elements;
    }

    /** The wire form, without the trailing newline. */
    public String toLine() {
        switch (type) {
            case STATUS:
                return text;
            case BULK:
                return "\"" + text + "\"";
            case INTEGER:
                return "(integer) " + number;
            case NIL:
                return NIL_TEXT;
            case ARRAY:
                if (elements.isEmpty()) return EMPTY_TEXT;
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(i + 1).append(") \"").append(elements.get(i)).append('"');
                }
                return sb.toString();
            case ERROR:
                return ERROR_PREFIX + text;
            default:
                throw new IllegalStateException("Unhandled reply type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reply)) return false;
        Reply other = (Reply) o;
        return type == other.type && number == other.number
                && Objects.equals(text, other.text) && Objects.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number, elements);
    }

    @Override
    public String toString() {
        return toLine();
    }
}
