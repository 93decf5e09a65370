package kvline.db;

/**
 * Raised by {@link KvStore} when a command cannot be applied to the current value.
 * The store is left unchanged whenever one is thrown.
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        WRONGTYPE,
        NOT_AN_INTEGER
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static StoreException wrongType() {
        return new StoreException(Kind.WRONGTYPE, "WRONGTYPE Operation against a key holding the wrong kind of value");
    }

    public static StoreException notAnInteger() {
        return new StoreException(Kind.NOT_AN_INTEGER, "value is not an integer or out of range");
    }
}
