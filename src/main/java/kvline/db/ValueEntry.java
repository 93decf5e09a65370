package kvline.db;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * One slot of the keyspace: a value tagged with the kind of data it holds.
 * Not thread-safe on its own, callers hold the store lock.
 */
public class ValueEntry {
    public final DataType type;
    private final Object value;

    public ValueEntry(Object value, DataType type) {
        this.value = value;
        this.type = type;
    }

    public static ValueEntry ofString(String s) {
        return new ValueEntry(s, DataType.STRING);
    }

    public static ValueEntry newList() {
        return new ValueEntry(new ArrayDeque<String>(), DataType.LIST);
    }

    public static ValueEntry newSet() {
        return new ValueEntry(new HashSet<String>(), DataType.SET);
    }

    public String asString() {
        expect(DataType.STRING);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public Deque<String> asList() {
        expect(DataType.LIST);
        return (Deque<String>) value;
    }

    @SuppressWarnings("unchecked")
    public Set<String> asSet() {
        expect(DataType.SET);
        return (Set<String>) value;
    }

    private void expect(DataType expected) {
        if (type != expected) {
            throw StoreException.wrongType();
        }
    }
}
