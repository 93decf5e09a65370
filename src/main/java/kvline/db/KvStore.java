package kvline.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory keyspace holding strings, lists and sets.
 *
 * <p>Every key lives in exactly one namespace, recorded by its {@link DataType}.
 * Commands that hit a key of another kind throw {@link StoreException} with
 * {@link StoreException.Kind#WRONGTYPE}. Lists and sets are never kept empty:
 * removing the last element deletes the key.
 *
 * <p>One read/write lock guards the whole keyspace. Reads share the read lock,
 * every mutation takes the write lock for its full read-modify-write.
 */
public class KvStore {

    private final Map<String, ValueEntry> keyspace = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // --- STRINGS ---

    public void set(String key, String value) {
        lock.writeLock().lock();
        try {
            keyspace.put(key, ValueEntry.ofString(value));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns the string at {@code key}, or {@code null} if the key does not exist. */
    public String get(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            return entry == null ? null : entry.asString();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long incr(String key) {
        return incrBy(key, 1);
    }

    public long decr(String key) {
        return incrBy(key, -1);
    }

    public long decrBy(String key, long decrement) {
        if (decrement == Long.MIN_VALUE) {
            throw StoreException.notAnInteger();
        }
        return incrBy(key, -decrement);
    }

    /**
     * Adds {@code delta} to the integer stored at {@code key}, treating a missing key as 0.
     * The read and the write happen under one write lock.
     */
    public long incrBy(String key, long delta) {
        lock.writeLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            long current = 0;
            if (entry != null) {
                current = parseLong(entry.asString());
            }
            long next;
            try {
                next = Math.addExact(current, delta);
            } catch (ArithmeticException e) {
                throw StoreException.notAnInteger();
            }
            keyspace.put(key, ValueEntry.ofString(Long.toString(next)));
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- GENERIC ---

    /** Removes every listed key that exists, whatever its kind, and returns how many were removed. */
    public int delete(String... keys) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String key : keys) {
                if (keyspace.remove(key) != null) removed++;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean delete(String key) {
        return delete(new String[] { key }) == 1;
    }

    public int exists(String... keys) {
        lock.readLock().lock();
        try {
            int count = 0;
            for (String key : keys) {
                if (keyspace.containsKey(key)) count++;
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public DataType type(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            return entry == null ? null : entry.type;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return keyspace.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void flushAll() {
        lock.writeLock().lock();
        try {
            keyspace.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- LISTS ---

    /**
     * Prepends {@code values} keeping their given order, so pushing [a, b, c]
     * onto an empty key gives a, b, c. Returns the new length.
     */
    public int lpush(String key, List<String> values) {
        lock.writeLock().lock();
        try {
            Deque<String> list = listForWrite(key, values.isEmpty());
            if (list == null) return 0;
            for (int i = values.size() - 1; i >= 0; i--) {
                list.addFirst(values.get(i));
            }
            return list.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int rpush(String key, List<String> values) {
        lock.writeLock().lock();
        try {
            Deque<String> list = listForWrite(key, values.isEmpty());
            if (list == null) return 0;
            for (String value : values) {
                list.addLast(value);
            }
            return list.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String lpop(String key) {
        return pop(key, true);
    }

    public String rpop(String key) {
        return pop(key, false);
    }

    public int llen(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            return entry == null ? 0 : entry.asList().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the inclusive range {@code [start, end]} of the list at {@code key}.
     * Negative indices count from the tail. Out-of-range bounds are clamped, and an
     * inverted range yields an empty list. Returns {@code null} if the key does not exist.
     */
    public List<String> lrange(String key, long start, long end) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            if (entry == null) return null;
            Deque<String> list = entry.asList();
            long size = list.size();

            if (start < 0) start += size;
            if (end < 0) end += size;
            if (start < 0) start = 0;
            if (end > size - 1) end = size - 1;
            if (start > end || start >= size) return Collections.emptyList();

            List<String> sub = new ArrayList<>((int) (end - start + 1));
            Iterator<String> it = list.iterator();
            long idx = 0;
            while (it.hasNext() && idx <= end) {
                String s = it.next();
                if (idx >= start) sub.add(s);
                idx++;
            }
            return sub;
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- SETS ---

    /** Adds the members that are not yet present and returns how many were added. */
    public int sadd(String key, List<String> members) {
        lock.writeLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            if (entry == null) {
                if (members.isEmpty()) return 0;
                entry = ValueEntry.newSet();
                keyspace.put(key, entry);
            }
            Set<String> set = entry.asSet();
            int added = 0;
            for (String member : members) {
                if (set.add(member)) added++;
            }
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int srem(String key, List<String> members) {
        lock.writeLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            if (entry == null) return 0;
            Set<String> set = entry.asSet();
            int removed = 0;
            for (String member : members) {
                if (set.remove(member)) removed++;
            }
            if (set.isEmpty()) keyspace.remove(key);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** False when the key is missing or does not hold a set. */
    public boolean sismember(String key, String member) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            if (entry == null || entry.type != DataType.SET) return false;
            return entry.asSet().contains(member);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** A snapshot of the members in no particular order, or {@code null} if the key does not exist. */
    public Set<String> smembers(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            return entry == null ? null : new HashSet<>(entry.asSet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int scard(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            return entry == null ? 0 : entry.asSet().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- HELPERS (caller holds the write lock) ---

    private Deque<String> listForWrite(String key, boolean readOnly) {
        ValueEntry entry = keyspace.get(key);
        if (entry != null) return entry.asList();
        if (readOnly) return null;
        entry = ValueEntry.newList();
        keyspace.put(key, entry);
        return entry.asList();
    }

    private String pop(String key, boolean head) {
        lock.writeLock().lock();
        try {
            ValueEntry entry = keyspace.get(key);
            if (entry == null) return null;
            Deque<String> list = entry.asList();
            String val = head ? list.pollFirst() : list.pollLast();
            if (list.isEmpty()) keyspace.remove(key);
            return val;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw StoreException.notAnInteger();
        }
    }
}
