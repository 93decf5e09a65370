package kvline.db;

import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KvStorePropertyTest {

    @Property
    void incrementsSumAlgebraically(@ForAll @Size(max = 50) List<@IntRange(min = -1_000_000, max = 1_000_000) Integer> deltas) {
        KvStore store = new KvStore();
        long expected = 0;
        for (int d : deltas) {
            if (d >= 0) store.incrBy("k", d);
            else store.decrBy("k", -d);
            expected += d;
        }
        String stored = store.get("k");
        assertEquals(deltas.isEmpty() ? null : String.valueOf(expected), stored);
    }

    @Property
    void lrangeReturnsTheResolvedSubList(
            @ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 5) String> values,
            @ForAll @IntRange(min = -25, max = 25) int start,
            @ForAll @IntRange(min = -25, max = 25) int end) {
        KvStore store = new KvStore();
        store.rpush("l", values);

        int size = values.size();
        int s = start < 0 ? Math.max(start + size, 0) : start;
        int e = end < 0 ? end + size : Math.min(end, size - 1);
        List<String> expected = (s <= e && s < size) ? values.subList(s, e + 1) : Collections.emptyList();

        assertEquals(expected, store.lrange("l", start, end));
    }

    @Property
    void pushThenPopDrainsInOrder(@ForAll @Size(min = 1, max = 30) List<@AlphaChars @StringLength(min = 1, max = 5) String> values) {
        KvStore store = new KvStore();
        store.rpush("q", values);
        for (String v : values) {
            assertEquals(v, store.lpop("q"));
        }
        assertNull(store.lpop("q"));
        assertEquals(0, store.size());
    }
}
