package kvline.network;

import kvline.Config;
import kvline.cli.LineConnection;
import kvline.commands.CommandDispatcher;
import kvline.db.KvStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class KvlineServerTest {

    private KvStore store;
    private KvlineServer server;

    private static Config localConfig(int port) {
        Config config = new Config();
        config.bind = "127.0.0.1";
        config.port = port;
        return config;
    }

    @BeforeEach
    public void setup() throws InterruptedException {
        store = new KvStore();
        server = new KvlineServer(localConfig(0), new CommandDispatcher(store), new ServerStats());
        server.start();
    }

    @AfterEach
    public void teardown() {
        server.close();
    }

    @Test
    public void testRoundTrip() throws IOException {
        try (LineConnection conn = new LineConnection("127.0.0.1", server.getPort())) {
            assertEquals("OK", conn.execute("SET greeting hello  world"));
            assertEquals("\"hello  world\"", conn.execute("GET greeting"));
            assertEquals("(integer) 3", conn.execute("RPUSH l a b c"));
            assertEquals("1) \"b\" 2) \"c\"", conn.execute("LRANGE l -2 -1"));
            assertEquals("ERROR: empty command", conn.execute(""));
            assertEquals("ERROR: unknown command 'NOPE'", conn.execute("nope"));
        }
    }

    @Test
    public void testStoreIsSharedAcrossConnections() throws IOException {
        try (LineConnection a = new LineConnection("127.0.0.1", server.getPort());
             LineConnection b = new LineConnection("127.0.0.1", server.getPort())) {
            a.execute("SADD s x");
            assertEquals("(integer) 1", b.execute("SISMEMBER s x"));
        }
    }

    @Test
    public void testConcurrentClientsIncrement() throws Exception {
        int clients = 10;
        int perClient = 200;
        ExecutorService es = Executors.newFixedThreadPool(clients);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger(0);

        for (int i = 0; i < clients; i++) {
            es.submit(() -> {
                try (LineConnection conn = new LineConnection("127.0.0.1", server.getPort())) {
                    latch.await();
                    for (int j = 0; j < perClient; j++) {
                        if (!conn.execute("INCR hits").startsWith("(integer) ")) failures.incrementAndGet();
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                }
            });
        }

        latch.countDown();
        es.shutdown();
        assertTrue(es.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(0, failures.get());
        assertEquals(String.valueOf(clients * perClient), store.get("hits"));
        assertTrue(server.getStats().getTotalCommands() >= clients * perClient);
    }

    @Test
    public void testQuitEndsTheSession() throws IOException {
        try (LineConnection conn = new LineConnection("127.0.0.1", server.getPort())) {
            assertEquals("OK", conn.execute("QUIT"));
            assertThrows(IOException.class, () -> conn.execute("PING"));
        }
    }

    @Test
    public void testBindFailure() {
        KvlineServer second = new KvlineServer(localConfig(server.getPort()), new CommandDispatcher(new KvStore()), new ServerStats());
        try {
            assertThrows(IllegalStateException.class, second::start);
        } finally {
            second.close();
        }
    }
}
