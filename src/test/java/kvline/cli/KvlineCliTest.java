package kvline.cli;

import kvline.Config;
import kvline.commands.CommandDispatcher;
import kvline.db.KvStore;
import kvline.network.KvlineServer;
import kvline.network.ServerStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class KvlineCliTest {

    private KvStore store;
    private KvlineServer server;

    @BeforeEach
    public void setup() throws InterruptedException {
        Config config = new Config();
        config.bind = "127.0.0.1";
        config.port = 0;
        store = new KvStore();
        server = new KvlineServer(config, new CommandDispatcher(store), new ServerStats());
        server.start();
    }

    @AfterEach
    public void teardown() {
        server.close();
    }

    private String runSession(int port, String input, int expectedStatus) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        int status = new KvlineCli("127.0.0.1", port).run(new BufferedReader(new StringReader(input)), out);
        assertEquals(expectedStatus, status);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testSessionEchoesReplies() {
        String output = runSession(server.getPort(), "SET a hello world\nGET a\n\nINCR a\nExit\nGET a\n", 0);

        assertTrue(output.contains("Connected to Kvline"));
        assertTrue(output.contains("OK"));
        assertTrue(output.contains("\"hello world\""));
        assertTrue(output.contains("ERROR: value is not an integer or out of range"));
        assertTrue(output.contains("Exiting..."));
        assertEquals("hello world", store.get("a"));
    }

    @Test
    public void testExitIsNotSentToServer() {
        runSession(server.getPort(), "EXIT\n", 0);
        assertEquals(0, server.getStats().getTotalCommands());
    }

    @Test
    public void testEndOfInputEndsSession() {
        String output = runSession(server.getPort(), "SET k v\n", 0);
        assertTrue(output.contains("OK"));
        assertEquals("v", store.get("k"));
    }

    @Test
    public void testServerClosingTheConnection() {
        String output = runSession(server.getPort(), "QUIT\nGET k\n", 1);
        assertTrue(output.contains("OK"));
    }

    @Test
    public void testUnreachableServer() throws IOException {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        String output = runSession(port, "PING\n", 1);
        assertTrue(output.contains("Connection error"));
    }
}
