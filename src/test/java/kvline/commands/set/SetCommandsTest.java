package kvline.commands.set;

import kvline.commands.CommandDispatcher;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandsTest {

    private CommandDispatcher dispatcher;

    @BeforeEach
    public void setup() {
        dispatcher = new CommandDispatcher(new KvStore());
    }

    private String run(String command, String... args) {
        return dispatcher.handleCommand(command, args).toLine();
    }

    @Test
    public void testAddRemoveMembership() {
        assertEquals("(integer) 2", run("SADD", "s", "x", "y"));
        assertEquals("(integer) 0", run("SADD", "s", "x"));
        assertEquals("(integer) 1", run("SISMEMBER", "s", "x"));
        assertEquals("(integer) 1", run("SREM", "s", "x"));
        assertEquals("(integer) 0", run("SISMEMBER", "s", "x"));
        assertEquals("(integer) 1", run("SCARD", "s"));
    }

    @Test
    public void testMembersInAnyOrder() {
        run("SADD", "s", "a", "b", "c");
        Reply reply = dispatcher.handleCommand("SMEMBERS", "s");
        assertEquals(Reply.Type.ARRAY, reply.getType());
        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")), new HashSet<>(reply.getElements()));
    }

    @Test
    public void testMissingKey() {
        assertEquals("(nil)", run("SMEMBERS", "nope"));
        assertEquals("(integer) 0", run("SISMEMBER", "nope", "x"));
        assertEquals("(integer) 0", run("SREM", "nope", "x"));
        assertEquals("(integer) 0", run("SCARD", "nope"));
    }

    @Test
    public void testEmptiedSetIsGone() {
        run("SADD", "s", "only");
        assertEquals("1) \"only\"", run("SMEMBERS", "s"));
        assertEquals("(integer) 1", run("SREM", "s", "only"));
        assertEquals("(nil)", run("SMEMBERS", "s"));
        assertEquals("none", run("TYPE", "s"));
    }

    @Test
    public void testNoMembers() {
        assertEquals("(integer) 0", run("SADD", "s"));
        assertEquals("(integer) 0", run("EXISTS", "s"));
        assertEquals("(integer) 0", run("SREM", "s"));
    }

    @Test
    public void testSIsMemberOnOtherKinds() {
        run("SET", "str", "x");
        assertEquals("(integer) 0", run("SISMEMBER", "str", "x"));
        assertEquals("ERROR: WRONGTYPE Operation against a key holding the wrong kind of value", run("SADD", "str", "x"));
    }
}
