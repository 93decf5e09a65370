package kvline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @TempDir
    Path dir;

    private static final Map<String, String> NO_ENV = Collections.emptyMap();

    private Path write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    @Test
    public void testMissingFileUsesDefaults() {
        Config config = Config.load(dir.resolve("nope.yaml").toString(), NO_ENV);
        assertEquals(6379, config.port);
        assertEquals("0.0.0.0", config.bind);
        assertEquals(65536, config.maxLineLength);
        assertEquals("INFO", config.logLevel);
    }

    @Test
    public void testYamlFile() throws IOException {
        Path p = write("kvline.yaml",
                "port: 7001\n" +
                "bind: 127.0.0.1\n" +
                "maxLineLength: 128\n" +
                "logLevel: DEBUG\n" +
                "somethingElse: ignored\n");

        Config config = Config.load(p.toString(), NO_ENV);
        assertEquals(7001, config.port);
        assertEquals("127.0.0.1", config.bind);
        assertEquals(128, config.maxLineLength);
        assertEquals("DEBUG", config.logLevel);
        assertEquals(5, config.statsIntervalSeconds);
    }

    @Test
    public void testLegacyFormat() throws IOException {
        Path p = write("legacy.conf",
                "# legacy style\n" +
                "port 7002\n" +
                "max-line-length 256\n" +
                "stats-interval-seconds 0\n");

        Config config = Config.load(p.toString(), NO_ENV);
        assertEquals(7002, config.port);
        assertEquals(256, config.maxLineLength);
        assertEquals(0, config.statsIntervalSeconds);
    }

    @Test
    public void testConfSiblingOfMissingYaml() throws IOException {
        write("server.conf", "port 7003\n");
        Config config = Config.load(dir.resolve("server.yaml").toString(), NO_ENV);
        assertEquals(7003, config.port);
    }

    @Test
    public void testEnvironmentOverrides() throws IOException {
        Path p = write("kvline.yaml", "port: 7001\n");
        Map<String, String> env = new HashMap<>();
        env.put("KVLINE_PORT", "7100");
        env.put("KVLINE_BIND", "127.0.0.1");

        Config config = Config.load(p.toString(), env);
        assertEquals(7100, config.port);
        assertEquals("127.0.0.1", config.bind);
    }

    @Test
    public void testInvalidValuesAreRejected() throws IOException {
        Path badPort = write("bad-port.yaml", "port: 70000\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(badPort.toString(), NO_ENV));

        Path badLength = write("bad-length.yaml", "maxLineLength: 0\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(badLength.toString(), NO_ENV));

        Path badLevel = write("bad-level.yaml", "logLevel: LOUD\n");
        assertThrows(IllegalArgumentException.class, () -> Config.load(badLevel.toString(), NO_ENV));

        Map<String, String> env = Collections.singletonMap("KVLINE_PORT", "abc");
        assertThrows(IllegalArgumentException.class, () -> Config.load(dir.resolve("none.yaml").toString(), env));
    }
}
