package kvline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import kvline.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Map;

public class Config {
    public static final String DEFAULT_FILE = "kvline.yaml";

    public int port = 6379;
    public String bind = "0.0.0.0";
    public int workerThreads = 0; // 0 = Netty default
    public int maxLineLength = 65536;
    public String logLevel = "INFO";
    public int statsIntervalSeconds = 5;

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    /**
     * Reads {@code filename} as YAML, falling back to the legacy {@code key value} format,
     * then applies {@code KVLINE_*} overrides from {@code env} and validates the result.
     */
    public static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists() && filename.endsWith(".yaml")) {
            File confFile = new File(filename.substring(0, filename.length() - ".yaml".length()) + ".conf");
            if (confFile.exists()) f = confFile;
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                Config parsed = mapper.readValue(f, Config.class);
                if (parsed != null) config = parsed;
                Log.info("Loaded config from " + f.getPath());
            } catch (IOException e) {
                Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
                config = loadLegacy(f, new Config());
            }
        }

        if (env.get("KVLINE_PORT") != null) {
            config.port = parseInt("KVLINE_PORT", env.get("KVLINE_PORT"));
        }
        if (env.get("KVLINE_BIND") != null) {
            config.bind = env.get("KVLINE_BIND");
        }

        config.validate();
        return config;
    }

    static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0].replace("-", "").toLowerCase(Locale.ROOT);
                String val = parts[1].trim();

                switch (key) {
                    case "port": config.port = parseInt(parts[0], val); break;
                    case "bind": config.bind = val; break;
                    case "workerthreads": config.workerThreads = parseInt(parts[0], val); break;
                    case "maxlinelength": config.maxLineLength = parseInt(parts[0], val); break;
                    case "loglevel": config.logLevel = val; break;
                    case "statsintervalseconds": config.statsIntervalSeconds = parseInt(parts[0], val); break;
                    default: Log.warn("Ignoring unknown config key: " + parts[0]);
                }
            }
            Log.info("Loaded legacy config from " + f.getPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config file " + f.getPath(), e);
        }
        return config;
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must not be negative: " + workerThreads);
        }
        if (statsIntervalSeconds < 0) {
            throw new IllegalArgumentException("statsIntervalSeconds must not be negative: " + statsIntervalSeconds);
        }
        if (bind == null || bind.isEmpty()) {
            throw new IllegalArgumentException("bind address must be set");
        }
        if (logLevel == null) {
            throw new IllegalArgumentException("logLevel must be set");
        }
        switch (logLevel.toUpperCase(Locale.ROOT)) {
            case "DEBUG": case "INFO": case "WARN": case "ERROR": break;
            default: throw new IllegalArgumentException("Unknown logLevel: " + logLevel);
        }
    }

    private static int parseInt(String name, String val) {
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + val, e);
        }
    }
}
