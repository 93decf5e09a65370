package kvline;

import kvline.commands.CommandDispatcher;
import kvline.db.KvStore;
import kvline.network.KvlineServer;
import kvline.network.ServerStats;
import kvline.utils.Log;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Server entry point: {@code Kvline [config-file]}.
 */
public class Kvline {

    public static final String VERSION = "0.1.0";

    public static void printBanner() {
        Log.info("\n" +
                " _             _ _            \n" +
                "| | ____   __ | (_)_ __   ___ \n" +
                "| |/ /\\ \\ / / | | | '_ \\ / _ \\\n" +
                "|   <  \\ V /  | | | | | |  __/\n" +
                "|_|\\_\\  \\_/   |_|_|_| |_|\\___|\n" +
                "                              \n" +
                " :: Kvline ::       (v" + VERSION + ") \n" +
                " :: Engine ::       Java \n");
    }

    public static void main(String[] args) throws Exception {
        Config config;
        try {
            config = Config.load(args.length > 0 ? args[0] : Config.DEFAULT_FILE);
        } catch (RuntimeException e) {
            Log.error("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        Log.setLevel(config.logLevel);

        KvStore store = new KvStore();
        ServerStats stats = new ServerStats();
        CommandDispatcher dispatcher = new CommandDispatcher(store);
        KvlineServer server = new KvlineServer(config, dispatcher, stats);

        printBanner();

        try {
            server.start();
        } catch (IllegalStateException e) {
            Log.error(e.getMessage());
            System.exit(1);
            return;
        }

        ScheduledExecutorService monitor = startMonitor(config, store, stats);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            if (monitor != null) monitor.shutdownNow();
            server.close();
        }));

        server.awaitTermination();
    }

    private static ScheduledExecutorService startMonitor(Config config, KvStore store, ServerStats stats) {
        if (config.statsIntervalSeconds == 0) return null;

        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Monitor");
            t.setDaemon(true);
            return t;
        });
        final long[] lastCount = { 0 };
        final int interval = config.statsIntervalSeconds;
        monitor.scheduleAtFixedRate(() -> {
            long currentCount = stats.getTotalCommands();
            long ops = (currentCount - lastCount[0]) / interval;
            lastCount[0] = currentCount;

            if (ops > 0 || stats.getActiveConnections() > 0) {
                Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s",
                        stats.getActiveConnections(), store.size(), ops));
            }
        }, interval, interval, TimeUnit.SECONDS);
        return monitor;
    }
}
