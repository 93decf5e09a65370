package kvline.utils;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Kvline");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";

                return String.format("[%s] %s%n", levelStr, record.getMessage());
            }
        });
        logger.addHandler(handler);
        setLevel("INFO");
    }

    /** Accepts DEBUG, INFO, WARN or ERROR, case-insensitive. */
    public static void setLevel(String name) {
        Level level;
        switch (name.toUpperCase(Locale.ROOT)) {
            case "DEBUG": level = Level.FINE; break;
            case "INFO": level = Level.INFO; break;
            case "WARN": level = Level.WARNING; break;
            case "ERROR": level = Level.SEVERE; break;
            default: throw new IllegalArgumentException("Unknown log level: " + name);
        }
        logger.setLevel(level);
        handler.setLevel(level);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
