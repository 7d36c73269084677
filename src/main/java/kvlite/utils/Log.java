package kvlite.utils;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("KvLite");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
                String line = String.format("[%s] [%s] %s%n", levelStr, Thread.currentThread().getName(), record.getMessage());
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Accepts DEBUG, INFO, WARN or ERROR (case-insensitive).
     */
    public static void setLevel(String level) {
        logger.setLevel(toLevel(level));
    }

    public static Level toLevel(String level) {
        if (level == null) throw new IllegalArgumentException("log level must not be empty");
        switch (level.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG": return Level.FINE;
            case "INFO": return Level.INFO;
            case "WARN":
            case "WARNING": return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default: throw new IllegalArgumentException("unknown log level: " + level);
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
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

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
