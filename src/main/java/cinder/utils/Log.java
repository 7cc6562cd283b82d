package cinder.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Cinder");
    private static final ConsoleHandler handler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";

                if (record.getThrown() != null) {
                    StringWriter sw = new StringWriter();
                    record.getThrown().printStackTrace(new PrintWriter(sw));
                    return String.format("[%s] [%s] %s%n%s", levelStr, Thread.currentThread().getName(), record.getMessage(), sw);
                }
                return String.format("[%s] [%s] %s%n", levelStr, Thread.currentThread().getName(), record.getMessage());
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Accepts ERROR, WARN, INFO or DEBUG. Unknown names leave the level unchanged.
     */
    public static void setLevel(String name) {
        if (name == null) return;
        switch (name.trim().toUpperCase()) {
            case "ERROR": logger.setLevel(Level.SEVERE); break;
            case "WARN": logger.setLevel(Level.WARNING); break;
            case "INFO": logger.setLevel(Level.INFO); break;
            case "DEBUG": logger.setLevel(Level.FINE); break;
            default: warn("Unknown log level '" + name + "', keeping " + logger.getLevel());
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
