package agents.spanner.services;

import agents.spanner.Driver;
import io.vertx.core.Vertx;

/**
 * Helpers that format log entries for the {@link Logger} and gate them on {@link Driver#logLevel}.
 */
public class LogUtil {

    // Log levels matching the Driver.logLevel
    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;
    public static final int DATA = 4;

    private LogUtil() {
    }

    public static void logError(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, ERROR, message, component, operation, category);
    }

    /**
     * Log an error with exception details; the stack trace follows at debug level
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation, String category) {
        publish(vertx, ERROR, message + ": " + throwable.getMessage(), component, operation, category);

        if (Driver.logLevel >= DEBUG) {
            StringBuilder stackTrace = new StringBuilder();
            for (StackTraceElement element : throwable.getStackTrace()) {
                stackTrace.append("  at ").append(element).append("\n");
            }
            publish(vertx, DEBUG, "Stack trace: " + stackTrace, component, operation, category);
        }
    }

    public static void logInfo(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, INFO, message, component, operation, category);
    }

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, DETAIL, message, component, operation, category);
    }

    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, DEBUG, message, component, operation, category);
    }

    public static void logData(Vertx vertx, String message, String component, String operation, String category) {
        publish(vertx, DATA, message, component, operation, category);
    }

    private static void publish(Vertx vertx, int level, String message, String component, String operation, String category) {
        if (vertx != null && Driver.logLevel >= level) {
            vertx.eventBus().publish("log", formatLogMessage(message, level, component, operation, category));
        }
    }

    /**
     * Format log message for event bus
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        // Commas would shift the CSV columns
        String cleanMessage = message.replace(",", ";").replace("\n", " | ");
        return cleanMessage + "," + level + "," + component + "," + operation + "," + category;
    }
}
