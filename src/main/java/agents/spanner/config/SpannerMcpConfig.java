package agents.spanner.config;

import io.vertx.core.json.JsonObject;

/**
 * Runtime settings for the Spanner MCP server.
 *
 * Values are read from system properties first (populated from .env.local by the Driver)
 * and then from OS environment variables.
 */
public class SpannerMcpConfig {

    public static final String HTTP_PORT = "MCP_HTTP_PORT";
    public static final String LOG_LEVEL = "LOG_LEVEL";
    public static final String DATA_PATH = "DATA_PATH";
    public static final String EMULATOR_HOST = "SPANNER_EMULATOR_HOST";
    public static final String INCLUDE_CHILD_LINKS = "PLAN_INCLUDE_CHILD_LINKS";

    private final int httpPort;
    private final int logLevel;
    private final String dataPath;
    private final String emulatorHost;
    private final boolean includeChildLinks;

    public SpannerMcpConfig(int httpPort, int logLevel, String dataPath,
                            String emulatorHost, boolean includeChildLinks) {
        this.httpPort = httpPort;
        this.logLevel = logLevel;
        this.dataPath = dataPath;
        this.emulatorHost = emulatorHost;
        this.includeChildLinks = includeChildLinks;
    }

    /**
     * Load configuration from system properties and environment variables
     */
    public static SpannerMcpConfig load() {
        int port = getIntSetting(HTTP_PORT, 8080);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(
                "Invalid " + HTTP_PORT + " value: '" + port + "'. Must be a valid port number.");
        }

        int level = getIntSetting(LOG_LEVEL, 3);
        if (level < 0 || level > 4) {
            throw new IllegalArgumentException(
                "Invalid " + LOG_LEVEL + " value: '" + level + "'. Must be between 0 (errors) and 4 (data).");
        }

        return new SpannerMcpConfig(
            port,
            level,
            getSetting(DATA_PATH, "./data"),
            getSetting(EMULATOR_HOST, null),
            Boolean.parseBoolean(getSetting(INCLUDE_CHILD_LINKS, "false"))
        );
    }

    /**
     * Get a setting, checking System.getProperty() (from dotenv) before System.getenv()
     */
    static String getSetting(String key, String defaultValue) {
        String value = System.getProperty(key);

        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }

        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    static int getIntSetting(String key, int defaultValue) {
        String value = getSetting(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid " + key + " value: '" + value + "'. Must be an integer.", e);
        }
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public String getDataPath() {
        return dataPath;
    }

    /**
     * Emulator host:port, or null when connecting to the real service
     */
    public String getEmulatorHost() {
        return emulatorHost;
    }

    public boolean isIncludeChildLinks() {
        return includeChildLinks;
    }

    public JsonObject toJsonObject() {
        return new JsonObject()
            .put("httpPort", httpPort)
            .put("logLevel", logLevel)
            .put("dataPath", dataPath)
            .put("emulatorHost", emulatorHost)
            .put("includeChildLinks", includeChildLinks);
    }
}
