package agents.spanner.mcp.servers;

import agents.spanner.services.SpannerClientManager;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

import static agents.spanner.mcp.base.MCPTool.stringProperty;

/**
 * The project / instance / database triple every Spanner tool takes, plus the argument
 * decoding helpers shared by the tool servers.
 *
 * Decoding failures are reported as {@link IllegalArgumentException} and answered with
 * INVALID_PARAMS before any Spanner call is made.
 */
public class DatabaseArguments {

    private final String project;
    private final String instance;
    private final String database;

    public DatabaseArguments(String project, String instance, String database) {
        this.project = project;
        this.instance = instance;
        this.database = database;
    }

    public static DatabaseArguments fromJson(JsonObject arguments) {
        return new DatabaseArguments(
            requireString(arguments, "project"),
            requireString(arguments, "instance"),
            requireString(arguments, "database")
        );
    }

    /**
     * Schema properties for the three database arguments, to be extended by each tool
     */
    public static JsonObject schemaProperties() {
        return new JsonObject()
            .put("project", stringProperty("Google Cloud project"))
            .put("instance", stringProperty("Spanner instance id"))
            .put("database", stringProperty("Spanner database id"));
    }

    public static JsonArray requiredNames(String... extra) {
        JsonArray required = new JsonArray().add("project").add("instance").add("database");
        for (String name : extra) {
            required.add(name);
        }
        return required;
    }

    public static String requireString(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a non-empty string");
        }
        return (String) value;
    }

    public static List<String> requireStringList(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (!(value instanceof JsonArray) || ((JsonArray) value).isEmpty()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a non-empty array of strings");
        }
        JsonArray array = (JsonArray) value;
        List<String> strings = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.getValue(i);
            if (!(item instanceof String)) {
                throw new IllegalArgumentException("Argument '" + name + "' item " + i + " is not a string");
            }
            strings.add((String) item);
        }
        return strings;
    }

    public static boolean optionalBoolean(JsonObject arguments, String name, boolean defaultValue) {
        Object value = arguments.getValue(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
        }
        return (Boolean) value;
    }

    public String getProject() {
        return project;
    }

    public String getInstance() {
        return instance;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * projects/&lt;project&gt;/instances/&lt;instance&gt;/databases/&lt;database&gt;
     */
    public String path() {
        return SpannerClientManager.databasePath(project, instance, database);
    }

    @Override
    public String toString() {
        return path();
    }
}
