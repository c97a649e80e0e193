package agents.spanner.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents an MCP tool definition with name, description, and input schema.
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema != null ? inputSchema : objectSchema(new JsonObject(), new JsonArray());
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    /**
     * Names listed in the schema's "required" array
     */
    public List<String> getRequiredArguments() {
        List<String> required = new ArrayList<>();
        JsonArray array = inputSchema.getJsonArray("required", new JsonArray());
        for (int i = 0; i < array.size(); i++) {
            required.add(array.getString(i));
        }
        return required;
    }

    /**
     * Convert to JSON format for MCP protocol
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema);
    }

    public static MCPTool fromJson(JsonObject json) {
        return new MCPTool(
            json.getString("name"),
            json.getString("description"),
            json.getJsonObject("inputSchema")
        );
    }

    /* ---------- schema helpers ---------- */

    public static JsonObject objectSchema(JsonObject properties, JsonArray required) {
        return new JsonObject()
            .put("type", "object")
            .put("properties", properties)
            .put("required", required);
    }

    public static JsonObject stringProperty(String description) {
        return new JsonObject()
            .put("type", "string")
            .put("description", description);
    }

    public static JsonObject booleanProperty(String description, boolean defaultValue) {
        return new JsonObject()
            .put("type", "boolean")
            .put("description", description)
            .put("default", defaultValue);
    }

    public static JsonObject stringArrayProperty(String description) {
        return new JsonObject()
            .put("type", "array")
            .put("description", description)
            .put("items", new JsonObject().put("type", "string"));
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "', description='" + description + "'}";
    }
}
