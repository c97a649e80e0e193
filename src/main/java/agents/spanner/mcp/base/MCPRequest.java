package agents.spanner.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents a JSON-RPC request in MCP protocol format.
 */
public class MCPRequest {

    private final String jsonrpc;
    private final String id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(String id, String method, JsonObject params) {
        this("2.0", id, method, params);
    }

    private MCPRequest(String jsonrpc, String id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params != null ? params : new JsonObject();
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id)
            .put("method", method);

        if (!params.isEmpty()) {
            json.put("params", params);
        }

        return json;
    }

    /**
     * Create from incoming JSON. Numeric ids are accepted and kept in their string form.
     */
    public static MCPRequest fromJson(JsonObject json) {
        if (json == null) {
            return new MCPRequest(null, null, null, null);
        }
        Object rawId = json.getValue("id");
        Object rawParams = json.getValue("params");
        return new MCPRequest(
            json.getValue("jsonrpc") instanceof String ? json.getString("jsonrpc") : null,
            rawId != null ? rawId.toString() : null,
            json.getValue("method") instanceof String ? json.getString("method") : null,
            rawParams instanceof JsonObject ? (JsonObject) rawParams : new JsonObject()
        );
    }

    /**
     * Validate the request format
     */
    public boolean isValid() {
        return id != null && !id.isEmpty() &&
               method != null && !method.isEmpty() &&
               "2.0".equals(jsonrpc);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
