package agents.spanner.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * JSON-RPC 2.0 reply sent by the tool servers: either a result or an error object, never both.
 */
public class MCPResponse {

    private final String id;
    private final JsonObject payload;
    private final boolean error;

    private MCPResponse(String id, JsonObject payload, boolean error) {
        this.id = id;
        this.payload = payload;
        this.error = error;
    }

    public static MCPResponse success(String id, JsonObject result) {
        return new MCPResponse(id, result, false);
    }

    public static MCPResponse error(String id, int code, String message, JsonObject data) {
        JsonObject body = new JsonObject()
            .put("code", code)
            .put("message", message);
        if (data != null) {
            body.put("data", data);
        }
        return new MCPResponse(id, body, true);
    }

    public boolean isError() {
        return error;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("jsonrpc", "2.0")
            .put("id", id)
            .put(error ? "error" : "result", payload);
    }

    @Override
    public String toString() {
        return toJson().encode();
    }

    public static final class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;

        private ErrorCodes() {
        }
    }
}
