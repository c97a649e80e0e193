package agents.spanner.mcp.base;

import agents.spanner.services.LogUtil;
import agents.spanner.services.MCPRouterService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class for all MCP servers.
 * Provides common MCP protocol implementation for initialize, tools/list and tools/call.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    public static final String SERVER_NAME = "Spanner MCP";
    public static final String SERVER_VERSION = "0.1.0";
    public static final String PROTOCOL_VERSION = "2024-11-05";

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        router = Router.router(vertx);

        router.post("/initialize").handler(this::handleInitialize);
        router.post("/tools/list").handler(this::handleToolsList);
        router.post("/tools/call").handler(this::handleToolCall);

        initializeTools();

        MCPRouterService.registerRouter(serverPath, router);
        vertx.eventBus().publish("log", serverName + " registered router at path: " + serverPath + ",2,MCPServerBase,MCP,System");

        onServerReady();
        startPromise.complete();
    }

    /**
     * Initialize the tools provided by this server.
     * Subclasses must implement this to register their tools.
     */
    protected abstract void initializeTools();

    /**
     * Called when the server is registered and ready
     */
    protected void onServerReady() {
        // Default: no additional action
    }

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        vertx.eventBus().publish("log", serverName + " registered tool: " + tool.getName() + ",3,MCPServerBase,MCP,System");
    }

    private void handleInitialize(RoutingContext ctx) {
        MCPRequest request = MCPRequest.fromJson(parseBody(ctx));
        if (!request.isValid()) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
            return;
        }

        JsonObject result = new JsonObject()
            .put("protocolVersion", PROTOCOL_VERSION)
            .put("capabilities", new JsonObject()
                .put("tools", new JsonObject()))
            .put("serverInfo", new JsonObject()
                .put("name", SERVER_NAME)
                .put("version", SERVER_VERSION));

        sendSuccess(ctx, request.getId(), result);
    }

    private void handleToolsList(RoutingContext ctx) {
        try {
            MCPRequest request = MCPRequest.fromJson(parseBody(ctx));

            if (!request.isValid()) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
                return;
            }

            JsonArray toolsArray = new JsonArray();
            for (MCPTool tool : tools.values()) {
                toolsArray.add(tool.toJson());
            }

            sendSuccess(ctx, request.getId(), new JsonObject().put("tools", toolsArray));

        } catch (Exception e) {
            vertx.eventBus().publish("log", "Error handling tools/list: " + e.getMessage() + ",0,MCPServerBase,MCP,System");
            sendError(ctx, null, MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error");
        }
    }

    private void handleToolCall(RoutingContext ctx) {
        try {
            MCPRequest request = MCPRequest.fromJson(parseBody(ctx));

            if (!request.isValid()) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
                return;
            }

            JsonObject params = request.getParams();
            String toolName = params.getValue("name") instanceof String ? params.getString("name") : null;
            JsonObject arguments = params.getValue("arguments") instanceof JsonObject
                ? params.getJsonObject("arguments")
                : new JsonObject();

            if (toolName == null) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name");
                return;
            }

            MCPTool tool = tools.get(toolName);
            if (tool == null) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Tool not found: " + toolName);
                return;
            }

            for (String required : tool.getRequiredArguments()) {
                if (!arguments.containsKey(required) || arguments.getValue(required) == null) {
                    sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS,
                        "Missing required argument: " + required);
                    return;
                }
            }

            vertx.eventBus().publish("log", serverName + " calling tool " + toolName + ",3,MCPServerBase,MCP,Tool");
            executeTool(ctx, request.getId(), toolName, arguments);

        } catch (Exception e) {
            vertx.eventBus().publish("log", "Error handling tools/call: " + e.getMessage() +
                " - " + e.getClass().getName() + ",0,MCPServerBase,MCP,System");
            sendError(ctx, null, MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    /**
     * Execute a specific tool. Subclasses must implement this.
     */
    protected abstract void executeTool(RoutingContext ctx, String requestId,
                                        String toolName, JsonObject arguments);

    /**
     * Reply with the tool result once it completes, or with an INTERNAL_ERROR carrying the cause
     */
    protected void sendToolResult(RoutingContext ctx, String requestId, String toolName,
                                  Future<MCPToolResult> result) {
        result.onComplete(ar -> {
            if (ar.succeeded()) {
                sendSuccess(ctx, requestId, ar.result().toJson());
            } else {
                String message = toolName + " failed: " + failureMessage(ar.cause());
                LogUtil.logError(vertx, message, serverName, "MCP", "Tool");
                sendError(ctx, requestId, MCPResponse.ErrorCodes.INTERNAL_ERROR, message);
            }
        });
    }

    /**
     * Message of a failed tool call. Exceptions without a message (NPE and friends) are
     * described by their class instead.
     */
    static String failureMessage(Throwable cause) {
        if (cause == null) {
            return "unknown failure";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }

    protected void sendSuccess(RoutingContext ctx, String requestId, JsonObject result) {
        MCPResponse response = MCPResponse.success(
            requestId != null ? requestId : UUID.randomUUID().toString(),
            result
        );

        ctx.response()
            .putHeader("content-type", "application/json")
            .end(response.toJson().encode());
    }

    protected void sendError(RoutingContext ctx, String requestId, int code, String message) {
        sendError(ctx, requestId, code, message, null);
    }

    /**
     * Send an error response with additional data
     */
    protected void sendError(RoutingContext ctx, String requestId, int code,
                             String message, JsonObject data) {
        MCPResponse response = MCPResponse.error(
            requestId != null ? requestId : UUID.randomUUID().toString(),
            code,
            message,
            data
        );

        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(400)
            .end(response.toJson().encode());
    }

    private JsonObject parseBody(RoutingContext ctx) {
        try {
            return ctx.body().asJsonObject();
        } catch (RuntimeException e) {
            vertx.eventBus().publish("log", serverName + " received a body that is not a JSON object,1,MCPServerBase,MCP,Request");
            return null;
        }
    }

    public String getServerPath() {
        return serverPath;
    }
}
