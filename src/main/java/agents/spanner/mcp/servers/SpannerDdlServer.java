package agents.spanner.mcp.servers;

import agents.spanner.mcp.base.MCPResponse;
import agents.spanner.mcp.base.MCPServerBase;
import agents.spanner.mcp.base.MCPTool;
import agents.spanner.mcp.base.MCPToolResult;
import agents.spanner.services.LogUtil;
import agents.spanner.services.SpannerClientManager;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.TextFormat;
import com.google.spanner.admin.database.v1.GetDatabaseDdlResponse;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;

import static agents.spanner.mcp.base.MCPTool.booleanProperty;
import static agents.spanner.mcp.base.MCPTool.objectSchema;
import static agents.spanner.mcp.base.MCPTool.stringArrayProperty;

/**
 * MCP Server for database schema: reading the DDL and applying schema changes.
 * Deployed as a Worker Verticle; admin calls run through {@link SpannerClientManager}.
 */
public class SpannerDdlServer extends MCPServerBase {

    private final SpannerClientManager clientManager;

    public SpannerDdlServer() {
        this(SpannerClientManager.getInstance());
    }

    public SpannerDdlServer(SpannerClientManager clientManager) {
        super("SpannerDdlServer", "/mcp/servers/spanner-ddl");
        this.clientManager = clientManager;
    }

    @Override
    protected void initializeTools() {
        registerTool(new MCPTool(
            "get_ddl",
            "Get DDL of the database. The first content is the whole response, "
                + "and the second content is unmarshalled proto_descriptors (optional).",
            objectSchema(
                DatabaseArguments.schemaProperties()
                    .put("include_proto_descriptors",
                        booleanProperty("Enable only if proto_descriptors is needed.", false)),
                DatabaseArguments.requiredNames())
        ));

        registerTool(new MCPTool(
            "update_ddl",
            "Update DDL of the database",
            objectSchema(
                DatabaseArguments.schemaProperties()
                    .put("statements", stringArrayProperty("DDL statements")),
                DatabaseArguments.requiredNames("statements"))
        ));
    }

    @Override
    protected void executeTool(RoutingContext ctx, String requestId, String toolName, JsonObject arguments) {
        switch (toolName) {
            case "get_ddl":
                getDdl(ctx, requestId, arguments);
                break;
            case "update_ddl":
                updateDdl(ctx, requestId, arguments);
                break;
            default:
                sendError(ctx, requestId, MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Unknown tool: " + toolName);
        }
    }

    private void getDdl(RoutingContext ctx, String requestId, JsonObject arguments) {
        DatabaseArguments db;
        boolean includeProtoDescriptors;
        try {
            db = DatabaseArguments.fromJson(arguments);
            includeProtoDescriptors = DatabaseArguments.optionalBoolean(arguments, "include_proto_descriptors", false);
        } catch (IllegalArgumentException e) {
            sendError(ctx, requestId, MCPResponse.ErrorCodes.INVALID_PARAMS, e.getMessage());
            return;
        }

        LogUtil.logDetail(vertx, "Fetching DDL of " + db.path(), "SpannerDdlServer", "MCP", "GetDdl");

        Future<MCPToolResult> result = clientManager.getDatabaseDdl(db.path())
            .compose(response -> {
                try {
                    return Future.succeededFuture(formatDdl(response, includeProtoDescriptors));
                } catch (InvalidProtocolBufferException e) {
                    return Future.failedFuture(e);
                }
            });

        sendToolResult(ctx, requestId, "get_ddl", result);
    }

    /**
     * Render the DDL response. Proto descriptors are always parsed so that a corrupt
     * descriptor set is reported even when it is not requested.
     */
    static MCPToolResult formatDdl(GetDatabaseDdlResponse response, boolean includeProtoDescriptors)
            throws InvalidProtocolBufferException {
        FileDescriptorSet descriptors = FileDescriptorSet.parseFrom(response.getProtoDescriptors());

        if (includeProtoDescriptors) {
            return MCPToolResult.text(
                TextFormat.printer().printToString(response),
                TextFormat.printer().printToString(descriptors));
        }
        return MCPToolResult.text(
            TextFormat.printer().printToString(response.toBuilder().clearProtoDescriptors().build()));
    }

    private void updateDdl(RoutingContext ctx, String requestId, JsonObject arguments) {
        DatabaseArguments db;
        List<String> statements;
        try {
            db = DatabaseArguments.fromJson(arguments);
            statements = DatabaseArguments.requireStringList(arguments, "statements");
        } catch (IllegalArgumentException e) {
            sendError(ctx, requestId, MCPResponse.ErrorCodes.INVALID_PARAMS, e.getMessage());
            return;
        }

        LogUtil.logInfo(vertx, "Applying " + statements.size() + " DDL statements to " + db.path(),
            "SpannerDdlServer", "MCP", "UpdateDdl");

        Future<MCPToolResult> result = clientManager.updateDatabaseDdl(db.path(), statements)
            .map(metadata -> MCPToolResult.text(TextFormat.printer().printToString(metadata)));

        sendToolResult(ctx, requestId, "update_ddl", result);
    }
}
