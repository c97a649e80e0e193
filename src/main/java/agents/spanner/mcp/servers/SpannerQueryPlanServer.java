package agents.spanner.mcp.servers;

import agents.spanner.config.SpannerMcpConfig;
import agents.spanner.mcp.base.MCPResponse;
import agents.spanner.mcp.base.MCPServerBase;
import agents.spanner.mcp.base.MCPTool;
import agents.spanner.mcp.base.MCPToolResult;
import agents.spanner.plan.PlanReportFormatter;
import agents.spanner.plan.PlanRow;
import agents.spanner.plan.QueryPlanTree;
import agents.spanner.services.LogUtil;
import agents.spanner.services.SpannerClientManager;
import com.google.protobuf.TextFormat;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.util.List;

import static agents.spanner.mcp.base.MCPTool.objectSchema;
import static agents.spanner.mcp.base.MCPTool.stringProperty;

/**
 * MCP Server exposing query execution plans.
 * The plan is returned twice: as protobuf text for machines and as a rendered operator tree.
 * Deployed as a Worker Verticle; Spanner calls run through {@link SpannerClientManager}.
 */
public class SpannerQueryPlanServer extends MCPServerBase {

    private final SpannerClientManager clientManager;
    private final PlanReportFormatter formatter;

    public SpannerQueryPlanServer() {
        this(SpannerClientManager.getInstance(),
            new PlanReportFormatter(SpannerMcpConfig.load().isIncludeChildLinks()));
    }

    public SpannerQueryPlanServer(SpannerClientManager clientManager, PlanReportFormatter formatter) {
        super("SpannerQueryPlanServer", "/mcp/servers/spanner-plan");
        this.clientManager = clientManager;
        this.formatter = formatter;
    }

    @Override
    protected void initializeTools() {
        registerTool(new MCPTool(
            "plan",
            "Get execution plan for the query. The first content is machine-readable prototext format of QueryPlan message. "
                + "The second content is human-readable rendered query plan.",
            objectSchema(
                DatabaseArguments.schemaProperties()
                    .put("query", stringProperty("query text of SQL or GQL")),
                DatabaseArguments.requiredNames("query"))
        ));
    }

    @Override
    protected void executeTool(RoutingContext ctx, String requestId, String toolName, JsonObject arguments) {
        switch (toolName) {
            case "plan":
                plan(ctx, requestId, arguments);
                break;
            default:
                sendError(ctx, requestId, MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Unknown tool: " + toolName);
        }
    }

    private void plan(RoutingContext ctx, String requestId, JsonObject arguments) {
        DatabaseArguments db;
        String query;
        try {
            db = DatabaseArguments.fromJson(arguments);
            query = DatabaseArguments.requireString(arguments, "query");
        } catch (IllegalArgumentException e) {
            sendError(ctx, requestId, MCPResponse.ErrorCodes.INVALID_PARAMS, e.getMessage());
            return;
        }

        LogUtil.logDetail(vertx, "Analyzing query on " + db.path(), "SpannerQueryPlanServer", "MCP", "Plan");

        Future<MCPToolResult> result = clientManager
            .analyzeQuery(db.getProject(), db.getInstance(), db.getDatabase(), query)
            .map(plan -> {
                List<PlanRow> rows = QueryPlanTree.process(plan);
                LogUtil.logDebug(vertx, "Resolved " + rows.size() + " plan rows from " + plan.getPlanNodesCount() + " nodes",
                    "SpannerQueryPlanServer", "MCP", "Plan");
                return MCPToolResult.text(
                    TextFormat.printer().printToString(plan),
                    formatter.format(rows));
            });

        sendToolResult(ctx, requestId, "plan", result);
    }
}
