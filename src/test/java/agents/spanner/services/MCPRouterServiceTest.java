package agents.spanner.services;

import agents.spanner.mcp.servers.SpannerDdlServer;
import agents.spanner.mcp.servers.SpannerQueryPlanServer;
import agents.spanner.plan.PlanReportFormatter;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for the master router: server mounting and the health endpoint.
 */
@ExtendWith(VertxExtension.class)
public class MCPRouterServiceTest {

    @Test
    @DisplayName("Test health lists mounted servers and announces readiness")
    void testHealth(Vertx vertx, VertxTestContext testContext) {
        SpannerClientManager unused = new SpannerClientManager(null) { };
        MCPRouterService router = new MCPRouterService(0);
        WebClient client = WebClient.create(vertx);

        vertx.eventBus().<JsonObject>consumer("mcp.router.ready", msg -> testContext.verify(() ->
            Assertions.assertTrue(msg.body().getInteger("port") > 0)));

        vertx.deployVerticle(router)
            .compose(id -> vertx.deployVerticle(new SpannerDdlServer(unused)))
            .compose(id -> vertx.deployVerticle(new SpannerQueryPlanServer(unused, new PlanReportFormatter())))
            .compose(id -> client.get(router.actualPort(), "localhost", "/health").send())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonObject health = response.bodyAsJsonObject();
                Assertions.assertEquals("healthy", health.getString("status"));
                Assertions.assertEquals(
                    new JsonArray().add("/mcp/servers/spanner-ddl").add("/mcp/servers/spanner-plan"),
                    health.getJsonArray("servers"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test routers registered before start are mounted on start")
    void testPendingRouterIsMounted(Vertx vertx, VertxTestContext testContext) {
        SpannerClientManager unused = new SpannerClientManager(null) { };
        MCPRouterService router = new MCPRouterService(0);
        WebClient client = WebClient.create(vertx);

        JsonObject initialize = new JsonObject()
            .put("jsonrpc", "2.0")
            .put("id", "init-1")
            .put("method", "initialize");

        vertx.deployVerticle(new SpannerDdlServer(unused))
            .compose(id -> vertx.deployVerticle(router))
            .compose(id -> client.post(router.actualPort(), "localhost", "/mcp/servers/spanner-ddl/initialize")
                .sendJsonObject(initialize))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertEquals("init-1", response.bodyAsJsonObject().getString("id"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test unknown MCP paths are not found")
    void testUnknownPath(Vertx vertx, VertxTestContext testContext) {
        MCPRouterService router = new MCPRouterService(0);
        WebClient client = WebClient.create(vertx);

        vertx.deployVerticle(router)
            .compose(id -> client.post(router.actualPort(), "localhost", "/mcp/servers/nothing/tools/list")
                .sendJsonObject(new JsonObject()))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(404, response.statusCode());
                testContext.completeNow();
            })));
    }
}
