package agents.spanner.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.ErrorHandler;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

import static agents.spanner.Driver.logLevel;

/**
 * Master router service for the MCP tool servers.
 * Runs the HTTP server and mounts each server's sub-router under its path.
 */
public class MCPRouterService extends AbstractVerticle {

    private final int httpPort;

    private Router mainRouter;
    private HttpServer httpServer;
    private final Set<String> mountedPaths = new CopyOnWriteArraySet<>();
    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static MCPRouterService instance;

    /**
     * @param httpPort port to listen on, 0 picks a free port (see {@link #actualPort()})
     */
    public MCPRouterService(int httpPort) {
        this.httpPort = httpPort;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);

        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> {
            ctx.response()
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("status", "healthy")
                    .put("servers", new JsonArray(mountedPaths.stream().sorted().toList()))
                    .put("timestamp", System.currentTimeMillis())
                    .toString());
        });

        instance = this;
        mountRegisteredRouters();

        HttpServerOptions options = new HttpServerOptions()
            .setPort(httpPort)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);

        httpServer
            .requestHandler(mainRouter)
            .listen(result -> {
                if (result.succeeded()) {
                    vertx.eventBus().publish("log", "MCPRouterService started on port " + actualPort() + ",2,MCPRouterService,Service,System");

                    vertx.eventBus().publish("mcp.router.ready", new JsonObject()
                        .put("port", actualPort())
                        .put("address", "localhost")
                        .put("timestamp", System.currentTimeMillis()));

                    startPromise.complete();
                } else {
                    vertx.eventBus().publish("log", "Failed to start MCPRouterService: " + result.cause().getMessage() + ",0,MCPRouterService,Service,System");
                    startPromise.fail(result.cause());
                }
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigins(Arrays.asList("*"))
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create()
            .setBodyLimit(10 * 1024 * 1024)); // 10MB limit

        mainRouter.route().failureHandler(ErrorHandler.create(vertx));

        // JSON-RPC shaped failures for MCP endpoints
        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode();

            if (statusCode == -1) {
                statusCode = 500;
            }

            JsonObject error = new JsonObject()
                .put("jsonrpc", "2.0")
                .put("error", new JsonObject()
                    .put("code", statusCode)
                    .put("message", failure != null ? failure.getMessage() : "Unknown error"));

            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(error.encode());
        });
    }

    /**
     * Register a server's router. Mounted immediately if the router service is running,
     * otherwise kept until it starts.
     */
    public static void registerRouter(String path, Router subRouter) {
        MCPRouterService current = instance;
        if (current != null && current.mainRouter != null) {
            current.mountRouter(path, subRouter);
        } else {
            pendingRouters.put(path, subRouter);
            if (current != null && current.vertx != null && logLevel >= 2) {
                current.vertx.eventBus().publish("log", "Router registered for path: " + path + " (pending mount),2,MCPRouterService,HTTP,Router");
            }
        }
    }

    private synchronized void mountRouter(String path, Router subRouter) {
        mainRouter.route(path + "/*").subRouter(subRouter);
        mountedPaths.add(path);
        vertx.eventBus().publish("log", "Mounted router at path: " + path + ",2,MCPRouterService,Service,System");
    }

    private void mountRegisteredRouters() {
        for (Map.Entry<String, Router> entry : pendingRouters.entrySet()) {
            mountRouter(entry.getKey(), entry.getValue());
        }
        pendingRouters.clear();
    }

    /**
     * Port the HTTP server is bound to
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : httpPort;
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        instance = null;
        mountedPaths.clear();
        if (httpServer != null) {
            httpServer.close(result -> {
                if (result.succeeded()) {
                    vertx.eventBus().publish("log", "MCPRouterService stopped,2,MCPRouterService,Service,System");
                    stopPromise.complete();
                } else {
                    vertx.eventBus().publish("log", "Failed to stop MCPRouterService: " + result.cause().getMessage() + ",0,MCPRouterService,Service,System");
                    stopPromise.fail(result.cause());
                }
            });
        } else {
            stopPromise.complete();
        }
    }
}
