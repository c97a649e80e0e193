package agents.spanner;

import agents.spanner.config.SpannerMcpConfig;
import agents.spanner.services.Logger;
import agents.spanner.services.MCPRouterService;
import agents.spanner.services.SpannerClientManager;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx;

  private static final String[] SERVER_CLASSES = {
      "agents.spanner.mcp.servers.SpannerQueryPlanServer",
      "agents.spanner.mcp.servers.SpannerDdlServer"
  };

  private final SpannerMcpConfig config;

  // Track component readiness via events
  private boolean mcpRouterReady = false;
  private boolean mcpServersReady = false;
  // Bound port as announced by the router; differs from the configured one when that is 0
  private int routerPort = -1;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final LinkedList<String> emergencyLogBuffer = new LinkedList<>();
  private static volatile boolean loggerReady = false;

  Driver(SpannerMcpConfig config) {
    this.config = config;
  }

  /**
   * Captures log messages to emergency buffer or publishes directly if logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.removeFirst();
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish("log", message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== Spanner MCP Server Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    SpannerMcpConfig config;
    try {
      loadEnvironment();
      config = SpannerMcpConfig.load();
    } catch (IllegalArgumentException e) {
      System.err.println("FATAL: Invalid configuration: " + e.getMessage());
      System.exit(1);
      return;
    }
    logLevel = config.getLogLevel();

    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(4)
        .setEventLoopPoolSize(1)
    );
    captureOrPublishLog("Data path: " + config.getDataPath() + ",2,Driver,System,System");

    // Deploy Logger FIRST before anything else
    System.out.println("Deploying Logger as first component...");
    vertx.deployVerticle(new Logger(config.getDataPath()), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        System.out.println("Logger deployed successfully - flushing emergency buffer");
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");

        new Driver(config).doIt();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.err.println("Cannot continue without logging capability");
        System.exit(1);
      }
    });
  }

  /**
   * Load .env.local into system properties; a missing file is not fatal
   */
  private static void loadEnvironment() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");
    } catch (RuntimeException e) {
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage() + ",1,Driver,StartUp,Config");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }
  }

  private void doIt() {
    if (logLevel >= 1) captureOrPublishLog("Driver initialization starting - " + config.toJsonObject().encode().replace(",", ";") + ",1,Driver,StartUp,MCP");

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      SpannerClientManager.getInstance().close();
      vertx.eventBus().publish("saveAllDataToFiles_OnTermination", "shutdown");
    }));

    setupReadinessListeners();

    // Router first, then servers
    deployMCPRouter();
  }

  private void deployMCPRouter() {
    if (logLevel >= 1) captureOrPublishLog("Deploying MCP Router Service...,1,Driver,StartUp,MCP");

    vertx.deployVerticle(new MCPRouterService(config.getHttpPort()), res -> {
      if (res.succeeded()) {
        if (logLevel >= 3) captureOrPublishLog("MCPRouterService deployed,3,Driver,StartUp,MCP");
      } else {
        captureOrPublishLog("MCPRouterService deployment failed: " + res.cause().getMessage() + ",0,Driver,System,System");
        System.err.println("Fatal error - cannot continue without router: " + res.cause().getMessage());
      }
    });
  }

  private void deployMCPServers() {
    if (logLevel >= 1) captureOrPublishLog("Deploying MCP Servers...,1,Driver,StartUp,MCP");

    SpannerClientManager.getInstance().initialize(vertx).onComplete(ar -> {
      if (ar.succeeded()) {
        deployAllMCPServers();
      } else {
        captureOrPublishLog("Failed to initialize Spanner Client Manager: " + ar.cause().getMessage() + ",0,Driver,StartUp,Database");
        System.err.println("Fatal error - SpannerClientManager initialization failed: " + ar.cause().getMessage());
      }
    });
  }

  private void deployAllMCPServers() {
    List<Future<String>> deploymentFutures = new ArrayList<>();

    int serverCount = 0;
    for (String serverClass : SERVER_CLASSES) {
      if (logLevel >= 3) captureOrPublishLog("Deploying server " + (++serverCount) + ": " + serverClass + ",3,Driver,StartUp,Database");
      deploymentFutures.add(
          vertx.deployVerticle(
              serverClass,
              new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER).setWorkerPoolSize(1)
          )
      );
    }

    Future.all(deploymentFutures).onComplete(ar -> {
      if (ar.succeeded()) {
        if (logLevel >= 3) captureOrPublishLog("All MCP servers deployed successfully,3,Driver,StartUp,MCP");
        vertx.eventBus().publish("mcp.servers.ready", new JsonObject()
            .put("serverCount", deploymentFutures.size())
            .put("timestamp", System.currentTimeMillis()));
      } else {
        captureOrPublishLog("Failed to deploy MCP servers: " + ar.cause().getMessage() + ",0,Driver,StartUp,MCP");
        System.err.println("Failed to deploy MCP servers: " + ar.cause().getMessage());
      }
    });
  }

  private void setupReadinessListeners() {
    vertx.eventBus().<JsonObject>consumer("mcp.router.ready", msg -> {
      markRouterReady(msg.body().getInteger("port"));
      deployMCPServers();
    });

    vertx.eventBus().consumer("mcp.servers.ready", msg -> {
      mcpServersReady = true;
      checkSystemReady();
    });
  }

  void markRouterReady(int port) {
    mcpRouterReady = true;
    routerPort = port;
    if (logLevel >= 1) captureOrPublishLog("MCP Router Ready on port: " + port + ".  Now deploy Servers,1,Driver,StartUp,MCP");
  }

  JsonObject systemReadyEvent() {
    return new JsonObject()
        .put("mcpRouter", mcpRouterReady)
        .put("mcpServers", mcpServersReady)
        .put("port", routerPort)
        .put("timestamp", System.currentTimeMillis());
  }

  private void checkSystemReady() {
    if (mcpRouterReady && mcpServersReady) {
      captureOrPublishLog("=== Spanner MCP Server Started ===,1,Driver,System,System");
      System.out.println("Spanner MCP Server ready on port " + routerPort);

      vertx.eventBus().publish("system.fully.ready", systemReadyEvent());
    } else {
      captureOrPublishLog("Error: sent checkSystemReady when not ready - Router: " + mcpRouterReady + "; Servers: " + mcpServersReady + ",0,Driver,StartUp,System");
    }
  }
}
