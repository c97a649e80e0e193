package agents.spanner.services;

import agents.spanner.config.SpannerMcpConfig;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.longrunning.OperationFuture;
import com.google.cloud.spanner.DatabaseClient;
import com.google.cloud.spanner.DatabaseId;
import com.google.cloud.spanner.ReadContext;
import com.google.cloud.spanner.ResultSet;
import com.google.cloud.spanner.Spanner;
import com.google.cloud.spanner.SpannerOptions;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.admin.database.v1.DatabaseAdminClient;
import com.google.cloud.spanner.admin.database.v1.DatabaseAdminSettings;
import com.google.protobuf.Empty;
import com.google.spanner.admin.database.v1.GetDatabaseDdlRequest;
import com.google.spanner.admin.database.v1.GetDatabaseDdlResponse;
import com.google.spanner.admin.database.v1.UpdateDatabaseDdlMetadata;
import com.google.spanner.admin.database.v1.UpdateDatabaseDdlRequest;
import com.google.spanner.v1.QueryPlan;
import io.grpc.ManagedChannelBuilder;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import static agents.spanner.Driver.logLevel;

/**
 * Access to Cloud Spanner data and database admin APIs for the MCP tool servers.
 *
 * Every call blocks on the Spanner client libraries, so it runs through
 * {@code vertx.executeBlocking} and completes a Vert.x Future.
 * One {@link Spanner} service is kept per project; admin clients are opened per call.
 */
public class SpannerClientManager {

    private static SpannerClientManager instance;
    private volatile Vertx vertx;

    // host:port of the Spanner emulator, null for the real service
    private final String emulatorHost;
    private final Map<String, Spanner> services = new ConcurrentHashMap<>();

    protected SpannerClientManager(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    /**
     * Get singleton instance
     */
    public static synchronized SpannerClientManager getInstance() {
        if (instance == null) {
            instance = new SpannerClientManager(SpannerMcpConfig.load().getEmulatorHost());
        }
        return instance;
    }

    /**
     * Initialize - saves the Vertx instance used for blocking calls
     */
    public Future<Void> initialize(Vertx vertx) {
        this.vertx = vertx;

        vertx.eventBus().publish("log", "[SpannerClientManager] Initializing,1,SpannerClientManager,Connection,Environment");
        if (emulatorHost != null) {
            vertx.eventBus().publish("log", "[SpannerClientManager] Using Spanner emulator at " + emulatorHost + ",1,SpannerClientManager,Connection,Config");
        } else {
            vertx.eventBus().publish("log", "[SpannerClientManager] Using Cloud Spanner with application default credentials,2,SpannerClientManager,Connection,Config");
        }

        return Future.succeededFuture();
    }

    public static String databasePath(String project, String instance, String database) {
        return String.format("projects/%s/instances/%s/databases/%s", project, instance, database);
    }

    /**
     * Analyze a SQL or GQL query in PLAN mode and return its query plan
     */
    public Future<QueryPlan> analyzeQuery(String project, String instance, String database, String query) {
        return executeBlocking("analyzeQuery", () -> {
            DatabaseClient client = service(project).getDatabaseClient(DatabaseId.of(project, instance, database));
            try (ResultSet resultSet = client.singleUse()
                    .analyzeQuery(Statement.of(query), ReadContext.QueryAnalyzeMode.PLAN)) {
                // stats are only available once the result set is consumed
                while (resultSet.next()) {
                }
                return resultSet.getStats().getQueryPlan();
            }
        });
    }

    public Future<GetDatabaseDdlResponse> getDatabaseDdl(String databasePath) {
        return executeBlocking("getDatabaseDdl", () -> {
            try (DatabaseAdminClient admin = adminClient()) {
                return admin.getDatabaseDdl(GetDatabaseDdlRequest.newBuilder()
                    .setDatabase(databasePath)
                    .build());
            }
        });
    }

    /**
     * Apply DDL statements and wait for the schema change operation to finish
     */
    public Future<UpdateDatabaseDdlMetadata> updateDatabaseDdl(String databasePath, List<String> statements) {
        return executeBlocking("updateDatabaseDdl", () -> {
            try (DatabaseAdminClient admin = adminClient()) {
                OperationFuture<Empty, UpdateDatabaseDdlMetadata> operation = admin.updateDatabaseDdlAsync(
                    UpdateDatabaseDdlRequest.newBuilder()
                        .setDatabase(databasePath)
                        .addAllStatements(statements)
                        .build());
                if (vertx != null && logLevel >= 2) {
                    vertx.eventBus().publish("log", "[SpannerClientManager] Waiting for DDL operation " + operation.getName() + ",2,SpannerClientManager,Admin,UpdateDdl");
                }
                operation.get();
                return operation.getMetadata().get();
            }
        });
    }

    /**
     * Close all cached Spanner services
     */
    public void close() {
        for (Map.Entry<String, Spanner> entry : services.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                if (vertx != null) {
                    vertx.eventBus().publish("log", "[SpannerClientManager] Failed to close service for project " + entry.getKey() + ": " + e.getMessage() + ",0,SpannerClientManager,Connection,Error");
                }
            }
        }
        services.clear();
    }

    private Spanner service(String project) {
        return services.computeIfAbsent(project, p -> {
            SpannerOptions.Builder builder = SpannerOptions.newBuilder().setProjectId(p);
            if (emulatorHost != null) {
                builder.setEmulatorHost(emulatorHost);
            }
            if (vertx != null) {
                vertx.eventBus().publish("log", "[SpannerClientManager] Opening Spanner service for project " + p + ",2,SpannerClientManager,Connection,Attempt");
            }
            return builder.build().getService();
        });
    }

    private DatabaseAdminClient adminClient() throws IOException {
        DatabaseAdminSettings.Builder settings = DatabaseAdminSettings.newBuilder();
        if (emulatorHost != null) {
            settings.setCredentialsProvider(NoCredentialsProvider.create());
            settings.setTransportChannelProvider(DatabaseAdminSettings.defaultGrpcTransportProviderBuilder()
                .setEndpoint(emulatorHost)
                .setChannelConfigurator(ManagedChannelBuilder::usePlaintext)
                .build());
        }
        return DatabaseAdminClient.create(settings.build());
    }

    private <T> Future<T> executeBlocking(String operation, Callable<T> work) {
        if (vertx == null) {
            return Future.failedFuture("SpannerClientManager not initialized. Call initialize() first.");
        }
        return vertx.executeBlocking(promise -> {
            try {
                promise.complete(work.call());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                promise.fail(e);
            } catch (ExecutionException e) {
                vertx.eventBus().publish("log", "[SpannerClientManager] " + operation + " failed: " + e.getCause().getMessage() + ",0,SpannerClientManager,Spanner,Error");
                promise.fail(e.getCause());
            } catch (Exception e) {
                vertx.eventBus().publish("log", "[SpannerClientManager] " + operation + " failed: " + e.getMessage() + ",0,SpannerClientManager,Spanner,Error");
                promise.fail(e);
            }
        }, false);
    }
}
