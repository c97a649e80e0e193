package agents.spanner.services;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Collections;

/**
 * Tests for SpannerClientManager behaviour that needs no Spanner backend.
 */
@ExtendWith(VertxExtension.class)
public class SpannerClientManagerTest {

    @Test
    @DisplayName("Test database path format")
    void testDatabasePath(VertxTestContext testContext) {
        testContext.verify(() -> Assertions.assertEquals(
            "projects/my-project/instances/test-instance/databases/music",
            SpannerClientManager.databasePath("my-project", "test-instance", "music")));
        testContext.completeNow();
    }

    @Test
    @DisplayName("Test calls fail before initialize")
    void testCallsRequireInitialize(VertxTestContext testContext) {
        SpannerClientManager manager = new SpannerClientManager("localhost:9010");
        String expected = "SpannerClientManager not initialized. Call initialize() first.";

        manager.analyzeQuery("p", "i", "d", "SELECT 1")
            .onComplete(testContext.failing(e -> testContext.verify(() -> {
                Assertions.assertEquals(expected, e.getMessage());
            })))
            .transform(ar -> manager.getDatabaseDdl("projects/p/instances/i/databases/d"))
            .onComplete(testContext.failing(e -> testContext.verify(() -> {
                Assertions.assertEquals(expected, e.getMessage());
            })))
            .transform(ar -> manager.updateDatabaseDdl("projects/p/instances/i/databases/d",
                Collections.singletonList("DROP TABLE T")))
            .onComplete(testContext.failing(e -> testContext.verify(() -> {
                Assertions.assertEquals(expected, e.getMessage());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test initialize and close without open services")
    void testInitializeAndClose(Vertx vertx, VertxTestContext testContext) {
        SpannerClientManager manager = new SpannerClientManager(null);

        manager.initialize(vertx).onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            Assertions.assertDoesNotThrow(manager::close);
            testContext.completeNow();
        })));
    }
}
