package agents.spanner.services;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tests for the CSV Logger verticle.
 */
@ExtendWith(VertxExtension.class)
public class LoggerTest {

    @TempDir
    Path dataPath;

    @Test
    @DisplayName("Test start creates current.csv with the header")
    void testStartWritesHeader(Vertx vertx, VertxTestContext testContext) {
        vertx.deployVerticle(new Logger(dataPath.toString()))
            .onComplete(testContext.succeeding(id -> testContext.verify(() -> {
                List<String> lines = Files.readAllLines(dataPath.resolve("logs/current.csv"));
                Assertions.assertEquals(1, lines.size());
                Assertions.assertEquals("Message,Level,Class,Category,Subcategory,SequenceReceived,EpochTimeMillis",
                    lines.get(0));
                Assertions.assertEquals(Logger.HEADER, lines.get(0) + "\n");
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test termination flush appends buffered entries")
    void testFlushOnTermination(Vertx vertx, VertxTestContext testContext) {
        vertx.deployVerticle(new Logger(dataPath.toString()))
            .compose(id -> {
                vertx.eventBus().publish("log", "first entry,1,LoggerTest,Test,Flush");
                vertx.eventBus().publish("log", "second entry,3,LoggerTest,Test,Flush");
                return vertx.eventBus().request("saveAllDataToFiles_OnTermination", "shutdown");
            })
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                Assertions.assertEquals("flushed", reply.body());

                List<String> lines = Files.readAllLines(dataPath.resolve("logs/current.csv"));
                Assertions.assertEquals(3, lines.size());
                Assertions.assertTrue(lines.get(1).startsWith("first entry,1,LoggerTest,Test,Flush,1,"));
                Assertions.assertTrue(lines.get(2).startsWith("second entry,3,LoggerTest,Test,Flush,2,"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test flush with an empty buffer leaves the file alone")
    void testEmptyFlush(Vertx vertx, VertxTestContext testContext) {
        vertx.deployVerticle(new Logger(dataPath.toString()))
            .compose(id -> vertx.eventBus().request("saveAllDataToFiles_OnTermination", "shutdown"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                Assertions.assertEquals(1, Files.readAllLines(dataPath.resolve("logs/current.csv")).size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Test later batches append after earlier ones and keep the sequence")
    void testBatchesAppend(Vertx vertx, VertxTestContext testContext) {
        vertx.deployVerticle(new Logger(dataPath.toString()))
            .compose(id -> {
                vertx.eventBus().publish("log", "batch one,1,LoggerTest,Test,Append");
                return vertx.eventBus().request("saveAllDataToFiles_OnTermination", "shutdown");
            })
            .compose(reply -> {
                vertx.eventBus().publish("log", "batch two,1,LoggerTest,Test,Append");
                return vertx.eventBus().request("saveAllDataToFiles_OnTermination", "shutdown");
            })
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                List<String> lines = Files.readAllLines(dataPath.resolve("logs/current.csv"));
                Assertions.assertEquals(3, lines.size());
                Assertions.assertTrue(lines.get(1).startsWith("batch one,1,LoggerTest,Test,Append,1,"));
                Assertions.assertTrue(lines.get(2).startsWith("batch two,1,LoggerTest,Test,Append,2,"));
                testContext.completeNow();
            })));
    }
}
