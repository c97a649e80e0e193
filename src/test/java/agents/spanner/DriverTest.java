package agents.spanner;

import agents.spanner.config.SpannerMcpConfig;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for the Driver readiness bookkeeping
 */
class DriverTest {

    @Test
    void testReadyEventCarriesAnnouncedPort() {
        Driver driver = new Driver(new SpannerMcpConfig(0, 1, "./data", null, false));

        driver.markRouterReady(41234);
        JsonObject event = driver.systemReadyEvent();

        assertTrue(event.getBoolean("mcpRouter"));
        assertFalse(event.getBoolean("mcpServers"));
        assertEquals(41234, event.getInteger("port"));
    }

    @Test
    void testPortUnknownBeforeRouterIsReady() {
        Driver driver = new Driver(new SpannerMcpConfig(8080, 1, "./data", null, false));

        assertFalse(driver.systemReadyEvent().getBoolean("mcpRouter"));
        assertEquals(-1, driver.systemReadyEvent().getInteger("port"));
    }
}
