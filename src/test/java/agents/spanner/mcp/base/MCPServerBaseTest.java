package agents.spanner.mcp.base;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for the MCPServerBase failure reporting
 */
class MCPServerBaseTest {

    @Test
    void testFailureMessageUsesExceptionMessage() {
        assertEquals("Session not found", MCPServerBase.failureMessage(new IllegalStateException("Session not found")));
    }

    @Test
    void testFailureMessageWithoutMessageNamesTheException() {
        assertEquals("java.lang.NullPointerException", MCPServerBase.failureMessage(new NullPointerException()));
    }

    @Test
    void testFailureMessageWithoutCause() {
        assertEquals("unknown failure", MCPServerBase.failureMessage(null));
    }
}
