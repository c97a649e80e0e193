package agents.spanner.plan;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for PlanRow and ResolvedChildLink
 */
class PlanRowTest {

    @Test
    void testFormatIdMarksRowsWithPredicates() {
        PlanRow plain = new PlanRow(4, "Scan");
        PlanRow filtered = new PlanRow(4, "Filter", Collections.singletonList("Condition: x"), null);

        assertEquals("4", plain.formatId());
        assertEquals("*4", filtered.formatId());
    }

    @Test
    void testNegativeIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PlanRow(-1, "Scan"));
    }

    @Test
    void testRowIsImmutableCopy() {
        List<String> predicates = new ArrayList<>(Collections.singletonList("p"));
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Left", new ArrayList<>(Collections.singletonList(new ResolvedChildLink("", "Scan(L)"))));

        PlanRow row = new PlanRow(1, "Join", predicates, links);
        predicates.add("q");
        links.put("Right", new ArrayList<>());

        assertEquals(Collections.singletonList("p"), row.getPredicates());
        assertEquals(Collections.singletonList("Left"), new ArrayList<>(row.getChildLinks().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> row.getPredicates().add("r"));
        assertThrows(UnsupportedOperationException.class,
            () -> row.getChildLinks().get("Left").add(new ResolvedChildLink("x", "y")));
    }

    @Test
    void testChildLinkKeysKeepInsertionOrder() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Right", Collections.emptyList());
        links.put("Left", Collections.emptyList());
        links.put(null, Collections.emptyList());

        PlanRow row = new PlanRow(1, "Join", null, links);

        assertEquals(Arrays.asList("Right", "Left", ""), new ArrayList<>(row.getChildLinks().keySet()));
    }

    @Test
    void testNullsBecomeEmpty() {
        PlanRow row = new PlanRow(0, null, null, null);
        ResolvedChildLink link = new ResolvedChildLink(null, null);

        assertEquals("", row.getText());
        assertTrue(row.getPredicates().isEmpty());
        assertTrue(row.getChildLinks().isEmpty());
        assertEquals("", link.getVariableName());
        assertEquals("", link.getChildDescription());
    }
}
