package agents.spanner.plan;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for ChildLinkDescriber
 */
class ChildLinkDescriberTest {

    @Test
    void testDescribeWithAndWithoutVariable() {
        assertEquals("$x=Scan(Table: T)", ChildLinkDescriber.describe(new ResolvedChildLink("x", "Scan(Table: T)")));
        assertEquals("Scan(Table: T)", ChildLinkDescriber.describe(new ResolvedChildLink("", "Scan(Table: T)")));
    }

    @Test
    void testTypesAreVisitedInLexicographicOrder() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Right", Collections.singletonList(new ResolvedChildLink("r", "Scan(R)")));
        links.put("Left", Collections.singletonList(new ResolvedChildLink("", "Scan(L)")));
        List<PlanRow> rows = Collections.singletonList(new PlanRow(1, "Join", null, links));

        List<String> lines = ChildLinkDescriber.lines(rows, PlanIdColumn.of(rows));

        assertEquals(Arrays.asList("1: Left: Scan(L)", "   Right: $r=Scan(R)"), lines);
    }

    @Test
    void testEmptyTypeKeyIsAlwaysSkipped() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("", Collections.singletonList(new ResolvedChildLink("v", "Reference(x)")));
        links.put("Input", Collections.singletonList(new ResolvedChildLink("", "Scan(T)")));
        List<PlanRow> rows = Collections.singletonList(new PlanRow(5, "Compute", null, links));

        List<String> lines = ChildLinkDescriber.lines(rows, PlanIdColumn.of(rows));

        assertEquals(Collections.singletonList("5: Input: Scan(T)"), lines);
    }

    @Test
    void testTypeWithOnlyEmptyDescriptionsIsSkipped() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Aggregate", Collections.singletonList(new ResolvedChildLink("", "")));
        links.put("Key", Arrays.asList(new ResolvedChildLink("", "a"), new ResolvedChildLink("k", "b")));
        List<PlanRow> rows = Collections.singletonList(new PlanRow(2, "Aggregate", null, links));

        List<String> lines = ChildLinkDescriber.lines(rows, PlanIdColumn.of(rows));

        assertEquals(Collections.singletonList("2: Key: a, $k=b"), lines);
    }

    @Test
    void testIdStateIsIndependentOfPredicates() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Split Range", Collections.singletonList(new ResolvedChildLink("", "true")));
        List<PlanRow> rows = Collections.singletonList(
            new PlanRow(4, "Union", Collections.singletonList("Condition: x"), links));
        PlanIdColumn idColumn = PlanIdColumn.of(rows);

        assertEquals(Collections.singletonList("4: Condition: x"), PredicateSection.lines(rows, idColumn));
        assertEquals(Collections.singletonList("4: Split Range: true"), ChildLinkDescriber.lines(rows, idColumn));
    }

    @Test
    void testRenderUsesParametersHeader() {
        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        links.put("Input", Collections.singletonList(new ResolvedChildLink("", "Scan(T)")));
        List<PlanRow> rows = Collections.singletonList(new PlanRow(1, "Compute", null, links));

        assertEquals("Parameters(identified by ID):\n 1: Input: Scan(T)\n",
            ChildLinkDescriber.render(rows, PlanIdColumn.of(rows)));
        assertEquals("", ChildLinkDescriber.render(
            Collections.singletonList(new PlanRow(1, "Scan")), PlanIdColumn.of(rows)));
    }
}
