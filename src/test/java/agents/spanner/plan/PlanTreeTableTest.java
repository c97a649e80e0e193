package agents.spanner.plan;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for PlanTreeTable
 */
class PlanTreeTableTest {

    @Test
    void testEmptyRowsRenderNothing() {
        assertEquals("", PlanTreeTable.render(Collections.emptyList()));
    }

    @Test
    void testColumnsGrowWithContent() {
        String table = PlanTreeTable.render(Arrays.asList(
            new PlanRow(0, "Distributed Union"),
            new PlanRow(1, "+- Table Scan", Collections.singletonList("Seek Condition: k=1"), null)));

        String expected =
            "+----+-------------------+\n" +
            "| ID | Operator          |\n" +
            "+----+-------------------+\n" +
            "|  0 | Distributed Union |\n" +
            "| *1 | +- Table Scan     |\n" +
            "+----+-------------------+\n";
        assertEquals(expected, table);
    }

    @Test
    void testMultiLineCellSpansSeveralLines() {
        String table = PlanTreeTable.render(Arrays.asList(
            new PlanRow(0, "Foo"),
            new PlanRow(12, "+- Bar\n   baz")));

        String expected =
            "+----+----------+\n" +
            "| ID | Operator |\n" +
            "+----+----------+\n" +
            "|  0 | Foo      |\n" +
            "| 12 | +- Bar   |\n" +
            "|    |    baz   |\n" +
            "+----+----------+\n";
        assertEquals(expected, table);
    }

    @Test
    void testIndentationIsKeptVerbatim() {
        String table = PlanTreeTable.render(Collections.singletonList(new PlanRow(3, "   +- Scan")));

        assertTrue(table.contains("|  3 |    +- Scan |\n"), table);
    }
}
