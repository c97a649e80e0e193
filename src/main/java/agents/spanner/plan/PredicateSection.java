package agents.spanner.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-reference of every row's predicates, keyed by row ID.
 */
public class PredicateSection {

    public static final String HEADER = "Predicates(identified by ID):";

    private PredicateSection() {
    }

    /**
     * Build the predicate lines, without the header or leading indent.
     * The first predicate of a row carries the row ID, later ones are blank padded.
     */
    public static List<String> lines(List<PlanRow> rows, PlanIdColumn idColumn) {
        List<String> lines = new ArrayList<>();
        for (PlanRow row : rows) {
            boolean idShown = false;
            for (String predicate : row.getPredicates()) {
                lines.add(idColumn.prefix(row.getId(), idShown) + " " + predicate);
                idShown = true;
            }
        }
        return lines;
    }

    /**
     * Render the whole section, or an empty string if no row has predicates
     */
    public static String render(List<PlanRow> rows, PlanIdColumn idColumn) {
        return renderSection(HEADER, lines(rows, idColumn));
    }

    static String renderSection(String header, List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(header).append("\n");
        for (String line : lines) {
            sb.append(" ").append(line).append("\n");
        }
        return sb.toString();
    }
}
