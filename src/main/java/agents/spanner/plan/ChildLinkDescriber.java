package agents.spanner.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Describes the typed child links of each plan row, e.g. {@code " 1: Left: Scan(L)"}.
 *
 * Link types are visited in lexicographic order. The untyped group (empty key) has no label
 * to print and is skipped.
 */
public class ChildLinkDescriber {

    public static final String HEADER = "Parameters(identified by ID):";

    private ChildLinkDescriber() {
    }

    /**
     * Render one link: {@code $var=description}, or just the description when unbound
     */
    public static String describe(ResolvedChildLink link) {
        if (!link.getVariableName().isEmpty()) {
            return "$" + link.getVariableName() + "=" + link.getChildDescription();
        }
        return link.getChildDescription();
    }

    public static List<String> lines(List<PlanRow> rows, PlanIdColumn idColumn) {
        List<String> lines = new ArrayList<>();
        for (PlanRow row : rows) {
            boolean idShown = false;
            Map<String, List<ResolvedChildLink>> byType = new TreeMap<>(row.getChildLinks());
            for (Map.Entry<String, List<ResolvedChildLink>> entry : byType.entrySet()) {
                String type = entry.getKey();
                if (type.isEmpty()) {
                    continue;
                }

                String joined = entry.getValue().stream()
                    .map(ChildLinkDescriber::describe)
                    .collect(Collectors.joining(", "));
                if (joined.isEmpty()) {
                    continue;
                }

                lines.add(idColumn.prefix(row.getId(), idShown) + " " + type + ": " + joined);
                idShown = true;
            }
        }
        return lines;
    }

    public static String render(List<PlanRow> rows, PlanIdColumn idColumn) {
        return PredicateSection.renderSection(HEADER, lines(rows, idColumn));
    }
}
