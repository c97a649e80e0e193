package agents.spanner.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One display-ready entry of a linearized execution plan tree.
 *
 * Rows are produced by {@link QueryPlanTree} in pre-order and are immutable once built.
 * The operator text already carries the tree indentation for the row's depth.
 */
public class PlanRow {

    private final int id;
    private final String text;
    private final List<String> predicates;
    private final Map<String, List<ResolvedChildLink>> childLinks;

    public PlanRow(int id, String text, List<String> predicates,
                   Map<String, List<ResolvedChildLink>> childLinks) {
        if (id < 0) {
            throw new IllegalArgumentException("Plan row id must be non-negative: " + id);
        }
        this.id = id;
        this.text = text != null ? text : "";
        this.predicates = predicates != null
            ? Collections.unmodifiableList(new ArrayList<>(predicates))
            : Collections.emptyList();

        Map<String, List<ResolvedChildLink>> links = new LinkedHashMap<>();
        if (childLinks != null) {
            for (Map.Entry<String, List<ResolvedChildLink>> entry : childLinks.entrySet()) {
                links.put(entry.getKey() != null ? entry.getKey() : "",
                    Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        this.childLinks = Collections.unmodifiableMap(links);
    }

    public PlanRow(int id, String text) {
        this(id, text, null, null);
    }

    public int getId() {
        return id;
    }

    /**
     * Display label for the ID column. Rows carrying predicates are marked with a leading '*'.
     */
    public String formatId() {
        return (predicates.isEmpty() ? "" : "*") + id;
    }

    public String getText() {
        return text;
    }

    public List<String> getPredicates() {
        return predicates;
    }

    /**
     * Child links grouped by link type. The map keeps insertion order; consumers that need
     * deterministic output sort the keys themselves.
     */
    public Map<String, List<ResolvedChildLink>> getChildLinks() {
        return childLinks;
    }

    @Override
    public String toString() {
        return "PlanRow{id=" + id + ", text='" + text + "', predicates=" + predicates + "}";
    }
}
