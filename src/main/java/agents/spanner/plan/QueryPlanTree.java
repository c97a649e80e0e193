package agents.spanner.plan;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.google.spanner.v1.PlanNode;
import com.google.spanner.v1.QueryPlan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Linearizes a Spanner {@link QueryPlan} into {@link PlanRow}s.
 *
 * Relational operators are visited in pre-order starting at node 0. Scalar children whose
 * link type is a condition become predicates of their parent row, the remaining scalar
 * children become typed child links. Relational operators reached through a scalar child
 * (subqueries) are rendered as children of the row owning that scalar.
 */
public class QueryPlanTree {

    private static final Set<String> PREDICATE_LINK_TYPES = new HashSet<>(Arrays.asList(
        "Condition", "Seek Condition", "Residual Condition", "Filter Condition", "Split Range"
    ));

    // Metadata keys folded into the operator name instead of the field list
    private static final Set<String> TITLE_METADATA_KEYS = new HashSet<>(Arrays.asList(
        "call_type", "iterator_type", "scan_target", "subquery_cluster_node"
    ));

    private static final String CHILD_MARKER = "+- ";
    private static final String PIPE_INDENT = "|  ";
    private static final String BLANK_INDENT = "   ";

    private final Map<Integer, PlanNode> nodes = new HashMap<>();
    private final Set<Integer> visited = new HashSet<>();
    private final List<PlanRow> rows = new ArrayList<>();

    private QueryPlanTree(QueryPlan plan) {
        for (PlanNode node : plan.getPlanNodesList()) {
            nodes.put(node.getIndex(), node);
        }
    }

    /**
     * Resolve the plan into display rows.
     *
     * @throws IllegalArgumentException if a child link points outside the plan or the
     *         relational operators do not form a tree
     */
    public static List<PlanRow> process(QueryPlan plan) {
        if (plan.getPlanNodesCount() == 0) {
            return new ArrayList<>();
        }
        QueryPlanTree tree = new QueryPlanTree(plan);
        tree.visit(tree.node(0), "", "", true, true);
        return tree.rows;
    }

    private void visit(PlanNode node, String linkType, String indent, boolean root, boolean last) {
        if (!visited.add(node.getIndex())) {
            throw new IllegalArgumentException("Plan node " + node.getIndex() + " is reachable more than once");
        }

        List<String> predicates = new ArrayList<>();
        Map<String, List<ResolvedChildLink>> childLinks = new LinkedHashMap<>();
        List<PlanNode.ChildLink> relationalLinks = new ArrayList<>();
        // shared by all scalar links of this row; one subquery may be referenced by several of them
        Set<Integer> queued = new HashSet<>();
        Set<Integer> seenScalars = new HashSet<>();

        for (PlanNode.ChildLink link : node.getChildLinksList()) {
            PlanNode child = node(link.getChildIndex());
            if (child.getKind() == PlanNode.Kind.RELATIONAL) {
                relationalLinks.add(link);
                queued.add(child.getIndex());
                continue;
            }

            String description = child.getShortRepresentation().getDescription();
            if (isPredicate(link.getType())) {
                predicates.add(link.getType() + ": " + description);
            } else {
                childLinks.computeIfAbsent(link.getType(), k -> new ArrayList<>())
                    .add(new ResolvedChildLink(link.getVariable(), description));
            }
            collectSubqueries(child, relationalLinks, queued, seenScalars);
        }

        String label = linkType.isEmpty() ? "" : "[" + linkType + "] ";
        String text = root ? label + title(node) : indent + CHILD_MARKER + label + title(node);
        rows.add(new PlanRow(node.getIndex(), text, predicates, childLinks));

        String childIndent = root ? "" : indent + (last ? BLANK_INDENT : PIPE_INDENT);
        for (int i = 0; i < relationalLinks.size(); i++) {
            PlanNode.ChildLink link = relationalLinks.get(i);
            visit(node(link.getChildIndex()), link.getType(), childIndent, false, i == relationalLinks.size() - 1);
        }
    }

    /**
     * Walk a scalar expression and collect the relational operators it references.
     * Operators already queued for the row are not collected again.
     */
    private void collectSubqueries(PlanNode scalar, List<PlanNode.ChildLink> out,
                                   Set<Integer> queued, Set<Integer> seenScalars) {
        if (!seenScalars.add(scalar.getIndex())) {
            return;
        }
        for (PlanNode.ChildLink link : scalar.getChildLinksList()) {
            PlanNode child = node(link.getChildIndex());
            if (child.getKind() != PlanNode.Kind.RELATIONAL) {
                collectSubqueries(child, out, queued, seenScalars);
            } else if (queued.add(child.getIndex())) {
                out.add(link);
            }
        }
    }

    private PlanNode node(int index) {
        PlanNode node = nodes.get(index);
        if (node == null) {
            throw new IllegalArgumentException("Plan node " + index + " not found in plan with " + nodes.size() + " nodes");
        }
        return node;
    }

    static boolean isPredicate(String linkType) {
        return PREDICATE_LINK_TYPES.contains(linkType) || linkType.endsWith("Condition");
    }

    /**
     * Operator title, e.g. {@code Local Distributed Union} or
     * {@code Table Scan (Full scan: true, Table: Singers)}
     */
    static String title(PlanNode node) {
        Map<String, Value> metadata = node.getMetadata().getFieldsMap();

        List<String> components = new ArrayList<>();
        for (String part : new String[] {
                stringValue(metadata.get("call_type")),
                stringValue(metadata.get("iterator_type")),
                trimScanSuffix(stringValue(metadata.get("scan_type"))),
                node.getDisplayName()}) {
            if (!part.isEmpty()) {
                components.add(part);
            }
        }
        String operator = String.join(" ", components);

        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, Value> entry : metadata.entrySet()) {
            String key = entry.getKey();
            if (TITLE_METADATA_KEYS.contains(key)) {
                continue;
            }
            if ("scan_type".equals(key)) {
                fields.add(trimScanSuffix(stringValue(entry.getValue())) + ": " + stringValue(metadata.get("scan_target")));
            } else {
                fields.add(key + ": " + stringValue(entry.getValue()));
            }
        }
        fields.sort(null);

        if (fields.isEmpty()) {
            return operator;
        }
        return operator + " (" + String.join(", ", fields) + ")";
    }

    private static String trimScanSuffix(String scanType) {
        return scanType.endsWith("Scan") ? scanType.substring(0, scanType.length() - "Scan".length()) : scanType;
    }

    static String stringValue(Value value) {
        if (value == null) {
            return "";
        }
        switch (value.getKindCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case BOOL_VALUE:
                return String.valueOf(value.getBoolValue());
            case NUMBER_VALUE:
                double number = value.getNumberValue();
                if (number == Math.rint(number) && !Double.isInfinite(number)) {
                    return String.valueOf((long) number);
                }
                return String.valueOf(number);
            case STRUCT_VALUE:
                return structValue(value.getStructValue());
            default:
                return "";
        }
    }

    private static String structValue(Struct struct) {
        List<String> fields = new ArrayList<>();
        for (Map.Entry<String, Value> entry : struct.getFieldsMap().entrySet()) {
            fields.add(entry.getKey() + ": " + stringValue(entry.getValue()));
        }
        fields.sort(null);
        return "{" + String.join(", ", fields) + "}";
    }
}
