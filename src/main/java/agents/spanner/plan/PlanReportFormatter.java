package agents.spanner.plan;

import java.util.List;

/**
 * Composes the human readable plan report: the operator tree table followed by the
 * predicate cross-reference.
 *
 * Child link descriptions are computed by {@link ChildLinkDescriber} but only appended when
 * {@code includeChildLinks} is set. The default report leaves them out.
 *
 * Instances hold no per-call state and can be shared between concurrent tool calls.
 */
public class PlanReportFormatter {

    private final boolean includeChildLinks;

    public PlanReportFormatter() {
        this(false);
    }

    public PlanReportFormatter(boolean includeChildLinks) {
        this.includeChildLinks = includeChildLinks;
    }

    public boolean isIncludeChildLinks() {
        return includeChildLinks;
    }

    public String format(List<PlanRow> rows) {
        PlanIdColumn idColumn = PlanIdColumn.of(rows);

        StringBuilder report = new StringBuilder();
        report.append(PlanTreeTable.render(rows));
        report.append(PredicateSection.render(rows, idColumn));
        if (includeChildLinks) {
            report.append(ChildLinkDescriber.render(rows, idColumn));
        }
        return report.toString();
    }
}
