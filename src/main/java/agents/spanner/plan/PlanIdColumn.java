package agents.spanner.plan;

import java.util.List;
import java.util.Locale;

/**
 * Width of the row identifier column shared by the cross-reference sections of a plan report.
 */
public class PlanIdColumn {

    private final int maxIdLength;

    private PlanIdColumn(int maxIdLength) {
        this.maxIdLength = maxIdLength;
    }

    /**
     * Derive the column from the digit count of the largest ID, 0 for no rows
     */
    public static PlanIdColumn of(List<PlanRow> rows) {
        int maxIdLength = 0;
        for (PlanRow row : rows) {
            int length = String.valueOf(row.getId()).length();
            if (length > maxIdLength) {
                maxIdLength = length;
            }
        }
        return new PlanIdColumn(maxIdLength);
    }

    public int getMaxIdLength() {
        return maxIdLength;
    }

    /**
     * Prefix for the first line of a row: the ID right-justified, then a colon.
     * Always ASCII digits, like {@link PlanRow#formatId()} in the table.
     */
    public String idPrefix(int id) {
        return String.format(Locale.ROOT, "%" + (maxIdLength > 0 ? maxIdLength : "") + "d:", id);
    }

    /**
     * Prefix for the following lines of the same row, as wide as {@link #idPrefix(int)}
     */
    public String continuationPrefix() {
        return " ".repeat(maxIdLength + 1);
    }

    /**
     * Pick the prefix for a row line depending on whether the row already showed its ID
     */
    public String prefix(int id, boolean idShown) {
        return idShown ? continuationPrefix() : idPrefix(id);
    }
}
