package agents.spanner.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders plan rows as a bordered two column table (ID, Operator).
 *
 * <pre>
 * +----+----------+
 * | ID | Operator |
 * +----+----------+
 * |  0 | Foo      |
 * | *1 | +- Bar   |
 * +----+----------+
 * </pre>
 *
 * IDs are right aligned, operator text is left aligned and never wrapped. A cell containing
 * newlines spans several physical lines of the same table row.
 */
public class PlanTreeTable {

    private static final String ID_HEADER = "ID";
    private static final String OPERATOR_HEADER = "Operator";

    private PlanTreeTable() {
    }

    /**
     * Render the table, or an empty string when there are no rows (no header either).
     */
    public static String render(List<PlanRow> rows) {
        if (rows.isEmpty()) {
            return "";
        }

        List<String[]> idCells = new ArrayList<>();
        List<String[]> textCells = new ArrayList<>();
        int idWidth = displayWidth(ID_HEADER);
        int textWidth = displayWidth(OPERATOR_HEADER);

        for (PlanRow row : rows) {
            String[] idLines = splitLines(row.formatId());
            String[] textLines = splitLines(row.getText());
            idCells.add(idLines);
            textCells.add(textLines);
            idWidth = Math.max(idWidth, maxWidth(idLines));
            textWidth = Math.max(textWidth, maxWidth(textLines));
        }

        String border = "+" + "-".repeat(idWidth + 2) + "+" + "-".repeat(textWidth + 2) + "+\n";

        StringBuilder sb = new StringBuilder();
        sb.append(border);
        appendLine(sb, padRight(ID_HEADER, idWidth), padRight(OPERATOR_HEADER, textWidth));
        sb.append(border);

        for (int i = 0; i < rows.size(); i++) {
            String[] idLines = idCells.get(i);
            String[] textLines = textCells.get(i);
            int height = Math.max(idLines.length, textLines.length);
            for (int line = 0; line < height; line++) {
                String id = line < idLines.length ? idLines[line] : "";
                String text = line < textLines.length ? textLines[line] : "";
                appendLine(sb, padLeft(id, idWidth), padRight(text, textWidth));
            }
        }
        sb.append(border);
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String idCell, String textCell) {
        sb.append("| ").append(idCell).append(" | ").append(textCell).append(" |\n");
    }

    private static String[] splitLines(String cell) {
        return cell.split("\n", -1);
    }

    private static int maxWidth(String[] lines) {
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, displayWidth(line));
        }
        return width;
    }

    private static int displayWidth(String s) {
        return s.codePointCount(0, s.length());
    }

    private static String padLeft(String s, int width) {
        return " ".repeat(width - displayWidth(s)) + s;
    }

    private static String padRight(String s, int width) {
        return s + " ".repeat(width - displayWidth(s));
    }
}
