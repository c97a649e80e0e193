package agents.spanner.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a tools/call: an ordered list of text contents.
 *
 * <pre>
 * {"content": [{"type": "text", "text": "..."}], "isError": false}
 * </pre>
 */
public class MCPToolResult {

    private final List<String> texts;

    private MCPToolResult(List<String> texts) {
        this.texts = Collections.unmodifiableList(new ArrayList<>(texts));
    }

    public static MCPToolResult text(String... texts) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, texts);
        return new MCPToolResult(list);
    }

    public static MCPToolResult texts(List<String> texts) {
        return new MCPToolResult(texts);
    }

    public List<String> getTexts() {
        return texts;
    }

    public JsonObject toJson() {
        JsonArray content = new JsonArray();
        for (String text : texts) {
            content.add(new JsonObject()
                .put("type", "text")
                .put("text", text));
        }
        return new JsonObject()
            .put("content", content)
            .put("isError", false);
    }
}
