package work.lcod.markup.verify;

import java.util.LinkedHashMap;
import java.util.Map;

public record AccessibilityFinding(String element, String issue, Severity severity, String nodeId) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("element", element);
        map.put("issue", issue);
        map.put("severity", severity.name());
        map.put("node_id", nodeId);
        return map;
    }

    public enum Severity {
        CRITICAL,
        WARNING
    }
}
