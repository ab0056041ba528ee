package work.lcod.markup.verify;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record IntegrityReport(boolean valid, int nodeCount, int maxDepth, List<String> issues) {
    public IntegrityReport {
        issues = List.copyOf(issues);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("valid", valid);
        map.put("node_count", nodeCount);
        map.put("max_depth", maxDepth);
        map.put("issues", issues);
        return map;
    }
}
