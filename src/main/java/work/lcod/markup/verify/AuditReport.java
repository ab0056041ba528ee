package work.lcod.markup.verify;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link SemanticComplianceAuditor} run.
 */
public record AuditReport(int score, List<String> violations, Status status) {
    public AuditReport {
        violations = List.copyOf(violations);
    }

    public boolean passed() {
        return status == Status.PASS;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("score", score);
        map.put("violations", violations);
        map.put("status", status.name());
        return map;
    }

    public enum Status {
        PASS,
        FAIL
    }
}
