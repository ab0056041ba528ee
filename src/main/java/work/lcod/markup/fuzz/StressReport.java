package work.lcod.markup.fuzz;

import java.util.LinkedHashMap;
import java.util.Map;

public record StressReport(
    int iterations,
    int completed,
    int failures,
    int timeouts,
    int totalViolations,
    int integrityFailures
) {
    public boolean clean() {
        return failures == 0 && timeouts == 0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("iterations", iterations);
        map.put("completed", completed);
        map.put("failures", failures);
        map.put("timeouts", timeouts);
        map.put("total_violations", totalViolations);
        map.put("integrity_failures", integrityFailures);
        map.put("clean", clean());
        return map;
    }
}
