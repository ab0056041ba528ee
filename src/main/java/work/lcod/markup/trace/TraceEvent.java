package work.lcod.markup.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One trace entry; {@code timestamp} is in seconds relative to the start of the parse call.
 */
public record TraceEvent(double timestamp, TraceEventKind kind, Map<String, Object> details) {
    public TraceEvent {
        Objects.requireNonNull(kind, "kind");
        details = details == null || details.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp);
        map.put("type", kind.label());
        map.put("details", details);
        return map;
    }
}
