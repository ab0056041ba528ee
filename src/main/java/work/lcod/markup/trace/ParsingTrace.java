package work.lcod.markup.trace;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Append-only event log for a single parse call.
 *
 * <p>The same instance is handed to the tokenizer and to the tree builder; it is not thread-safe and must not be
 * shared between concurrent parses. Once {@link #finish()} has been called the trace is treated as read-only.
 */
public final class ParsingTrace {
    private final LongSupplier clock;
    private final long startNanos;
    private final List<TraceEvent> events = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private long endNanos = -1L;

    public ParsingTrace() {
        this(System::nanoTime);
    }

    ParsingTrace(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startNanos = clock.getAsLong();
    }

    public void record(TraceEventKind kind) {
        record(kind, Map.of());
    }

    public void record(TraceEventKind kind, Map<String, Object> details) {
        double elapsed = (clock.getAsLong() - startNanos) / 1_000_000_000d;
        events.add(new TraceEvent(elapsed, kind, details));
    }

    public void error(String message) {
        errors.add(message);
        record(TraceEventKind.PARSE_ERROR, Map.of("message", message));
    }

    public void finish() {
        if (endNanos < 0) {
            endNanos = clock.getAsLong();
        }
    }

    public boolean isFinished() {
        return endNanos >= 0;
    }

    /**
     * Elapsed time of the call; before {@link #finish()} this is measured against the current clock.
     */
    public Duration duration() {
        long end = isFinished() ? endNanos : clock.getAsLong();
        return Duration.ofNanos(end - startNanos);
    }

    public List<TraceEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public long count(TraceEventKind kind) {
        return events.stream().filter(event -> event.kind() == kind).count();
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> serializedEvents = new ArrayList<>(events.size());
        for (TraceEvent event : events) {
            serializedEvents.add(event.toMap());
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("events", serializedEvents);
        map.put("errors", List.copyOf(errors));
        map.put("duration", duration().toNanos() / 1_000_000_000d);
        return map;
    }
}
