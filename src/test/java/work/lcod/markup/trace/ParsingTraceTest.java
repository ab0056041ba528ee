package work.lcod.markup.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ParsingTraceTest {
    private final AtomicLong clock = new AtomicLong(1_000L);
    private final ParsingTrace trace = new ParsingTrace(clock::get);

    @Test
    void timestampsAreRelativeToTheStart() {
        clock.addAndGet(500_000_000L);
        trace.record(TraceEventKind.PARSING_START, Map.of("token_count", 3));
        TraceEvent event = trace.events().get(0);
        assertEquals(0.5d, event.timestamp(), 1e-9);
        assertEquals(3, event.details().get("token_count"));
    }

    @Test
    void errorsAreAlsoRecordedAsEvents() {
        trace.error("eof-in-tag 'div' at offset 4");
        assertEquals(List.of("eof-in-tag 'div' at offset 4"), trace.errors());
        assertEquals(1, trace.count(TraceEventKind.PARSE_ERROR));
    }

    @Test
    void finishFreezesTheDuration() {
        clock.addAndGet(2_000_000L);
        assertFalse(trace.isFinished());
        trace.finish();
        clock.addAndGet(5_000_000_000L);
        trace.finish();
        assertTrue(trace.isFinished());
        assertEquals(Duration.ofMillis(2), trace.duration());
    }

    @Test
    void exposesReadOnlyViews() {
        trace.record(TraceEventKind.TOKENIZATION_START);
        assertThrows(UnsupportedOperationException.class, () -> trace.events().clear());
        assertThrows(UnsupportedOperationException.class, () -> trace.errors().add("x"));
    }

    @Test
    void mapUsesEventLabels() {
        trace.record(TraceEventKind.ATTRIBUTE_PARSED, Map.of("name", "id", "value", "a"));
        clock.addAndGet(250_000_000L);
        trace.finish();
        Map<String, Object> map = trace.toMap();
        @SuppressWarnings("unchecked")
        var events = (List<Map<String, Object>>) map.get("events");
        assertEquals("attr_parsed", events.get(0).get("type"));
        assertEquals(0.25d, (Double) map.get("duration"), 1e-9);
        assertEquals(List.of(), map.get("errors"));
    }
}
