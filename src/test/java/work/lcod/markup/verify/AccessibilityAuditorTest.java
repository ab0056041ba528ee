package work.lcod.markup.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupParser;

class AccessibilityAuditorTest {
    private final MarkupParser parser = new MarkupParser();
    private final AccessibilityAuditor auditor = new AccessibilityAuditor();

    @Test
    void flagsImagesWithoutAltText() {
        List<AccessibilityFinding> findings = auditor.audit(parser.parse(
            "<img src=a.png><img id=logo src=b.png alt=\" \"><img src=c.png alt=\"Chart\">"
        ));
        assertEquals(2, findings.size());
        assertEquals(AccessibilityFinding.Severity.CRITICAL, findings.get(0).severity());
        assertEquals("N/A", findings.get(0).nodeId());
        assertEquals("logo", findings.get(1).nodeId());
        assertEquals("Missing 'alt' attribute", findings.get(1).issue());
    }

    @Test
    void flagsEmptyHeadings() {
        List<AccessibilityFinding> findings = auditor.audit(parser.parse("<h1>Title</h1><h2 id=sub>  </h2>"));
        assertEquals(1, findings.size());
        AccessibilityFinding finding = findings.get(0);
        assertEquals("h2", finding.element());
        assertEquals(AccessibilityFinding.Severity.WARNING, finding.severity());
        assertEquals("sub", finding.toMap().get("node_id"));
    }

    @Test
    void cleanDocumentHasNoFindings() {
        assertTrue(auditor.audit(parser.parse("<h1>Hi</h1><p>text</p>")).isEmpty());
    }
}
