package work.lcod.markup.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.tree.TreeNode;

class IntegrityVerifierTest {
    private final MarkupParser parser = new MarkupParser();

    @Test
    void reportsDepthOverLimit() {
        TreeNode root = parser.parse("<div><div><div></div></div></div>");
        IntegrityReport report = new IntegrityVerifier(2, 100).verify(root);
        assertFalse(report.valid());
        assertEquals(4, report.maxDepth());
        assertEquals(List.of("DOM depth (4) exceeds limit (2)"), report.issues());
    }

    @Test
    void reportsNodeCountOverLimit() {
        TreeNode root = parser.parse("<b></b><i></i><u></u>");
        IntegrityReport report = new IntegrityVerifier(10, 3).verify(root);
        assertFalse(report.valid());
        assertEquals(4, report.nodeCount());
        assertEquals(List.of("Node count (4) exceeds limit (3)"), report.issues());
    }

    @Test
    void limitsAreInclusive() {
        IntegrityReport report = new IntegrityVerifier(2, 2).verify(parser.parse("<p>x</p>"));
        assertTrue(report.valid());
        assertTrue(report.issues().isEmpty());
    }

    @Test
    void readsLimitsFromConfiguration() {
        var config = MarkupConfiguration.builder().maxDepth(1).build();
        assertFalse(IntegrityVerifier.from(config).verify(parser.parse("<p></p>")).valid());
        assertThrows(IllegalArgumentException.class, () -> new IntegrityVerifier(0, 10));
    }
}
