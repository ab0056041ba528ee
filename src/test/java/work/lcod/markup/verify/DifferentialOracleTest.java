package work.lcod.markup.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.tree.TreeNode;

class DifferentialOracleTest {
    private final MarkupParser parser = new MarkupParser();

    @Test
    void matchesJsoupOnWellFormedMarkup() {
        String input = "<div><p>a</p><span>b</span></div>";
        OracleReport report = new DifferentialOracle().compare(input, parser.parse(input));
        assertTrue(report.matches(), report.details());
        assertEquals(3, report.refTagCount());
        assertEquals(3, report.ourTagCount());
        assertEquals("Structure matches reference", report.details());
    }

    @Test
    void jsoupReferenceDropsDocumentWrappers() {
        TreeNode reference = new JsoupReferenceParser().parse("<p>x</p>");
        assertEquals(JsoupReferenceParser.DOCUMENT_NAME, reference.name());
        assertEquals(List.of("p"), DifferentialOracle.tagSequence(reference));
    }

    @Test
    void reportsFirstDivergingElement() {
        ReferenceParser stub = input -> {
            TreeNode root = new TreeNode("#document");
            root.appendChild(new TreeNode("div")).appendChild(new TreeNode("em"));
            return root.freeze();
        };
        OracleReport report = new DifferentialOracle(stub).compare("<div><b>x</b></div>", parser.parse("<div><b>x</b></div>"));
        assertFalse(report.matches());
        assertEquals("Structural discrepancy detected at element 1: reference has <em>, parser has <b>", report.details());
    }

    @Test
    void reportsCountMismatch() {
        ReferenceParser stub = input -> new TreeNode("#document").freeze();
        OracleReport report = new DifferentialOracle(stub).compare("<i></i>", parser.parse("<i></i>"));
        assertFalse(report.matches());
        assertEquals(0, report.refTagCount());
        assertEquals(1, report.ourTagCount());
        assertTrue(report.details().contains("reference has 0 elements, parser has 1"));
    }
}
