package work.lcod.markup.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.markup.api.MarkupParser;
import work.lcod.markup.tree.TreeNode;

class SemanticComplianceAuditorTest {
    private final SemanticComplianceAuditor auditor = new SemanticComplianceAuditor();

    @Test
    void parsedTreeNeverNestsBlockInParagraph() {
        AuditReport report = auditor.audit(new MarkupParser().parse("<p>Text<div>Block</div>"));
        assertTrue(report.passed());
        assertEquals(100, report.score());
        assertTrue(report.violations().isEmpty());
    }

    @Test
    void reportsHandBuiltViolation() {
        TreeNode root = TreeNode.root();
        root.appendChild(new TreeNode("p")).appendChild(new TreeNode("div"));
        AuditReport report = auditor.audit(root);
        assertEquals(AuditReport.Status.FAIL, report.status());
        assertEquals(90, report.score());
        assertEquals(List.of("Invalid nesting: <div> inside <p>"), report.violations());
    }

    @Test
    void onlyDirectChildrenCount() {
        TreeNode root = TreeNode.root();
        root.appendChild(new TreeNode("ul")).appendChild(new TreeNode("li")).appendChild(new TreeNode("div"));
        assertTrue(auditor.audit(root).passed());
    }

    @Test
    void scoreNeverDropsBelowZero() {
        TreeNode root = TreeNode.root();
        TreeNode list = root.appendChild(new TreeNode("ul"));
        for (int i = 0; i < 12; i++) {
            list.appendChild(new TreeNode("p"));
        }
        AuditReport report = auditor.audit(root);
        assertEquals(0, report.score());
        assertEquals(12, report.violations().size());
        assertEquals("FAIL", report.toMap().get("status"));
    }

    @Test
    void acceptsCustomRules() {
        var custom = new SemanticComplianceAuditor(Map.of("span", Set.of("div")));
        TreeNode root = TreeNode.root();
        root.appendChild(new TreeNode("span")).appendChild(new TreeNode("div"));
        assertEquals(List.of("Invalid nesting: <div> inside <span>"), custom.audit(root).violations());
    }
}
