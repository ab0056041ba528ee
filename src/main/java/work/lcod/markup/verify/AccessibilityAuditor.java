package work.lcod.markup.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.lcod.markup.tree.TreeMetrics;
import work.lcod.markup.tree.TreeNode;

/**
 * Flags images without alternative text and headings without text.
 */
public final class AccessibilityAuditor {
    private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");
    private static final String NO_ID = "N/A";

    public List<AccessibilityFinding> audit(TreeNode root) {
        List<AccessibilityFinding> findings = new ArrayList<>();
        TreeMetrics.preOrder(root, node -> {
            String id = node.attribute("id").orElse(NO_ID);
            if ("img".equals(node.name()) && node.attribute("alt").map(String::isBlank).orElse(true)) {
                findings.add(new AccessibilityFinding("img", "Missing 'alt' attribute", AccessibilityFinding.Severity.CRITICAL, id));
            }
            if (HEADINGS.contains(node.name()) && node.textContent().isBlank()) {
                findings.add(new AccessibilityFinding(node.name(), "Empty heading", AccessibilityFinding.Severity.WARNING, id));
            }
        });
        return findings;
    }
}
