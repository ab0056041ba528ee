package work.lcod.markup.verify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.markup.tree.TreeMetrics;
import work.lcod.markup.tree.TreeNode;

/**
 * Static content-model check: reports every direct parent/child pair listed in the nesting table.
 * Only direct children are inspected; a {@code div} two levels below a {@code p} is not a violation.
 */
public final class SemanticComplianceAuditor {
    public static final Map<String, Set<String>> DEFAULT_RULES = Map.of(
        "p", Set.of("div", "p", "blockquote", "header", "footer", "section", "article"),
        "ul", Set.of("p", "div"),
        "li", Set.of("header", "footer")
    );

    private static final int PENALTY = 10;

    private final Map<String, Set<String>> forbiddenChildren;

    public SemanticComplianceAuditor() {
        this(DEFAULT_RULES);
    }

    public SemanticComplianceAuditor(Map<String, Set<String>> forbiddenChildren) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        forbiddenChildren.forEach((parent, children) -> copy.put(parent, Set.copyOf(children)));
        this.forbiddenChildren = Map.copyOf(copy);
    }

    public AuditReport audit(TreeNode root) {
        List<String> violations = new ArrayList<>();
        TreeMetrics.preOrder(root, node -> {
            Set<String> forbidden = forbiddenChildren.get(node.name());
            if (forbidden == null) {
                return;
            }
            for (TreeNode child : node.children()) {
                if (forbidden.contains(child.name())) {
                    violations.add("Invalid nesting: <" + child.name() + "> inside <" + node.name() + ">");
                }
            }
        });
        int score = Math.max(0, 100 - PENALTY * violations.size());
        return new AuditReport(score, violations, score == 100 ? AuditReport.Status.PASS : AuditReport.Status.FAIL);
    }
}
