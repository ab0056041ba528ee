package work.lcod.markup.verify;

import java.util.ArrayList;
import java.util.List;
import work.lcod.markup.api.MarkupConfiguration;
import work.lcod.markup.tree.TreeMetrics;
import work.lcod.markup.tree.TreeNode;

/**
 * Post-parse guard enforcing depth and node-count limits. The root counts as one node at depth 1.
 */
public final class IntegrityVerifier {
    private final int maxDepth;
    private final int maxNodes;

    public IntegrityVerifier(int maxDepth, int maxNodes) {
        if (maxDepth <= 0 || maxNodes <= 0) {
            throw new IllegalArgumentException("Integrity limits must be positive (maxDepth=" + maxDepth + ", maxNodes=" + maxNodes + ")");
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    public static IntegrityVerifier from(MarkupConfiguration configuration) {
        return new IntegrityVerifier(configuration.maxDepth(), configuration.maxNodes());
    }

    public IntegrityReport verify(TreeNode root) {
        TreeMetrics.Summary summary = TreeMetrics.summarize(root);
        List<String> issues = new ArrayList<>();
        if (summary.nodeCount() > maxNodes) {
            issues.add("Node count (" + summary.nodeCount() + ") exceeds limit (" + maxNodes + ")");
        }
        if (summary.maxDepth() > maxDepth) {
            issues.add("DOM depth (" + summary.maxDepth() + ") exceeds limit (" + maxDepth + ")");
        }
        return new IntegrityReport(issues.isEmpty(), summary.nodeCount(), summary.maxDepth(), issues);
    }
}
