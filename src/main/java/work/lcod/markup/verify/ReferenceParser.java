package work.lcod.markup.verify;

import work.lcod.markup.tree.TreeNode;

/**
 * Independent, standards-grade parser used as the oracle's reference. Implementations convert their own document
 * model into a {@link TreeNode} whose root stands for the document itself.
 */
@FunctionalInterface
public interface ReferenceParser {
    TreeNode parse(String input);
}
