package work.lcod.markup.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.markup.tree.TreeMetrics;
import work.lcod.markup.tree.TreeNode;

/**
 * Compares the element structure of a parsed tree with the tree a {@link ReferenceParser} builds from the same input.
 *
 * <p>Both trees are flattened to their pre-order tag names, leaving out the root and the document wrappers
 * ({@code html}, {@code head}, {@code body}) that reference parsers synthesize. Attributes and text are ignored.
 */
public final class DifferentialOracle {
    public static final Set<String> WRAPPER_NAMES = Set.of("html", "head", "body");

    private final ReferenceParser reference;

    public DifferentialOracle() {
        this(new JsoupReferenceParser());
    }

    public DifferentialOracle(ReferenceParser reference) {
        this.reference = Objects.requireNonNull(reference, "reference");
    }

    public OracleReport compare(String input, TreeNode tree) {
        List<String> expected = tagSequence(reference.parse(input));
        List<String> actual = tagSequence(tree);
        boolean matches = expected.equals(actual);
        String details = matches ? "Structure matches reference" : describeMismatch(expected, actual);
        return new OracleReport(matches, expected.size(), actual.size(), details);
    }

    public static List<String> tagSequence(TreeNode root) {
        List<String> names = new ArrayList<>();
        TreeMetrics.preOrder(root, node -> {
            if (node != root && !WRAPPER_NAMES.contains(node.name())) {
                names.add(node.name());
            }
        });
        return names;
    }

    private static String describeMismatch(List<String> expected, List<String> actual) {
        int limit = Math.min(expected.size(), actual.size());
        for (int i = 0; i < limit; i++) {
            if (!expected.get(i).equals(actual.get(i))) {
                return "Structural discrepancy detected at element " + i
                    + ": reference has <" + expected.get(i) + ">, parser has <" + actual.get(i) + ">";
            }
        }
        return "Structural discrepancy detected: reference has " + expected.size()
            + " elements, parser has " + actual.size();
    }
}
