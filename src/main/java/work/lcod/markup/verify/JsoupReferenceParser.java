package work.lcod.markup.verify;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import work.lcod.markup.tree.TreeNode;

/**
 * {@link ReferenceParser} backed by jsoup's HTML5 tree builder.
 */
public final class JsoupReferenceParser implements ReferenceParser {
    public static final String DOCUMENT_NAME = "#document";

    @Override
    public TreeNode parse(String input) {
        Document document = Jsoup.parse(input == null ? "" : input);
        TreeNode root = new TreeNode(DOCUMENT_NAME);
        Deque<Map.Entry<Element, TreeNode>> pending = new ArrayDeque<>();
        pending.push(Map.entry(document, root));
        while (!pending.isEmpty()) {
            var entry = pending.pop();
            for (Element child : entry.getKey().children()) {
                TreeNode node = new TreeNode(child.normalName(), attributesOf(child)).appendText(child.ownText());
                entry.getValue().appendChild(node);
                pending.push(Map.entry(child, node));
            }
        }
        return root.freeze();
    }

    private static Map<String, String> attributesOf(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return attributes;
    }
}
