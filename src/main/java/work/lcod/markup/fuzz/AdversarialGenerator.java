package work.lcod.markup.fuzz;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Produces messy but tag-balanced markup for stress runs.
 *
 * <p>A random walk of {@code complexity} steps opens tags, closes the most recent one, writes text, or writes a
 * complete {@code div} with a random id. Whatever is still open afterwards is closed in reverse order, so every start
 * tag has exactly one matching end tag in last-in-first-out order. Nesting is not required to be legal.
 */
public final class AdversarialGenerator {
    public static final List<String> TAGS = List.of("div", "p", "span", "b", "i", "ul", "li");

    private static final String ID_ALPHABET = "abc";
    private static final int ID_LENGTH = 5;

    private final Random random;

    public AdversarialGenerator() {
        this(new Random());
    }

    public AdversarialGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String generate(int complexity) {
        if (complexity < 0) {
            throw new IllegalArgumentException("complexity must not be negative: " + complexity);
        }
        StringBuilder out = new StringBuilder();
        Deque<String> open = new ArrayDeque<>();
        for (int step = 0; step < complexity; step++) {
            switch (Action.values()[random.nextInt(Action.values().length)]) {
                case OPEN -> {
                    String tag = TAGS.get(random.nextInt(TAGS.size()));
                    out.append('<').append(tag).append('>');
                    open.push(tag);
                }
                case CLOSE -> {
                    if (!open.isEmpty()) {
                        out.append("</").append(open.pop()).append('>');
                    }
                }
                case TEXT -> out.append(" fuzzy_data ");
                case ATTRIBUTE -> out.append("<div id=\"").append(randomId()).append("\" class=\"test\">content</div>");
            }
        }
        while (!open.isEmpty()) {
            out.append("</").append(open.pop()).append('>');
        }
        return out.toString();
    }

    private String randomId() {
        char[] id = new char[ID_LENGTH];
        for (int i = 0; i < id.length; i++) {
            id[i] = ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length()));
        }
        return new String(id);
    }

    private enum Action {
        OPEN,
        CLOSE,
        TEXT,
        ATTRIBUTE
    }
}
