package work.lcod.markup.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single lexical unit emitted by {@link Tokenizer}. Tokens are consumed right away by the tree builder.
 */
public record Token(
    TokenType type,
    String name,
    Map<String, String> attributes,
    boolean selfClosing,
    String data,
    boolean forceQuirks
) {
    private static final Token EOF_TOKEN = new Token(TokenType.EOF, null, Map.of(), false, null, false);

    public Token {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Token character(char value) {
        return new Token(TokenType.CHARACTER, null, Map.of(), false, String.valueOf(value), false);
    }

    public static Token startTag(String name, Map<String, String> attributes, boolean selfClosing) {
        return new Token(TokenType.START_TAG, name, attributes, selfClosing, null, false);
    }

    public static Token endTag(String name) {
        return new Token(TokenType.END_TAG, name, Map.of(), false, null, false);
    }

    public static Token eof() {
        return EOF_TOKEN;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.label());
        map.put("name", name);
        map.put("attributes", attributes);
        map.put("self_closing", selfClosing);
        map.put("data", data);
        map.put("force_quirks", forceQuirks);
        return map;
    }

    @Override
    public String toString() {
        return switch (type) {
            case CHARACTER -> "Char('" + data + "')";
            case START_TAG -> "<" + name + (selfClosing ? "/>" : ">");
            case END_TAG -> "</" + name + ">";
            default -> type.label() + "(" + (name == null ? "" : name) + ")";
        };
    }
}
