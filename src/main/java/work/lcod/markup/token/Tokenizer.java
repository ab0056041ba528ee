package work.lcod.markup.token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.markup.trace.ParsingTrace;
import work.lcod.markup.trace.TraceEventKind;

/**
 * Character-level tokenizer driven by {@link TokenizerState}.
 *
 * <p>The scan is a single pass with a one-character reconsume flag: when a character is not valid in the current
 * state the machine switches state without advancing and replays the character. Tokenization never fails; broken
 * markup degrades into character tokens or discarded tag fragments, and irregularities are written to the trace as
 * parse errors.
 *
 * <p>Instances keep per-run state and must not be shared between threads.
 */
public final class Tokenizer {
    public static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input",
        "link", "meta", "param", "source", "track", "wbr"
    );

    private static final int EOF = -1;

    private final ParsingTrace trace;

    private TokenizerState state;
    private List<Token> tokens;
    private PendingTag tag;
    private StringBuilder attrName;
    private StringBuilder attrValue;

    public Tokenizer(ParsingTrace trace) {
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    public List<Token> tokenize(String text) {
        String input = text == null ? "" : text;
        state = TokenizerState.DATA;
        tokens = new ArrayList<>();
        tag = null;
        attrName = new StringBuilder();
        attrValue = new StringBuilder();
        trace.record(TraceEventKind.TOKENIZATION_START, Map.of("input_length", input.length()));

        int length = input.length();
        int pos = 0;
        boolean running = true;
        while (running) {
            int c = pos < length ? input.charAt(pos) : EOF;
            boolean reconsume = false;
            switch (state) {
                case DATA -> {
                    if (c == '<') {
                        state = TokenizerState.TAG_OPEN;
                    } else if (c == EOF) {
                        running = false;
                    } else {
                        tokens.add(Token.character((char) c));
                    }
                }
                case TAG_OPEN -> {
                    if (c == '/') {
                        state = TokenizerState.END_TAG_OPEN;
                    } else if (c != EOF && Character.isLetter(c)) {
                        tag = new PendingTag(TokenType.START_TAG);
                        tag.name.append((char) c);
                        state = TokenizerState.TAG_NAME;
                    } else {
                        trace.error("invalid-first-character-of-tag-name at offset " + pos);
                        tokens.add(Token.character('<'));
                        state = TokenizerState.DATA;
                        reconsume = true;
                    }
                }
                case END_TAG_OPEN -> {
                    if (c != EOF && Character.isLetter(c)) {
                        tag = new PendingTag(TokenType.END_TAG);
                        tag.name.append((char) c);
                        state = TokenizerState.TAG_NAME;
                    } else {
                        trace.error("missing-end-tag-name at offset " + pos);
                        state = TokenizerState.DATA;
                        reconsume = c == EOF;
                    }
                }
                case TAG_NAME -> {
                    if (c == EOF) {
                        reconsume = discardAtEof(pos);
                    } else if (isWhitespace(c)) {
                        state = TokenizerState.BEFORE_ATTR_NAME;
                    } else if (c == '/') {
                        state = TokenizerState.SELF_CLOSING_START_TAG;
                    } else if (c == '>') {
                        emitTag();
                    } else {
                        tag.name.append((char) c);
                    }
                }
                case BEFORE_ATTR_NAME -> {
                    if (c == EOF) {
                        reconsume = discardAtEof(pos);
                    } else if (c == '/') {
                        state = TokenizerState.SELF_CLOSING_START_TAG;
                    } else if (c == '>') {
                        emitTag();
                    } else if (!isWhitespace(c)) {
                        startAttribute((char) c);
                    }
                }
                case ATTR_NAME -> {
                    if (c == EOF || isWhitespace(c) || c == '/' || c == '>') {
                        state = TokenizerState.AFTER_ATTR_NAME;
                        reconsume = true;
                    } else if (c == '=') {
                        state = TokenizerState.BEFORE_ATTR_VALUE;
                    } else {
                        attrName.append((char) c);
                    }
                }
                case AFTER_ATTR_NAME -> {
                    if (c == EOF) {
                        reconsume = discardAtEof(pos);
                    } else if (c == '=') {
                        state = TokenizerState.BEFORE_ATTR_VALUE;
                    } else if (c == '/') {
                        commitAttribute();
                        state = TokenizerState.SELF_CLOSING_START_TAG;
                    } else if (c == '>') {
                        commitAttribute();
                        emitTag();
                    } else if (!isWhitespace(c)) {
                        commitAttribute();
                        startAttribute((char) c);
                    }
                }
                case BEFORE_ATTR_VALUE -> {
                    if (c == EOF) {
                        reconsume = discardAtEof(pos);
                    } else if (c == '"') {
                        state = TokenizerState.ATTR_VALUE_DOUBLE_QUOTED;
                    } else if (c == '\'') {
                        state = TokenizerState.ATTR_VALUE_SINGLE_QUOTED;
                    } else if (c == '>') {
                        trace.error("missing-attribute-value for '" + lower(attrName) + "'");
                        resetAttribute();
                        emitTag();
                    } else if (!isWhitespace(c)) {
                        attrValue.append((char) c);
                        state = TokenizerState.ATTR_VALUE_UNQUOTED;
                    }
                }
                case ATTR_VALUE_DOUBLE_QUOTED, ATTR_VALUE_SINGLE_QUOTED -> {
                    char quote = state == TokenizerState.ATTR_VALUE_DOUBLE_QUOTED ? '"' : '\'';
                    if (c == EOF) {
                        reconsume = discardAtEof(pos);
                    } else if (c == quote) {
                        commitAttribute();
                        state = TokenizerState.BEFORE_ATTR_NAME;
                    } else {
                        attrValue.append((char) c);
                    }
                }
                case ATTR_VALUE_UNQUOTED -> {
                    if (c == EOF || isWhitespace(c) || c == '>') {
                        commitAttribute();
                        state = TokenizerState.BEFORE_ATTR_NAME;
                        reconsume = true;
                    } else {
                        attrValue.append((char) c);
                    }
                }
                case SELF_CLOSING_START_TAG -> {
                    if (c == '>') {
                        tag.selfClosing = true;
                        emitTag();
                    } else {
                        state = TokenizerState.BEFORE_ATTR_NAME;
                        reconsume = true;
                    }
                }
                case BOGUS_COMMENT -> {
                    // unreachable until comments are tokenized
                    state = TokenizerState.DATA;
                    reconsume = true;
                }
            }
            if (!reconsume) {
                if (c == EOF) {
                    running = false;
                }
                pos++;
            }
        }
        tokens.add(Token.eof());
        List<Token> result = tokens;
        tokens = null;
        tag = null;
        return result;
    }

    private void startAttribute(char first) {
        resetAttribute();
        attrName.append(first);
        state = TokenizerState.ATTR_NAME;
    }

    private void commitAttribute() {
        if (tag != null && attrName.length() > 0) {
            String name = lower(attrName);
            String value = attrValue.toString();
            if (tag.attributes.containsKey(name)) {
                trace.error("duplicate-attribute '" + name + "'");
            }
            tag.attributes.put(name, value);
            trace.record(TraceEventKind.ATTRIBUTE_PARSED, Map.of("name", name, "value", value));
        }
        resetAttribute();
    }

    private void resetAttribute() {
        attrName.setLength(0);
        attrValue.setLength(0);
    }

    private void emitTag() {
        String name = lower(tag.name);
        Token token;
        if (tag.type == TokenType.END_TAG) {
            token = Token.endTag(name);
        } else {
            token = Token.startTag(name, tag.attributes, tag.selfClosing || VOID_ELEMENTS.contains(name));
        }
        tokens.add(token);
        trace.record(TraceEventKind.TAG_EMITTED, Map.of("name", name, "kind", token.type().label()));
        tag = null;
        state = TokenizerState.DATA;
    }

    private boolean discardAtEof(int pos) {
        trace.error("eof-in-tag '" + lower(tag.name) + "' at offset " + pos);
        tag = null;
        resetAttribute();
        state = TokenizerState.DATA;
        return true;
    }

    private static String lower(CharSequence value) {
        return value.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static final class PendingTag {
        private final TokenType type;
        private final StringBuilder name = new StringBuilder();
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private boolean selfClosing;

        private PendingTag(TokenType type) {
            this.type = type;
        }
    }
}
