package work.lcod.markup.token;

/**
 * Lexical token kinds; {@link #label()} is the name used in serialized token lists.
 */
public enum TokenType {
    DOCTYPE("DOCTYPE"),
    START_TAG("StartTag"),
    END_TAG("EndTag"),
    COMMENT("Comment"),
    CHARACTER("Character"),
    EOF("EOF"),
    PARSE_ERROR("ParseError");

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
