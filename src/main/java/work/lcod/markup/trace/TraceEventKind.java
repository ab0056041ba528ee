package work.lcod.markup.trace;

/**
 * Kinds of events recorded while tokenizing and building a tree.
 */
public enum TraceEventKind {
    TOKENIZATION_START("tokenization_start"),
    TAG_EMITTED("tag_emitted"),
    ATTRIBUTE_PARSED("attr_parsed"),
    PARSING_START("parsing_start"),
    IMPLICIT_CLOSURE("implicit_closure"),
    START_TAG_PROCESSED("start_tag_processed"),
    END_TAG_PROCESSED("end_tag_processed"),
    CHARACTER_PROCESSED("character_processed"),
    PARSING_COMPLETE("parsing_complete"),
    PARSE_ERROR("parse_error");

    private final String label;

    TraceEventKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
