package work.lcod.markup.token;

/**
 * States of the tokenizer machine. {@link #BOGUS_COMMENT} is reserved; nothing transitions into it yet.
 */
public enum TokenizerState {
    DATA,
    TAG_OPEN,
    END_TAG_OPEN,
    TAG_NAME,
    BEFORE_ATTR_NAME,
    ATTR_NAME,
    AFTER_ATTR_NAME,
    BEFORE_ATTR_VALUE,
    ATTR_VALUE_DOUBLE_QUOTED,
    ATTR_VALUE_SINGLE_QUOTED,
    ATTR_VALUE_UNQUOTED,
    SELF_CLOSING_START_TAG,
    BOGUS_COMMENT
}
