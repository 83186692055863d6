package slim.lexer;

public enum TokenType {

    // structure
    EOF,
    BLANK,
    INDENT,
    OUTDENT,

    // line constructs
    DOCTYPE,
    COMMENT,
    TEXT,
    TAG,
    ID,
    CLASS,
    ATTRIBUTE,
    RAW_MARKER,
    ASSIGNMENT,

    // control
    IF,
    ELSE_IF,
    ELSE,
    EACH,

    // composition
    NAMED_BLOCK,
    IMPORT,
    EXTEND
}
