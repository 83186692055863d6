package slim.expr;

public enum ExprTokenType {

    // literals
    IDENTIFIER,
    VARIABLE,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,
    KEYWORD_LITERAL,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,

    // symbols
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA, DOT,

    EOF
}
