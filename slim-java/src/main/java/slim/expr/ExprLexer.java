package slim.expr;

import slim.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ExprLexer {

    private final String source;
    private final SourcePosition origin;
    private final List<ExprToken> tokens = new ArrayList<>();

    private int pos = 0;

    private static final Map<String, ExprTokenType> keywords = Map.of(
            "true", ExprTokenType.KEYWORD_LITERAL,
            "false", ExprTokenType.KEYWORD_LITERAL,
            "nil", ExprTokenType.KEYWORD_LITERAL,
            "not", ExprTokenType.NOT
    );

    public ExprLexer(String source, SourcePosition origin) {
        this.source = source;
        this.origin = origin;
    }

    public List<ExprToken> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int start = pos;
            char c = advance();

            switch (c) {
                case '+' -> add(ExprTokenType.PLUS, "+", start);
                case '-' -> add(ExprTokenType.MINUS, "-", start);
                case '*' -> add(ExprTokenType.STAR, "*", start);
                case '/' -> add(ExprTokenType.SLASH, "/", start);
                case '%' -> add(ExprTokenType.PERCENT, "%", start);

                case '=' -> {
                    if (match('=')) add(ExprTokenType.EQ, "==", start);
                    else error("Unexpected '='", start);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? ExprTokenType.NEQ : ExprTokenType.NOT, neq ? "!=" : "!", start);
                }

                case '<' -> {
                    if (peek() == '<') error("Unsupported operator '<<'", start);
                    boolean le = match('=');
                    add(le ? ExprTokenType.LE : ExprTokenType.LT, le ? "<=" : "<", start);
                }
                case '>' -> {
                    if (peek() == '>') error("Unsupported operator '>>'", start);
                    boolean ge = match('=');
                    add(ge ? ExprTokenType.GE : ExprTokenType.GT, ge ? ">=" : ">", start);
                }

                case '&' -> {
                    if (match('&')) add(ExprTokenType.AND, "&&", start);
                    else error("Unsupported operator '&'", start);
                }
                case '|' -> {
                    if (match('|')) add(ExprTokenType.OR, "||", start);
                    else error("Unsupported operator '|'", start);
                }

                case '(' -> add(ExprTokenType.LPAREN, "(", start);
                case ')' -> add(ExprTokenType.RPAREN, ")", start);
                case '[' -> add(ExprTokenType.LBRACKET, "[", start);
                case ']' -> add(ExprTokenType.RBRACKET, "]", start);
                case '{' -> add(ExprTokenType.LBRACE, "{", start);
                case '}' -> add(ExprTokenType.RBRACE, "}", start);
                case ',' -> add(ExprTokenType.COMMA, ",", start);
                case '.' -> {
                    if (isDigit(peek())) numberLiteral(c, start);
                    else add(ExprTokenType.DOT, ".", start);
                }

                case '"' -> quoted('"', ExprTokenType.STRING_LITERAL, start);
                case '\'' -> quoted('\'', ExprTokenType.CHAR_LITERAL, start);
                case '`' -> rawString(start);
                case '$' -> variable(start);

                default -> {
                    if (isDigit(c)) numberLiteral(c, start);
                    else if (isAlpha(c)) identifier(c, start);
                    else error("Unexpected character: " + c, start);
                }
            }
        }

        tokens.add(new ExprToken(ExprTokenType.EOF, "", pos));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int start) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            sb.append(advance());
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) sb.append(advance());
            add(ExprTokenType.INT_LITERAL, sb.toString(), start);
            return;
        }

        boolean isFloat = first == '.';

        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }

        // "1." is a float, "1.5" too; "1.x" is not a number followed by a field
        if (!isFloat && !isAtEnd() && peek() == '.' && peekNext() != '.' && !isAlpha(peekNext())) {
            isFloat = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            char n = peekNext();
            boolean signed = (n == '+' || n == '-') && pos + 2 < source.length() && isDigit(source.charAt(pos + 2));
            if (isDigit(n) || signed) {
                isFloat = true;
                sb.append(advance());
                if (signed) sb.append(advance());
                while (!isAtEnd() && isDigit(peek())) sb.append(advance());
            }
        }

        if (!isAtEnd() && isAlpha(peek())) {
            error("Malformed number literal", start);
        }

        add(isFloat ? ExprTokenType.FLOAT_LITERAL : ExprTokenType.INT_LITERAL, sb.toString(), start);
    }

    private void identifier(char first, int start) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        add(keywords.getOrDefault(text, ExprTokenType.IDENTIFIER), text, start);
    }

    private void variable(int start) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }
        add(ExprTokenType.VARIABLE, sb.toString(), start);
    }

    // lexeme keeps the quotes and escapes exactly as written
    private void quoted(char quote, ExprTokenType type, int start) {
        StringBuilder sb = new StringBuilder();
        sb.append(quote);

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            sb.append(c);
            if (c == '\\') {
                if (isAtEnd()) break;
                sb.append(advance());
            }
        }

        if (isAtEnd()) error("Unterminated literal", start);

        sb.append(advance());
        add(type, sb.toString(), start);
    }

    private void rawString(int start) {
        int end = source.indexOf('`', pos);
        if (end < 0) error("Unterminated raw string", start);
        String text = source.substring(start, end + 1);
        pos = end + 1;
        add(ExprTokenType.STRING_LITERAL, text, start);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') advance();
            else return;
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        return source.charAt(pos++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(ExprTokenType type, String lexeme, int offset) {
        tokens.add(new ExprToken(type, lexeme, offset));
    }

    private void error(String message, int offset) {
        throw new ExpressionException("Unable to parse expression `" + source + "`: "
                + message + " at offset " + offset, origin);
    }
}
