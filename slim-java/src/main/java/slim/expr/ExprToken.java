package slim.expr;

public record ExprToken(ExprTokenType type, String lexeme, int offset) {

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + offset;
    }
}
