package slim.ast.expr;

public record UnaryExpr(
        Operator op,
        Expr operand
) implements Expr {
    public enum Operator {
        NEG, PLUS, NOT
    }
}
