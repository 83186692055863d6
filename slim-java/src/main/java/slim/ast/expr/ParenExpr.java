package slim.ast.expr;

public record ParenExpr(Expr inner) implements Expr {}
