package slim.ast.expr;

public record Selector(Expr target, String field) implements Expr {}
