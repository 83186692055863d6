package slim.ast.expr;

public record Literal(String text) implements Expr {}
