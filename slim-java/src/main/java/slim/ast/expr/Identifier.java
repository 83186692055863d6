package slim.ast.expr;

public record Identifier(String name) implements Expr {}
