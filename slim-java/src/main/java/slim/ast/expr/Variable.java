package slim.ast.expr;

public record Variable(String name) implements Expr {

    public boolean isDot() {
        return name.isEmpty();
    }
}
