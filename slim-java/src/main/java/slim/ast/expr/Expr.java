package slim.ast.expr;

public sealed interface Expr
        permits Literal, Identifier, Variable, Selector,
        UnaryExpr, BinaryExpr, CallExpr, ParenExpr {}
