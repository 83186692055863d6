package slim.codegen;

import slim.SourcePosition;
import slim.ast.expr.*;
import slim.expr.ExprParser;
import slim.expr.ExpressionException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Lowers an expression into a sequence of single-operation bindings
 * ({@code {{$__slim_N := op a b}}}) written to the output, and returns the
 * reference holding the result: a temporary, a literal, {@code .field},
 * {@code $var} or {@code .}.
 *
 * <p>Operands are evaluated right to left; references live on a LIFO stack.
 * Temporary numbering is monotonic for the lifetime of the linearizer.</p>
 */
public final class ExpressionLinearizer {

    public static final String TEMP_PREFIX = "$__slim_";

    private static final Set<String> BUILTINS = Set.of(
            "len", "print", "printf", "println", "urlquery", "js", "json", "index", "html", "unescaped"
    );

    private final Output out;
    private final Deque<String> stack = new ArrayDeque<>();
    private int tempIndex = 0;
    private SourcePosition at = SourcePosition.UNKNOWN;

    public ExpressionLinearizer(Output out) {
        this.out = out;
    }

    public String lower(String source, SourcePosition position) {
        Expr expr = ExprParser.parse(source, position);
        at = position;
        stack.clear();
        exec(expr);
        return pop();
    }

    public String interpolate(String source, SourcePosition position) {
        return "{{" + lower(source, position) + "}}";
    }

    public int tempCount() {
        return tempIndex;
    }

    // ---------- lowering ----------
    private void exec(Expr e) {
        if (e instanceof BinaryExpr b) {
            execBinary(b);
        } else if (e instanceof UnaryExpr u) {
            exec(u.operand());
            String name = tempvar();
            out.write("{{" + name + " := " + unaryHelper(u.op()) + " " + pop() + "}}");
            stack.push(name);
        } else if (e instanceof ParenExpr p) {
            exec(p.inner());
        } else if (e instanceof Literal l) {
            stack.push(l.text());
        } else if (e instanceof Identifier id) {
            stack.push("." + id.name());
        } else if (e instanceof Variable v) {
            stack.push(v.isDot() ? "." : "$" + v.name());
        } else if (e instanceof Selector s) {
            exec(s.target());
            String base = pop();
            if (base.equals(".")) base = "";
            String name = tempvar();
            out.write("{{" + name + " := " + base + "." + s.field() + "}}");
            stack.push(name);
        } else if (e instanceof CallExpr c) {
            execCall(c);
        } else {
            throw new ExpressionException("Unable to parse expression. Unsupported: " + e, at);
        }
    }

    private void execBinary(BinaryExpr b) {
        exec(b.right());
        exec(b.left());

        String name = tempvar();
        boolean negate = false;
        String helper;
        switch (b.op()) {
            case ADD -> helper = "__slim_add";
            case SUB -> helper = "__slim_sub";
            case MUL -> helper = "__slim_mul";
            case DIV -> helper = "__slim_quo";
            case MOD -> helper = "__slim_rem";
            case AND -> helper = "and";
            case OR -> helper = "or";
            case EQ -> helper = "__slim_eql";
            case NE -> {
                helper = "__slim_eql";
                negate = true;
            }
            case LT -> helper = "__slim_lss";
            case GT -> helper = "__slim_gtr";
            case LE -> {
                helper = "__slim_gtr";
                negate = true;
            }
            case GE -> {
                helper = "__slim_lss";
                negate = true;
            }
            default -> throw new ExpressionException("Unexpected operator: " + b.op(), at);
        }

        String left = pop();
        String right = pop();
        out.write("{{" + name + " := " + helper + " " + left + " " + right + "}}");

        if (negate) {
            String negated = tempvar();
            out.write("{{" + negated + " := not " + name + "}}");
            stack.push(negated);
        } else {
            stack.push(name);
        }
    }

    private void execCall(CallExpr c) {
        for (int i = c.args().size() - 1; i >= 0; i--) exec(c.args().get(i));

        // the call result is numbered ahead of any callee temporaries
        String name = tempvar();

        StringBuilder sb = new StringBuilder();
        sb.append("{{").append(name).append(" := ");
        if (c.callee() instanceof Identifier id && BUILTINS.contains(id.name())) {
            sb.append(id.name());
        } else {
            exec(c.callee());
            sb.append("call ").append(pop());
        }

        for (int i = 0; i < c.args().size(); i++) sb.append(' ').append(pop());
        sb.append("}}");

        out.write(sb.toString());
        stack.push(name);
    }

    private static String unaryHelper(UnaryExpr.Operator op) {
        return switch (op) {
            case NEG -> "__slim_minus";
            case PLUS -> "__slim_plus";
            case NOT -> "not";
        };
    }

    private String tempvar() {
        tempIndex++;
        return TEMP_PREFIX + tempIndex;
    }

    private String pop() {
        return stack.isEmpty() ? "" : stack.pop();
    }
}
