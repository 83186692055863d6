package slim.expr;

import slim.SourcePosition;
import slim.ast.expr.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing parser for the expressions embedded in templates
 * (attribute values, guards, conditions, loop sources, assignments and
 * {@code #{...}} interpolations).
 *
 * <pre>
 *   or      := and ('||' and)*
 *   and     := compare ('&amp;&amp;' compare)*
 *   compare := add (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') add)*
 *   add     := mul (('+' | '-') mul)*
 *   mul     := unary (('*' | '/' | '%') unary)*
 *   unary   := ('!' | 'not' | '-' | '+') unary | postfix
 *   postfix := primary ('(' args? ')' | '.' IDENT)*
 *   primary := literal | IDENT | '$' IDENT? | '(' or ')'
 * </pre>
 */
public final class ExprParser {
    private final String source;
    private final SourcePosition origin;
    private final List<ExprToken> tokens;
    private int pos = 0;

    public ExprParser(String source, SourcePosition origin) {
        this.source = source;
        this.origin = origin;
        this.tokens = new ExprLexer(source, origin).tokenize();
    }

    public static Expr parse(String source, SourcePosition origin) {
        return new ExprParser(source, origin).parseExpression();
    }

    // ---------- entry ----------
    public Expr parseExpression() {
        if (check(ExprTokenType.EOF)) throw error(peek(), "Empty expression");
        Expr e = parseOr();
        if (!check(ExprTokenType.EOF)) throw error(peek(), "Unexpected trailing input");
        return e;
    }

    // ---------- binary levels ----------
    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(ExprTokenType.OR)) {
            ExprToken op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(ExprTokenType.AND)) {
            ExprToken op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(ExprTokenType.LT, ExprTokenType.LE, ExprTokenType.GT, ExprTokenType.GE,
                ExprTokenType.EQ, ExprTokenType.NEQ)) {
            ExprToken op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(ExprTokenType.PLUS, ExprTokenType.MINUS)) {
            ExprToken op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(ExprTokenType.STAR, ExprTokenType.SLASH, ExprTokenType.PERCENT)) {
            ExprToken op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    // ---------- unary / postfix / primary ----------
    private Expr parseUnary() {
        if (match(ExprTokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        }
        if (match(ExprTokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        }
        if (match(ExprTokenType.PLUS)) {
            return new UnaryExpr(UnaryExpr.Operator.PLUS, parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (match(ExprTokenType.LPAREN)) {
                List<Expr> args = new ArrayList<>();
                if (!check(ExprTokenType.RPAREN)) {
                    do { args.add(parseOr()); } while (match(ExprTokenType.COMMA));
                }
                consume(ExprTokenType.RPAREN, "Expected ')' after call arguments");
                e = new CallExpr(e, args);
                continue;
            }
            if (match(ExprTokenType.DOT)) {
                ExprToken name = consume(ExprTokenType.IDENTIFIER, "Expected field name after '.'");
                e = new Selector(e, name.lexeme());
                continue;
            }
            if (check(ExprTokenType.LBRACKET)) {
                throw error(peek(), "Unsupported: index expression");
            }
            if (check(ExprTokenType.LBRACE)) {
                throw error(peek(), "Unsupported: composite literal");
            }
            break;
        }
        return e;
    }

    private Expr parsePrimary() {
        if (match(ExprTokenType.INT_LITERAL, ExprTokenType.FLOAT_LITERAL, ExprTokenType.STRING_LITERAL,
                ExprTokenType.CHAR_LITERAL, ExprTokenType.KEYWORD_LITERAL)) {
            return new Literal(previous().lexeme());
        }
        if (match(ExprTokenType.IDENTIFIER)) return new Identifier(previous().lexeme());
        if (match(ExprTokenType.VARIABLE)) return new Variable(previous().lexeme());
        if (match(ExprTokenType.LPAREN)) {
            Expr e = parseOr();
            consume(ExprTokenType.RPAREN, "Expected ')'");
            return new ParenExpr(e);
        }
        if (check(ExprTokenType.LBRACKET)) throw error(peek(), "Unsupported: slice or array literal");
        throw error(peek(), "Expected expression");
    }

    // ---------- helpers ----------
    private boolean match(ExprTokenType... types) {
        for (ExprTokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private ExprToken consume(ExprTokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(ExprTokenType t) {
        return peek().type() == t;
    }

    private ExprToken advance() {
        if (!check(ExprTokenType.EOF)) pos++;
        return previous();
    }

    private ExprToken peek() { return tokens.get(pos); }
    private ExprToken previous() { return tokens.get(pos - 1); }

    private ExpressionException error(ExprToken at, String msg) {
        String got = at.type() == ExprTokenType.EOF ? "end of expression" : at.type() + " '" + at.lexeme() + "'";
        return new ExpressionException("Unable to parse expression `" + source + "`: "
                + msg + " (got " + got + " at offset " + at.offset() + ")", origin);
    }

    private static BinaryExpr.Operator toBinOp(ExprTokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
