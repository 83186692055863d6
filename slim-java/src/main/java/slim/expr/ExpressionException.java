package slim.expr;

import slim.CompileException;
import slim.SourcePosition;

public class ExpressionException extends CompileException {
    public ExpressionException(String reason, SourcePosition position) {
        super(reason, position);
    }
}
