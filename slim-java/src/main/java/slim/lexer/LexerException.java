package slim.lexer;

import slim.CompileException;
import slim.SourcePosition;

public class LexerException extends CompileException {
    public LexerException(String reason, SourcePosition position) {
        super(reason, position);
    }
}
