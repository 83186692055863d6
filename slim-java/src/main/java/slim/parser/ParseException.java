package slim.parser;

import slim.CompileException;
import slim.SourcePosition;

public class ParseException extends CompileException {
    public ParseException(String reason, SourcePosition position) {
        super(reason, position);
    }
}
