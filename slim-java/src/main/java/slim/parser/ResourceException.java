package slim.parser;

import slim.CompileException;
import slim.SourcePosition;

public class ResourceException extends CompileException {
    public ResourceException(String reason, SourcePosition position, Throwable cause) {
        super(reason, position, cause);
    }
}
