package slim.ast;

import slim.SourcePosition;

public record Assignment(SourcePosition position, String variable, String expression) implements Node {}
