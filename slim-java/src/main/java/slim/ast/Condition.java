package slim.ast;

import slim.SourcePosition;

public record Condition(
        SourcePosition position,
        String expression,
        Block positive,
        Block negative       // may be null
) implements Node {}
