package slim.ast;

import slim.SourcePosition;

public record Each(
        SourcePosition position,
        String key,
        String value,        // may be empty
        String expression,
        Block body           // may be null
) implements Node {}
