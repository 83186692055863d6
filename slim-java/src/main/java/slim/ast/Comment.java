package slim.ast;

import slim.SourcePosition;

public record Comment(
        SourcePosition position,
        String text,
        boolean silent,
        Block block          // may be null
) implements Node {}
