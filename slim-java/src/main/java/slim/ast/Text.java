package slim.ast;

import slim.SourcePosition;

public record Text(SourcePosition position, String value, boolean raw) implements Node {}
