package slim.ast;

import slim.DoctypeFormat;
import slim.SourcePosition;

public record Doctype(SourcePosition position, String shorthand, DoctypeFormat format) implements Node {}
