package slim.ast;

import slim.SourcePosition;

public sealed interface Node
        permits Block, Doctype, Comment, Text, Tag, Attribute,
        Condition, Each, Assignment, NamedBlock {

    SourcePosition position();
}
