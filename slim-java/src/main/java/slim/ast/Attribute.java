package slim.ast;

import slim.SourcePosition;

public record Attribute(
        SourcePosition position,
        String name,
        String value,
        boolean raw,
        String condition
) implements Node {

    public boolean hasCondition() {
        return condition != null && !condition.isEmpty();
    }
}
