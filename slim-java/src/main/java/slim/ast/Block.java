package slim.ast;

import slim.SourcePosition;

import java.util.ArrayList;
import java.util.List;

// children stay mutable: extend composition rewrites named block bodies in place
public record Block(SourcePosition position, List<Node> children) implements Node {

    public Block {
        children = children == null ? new ArrayList<>() : children;
    }

    public static Block empty(SourcePosition position) {
        return new Block(position, new ArrayList<>());
    }

    public static Block of(SourcePosition position, Node... nodes) {
        return new Block(position, new ArrayList<>(List.of(nodes)));
    }

    public boolean canInline() {
        for (Node child : children) {
            if (!(child instanceof Text t) || t.raw()) return false;
        }
        return true;
    }
}
