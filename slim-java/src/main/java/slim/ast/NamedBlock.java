package slim.ast;

import slim.SourcePosition;

public record NamedBlock(
        SourcePosition position,
        String name,
        Modifier modifier,
        Block body
) implements Node {

    public enum Modifier {
        DEFAULT, APPEND, PREPEND;

        public static Modifier of(String keyword) {
            return switch (keyword == null ? "" : keyword) {
                case "append" -> APPEND;
                case "prepend" -> PREPEND;
                default -> DEFAULT;
            };
        }
    }
}
