package slim.ast;

import slim.SourcePosition;

import java.util.List;
import java.util.Set;

public record Tag(
        SourcePosition position,
        String name,
        List<Attribute> attributes,
        Block body,          // may be null
        boolean rawText
) implements Node {

    private static final Set<String> SELF_CLOSING = Set.of(
            "base", "basefont", "bgsound", "link", "meta", "area", "br", "embed", "img",
            "keygen", "wbr", "input", "menuitem", "param", "source", "track", "hr", "col", "frame"
    );

    private static final Set<String> RAW_TEXT = Set.of("style", "script");

    public static boolean isSelfClosing(String name) {
        return SELF_CLOSING.contains(name);
    }

    public static boolean isRawTextElement(String name) {
        return RAW_TEXT.contains(name);
    }

    public boolean selfClosing() {
        return isSelfClosing(name);
    }
}
