package slim.lexer;

import slim.SourcePosition;

import java.util.Map;

public record Token(
        TokenType type,
        String value,
        Map<String, String> data,
        SourcePosition position
) {
    // auxiliary field keys
    public static final String CONDITION = "condition";
    public static final String CONTENT = "content";
    public static final String MODE = "mode";
    public static final String VARIABLE = "variable";
    public static final String KEY = "key";
    public static final String VALUE = "value";
    public static final String MODIFIER = "modifier";

    // modes
    public static final String MODE_RAW = "raw";
    public static final String MODE_EXPRESSION = "expression";
    public static final String MODE_INLINE = "inline";
    public static final String MODE_PIPED = "piped";
    public static final String MODE_VISIBLE = "visible";
    public static final String MODE_SILENT = "silent";

    public Token {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public String get(String key) {
        return data.getOrDefault(key, "");
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + "('" + value + "')@" + position.line() + ":" + position.column();
    }
}
