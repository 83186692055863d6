package slim;

public class CompileException extends RuntimeException {

    private final String reason;
    private final SourcePosition position;

    public CompileException(String reason, SourcePosition position) {
        this(reason, position, null);
    }

    public CompileException(String reason, SourcePosition position, Throwable cause) {
        super(format(reason, position), cause);
        this.reason = reason;
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    public String reason() { return reason; }

    public SourcePosition position() { return position; }

    public String filename() { return position.filename(); }

    public int line() { return position.line(); }

    public int column() { return position.column(); }

    public int length() { return position.length(); }

    private static String format(String reason, SourcePosition pos) {
        if (pos == null) pos = SourcePosition.UNKNOWN;
        String head = pos.filename() != null
                ? "Slim Error in <" + pos.filename() + ">: "
                : "Slim Error: ";
        return head + reason
                + " - Line: " + pos.line()
                + ", Column: " + pos.column()
                + ", Length: " + pos.length();
    }
}
