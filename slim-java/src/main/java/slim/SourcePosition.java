package slim;

// line and column are 1-based; filename is null for in-memory sources
public record SourcePosition(int line, int column, String filename, int length) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, null, 0);

    @Override
    public String toString() {
        String at = line + ":" + column;
        return filename == null ? at : filename + ":" + at;
    }
}
