package slim.codegen;

public final class Output {
    private final StringBuilder buffer = new StringBuilder();
    private final boolean prettyPrint;
    private int indentLevel = 0;

    public Output(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public void write(String text) {
        buffer.append(text);
    }

    public void indent(int offset, boolean newline) {
        if (!prettyPrint) return;

        if (newline && buffer.length() > 0) buffer.append('\n');

        for (int i = 0; i < indentLevel + offset; i++) buffer.append('\t');
    }

    public void deeper() { indentLevel++; }

    public void shallower() {
        if (indentLevel == 0) throw new IllegalStateException("Indent level underflow");
        indentLevel--;
    }

    public String finish() {
        if (buffer.length() > 0) buffer.append('\n');
        return buffer.toString();
    }
}
