package slim;

public record CompilerOptions(
        boolean prettyPrint,
        boolean lineNumbers,
        DoctypeFormat format,
        String extension
) {
    public static final String DEFAULT_EXTENSION = ".slim";

    public CompilerOptions {
        if (format == null) format = DoctypeFormat.HTML;
        if (extension == null || extension.isEmpty()) extension = DEFAULT_EXTENSION;
        if (!extension.startsWith(".")) extension = "." + extension;
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(true, false, DoctypeFormat.HTML, DEFAULT_EXTENSION);
    }

    public CompilerOptions withPrettyPrint(boolean prettyPrint) {
        return new CompilerOptions(prettyPrint, lineNumbers, format, extension);
    }

    public CompilerOptions withLineNumbers(boolean lineNumbers) {
        return new CompilerOptions(prettyPrint, lineNumbers, format, extension);
    }

    public CompilerOptions withFormat(DoctypeFormat format) {
        return new CompilerOptions(prettyPrint, lineNumbers, format, extension);
    }

    public CompilerOptions withExtension(String extension) {
        return new CompilerOptions(prettyPrint, lineNumbers, format, extension);
    }
}
