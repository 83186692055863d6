package slim;

import slim.ast.Block;
import slim.codegen.CodeGenerator;
import slim.parser.Parser;

import java.nio.file.Path;

/**
 * Entry point: template source in, template script out.
 *
 * <pre>
 *   String script = new SlimCompiler().compileFile(Path.of("views/index.slim"));
 * </pre>
 *
 * Every failure surfaces as a {@link CompileException}; nothing is returned
 * for a compile that fails. Instances hold only options and may be shared.
 */
public final class SlimCompiler {
    private final CompilerOptions options;

    public SlimCompiler() {
        this(CompilerOptions.defaults());
    }

    public SlimCompiler(CompilerOptions options) {
        this.options = options == null ? CompilerOptions.defaults() : options;
    }

    public CompilerOptions options() {
        return options;
    }

    // ---------- parse ----------
    public Block parse(String source) {
        return parse(source, null);
    }

    public Block parse(String source, Path baseDir) {
        return guard(() -> new Parser(source, baseDir, options).parse());
    }

    public Block parseFile(Path file) {
        return guard(() -> Parser.forFile(file, options).parse());
    }

    // ---------- compile ----------
    public String compile(String source) {
        return compile(source, null);
    }

    public String compile(String source, Path baseDir) {
        return compile(parse(source, baseDir));
    }

    public String compileFile(Path file) {
        return compile(parseFile(file));
    }

    public String compile(Block root) {
        return guard(() -> CodeGenerator.generate(root, options));
    }

    private interface Stage<T> {
        T run();
    }

    private static <T> T guard(Stage<T> stage) {
        try {
            return stage.run();
        } catch (CompileException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CompileException(String.valueOf(e.getMessage()), SourcePosition.UNKNOWN, e);
        }
    }
}
