package slim.cli;

import slim.CompileException;
import slim.CompilerOptions;
import slim.DoctypeFormat;
import slim.SlimCompiler;
import slim.ast.Block;

import java.io.PrintStream;
import java.nio.file.Path;

public final class Main {

    private static final String USAGE = String.join("\n",
            "Usage: slimc [options] <input.slim>",
            "  -pp, -prettyprint[=true|false]  pretty indentation in output (default true)",
            "  -ln, -linenos[=true|false]      position comments in output (default false)",
            "  -format=html|xhtml              doctype table (default html)",
            "  -ext=<extension>                extension for import/extend targets (default .slim)",
            "  -v                              print progress to stderr");

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    // 0 success, 1 compile failure, 2 usage error
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CompilerOptions options = CompilerOptions.defaults();
        boolean verbose = false;
        String input = null;

        for (String arg : args) {
            if (!arg.startsWith("-") || arg.equals("-")) {
                if (input != null) return usage(err, "Unexpected argument: " + arg);
                input = arg;
                continue;
            }

            // -flag and --flag are equivalent
            String flag = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String name = flag;
            String value = null;
            int eq = flag.indexOf('=');
            if (eq >= 0) {
                name = flag.substring(0, eq);
                value = flag.substring(eq + 1);
            }

            switch (name) {
                case "pp", "prettyprint" -> {
                    Boolean b = bool(value);
                    if (b == null) return usage(err, "Invalid boolean value for -" + name + ": " + value);
                    options = options.withPrettyPrint(b);
                }
                case "ln", "linenos" -> {
                    Boolean b = bool(value);
                    if (b == null) return usage(err, "Invalid boolean value for -" + name + ": " + value);
                    options = options.withLineNumbers(b);
                }
                case "format" -> {
                    if ("html".equals(value)) options = options.withFormat(DoctypeFormat.HTML);
                    else if ("xhtml".equals(value)) options = options.withFormat(DoctypeFormat.XHTML);
                    else return usage(err, "Invalid format: " + value);
                }
                case "ext" -> {
                    if (value == null || value.isEmpty()) return usage(err, "Missing value for -ext");
                    options = options.withExtension(value);
                }
                case "v" -> verbose = true;
                case "h", "help" -> {
                    err.println(USAGE);
                    return 2;
                }
                default -> {
                    return usage(err, "Unknown flag: " + arg);
                }
            }
        }

        if (input == null) return usage(err, "Please provide an input file.");

        Path file = Path.of(input);
        try {
            if (verbose) err.println("[1/3] Parsing: " + file);
            SlimCompiler compiler = new SlimCompiler(options);
            Block root = compiler.parseFile(file);

            if (verbose) err.println("[2/3] Generating: " + root.children().size() + " top-level nodes");
            String script = compiler.compile(root);

            if (verbose) err.println("[3/3] Done: " + script.length() + " chars");
            out.print(script);
            out.flush();
            return 0;
        } catch (CompileException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    private static Boolean bool(String value) {
        if (value == null || value.equals("true") || value.equals("1")) return Boolean.TRUE;
        if (value.equals("false") || value.equals("0")) return Boolean.FALSE;
        return null;
    }

    private static int usage(PrintStream err, String message) {
        err.println(message);
        err.println(USAGE);
        return 2;
    }
}
