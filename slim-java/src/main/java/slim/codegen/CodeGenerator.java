package slim.codegen;

import slim.CompileException;
import slim.CompilerOptions;
import slim.SourcePosition;
import slim.ast.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CodeGenerator {

    private static final Pattern TEXT_ESCAPE = Pattern.compile("\\{\\{(.*?)\\}\\}");
    private static final Pattern TEXT_INTERPOLATE = Pattern.compile("#\\{(.*?)\\}");

    private final CompilerOptions options;
    private final Output out;
    private final ExpressionLinearizer expressions;

    private CodeGenerator(CompilerOptions options) {
        this.options = options;
        this.out = new Output(options.prettyPrint());
        this.expressions = new ExpressionLinearizer(out);
    }

    public static String generate(Node root, CompilerOptions options) {
        CodeGenerator gen = new CodeGenerator(options == null ? CompilerOptions.defaults() : options);
        gen.visit(root);
        return gen.out.finish();
    }

    // ---------- dispatch ----------
    private void visit(Node node) {
        if (node instanceof Block b) visitBlock(b);
        else if (node instanceof Doctype d) out.write(Doctypes.render(d));
        else if (node instanceof Comment c) visitComment(c);
        else if (node instanceof Tag t) visitTag(t);
        else if (node instanceof Text t) visitText(t);
        else if (node instanceof Condition c) visitCondition(c);
        else if (node instanceof Each e) visitEach(e);
        else if (node instanceof Assignment a) visitAssignment(a);
        // NamedBlock and Attribute never reach the tree; their contents are spliced by the parser
        else throw new CompileException("Unexpected node: " + node.getClass().getSimpleName(), node.position());
    }

    private void visitBlock(Block block) {
        boolean inline = block.canInline();
        for (Node child : block.children()) {
            if (!inline && child instanceof Text) out.indent(0, true);
            visit(child);
        }
    }

    private void lineMarker(SourcePosition pos) {
        if (!options.lineNumbers()) return;
        String where = pos.filename() == null || pos.filename().isEmpty()
                ? "line " + pos.line()
                : pos.filename() + ":" + pos.line();
        out.write("{{/* " + where + " */}}");
    }

    // ---------- markup ----------
    private void visitComment(Comment comment) {
        if (comment.silent()) return;

        out.indent(0, true);
        if (comment.block() == null) {
            out.write("{{unescaped \"<!-- " + escape(comment.text()) + " -->\"}}");
        } else {
            out.write("<!-- " + comment.text());
            visitBlock(comment.block());
            out.write(" -->");
        }
    }

    private record LoweredAttribute(String value, String guard) {}

    private void visitTag(Tag tag) {
        // attribute expressions are lowered first; their bindings precede the tag
        Map<String, LoweredAttribute> attributes = new LinkedHashMap<>();
        for (Attribute attribute : tag.attributes()) {
            String value;
            if (!attribute.raw()) value = expressions.interpolate(attribute.value(), attribute.position());
            else if (attribute.value().isEmpty()) value = "";
            else value = "{{\"" + attribute.value() + "\"}}";

            String guard = attribute.hasCondition()
                    ? expressions.lower(attribute.condition(), attribute.position())
                    : "";

            LoweredAttribute previous = attributes.get(attribute.name());
            if (attribute.name().equals("class") && previous != null) {
                attributes.put("class", new LoweredAttribute(
                        guarded(previous.value(), previous.guard()) + guarded(" " + value, guard), ""));
            } else {
                attributes.put(attribute.name(), new LoweredAttribute(value, guard));
            }
        }

        out.indent(0, true);
        lineMarker(tag.position());
        out.write("<" + tag.name());

        for (Map.Entry<String, LoweredAttribute> e : attributes.entrySet()) {
            LoweredAttribute a = e.getValue();
            String text = a.value().isEmpty() ? " " + e.getKey() : " " + e.getKey() + "=\"" + a.value() + "\"";
            out.write(guarded(text, a.guard()));
        }

        if (tag.selfClosing()) {
            out.write(" />");
            return;
        }

        out.write(">");

        Block body = tag.body();
        if (body != null) {
            boolean inline = body.canInline();
            if (!inline) out.deeper();

            visitBlock(body);

            if (!inline) {
                out.shallower();
                out.indent(0, true);
            }
        }

        out.write("</" + tag.name() + ">");
    }

    private static String guarded(String text, String guard) {
        return guard.isEmpty() ? text : "{{if " + guard + "}}" + text + "{{end}}";
    }

    private void visitText(Text text) {
        String value = replace(TEXT_ESCAPE, text.value(), m -> "{{\"{{\"}}" + m.group(1) + "{{\"}}\"}}");
        value = replace(TEXT_INTERPOLATE, value, m -> expressions.interpolate(m.group(1), text.position()));

        String[] lines = value.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            out.write(lines[i]);
            if (i < lines.length - 1) {
                out.write("\n");
                out.indent(0, false);
            }
        }
    }

    private static String replace(Pattern pattern, String input, Function<Matcher, String> f) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) m.appendReplacement(sb, Matcher.quoteReplacement(f.apply(m)));
        m.appendTail(sb);
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // ---------- control ----------
    private void visitCondition(Condition condition) {
        lineMarker(condition.position());
        String ref = expressions.lower(condition.expression(), condition.position());
        out.write("{{if " + ref + "}}");
        visitBlock(condition.positive());
        if (condition.negative() != null) {
            out.write("{{else}}");
            visitBlock(condition.negative());
        }
        out.write("{{end}}");
    }

    private void visitEach(Each each) {
        if (each.body() == null) return;

        lineMarker(each.position());
        String ref = expressions.lower(each.expression(), each.position());
        String vars = each.value().isEmpty() ? each.key() : each.key() + ", " + each.value();
        out.write("{{range " + vars + " := " + ref + "}}");
        visitBlock(each.body());
        out.write("{{end}}");
    }

    private void visitAssignment(Assignment assignment) {
        lineMarker(assignment.position());
        String ref = expressions.lower(assignment.expression(), assignment.position());
        out.write("{{" + assignment.variable() + " := " + ref + "}}");
    }
}
