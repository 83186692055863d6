package slim.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import slim.CompileException;
import slim.CompilerOptions;
import slim.DoctypeFormat;
import slim.parser.Parser;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static final CompilerOptions PRETTY = CompilerOptions.defaults();
    private static final CompilerOptions COMPACT = CompilerOptions.defaults().withPrettyPrint(false);

    private static String gen(String src, CompilerOptions opts) {
        return CodeGenerator.generate(new Parser(src, null, opts).parse(), opts);
    }

    private static String pretty(String src) {
        return gen(src, PRETTY);
    }

    private static String compact(String src) {
        return gen(src, COMPACT);
    }

    @Test
    void gen_interpolated_text() {
        assertEquals("<p>Hello {{.name}}</p>\n", pretty("p Hello #{name}"));
    }

    @Test
    void gen_doctype_then_tag() {
        assertEquals("<!DOCTYPE html>\n<html></html>\n", pretty("doctype 5\nhtml"));
    }

    @Test
    void gen_empty_source_is_empty() {
        assertEquals("", pretty(""));
        assertEquals("", pretty("//- nothing to see"));
    }

    @Test
    void gen_nested_pretty_and_compact() {
        String src = """
                ul
                  li one
                  li two
                """;
        assertEquals("<ul>\n\t<li>one</li>\n\t<li>two</li>\n</ul>\n", pretty(src));
        assertEquals("<ul><li>one</li><li>two</li></ul>\n", compact(src));
    }

    @Test
    void gen_inline_text_followed_by_children() {
        assertEquals("<p>\n\tHello\n\t<span>x</span>\n</p>\n", pretty("p Hello\n  span x"));
    }

    @Test
    void gen_raw_and_expression_attributes() {
        assertEquals("<a id=\"{{\"main\"}}\" class=\"{{\"nav\"}}\" href=\"{{\"/x\"}}\">Go</a>\n",
                pretty("a#main.nav[href=\"/x\"] Go"));
        assertEquals("<a href=\"{{$url}}\">x</a>\n", pretty("a[href=$url] x"));
        assertEquals("<input disabled />\n", pretty("input[disabled]"));
    }

    @Test
    void gen_attributes_keep_source_order() {
        assertEquals("<a z=\"{{1}}\" a=\"{{2}}\" m=\"{{\"x\"}}\"></a>\n", pretty("a[z=1][a=2][m=\"x\"]"));
    }

    @Test
    void gen_class_merge_with_guard() {
        String src = """
                li.item
                  .active ? $on
                  | x
                """;
        assertEquals("<li class=\"{{\"item\"}}{{if $on}} {{\"active\"}}{{end}}\">x</li>\n", pretty(src));
    }

    @Test
    void gen_first_class_guard_moves_into_merged_value() {
        String src = """
                li
                  .a ? $x
                  .b
                """;
        assertEquals("<li class=\"{{if $x}}{{\"a\"}}{{end}} {{\"b\"}}\"></li>\n", pretty(src));
    }

    @Test
    void gen_guarded_attribute() {
        assertEquals("<a{{if $u}} href=\"{{$u}}\"{{end}}></a>\n", pretty("a\n  [href=$u] ? $u"));
    }

    @Test
    void gen_guard_bindings_precede_tag() {
        assertEquals("{{$__slim_1 := __slim_eql $a $b}}<option{{if $__slim_1}} selected{{end}}></option>\n",
                compact("option\n  [selected] ? $a == $b"));
    }

    @Test
    void gen_condition() {
        String src = """
                if $x
                  p yes
                else
                  p no
                """;
        assertEquals("{{if $x}}\n<p>yes</p>{{else}}\n<p>no</p>{{end}}\n", pretty(src));
        assertEquals("{{if $x}}<p>yes</p>{{else}}<p>no</p>{{end}}\n", compact(src));
    }

    @Test
    void gen_else_if_nests() {
        String src = "if $a\n  br\nelse if $b\n  hr\n";
        assertEquals("{{if $a}}<br />{{else}}{{if $b}}<hr />{{end}}{{end}}\n", compact(src));
    }

    @Test
    void gen_condition_expression_is_linearized() {
        assertEquals("{{$__slim_1 := __slim_gtr $n 1}}{{if $__slim_1}}<br />{{end}}\n",
                compact("if $n > 1\n  br"));
    }

    @Test
    void gen_each() {
        assertEquals("{{range $i, $v := $items}}<li>{{$v}}</li>{{end}}\n",
                compact("each $i, $v in $items\n  li #{$v}"));
        assertEquals("{{range $x := .List}}<br />{{end}}\n", compact("each $x in List\n  br"));
        assertEquals("", compact("each $x in List"));
    }

    @Test
    void gen_assignment() {
        assertEquals("{{$__slim_1 := __slim_add .a 1}}{{$x := $__slim_1}}\n", compact("$x = a + 1"));
    }

    @Test
    void gen_temporaries_are_numbered_across_the_whole_output() {
        assertEquals("{{$__slim_1 := __slim_add $a 1}}{{$x := $__slim_1}}"
                        + "{{$__slim_2 := __slim_sub $a 1}}{{$y := $__slim_2}}\n",
                compact("$x = $a + 1\n$y = $a - 1"));
    }

    @Test
    void gen_escapes_literal_actions_in_text() {
        assertEquals("<p>{{\"{{\"}}x{{\"}}\"}}</p>\n", pretty("p {{x}}"));
    }

    @Test
    void gen_text_interpolation_with_bindings() {
        assertEquals("<p>{{$__slim_1 := len $items}}n={{$__slim_1}}</p>\n", compact("p n=#{len($items)}"));
    }

    @Test
    void gen_comments() {
        assertEquals("{{unescaped \"<!-- hi \\\"there\\\" -->\"}}\n", pretty("// hi \"there\""));
        assertEquals("<!-- note\n<p></p> -->\n", pretty("// note\n  p"));
        assertEquals("<!-- note<p></p> -->\n", compact("// note\n  p"));
    }

    @Test
    void gen_raw_script_reindents_lines() {
        String src = """
                script
                  var a = 1;
                  if (a) {
                    b();
                  }
                """;
        assertEquals("<script>\n\tvar a = 1;\n\tif (a) {\n\t\tb();\n\t}\n</script>\n", pretty(src));
    }

    @Test
    void gen_self_closing_discards_body() {
        assertEquals("<br />\n", pretty("br\n  | ignored"));
    }

    @Test
    void gen_line_numbers() {
        var opts = COMPACT.withLineNumbers(true);
        assertEquals("{{/* line 1 */}}<p></p>{{/* line 2 */}}{{if $x}}{{/* line 3 */}}<br />{{end}}\n",
                gen("p\nif $x\n  br", opts));
    }

    static Stream<Object[]> doctypes() {
        return Stream.of(
                new Object[]{"doctype", DoctypeFormat.HTML, "<!DOCTYPE html>"},
                new Object[]{"doctype transitional", DoctypeFormat.HTML,
                        "<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\" \"http://www.w3.org/TR/html4/loose.dtd\">"},
                new Object[]{"doctype strict", DoctypeFormat.XHTML,
                        "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">"},
                new Object[]{"doctype 1.1", DoctypeFormat.XHTML,
                        "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.1//EN\" \"http://www.w3.org/TR/xhtml11/DTD/xhtml11.dtd\">"},
                new Object[]{"doctype 1.1", DoctypeFormat.HTML, "<!DOCTYPE html>"},
                new Object[]{"doctype whatever", DoctypeFormat.XHTML, "<!DOCTYPE html>"},
                new Object[]{"doctype xml", DoctypeFormat.XHTML, "<?xml version=\"1.0\" encoding=\"utf-8\" ?>"},
                new Object[]{"doctype xml ISO-8859-1", DoctypeFormat.XHTML,
                        "<?xml version=\"1.0\" encoding=\"ISO-8859-1\" ?>"}
        );
    }

    @ParameterizedTest
    @MethodSource("doctypes")
    void gen_doctype(String src, DoctypeFormat format, String expected) {
        assertEquals(expected + "\n", gen(src, PRETTY.withFormat(format)));
    }

    @Test
    void gen_xml_doctype_rejected_in_html_format() {
        var ex = assertThrows(CompileException.class, () -> pretty("p\ndoctype xml"));
        assertEquals("Invalid xml directive with html format", ex.reason());
        assertEquals(2, ex.line());
    }
}
