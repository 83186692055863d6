package slim.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static slim.lexer.TokenType.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> types(String src) {
        return lex(src).stream().map(Token::type).toList();
    }

    @Test
    void lex_tag_with_inline_text() {
        var ts = lex("p Hello");
        assertEquals(List.of(TAG, TEXT, EOF), ts.stream().map(Token::type).toList());
        assertEquals("p", ts.get(0).value());
        assertEquals("Hello", ts.get(1).value());
        assertEquals(Token.MODE_INLINE, ts.get(1).get(Token.MODE));
    }

    @Test
    void lex_nested_indentation_closes_every_level() {
        var ts = types("""
                div
                  p
                    span
                a
                """);
        assertEquals(List.of(TAG, INDENT, TAG, INDENT, TAG, OUTDENT, OUTDENT, TAG, EOF), ts);
    }

    @Test
    void lex_open_levels_are_closed_at_end_of_input() {
        assertEquals(List.of(TAG, INDENT, TAG, INDENT, TAG, OUTDENT, OUTDENT, EOF),
                types("div\n  p\n    span"));
    }

    @Test
    void lex_indent_and_outdent_are_balanced() {
        var ts = types("""
                html
                  head
                    title x
                  body

                    div
                      p
                        | deep
                    footer
                """);
        long indents = ts.stream().filter(t -> t == INDENT).count();
        long outdents = ts.stream().filter(t -> t == OUTDENT).count();
        assertEquals(indents, outdents);
    }

    @Test
    void lex_blank_line() {
        assertEquals(List.of(TAG, BLANK, TAG, EOF), types("p\n\nspan"));
    }

    @Test
    void lex_mismatching_indentation_fails() {
        var ex = assertThrows(LexerException.class, () -> lex("div\n    p\n  span"));
        assertTrue(ex.getMessage().contains("Mismatching indentation"));
        assertEquals(3, ex.line());
    }

    @Test
    void lex_tab_against_space_indentation_fails() {
        var ex = assertThrows(LexerException.class, () -> lex("div\n  p\n\tspan"));
        assertTrue(ex.getMessage().contains("Mismatching indentation"));
        assertEquals(3, ex.line());
    }

    @Test
    void lex_tag_shorthands_and_attributes() {
        var ts = lex("a#main.nav[href=\"/x\"] Go");
        assertEquals(List.of(TAG, ID, CLASS, ATTRIBUTE, TEXT, EOF), ts.stream().map(Token::type).toList());
        assertEquals("main", ts.get(1).value());
        assertEquals("nav", ts.get(2).value());
        assertEquals("href", ts.get(3).value());
        assertEquals("/x", ts.get(3).get(Token.CONTENT));
        assertEquals(Token.MODE_RAW, ts.get(3).get(Token.MODE));
        assertEquals("Go", ts.get(4).value());
    }

    @Test
    void lex_expression_and_boolean_attributes() {
        var ts = lex("input[value=$name][disabled]");
        assertEquals("$name", ts.get(1).get(Token.CONTENT));
        assertEquals(Token.MODE_EXPRESSION, ts.get(1).get(Token.MODE));
        assertEquals("disabled", ts.get(2).value());
        assertEquals("", ts.get(2).get(Token.CONTENT));
        assertEquals(Token.MODE_RAW, ts.get(2).get(Token.MODE));
    }

    @Test
    void lex_conditional_shorthand_keeps_guard() {
        var ts = lex("li\n  .active ? $on");
        Token cls = ts.get(2);
        assertEquals(CLASS, cls.type());
        assertEquals("active", cls.value());
        assertEquals("$on", cls.get(Token.CONDITION));
    }

    static Stream<Object[]> doctypes() {
        return Stream.of(
                new Object[]{"doctype 5", "5"},
                new Object[]{"doctype", "html"},
                new Object[]{"!!! strict", "strict"},
                new Object[]{"!!!", "html"},
                new Object[]{"! xml", "xml"}
        );
    }

    @ParameterizedTest
    @MethodSource("doctypes")
    void lex_doctype_shorthand(String src, String shorthand) {
        var t = lex(src).get(0);
        assertEquals(DOCTYPE, t.type());
        assertEquals(shorthand, t.value());
    }

    @Test
    void lex_condition_chain() {
        var ts = types("""
                if $x
                  p
                else if $y
                  p
                elsif $z
                  p
                else
                  p
                """);
        assertEquals(List.of(
                IF, INDENT, TAG, OUTDENT,
                ELSE, IF, INDENT, TAG, OUTDENT,
                ELSE_IF, INDENT, TAG, OUTDENT,
                ELSE, INDENT, TAG, OUTDENT,
                EOF), ts);
    }

    @Test
    void lex_condition_expression_value() {
        assertEquals("$a > 1", lex("if $a > 1").get(0).value());
        assertEquals("$b", lex("elseif $b").get(0).value());
    }

    @Test
    void lex_keyword_prefix_is_still_a_tag() {
        assertEquals(List.of(TAG, EOF), types("iframe"));
        assertEquals(List.of(TAG, EOF), types("elsewhere"));
        assertEquals(List.of(TAG, EOF), types("blockquote"));
    }

    @Test
    void lex_keywords_only_at_line_start() {
        var ts = lex("p if you say so");
        assertEquals(List.of(TAG, TEXT, EOF), ts.stream().map(Token::type).toList());
        assertEquals("if you say so", ts.get(1).value());
    }

    @Test
    void lex_each_with_key_and_value() {
        var t = lex("each $i, $v in $items").get(0);
        assertEquals(EACH, t.type());
        assertEquals("$items", t.value());
        assertEquals("$i", t.get(Token.KEY));
        assertEquals("$v", t.get(Token.VALUE));

        var single = lex("each $item in .List").get(0);
        assertEquals("$item", single.get(Token.KEY));
        assertEquals("", single.get(Token.VALUE));
    }

    @Test
    void lex_assignment() {
        var t = lex("$total = $a + $b").get(0);
        assertEquals(ASSIGNMENT, t.type());
        assertEquals("$total", t.get(Token.VARIABLE));
        assertEquals("$a + $b", t.value());
    }

    @Test
    void lex_composition_directives() {
        assertEquals(IMPORT, lex("import partials/nav").get(0).type());
        assertEquals("partials/nav", lex("import partials/nav").get(0).value());
        assertEquals("layout.slim", lex("extend layout.slim").get(0).value());

        var b = lex("block append scripts").get(0);
        assertEquals(NAMED_BLOCK, b.type());
        assertEquals("scripts", b.value());
        assertEquals("append", b.get(Token.MODIFIER));
        assertEquals("", lex("block content").get(0).get(Token.MODIFIER));
    }

    @Test
    void lex_visible_and_silent_comments() {
        var visible = lex("// hi there").get(0);
        assertEquals(COMMENT, visible.type());
        assertEquals("hi there", visible.value());
        assertEquals(Token.MODE_VISIBLE, visible.get(Token.MODE));

        var silent = lex("//- secret").get(0);
        assertEquals("secret", silent.value());
        assertEquals(Token.MODE_SILENT, silent.get(Token.MODE));
    }

    @Test
    void lex_piped_text() {
        var t = lex("| hello world").get(0);
        assertEquals(TEXT, t.type());
        assertEquals("hello world", t.value());
        assertEquals(Token.MODE_PIPED, t.get(Token.MODE));
    }

    @Test
    void lex_raw_marker_only_after_tag() {
        assertEquals(List.of(TAG, RAW_MARKER, EOF), types("p."));
        assertEquals(List.of(TEXT, EOF), types("."));
    }

    @Test
    void lex_raw_capture_rebuilds_nesting_with_tabs() {
        var lexer = new Lexer("""
                script
                  if (a) {
                    b();
                  }
                p
                """);
        assertEquals(TAG, lexer.next().type());
        assertEquals(INDENT, lexer.next().type());

        lexer.requestRawCapture();
        Token raw = lexer.next();
        assertEquals(TEXT, raw.type());
        assertEquals(Token.MODE_RAW, raw.get(Token.MODE));
        assertEquals("if (a) {\n\tb();\n}", raw.value());

        assertEquals(OUTDENT, lexer.next().type());
        Token p = lexer.next();
        assertEquals(TAG, p.type());
        assertEquals("p", p.value());
        assertEquals(EOF, lexer.next().type());
    }

    @Test
    void lex_raw_capture_keeps_inner_blank_lines() {
        var lexer = new Lexer("pre\n  a\n\n  b\n");
        lexer.next();
        lexer.next();
        lexer.requestRawCapture();
        assertEquals("a\n\nb", lexer.next().value());
        assertEquals(OUTDENT, lexer.next().type());
        assertEquals(EOF, lexer.next().type());
    }

    @Test
    void lex_raw_capture_until_end_of_input() {
        var lexer = new Lexer("div\n  script\n    a\n      b");
        assertEquals(TAG, lexer.next().type());
        assertEquals(INDENT, lexer.next().type());
        assertEquals(TAG, lexer.next().type());
        assertEquals(INDENT, lexer.next().type());
        lexer.requestRawCapture();
        assertEquals("a\n\tb", lexer.next().value());
        assertEquals(OUTDENT, lexer.next().type());
        assertEquals(OUTDENT, lexer.next().type());
        assertEquals(EOF, lexer.next().type());
    }

    @Test
    void lex_raw_capture_requires_fresh_indent() {
        var lexer = new Lexer("p");
        lexer.next();
        assertThrows(LexerException.class, lexer::requestRawCapture);
    }

    @Test
    void lex_positions_are_one_based() {
        var ts = lex("div\n  p.x");
        Token p = ts.get(2);
        assertEquals(2, p.position().line());
        assertEquals(3, p.position().column());
        assertEquals(1, p.position().length());

        Token cls = ts.get(3);
        assertEquals(4, cls.position().column());
    }

    @Test
    void lex_filename_is_carried_into_positions() {
        Token t = new Lexer("p", "views/a.slim").next();
        assertEquals("views/a.slim", t.position().filename());
    }

    @Test
    void lex_empty_source() {
        assertEquals(List.of(EOF), types(""));
    }
}
