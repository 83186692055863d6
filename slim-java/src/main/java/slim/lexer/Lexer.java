package slim.lexer;

import slim.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented tokenizer for the indentation-significant template syntax.
 *
 * <p>Produces exactly one token per {@link #next()} call. Indentation changes are
 * turned into {@link TokenType#INDENT} / {@link TokenType#OUTDENT} tokens; when a
 * line closes several levels at once the extra outdents are queued and handed out
 * by the following calls. At end of input every still-open level is closed before
 * {@link TokenType#EOF} is returned.</p>
 *
 * <p>The parser can ask for the body of the block it just opened to be captured as
 * opaque text ({@link #requestRawCapture()}); the next call then returns a single
 * raw {@link TokenType#TEXT} token.</p>
 */
public final class Lexer {

    private enum State { NEW_LINE, LINE, EOF }

    private static final Pattern INDENT = Pattern.compile("^[ \\t]+");
    private static final Pattern DOCTYPE = Pattern.compile("^(?:doctype|!!!|!)(?:\\s+(.*))?$");
    private static final Pattern IF = Pattern.compile("^if(?=[\\s(])\\s*(.+)$");
    private static final Pattern ELSE_IF = Pattern.compile("^els(?:e)?if(?=[\\s(])\\s*(.+)$");
    private static final Pattern ELSE = Pattern.compile("^else(?:\\s+|$)");
    private static final Pattern EACH = Pattern.compile(
            "^each\\s+(\\$[\\w-]*)(?:\\s*,\\s*(\\$[\\w-]*))?\\s+in\\s+(.+)$");
    private static final Pattern IMPORT = Pattern.compile("^import\\s+([\\w\\-. /]+)$");
    private static final Pattern EXTEND = Pattern.compile("^extend\\s+([\\w\\-. /]+)$");
    private static final Pattern NAMED_BLOCK = Pattern.compile(
            "^block\\s+(?:(append|prepend)\\s+)?([\\w\\-. /]+)$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^(\\$[\\w-]*)\\s*=(?!=)\\s*(.+)$");
    private static final Pattern TAG = Pattern.compile("^\\w[-:\\w]*");
    private static final Pattern ID = Pattern.compile("^#([\\w-]+)(?:\\s*\\?\\s*(.*)$)?");
    private static final Pattern CLASS = Pattern.compile("^\\.([\\w-]+)(?:\\s*\\?\\s*(.*)$)?");
    private static final Pattern ATTRIBUTE = Pattern.compile(
            "^\\[([\\w-]+)\\s*(?:=\\s*(\"([^\"\\\\]*)\"|([^\\]]+)))?\\](?:\\s*\\?\\s*(.*)$)?");
    private static final Pattern RAW_MARKER = Pattern.compile("^\\.$");
    private static final Pattern COMMENT = Pattern.compile("^//(-)?\\s?(.*)$");
    private static final Pattern TEXT = Pattern.compile("^(\\|)? ?(.*)$");

    private final String filename;
    private final String[] lines;
    private int nextLine = 0;

    // literal whitespace segment per open level, outermost first
    private final List<String> indents = new ArrayList<>();
    private final Deque<Token> pending = new ArrayDeque<>();

    private State state = State.NEW_LINE;
    private String buffer = "";
    private int line = 0;
    private int column = 0;
    private int tokensOnLine = 0;

    private int lastLine = 0;
    private int lastColumn = 0;
    private int lastSize = 0;

    private boolean rawCapture = false;
    private TokenType lastType = null;

    public Lexer(String source) {
        this(source, null);
    }

    public Lexer(String source, String filename) {
        this.filename = filename;
        this.lines = splitLines(source == null ? "" : source);
    }

    public List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        Token t;
        do {
            t = next();
            out.add(t);
        } while (!t.is(TokenType.EOF));
        return out;
    }

    // only valid immediately after an INDENT
    public void requestRawCapture() {
        if (lastType != TokenType.INDENT || !pending.isEmpty()) {
            throw new LexerException("Raw text capture must start at an indented block", here(0));
        }
        rawCapture = true;
    }

    public Token next() {
        Token t = scan();
        lastType = t.type();
        return t;
    }

    private Token scan() {
        if (rawCapture) {
            rawCapture = false;
            return scanRaw();
        }

        if (!pending.isEmpty()) return pending.poll();

        readLine();

        switch (state) {
            case EOF -> {
                if (!indents.isEmpty()) {
                    indents.remove(indents.size() - 1);
                    return token(TokenType.OUTDENT, "", null, here(0));
                }
                return token(TokenType.EOF, "", null, here(0));
            }
            case NEW_LINE -> {
                state = State.LINE;
                Token t = scanIndent();
                if (t != null) return t;
                return scan();
            }
            default -> {
                return scanLine();
            }
        }
    }

    // ================= indentation =================

    private Token scanIndent() {
        if (buffer.isEmpty()) return token(TokenType.BLANK, "", null, here(0));

        int matched = 0;
        while (matched < indents.size() && buffer.startsWith(indents.get(matched))) {
            consume(indents.get(matched).length());
            matched++;
        }

        Matcher m = INDENT.matcher(buffer);
        String lead = m.lookingAt() ? m.group() : "";

        if (!lead.isEmpty() && matched == indents.size()) {
            indents.add(lead);
            consume(lead.length());
            return token(TokenType.INDENT, lead, null, last());
        }

        if (lead.isEmpty() && matched < indents.size()) {
            int closed = indents.size() - matched;
            while (indents.size() > matched) indents.remove(indents.size() - 1);
            for (int i = 1; i < closed; i++) pending.add(token(TokenType.OUTDENT, "", null, here(0)));
            return token(TokenType.OUTDENT, "", null, here(0));
        }

        if (!lead.isEmpty()) {
            throw new LexerException("Mismatching indentation. Please use a coherent indent schema.",
                    here(lead.length()));
        }

        return null;
    }

    // ================= raw capture =================

    private Token scanRaw() {
        SourcePosition start = here(0);
        List<String> captured = new ArrayList<>();
        int level = 0;

        while (true) {
            readLine();

            if (state == State.EOF) {
                // levels opened inside the raw text never reach the parser
                for (int i = 0; i < level; i++) indents.remove(indents.size() - 1);
                return rawText(captured, start);
            }

            if (state == State.NEW_LINE) {
                state = State.LINE;
                Token t = scanIndent();
                if (t == null) continue;

                switch (t.type()) {
                    case BLANK -> captured.add("");
                    case INDENT -> level++;
                    case OUTDENT -> {
                        level -= 1 + pending.size();
                        pending.clear();
                        if (level < 0) {
                            for (int i = 0; i < -level; i++) {
                                pending.add(token(TokenType.OUTDENT, "", null, here(0)));
                            }
                            return rawText(captured, start);
                        }
                    }
                    default -> throw new IllegalStateException("Unexpected indentation token " + t.type());
                }
                continue;
            }

            captured.add("\t".repeat(level) + buffer);
            consume(buffer.length());
        }
    }

    private Token rawText(List<String> captured, SourcePosition start) {
        String text = String.join("\n", captured).stripTrailing();
        return token(TokenType.TEXT, text, Map.of(Token.MODE, Token.MODE_RAW), start);
    }

    // ================= line constructs =================

    private Token scanLine() {
        Token t = null;
        if (tokensOnLine == 0) {
            t = scanDoctype();
            if (t == null) t = scanCondition();
            if (t == null) t = scanEach();
            if (t == null) t = scanPath(IMPORT, TokenType.IMPORT);
            if (t == null) t = scanPath(EXTEND, TokenType.EXTEND);
            if (t == null) t = scanNamedBlock();
            if (t == null) t = scanAssignment();
        } else if (lastType == TokenType.ELSE) {
            // "else if" on one line
            t = scanCondition();
        }
        if (t == null) t = scanTag();
        if (t == null) t = scanShorthand(ID, TokenType.ID);
        if (t == null) t = scanShorthand(CLASS, TokenType.CLASS);
        if (t == null) t = scanAttribute();
        if (t == null) t = scanRawMarker();
        if (t == null) t = scanComment();
        if (t == null) t = scanText();
        tokensOnLine++;
        return t;
    }

    private Token scanDoctype() {
        Matcher m = match(DOCTYPE);
        if (m == null) return null;
        String shorthand = m.group(1) == null || m.group(1).isBlank() ? "html" : m.group(1).trim();
        consume(m.end());
        return token(TokenType.DOCTYPE, shorthand, null, last());
    }

    private Token scanCondition() {
        Matcher m = match(IF);
        if (m != null) {
            consume(m.end());
            return token(TokenType.IF, m.group(1).trim(), null, last());
        }
        m = match(ELSE_IF);
        if (m != null) {
            consume(m.end());
            return token(TokenType.ELSE_IF, m.group(1).trim(), null, last());
        }
        m = match(ELSE);
        if (m != null) {
            consume(m.end());
            return token(TokenType.ELSE, "", null, last());
        }
        return null;
    }

    private Token scanEach() {
        Matcher m = match(EACH);
        if (m == null) return null;
        consume(m.end());
        Map<String, String> data = new HashMap<>();
        data.put(Token.KEY, m.group(1));
        data.put(Token.VALUE, nz(m.group(2)));
        return token(TokenType.EACH, m.group(3).trim(), data, last());
    }

    private Token scanPath(Pattern p, TokenType type) {
        Matcher m = match(p);
        if (m == null) return null;
        consume(m.end());
        return token(type, m.group(1).trim(), null, last());
    }

    private Token scanNamedBlock() {
        Matcher m = match(NAMED_BLOCK);
        if (m == null) return null;
        consume(m.end());
        return token(TokenType.NAMED_BLOCK, m.group(2).trim(),
                Map.of(Token.MODIFIER, nz(m.group(1))), last());
    }

    private Token scanAssignment() {
        Matcher m = match(ASSIGNMENT);
        if (m == null) return null;
        consume(m.end());
        return token(TokenType.ASSIGNMENT, m.group(2).trim(),
                Map.of(Token.VARIABLE, m.group(1)), last());
    }

    private Token scanTag() {
        Matcher m = match(TAG);
        if (m == null) return null;
        consume(m.end());
        return token(TokenType.TAG, m.group(), null, last());
    }

    private Token scanShorthand(Pattern p, TokenType type) {
        Matcher m = match(p);
        if (m == null) return null;
        consume(m.end());
        return token(type, m.group(1), Map.of(Token.CONDITION, nz(m.group(2)).trim()), last());
    }

    private Token scanAttribute() {
        Matcher m = match(ATTRIBUTE);
        if (m == null) return null;
        consume(m.end());

        Map<String, String> data = new HashMap<>();
        data.put(Token.CONDITION, nz(m.group(5)).trim());
        if (m.group(2) == null || m.group(3) != null) {
            // quoted or valueless
            data.put(Token.CONTENT, nz(m.group(3)));
            data.put(Token.MODE, Token.MODE_RAW);
        } else {
            data.put(Token.CONTENT, m.group(4).trim());
            data.put(Token.MODE, Token.MODE_EXPRESSION);
        }
        return token(TokenType.ATTRIBUTE, m.group(1), data, last());
    }

    private Token scanRawMarker() {
        if (tokensOnLine == 0) return null;
        Matcher m = match(RAW_MARKER);
        if (m == null) return null;
        consume(m.end());
        return token(TokenType.RAW_MARKER, ".", null, last());
    }

    private Token scanComment() {
        Matcher m = match(COMMENT);
        if (m == null) return null;
        consume(m.end());
        String mode = m.group(1) != null ? Token.MODE_SILENT : Token.MODE_VISIBLE;
        return token(TokenType.COMMENT, m.group(2), Map.of(Token.MODE, mode), last());
    }

    private Token scanText() {
        // always matches
        Matcher m = match(TEXT);
        consume(m.end());
        String mode = m.group(1) != null ? Token.MODE_PIPED : Token.MODE_INLINE;
        return token(TokenType.TEXT, m.group(2), Map.of(Token.MODE, mode), last());
    }

    // ================= helpers =================

    private static String[] splitLines(String source) {
        if (source.isEmpty()) return new String[0];
        String[] parts = source.split("\n", -1);
        if (source.endsWith("\n")) {
            String[] trimmed = new String[parts.length - 1];
            System.arraycopy(parts, 0, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return parts;
    }

    private void readLine() {
        if (!buffer.isEmpty()) return;

        if (nextLine >= lines.length) {
            state = State.EOF;
            buffer = "";
            column = 0;
            return;
        }

        buffer = lines[nextLine++].stripTrailing();
        line = nextLine;
        column = 0;
        tokensOnLine = 0;
        state = State.NEW_LINE;
    }

    private Matcher match(Pattern p) {
        Matcher m = p.matcher(buffer);
        return m.lookingAt() ? m : null;
    }

    private void consume(int n) {
        if (n > buffer.length()) {
            throw new LexerException("Unable to consume " + n + " characters from `" + buffer + "`", here(0));
        }
        lastLine = line;
        lastColumn = column;
        lastSize = n;
        buffer = buffer.substring(n);
        column += n;
    }

    private SourcePosition here(int length) {
        return new SourcePosition(Math.max(line, 1), column + 1, filename, length);
    }

    private SourcePosition last() {
        return new SourcePosition(lastLine, lastColumn + 1, filename, lastSize);
    }

    private static Token token(TokenType type, String value, Map<String, String> data, SourcePosition pos) {
        return new Token(type, value, data, pos);
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
