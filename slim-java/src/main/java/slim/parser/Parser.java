package slim.parser;

import slim.CompilerOptions;
import slim.SourcePosition;
import slim.ast.*;
import slim.lexer.Lexer;
import slim.lexer.Token;
import slim.lexer.TokenType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Parser {
    private final Lexer lexer;
    private final Path file;
    private final Path baseDir;
    private final CompilerOptions options;
    private final Set<Path> chain;
    private final Map<String, NamedBlock> namedBlocks = new LinkedHashMap<>();
    // names declared in this file, imports excluded
    private final Set<String> declared = new HashSet<>();

    private Parser parent;
    private Token token;
    private Block result;

    public Parser(String source) {
        this(source, null, CompilerOptions.defaults());
    }

    public Parser(String source, Path baseDir, CompilerOptions options) {
        this(source, null, baseDir, options, Set.of());
    }

    private Parser(String source, Path file, Path baseDir, CompilerOptions options, Set<Path> chain) {
        this.file = file;
        this.baseDir = baseDir;
        this.options = options == null ? CompilerOptions.defaults() : options;
        this.chain = chain;
        this.lexer = new Lexer(source, file == null ? null : file.toString());
    }

    public static Parser forFile(Path file, CompilerOptions options) {
        String source = read(file, new SourcePosition(0, 0, file.toString(), 0), "Unable to read template ");
        return new Parser(source, file, file.toAbsolutePath().getParent(), options, Set.of(key(file)));
    }

    public Map<String, NamedBlock> namedBlocks() {
        return Collections.unmodifiableMap(namedBlocks);
    }

    // ---------- entry ----------
    public Block parse() {
        if (result != null) return result;

        advance();
        Block block = Block.empty(token.position());

        while (!check(TokenType.EOF)) {
            if (check(TokenType.BLANK)) {
                advance();
                continue;
            }
            block.children().add(parseToken());
        }

        if (parent != null) {
            Block inherited = parent.parse();

            for (NamedBlock theirs : parent.namedBlocks.values()) {
                NamedBlock ours = namedBlocks.get(theirs.name());
                if (ours != null) compose(theirs, ours);
            }

            // a further child composes against the blocks that are actually in the tree
            Map<String, NamedBlock> effective = new LinkedHashMap<>(namedBlocks);
            effective.putAll(parent.namedBlocks);
            namedBlocks.clear();
            namedBlocks.putAll(effective);

            block = inherited;
        }

        result = block;
        return block;
    }

    private static void compose(NamedBlock theirs, NamedBlock ours) {
        List<Node> target = theirs.body().children();
        List<Node> mine = ours.body().children();
        switch (ours.modifier()) {
            case APPEND -> target.addAll(mine);
            case PREPEND -> target.addAll(0, mine);
            default -> {
                target.clear();
                target.addAll(mine);
            }
        }
    }

    private Node parseToken() {
        return switch (token.type()) {
            case INDENT -> parseBlock(null);
            case DOCTYPE -> parseDoctype();
            case COMMENT -> parseComment();
            case TAG -> parseTag();
            case TEXT -> parseText();
            case ASSIGNMENT -> parseAssignment();
            case IF -> parseCondition();
            case EACH -> parseEach();
            case NAMED_BLOCK -> parseNamedBlock();
            case IMPORT -> parseImport();
            case EXTEND -> parseExtend();
            case ID, CLASS, ATTRIBUTE -> throw new ParseException(
                    "Conditional attributes must be placed immediately within a parent tag.", token.position());
            default -> throw new ParseException("Unexpected token: " + token.type(), token.position());
        };
    }

    // ---------- block ----------

    // attribute lines inside the block go to tagAttributes, null unless the block belongs to a tag
    private Block parseBlock(List<Attribute> tagAttributes) {
        Token open = expect(TokenType.INDENT);
        Block block = Block.empty(open.position());

        while (!check(TokenType.EOF) && !check(TokenType.OUTDENT)) {
            if (check(TokenType.BLANK)) {
                advance();
                continue;
            }

            if (check(TokenType.ID) || check(TokenType.CLASS) || check(TokenType.ATTRIBUTE)) {
                if (tagAttributes == null) {
                    throw new ParseException("Conditional attributes must be placed immediately within a parent tag.",
                            token.position());
                }
                tagAttributes.add(toAttribute(advance(), true));
                continue;
            }

            block.children().add(parseToken());
        }

        expect(TokenType.OUTDENT);
        return block;
    }

    // ---------- leaves ----------
    private Doctype parseDoctype() {
        Token tok = expect(TokenType.DOCTYPE);
        return new Doctype(tok.position(), tok.value(), options.format());
    }

    private Comment parseComment() {
        Token tok = expect(TokenType.COMMENT);
        boolean silent = Token.MODE_SILENT.equals(tok.get(Token.MODE));

        Block block = null;
        skipBlanks();
        if (check(TokenType.INDENT)) {
            // a silent comment's body is never interpreted
            if (silent) lexer.requestRawCapture();
            block = parseBlock(null);
        }
        return new Comment(tok.position(), tok.value(), silent, block);
    }

    private Text parseText() {
        Token tok = expect(TokenType.TEXT);
        return new Text(tok.position(), tok.value(), Token.MODE_RAW.equals(tok.get(Token.MODE)));
    }

    private Assignment parseAssignment() {
        Token tok = expect(TokenType.ASSIGNMENT);
        return new Assignment(tok.position(), tok.get(Token.VARIABLE), tok.value());
    }

    // ---------- tag ----------
    private Tag parseTag() {
        Token tok = expect(TokenType.TAG);
        String name = tok.value();
        int line = tok.position().line();

        List<Attribute> attributes = new ArrayList<>();
        Block body = null;
        boolean raw = Tag.isRawTextElement(name);

        readmore:
        while (true) {
            switch (token.type()) {
                case ID, CLASS, ATTRIBUTE -> {
                    if (token.position().line() != line) break readmore;
                    attributes.add(toAttribute(advance(), false));
                }
                case BLANK -> advance();
                case RAW_MARKER -> {
                    advance();
                    raw = true;
                }
                case TEXT -> {
                    if (token.position().line() != line || Token.MODE_PIPED.equals(token.get(Token.MODE))) {
                        break readmore;
                    }
                    if (body == null) body = Block.empty(token.position());
                    body.children().add(0, parseText());
                }
                case INDENT -> {
                    if (raw) lexer.requestRawCapture();
                    Block block = parseBlock(attributes);
                    if (body == null) body = block;
                    else body.children().addAll(block.children());
                    break readmore;
                }
                default -> {
                    break readmore;
                }
            }
        }

        return new Tag(tok.position(), name, attributes, body, raw);
    }

    private static Attribute toAttribute(Token t, boolean allowCondition) {
        String condition = t.get(Token.CONDITION);
        if (!allowCondition && !condition.isEmpty()) {
            throw new ParseException("Conditional attributes must be placed in a block within a tag.", t.position());
        }

        return switch (t.type()) {
            case ID -> new Attribute(t.position(), "id", t.value(), true, condition);
            case CLASS -> new Attribute(t.position(), "class", t.value(), true, condition);
            case ATTRIBUTE -> new Attribute(t.position(), t.value(), t.get(Token.CONTENT),
                    Token.MODE_RAW.equals(t.get(Token.MODE)), condition);
            default -> throw new ParseException("Unexpected token: " + t.type(), t.position());
        };
    }

    // ---------- control ----------
    private Condition parseCondition() {
        return conditionBody(expect(TokenType.IF));
    }

    private Condition conditionBody(Token head) {
        Block positive = null;
        Block negative = null;

        readmore:
        while (true) {
            switch (token.type()) {
                case BLANK -> advance();
                case INDENT -> positive = parseBlock(null);
                case ELSE_IF -> {
                    Token elsif = advance();
                    negative = Block.of(elsif.position(), conditionBody(elsif));
                }
                case ELSE -> {
                    Token otherwise = advance();
                    if (check(TokenType.IF)) {
                        negative = Block.of(otherwise.position(), parseCondition());
                    } else if (check(TokenType.INDENT)) {
                        negative = parseBlock(null);
                    } else {
                        throw new ParseException("Expected 'if' or an indented block after 'else', but got "
                                + token.type(), token.position());
                    }
                }
                default -> {
                    break readmore;
                }
            }
        }

        if (positive == null) positive = Block.empty(head.position());
        return new Condition(head.position(), head.value(), positive, negative);
    }

    private Each parseEach() {
        Token tok = expect(TokenType.EACH);
        skipBlanks();
        Block body = check(TokenType.INDENT) ? parseBlock(null) : null;
        return new Each(tok.position(), tok.get(Token.KEY), tok.get(Token.VALUE), tok.value(), body);
    }

    // ---------- composition ----------
    private Block parseNamedBlock() {
        Token tok = expect(TokenType.NAMED_BLOCK);
        NamedBlock.Modifier modifier = NamedBlock.Modifier.of(tok.get(Token.MODIFIER));

        skipBlanks();
        Block body = check(TokenType.INDENT) ? parseBlock(null) : Block.empty(tok.position());
        register(new NamedBlock(tok.position(), tok.value(), modifier, body), tok.position());

        // append/prepend contribute only through composition
        return modifier == NamedBlock.Modifier.DEFAULT ? body : Block.empty(tok.position());
    }

    private void register(NamedBlock block, SourcePosition at) {
        if (!declared.add(block.name())) {
            throw new ParseException("Multiple definitions of named blocks are not permitted. Block "
                    + block.name() + " has been redefined.", at);
        }
        namedBlocks.put(block.name(), block);
    }

    private Block parseImport() {
        Token tok = expect(TokenType.IMPORT);
        Parser imported = newFileParser(tok.value(), tok.position());
        Block block = imported.parse();

        // own declarations take precedence, then the first import of a name
        for (NamedBlock nb : imported.namedBlocks.values()) namedBlocks.putIfAbsent(nb.name(), nb);

        return new Block(tok.position(), block.children());
    }

    private Block parseExtend() {
        if (parent != null) {
            throw new ParseException("Unable to extend multiple parent templates.", token.position());
        }

        Token tok = expect(TokenType.EXTEND);
        Parser p = newFileParser(tok.value(), tok.position());
        p.parse();
        parent = p;
        return Block.empty(tok.position());
    }

    private Parser newFileParser(String target, SourcePosition at) {
        if (baseDir == null) {
            throw new ResourceException("Unable to import/extend " + target + " with empty base path.", at, null);
        }

        Path resolved = baseDir.resolve(target);
        String fileName = resolved.getFileName().toString();
        if (fileName.lastIndexOf('.') <= 0) {
            resolved = resolved.resolveSibling(fileName + options.extension());
        }

        Path key = key(resolved);
        if (chain.contains(key)) {
            throw new ResourceException("Circular import/extend of " + resolved, at, null);
        }

        String source = read(resolved, at, "Failed to import/extend ");

        Set<Path> nextChain = new LinkedHashSet<>(chain);
        nextChain.add(key);
        return new Parser(source, resolved, resolved.toAbsolutePath().getParent(), options,
                Collections.unmodifiableSet(nextChain));
    }

    private static Path key(Path p) {
        return p.toAbsolutePath().normalize();
    }

    private static String read(Path file, SourcePosition at, String what) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ResourceException(what + file + " with error " + e, at, e);
        }
    }

    // ---------- helpers ----------
    private Token advance() {
        Token prev = token;
        token = lexer.next();
        return prev;
    }

    private Token expect(TokenType t) {
        if (!check(t)) {
            throw new ParseException("Expected " + t + ", but got " + token.type(), token.position());
        }
        return advance();
    }

    private void skipBlanks() {
        while (check(TokenType.BLANK)) advance();
    }

    private boolean check(TokenType t) {
        return token.type() == t;
    }
}
