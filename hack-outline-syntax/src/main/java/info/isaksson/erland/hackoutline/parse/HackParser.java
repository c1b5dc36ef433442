package info.isaksson.erland.hackoutline.parse;

import info.isaksson.erland.hackoutline.ast.AbsConst;
import info.isaksson.erland.hackoutline.ast.ClassConst;
import info.isaksson.erland.hackoutline.ast.ClassDef;
import info.isaksson.erland.hackoutline.ast.ClassElement;
import info.isaksson.erland.hackoutline.ast.ClassKind;
import info.isaksson.erland.hackoutline.ast.ClassRequire;
import info.isaksson.erland.hackoutline.ast.ClassVar;
import info.isaksson.erland.hackoutline.ast.ClassVars;
import info.isaksson.erland.hackoutline.ast.Definition;
import info.isaksson.erland.hackoutline.ast.Expr;
import info.isaksson.erland.hackoutline.ast.FunDef;
import info.isaksson.erland.hackoutline.ast.FunKind;
import info.isaksson.erland.hackoutline.ast.GlobalConst;
import info.isaksson.erland.hackoutline.ast.Id;
import info.isaksson.erland.hackoutline.ast.Kind;
import info.isaksson.erland.hackoutline.ast.Method;
import info.isaksson.erland.hackoutline.ast.Program;
import info.isaksson.erland.hackoutline.ast.Stmt;
import info.isaksson.erland.hackoutline.ast.TraitUse;
import info.isaksson.erland.hackoutline.ast.TypeConst;
import info.isaksson.erland.hackoutline.ast.Typedef;
import info.isaksson.erland.hackoutline.ast.XhpAttr;
import info.isaksson.erland.hackoutline.ast.XhpCategory;
import info.isaksson.erland.hackoutline.ast.XhpChildren;
import info.isaksson.erland.hackoutline.pos.LineMap;
import info.isaksson.erland.hackoutline.pos.Pos;
import info.isaksson.erland.hackoutline.pos.RelativePath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declaration-level recursive-descent parser for Hack/PHP.
 *
 * <p>Only the shapes an outline needs are parsed: functions, class-likes and their members.
 * Bodies, type hints and initializer expressions are skipped by bracket balancing. Anything the
 * parser does not understand is recorded as a {@link SyntaxError} and skipped up to the next
 * {@code ;} or balanced block, so parsing always terminates with a (possibly partial) program.</p>
 *
 * <p>Namespaces are elaborated while parsing: top-level function and class names are stored fully
 * qualified with a leading backslash, and namespace blocks are flattened in source order.</p>
 *
 * <p>A parser instance holds the state of one parse; use {@link #parse(RelativePath, String)}.</p>
 */
public final class HackParser {

    private static final Logger log = LogManager.getLogger(HackParser.class);

    private final RelativePath file;
    private final LineMap lines;
    private final List<Token> tokens;
    private final List<SyntaxError> errors = new ArrayList<>();
    private int p;

    private record FunctionTail(Token last, boolean generator) {}

    private HackParser(RelativePath file, String content) {
        this.file = Objects.requireNonNull(file, "file");
        this.lines = LineMap.of(content);
        this.tokens = Lexer.tokenize(content);
    }

    public static ParseResult parse(String content) {
        return parse(RelativePath.DEFAULT, content);
    }

    public static ParseResult parse(RelativePath file, String content) {
        HackParser parser = new HackParser(file, content == null ? "" : content);
        Program program = parser.parseProgram();
        log.debug("Parsed {}: {} definitions, {} tokens, {} syntax errors",
                file, program.definitions.size(), parser.tokens.size(), parser.errors.size());
        return new ParseResult(program, parser.errors);
    }

    // ---------------------------------------------------------------------------------------------
    // Top level

    private Program parseProgram() {
        List<Definition> defs = new ArrayList<>();
        parseDefinitions(defs, "", false);
        return new Program(defs);
    }

    /** Parses definitions until EOF, or until the closing brace of a namespace block. */
    private void parseDefinitions(List<Definition> out, String namespace, boolean inBlock) {
        String ns = namespace;
        while (!atEof()) {
            Token t = peek();
            if (t.isPunct("}")) {
                if (inBlock) return;
                error("unexpected-token", "Unmatched '}'", t);
                next();
                continue;
            }
            if (t.isKeyword("namespace") && (peek(1).isName() || peek(1).isPunct("{"))) {
                next();
                String name = peek().isName() ? stripLeadingBackslash(next().text) : "";
                if (peek().isPunct("{")) {
                    next();
                    parseDefinitions(out, name, true);
                    if (peek().isPunct("}")) {
                        next();
                    } else {
                        error("unterminated-block", "Missing '}' for namespace block " + name, t);
                    }
                    continue;
                }
                expectSemicolon("namespace declaration");
                ns = name;
                continue;
            }

            int before = p;
            Definition d = parseDefinition(ns);
            if (d != null) out.add(d);
            if (p == before) {
                error("unexpected-token", "Unexpected '" + peek().text + "'", peek());
                next();
            }
        }
    }

    private Definition parseDefinition(String ns) {
        skipAttributes();
        Token start = peek();

        if (start.isKeyword("function") && !peek(1).isPunct("(")) {
            return parseFunDef(ns, start, false);
        }
        if (start.isKeyword("async") && peek(1).isKeyword("function") && !peek(2).isPunct("(")) {
            next();
            return parseFunDef(ns, start, true);
        }

        int save = p;
        boolean isAbstract = false;
        boolean isFinal = false;
        while (peek().isKeyword("abstract") || peek().isKeyword("final")) {
            if (peek().isKeyword("abstract")) isAbstract = true;
            else isFinal = true;
            next();
        }
        Token kw = peek();
        ClassKind classKind = null;
        if (kw.isKeyword("class")) {
            classKind = isAbstract ? ClassKind.ABSTRACT : ClassKind.NORMAL;
        } else if (kw.isKeyword("interface")) {
            classKind = ClassKind.INTERFACE;
        } else if (kw.isKeyword("trait")) {
            classKind = ClassKind.TRAIT;
        } else if (kw.isKeyword("enum") && peek(1).type == TokenType.IDENTIFIER
                && (peek(2).isPunct(":") || peek(2).isPunct("{"))) {
            classKind = ClassKind.ENUM;
        }
        if (classKind != null) {
            return parseClassDef(ns, start, classKind, isFinal);
        }
        p = save;

        if ((start.isKeyword("type") || start.isKeyword("newtype")) && peek(1).type == TokenType.IDENTIFIER) {
            next();
            Token nameTok = next();
            return new Typedef(new Id(pos(nameTok), qualify(ns, nameTok.text)), skipStatement(start));
        }
        if (start.isKeyword("const")) {
            return new GlobalConst(skipStatement(start));
        }
        return new Stmt(skipStatement(start));
    }

    private Definition parseFunDef(String ns, Token start, boolean isAsync) {
        next(); // function
        if (peek().isPunct("&")) next();
        Token nameTok = peek();
        if (nameTok.type != TokenType.IDENTIFIER) {
            error("missing-name", "Expected function name", nameTok);
            return new Stmt(skipStatement(start));
        }
        next();
        FunctionTail tail = parseFunctionTail();
        return new FunDef(
                new Id(pos(nameTok), qualify(ns, nameTok.text)),
                span(start, tail.last()),
                FunKind.of(isAsync, tail.generator()));
    }

    private FunctionTail parseFunctionTail() {
        if (peek().isPunct("<")) skipGroup();
        if (peek().isPunct("(")) {
            skipGroup();
        } else {
            error("unexpected-token", "Expected '(' to open the parameter list", peek());
        }
        skipUntilBodyOrSemicolon();
        boolean generator = false;
        if (peek().isPunct("{")) {
            generator = skipGroup();
        } else if (peek().isPunct(";")) {
            next();
        } else {
            error("unexpected-token", "Expected a function body", peek());
        }
        return new FunctionTail(previous(), generator);
    }

    // ---------------------------------------------------------------------------------------------
    // Classes

    private Definition parseClassDef(String ns, Token start, ClassKind classKind, boolean isFinal) {
        next(); // class | interface | trait | enum
        Id name = parseClassName(ns);
        if (name == null) {
            error("missing-name", "Expected a class name", peek());
            return new Stmt(skipStatement(start));
        }
        skipUntilBodyOrSemicolon();
        if (!peek().isPunct("{")) {
            error("unexpected-token", "Expected '{' to open the body of " + name.name, peek());
            if (peek().isPunct(";")) next();
            return new ClassDef(name, span(start, previous()), classKind, isFinal, List.of());
        }
        next(); // {
        List<ClassElement> body = parseClassBody(classKind);
        Token last;
        if (peek().isPunct("}")) {
            last = next();
        } else {
            error("unterminated-block", "Missing '}' for " + name.name, start);
            last = previous();
        }
        return new ClassDef(name, span(start, last), classKind, isFinal, body);
    }

    private Id parseClassName(String ns) {
        Token t = peek();
        if (t.type == TokenType.IDENTIFIER) {
            next();
            return new Id(pos(t), qualify(ns, t.text));
        }
        if (t.isPunct(":") && peek(1).type == TokenType.IDENTIFIER && adjacent(t, peek(1))) {
            // XHP class: `:ui:my-button` is named `xhp_ui__my_button`.
            next();
            StringBuilder sb = new StringBuilder("xhp_");
            Token first = next();
            Token last = first;
            sb.append(first.text);
            while ((peek().isPunct(":") || peek().isPunct("-")) && adjacent(last, peek())
                    && peek(1).type == TokenType.IDENTIFIER && adjacent(peek(), peek(1))) {
                sb.append(next().isPunct(":") ? "__" : "_");
                last = next();
                sb.append(last.text);
            }
            return new Id(span(t, last), "\\" + sb);
        }
        return null;
    }

    private List<ClassElement> parseClassBody(ClassKind classKind) {
        List<ClassElement> out = new ArrayList<>();
        while (!atEof() && !peek().isPunct("}")) {
            int before = p;
            parseClassElement(classKind, out);
            if (p == before) {
                error("unexpected-token", "Unexpected '" + peek().text + "' in class body", peek());
                next();
            }
        }
        return out;
    }

    private void parseClassElement(ClassKind classKind, List<ClassElement> out) {
        skipAttributes();
        Token start = peek();

        if (start.isPunct(";")) {
            next();
            return;
        }
        if (start.isKeyword("use")) {
            parseTraitUse(out);
            return;
        }
        if (start.isKeyword("require") && (peek(1).isKeyword("extends") || peek(1).isKeyword("implements"))) {
            parseClassRequire(start, out);
            return;
        }
        if (start.isKeyword("attribute") && !peek(1).isPunct("=")) {
            parseXhpAttributes(out);
            return;
        }
        if (start.isKeyword("category") && peek(1).isPunct("%")) {
            parseXhpCategory(start, out);
            return;
        }
        if (start.isKeyword("children") && !peek(1).isPunct("=")) {
            out.add(new XhpChildren(skipStatement(start)));
            return;
        }
        if (classKind == ClassKind.ENUM && start.type == TokenType.IDENTIFIER && peek(1).isPunct("=")) {
            parseEnumConstant(out);
            return;
        }

        List<Kind> kinds = new ArrayList<>();
        boolean isAsync = false;
        while (true) {
            Token t = peek();
            Kind k = kindOf(t);
            if (k != null) {
                kinds.add(k);
            } else if (t.isKeyword("async")) {
                isAsync = true;
            } else if (!t.isKeyword("var")) {
                break;
            }
            next();
        }

        Token t = peek();
        if (t.isKeyword("function")) {
            parseMethod(start, kinds, isAsync, out);
        } else if (t.isKeyword("const")) {
            parseClassConst(start, kinds, out);
        } else if (looksLikeProperty()) {
            parseProperty(kinds, out);
        } else {
            error("unexpected-token", "Unexpected '" + t.text + "' in class body", t);
            skipStatement(t);
        }
    }

    private void parseMethod(Token start, List<Kind> kinds, boolean isAsync, List<ClassElement> out) {
        next(); // function
        if (peek().isPunct("&")) next();
        Token nameTok = peek();
        if (nameTok.type != TokenType.IDENTIFIER) {
            error("missing-name", "Expected method name", nameTok);
            skipStatement(start);
            return;
        }
        next();
        FunctionTail tail = parseFunctionTail();
        out.add(new Method(kinds, new Id(pos(nameTok), nameTok.text), span(start, tail.last()),
                FunKind.of(isAsync, tail.generator())));
    }

    private void parseClassConst(Token start, List<Kind> kinds, List<ClassElement> out) {
        next(); // const
        boolean isAbstract = kinds.contains(Kind.ABSTRACT);

        if (peek().isKeyword("type") && peek(1).type == TokenType.IDENTIFIER) {
            next();
            Token nameTok = next();
            out.add(new TypeConst(new Id(pos(nameTok), nameTok.text), skipStatement(start), isAbstract));
            return;
        }

        if (isAbstract) {
            Token nameTok = readConstName();
            if (nameTok == null) {
                error("missing-name", "Expected constant name", peek());
            } else {
                out.add(new AbsConst(new Id(pos(nameTok), nameTok.text)));
            }
            skipStatement(start);
            return;
        }

        List<ClassConst.Entry> entries = new ArrayList<>();
        boolean first = true;
        while (true) {
            Token nameTok;
            if (first) {
                nameTok = readConstName();
            } else {
                nameTok = peek().type == TokenType.IDENTIFIER ? next() : null;
            }
            first = false;
            if (nameTok == null) {
                error("missing-name", "Expected constant name", peek());
                skipStatement(start);
                break;
            }
            Expr value;
            if (peek().isPunct("=")) {
                next();
                value = parseExprExtent();
            } else {
                error("missing-initializer", "Constant " + nameTok.text + " has no value", nameTok);
                value = new Expr(pos(nameTok));
            }
            entries.add(new ClassConst.Entry(new Id(pos(nameTok), nameTok.text), value));
            if (peek().isPunct(",")) {
                next();
                continue;
            }
            expectSemicolon("constant declaration");
            break;
        }
        if (!entries.isEmpty()) out.add(new ClassConst(entries));
    }

    private void parseEnumConstant(List<ClassElement> out) {
        Token nameTok = next();
        next(); // =
        Expr value = parseExprExtent();
        expectSemicolon("enum constant");
        out.add(new ClassConst(List.of(new ClassConst.Entry(new Id(pos(nameTok), nameTok.text), value))));
    }

    private void parseProperty(List<Kind> kinds, List<ClassElement> out) {
        int depth = 0;
        while (!atEof()) {
            Token t = peek();
            if (depth == 0 && t.type == TokenType.VARIABLE) break;
            if (isOpener(t) || t.isPunct("<")) depth++;
            else if ((isCloser(t) || t.isPunct(">")) && depth > 0) depth--;
            next();
        }

        List<ClassVar> vars = new ArrayList<>();
        while (peek().type == TokenType.VARIABLE) {
            Token v = next();
            Id name = new Id(pos(v), v.text.substring(1));
            Expr init = null;
            if (peek().isPunct("=")) {
                next();
                init = parseExprExtent();
            }
            Pos varSpan = init == null ? pos(v) : Pos.btw(pos(v), init.pos);
            vars.add(new ClassVar(varSpan, name, init));
            if (!peek().isPunct(",")) break;
            next();
        }
        expectSemicolon("property declaration");
        out.add(new ClassVars(kinds, vars));
    }

    private void parseTraitUse(List<ClassElement> out) {
        next(); // use
        while (peek().isName()) {
            Token n = next();
            out.add(new TraitUse(new Id(pos(n), n.text)));
            if (peek().isPunct("<")) skipGroup();
            if (!peek().isPunct(",")) break;
            next();
        }
        if (peek().isPunct("{")) {
            skipGroup();
        } else {
            expectSemicolon("trait use");
        }
    }

    private void parseClassRequire(Token start, List<ClassElement> out) {
        next(); // require
        boolean isExtends = next().isKeyword("extends");
        if (peek().isName()) {
            Token n = next();
            out.add(new ClassRequire(isExtends, new Id(pos(n), n.text)));
        } else {
            error("missing-name", "Expected a class name after require", peek());
        }
        skipStatement(start);
    }

    private void parseXhpCategory(Token start, List<ClassElement> out) {
        next(); // category
        List<Id> names = new ArrayList<>();
        while (!atEof() && !peek().isPunct(";") && !peek().isPunct("}")) {
            Token t = next();
            if (t.type == TokenType.IDENTIFIER) names.add(new Id(pos(t), t.text));
        }
        expectSemicolon("category declaration");
        out.add(new XhpCategory(names));
    }

    /**
     * {@code attribute string title = "x" @required, int count, :ui:base;}. Each declared attribute
     * becomes one {@link XhpAttr} named {@code :title}; inherited attribute lists are skipped.
     */
    private void parseXhpAttributes(List<ClassElement> out) {
        next(); // attribute
        while (!atEof()) {
            int segStart = p;
            int idx = p;
            int depth = 0;
            int eq = -1;
            int at = -1;
            while (idx < tokens.size()) {
                Token t = tokens.get(idx);
                if (t.type == TokenType.EOF) break;
                if (depth == 0 && (t.isPunct(",") || t.isPunct(";") || t.isPunct("}"))) break;
                if (isOpener(t)) depth++;
                else if (isCloser(t) && depth > 0) depth--;
                else if (depth == 0 && t.isPunct("=") && eq < 0) eq = idx;
                else if (depth == 0 && t.isPunct("@") && at < 0) at = idx;
                idx++;
            }

            if (idx > segStart && !tokens.get(segStart).isPunct(":")) {
                int nameLimit = eq >= 0 ? eq : (at >= 0 ? at : idx);
                addXhpAttr(out, segStart, nameLimit, eq, at, idx);
            }

            p = idx;
            if (!peek().isPunct(",")) break;
            next();
        }
        expectSemicolon("attribute declaration");
    }

    private void addXhpAttr(List<ClassElement> out, int segStart, int nameLimit, int eq, int at, int segEnd) {
        int nameIdx = -1;
        for (int k = nameLimit - 1; k >= segStart; k--) {
            if (tokens.get(k).type == TokenType.IDENTIFIER) {
                nameIdx = k;
                break;
            }
        }
        if (nameIdx < 0) {
            error("missing-name", "Expected an attribute name", tokens.get(segStart));
            return;
        }
        // Dashed names: data-foo-bar
        int firstIdx = nameIdx;
        while (firstIdx - 2 >= segStart
                && tokens.get(firstIdx - 1).isPunct("-")
                && tokens.get(firstIdx - 2).type == TokenType.IDENTIFIER
                && adjacent(tokens.get(firstIdx - 2), tokens.get(firstIdx - 1))
                && adjacent(tokens.get(firstIdx - 1), tokens.get(firstIdx))) {
            firstIdx -= 2;
        }
        StringBuilder name = new StringBuilder(":");
        for (int k = firstIdx; k <= nameIdx; k++) name.append(tokens.get(k).text);
        Pos namePos = span(tokens.get(firstIdx), tokens.get(nameIdx));

        Expr init = null;
        if (eq >= 0) {
            int initEnd = (at > eq ? at : segEnd) - 1;
            if (initEnd > eq) init = new Expr(span(tokens.get(eq + 1), tokens.get(initEnd)));
        }
        Pos varSpan = init == null ? namePos : Pos.btw(namePos, init.pos);
        out.add(new XhpAttr(new ClassVar(varSpan, new Id(namePos, name.toString()), init), at >= 0));
    }

    // ---------------------------------------------------------------------------------------------
    // Skipping helpers

    /**
     * Scans a constant head ({@code [hint] NAME}) and returns the last identifier before
     * {@code =}, {@code ,} or {@code ;}. Leaves the cursor on that terminator.
     */
    private Token readConstName() {
        int depth = 0;
        Token name = null;
        int idx = p;
        while (idx < tokens.size()) {
            Token t = tokens.get(idx);
            if (t.type == TokenType.EOF) break;
            if (depth == 0 && (t.isPunct("=") || t.isPunct(",") || t.isPunct(";")
                    || t.isPunct("{") || t.isPunct("}"))) {
                break;
            }
            if (t.isPunct("(") || t.isPunct("[") || t.isPunct("<")) depth++;
            else if ((t.isPunct(")") || t.isPunct("]") || t.isPunct(">")) && depth > 0) depth--;
            else if (depth == 0 && t.type == TokenType.IDENTIFIER) name = t;
            idx++;
        }
        p = idx;
        return name;
    }

    /** Consumes an initializer up to (not including) {@code ,}, {@code ;} or a closer at depth 0. */
    private Expr parseExprExtent() {
        Token first = peek();
        Token last = null;
        int depth = 0;
        while (!atEof()) {
            Token t = peek();
            if (depth == 0 && (t.isPunct(",") || t.isPunct(";") || isCloser(t))) break;
            next();
            last = t;
            if (isOpener(t)) depth++;
            else if (isCloser(t)) depth--;
        }
        if (last == null) {
            error("missing-initializer", "Expected an expression", first);
            return new Expr(pos(previous()));
        }
        return new Expr(span(first, last));
    }

    /**
     * Skips a statement or member: up to and including a {@code ;} at depth 0, or through a
     * balanced block. Stops in front of an unmatched {@code }}. Returns the range from
     * {@code start} to the last consumed token.
     */
    private Pos skipStatement(Token start) {
        int depth = 0;
        while (!atEof()) {
            Token t = peek();
            if (depth == 0 && t.isPunct("}")) break;
            next();
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                if (depth > 0) depth--;
                if (depth == 0 && t.isPunct("}")) break;
            } else if (depth == 0 && t.isPunct(";")) {
                break;
            }
        }
        return span(start, previous());
    }

    /** Skips a return type and {@code where} clause, stopping in front of {@code {} or {@code ;}. */
    private void skipUntilBodyOrSemicolon() {
        int depth = 0;
        while (!atEof()) {
            Token t = peek();
            if (depth == 0 && (t.isPunct("{") || t.isPunct(";") || t.isPunct("}"))) return;
            if (t.isPunct("(") || t.isPunct("[")) depth++;
            else if ((t.isPunct(")") || t.isPunct("]")) && depth > 0) depth--;
            next();
        }
    }

    /**
     * Consumes a bracketed group starting at the current opener ({@code ( [ { <}).
     *
     * @return true if a {@code yield} appeared inside the group
     */
    private boolean skipGroup() {
        Token open = next();
        String close = closerFor(open.text);
        int depth = 1;
        boolean sawYield = false;
        while (!atEof()) {
            Token t = next();
            if (t.isKeyword("yield")) sawYield = true;
            if (t.isPunct(open.text)) {
                depth++;
            } else if (t.isPunct(close) && --depth == 0) {
                return sawYield;
            }
        }
        error("unterminated-block", "Missing '" + close + "'", open);
        return sawYield;
    }

    /** Skips {@code <<Attr, Other(1)>>} user attributes. */
    private void skipAttributes() {
        while (peek().isPunct("<") && peek(1).isPunct("<") && adjacent(peek(), peek(1))) {
            Token open = next();
            next();
            int depth = 0;
            boolean closed = false;
            while (!atEof()) {
                Token t = next();
                if (t.isPunct("(") || t.isPunct("[")) depth++;
                else if ((t.isPunct(")") || t.isPunct("]")) && depth > 0) depth--;
                else if (depth == 0 && t.isPunct(">") && peek().isPunct(">") && adjacent(t, peek())) {
                    next();
                    closed = true;
                    break;
                }
            }
            if (!closed) error("unterminated-block", "Missing '>>' for attribute", open);
        }
    }

    private boolean looksLikeProperty() {
        int depth = 0;
        for (int idx = p; idx < tokens.size(); idx++) {
            Token t = tokens.get(idx);
            if (t.type == TokenType.EOF) return false;
            if (depth == 0 && t.type == TokenType.VARIABLE) return true;
            if (depth == 0 && (t.isPunct(";") || t.isPunct("{") || t.isPunct("}") || t.isPunct("="))) return false;
            if (t.isPunct("(") || t.isPunct("[") || t.isPunct("<")) depth++;
            else if (t.isPunct(")") || t.isPunct("]") || t.isPunct(">")) {
                if (depth == 0) return false;
                depth--;
            }
        }
        return false;
    }

    private void expectSemicolon(String what) {
        if (peek().isPunct(";")) {
            next();
        } else {
            error("unexpected-token", "Expected ';' after " + what + ", found '" + peek().text + "'", peek());
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Token access

    private Token peek() {
        return tokens.get(p);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(p + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(p);
        if (t.type != TokenType.EOF) p++;
        return t;
    }

    private Token previous() {
        return tokens.get(Math.max(0, p - 1));
    }

    private boolean atEof() {
        return peek().type == TokenType.EOF;
    }

    private Pos pos(Token t) {
        return Pos.of(file, lines, t.start, t.end);
    }

    private Pos span(Token first, Token last) {
        return Pos.of(file, lines, first.start, Math.max(first.end, last.end));
    }

    private void error(String code, String message, Token at) {
        errors.add(new SyntaxError(code, message, pos(at)));
    }

    private static boolean adjacent(Token a, Token b) {
        return a.end == b.start;
    }

    private static boolean isOpener(Token t) {
        return t.isPunct("(") || t.isPunct("[") || t.isPunct("{");
    }

    private static boolean isCloser(Token t) {
        return t.isPunct(")") || t.isPunct("]") || t.isPunct("}");
    }

    private static String closerFor(String open) {
        switch (open) {
            case "(": return ")";
            case "[": return "]";
            case "{": return "}";
            case "<": return ">";
            default: throw new IllegalArgumentException("Not an opening bracket: " + open);
        }
    }

    private static Kind kindOf(Token t) {
        if (t.type != TokenType.IDENTIFIER) return null;
        switch (t.text.toLowerCase(Locale.ROOT)) {
            case "final": return Kind.FINAL;
            case "static": return Kind.STATIC;
            case "abstract": return Kind.ABSTRACT;
            case "private": return Kind.PRIVATE;
            case "public": return Kind.PUBLIC;
            case "protected": return Kind.PROTECTED;
            default: return null;
        }
    }

    private static String qualify(String ns, String name) {
        if (name.startsWith("\\")) return name;
        return ns.isEmpty() ? "\\" + name : "\\" + ns + "\\" + name;
    }

    private static String stripLeadingBackslash(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }
}
