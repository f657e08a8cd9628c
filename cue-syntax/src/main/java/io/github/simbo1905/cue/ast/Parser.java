package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser for the subset of the language the printer emits:
/// package and import clauses, fields with `?`/`!` markers and attributes, pattern
/// labels, embeddings, struct and list literals, unary and binary operators,
/// selectors, index expressions and calls.
///
/// Newlines terminate declarations the same way a comma does when the line
/// ends in an identifier, literal, closing bracket, `...` or `_|_`.
/// Line comments directly before a field become its doc lines.
public final class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private enum Type { IDENT, INT, FLOAT, STRING, BOTTOM, PUNCT, ATTR, COMMA, EOF }

    private record Token(Type type, String text, int pos, List<String> doc) {
        boolean is(String punct) {
            return type == Type.PUNCT && text.equals(punct);
        }
    }

    private final String source;
    private final List<Token> tokens;
    private int idx;

    private Parser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    /// Parses a complete file.
    /// @throws CueParseException if the source is malformed
    public static File parseFile(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "Parsing file of " + source.length() + " chars");
        return new Parser(source).file();
    }

    /// Parses a single expression.
    /// @throws CueParseException if the source is malformed or has trailing input
    public static Expr parseExpr(String source) {
        Objects.requireNonNull(source, "source must not be null");
        final Parser p = new Parser(source);
        p.skipCommas();
        final Expr e = p.expr();
        p.skipCommas();
        if (p.peek().type() != Type.EOF) {
            throw p.error("unexpected " + p.describe(p.peek()));
        }
        return e;
    }

    private File file() {
        final File file = new File();
        skipCommas();
        if (isKeyword("package")) {
            file.doc().addAll(peek().doc());
            next();
            file.add(new Package(expect(Type.IDENT).text()));
            skipCommas();
        }
        while (isKeyword("import")) {
            next();
            if (peek().is("(")) {
                next();
                skipCommas();
                while (!peek().is(")")) {
                    file.add(new ImportDecl(expect(Type.STRING).text()));
                    skipCommas();
                }
                next();
            } else {
                file.add(new ImportDecl(expect(Type.STRING).text()));
            }
            skipCommas();
        }
        while (peek().type() != Type.EOF) {
            file.add(decl());
            separator(null);
        }
        return file;
    }

    private boolean isKeyword(String word) {
        final Token t = peek();
        return t.type() == Type.IDENT && t.text().equals(word);
    }

    private void separator(String closing) {
        final Token t = peek();
        if (t.type() == Type.COMMA) {
            skipCommas();
        } else if (t.type() != Type.EOF && (closing == null || !t.is(closing))) {
            throw error("expected ',' or newline, found " + describe(t));
        }
    }

    private Decl decl() {
        final Token t = peek();
        if (t.type() == Type.ATTR) {
            next();
            return new Attribute(t.text());
        }
        if (t.is("...")) {
            next();
            final Token after = peek();
            if (after.type() == Type.COMMA || after.type() == Type.EOF || after.is("}")) {
                return new Ellipsis();
            }
            return new Ellipsis(expr());
        }
        final Field f = tryField();
        if (f != null) {
            return f;
        }
        return new EmbedDecl(expr());
    }

    private Field tryField() {
        final int save = idx;
        final Token start = peek();
        final Label label = tryLabel();
        if (label == null) {
            idx = save;
            return null;
        }
        Field.Constraint constraint = Field.Constraint.REGULAR;
        if (peek().is("?")) {
            next();
            constraint = Field.Constraint.OPTIONAL;
        } else if (peek().is("!")) {
            next();
            constraint = Field.Constraint.REQUIRED;
        }
        if (!peek().is(":")) {
            idx = save;
            return null;
        }
        next();
        final Field nested = tryField();
        final Expr value = nested != null ? StructLit.of(nested) : expr();
        final Field field = new Field(label, constraint, value);
        field.doc().addAll(start.doc());
        while (peek().type() == Type.ATTR) {
            field.addAttr(new Attribute(next().text()));
        }
        return field;
    }

    private Label tryLabel() {
        final Token t = peek();
        if (t.type() == Type.IDENT) {
            next();
            return new Ident(t.text());
        }
        if (t.type() == Type.STRING) {
            next();
            return BasicLit.string(t.text());
        }
        if (t.is("[")) {
            next();
            if (peek().is("]") || peek().is("...")) {
                return null;
            }
            final Expr pattern;
            try {
                pattern = expr();
            } catch (CueParseException e) {
                // not a pattern label; the caller reparses as an embedded list
                LOG.finest(() -> "Backtracking from label: " + e.getMessage());
                return null;
            }
            if (!peek().is("]")) {
                return null;
            }
            next();
            return ListLit.of(pattern);
        }
        return null;
    }

    private Expr expr() {
        return binary(1);
    }

    private Expr binary(int minPrecedence) {
        Expr left = unary();
        while (true) {
            final Token t = peek();
            final Op op = t.type() == Type.PUNCT ? Op.binary(t.text()) : null;
            if (op == null || op.precedence() < minPrecedence) {
                return left;
            }
            next();
            final Expr right = binary(op.precedence() + 1);
            left = new BinaryExpr(op, left, right);
        }
    }

    private Expr unary() {
        final Token t = peek();
        final Op op = t.type() == Type.PUNCT ? Op.unary(t.text()) : null;
        if (op == null) {
            return primary();
        }
        next();
        final Expr x = unary();
        if (x instanceof BasicLit lit && lit.isNumber()) {
            if (op == Op.SUB) {
                return new BasicLit(lit.kind(), lit.value().startsWith("-") ? lit.value().substring(1) : "-" + lit.value());
            }
            if (op == Op.ADD) {
                return lit;
            }
        }
        return new UnaryExpr(op, x);
    }

    private Expr primary() {
        Expr x = operand();
        while (true) {
            final Token t = peek();
            if (t.is(".")) {
                next();
                final Token sel = next();
                if (sel.type() == Type.IDENT) {
                    x = new SelectorExpr(x, new Ident(sel.text()));
                } else if (sel.type() == Type.STRING) {
                    x = new SelectorExpr(x, BasicLit.string(sel.text()));
                } else {
                    throw error("expected selector, found " + describe(sel));
                }
            } else if (t.is("(")) {
                next();
                x = new CallExpr(x, elements(")"));
            } else if (t.is("[")) {
                next();
                final Expr index = expr();
                expectPunct("]");
                x = new IndexExpr(x, index);
            } else {
                return x;
            }
        }
    }

    private Expr operand() {
        final Token t = next();
        switch (t.type()) {
            case INT:
                return new BasicLit(BasicLit.Kind.INT, t.text());
            case FLOAT:
                return new BasicLit(BasicLit.Kind.FLOAT, t.text());
            case STRING:
                return BasicLit.string(t.text());
            case BOTTOM:
                return new BottomLit();
            case IDENT:
                return switch (t.text()) {
                    case "null" -> BasicLit.nullLit();
                    case "true" -> BasicLit.bool(true);
                    case "false" -> BasicLit.bool(false);
                    default -> new Ident(t.text());
                };
            default:
                break;
        }
        if (t.is("{")) {
            final StructLit s = new StructLit();
            skipCommas();
            while (!peek().is("}")) {
                if (peek().type() == Type.EOF) {
                    throw error("unterminated struct");
                }
                s.add(decl());
                separator("}");
            }
            next();
            return s;
        }
        if (t.is("[")) {
            return new ListLit(elements("]"));
        }
        if (t.is("(")) {
            skipCommas();
            final Expr e = expr();
            skipCommas();
            expectPunct(")");
            return e;
        }
        idx--;
        throw error("unexpected " + describe(t));
    }

    private List<Expr> elements(String closing) {
        final List<Expr> out = new ArrayList<>();
        skipCommas();
        while (!peek().is(closing)) {
            if (peek().is("...")) {
                next();
                if (peek().is(closing) || peek().type() == Type.COMMA) {
                    out.add(new Ellipsis());
                } else {
                    out.add(new Ellipsis(expr()));
                }
            } else {
                out.add(expr());
            }
            separator(closing);
            if (peek().type() == Type.EOF) {
                throw error("expected '" + closing + "'");
            }
        }
        next();
        return out;
    }

    private void skipCommas() {
        while (peek().type() == Type.COMMA) {
            idx++;
        }
    }

    private Token peek() {
        return tokens.get(idx);
    }

    private Token next() {
        final Token t = tokens.get(idx);
        if (t.type() != Type.EOF) {
            idx++;
        }
        return t;
    }

    private Token expect(Type type) {
        final Token t = next();
        if (t.type() != type) {
            idx--;
            throw error("expected " + type.name().toLowerCase() + ", found " + describe(t));
        }
        return t;
    }

    private void expectPunct(String punct) {
        final Token t = next();
        if (!t.is(punct)) {
            throw error("expected '" + punct + "', found " + describe(t));
        }
    }

    private String describe(Token t) {
        return switch (t.type()) {
            case EOF -> "end of input";
            case COMMA -> "newline or ','";
            default -> "'" + t.text() + "'";
        };
    }

    private CueParseException error(String message) {
        return new CueParseException(message, source, peek().pos());
    }

    private static final class Lexer {

        private final String src;
        private final List<Token> out = new ArrayList<>();
        private List<String> pendingDoc = new ArrayList<>();
        private int pos;

        Lexer(String src) {
            this.src = src;
        }

        List<Token> tokenize() {
            while (pos < src.length()) {
                final char c = src.charAt(pos);
                if (c == '\n') {
                    if (endsStatement()) {
                        out.add(new Token(Type.COMMA, "\n", pos, List.of()));
                    }
                    pos++;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '/' && peekChar(1) == '/') {
                    comment();
                } else if (c == '"') {
                    string();
                } else if (Character.isDigit(c)) {
                    number();
                } else if (src.startsWith("_|_", pos)) {
                    emit(Type.BOTTOM, "_|_", pos);
                    pos += 3;
                } else if (Character.isLetter(c) || c == '_' || c == '$' || c == '#') {
                    ident();
                } else if (c == '@') {
                    attribute();
                } else {
                    punct();
                }
            }
            if (endsStatement()) {
                out.add(new Token(Type.COMMA, "\n", pos, List.of()));
            }
            out.add(new Token(Type.EOF, "", pos, List.of()));
            return out;
        }

        private boolean endsStatement() {
            if (out.isEmpty()) {
                return false;
            }
            final Token last = out.get(out.size() - 1);
            switch (last.type()) {
                case IDENT, INT, FLOAT, STRING, BOTTOM, ATTR:
                    return true;
                case PUNCT:
                    return last.text().equals(")") || last.text().equals("]")
                            || last.text().equals("}") || last.text().equals("...");
                default:
                    return false;
            }
        }

        private char peekChar(int offset) {
            final int i = pos + offset;
            return i < src.length() ? src.charAt(i) : '\0';
        }

        private void emit(Type type, String text, int start) {
            out.add(new Token(type, text, start, pendingDoc));
            pendingDoc = new ArrayList<>();
        }

        private void comment() {
            final int end = src.indexOf('\n', pos);
            final String line = src.substring(pos + 2, end < 0 ? src.length() : end);
            pendingDoc.add(line.startsWith(" ") ? line.substring(1) : line);
            pos = end < 0 ? src.length() : end;
            if (!out.isEmpty() && src.lastIndexOf('\n', pos - 1) < out.get(out.size() - 1).pos()) {
                // trailing comment on a code line
                pendingDoc.remove(pendingDoc.size() - 1);
            }
        }

        private void string() {
            final int start = pos;
            final var sb = new StringBuilder();
            pos++;
            while (true) {
                if (pos >= src.length() || src.charAt(pos) == '\n') {
                    throw new CueParseException("unterminated string", src, start);
                }
                final char c = src.charAt(pos++);
                if (c == '"') {
                    break;
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= src.length()) {
                    throw new CueParseException("unterminated string", src, start);
                }
                final char e = src.charAt(pos++);
                switch (e) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case '/' -> sb.append('/');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'u' -> {
                        if (pos + 4 > src.length()) {
                            throw new CueParseException("invalid unicode escape", src, pos - 2);
                        }
                        try {
                            sb.append((char) Integer.parseInt(src.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException ex) {
                            throw new CueParseException("invalid unicode escape", src, pos - 2);
                        }
                        pos += 4;
                    }
                    default -> throw new CueParseException("unknown escape sequence \\" + e, src, pos - 2);
                }
            }
            emit(Type.STRING, sb.toString(), start);
        }

        private void number() {
            final int start = pos;
            boolean isFloat = false;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
            if (peekChar(0) == '.' && Character.isDigit(peekChar(1))) {
                isFloat = true;
                pos++;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    pos++;
                }
            }
            if (peekChar(0) == 'e' || peekChar(0) == 'E') {
                final int mark = pos;
                pos++;
                if (peekChar(0) == '+' || peekChar(0) == '-') {
                    pos++;
                }
                if (Character.isDigit(peekChar(0))) {
                    isFloat = true;
                    while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                        pos++;
                    }
                } else {
                    pos = mark;
                }
            }
            emit(isFloat ? Type.FLOAT : Type.INT, src.substring(start, pos), start);
        }

        private void ident() {
            final int start = pos;
            pos++;
            while (pos < src.length()) {
                final char c = src.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '$' || (c == '#' && pos == start + 1)) {
                    pos++;
                } else {
                    break;
                }
            }
            emit(Type.IDENT, src.substring(start, pos), start);
        }

        private void attribute() {
            final int start = pos;
            pos++;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            if (peekChar(0) == '(') {
                int depth = 0;
                boolean inString = false;
                while (pos < src.length()) {
                    final char c = src.charAt(pos++);
                    if (inString) {
                        if (c == '\\') {
                            pos++;
                        } else if (c == '"') {
                            inString = false;
                        }
                    } else if (c == '"') {
                        inString = true;
                    } else if (c == '(') {
                        depth++;
                    } else if (c == ')' && --depth == 0) {
                        break;
                    }
                }
                if (depth != 0) {
                    throw new CueParseException("unterminated attribute", src, start);
                }
            }
            emit(Type.ATTR, src.substring(start, pos), start);
        }

        private void punct() {
            final int start = pos;
            if (src.startsWith("...", pos)) {
                pos += 3;
                emit(Type.PUNCT, "...", start);
                return;
            }
            final String two = pos + 2 <= src.length() ? src.substring(pos, pos + 2) : "";
            switch (two) {
                case "<=", ">=", "==", "!=", "=~", "!~" -> {
                    pos += 2;
                    emit(Type.PUNCT, two, start);
                    return;
                }
                default -> { }
            }
            final char c = src.charAt(pos);
            if ("{}[](),:?!|&<>+-*/.".indexOf(c) < 0) {
                throw new CueParseException("unexpected character '" + c + "'", src, pos);
            }
            pos++;
            if (c == ',') {
                out.add(new Token(Type.COMMA, ",", start, List.of()));
            } else {
                emit(Type.PUNCT, String.valueOf(c), start);
            }
        }
    }
}
