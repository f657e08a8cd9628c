package io.github.simbo1905.cue;

import io.github.simbo1905.cue.ast.Attribute;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.BinaryExpr;
import io.github.simbo1905.cue.ast.BottomLit;
import io.github.simbo1905.cue.ast.CallExpr;
import io.github.simbo1905.cue.ast.Decl;
import io.github.simbo1905.cue.ast.Ellipsis;
import io.github.simbo1905.cue.ast.EmbedDecl;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.File;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.ImportDecl;
import io.github.simbo1905.cue.ast.IndexExpr;
import io.github.simbo1905.cue.ast.ListLit;
import io.github.simbo1905.cue.ast.Op;
import io.github.simbo1905.cue.ast.Package;
import io.github.simbo1905.cue.ast.Parser;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.SelectorExpr;
import io.github.simbo1905.cue.ast.StructLit;
import io.github.simbo1905.cue.ast.UnaryExpr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// A [Value] evaluated lazily and directly from syntax.
///
/// Identifiers resolve through the lexical struct scopes they appear in. A struct
/// whose only content is one embedded expression (plus definitions or hidden fields)
/// evaluates as that expression; a struct with embeddings and fields evaluates as
/// their conjunction. Structs under a definition, and the argument of `close`, are closed.
/// Sized numeric types such as `int32` expand to `int` with bounds.
public final class AstValue implements Value {

    private static final Logger LOG = Logger.getLogger(AstValue.class.getName());

    private static final int MAX_DEPTH = 64;

    /// Builtin packages usable without an import declaration.
    private static final Set<String> PACKAGES = Set.of("strings", "list", "struct", "math", "time", "net", "regexp");

    private static final Set<String> FUNCTIONS = Set.of("close", "error", "matchN", "matchIf", "and", "or", "len");

    private static final Map<String, Kinds> TYPES = Map.of(
            "string", Kinds.STRING,
            "int", Kinds.INT,
            "float", Kinds.FLOAT,
            "number", Kinds.NUMBER,
            "bool", Kinds.BOOL,
            "bytes", Kinds.BYTES,
            "float32", Kinds.NUMBER,
            "float64", Kinds.NUMBER);

    private static final Map<String, String[]> INT_RANGES = Map.ofEntries(
            Map.entry("int8", new String[]{"-128", "127"}),
            Map.entry("int16", new String[]{"-32768", "32767"}),
            Map.entry("int32", new String[]{"-2147483648", "2147483647"}),
            Map.entry("int64", new String[]{"-9223372036854775808", "9223372036854775807"}),
            Map.entry("uint", new String[]{"0", null}),
            Map.entry("uint8", new String[]{"0", "255"}),
            Map.entry("byte", new String[]{"0", "255"}),
            Map.entry("uint16", new String[]{"0", "65535"}),
            Map.entry("uint32", new String[]{"0", "4294967295"}),
            Map.entry("uint64", new String[]{"0", "18446744073709551615"}),
            Map.entry("rune", new String[]{"0", "1114111"}));

    private static final Map<String, Kinds> BUILTIN_KINDS = Map.ofEntries(
            Map.entry("strings.MinRunes", Kinds.STRING),
            Map.entry("strings.MaxRunes", Kinds.STRING),
            Map.entry("list.MinItems", Kinds.LIST),
            Map.entry("list.MaxItems", Kinds.LIST),
            Map.entry("list.UniqueItems", Kinds.LIST),
            Map.entry("list.MatchN", Kinds.LIST),
            Map.entry("struct.MinFields", Kinds.STRUCT),
            Map.entry("struct.MaxFields", Kinds.STRUCT),
            Map.entry("math.MultipleOf", Kinds.NUMBER),
            Map.entry("time.Time", Kinds.STRING),
            Map.entry("time.Format", Kinds.STRING),
            Map.entry("net.AbsURL", Kinds.STRING),
            Map.entry("net.URL", Kinds.STRING),
            Map.entry("regexp.Valid", Kinds.STRING),
            Map.entry("len", Kinds.INT));

    private record Scope(StructLit struct, Path path, Scope parent) {
        Binding lookup(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                for (Decl d : s.struct.elts()) {
                    if (d instanceof Field f && f.label() instanceof Ident id && id.name().equals(name)) {
                        return new Binding(f, s);
                    }
                }
            }
            return null;
        }
    }

    private record Binding(Field field, Scope scope) {
        Path path() {
            return scope.path().append(Selector.fromLabel(field.label()));
        }
    }

    private static final class Context {
        final Map<String, String> packages = new HashMap<>();
        AstValue root;
    }

    private final Context ctx;
    private final Expr expr;
    private final Scope scope;
    private final Path path;
    private final boolean closed;
    private final boolean remainder;
    private final String error;

    private AstValue(Context ctx, Expr expr, Scope scope, Path path, boolean closed, boolean remainder, String error) {
        this.ctx = ctx;
        this.expr = expr;
        this.scope = scope;
        this.path = path;
        this.closed = closed;
        this.remainder = remainder;
        this.error = error;
    }

    /// Evaluates a file. Package and import clauses and file attributes are not part of the value.
    public static AstValue of(File file) {
        final Context ctx = new Context();
        PACKAGES.forEach(p -> ctx.packages.put(p, p));
        final List<Decl> decls = new ArrayList<>();
        for (Decl d : file.decls()) {
            if (d instanceof ImportDecl i) {
                final String q = Ident.qualifier(i.path());
                if (!q.isEmpty()) {
                    ctx.packages.put(q, i.path());
                }
            } else if (!(d instanceof Package) && !(d instanceof Attribute)) {
                decls.add(d);
            }
        }
        ctx.root = new AstValue(ctx, new StructLit(decls), null, Path.EMPTY, false, false, null);
        return ctx.root;
    }

    /// Evaluates a standalone expression.
    public static AstValue of(Expr expr) {
        final Context ctx = new Context();
        PACKAGES.forEach(p -> ctx.packages.put(p, p));
        ctx.root = new AstValue(ctx, expr, null, Path.EMPTY, false, false, null);
        return ctx.root;
    }

    /// Parses and evaluates a file.
    public static AstValue parse(String source) {
        return of(Parser.parseFile(source));
    }

    private AstValue derive(Expr e, Scope s, Path p, boolean c) {
        return new AstValue(ctx, e, s, p, c, false, null);
    }

    private AstValue bottom(String message) {
        LOG.finer(() -> "Bottom at " + path + ": " + message);
        return new AstValue(ctx, new BottomLit(), scope, path, false, false, message);
    }

    private AstValue at(Binding b) {
        return derive(b.field().value(), b.scope(), b.path(), false);
    }

    private boolean isPackage(String name, Scope s) {
        return ctx.packages.containsKey(name) && (s == null || s.lookup(name) == null);
    }

    private boolean isFunction(Expr fun, String name) {
        return fun instanceof Ident id && id.name().equals(name) && (scope == null || scope.lookup(name) == null);
    }

    // One step of indirection, or null when this value is already in direct form.
    private AstValue step() {
        if (error != null) {
            return null;
        }
        if (expr instanceof Ident id) {
            final String name = id.name();
            if (id.isTop()) {
                return null;
            }
            final Binding b = scope == null ? null : scope.lookup(name);
            if (b != null) {
                return at(b);
            }
            if (TYPES.containsKey(name) || isPackage(name, null)) {
                return null;
            }
            final Expr expansion = intRange(name);
            if (expansion != null) {
                return derive(expansion, null, path, closed);
            }
            return bottom("reference \"" + name + "\" not found");
        }
        if (expr instanceof SelectorExpr sel) {
            if (sel.x() instanceof Ident pkg && isPackage(pkg.name(), scope)) {
                return null;
            }
            final AstValue x = derive(sel.x(), scope, path, closed).eval();
            if (x.error != null) {
                return x;
            }
            final Selector s = Selector.fromLabel(sel.sel());
            final AstValue target = x.findField(s);
            return target != null ? target : bottom("undefined field: " + s);
        }
        if (expr instanceof IndexExpr ix) {
            final AstValue x = derive(ix.x(), scope, path, closed).eval();
            final AstValue index = derive(ix.index(), scope, path, closed).eval();
            if (index.expr instanceof BasicLit lit) {
                if (lit.kind() == BasicLit.Kind.INT && x.expr instanceof ListLit) {
                    final List<Value> elts = x.elements();
                    final int i = Integer.parseInt(lit.value());
                    if (i >= 0 && i < elts.size()) {
                        return (AstValue) elts.get(i);
                    }
                    return bottom("index out of range: " + i);
                }
                if (lit.isString()) {
                    final AstValue target = x.findField(Selector.str(lit.value()));
                    if (target != null) {
                        return target;
                    }
                }
            }
            return bottom("invalid index " + Printer.format(ix.index()));
        }
        if (expr instanceof CallExpr call && call.args().size() == 1 && isFunction(call.fun(), "close")) {
            return derive(call.args().get(0), scope, path, true);
        }
        if (expr instanceof StructLit s && !remainder) {
            final List<Expr> embeds = embeds(s);
            if (embeds.size() == 1 && contentCount(s) == 0) {
                return derive(embeds.get(0), new Scope(s, path, scope), path, closed);
            }
        }
        return null;
    }

    private static Expr intRange(String name) {
        final String[] range = INT_RANGES.get(name);
        if (range == null) {
            return null;
        }
        final List<Expr> parts = new ArrayList<>();
        parts.add(new Ident("int"));
        parts.add(new UnaryExpr(Op.GEQ, BasicLit.number(range[0])));
        if (range[1] != null) {
            parts.add(new UnaryExpr(Op.LEQ, BasicLit.number(range[1])));
        }
        return BinaryExpr.join(Op.AND, parts);
    }

    private static List<Expr> embeds(StructLit s) {
        final List<Expr> out = new ArrayList<>();
        for (Decl d : s.elts()) {
            if (d instanceof EmbedDecl e) {
                out.add(e.expr());
            }
        }
        return out;
    }

    // Declarations other than embeddings, definitions, hidden fields and attributes.
    private static int contentCount(StructLit s) {
        int n = 0;
        for (Decl d : s.elts()) {
            if (d instanceof Ellipsis) {
                n++;
            } else if (d instanceof Field f) {
                final Selector sel = Selector.fromLabel(f.label());
                if (sel == null || sel.isRegular()) {
                    n++;
                }
            }
        }
        return n;
    }

    private boolean isReferenceHop() {
        if (expr instanceof Ident id) {
            return scope != null && scope.lookup(id.name()) != null;
        }
        if (expr instanceof SelectorExpr sel) {
            return !(sel.x() instanceof Ident pkg && isPackage(pkg.name(), scope));
        }
        return expr instanceof IndexExpr;
    }

    AstValue eval() {
        AstValue v = this;
        for (int i = 0; i < MAX_DEPTH; i++) {
            final AstValue next = v.step();
            if (next == null) {
                return v;
            }
            v = next;
        }
        return bottom("structural cycle at " + path);
    }

    private AstValue findField(Selector sel) {
        if (!(expr instanceof StructLit s) || sel == null) {
            return null;
        }
        final Scope inner = new Scope(s, path, scope);
        for (Field f : s.fields()) {
            if (sel.equals(Selector.fromLabel(f.label()))) {
                return derive(f.value(), inner, path.append(sel), false);
            }
        }
        if (!remainder) {
            for (Expr e : embeds(s)) {
                final AstValue found = derive(e, inner, path, closed).eval().findField(sel);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    @Override
    public Kinds kind() {
        return isConcrete() ? incompleteKind() : Kinds.NONE;
    }

    @Override
    public Kinds incompleteKind() {
        return eval().directKind();
    }

    private Kinds directKind() {
        if (error != null) {
            return Kinds.NONE;
        }
        if (expr instanceof Ident id) {
            return TYPES.getOrDefault(id.name(), Kinds.TOP);
        }
        if (expr instanceof BasicLit lit) {
            return switch (lit.kind()) {
                case NULL -> Kinds.NULL;
                case TRUE, FALSE -> Kinds.BOOL;
                case INT -> Kinds.INT;
                case FLOAT -> Kinds.FLOAT;
                case STRING -> Kinds.STRING;
            };
        }
        if (expr instanceof BottomLit) {
            return Kinds.NONE;
        }
        if (expr instanceof ListLit) {
            return Kinds.LIST;
        }
        if (expr instanceof StructLit s) {
            if (remainder || embeds(s).isEmpty()) {
                return Kinds.STRUCT;
            }
            return conjunctionKind(expr().args());
        }
        if (expr instanceof UnaryExpr u) {
            final Kinds x = derive(u.x(), scope, path, closed).incompleteKind();
            return switch (u.op()) {
                case NOT -> Kinds.BOOL;
                case NEQ -> Kinds.TOP;
                case EQL -> x;
                case MAT, NMAT -> Kinds.STRING.union(Kinds.BYTES);
                case LSS, LEQ, GTR, GEQ -> x.intersect(Kinds.NUMBER).isEmpty()
                        ? x : Kinds.NUMBER.union(x.intersect(Kinds.STRING.union(Kinds.BYTES)));
                default -> Kinds.NUMBER;
            };
        }
        if (expr instanceof BinaryExpr b) {
            if (b.op() == Op.AND) {
                return conjunctionKind(expr().args());
            }
            Kinds k = Kinds.NONE;
            for (Value v : expr().args()) {
                k = k.union(v.incompleteKind());
            }
            return k;
        }
        if (expr instanceof CallExpr call) {
            if (isFunction(call.fun(), "error")) {
                return Kinds.NONE;
            }
            final String fn = functionName(call.fun());
            return fn == null ? Kinds.TOP : BUILTIN_KINDS.getOrDefault(fn, Kinds.TOP);
        }
        if (expr instanceof SelectorExpr) {
            final String fn = functionName(expr);
            return fn == null ? Kinds.TOP : BUILTIN_KINDS.getOrDefault(fn, Kinds.TOP);
        }
        return Kinds.TOP;
    }

    private static Kinds conjunctionKind(List<Value> args) {
        Kinds k = Kinds.TOP;
        for (Value v : args) {
            k = k.intersect(v.incompleteKind());
        }
        return k;
    }

    @Override
    public boolean isConcrete() {
        final AstValue d = eval();
        if (d.error != null) {
            return false;
        }
        if (d.expr instanceof BasicLit) {
            return true;
        }
        if (d.expr instanceof ListLit l) {
            if (l.ellipsis() != null) {
                return false;
            }
            for (Value v : d.elements()) {
                if (!v.isConcrete()) {
                    return false;
                }
            }
            return true;
        }
        if (d.expr instanceof StructLit s && (d.remainder || embeds(s).isEmpty())) {
            for (FieldInfo f : d.fields()) {
                if (f.required() || !f.optional() && !f.value().isConcrete()) {
                    return false;
                }
            }
            return true;
        }
        final Expression e = d.expr();
        if (e.op() == Operator.AND && !d.directKind().isEmpty()) {
            for (Value v : e.args()) {
                if (v.isConcrete()) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean isBottom() {
        return incompleteKind().isEmpty();
    }

    @Override
    public Optional<String> errorMessage() {
        final AstValue d = eval();
        if (d.error != null) {
            return Optional.of(d.error);
        }
        if (d.expr instanceof CallExpr call && d.isFunction(call.fun(), "error")) {
            if (!call.args().isEmpty() && call.args().get(0) instanceof BasicLit lit && lit.isString()) {
                return Optional.of(lit.value());
            }
            return Optional.of("error");
        }
        if (d.expr instanceof BottomLit) {
            return Optional.of("explicit error (_|_ literal)");
        }
        if (d.directKind().isEmpty()) {
            return Optional.of("conflicting values at " + d.path);
        }
        return Optional.empty();
    }

    @Override
    public Expression expr() {
        final AstValue d = eval();
        if (d != this) {
            return d.expr();
        }
        if (error != null) {
            return Expression.noOp();
        }
        if (expr instanceof BinaryExpr b && (b.op() == Op.AND || b.op() == Op.OR)) {
            final List<Value> args = new ArrayList<>();
            flatten(b, b.op(), args);
            return new Expression(b.op() == Op.AND ? Operator.AND : Operator.OR, args, null);
        }
        if (expr instanceof BinaryExpr b) {
            return new Expression(Operator.OTHER,
                    List.of(derive(b.x(), scope, path, closed), derive(b.y(), scope, path, closed)), null);
        }
        if (expr instanceof StructLit s && !remainder && !embeds(s).isEmpty()) {
            final Scope inner = new Scope(s, path, scope);
            final List<Value> args = new ArrayList<>();
            for (Expr e : embeds(s)) {
                args.add(derive(e, inner, path, closed));
            }
            if (contentCount(s) > 0) {
                args.add(new AstValue(ctx, s, scope, path, closed, true, null));
            }
            return new Expression(Operator.AND, args, null);
        }
        if (expr instanceof UnaryExpr u) {
            final Operator op = switch (u.op()) {
                case EQL -> Operator.EQUAL;
                case NEQ -> Operator.NOT_EQUAL;
                case LSS -> Operator.LESS_THAN;
                case LEQ -> Operator.LESS_THAN_EQUAL;
                case GTR -> Operator.GREATER_THAN;
                case GEQ -> Operator.GREATER_THAN_EQUAL;
                case MAT -> Operator.REGEX_MATCH;
                case NMAT -> Operator.NOT_REGEX_MATCH;
                case NOT -> Operator.NOT;
                default -> Operator.OTHER;
            };
            return new Expression(op, List.of(derive(u.x(), scope, path, closed)), null);
        }
        if (expr instanceof CallExpr call) {
            final String fn = functionName(call.fun());
            if (fn == null || fn.equals("error")) {
                return fn == null ? new Expression(Operator.OTHER, List.of(), null) : Expression.noOp();
            }
            final List<Value> args = new ArrayList<>();
            for (Expr a : call.args()) {
                args.add(derive(a, scope, path, closed));
            }
            return new Expression(Operator.CALL, args, fn);
        }
        if (expr instanceof SelectorExpr) {
            final String fn = functionName(expr);
            if (fn != null) {
                return new Expression(Operator.CALL, List.of(), fn);
            }
        }
        return Expression.noOp();
    }

    private void flatten(Expr e, Op op, List<Value> out) {
        if (e instanceof BinaryExpr b && b.op() == op) {
            flatten(b.x(), op, out);
            flatten(b.y(), op, out);
        } else {
            out.add(derive(e, scope, path, closed));
        }
    }

    // Qualified name of a builtin function or validator, or null if fun is not one.
    private String functionName(Expr fun) {
        if (fun instanceof Ident id && FUNCTIONS.contains(id.name())
                && (scope == null || scope.lookup(id.name()) == null)) {
            return id.name();
        }
        if (fun instanceof SelectorExpr sel && sel.x() instanceof Ident pkg && isPackage(pkg.name(), scope)) {
            final Selector member = Selector.fromLabel(sel.sel());
            return ctx.packages.get(pkg.name()) + "." + (member == null ? "" : member.unquoted());
        }
        return null;
    }

    @Override
    public Optional<Reference> reference() {
        AstValue v = this;
        for (int i = 0; i < MAX_DEPTH; i++) {
            final AstValue next = v.step();
            if (next == null) {
                return Optional.empty();
            }
            if (v.isReferenceHop()) {
                return next.error != null ? Optional.empty() : Optional.of(new Reference(ctx.root, next.path));
            }
            v = next;
        }
        return Optional.empty();
    }

    @Override
    public Value dereference() {
        AstValue v = this;
        for (int i = 0; i < MAX_DEPTH; i++) {
            final AstValue next = v.step();
            if (next == null) {
                return this;
            }
            if (v.isReferenceHop()) {
                return next;
            }
            v = next;
        }
        return this;
    }

    @Override
    public Optional<Value> lookupPath(Path p) {
        AstValue v = this;
        for (Selector sel : p.selectors()) {
            final AstValue d = v.eval();
            if (sel.type() == Selector.Type.INDEX) {
                final List<Value> elts = d.elements();
                if (sel.index() >= elts.size()) {
                    return Optional.empty();
                }
                v = (AstValue) elts.get(sel.index());
            } else {
                v = d.findField(sel);
                if (v == null) {
                    return Optional.empty();
                }
            }
        }
        return Optional.of(v);
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public List<FieldInfo> fields() {
        final AstValue d = eval();
        if (!(d.expr instanceof StructLit s)) {
            return List.of();
        }
        final Scope inner = new Scope(s, d.path, d.scope);
        final List<FieldInfo> out = new ArrayList<>();
        for (Field f : s.fields()) {
            final Selector sel = Selector.fromLabel(f.label());
            if (sel == null || !sel.isRegular()) {
                continue;
            }
            out.add(new FieldInfo(sel, derive(f.value(), inner, d.path.append(sel), false),
                    f.constraint() == Field.Constraint.OPTIONAL,
                    f.constraint() == Field.Constraint.REQUIRED,
                    f.doc()));
        }
        return out;
    }

    @Override
    public List<PatternConstraint> patterns() {
        final AstValue d = eval();
        if (!(d.expr instanceof StructLit s)) {
            return List.of();
        }
        final Scope inner = new Scope(s, d.path, d.scope);
        final List<PatternConstraint> out = new ArrayList<>();
        for (Field f : s.fields()) {
            if (f.label() instanceof ListLit l && l.elts().size() == 1) {
                out.add(new PatternConstraint(
                        derive(l.elts().get(0), inner, d.path, false),
                        derive(f.value(), inner, d.path, false)));
            }
        }
        return out;
    }

    @Override
    public boolean isClosed() {
        final AstValue d = eval();
        if (!(d.expr instanceof StructLit) || d.isExplicitlyOpen()) {
            return false;
        }
        return closed || d.closed || d.path.hasDefinition();
    }

    @Override
    public boolean isExplicitlyOpen() {
        final AstValue d = eval();
        if (d.expr instanceof StructLit s) {
            for (Decl decl : s.elts()) {
                if (decl instanceof Ellipsis) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public List<Value> elements() {
        final AstValue d = eval();
        if (!(d.expr instanceof ListLit l)) {
            return List.of();
        }
        final List<Value> out = new ArrayList<>();
        for (Expr e : l.elts()) {
            if (!(e instanceof Ellipsis)) {
                out.add(derive(e, d.scope, d.path.append(Selector.index(out.size())), d.closed));
            }
        }
        return out;
    }

    @Override
    public Optional<Value> rest() {
        final AstValue d = eval();
        if (d.expr instanceof ListLit l && l.ellipsis() != null) {
            final Expr type = l.ellipsis().type();
            return Optional.of(derive(type == null ? Ident.top() : type, d.scope, d.path, d.closed));
        }
        return Optional.empty();
    }

    @Override
    public Object decode() {
        final AstValue d = eval();
        if (d.expr instanceof BasicLit lit) {
            return switch (lit.kind()) {
                case NULL -> Null.INSTANCE;
                case TRUE -> Boolean.TRUE;
                case FALSE -> Boolean.FALSE;
                case INT -> new BigInteger(lit.value());
                case FLOAT -> new BigDecimal(lit.value());
                case STRING -> lit.value();
            };
        }
        if (d.expr instanceof ListLit l && l.ellipsis() == null) {
            final List<Object> out = new ArrayList<>();
            for (Value v : d.elements()) {
                out.add(v.decode());
            }
            return out;
        }
        if (d.expr instanceof StructLit s && (d.remainder || embeds(s).isEmpty())) {
            final Map<String, Object> out = new LinkedHashMap<>();
            for (FieldInfo f : d.fields()) {
                if (!f.optional()) {
                    out.put(f.selector().unquoted(), f.value().decode());
                }
            }
            return out;
        }
        final Expression e = d.expr();
        if (e.op() == Operator.AND) {
            for (Value v : e.args()) {
                if (v.isConcrete()) {
                    return v.decode();
                }
            }
        }
        throw new IllegalStateException("value is not concrete: " + Printer.format(d.expr));
    }

    @Override
    public List<String> validate() {
        final List<String> errors = new ArrayList<>();
        check(expr, scope, errors);
        return errors;
    }

    private void check(Expr e, Scope s, List<String> errors) {
        if (e == null) {
            return;
        }
        if (e instanceof Ident id) {
            if (!resolves(id.name(), s)) {
                errors.add("reference \"" + id.name() + "\" not found");
            }
        } else if (e instanceof StructLit st) {
            final Scope inner = new Scope(st, Path.EMPTY, s);
            for (Decl d : st.elts()) {
                if (d instanceof Field f) {
                    if (f.label() instanceof ListLit l) {
                        l.elts().forEach(x -> check(x, inner, errors));
                    }
                    check(f.value(), inner, errors);
                } else if (d instanceof EmbedDecl em) {
                    check(em.expr(), inner, errors);
                } else if (d instanceof Ellipsis el) {
                    check(el.type(), inner, errors);
                }
            }
        } else if (e instanceof ListLit l) {
            l.elts().forEach(x -> check(x, s, errors));
        } else if (e instanceof Ellipsis el) {
            check(el.type(), s, errors);
        } else if (e instanceof UnaryExpr u) {
            check(u.x(), s, errors);
        } else if (e instanceof BinaryExpr b) {
            check(b.x(), s, errors);
            check(b.y(), s, errors);
        } else if (e instanceof CallExpr c) {
            check(c.fun(), s, errors);
            c.args().forEach(x -> check(x, s, errors));
        } else if (e instanceof SelectorExpr sel) {
            if (!(sel.x() instanceof Ident pkg && isPackage(pkg.name(), s))) {
                check(sel.x(), s, errors);
            }
        } else if (e instanceof IndexExpr ix) {
            check(ix.x(), s, errors);
            check(ix.index(), s, errors);
        }
    }

    private boolean resolves(String name, Scope s) {
        return name.equals("_")
                || (s != null && s.lookup(name) != null)
                || TYPES.containsKey(name)
                || INT_RANGES.containsKey(name)
                || FUNCTIONS.contains(name)
                || ctx.packages.containsKey(name);
    }

    @Override
    public Expr syntax() {
        return expr;
    }

    @Override
    public String toString() {
        return Printer.format(expr);
    }
}
