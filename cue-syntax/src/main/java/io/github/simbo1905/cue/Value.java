package io.github.simbo1905.cue;

import io.github.simbo1905.cue.ast.Expr;

import java.util.List;
import java.util.Optional;

/// An evaluated view of a configuration value. Values are immutable; navigating
/// into fields, elements or operands returns new values.
public interface Value {

    /// Marker returned by [#decode()] for the null literal.
    enum Null { INSTANCE }

    /// The kind of a concrete value, or [Kinds#NONE] when the value is not concrete.
    Kinds kind();

    /// Every kind this value could still become.
    Kinds incompleteKind();

    boolean isConcrete();

    /// Reports whether the value is `_`, accepting anything.
    default boolean isTop() {
        return incompleteKind().isTop() && expr().op() == Operator.NO_OP;
    }

    /// Reports whether the value can never be satisfied.
    boolean isBottom();

    /// The error message carried by a bottom value.
    Optional<String> errorMessage();

    /// The top-level operation of this value.
    Expression expr();

    /// The field this value refers to, when the value is a reference.
    Optional<Reference> reference();

    /// The value a reference points to, or this value when it is not a reference.
    Value dereference();

    Optional<Value> lookupPath(Path path);

    /// The path of this value from its root.
    Path path();

    List<FieldInfo> fields();

    List<PatternConstraint> patterns();

    /// Reports whether a struct rejects fields it does not declare.
    boolean isClosed();

    /// Reports whether a struct is explicitly opened with `...`.
    boolean isExplicitlyOpen();

    /// The fixed elements of a list.
    List<Value> elements();

    /// The type of the remaining elements of an open list.
    Optional<Value> rest();

    /// Converts a concrete value to Java objects: [String], [java.math.BigInteger],
    /// [java.math.BigDecimal], [Boolean], [Null], [List] or [java.util.Map].
    /// @throws IllegalStateException if the value is not concrete
    Object decode();

    /// Reports problems that make the value unusable, such as unresolved references.
    List<String> validate();

    /// The syntax this value was built from.
    Expr syntax();
}
