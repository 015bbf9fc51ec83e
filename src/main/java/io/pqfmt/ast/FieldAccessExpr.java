package io.pqfmt.ast;

/**
 * A field selection {@code target[Name]}; a bare {@code [Name]} selects from {@code _}.
 *
 * @param target the selected-from expression
 * @param field the field name
 * @param optional whether a trailing {@code ?} was written
 */
public record FieldAccessExpr(Expr target, Identifier field, boolean optional)
    implements ExprKind {}
