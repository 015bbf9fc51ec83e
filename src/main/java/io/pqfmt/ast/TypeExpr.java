package io.pqfmt.ast;

/**
 * A type value: {@code type T}, or the type operand of {@code is} and {@code as}.
 *
 * @param type the type
 */
public record TypeExpr(TypeAnnotation type) implements ExprKind {}
