package io.pqfmt.ast;

import java.util.List;

/** Sealed interface for the fixed-arity {@code #name(...)} intrinsic constructors. */
public sealed interface HashConstructorExpr extends ExprKind
    permits HashTableExpr,
        HashDateExpr,
        HashTimeExpr,
        HashDatetimeExpr,
        HashDatetimezoneExpr,
        HashDurationExpr {
  /** Returns the constructor keyword, including the {@code #}. */
  String keyword();

  /** Returns the arguments in source order. */
  List<Expr> arguments();
}
