package io.pqfmt.format;

import io.pqfmt.ast.*;
import java.util.List;

/**
 * Width estimates and shape predicates that drive the formatter's single-line versus expanded
 * decisions.
 *
 * <p>Estimates approximate the single-line width of a node. Constructs that are normally laid out
 * over several lines (let, if, try, function) count as a fixed large width so they never fit.
 */
final class Layout {
  private static final int MULTILINE_ESTIMATE = 200;
  private static final int DEFAULT_ESTIMATE = 50;
  private static final int LONG_ARGUMENT = 30;

  private final FormatConfig config;

  Layout(FormatConfig config) {
    this.config = config;
  }

  int estimate(Expr expr) {
    ExprKind kind = expr.kind();
    if (kind instanceof NullLiteral) {
      return 4;
    }
    if (kind instanceof LogicalLiteral logical) {
      return logical.value() ? 4 : 5;
    }
    if (kind instanceof NumberLiteral number) {
      return Literals.number(number.value()).length();
    }
    if (kind instanceof TextLiteral text) {
      return Literals.text(text.value()).length();
    }
    if (kind instanceof IdentifierExpr id) {
      return id.name().length() + (id.inclusive() ? 1 : 0);
    }
    if (kind instanceof QuotedIdentifierExpr id) {
      return Literals.quoted(id.name()).length() + (id.inclusive() ? 1 : 0);
    }
    if (kind instanceof UnderscoreExpr) {
      return 1;
    }
    if (kind instanceof FieldAccessExpr access) {
      return estimate(access.target()) + name(access.field()) + 2 + (access.optional() ? 1 : 0);
    }
    if (kind instanceof ItemAccessExpr access) {
      return estimate(access.target()) + estimate(access.index()) + 2
          + (access.optional() ? 1 : 0);
    }
    if (kind instanceof FunctionCallExpr call) {
      return estimate(call.function()) + 2 + sequence(call.arguments());
    }
    if (kind instanceof ListExpr list) {
      return 2 + sequence(list.items());
    }
    if (kind instanceof RecordExpr recordExpr) {
      return 2 + fields(recordExpr.fields());
    }
    if (kind instanceof RangeExpr range) {
      return estimate(range.start()) + 2 + estimate(range.end());
    }
    if (kind instanceof BinaryExpr binary) {
      return estimate(binary.left()) + 3 + estimate(binary.right());
    }
    if (kind instanceof UnaryExpr unary) {
      return 1 + estimate(unary.operand());
    }
    if (kind instanceof ParenthesizedExpr paren) {
      return 2 + estimate(paren.inner());
    }
    if (kind instanceof TypeExpr type) {
      return 5 + Types.render(type.type()).length();
    }
    if (kind instanceof EachExpr each) {
      return 5 + estimate(each.body());
    }
    if (kind instanceof ErrorExpr error) {
      return 6 + estimate(error.value());
    }
    if (kind instanceof LetExpr
        || kind instanceof IfExpr
        || kind instanceof TryExpr
        || kind instanceof FunctionExpr) {
      return MULTILINE_ESTIMATE;
    }
    return DEFAULT_ESTIMATE;
  }

  /** Estimates {@code let a = 1, b = 2 in body} on one line. */
  int estimateLet(LetExpr let) {
    int length = 8;
    for (Binding binding : let.bindings()) {
      length += name(binding.name()) + 3 + estimate(binding.value()) + 2;
    }
    return length + estimate(let.body());
  }

  /** Estimates {@code if c then t else e} on one line. */
  int estimateIf(IfExpr ifExpr) {
    return 15
        + estimate(ifExpr.condition())
        + estimate(ifExpr.thenBranch())
        + estimate(ifExpr.elseBranch());
  }

  /** Estimates the comma-separated items of a list or argument list, without delimiters. */
  int sequence(List<Expr> items) {
    int length = 0;
    for (Expr item : items) {
      length += estimate(item);
    }
    return length + Math.max(0, items.size() - 1) * 2;
  }

  /** Estimates {@code A = 1, B = 2} without the brackets. */
  int fields(List<RecordField> fields) {
    int length = 0;
    for (RecordField field : fields) {
      length += name(field.name()) + 3 + estimate(field.value());
    }
    return length + Math.max(0, fields.size() - 1) * 2;
  }

  /** Returns true for leaves and plain selections from leaves. */
  boolean isSimple(Expr expr) {
    ExprKind kind = expr.kind();
    if (kind instanceof FieldAccessExpr access) {
      return isSimple(access.target());
    }
    if (kind instanceof ItemAccessExpr access) {
      return isSimple(access.target()) && isSimple(access.index());
    }
    return kind instanceof NumberLiteral
        || kind instanceof TextLiteral
        || kind instanceof IdentifierExpr
        || kind instanceof QuotedIdentifierExpr
        || kind instanceof NullLiteral
        || kind instanceof LogicalLiteral
        || kind instanceof TypeExpr
        || kind instanceof UnderscoreExpr;
  }

  /** Returns true for nodes that should start on their own line when nested. */
  boolean isComplex(Expr expr) {
    ExprKind kind = expr.kind();
    if (kind instanceof LetExpr
        || kind instanceof IfExpr
        || kind instanceof TryExpr
        || kind instanceof FunctionExpr) {
      return true;
    }
    if (kind instanceof RecordExpr recordExpr) {
      return recordExpr.fields().size() > config.multilineThreshold();
    }
    if (kind instanceof ListExpr list) {
      return list.items().stream().anyMatch(this::isComplex);
    }
    if (kind instanceof FunctionCallExpr call) {
      return call.arguments().size() > config.multilineThreshold()
          || call.arguments().stream()
              .anyMatch(arg -> isComplex(arg) || estimate(arg) > LONG_ARGUMENT);
    }
    return false;
  }

  static int name(Identifier identifier) {
    return Literals.identifier(identifier).length();
  }
}
