package io.pqfmt.format;

import io.pqfmt.ast.*;
import java.util.List;

/**
 * Renders a {@link Document} as canonical Power Query M text.
 *
 * <p>The formatter makes a single pass over the tree, choosing for each let, if, record, list and
 * call between a single-line and an expanded layout from width estimates and the {@link
 * FormatConfig}. Output always ends with a newline.
 */
public final class Formatter {
  private final FormatConfig config;
  private final Layout layout;
  private final StringBuilder out = new StringBuilder();
  private int indentLevel;
  private int column;

  private Formatter(FormatConfig config) {
    this.config = config;
    this.layout = new Layout(config);
  }

  /**
   * Formats a parsed document.
   *
   * @param document the document to format
   * @param config the layout options
   * @return the formatted text, ending with a newline
   */
  public static String format(Document document, FormatConfig config) {
    return new Formatter(config).render(document);
  }

  private String render(Document document) {
    formatExpr(document.expression());
    if (out.length() == 0 || out.charAt(out.length() - 1) != '\n') {
      out.append('\n');
    }
    return out.toString();
  }

  private void formatExpr(Expr expr) {
    writeLeadingComments(expr.leadingTrivia());
    formatKind(expr.kind());
    writeTrailingComments(expr.trailingTrivia());
  }

  private void formatKind(ExprKind kind) {
    if (kind instanceof NullLiteral) {
      write("null");
    } else if (kind instanceof LogicalLiteral logical) {
      write(logical.value() ? "true" : "false");
    } else if (kind instanceof NumberLiteral number) {
      write(Literals.number(number.value()));
    } else if (kind instanceof TextLiteral text) {
      write(Literals.text(text.value()));
    } else if (kind instanceof IdentifierExpr id) {
      write((id.inclusive() ? "@" : "") + id.name());
    } else if (kind instanceof QuotedIdentifierExpr id) {
      write((id.inclusive() ? "@" : "") + Literals.quoted(id.name()));
    } else if (kind instanceof UnderscoreExpr) {
      write("_");
    } else if (kind instanceof LetExpr let) {
      formatLet(let);
    } else if (kind instanceof IfExpr ifExpr) {
      formatIf(ifExpr);
    } else if (kind instanceof TryExpr tryExpr) {
      write("try ");
      formatExpr(tryExpr.body());
      if (tryExpr.otherwise() != null) {
        write(" otherwise ");
        formatExpr(tryExpr.otherwise());
      }
    } else if (kind instanceof ErrorExpr error) {
      write("error ");
      formatExpr(error.value());
    } else if (kind instanceof EachExpr each) {
      write("each ");
      formatExpr(each.body());
    } else if (kind instanceof FunctionExpr function) {
      formatFunction(function);
    } else if (kind instanceof FunctionCallExpr call) {
      formatCall(call);
    } else if (kind instanceof RecordExpr recordExpr) {
      formatRecord(recordExpr);
    } else if (kind instanceof ListExpr list) {
      formatList(list);
    } else if (kind instanceof RangeExpr range) {
      formatExpr(range.start());
      write("..");
      formatExpr(range.end());
    } else if (kind instanceof FieldAccessExpr access) {
      formatExpr(access.target());
      write("[" + Literals.identifier(access.field()) + "]");
      writeOptionalMarker(access.optional());
    } else if (kind instanceof FieldProjectionExpr projection) {
      formatExpr(projection.target());
      write("[");
      List<Identifier> fields = projection.fields();
      for (int i = 0; i < fields.size(); i++) {
        write(i > 0 ? ", [" : "[");
        write(Literals.identifier(fields.get(i)) + "]");
      }
      write("]");
      writeOptionalMarker(projection.optional());
    } else if (kind instanceof ItemAccessExpr access) {
      formatExpr(access.target());
      write("{");
      formatExpr(access.index());
      write("}");
      writeOptionalMarker(access.optional());
    } else if (kind instanceof BinaryExpr binary) {
      formatBinary(binary);
    } else if (kind instanceof MetadataExpr metadata) {
      int precedence = BinaryOp.META.precedence();
      formatOperand(metadata.value(), precedence, false);
      write(" meta ");
      formatOperand(metadata.metadata(), precedence, true);
    } else if (kind instanceof UnaryExpr unary) {
      write(unary.operator().prefix());
      formatOperand(unary.operand(), Integer.MAX_VALUE, false);
    } else if (kind instanceof ParenthesizedExpr paren) {
      String pad = config.spaceInParens() ? " " : "";
      write("(" + pad);
      formatExpr(paren.inner());
      write(pad + ")");
    } else if (kind instanceof TypeExpr type) {
      write("type " + Types.render(type.type()));
    } else if (kind instanceof HashConstructorExpr constructor) {
      write(constructor.keyword() + "(");
      List<Expr> args = constructor.arguments();
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          write(", ");
        }
        formatExpr(args.get(i));
      }
      write(")");
    }
  }

  // Let

  private void formatLet(LetExpr let) {
    boolean singleLine =
        !config.alwaysExpandLet()
            && column + layout.estimateLet(let) <= config.maxLineLength()
            && !hasComplexBinding(let)
            && !hasComments(let);
    if (!singleLine) {
      formatLetExpanded(let);
      return;
    }

    write("let ");
    List<Binding> bindings = let.bindings();
    for (int i = 0; i < bindings.size(); i++) {
      if (i > 0) {
        write(", ");
      }
      write(Literals.identifier(bindings.get(i).name()) + " = ");
      formatExpr(bindings.get(i).value());
    }
    write(" in ");
    formatExpr(let.body());
  }

  private void formatLetExpanded(LetExpr let) {
    write("let");
    newline();
    indentLevel++;

    List<Binding> bindings = let.bindings();
    int width =
        config.alignEquals() ? nameWidth(bindings.stream().map(Binding::name).toList()) : 0;
    for (int i = 0; i < bindings.size(); i++) {
      Binding binding = bindings.get(i);
      writeCommentLines(binding.leadingTrivia());
      writeIndent();
      writeName(binding.name(), width);
      writeAssignedValue(binding.value());
      if (i < bindings.size() - 1) {
        write(",");
      }
      writeSameLineComments(binding.trailingTrivia(), " ");
      newline();
    }

    indentLevel--;
    writeIndent();
    write("in");
    newline();
    indentLevel++;
    writeIndent();
    formatExpr(let.body());
    indentLevel--;
  }

  private boolean hasComplexBinding(LetExpr let) {
    return let.bindings().stream().anyMatch(binding -> layout.isComplex(binding.value()));
  }

  private static boolean hasComments(LetExpr let) {
    return let.bindings().stream().anyMatch(Binding::hasComments)
        || !let.body().leadingTrivia().isEmpty();
  }

  // If

  private void formatIf(IfExpr ifExpr) {
    boolean singleLine =
        column + layout.estimateIf(ifExpr) <= config.maxLineLength()
            && !layout.isComplex(ifExpr.condition())
            && !layout.isComplex(ifExpr.thenBranch())
            && !layout.isComplex(ifExpr.elseBranch());

    write("if ");
    formatExpr(ifExpr.condition());
    if (singleLine) {
      write(" then ");
      formatExpr(ifExpr.thenBranch());
      write(" else ");
      formatExpr(ifExpr.elseBranch());
      return;
    }

    write(" then");
    newline();
    writeIndented(ifExpr.thenBranch());
    newline();
    writeIndent();

    Expr elseBranch = ifExpr.elseBranch();
    if (elseBranch.kind() instanceof IfExpr && !elseBranch.hasComments()) {
      write("else ");
      formatExpr(elseBranch);
    } else {
      write("else");
      newline();
      writeIndented(elseBranch);
    }
  }

  // Function

  private void formatFunction(FunctionExpr function) {
    write(Types.renderParameters(function.parameters()));
    if (function.returnType() != null) {
      write(" as " + Types.render(function.returnType()));
    }
    write(" =>");

    Expr body = function.body();
    if (body.kind() instanceof LetExpr let) {
      boolean inline =
          !config.alwaysExpandLet()
              && !hasComments(let)
              && !hasComplexBinding(let)
              && column + 1 + layout.estimateLet(let) <= config.maxLineLength();
      if (inline) {
        write(" ");
        formatExpr(body);
      } else if (indentLevel == 0) {
        newline();
        formatExpr(body);
      } else {
        newline();
        writeIndented(body);
      }
    } else if (layout.isComplex(body)) {
      newline();
      writeIndented(body);
    } else {
      write(" ");
      formatExpr(body);
    }
  }

  // Calls, records and lists

  private void formatCall(FunctionCallExpr call) {
    formatExpr(call.function());
    write("(");
    List<Expr> args = call.arguments();
    boolean multiline =
        !args.isEmpty()
            && (args.stream().anyMatch(layout::isComplex)
                || (!args.stream().allMatch(layout::isSimple)
                    && args.size() > config.multilineThreshold())
                || column + layout.sequence(args) + 1 > config.maxLineLength());
    if (multiline) {
      writeExpandedItems(args);
    } else {
      writeInlineItems(args);
    }
    write(")");
  }

  private void formatRecord(RecordExpr recordExpr) {
    List<RecordField> fields = recordExpr.fields();
    if (fields.isEmpty()) {
      write("[]");
      return;
    }

    boolean multiline =
        config.alwaysExpandRecords()
            || fields.size() > config.multilineThreshold()
            || fields.stream().anyMatch(field -> layout.isComplex(field.value()))
            || fields.stream().anyMatch(RecordField::hasComments)
            || column + layout.fields(fields) + 2 > config.maxLineLength();

    if (!multiline) {
      String pad = config.spaceInBrackets() ? " " : "";
      write("[" + pad);
      for (int i = 0; i < fields.size(); i++) {
        if (i > 0) {
          write(", ");
        }
        write(Literals.identifier(fields.get(i).name()) + " = ");
        formatExpr(fields.get(i).value());
      }
      write(pad + "]");
      return;
    }

    write("[");
    newline();
    indentLevel++;
    int width =
        config.alignEquals() ? nameWidth(fields.stream().map(RecordField::name).toList()) : 0;
    for (int i = 0; i < fields.size(); i++) {
      RecordField field = fields.get(i);
      writeCommentLines(field.leadingTrivia());
      writeIndent();
      writeName(field.name(), width);
      writeAssignedValue(field.value());
      if (i < fields.size() - 1 || config.trailingComma()) {
        write(",");
      }
      writeSameLineComments(field.trailingTrivia(), "  ");
      newline();
    }
    indentLevel--;
    writeIndent();
    write("]");
  }

  private void formatList(ListExpr list) {
    List<Expr> items = list.items();
    if (items.isEmpty()) {
      write("{}");
      return;
    }

    boolean multiline =
        config.alwaysExpandLists()
            || items.stream().anyMatch(layout::isComplex)
            || (!items.stream().allMatch(layout::isSimple)
                && items.size() > config.multilineThreshold())
            || column + layout.sequence(items) + 2 > config.maxLineLength();

    write("{");
    if (multiline) {
      writeExpandedItems(items);
    } else {
      String pad = config.spaceInBraces() ? " " : "";
      write(pad);
      writeInlineItems(items);
      write(pad);
    }
    write("}");
  }

  private void writeInlineItems(List<Expr> items) {
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        write(", ");
      }
      formatExpr(items.get(i));
    }
  }

  /** Writes one item per line, leaving the cursor on the closing delimiter's line. */
  private void writeExpandedItems(List<Expr> items) {
    newline();
    indentLevel++;
    for (int i = 0; i < items.size(); i++) {
      writeIndent();
      formatExpr(items.get(i));
      if (i < items.size() - 1 || config.trailingComma()) {
        write(",");
      }
      newline();
    }
    indentLevel--;
    writeIndent();
  }

  /** Writes {@code = value} after a binding or field name, moving long values to the next line. */
  private void writeAssignedValue(Expr value) {
    boolean continuation =
        !(value.kind() instanceof FunctionExpr)
            && (layout.isComplex(value)
                || column + 3 + layout.estimate(value) > config.maxLineLength());
    if (continuation) {
      write(" =");
      newline();
      writeIndented(value);
    } else {
      write(" = ");
      formatExpr(value);
    }
  }

  // Operators

  private void formatBinary(BinaryExpr binary) {
    BinaryOp op = binary.operator();
    formatOperand(binary.left(), op.precedence(), false);
    write(" " + op.symbol() + " ");
    if ((op == BinaryOp.IS || op == BinaryOp.AS)
        && binary.right().kind() instanceof TypeExpr type) {
      write(Types.render(type.type()));
    } else {
      formatOperand(binary.right(), op.precedence(), true);
    }
  }

  /**
   * Writes an operand, adding parentheses when the tree shape would not survive re-parsing:
   * looser children on either side, and equal precedence on the right.
   */
  private void formatOperand(Expr operand, int parentPrecedence, boolean right) {
    int precedence = precedenceOf(operand);
    boolean parens =
        precedence > 0
            && (precedence < parentPrecedence || (right && precedence == parentPrecedence));
    if (parens) {
      write("(");
    }
    formatExpr(operand);
    if (parens) {
      write(")");
    }
  }

  private static int precedenceOf(Expr expr) {
    if (expr.kind() instanceof BinaryExpr binary) {
      return binary.operator().precedence();
    }
    if (expr.kind() instanceof MetadataExpr) {
      return BinaryOp.META.precedence();
    }
    return 0;
  }

  // Comments

  private void writeLeadingComments(List<Trivia> comments) {
    for (Trivia comment : comments) {
      write(comment.render());
      if (comment.isLineComment()) {
        newline();
        writeIndent();
      } else {
        write(" ");
      }
    }
  }

  private void writeTrailingComments(List<Trivia> comments) {
    for (Trivia comment : comments) {
      if (column > 0 && out.charAt(out.length() - 1) != ' ') {
        write(" ");
      }
      write(comment.render());
      if (comment.isLineComment()) {
        newline();
        writeIndent();
      }
    }
  }

  /** Writes each comment on its own indented line. */
  private void writeCommentLines(List<Trivia> comments) {
    for (Trivia comment : comments) {
      writeIndent();
      write(comment.render());
      newline();
    }
  }

  private void writeSameLineComments(List<Trivia> comments, String lineCommentGap) {
    for (Trivia comment : comments) {
      write(comment.isLineComment() ? lineCommentGap : " ");
      write(comment.render());
    }
  }

  // Output primitives

  private void writeName(Identifier name, int width) {
    String text = Literals.identifier(name);
    write(text);
    if (width > text.length()) {
      write(" ".repeat(width - text.length()));
    }
  }

  private static int nameWidth(List<Identifier> names) {
    return names.stream().mapToInt(Layout::name).max().orElse(0);
  }

  private void writeOptionalMarker(boolean optional) {
    if (optional) {
      write("?");
    }
  }

  /** Writes an expression on the current line, one level deeper. */
  private void writeIndented(Expr expr) {
    indentLevel++;
    writeIndent();
    formatExpr(expr);
    indentLevel--;
  }

  private void write(String text) {
    out.append(text);
    column += text.length();
  }

  private void newline() {
    out.append('\n');
    column = 0;
  }

  private void writeIndent() {
    String indent = config.indentAt(indentLevel);
    out.append(indent);
    column = indent.length();
  }
}
