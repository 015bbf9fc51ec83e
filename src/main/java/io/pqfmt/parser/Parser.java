package io.pqfmt.parser;

import io.pqfmt.PqfmtException;
import io.pqfmt.Span;
import io.pqfmt.ast.*;
import io.pqfmt.lexer.Lexer;
import io.pqfmt.lexer.Token;
import io.pqfmt.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses Power Query M source into a {@link Document}.
 *
 * <p>Binary operators are parsed by precedence climbing. Two constructs need lookahead: {@code (}
 * starts either a function literal or a parenthesized expression, and {@code [} starts either a
 * record literal or an implicit field selection. Both are resolved by scanning ahead and restoring
 * the position.
 *
 * <p>Comments are kept where they can be re-emitted: before and after the document expression,
 * around let bindings and record fields, and between {@code in} and the let body. Comments
 * anywhere else are dropped.
 */
public final class Parser {
  /** Deepest expression nesting accepted before parsing is abandoned. */
  public static final int MAX_NESTING_DEPTH = 256;

  /** Maximum number of operators in one flat left-associative chain. */
  public static final int MAX_CHAIN_LENGTH = 2048;

  private final String input;
  private final List<Token> tokens;
  private int pos;
  private int depth;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
    this.depth = 0;
  }

  /**
   * Parses a Power Query M document.
   *
   * @param input the source text
   * @return the parsed document
   * @throws PqfmtException if the input is not a single well-formed expression
   */
  public static Document parse(String input) throws PqfmtException {
    Objects.requireNonNull(input, "input");
    return new Parser(input, Lexer.tokenize(input)).parseDocument();
  }

  private Document parseDocument() throws PqfmtException {
    Span start = current().span();
    List<Trivia> leading = collectComments();
    Expr expression = parseExpression();
    List<Trivia> trailing = collectComments();
    if (!isAtEnd()) {
      throw unexpected("Unexpected token after expression: " + current().describe());
    }

    List<Trivia> allLeading = new ArrayList<>(leading);
    allLeading.addAll(expression.leadingTrivia());
    expression = expression.withLeadingTrivia(allLeading).withTrailingTrivia(trailing);
    return new Document(expression, start.merge(current().span()));
  }

  // Expressions

  private Expr parseExpression() throws PqfmtException {
    return parseBinaryExpression(0);
  }

  private Expr parseBinaryExpression(int minPrecedence) throws PqfmtException {
    Expr left = parseUnaryExpression();
    int chain = 0;

    while (true) {
      int saved = pos;
      skipTrivia();
      BinaryOp op = BinaryOp.fromToken(current().kind());
      if (op == null || op.precedence() < minPrecedence) {
        pos = saved;
        return left;
      }
      if (++chain > MAX_CHAIN_LENGTH) {
        throw PqfmtException.limit(
            "Maximum operator chain length of " + MAX_CHAIN_LENGTH + " exceeded",
            current().span(),
            input);
      }
      advance();
      skipTrivia();

      Expr right =
          op == BinaryOp.IS || op == BinaryOp.AS
              ? parseTypeOperand(op)
              : parseBinaryExpression(op.precedence() + 1);
      Span span = left.span().merge(right.span());
      ExprKind kind =
          op == BinaryOp.META ? new MetadataExpr(left, right) : new BinaryExpr(left, op, right);
      left = Expr.of(kind, span);
    }
  }

  /**
   * Parses the right side of {@code is} / {@code as}. A type there may be written with or without
   * the {@code type} keyword; {@code type} alone names the primitive type.
   */
  private Expr parseTypeOperand(BinaryOp op) throws PqfmtException {
    Token tok = current();
    if (tok.kind() == TokenKind.TYPE && startsType(peekAfterCurrent())) {
      advance();
      skipTrivia();
    } else if (!startsType(tok.kind())) {
      return parseBinaryExpression(op.precedence() + 1);
    }
    TypeAnnotation type = parseTypeAnnotation();
    return Expr.of(new TypeExpr(type), tok.span().merge(type.span()));
  }

  private static boolean startsType(TokenKind kind) {
    return kind == TokenKind.IDENTIFIER
        || kind == TokenKind.NULL
        || kind == TokenKind.TYPE
        || kind == TokenKind.LEFT_BRACKET
        || kind == TokenKind.LEFT_BRACE;
  }

  private Expr parseUnaryExpression() throws PqfmtException {
    enter();
    try {
      skipTrivia();
      Token tok = current();
      UnaryOp op =
          switch (tok.kind()) {
            case NOT -> UnaryOp.NOT;
            case MINUS -> UnaryOp.NEGATE;
            case PLUS -> UnaryOp.PLUS;
            default -> null;
          };
      if (op == null) {
        return parsePostfixExpression();
      }
      advance();
      skipTrivia();
      Expr operand = parseUnaryExpression();
      return Expr.of(new UnaryExpr(op, operand), tok.span().merge(operand.span()));
    } finally {
      depth--;
    }
  }

  private Expr parsePostfixExpression() throws PqfmtException {
    Expr expr = parsePrimaryExpression();

    while (true) {
      int saved = pos;
      skipTrivia();
      switch (current().kind()) {
        case LEFT_BRACKET -> expr = parseFieldSuffix(expr);
        case LEFT_BRACE -> {
          advance();
          skipTrivia();
          Expr index = parseExpression();
          skipTrivia();
          Token close = expect(TokenKind.RIGHT_BRACE);
          boolean optional = consumeOptionalMarker();
          expr =
              Expr.of(
                  new ItemAccessExpr(expr, index, optional), expr.span().merge(endSpan(close)));
        }
        case LEFT_PAREN -> {
          advance();
          List<Expr> arguments = parseArgumentList();
          Token close = expect(TokenKind.RIGHT_PAREN);
          expr = Expr.of(new FunctionCallExpr(expr, arguments), expr.span().merge(close.span()));
        }
        default -> {
          pos = saved;
          return expr;
        }
      }
    }
  }

  /** Parses {@code [Name]} or {@code [[A], [B]]} after an expression. */
  private Expr parseFieldSuffix(Expr target) throws PqfmtException {
    advance(); // [
    skipTrivia();
    if (check(TokenKind.LEFT_BRACKET)) {
      List<Identifier> fields = parseProjectionFields();
      skipTrivia();
      Token close = expect(TokenKind.RIGHT_BRACKET);
      boolean optional = consumeOptionalMarker();
      return Expr.of(
          new FieldProjectionExpr(target, fields, optional), target.span().merge(endSpan(close)));
    }

    Identifier field = parseGeneralizedIdentifier();
    skipTrivia();
    Token close = expect(TokenKind.RIGHT_BRACKET);
    boolean optional = consumeOptionalMarker();
    return Expr.of(
        new FieldAccessExpr(target, field, optional), target.span().merge(endSpan(close)));
  }

  private List<Identifier> parseProjectionFields() throws PqfmtException {
    List<Identifier> fields = new ArrayList<>();
    while (true) {
      expect(TokenKind.LEFT_BRACKET);
      skipTrivia();
      fields.add(parseGeneralizedIdentifier());
      skipTrivia();
      expect(TokenKind.RIGHT_BRACKET);
      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        return fields;
      }
      advance();
      skipTrivia();
    }
  }

  private Expr parsePrimaryExpression() throws PqfmtException {
    skipTrivia();
    Token tok = current();
    Span span = tok.span();

    return switch (tok.kind()) {
      case NULL -> literal(new NullLiteral(), span);
      case TRUE -> literal(new LogicalLiteral(true), span);
      case FALSE -> literal(new LogicalLiteral(false), span);
      case NUMBER -> literal(new NumberLiteral(tok.number()), span);
      case HASH_INFINITY -> literal(new NumberLiteral(Double.POSITIVE_INFINITY), span);
      case HASH_NAN -> literal(new NumberLiteral(Double.NaN), span);
      case TEXT -> literal(new TextLiteral(tok.text()), span);
      case IDENTIFIER ->
          literal(
              "_".equals(tok.text()) ? new UnderscoreExpr() : new IdentifierExpr(tok.text(), false),
              span);
      case QUOTED_IDENTIFIER -> literal(new QuotedIdentifierExpr(tok.text(), false), span);
      case HASH_BINARY, HASH_SECTIONS, HASH_SHARED ->
          literal(new IdentifierExpr(tok.text(), false), span);
      case AT -> parseInclusiveIdentifier();
      case LET -> parseLetExpression();
      case IF -> parseIfExpression();
      case TRY -> parseTryExpression();
      case ERROR -> {
        advance();
        skipTrivia();
        Expr value = parseExpression();
        yield Expr.of(new ErrorExpr(value), span.merge(value.span()));
      }
      case EACH -> {
        advance();
        skipTrivia();
        Expr body = parseExpression();
        yield Expr.of(new EachExpr(body), span.merge(body.span()));
      }
      case LEFT_PAREN -> parseParenthesizedOrFunction();
      case LEFT_BRACKET -> parseRecordOrFieldSelection();
      case LEFT_BRACE -> parseListExpression();
      case TYPE -> {
        advance();
        skipTrivia();
        TypeAnnotation type = parseTypeAnnotation();
        yield Expr.of(new TypeExpr(type), span.merge(type.span()));
      }
      case HASH_TABLE, HASH_DATE, HASH_TIME, HASH_DATETIME, HASH_DATETIMEZONE, HASH_DURATION ->
          parseHashConstructor();
      case EOF -> throw unexpected("Unexpected end of input");
      default -> throw unexpected("Unexpected token: " + tok.describe());
    };
  }

  private Expr literal(ExprKind kind, Span span) {
    advance();
    return Expr.of(kind, span);
  }

  private Expr parseInclusiveIdentifier() throws PqfmtException {
    Token at = advance();
    skipTrivia();
    Identifier name = parseIdentifier();
    ExprKind kind =
        name.quoted()
            ? new QuotedIdentifierExpr(name.name(), true)
            : new IdentifierExpr(name.name(), true);
    return Expr.of(kind, at.span().merge(name.span()));
  }

  private Expr parseLetExpression() throws PqfmtException {
    Token let = advance();
    skipWhitespace();

    List<Binding> bindings = new ArrayList<>();
    while (true) {
      List<Trivia> leading = collectComments();
      if (check(TokenKind.IN)) {
        if (!bindings.isEmpty() && !leading.isEmpty()) {
          Binding last = bindings.remove(bindings.size() - 1);
          bindings.add(last.withTrailingTrivia(concat(last.trailingTrivia(), leading)));
        }
        break;
      }

      Binding binding = parseBinding().withLeadingTrivia(leading);
      List<Trivia> trailing = new ArrayList<>(collectComments());
      if (!check(TokenKind.COMMA)) {
        bindings.add(binding.withTrailingTrivia(trailing));
        break;
      }
      advance();
      trailing.addAll(collectSameLineComments());
      bindings.add(binding.withTrailingTrivia(trailing));
      skipWhitespace();
    }

    skipTrivia();
    expect(TokenKind.IN);
    List<Trivia> bodyComments = collectComments();
    Expr body = parseExpression().withLeadingTrivia(bodyComments);
    return Expr.of(new LetExpr(bindings, body), let.span().merge(body.span()));
  }

  private Binding parseBinding() throws PqfmtException {
    Identifier name = parseIdentifier();
    skipTrivia();
    expect(TokenKind.EQUAL);
    skipTrivia();
    Expr value = parseExpression();
    return new Binding(name, value, name.span().merge(value.span()), List.of(), List.of());
  }

  private Expr parseIfExpression() throws PqfmtException {
    Token start = advance();
    skipTrivia();
    Expr condition = parseExpression();
    skipTrivia();
    expect(TokenKind.THEN);
    skipTrivia();
    Expr thenBranch = parseExpression();
    skipTrivia();
    expect(TokenKind.ELSE);
    skipTrivia();
    Expr elseBranch = parseExpression();
    return Expr.of(
        new IfExpr(condition, thenBranch, elseBranch), start.span().merge(elseBranch.span()));
  }

  private Expr parseTryExpression() throws PqfmtException {
    Token start = advance();
    skipTrivia();
    Expr body = parseExpression();
    if (peekPastTrivia() != TokenKind.OTHERWISE) {
      return Expr.of(new TryExpr(body, null), start.span().merge(body.span()));
    }
    skipTrivia();
    advance();
    skipTrivia();
    Expr otherwise = parseExpression();
    return Expr.of(new TryExpr(body, otherwise), start.span().merge(otherwise.span()));
  }

  private Expr parseParenthesizedOrFunction() throws PqfmtException {
    Token open = advance();
    skipTrivia();

    int saved = pos;
    boolean function = isFunctionDefinition();
    pos = saved;
    if (function) {
      return parseFunctionExpression(open);
    }

    Expr inner = parseExpression();
    skipTrivia();
    Token close = expect(TokenKind.RIGHT_PAREN);
    return Expr.of(new ParenthesizedExpr(inner), open.span().merge(close.span()));
  }

  /** Scans past the matching {@code )} and checks for {@code =>} or {@code as T =>}. */
  private boolean isFunctionDefinition() {
    int parens = 1;
    while (parens > 0) {
      switch (current().kind()) {
        case LEFT_PAREN -> parens++;
        case RIGHT_PAREN -> parens--;
        case EOF -> {
          return false;
        }
        default -> {
          // other tokens do not affect nesting
        }
      }
      advance();
    }

    skipTrivia();
    if (check(TokenKind.FAT_ARROW)) {
      return true;
    }
    if (!check(TokenKind.AS)) {
      return false;
    }
    advance();
    skipTrivia();
    skipTypeForLookahead();
    skipTrivia();
    return check(TokenKind.FAT_ARROW);
  }

  private void skipTypeForLookahead() {
    while (current().kind() == TokenKind.IDENTIFIER && "nullable".equals(current().text())) {
      advance();
      skipTrivia();
    }
    TokenKind kind = current().kind();
    if (kind == TokenKind.IDENTIFIER || kind == TokenKind.NULL || kind == TokenKind.TYPE) {
      advance();
    } else if (kind == TokenKind.LEFT_BRACE || kind == TokenKind.LEFT_BRACKET) {
      TokenKind close =
          kind == TokenKind.LEFT_BRACE ? TokenKind.RIGHT_BRACE : TokenKind.RIGHT_BRACKET;
      int nesting = 0;
      while (!isAtEnd()) {
        TokenKind k = advance().kind();
        if (k == kind) {
          nesting++;
        } else if (k == close && --nesting == 0) {
          return;
        }
      }
    }
  }

  private Expr parseFunctionExpression(Token open) throws PqfmtException {
    List<Parameter> parameters = parseParameterList();
    skipTrivia();
    expect(TokenKind.RIGHT_PAREN);

    TypeAnnotation returnType = null;
    if (peekPastTrivia() == TokenKind.AS) {
      skipTrivia();
      advance();
      skipTrivia();
      returnType = parseTypeAnnotation();
    }
    skipTrivia();
    expect(TokenKind.FAT_ARROW);
    skipTrivia();
    Expr body = parseExpression();
    return Expr.of(
        new FunctionExpr(parameters, returnType, body), open.span().merge(body.span()));
  }

  private List<Parameter> parseParameterList() throws PqfmtException {
    List<Parameter> parameters = new ArrayList<>();
    skipTrivia();
    while (!check(TokenKind.RIGHT_PAREN) && !isAtEnd()) {
      parameters.add(parseParameter());
      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        break;
      }
      advance();
      skipTrivia();
    }
    return parameters;
  }

  private Parameter parseParameter() throws PqfmtException {
    Span start = current().span();
    boolean optional = consumeOptionalModifier();
    Identifier name = parseIdentifier();

    TypeAnnotation type = null;
    if (peekPastTrivia() == TokenKind.AS) {
      skipTrivia();
      advance();
      skipTrivia();
      type = parseTypeAnnotation();
    }
    Span end = type != null ? type.span() : name.span();
    return new Parameter(name, type, optional, start.merge(end));
  }

  /** Consumes {@code optional} when it modifies a following name rather than being the name. */
  private boolean consumeOptionalModifier() {
    if (current().kind() != TokenKind.IDENTIFIER || !"optional".equals(current().text())) {
      return false;
    }
    int saved = pos;
    advance();
    skipTrivia();
    if (isWord(current()) || check(TokenKind.QUOTED_IDENTIFIER)) {
      return true;
    }
    pos = saved;
    return false;
  }

  private Expr parseRecordOrFieldSelection() throws PqfmtException {
    Token open = advance();
    skipWhitespace();

    if (peekPastTrivia() == TokenKind.RIGHT_BRACKET) {
      skipTrivia();
      Token close = advance();
      return Expr.of(new RecordExpr(List.of()), open.span().merge(close.span()));
    }
    if (isRecordLiteral()) {
      return parseRecordFields(open);
    }

    skipTrivia();
    Expr underscore = Expr.of(new UnderscoreExpr(), open.span());
    if (check(TokenKind.LEFT_BRACKET)) {
      List<Identifier> fields = parseProjectionFields();
      skipTrivia();
      Token close = expect(TokenKind.RIGHT_BRACKET);
      boolean optional = consumeOptionalMarker();
      return Expr.of(
          new FieldProjectionExpr(underscore, fields, optional),
          open.span().merge(endSpan(close)));
    }

    List<Identifier> names = new ArrayList<>();
    while (true) {
      names.add(parseGeneralizedIdentifier());
      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        break;
      }
      advance();
      skipTrivia();
    }
    Token close = expect(TokenKind.RIGHT_BRACKET);

    if (names.size() == 1) {
      boolean optional = consumeOptionalMarker();
      return Expr.of(
          new FieldAccessExpr(underscore, names.get(0), optional),
          open.span().merge(endSpan(close)));
    }

    // [A, B] selects several fields of _ into a new record
    List<RecordField> fields = new ArrayList<>();
    for (Identifier name : names) {
      Expr value =
          Expr.of(
              new FieldAccessExpr(Expr.of(new UnderscoreExpr(), name.span()), name, false),
              name.span());
      fields.add(new RecordField(name, value, name.span(), List.of(), List.of()));
    }
    return Expr.of(new RecordExpr(fields), open.span().merge(close.span()));
  }

  /** Returns true if the tokens ahead read {@code name =}, without consuming them. */
  private boolean isRecordLiteral() {
    int saved = pos;
    try {
      skipTrivia();
      if (check(TokenKind.QUOTED_IDENTIFIER)) {
        advance();
      } else if (isWord(current())) {
        skipGeneralizedIdentifierWords();
      } else {
        return false;
      }
      skipTrivia();
      return check(TokenKind.EQUAL);
    } finally {
      pos = saved;
    }
  }

  private Expr parseRecordFields(Token open) throws PqfmtException {
    List<RecordField> fields = new ArrayList<>();
    while (true) {
      List<Trivia> leading = collectComments();
      if (check(TokenKind.RIGHT_BRACKET) || isAtEnd()) {
        if (!fields.isEmpty() && !leading.isEmpty()) {
          RecordField last = fields.remove(fields.size() - 1);
          fields.add(last.withTrailingTrivia(concat(last.trailingTrivia(), leading)));
        }
        break;
      }

      RecordField field = parseRecordField().withLeadingTrivia(leading);
      List<Trivia> trailing = new ArrayList<>(collectComments());
      if (!check(TokenKind.COMMA)) {
        fields.add(field.withTrailingTrivia(trailing));
        break;
      }
      advance();
      trailing.addAll(collectSameLineComments());
      fields.add(field.withTrailingTrivia(trailing));
      skipWhitespace();
    }

    skipTrivia();
    Token close = expect(TokenKind.RIGHT_BRACKET);
    return Expr.of(new RecordExpr(fields), open.span().merge(close.span()));
  }

  private RecordField parseRecordField() throws PqfmtException {
    Identifier name = parseGeneralizedIdentifier();
    skipTrivia();
    expect(TokenKind.EQUAL);
    skipTrivia();
    Expr value = parseExpression();
    return new RecordField(name, value, name.span().merge(value.span()), List.of(), List.of());
  }

  private Expr parseListExpression() throws PqfmtException {
    Token open = advance();
    skipTrivia();

    List<Expr> items = new ArrayList<>();
    while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
      Expr item = parseExpression();
      if (peekPastTrivia() == TokenKind.DOT_DOT) {
        skipTrivia();
        advance();
        skipTrivia();
        Expr end = parseExpression();
        item = Expr.of(new RangeExpr(item, end), item.span().merge(end.span()));
      }
      items.add(item);
      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        break;
      }
      advance();
      skipTrivia();
    }

    Token close = expect(TokenKind.RIGHT_BRACE);
    return Expr.of(new ListExpr(items), open.span().merge(close.span()));
  }

  private List<Expr> parseArgumentList() throws PqfmtException {
    List<Expr> arguments = new ArrayList<>();
    skipTrivia();
    while (!check(TokenKind.RIGHT_PAREN) && !isAtEnd()) {
      arguments.add(parseExpression());
      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        break;
      }
      advance();
      skipTrivia();
    }
    return arguments;
  }

  private Expr parseHashConstructor() throws PqfmtException {
    Token keyword = advance();
    int arity =
        switch (keyword.kind()) {
          case HASH_TABLE -> 2;
          case HASH_DATE, HASH_TIME -> 3;
          case HASH_DURATION -> 4;
          case HASH_DATETIME -> 6;
          default -> 8;
        };

    skipTrivia();
    expect(TokenKind.LEFT_PAREN);
    List<Expr> args = new ArrayList<>();
    for (int i = 0; i < arity; i++) {
      skipTrivia();
      args.add(parseExpression());
      skipTrivia();
      if (i < arity - 1) {
        expect(TokenKind.COMMA);
      }
    }
    Token close = expect(TokenKind.RIGHT_PAREN);

    ExprKind kind =
        switch (keyword.kind()) {
          case HASH_TABLE -> new HashTableExpr(args.get(0), args.get(1));
          case HASH_DATE -> new HashDateExpr(args.get(0), args.get(1), args.get(2));
          case HASH_TIME -> new HashTimeExpr(args.get(0), args.get(1), args.get(2));
          case HASH_DURATION ->
              new HashDurationExpr(args.get(0), args.get(1), args.get(2), args.get(3));
          case HASH_DATETIME -> new HashDatetimeExpr(args);
          default -> new HashDatetimezoneExpr(args);
        };
    return Expr.of(kind, keyword.span().merge(close.span()));
  }

  // Types

  private TypeAnnotation parseTypeAnnotation() throws PqfmtException {
    enter();
    try {
      Token tok = current();
      Span start = tok.span();
      TypeKind kind;

      switch (tok.kind()) {
        case IDENTIFIER -> {
          advance();
          kind = parseNamedType(tok.text());
        }
        case NULL -> {
          advance();
          kind = PrimitiveType.NULL;
        }
        case TYPE -> {
          advance();
          kind = PrimitiveType.TYPE;
        }
        case LEFT_BRACE -> kind = parseListType();
        case LEFT_BRACKET -> {
          TypeFields fields = parseTypeFields();
          kind = new RecordType(fields.fields(), fields.open());
        }
        default -> throw unexpected("Expected type, found " + tok.describe());
      }
      return new TypeAnnotation(kind, start.merge(previous().span()));
    } finally {
      depth--;
    }
  }

  private TypeKind parseNamedType(String name) throws PqfmtException {
    switch (name) {
      case "nullable" -> {
        skipTrivia();
        return new NullableType(parseTypeAnnotation());
      }
      case "list" -> {
        if (peekPastTrivia() == TokenKind.LEFT_BRACE) {
          skipTrivia();
          return parseListType();
        }
        return PrimitiveType.LIST;
      }
      case "record" -> {
        if (peekPastTrivia() == TokenKind.LEFT_BRACKET) {
          skipTrivia();
          TypeFields fields = parseTypeFields();
          return new RecordType(fields.fields(), fields.open());
        }
        return PrimitiveType.RECORD;
      }
      case "table" -> {
        if (peekPastTrivia() == TokenKind.LEFT_BRACKET) {
          skipTrivia();
          TypeFields fields = parseTypeFields();
          return new TableType(fields.fields(), fields.open());
        }
        return PrimitiveType.TABLE;
      }
      case "function" -> {
        if (peekPastTrivia() != TokenKind.LEFT_PAREN) {
          return PrimitiveType.FUNCTION;
        }
        skipTrivia();
        advance();
        List<Parameter> parameters = parseParameterList();
        skipTrivia();
        expect(TokenKind.RIGHT_PAREN);
        TypeAnnotation returnType = null;
        if (peekPastTrivia() == TokenKind.AS) {
          skipTrivia();
          advance();
          skipTrivia();
          returnType = parseTypeAnnotation();
        }
        return new FunctionType(parameters, returnType);
      }
      default -> {
        PrimitiveType primitive = PrimitiveType.fromName(name);
        return primitive != null ? primitive : new CustomType(name);
      }
    }
  }

  private ListType parseListType() throws PqfmtException {
    expect(TokenKind.LEFT_BRACE);
    skipTrivia();
    if (check(TokenKind.RIGHT_BRACE)) {
      advance();
      return new ListType(null);
    }
    TypeAnnotation item = parseTypeAnnotation();
    skipTrivia();
    expect(TokenKind.RIGHT_BRACE);
    return new ListType(item);
  }

  private record TypeFields(List<FieldType> fields, boolean open) {}

  private TypeFields parseTypeFields() throws PqfmtException {
    expect(TokenKind.LEFT_BRACKET);
    skipTrivia();

    List<FieldType> fields = new ArrayList<>();
    boolean open = false;
    while (!check(TokenKind.RIGHT_BRACKET) && !isAtEnd()) {
      if (check(TokenKind.DOT_DOT_DOT)) {
        advance();
        skipTrivia();
        open = true;
        break;
      }

      Span start = current().span();
      boolean optional = consumeOptionalModifier();
      Identifier name = parseGeneralizedIdentifier();
      skipTrivia();
      TypeAnnotation type;
      if (check(TokenKind.EQUAL)) {
        advance();
        skipTrivia();
        type = parseTypeAnnotation();
      } else {
        type = new TypeAnnotation(PrimitiveType.ANY, name.span());
      }
      fields.add(new FieldType(name, type, optional, start.merge(type.span())));

      skipTrivia();
      if (!check(TokenKind.COMMA)) {
        break;
      }
      advance();
      skipTrivia();
    }

    skipTrivia();
    expect(TokenKind.RIGHT_BRACKET);
    return new TypeFields(fields, open);
  }

  // Identifiers

  private Identifier parseIdentifier() throws PqfmtException {
    Token tok = current();
    if (tok.kind() != TokenKind.IDENTIFIER && tok.kind() != TokenKind.QUOTED_IDENTIFIER) {
      throw unexpected("Expected identifier, found " + tok.describe());
    }
    advance();
    return new Identifier(tok.text(), tok.kind() == TokenKind.QUOTED_IDENTIFIER, tok.span());
  }

  /**
   * Parses a field name. Keywords are allowed, and words separated by spaces form one name, as in
   * {@code [Unit Price]}.
   */
  private Identifier parseGeneralizedIdentifier() throws PqfmtException {
    Token first = current();
    if (first.kind() == TokenKind.QUOTED_IDENTIFIER) {
      advance();
      return new Identifier(first.text(), true, first.span());
    }
    if (!isWord(first)) {
      throw unexpected("Expected identifier, found " + first.describe());
    }

    int start = pos;
    skipGeneralizedIdentifierWords();
    StringBuilder name = new StringBuilder();
    for (int i = start; i < pos; i++) {
      name.append(tokens.get(i).text());
    }
    return new Identifier(name.toString(), false, first.span().merge(previous().span()));
  }

  private void skipGeneralizedIdentifierWords() {
    advance();
    while (check(TokenKind.WHITESPACE)
        && (isWord(peekAt(pos + 1)) || peekAt(pos + 1).kind() == TokenKind.NUMBER)) {
      advance();
      advance();
    }
  }

  private static boolean isWord(Token tok) {
    return tok.kind() == TokenKind.IDENTIFIER || tok.kind().isKeyword();
  }

  // Helper methods

  private Token current() {
    return peekAt(pos);
  }

  private Token peekAt(int index) {
    return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
  }

  private Token previous() {
    return tokens.get(Math.max(0, pos - 1));
  }

  private Token advance() {
    Token tok = current();
    if (pos < tokens.size() - 1) {
      pos++;
    }
    return tok;
  }

  private boolean check(TokenKind kind) {
    return current().kind() == kind;
  }

  private boolean isAtEnd() {
    return check(TokenKind.EOF);
  }

  private Token expect(TokenKind kind) throws PqfmtException {
    if (!check(kind)) {
      throw unexpected("Expected " + kind.describe() + ", found " + current().describe());
    }
    return advance();
  }

  private boolean consumeOptionalMarker() {
    if (check(TokenKind.QUESTION)) {
      advance();
      return true;
    }
    return false;
  }

  private Span endSpan(Token close) {
    return previous().kind() == TokenKind.QUESTION ? previous().span() : close.span();
  }

  private TokenKind peekPastTrivia() {
    int i = pos;
    while (peekAt(i).isTrivia()) {
      i++;
    }
    return peekAt(i).kind();
  }

  /** Returns the kind of the first non-trivia token after the current one. */
  private TokenKind peekAfterCurrent() {
    int i = pos + 1;
    while (peekAt(i).isTrivia()) {
      i++;
    }
    return peekAt(i).kind();
  }

  private void skipTrivia() {
    while (current().isTrivia()) {
      advance();
    }
  }

  private void skipWhitespace() {
    while (check(TokenKind.WHITESPACE) || check(TokenKind.NEWLINE)) {
      advance();
    }
  }

  /** Skips trivia, returning the comments passed over. */
  private List<Trivia> collectComments() {
    List<Trivia> comments = new ArrayList<>();
    while (current().isTrivia()) {
      Token tok = advance();
      if (tok.kind() == TokenKind.LINE_COMMENT) {
        comments.add(Trivia.line(tok.text()));
      } else if (tok.kind() == TokenKind.BLOCK_COMMENT) {
        comments.add(Trivia.block(tok.text()));
      }
    }
    return comments;
  }

  /** Collects comments up to the end of the current line, leaving the line break unconsumed. */
  private List<Trivia> collectSameLineComments() {
    List<Trivia> comments = new ArrayList<>();
    while (true) {
      Token tok = current();
      if (tok.kind() == TokenKind.WHITESPACE) {
        advance();
      } else if (tok.kind() == TokenKind.BLOCK_COMMENT) {
        advance();
        comments.add(Trivia.block(tok.text()));
      } else if (tok.kind() == TokenKind.LINE_COMMENT) {
        advance();
        comments.add(Trivia.line(tok.text()));
        return comments;
      } else {
        return comments;
      }
    }
  }

  private static List<Trivia> concat(List<Trivia> first, List<Trivia> second) {
    List<Trivia> all = new ArrayList<>(first);
    all.addAll(second);
    return all;
  }

  private void enter() throws PqfmtException {
    if (++depth > MAX_NESTING_DEPTH) {
      throw nestingError();
    }
  }

  private PqfmtException nestingError() {
    return PqfmtException.limit(
        "Maximum nesting depth of " + MAX_NESTING_DEPTH + " exceeded", current().span(), input);
  }

  private PqfmtException unexpected(String message) {
    Token tok = current();
    if (tok.kind() == TokenKind.INVALID) {
      return PqfmtException.lex(tok.text(), tok.span(), input);
    }
    return PqfmtException.parse(message, tok.span(), input);
  }
}
