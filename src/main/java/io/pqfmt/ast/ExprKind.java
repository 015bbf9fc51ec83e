package io.pqfmt.ast;

/**
 * Sealed interface for expression variants.
 *
 * <ul>
 *   <li>Literals: {@link NullLiteral}, {@link LogicalLiteral}, {@link NumberLiteral}, {@link
 *       TextLiteral}
 *   <li>Names: {@link IdentifierExpr}, {@link QuotedIdentifierExpr}, {@link UnderscoreExpr}
 *   <li>Control: {@link LetExpr}, {@link IfExpr}, {@link TryExpr}, {@link ErrorExpr}, {@link
 *       EachExpr}, {@link FunctionExpr}
 *   <li>Structure: {@link FunctionCallExpr}, {@link RecordExpr}, {@link ListExpr}, {@link
 *       RangeExpr}, {@link FieldAccessExpr}, {@link FieldProjectionExpr}, {@link
 *       ItemAccessExpr}
 *   <li>Operators: {@link BinaryExpr}, {@link UnaryExpr}, {@link ParenthesizedExpr}, {@link
 *       MetadataExpr}, {@link TypeExpr}
 *   <li>Intrinsic constructors: {@link HashConstructorExpr}
 * </ul>
 */
public sealed interface ExprKind
    permits NullLiteral,
        LogicalLiteral,
        NumberLiteral,
        TextLiteral,
        IdentifierExpr,
        QuotedIdentifierExpr,
        UnderscoreExpr,
        LetExpr,
        IfExpr,
        TryExpr,
        ErrorExpr,
        EachExpr,
        FunctionExpr,
        FunctionCallExpr,
        RecordExpr,
        ListExpr,
        RangeExpr,
        FieldAccessExpr,
        FieldProjectionExpr,
        ItemAccessExpr,
        BinaryExpr,
        UnaryExpr,
        ParenthesizedExpr,
        MetadataExpr,
        TypeExpr,
        HashConstructorExpr {}
