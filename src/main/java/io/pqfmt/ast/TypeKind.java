package io.pqfmt.ast;

/**
 * Sealed interface for type variants.
 *
 * <ul>
 *   <li>{@link PrimitiveType} - "number", "text", "record"
 *   <li>{@link ListType} - "{number}"
 *   <li>{@link RecordType} - "[A = number, optional B]"
 *   <li>{@link TableType} - "table [A = number]"
 *   <li>{@link FunctionType} - "function (x as number) as text"
 *   <li>{@link NullableType} - "nullable text"
 *   <li>{@link CustomType} - any other name
 * </ul>
 */
public sealed interface TypeKind
    permits PrimitiveType, ListType, RecordType, TableType, FunctionType, NullableType, CustomType {}
