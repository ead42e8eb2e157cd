package com.pivotcalc.common;

/**
 * 全局错误常量，统一使用 {@code throw Error.XxxException} 抛出。
 */
public class Error {
    // aggregator
    public static final RuntimeException NullAggregatorException = new IllegalArgumentException("Aggregator must not be null");
    public static final RuntimeException IncompatibleStateException = new IllegalArgumentException("Cannot merge aggregation states of different kinds");
    public static final RuntimeException InvalidAggregateException = new IllegalArgumentException("Unknown aggregate type");

    // cell
    public static final RuntimeException CellStateFrozenException = new IllegalStateException("Cell state is frozen");
    public static final RuntimeException CellCountMismatchException = new IllegalArgumentException("Cell states belong to different value field lists");
    public static final RuntimeException ValueCountMismatchException = new IllegalArgumentException("Record has more values than value fields");
    public static final RuntimeException BuilderClosedException = new IllegalStateException("Cell state builder has already been built");

    // formula
    public static final Exception EmptyFormulaException = new Exception("Formula is empty");
    public static final Exception InvalidCharacterException = new Exception("Invalid character in formula");
    public static final Exception InvalidNumberException = new Exception("Malformed number literal");
    public static final Exception UnterminatedBracketException = new Exception("Unterminated bracketed field name");
    public static final Exception FieldNotFoundException = new Exception("Field not found");
    public static final Exception UnknownFunctionException = new Exception("Unknown total function");
    public static final Exception InvalidArgumentException = new Exception("Total function argument must be a single field reference");
    public static final Exception MismatchedParenthesisException = new Exception("Mismatched parenthesis");
    public static final Exception UnexpectedTokenException = new Exception("Unexpected token");
    public static final Exception IncompleteFormulaException = new Exception("Incomplete formula");

    // executor
    public static final RuntimeException TooManyRecordsException = new IllegalArgumentException("Too many records in pivot definition");
    public static final RuntimeException TooManyCellsException = new IllegalArgumentException("Too many cells requested");
    public static final RuntimeException PathNotFoundException = new IllegalArgumentException("Pivot path not found");
}
