package com.pivotcalc.backend.formula;

import java.util.Locale;

/**
 * 公式词元。常量携带数值，字段引用与合计函数携带值字段下标。
 */
public final class FormulaToken {

    public static final FormulaToken END = new FormulaToken(FormulaTokenKind.END, 0d, -1);

    private final FormulaTokenKind kind;
    private final double constant;
    private final int valueIndex;

    private FormulaToken(FormulaTokenKind kind, double constant, int valueIndex) {
        this.kind = kind;
        this.constant = constant;
        this.valueIndex = valueIndex;
    }

    public static FormulaToken constant(double value) {
        return new FormulaToken(FormulaTokenKind.CONSTANT, value, -1);
    }

    public static FormulaToken value(int index) {
        return new FormulaToken(FormulaTokenKind.VALUE, 0d, index);
    }

    /** 合计函数词元：ROW_TOTAL、COLUMN_TOTAL、GRAND_TOTAL、PARENT_ROW_TOTAL、PARENT_COLUMN_TOTAL */
    public static FormulaToken total(FormulaTokenKind kind, int index) {
        return new FormulaToken(kind, 0d, index);
    }

    public static FormulaToken operator(FormulaTokenKind kind) {
        return new FormulaToken(kind, 0d, -1);
    }

    public FormulaTokenKind getKind() {
        return kind;
    }

    public double getConstant() {
        return constant;
    }

    public int getValueIndex() {
        return valueIndex;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return String.format(Locale.ROOT, "%s", constant);
            case VALUE:
                return "$" + valueIndex;
            case ADD:
                return "+";
            case SUBTRACT:
                return "-";
            case MULTIPLY:
                return "*";
            case DIVIDE:
                return "/";
            case NEGATE:
                return "neg";
            case LEFT_PAREN:
                return "(";
            case RIGHT_PAREN:
                return ")";
            case END:
                return "<end>";
            default:
                return kind.name() + "($" + valueIndex + ")";
        }
    }
}
