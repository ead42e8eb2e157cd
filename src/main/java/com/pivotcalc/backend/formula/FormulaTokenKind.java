package com.pivotcalc.backend.formula;

public enum FormulaTokenKind {
    CONSTANT,
    VALUE,
    ROW_TOTAL,
    COLUMN_TOTAL,
    GRAND_TOTAL,
    PARENT_ROW_TOTAL,
    PARENT_COLUMN_TOTAL,
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    NEGATE,
    LEFT_PAREN,
    RIGHT_PAREN,
    /** 输入结束 */
    END;

    /** 常量、字段引用与合计函数都是操作数 */
    public boolean isOperand() {
        switch (this) {
            case CONSTANT:
            case VALUE:
            case ROW_TOTAL:
            case COLUMN_TOTAL:
            case GRAND_TOTAL:
            case PARENT_ROW_TOTAL:
            case PARENT_COLUMN_TOTAL:
                return true;
            default:
                return false;
        }
    }

    public boolean isBinaryOperator() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE;
    }

    /** 优先级：取负 3，乘除 2，加减 1 */
    public int precedence() {
        switch (this) {
            case NEGATE:
                return 3;
            case MULTIPLY:
            case DIVIDE:
                return 2;
            case ADD:
            case SUBTRACT:
                return 1;
            default:
                return 0;
        }
    }

    /** 除取负外全部左结合 */
    public boolean isLeftAssociative() {
        return this != NEGATE;
    }
}
