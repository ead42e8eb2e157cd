package com.pivotcalc.api.entity;

import com.pivotcalc.backend.formula.Formula;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.backend.formula.FormulaUsage;

/**
 * 公式检查结果：合法时给出后缀程序与合计函数使用情况，非法时给出错误位置。
 */
public class FormulaCheckResult {
    private final boolean valid;
    private final String program;
    private final String marked;
    private final int position;
    private final String message;
    private final boolean usesRowTotals;
    private final boolean usesColumnTotals;
    private final boolean usesGrandTotals;
    private final boolean usesParentRowTotals;
    private final boolean usesParentColumnTotals;

    private FormulaCheckResult(boolean valid, String program, String marked, int position, String message,
                               FormulaUsage usage) {
        this.valid = valid;
        this.program = program;
        this.marked = marked;
        this.position = position;
        this.message = message;
        this.usesRowTotals = usage != null && usage.usesRowTotals();
        this.usesColumnTotals = usage != null && usage.usesColumnTotals();
        this.usesGrandTotals = usage != null && usage.usesGrandTotals();
        this.usesParentRowTotals = usage != null && usage.usesParentRowTotals();
        this.usesParentColumnTotals = usage != null && usage.usesParentColumnTotals();
    }

    public static FormulaCheckResult valid(Formula formula) {
        return new FormulaCheckResult(true, formula.toString(), null, -1, null, formula.getUsage());
    }

    public static FormulaCheckResult invalid(FormulaException e) {
        return new FormulaCheckResult(false, null, e.getMarkedFormula(), e.getPosition(), e.getMessage(), null);
    }

    public boolean isValid() {
        return valid;
    }

    public String getProgram() {
        return program;
    }

    public String getMarked() {
        return marked;
    }

    public int getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    public boolean isUsesRowTotals() {
        return usesRowTotals;
    }

    public boolean isUsesColumnTotals() {
        return usesColumnTotals;
    }

    public boolean isUsesGrandTotals() {
        return usesGrandTotals;
    }

    public boolean isUsesParentRowTotals() {
        return usesParentRowTotals;
    }

    public boolean isUsesParentColumnTotals() {
        return usesParentColumnTotals;
    }
}
