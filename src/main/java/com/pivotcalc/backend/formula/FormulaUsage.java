package com.pivotcalc.backend.formula;

/**
 * 公式需要的跨单元格查询种类，外加编译时的值字段数量。
 * 多个公式的 usage 按标志位 OR、字段数取最大值合并，
 * 构建方据此决定需要保留哪些虚拟单元格查询。
 */
public class FormulaUsage {
    private boolean usesRowTotals;
    private boolean usesColumnTotals;
    private boolean usesGrandTotals;
    private boolean usesParentRowTotals;
    private boolean usesParentColumnTotals;
    private int valueFieldCount;

    public void merge(FormulaUsage usage) {
        if(usage == null) {
            return;
        }
        usesRowTotals |= usage.usesRowTotals;
        usesColumnTotals |= usage.usesColumnTotals;
        usesGrandTotals |= usage.usesGrandTotals;
        usesParentRowTotals |= usage.usesParentRowTotals;
        usesParentColumnTotals |= usage.usesParentColumnTotals;
        valueFieldCount = Math.max(valueFieldCount, usage.valueFieldCount);
    }

    public void setValueFieldCount(int count) {
        valueFieldCount = Math.max(valueFieldCount, count);
    }

    /** 记录某个合计函数被使用 */
    void mark(FormulaTokenKind kind) {
        switch (kind) {
            case ROW_TOTAL:
                usesRowTotals = true;
                break;
            case COLUMN_TOTAL:
                usesColumnTotals = true;
                break;
            case GRAND_TOTAL:
                usesGrandTotals = true;
                break;
            case PARENT_ROW_TOTAL:
                usesParentRowTotals = true;
                break;
            case PARENT_COLUMN_TOTAL:
                usesParentColumnTotals = true;
                break;
            default:
                break;
        }
    }

    public boolean usesRowTotals() {
        return usesRowTotals;
    }

    public boolean usesColumnTotals() {
        return usesColumnTotals;
    }

    public boolean usesGrandTotals() {
        return usesGrandTotals;
    }

    public boolean usesParentRowTotals() {
        return usesParentRowTotals;
    }

    public boolean usesParentColumnTotals() {
        return usesParentColumnTotals;
    }

    public int getValueFieldCount() {
        return valueFieldCount;
    }

    @Override
    public String toString() {
        return "FormulaUsage{rowTotals=" + usesRowTotals
                + ", columnTotals=" + usesColumnTotals
                + ", grandTotals=" + usesGrandTotals
                + ", parentRowTotals=" + usesParentRowTotals
                + ", parentColumnTotals=" + usesParentColumnTotals
                + ", valueFieldCount=" + valueFieldCount + "}";
    }
}
