package com.pivotcalc.backend.formula;

/**
 * 公式编译失败，消息中带有标注了出错位置的公式文本。
 */
public class FormulaException extends Exception {
    private final String formula;
    private final int position;

    public FormulaException(String formula, int position, Exception cause) {
        super(cause.getMessage() + ": " + mark(formula, position), cause);
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }

    /** 标注了出错位置的公式文本 */
    public String getMarkedFormula() {
        return mark(formula, position);
    }

    /** 在出错位置前插入 "<< " */
    static String mark(String formula, int position) {
        if(formula == null) {
            return "";
        }
        int pos = Math.max(0, Math.min(position, formula.length()));
        return formula.substring(0, pos) + "<< " + formula.substring(pos);
    }
}
