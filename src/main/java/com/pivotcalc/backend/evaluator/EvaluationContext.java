package com.pivotcalc.backend.evaluator;

import java.util.List;
import java.util.Map;

import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.cell.CellState;
import com.pivotcalc.backend.field.ValueDisplayMode;
import com.pivotcalc.backend.formula.Formula;
import com.pivotcalc.backend.formula.FormulaContext;

/**
 * 单个 (行路径, 列路径) 的求值上下文，对应一次展示请求。
 * <p>
 * 持有按字段下标的结果缓存与"求值中"标记：
 * <ul>
 *     <li>已缓存的字段直接返回</li>
 *     <li>正在求值的字段再次被引用时视为循环引用，返回 null</li>
 * </ul>
 * 合计函数在目标坐标上开启嵌套上下文（共享同一份冻结的单元格状态）。
 * 若当前解析链上已经有位于同一坐标的上下文，则复用它，
 * 这样经由 RowTotal / ParentRowTotal 等形成的环也会被标记拦截，不会无限递归。
 */
public class EvaluationContext implements FormulaContext {

    private final FormulaEvaluator owner;
    private final Map<CellKey, CellState> cellStates;
    private final List<Object> rowPath;
    private final List<Object> columnPath;
    private final Map<List<Object>, List<Object>> rowParentPaths;
    private final Map<List<Object>, List<Object>> columnParentPaths;
    /** 发起嵌套求值的上下文，根上下文为 null */
    private final EvaluationContext parent;
    private final Object[] cache;
    private final boolean[] cacheSet;
    private final boolean[] evaluating;

    EvaluationContext(FormulaEvaluator owner,
                      Map<CellKey, CellState> cellStates,
                      List<Object> rowPath,
                      List<Object> columnPath,
                      Map<List<Object>, List<Object>> rowParentPaths,
                      Map<List<Object>, List<Object>> columnParentPaths,
                      EvaluationContext parent) {
        this.owner = owner;
        this.cellStates = cellStates;
        this.rowPath = rowPath;
        this.columnPath = columnPath;
        this.rowParentPaths = rowParentPaths;
        this.columnParentPaths = columnParentPaths;
        this.parent = parent;
        int count = owner.usage().getValueFieldCount();
        this.cache = new Object[count];
        this.cacheSet = new boolean[count];
        this.evaluating = new boolean[count];
    }

    @Override
    public Object resolveValue(int valueIndex) {
        if(valueIndex < 0 || valueIndex >= cache.length) {
            return null;
        }
        if(cacheSet[valueIndex]) {
            return cache[valueIndex];
        }
        if(evaluating[valueIndex]) {
            return null;
        }

        evaluating[valueIndex] = true;
        Object result;
        try {
            Formula formula = owner.getFormula(valueIndex);
            if(formula != null) {
                result = formula.evaluate(this);
            } else {
                result = owner.getAggregateValue(cellStates, rowPath, columnPath, valueIndex);
            }
        } finally {
            evaluating[valueIndex] = false;
        }
        cache[valueIndex] = result;
        cacheSet[valueIndex] = true;
        return result;
    }

    @Override
    public Object resolveRowTotal(int valueIndex) {
        return at(rowPath, CellKey.EMPTY_PATH).resolveValue(valueIndex);
    }

    @Override
    public Object resolveColumnTotal(int valueIndex) {
        return at(CellKey.EMPTY_PATH, columnPath).resolveValue(valueIndex);
    }

    @Override
    public Object resolveGrandTotal(int valueIndex) {
        return at(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).resolveValue(valueIndex);
    }

    @Override
    public Object resolveParentRowTotal(int valueIndex) {
        return at(parentPath(rowPath, rowParentPaths), columnPath).resolveValue(valueIndex);
    }

    @Override
    public Object resolveParentColumnTotal(int valueIndex) {
        return at(rowPath, parentPath(columnPath, columnParentPaths)).resolveValue(valueIndex);
    }

    @Override
    public Double toNumber(Object value) {
        return owner.getNumeric().toDouble(value);
    }

    /**
     * 按展示方式求值。百分比为比例；任一操作数缺失或分母为 0 时返回 null。
     */
    public Object display(int valueIndex, ValueDisplayMode mode) {
        Object value = resolveValue(valueIndex);
        if(mode == null || mode == ValueDisplayMode.VALUE) {
            return value;
        }
        Double v = toNumber(value);
        switch (mode) {
            case PERCENT_OF_ROW_TOTAL:
                return ratio(v, toNumber(resolveRowTotal(valueIndex)));
            case PERCENT_OF_COLUMN_TOTAL:
                return ratio(v, toNumber(resolveColumnTotal(valueIndex)));
            case PERCENT_OF_GRAND_TOTAL:
                return ratio(v, toNumber(resolveGrandTotal(valueIndex)));
            case PERCENT_OF_PARENT_ROW_TOTAL:
                return ratio(v, toNumber(resolveParentRowTotal(valueIndex)));
            case PERCENT_OF_PARENT_COLUMN_TOTAL:
                return ratio(v, toNumber(resolveParentColumnTotal(valueIndex)));
            case INDEX:
                Double grand = toNumber(resolveGrandTotal(valueIndex));
                Double rowTotal = toNumber(resolveRowTotal(valueIndex));
                Double columnTotal = toNumber(resolveColumnTotal(valueIndex));
                if(v == null || grand == null || rowTotal == null || columnTotal == null) {
                    return null;
                }
                return ratio(v * grand, rowTotal * columnTotal);
            default:
                return value;
        }
    }

    public List<Object> getRowPath() {
        return rowPath;
    }

    public List<Object> getColumnPath() {
        return columnPath;
    }

    private static Double ratio(Double numerator, Double denominator) {
        if(numerator == null || denominator == null || denominator == 0d) {
            return null;
        }
        return numerator / denominator;
    }

    /**
     * 返回位于 (row, column) 的上下文：解析链上已有同坐标的上下文时复用，否则新建嵌套上下文。
     */
    private EvaluationContext at(List<Object> row, List<Object> column) {
        for (EvaluationContext ctx = this; ctx != null; ctx = ctx.parent) {
            if(ctx.rowPath.equals(row) && ctx.columnPath.equals(column)) {
                return ctx;
            }
        }
        return new EvaluationContext(owner, cellStates, row, column, rowParentPaths, columnParentPaths, this);
    }

    /**
     * 父路径：优先查构建方提供的父路径表，否则去掉最后一个元素；空路径的父路径是它自己。
     */
    private static List<Object> parentPath(List<Object> path, Map<List<Object>, List<Object>> parentPaths) {
        if(parentPaths != null) {
            List<Object> parent = parentPaths.get(path);
            if(parent != null) {
                return CellKey.path(parent);
            }
        }
        return CellKey.truncate(path);
    }
}
