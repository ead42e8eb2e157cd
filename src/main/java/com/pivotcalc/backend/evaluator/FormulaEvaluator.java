package com.pivotcalc.backend.evaluator;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.cell.CellState;
import com.pivotcalc.backend.cell.PivotCells;
import com.pivotcalc.backend.field.ValueDisplayMode;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.backend.formula.FieldLookup;
import com.pivotcalc.backend.formula.Formula;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.backend.formula.FormulaUsage;
import com.pivotcalc.backend.utils.PivotNumeric;

/**
 * 公式求值器。
 * <p>
 * 构造时为每个声明了公式的值字段编译一次公式；编译失败的字段退化为普通字段
 * （直接读取聚合结果），失败只记 DEBUG 日志，不向调用方抛出。
 * <p>
 * 求值器本身不可变，可被多个线程共享；每次展示请求通过 {@link #createContext}
 * 得到独立的 {@link EvaluationContext}，缓存与环检测都限定在该上下文内。
 */
public class FormulaEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final List<ValueField> fields;
    private final Formula[] formulas;
    private final FieldLookup lookup;
    private final FormulaUsage usage = new FormulaUsage();
    private final PivotNumeric numeric;

    public FormulaEvaluator(List<ValueField> fields) {
        this(fields, PivotNumeric.DEFAULT);
    }

    public FormulaEvaluator(List<ValueField> fields, PivotNumeric numeric) {
        this.fields = fields;
        this.numeric = numeric == null ? PivotNumeric.DEFAULT : numeric;
        this.formulas = new Formula[fields.size()];
        this.lookup = FieldLookup.of(fields);
        usage.setValueFieldCount(fields.size());

        for (int i = 0; i < fields.size(); i++) {
            ValueField field = fields.get(i);
            if(field == null || !field.hasFormula()) {
                continue;
            }
            try {
                Formula formula = Formula.compile(field.getFormula(), lookup);
                formulas[i] = formula;
                usage.merge(formula.getUsage());
            } catch (FormulaException e) {
                LOGGER.debug("Formula of {} ignored, falling back to aggregate: {}", field.displayName(), e.getMessage());
            }
        }
    }

    public FormulaUsage usage() {
        return usage;
    }

    public boolean hasFormulas() {
        for (Formula formula : formulas) {
            if(formula != null) {
                return true;
            }
        }
        return false;
    }

    /** 第 valueIndex 个字段编译后的公式，普通字段返回 null */
    public Formula getFormula(int valueIndex) {
        return valueIndex >= 0 && valueIndex < formulas.length ? formulas[valueIndex] : null;
    }

    public FieldLookup getLookup() {
        return lookup;
    }

    public List<ValueField> getFields() {
        return fields;
    }

    public PivotNumeric getNumeric() {
        return numeric;
    }

    public EvaluationContext createContext(Map<CellKey, CellState> cellStates,
                                           List<Object> rowPath,
                                           List<Object> columnPath,
                                           Map<List<Object>, List<Object>> rowParentPaths,
                                           Map<List<Object>, List<Object>> columnParentPaths) {
        return new EvaluationContext(this, cellStates, CellKey.path(rowPath), CellKey.path(columnPath),
                rowParentPaths, columnParentPaths, null);
    }

    public EvaluationContext createContext(PivotCells cells, List<Object> rowPath, List<Object> columnPath) {
        return createContext(cells.getCellStates(), rowPath, columnPath,
                cells.getRowParentPaths(), cells.getColumnParentPaths());
    }

    /** 在 (rowPath, columnPath) 处求第 valueIndex 个字段的值 */
    public Object evaluateAt(int valueIndex, PivotCells cells, List<Object> rowPath, List<Object> columnPath) {
        return createContext(cells, rowPath, columnPath).resolveValue(valueIndex);
    }

    /** 按字段的展示方式求值 */
    public Object displayAt(int valueIndex, PivotCells cells, List<Object> rowPath, List<Object> columnPath) {
        ValueDisplayMode mode = valueIndex >= 0 && valueIndex < fields.size() && fields.get(valueIndex) != null
                ? fields.get(valueIndex).getDisplayMode() : ValueDisplayMode.VALUE;
        return createContext(cells, rowPath, columnPath).display(valueIndex, mode);
    }

    Object getAggregateValue(Map<CellKey, CellState> cellStates,
                             List<Object> rowPath,
                             List<Object> columnPath,
                             int valueIndex) {
        CellState state = cellStates.get(CellKey.of(rowPath, columnPath));
        if(state == null) {
            return null;
        }
        return state.getResult(valueIndex);
    }
}
