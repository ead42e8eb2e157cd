package com.pivotcalc.backend.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.pivotcalc.backend.aggregator.AggregateType;
import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.cell.CellStateBuilder;
import com.pivotcalc.backend.cell.PivotCells;
import com.pivotcalc.backend.evaluator.EvaluationContext;
import com.pivotcalc.backend.evaluator.FormulaEvaluator;
import com.pivotcalc.backend.field.ValueDisplayMode;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.backend.formula.Formula;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.backend.formula.FormulaUsage;
import com.pivotcalc.common.Error;
import com.pivotcalc.common.EvalResult;
import com.pivotcalc.common.PivotDefinition;
import com.pivotcalc.common.PivotResultSet;
import com.pivotcalc.common.PivotResultSet.CellRow;

/**
 * PivotExecutor 负责把透视定义构建为冻结的单元格状态，并按请求在指定坐标上求值，
 * 返回结构化的 {@link EvalResult}，由上层决定如何格式化。
 * <p>
 * 构建完成后执行器只读，可被多个请求共享；每个单元格的求值使用独立的上下文。
 */
public class PivotExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotExecutor.class);

    static final String TOTAL_LABEL = "Total";
    static final String NULL_LABEL = "NULL";
    private static final Joiner PATH_JOINER = Joiner.on(" / ").useForNull(NULL_LABEL);

    private final List<ValueField> fields;
    private final PivotCells cells;
    private final FormulaEvaluator evaluator;
    /** 用于日志的调用方标识 */
    private final String clientId;

    public PivotExecutor(List<ValueField> fields, PivotCells cells, AggregatorRegistry registry, String clientId) {
        this.fields = fields;
        this.cells = cells;
        this.evaluator = new FormulaEvaluator(fields, registry.getNumeric());
        this.clientId = clientId == null ? "default" : clientId;
    }

    /**
     * 由透视定义构建执行器：解析字段、累加记录并冻结单元格。
     */
    public static PivotExecutor of(PivotDefinition definition, AggregatorRegistry registry) {
        return of(definition, registry, "default");
    }

    public static PivotExecutor of(PivotDefinition definition, AggregatorRegistry registry, String clientId) {
        List<ValueField> fields = toValueFields(definition.getFields());
        CellStateBuilder builder = new CellStateBuilder(fields, registry);
        if(definition.getRecords() != null) {
            for (PivotDefinition.RecordSpec record : definition.getRecords()) {
                List<Object> values = record.getValues() == null ? new ArrayList<>() : record.getValues();
                builder.add(nullToEmpty(record.getRow()), nullToEmpty(record.getColumn()), values.toArray());
            }
        }
        PivotCells cells = builder.build();
        LOGGER.info("[client={}] Pivot built: {} fields, {} cells", clientId, fields.size(), cells.size());
        return new PivotExecutor(fields, cells, registry, clientId);
    }

    public static List<ValueField> toValueFields(List<PivotDefinition.FieldSpec> specs) {
        List<ValueField> fields = new ArrayList<>();
        if(specs == null) {
            return fields;
        }
        for (PivotDefinition.FieldSpec spec : specs) {
            AggregateType type = spec.getAggregate() == null || spec.getAggregate().isBlank()
                    ? AggregateType.SUM : AggregateType.from(spec.getAggregate());
            fields.add(ValueField.builder(spec.getKey())
                    .header(spec.getHeader())
                    .aggregate(type)
                    .formula(spec.getFormula())
                    .displayMode(ValueDisplayMode.from(spec.getDisplayMode()))
                    .build());
        }
        return fields;
    }

    /**
     * 求单个单元格：一行，每个值字段一列（按字段的展示方式）。
     */
    public EvalResult evaluateCell(List<?> rowPath, List<?> columnPath) {
        long start = System.nanoTime();
        List<Object> row = CellKey.path(rowPath);
        List<Object> column = CellKey.path(columnPath);
        if(cells.get(row, column) == null) {
            throw Error.PathNotFoundException;
        }
        LOGGER.info("[client={}] Evaluate cell: {} | {}", clientId, label(row), label(column));
        List<CellRow> rows = new ArrayList<>();
        rows.add(evaluateRow(row, column));
        return EvalResult.from(new PivotResultSet(valueHeaders(), rows), System.nanoTime() - start);
    }

    /**
     * 求全部单元格，按行路径、列路径的构建顺序排列。
     */
    public EvalResult evaluateAll() {
        long start = System.nanoTime();
        LOGGER.info("[client={}] Evaluate all {} cells", clientId, cells.size());
        List<CellRow> rows = new ArrayList<>();
        for (List<Object> row : cells.getRowPaths()) {
            for (List<Object> column : cells.getColumnPaths()) {
                if(cells.get(row, column) != null) {
                    rows.add(evaluateRow(row, column));
                }
            }
        }
        return EvalResult.from(new PivotResultSet(valueHeaders(), rows), System.nanoTime() - start);
    }

    /**
     * 按给定坐标列表求值，坐标不存在时抛出。
     */
    public EvalResult evaluateCells(List<CellKey> keys) {
        long start = System.nanoTime();
        LOGGER.info("[client={}] Evaluate {} cells", clientId, keys.size());
        List<CellRow> rows = new ArrayList<>();
        for (CellKey key : keys) {
            if(cells.get(key.getRowPath(), key.getColumnPath()) == null) {
                throw Error.PathNotFoundException;
            }
            rows.add(evaluateRow(key.getRowPath(), key.getColumnPath()));
        }
        return EvalResult.from(new PivotResultSet(valueHeaders(), rows), System.nanoTime() - start);
    }

    /**
     * 对所有单元格计算一个临时公式。公式可以引用任意已定义的值字段。
     *
     * @throws FormulaException 公式无法编译
     */
    public EvalResult calc(String text) throws FormulaException {
        long start = System.nanoTime();
        LOGGER.info("[client={}] Calc: {}", clientId, text);
        Formula.compile(text, evaluator.getLookup());

        List<ValueField> extended = new ArrayList<>(fields);
        extended.add(ValueField.calculated(text, text));
        FormulaEvaluator adHoc = new FormulaEvaluator(extended, evaluator.getNumeric());
        int index = fields.size();

        List<CellRow> rows = new ArrayList<>();
        for (List<Object> row : cells.getRowPaths()) {
            for (List<Object> column : cells.getColumnPaths()) {
                if(cells.get(row, column) == null) {
                    continue;
                }
                rows.add(new CellRow(label(row), label(column),
                        Collections.singletonList(formatValue(adHoc.evaluateAt(index, cells, row, column)))));
            }
        }
        return EvalResult.from(new PivotResultSet(Collections.singletonList(text), rows), System.nanoTime() - start);
    }

    /** 按段文本查找行路径，找不到返回 null */
    public List<Object> findRowPath(List<String> segments) {
        return findPath(cells.getRowPaths(), segments);
    }

    /** 按段文本查找列路径，找不到返回 null */
    public List<Object> findColumnPath(List<String> segments) {
        return findPath(cells.getColumnPaths(), segments);
    }

    public FormulaUsage usage() {
        return evaluator.usage();
    }

    public List<ValueField> getFields() {
        return fields;
    }

    public PivotCells getCells() {
        return cells;
    }

    private CellRow evaluateRow(List<Object> row, List<Object> column) {
        EvaluationContext context = evaluator.createContext(cells, row, column);
        List<String> values = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            values.add(formatValue(context.display(i, fields.get(i).getDisplayMode())));
        }
        return new CellRow(label(row), label(column), values);
    }

    private List<String> valueHeaders() {
        List<String> headers = new ArrayList<>(fields.size());
        for (ValueField field : fields) {
            headers.add(field.displayName());
        }
        return headers;
    }

    private static List<Object> findPath(List<List<Object>> paths, List<String> segments) {
        for (List<Object> path : paths) {
            if(path.size() != segments.size()) {
                continue;
            }
            boolean match = true;
            for (int i = 0; i < path.size(); i++) {
                if(!String.valueOf(path.get(i)).equals(segments.get(i))) {
                    match = false;
                    break;
                }
            }
            if(match) {
                return path;
            }
        }
        return null;
    }

    static String label(List<Object> path) {
        if(path.isEmpty()) {
            return TOTAL_LABEL;
        }
        return PATH_JOINER.join(path);
    }

    /**
     * 整数值的 Double 去掉 ".0"，其余按 String.valueOf 输出，null 输出 NULL。
     */
    static String formatValue(Object value) {
        if(value == null) {
            return NULL_LABEL;
        }
        if(value instanceof Double) {
            double d = (Double) value;
            if(d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
        }
        return String.valueOf(value);
    }

    private static List<Object> nullToEmpty(List<Object> path) {
        return path == null ? CellKey.EMPTY_PATH : path;
    }
}
