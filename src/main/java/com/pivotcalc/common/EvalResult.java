package com.pivotcalc.common;

/**
 * 一次透视求值请求的结构化结果，供不同的输出层自定义格式化逻辑。
 */
public class EvalResult {
    private final PivotResultSet resultSet;
    private final long elapsedNanos;

    private EvalResult(PivotResultSet resultSet, long elapsedNanos) {
        this.resultSet = resultSet;
        this.elapsedNanos = elapsedNanos;
    }

    public static EvalResult from(PivotResultSet resultSet, long elapsedNanos) {
        PivotResultSet effective = resultSet == null ? new PivotResultSet(null, null) : resultSet;
        return new EvalResult(effective, elapsedNanos);
    }

    public PivotResultSet getResultSet() {
        return resultSet;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public int getResultRows() {
        return resultSet.getCellRows().size();
    }
}
