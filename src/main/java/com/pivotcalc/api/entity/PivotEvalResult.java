package com.pivotcalc.api.entity;

import java.util.List;

import com.pivotcalc.common.EvalResult;

/**
 * 透视求值结果
 */
public class PivotEvalResult {
    private final List<String> headers;
    private final List<List<String>> rows;
    private final long elapsedNanos;
    private final int resultRows;

    private PivotEvalResult(List<String> headers, List<List<String>> rows, long elapsedNanos, int resultRows) {
        this.headers = headers;
        this.rows = rows;
        this.elapsedNanos = elapsedNanos;
        this.resultRows = resultRows;
    }

    public static PivotEvalResult from(EvalResult evalResult) {
        if (evalResult == null) {
            throw new IllegalArgumentException("evalResult must not be null");
        }
        return new PivotEvalResult(
                evalResult.getResultSet().getHeaders(),
                evalResult.getResultSet().getRows(),
                evalResult.getElapsedNanos(),
                evalResult.getResultRows());
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public int getResultRows() {
        return resultRows;
    }
}
