package com.pivotcalc.api.entity.response;

/**
 * 通用透视求值响应，getData 可为文本或结构化结果。
 */
public class PivotEvalResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    private PivotEvalResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> PivotEvalResponse<T> success(T data) {
        return new PivotEvalResponse<>(true, data, null);
    }

    public static <T> PivotEvalResponse<T> failure(String message) {
        return new PivotEvalResponse<>(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
