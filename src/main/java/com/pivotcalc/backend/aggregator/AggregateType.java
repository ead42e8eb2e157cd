package com.pivotcalc.backend.aggregator;

import java.util.Locale;

import com.pivotcalc.common.Error;

public enum AggregateType {
    SUM("Sum"),
    COUNT("Count"),
    AVERAGE("Average"),
    MIN("Min"),
    MAX("Max"),
    PRODUCT("Product"),
    COUNT_NUMBERS("Count Numbers"),
    COUNT_DISTINCT("Distinct Count"),
    STD_DEV("StdDev"),
    STD_DEV_P("StdDev (Population)"),
    VARIANCE("Variance"),
    VARIANCE_P("Variance (Population)"),
    FIRST("First"),
    LAST("Last"),
    CUSTOM("Custom");

    private final String displayName;

    AggregateType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * 从字符串解析聚合类型，忽略大小写、下划线与空格：
     * "stddevp"、"STD_DEV_P"、"Std Dev P" 均解析为 STD_DEV_P，"avg" 为 AVERAGE 的别名。
     */
    public static AggregateType from(String s) {
        if(s == null) {
            throw Error.InvalidAggregateException;
        }
        String normalized = normalize(s);
        if("AVG".equals(normalized)) {
            return AVERAGE;
        }
        for (AggregateType type : values()) {
            if(normalize(type.name()).equals(normalized)) {
                return type;
            }
        }
        throw Error.InvalidAggregateException;
    }

    private static String normalize(String s) {
        return s.replace("_", "").replace(" ", "").toUpperCase(Locale.ROOT);
    }
}
