package com.pivotcalc.backend.field;

import java.util.Locale;

/**
 * 值字段的展示方式。百分比类结果为比例（0.25 表示 25%），由展示层自行格式化。
 */
public enum ValueDisplayMode {
    VALUE,
    PERCENT_OF_ROW_TOTAL,
    PERCENT_OF_COLUMN_TOTAL,
    PERCENT_OF_GRAND_TOTAL,
    PERCENT_OF_PARENT_ROW_TOTAL,
    PERCENT_OF_PARENT_COLUMN_TOTAL,
    /** (value * grandTotal) / (rowTotal * columnTotal) */
    INDEX;

    /**
     * 解析展示方式，空值为 VALUE，忽略大小写与下划线。
     */
    public static ValueDisplayMode from(String s) {
        if(s == null || s.isBlank()) {
            return VALUE;
        }
        String normalized = s.replace("_", "").replace(" ", "").toUpperCase(Locale.ROOT);
        for (ValueDisplayMode mode : values()) {
            if(mode.name().replace("_", "").equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown display mode: " + s);
    }
}
