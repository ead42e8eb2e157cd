package com.pivotcalc.api.entity.enums;

/**
 * 求值返回格式：文本表格或结构化（默认）。
 */
public enum ResponseFormat {
    TEXT,
    STRUCTURED
}
