package com.pivotcalc.api.config;

import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pivotcalc.engine")
public class PivotCalcConfig {

    /**
     * 单次请求允许的最大记录数
     */
    private int maxRecords = 100_000;

    /**
     * 构建后允许的最大单元格数（含所有小计与总计）
     */
    private int maxCells = 50_000;

    /**
     * 解析字符串数值时使用的区域，BCP 47 标签，如 en-US、de-DE
     */
    private String locale = "en-US";

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public int getMaxCells() {
        return maxCells;
    }

    public void setMaxCells(int maxCells) {
        this.maxCells = maxCells;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public Locale toLocale() {
        if(locale == null || locale.isBlank()) {
            return Locale.getDefault();
        }
        return Locale.forLanguageTag(locale.trim());
    }
}
