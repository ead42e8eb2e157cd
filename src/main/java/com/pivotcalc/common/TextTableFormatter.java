package com.pivotcalc.common;

import java.util.List;

import com.google.common.base.Strings;

/**
 * 把透视结果渲染为 ASCII 表格：标签列左对齐，值列右对齐。
 */
public final class TextTableFormatter {
    private TextTableFormatter() {}

    public static String format(PivotResultSet resultSet) {
        List<String> headers = resultSet.getHeaders();
        List<List<String>> rows = resultSet.getRows();
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length && i < row.size(); i++) {
                widths[i] = Math.max(widths[i], Strings.nullToEmpty(row.get(i)).length());
            }
        }
        String separator = separator(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(separator).append("\n");
        // 列头统一左对齐
        sb.append(line(headers, widths, widths.length)).append("\n");
        sb.append(separator).append("\n");
        for (List<String> row : rows) {
            sb.append(line(row, widths, PivotResultSet.LABEL_COLUMNS)).append("\n");
        }
        sb.append(separator);
        return sb.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(Strings.repeat("-", width + 2)).append("+");
        }
        return sb.toString();
    }

    /**
     * 下标小于 leftAligned 的列左对齐，其余右对齐；缺少的列补空。
     */
    private static String line(List<String> values, int[] widths, int leftAligned) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            String value = i < values.size() ? Strings.nullToEmpty(values.get(i)) : "";
            sb.append(" ");
            sb.append(i < leftAligned
                    ? Strings.padEnd(value, widths[i], ' ')
                    : Strings.padStart(value, widths[i], ' '));
            sb.append(" |");
        }
        return sb.toString();
    }
}
