package com.pivotcalc.common;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 控制台结果格式化器
 */
public class ConsoleResultFormatter implements ResultFormatter {

    @Override
    public byte[] format(EvalResult result) {
        StringBuilder sb = new StringBuilder();
        PivotResultSet data = result.getResultSet();
        if (data != null && !data.isEmpty()) {
            sb.append(TextTableFormatter.format(data)).append("\n");
        }
        int rows = Math.max(result.getResultRows(), 0);
        String summary = rows + (rows == 1 ? " cell" : " cells") +
                " in set (" + formatSeconds(result.getElapsedNanos()) + " sec)";
        sb.append(summary);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String formatSeconds(long nanos) {
        double seconds = nanos / 1_000_000_000d;
        return String.format(Locale.ROOT, "%.2f", seconds);
    }
}
