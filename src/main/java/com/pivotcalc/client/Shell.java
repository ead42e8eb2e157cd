package com.pivotcalc.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import com.google.common.base.Splitter;
import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.backend.server.PivotExecutor;
import com.pivotcalc.common.ConsoleResultFormatter;
import com.pivotcalc.common.EvalResult;
import com.pivotcalc.common.ResultFormatter;

/**
 * 交互式透视 shell。支持的命令：
 * <pre>
 * cells                    求全部单元格
 * cell &lt;row&gt; | &lt;column&gt;   求单个单元格，路径段以 / 分隔，空或 Total 表示总计
 * calc &lt;formula&gt;           对全部单元格计算临时公式
 * fields                   列出值字段
 * exit / quit              退出
 * </pre>
 */
public class Shell {
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String PROMPT = ANSI_CYAN + "pivot> " + ANSI_RESET;
    private static final Splitter PATH_SPLITTER = Splitter.on('/').trimResults().omitEmptyStrings();

    private final PivotExecutor executor;
    private final ResultFormatter formatter = new ConsoleResultFormatter();

    public Shell(PivotExecutor executor) {
        this.executor = executor;
    }

    public void run() {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .appName("PivotCalc")
                    .build();
            while (true) {
                String line;
                try {
                    line = reader.readLine(PROMPT);
                } catch (UserInterruptException ignore) {
                    // 用户按下 Ctrl+C，保持会话继续
                    continue;
                } catch (EndOfFileException eof) {
                    // Ctrl+D 退出
                    break;
                }
                if (line == null) continue;
                String trimmed = line.trim();
                if ("exit".equalsIgnoreCase(trimmed) || "quit".equalsIgnoreCase(trimmed)) {
                    return;
                }
                if (trimmed.isEmpty()) continue;
                try {
                    System.out.println(execute(trimmed));
                    System.out.println();
                } catch (Exception e) {
                    System.out.println(e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize console", e);
        }
    }

    /**
     * 执行一条命令并返回要打印的文本。
     */
    String execute(String line) throws FormulaException {
        String command = line;
        String argument = "";
        int space = line.indexOf(' ');
        if (space > 0) {
            command = line.substring(0, space);
            argument = line.substring(space + 1).trim();
        }
        switch (command.toLowerCase()) {
            case "cells":
                return render(executor.evaluateAll());
            case "cell":
                return render(evaluateCell(argument));
            case "calc":
                if (argument.isEmpty()) {
                    throw new IllegalArgumentException("Usage: calc <formula>");
                }
                return render(executor.calc(argument));
            case "fields":
                return describeFields();
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private EvalResult evaluateCell(String argument) {
        int bar = argument.indexOf('|');
        if (bar < 0) {
            throw new IllegalArgumentException("Usage: cell <row> | <column>");
        }
        List<Object> row = resolve(argument.substring(0, bar), true);
        List<Object> column = resolve(argument.substring(bar + 1), false);
        return executor.evaluateCell(row, column);
    }

    private List<Object> resolve(String text, boolean isRow) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "total".equalsIgnoreCase(trimmed)) {
            return CellKey.EMPTY_PATH;
        }
        List<String> segments = PATH_SPLITTER.splitToList(trimmed);
        List<Object> path = isRow ? executor.findRowPath(segments) : executor.findColumnPath(segments);
        if (path == null) {
            throw new IllegalArgumentException((isRow ? "Row" : "Column") + " path not found: " + trimmed);
        }
        return path;
    }

    private String describeFields() {
        StringBuilder sb = new StringBuilder();
        List<ValueField> fields = executor.getFields();
        for (int i = 0; i < fields.size(); i++) {
            ValueField field = fields.get(i);
            sb.append(i).append(": ").append(field.displayName());
            if (field.hasFormula()) {
                sb.append(" = ").append(field.getFormula());
            } else {
                sb.append(" (").append(field.getAggregateType() == null ? "-" : field.getAggregateType().displayName()).append(")");
            }
            sb.append(" [").append(field.getDisplayMode()).append("]");
            if (i < fields.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private String render(EvalResult result) {
        return new String(formatter.format(result), StandardCharsets.UTF_8);
    }
}
