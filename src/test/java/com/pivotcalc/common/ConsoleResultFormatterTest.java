package com.pivotcalc.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.pivotcalc.common.PivotResultSet.CellRow;

import static org.junit.jupiter.api.Assertions.*;

public class ConsoleResultFormatterTest {

    private final ResultFormatter formatter = new ConsoleResultFormatter();

    private String format(EvalResult result) {
        return new String(formatter.format(result), StandardCharsets.UTF_8);
    }

    @Test
    public void testTable() {
        PivotResultSet rs = new PivotResultSet(Arrays.asList("Revenue", "Share"), Arrays.asList(
                new CellRow("East / NY", "Q1", Arrays.asList("100", "0.25")),
                new CellRow("Total", "Total", Arrays.asList("400", "NULL"))));
        String expected = String.join("\n",
                "+-----------+--------+---------+-------+",
                "| Row       | Column | Revenue | Share |",
                "+-----------+--------+---------+-------+",
                "| East / NY | Q1     |     100 |  0.25 |",
                "| Total     | Total  |     400 |  NULL |",
                "+-----------+--------+---------+-------+",
                "2 cells in set (0.00 sec)");
        assertEquals(expected, format(EvalResult.from(rs, 0)));
    }

    @Test
    public void testLabelColumnsLeadEveryRow() {
        PivotResultSet rs = new PivotResultSet(Arrays.asList("Revenue"),
                Arrays.asList(new CellRow("West", "Q2", Arrays.asList("90"))));
        assertEquals(Arrays.asList("Row", "Column", "Revenue"), rs.getHeaders());
        assertEquals(Arrays.asList(Arrays.asList("West", "Q2", "90")), rs.getRows());
        assertFalse(rs.isEmpty());
        assertTrue(new PivotResultSet(null, null).isEmpty());
    }

    @Test
    public void testNoValueFieldsStillListsCells() {
        PivotResultSet rs = new PivotResultSet(null,
                Arrays.asList(new CellRow("Total", "Total", null)));
        String expected = String.join("\n",
                "+-------+--------+",
                "| Row   | Column |",
                "+-------+--------+",
                "| Total | Total  |",
                "+-------+--------+",
                "1 cell in set (0.00 sec)");
        assertEquals(expected, format(EvalResult.from(rs, 0)));
    }

    @Test
    public void testEmptyResult() {
        assertEquals("0 cells in set (1.50 sec)", format(EvalResult.from(null, 1_500_000_000L)));
    }
}
