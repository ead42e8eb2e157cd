package com.pivotcalc.backend.server;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.cell.CellKey;
import com.pivotcalc.backend.formula.FormulaException;
import com.pivotcalc.common.Error;
import com.pivotcalc.common.EvalResult;
import com.pivotcalc.common.PivotDefinition;
import com.pivotcalc.common.PivotDefinition.FieldSpec;
import com.pivotcalc.common.PivotDefinition.RecordSpec;

import static org.junit.jupiter.api.Assertions.*;

public class PivotExecutorTest {

    private PivotExecutor executor;

    static PivotDefinition sampleDefinition() {
        FieldSpec share = new FieldSpec("Share", null, "Revenue");
        share.setHeader("Revenue Share");
        share.setDisplayMode("percent_of_row_total");
        PivotDefinition definition = new PivotDefinition();
        definition.setFields(Arrays.asList(
                new FieldSpec("Revenue", "sum", null),
                new FieldSpec("Cost", "sum", null),
                new FieldSpec("Profit", null, "Revenue - Cost"),
                share));
        definition.setRecords(Arrays.asList(
                record(Arrays.asList("East", "NY"), Arrays.asList("Q1"), 100, 30),
                record(Arrays.asList("East", "NY"), Arrays.asList("Q2"), 120, 50),
                record(Arrays.asList("East", "MA"), Arrays.asList("Q1"), 80, 20),
                record(Arrays.asList("West", "CA"), Arrays.asList("Q1"), 200, 90)));
        return definition;
    }

    private static RecordSpec record(List<Object> row, List<Object> column, Object revenue, Object cost) {
        return new RecordSpec(row, column, Arrays.asList(revenue, cost));
    }

    @BeforeEach
    public void setUp() {
        executor = PivotExecutor.of(sampleDefinition(), new AggregatorRegistry());
    }

    @Test
    public void testEvaluateCell() {
        EvalResult result = executor.evaluateCell(CellKey.path("East", "NY"), CellKey.path("Q1"));
        assertEquals(Arrays.asList("Row", "Column", "Revenue", "Cost", "Profit", "Revenue Share"),
                result.getResultSet().getHeaders());
        assertEquals(1, result.getResultRows());
        List<String> row = result.getResultSet().getRows().get(0);
        assertEquals(Arrays.asList("East / NY", "Q1", "100", "30", "70"), row.subList(0, 5));
        assertEquals(100.0 / 220, Double.parseDouble(row.get(5)), 1e-9);
    }

    @Test
    public void testEvaluateTotals() {
        List<String> row = executor.evaluateCell(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResultSet().getRows().get(0);
        assertEquals(Arrays.asList("Total", "Total", "500", "190", "310", "1"), row);
    }

    @Test
    public void testEvaluateMissingCell() {
        assertSame(Error.PathNotFoundException, assertThrows(IllegalArgumentException.class,
                () -> executor.evaluateCell(CellKey.path("East", "MA"), CellKey.path("Q2"))));
    }

    @Test
    public void testEvaluateAll() {
        EvalResult result = executor.evaluateAll();
        assertEquals(15, result.getResultRows());
        assertEquals(Arrays.asList("Total", "Total"), result.getResultSet().getRows().get(0).subList(0, 2));
        assertEquals(15, executor.getCells().size());
    }

    @Test
    public void testEvaluateCells() {
        EvalResult result = executor.evaluateCells(Arrays.asList(
                CellKey.of(CellKey.path("West"), CellKey.EMPTY_PATH),
                CellKey.of(CellKey.path("East"), CellKey.path("Q2"))));
        assertEquals(2, result.getResultRows());
        assertEquals(Arrays.asList("West", "Total", "200", "90", "110"), result.getResultSet().getRows().get(0).subList(0, 5));
        assertEquals(Arrays.asList("East", "Q2", "120", "50", "70"), result.getResultSet().getRows().get(1).subList(0, 5));
    }

    @Test
    public void testCalc() throws Exception {
        EvalResult result = executor.calc("Profit / Revenue");
        assertEquals(Arrays.asList("Row", "Column", "Profit / Revenue"), result.getResultSet().getHeaders());
        assertEquals(15, result.getResultRows());
        assertEquals(Arrays.asList("Total", "Total", "0.62"), result.getResultSet().getRows().get(0));
        assertThrows(FormulaException.class, () -> executor.calc("Profit +"));
        assertThrows(FormulaException.class, () -> executor.calc("Unknown * 2"));
    }

    @Test
    public void testFindPaths() {
        assertEquals(CellKey.path("East", "NY"), executor.findRowPath(Arrays.asList("East", "NY")));
        assertEquals(CellKey.path("Q2"), executor.findColumnPath(Arrays.asList("Q2")));
        assertEquals(CellKey.EMPTY_PATH, executor.findRowPath(Arrays.asList()));
        assertNull(executor.findRowPath(Arrays.asList("East", "TX")));
    }

    @Test
    public void testFormatting() {
        assertEquals("NULL", PivotExecutor.formatValue(null));
        assertEquals("70", PivotExecutor.formatValue(70.0));
        assertEquals("0.25", PivotExecutor.formatValue(0.25));
        assertEquals("abc", PivotExecutor.formatValue("abc"));
        assertEquals("Total", PivotExecutor.label(CellKey.EMPTY_PATH));
        assertEquals("2024 / NULL", PivotExecutor.label(Arrays.asList(2024, null)));
    }

    @Test
    public void testDefinitionErrors() {
        PivotDefinition definition = sampleDefinition();
        definition.getFields().get(0).setAggregate("median");
        assertSame(Error.InvalidAggregateException,
                assertThrows(IllegalArgumentException.class, () -> PivotExecutor.of(definition, new AggregatorRegistry())));

        PivotDefinition tooWide = sampleDefinition();
        tooWide.setRecords(Arrays.asList(new RecordSpec(Arrays.asList("East"), Arrays.asList("Q1"),
                Arrays.asList(1, 2, 3, 4, 5))));
        assertSame(Error.ValueCountMismatchException,
                assertThrows(IllegalArgumentException.class, () -> PivotExecutor.of(tooWide, new AggregatorRegistry())));
    }
}
