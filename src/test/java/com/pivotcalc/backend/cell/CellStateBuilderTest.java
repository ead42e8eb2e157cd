package com.pivotcalc.backend.cell;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pivotcalc.backend.aggregator.AggregateType;
import com.pivotcalc.backend.aggregator.AggregationState;
import com.pivotcalc.backend.aggregator.AggregatorRegistry;
import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.common.Error;

import static org.junit.jupiter.api.Assertions.*;

public class CellStateBuilderTest {

    private final AggregatorRegistry registry = new AggregatorRegistry();
    private final List<ValueField> fields = Arrays.asList(
            ValueField.of("Revenue", AggregateType.SUM),
            ValueField.of("Orders", AggregateType.COUNT),
            ValueField.of("Spread", AggregateType.STD_DEV_P));
    private PivotCells cells;

    @BeforeEach
    public void setUp() {
        cells = new CellStateBuilder(fields, registry)
                .add(CellKey.path("East", "NY"), CellKey.path("Q1"), new Object[]{100, "a", 1})
                .add(CellKey.path("East", "NY"), CellKey.path("Q2"), new Object[]{120, "b", 2})
                .add(CellKey.path("East", "MA"), CellKey.path("Q1"), new Object[]{80, "c", 3})
                .add(CellKey.path("West", "CA"), CellKey.path("Q1"), new Object[]{200, "d", 4})
                .add(CellKey.path("West", "CA"), CellKey.path("Q1"), new Object[]{null, "e", 5})
                .build();
    }

    @Test
    public void testRollUp() {
        assertEquals(15, cells.size());
        assertEquals(500.0, cells.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResult(0));
        assertEquals(5L, cells.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResult(1));
        assertEquals(300.0, cells.get(CellKey.path("East"), CellKey.EMPTY_PATH).getResult(0));
        assertEquals(180.0, cells.get(CellKey.path("East"), CellKey.path("Q1")).getResult(0));
        assertEquals(380.0, cells.get(CellKey.EMPTY_PATH, CellKey.path("Q1")).getResult(0));
        assertEquals(2L, cells.get(CellKey.path("West", "CA"), CellKey.path("Q1")).getResult(1));
        assertNull(cells.get(CellKey.path("East", "MA"), CellKey.path("Q2")));
    }

    @Test
    public void testRollUpMatchesSinglePass() {
        AggregationState single = registry.get(AggregateType.STD_DEV_P).createState();
        for (int i = 1; i <= 5; i++) {
            single.add(i);
        }
        assertEquals((Double) single.getResult(),
                (Double) cells.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResult(2), 1e-9);
        assertEquals(Math.sqrt(2.0), (Double) single.getResult(), 1e-9);
    }

    @Test
    public void testTotalsFollowRecordOrder() {
        List<ValueField> ordered = Arrays.asList(
                ValueField.of("Last", AggregateType.LAST),
                ValueField.of("First", AggregateType.FIRST));
        PivotCells interleaved = new CellStateBuilder(ordered, registry)
                .add(CellKey.path("A"), CellKey.EMPTY_PATH, new Object[]{"a1", "a1"})
                .add(CellKey.path("B"), CellKey.EMPTY_PATH, new Object[]{"b1", "b1"})
                .add(CellKey.path("A"), CellKey.EMPTY_PATH, new Object[]{"a2", "a2"})
                .build();
        AggregationState single = registry.get(AggregateType.LAST).createState();
        for (String value : Arrays.asList("a1", "b1", "a2")) {
            single.add(value);
        }
        CellState grand = interleaved.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH);
        assertEquals(single.getResult(), grand.getResult(0));
        assertEquals("a2", grand.getResult(0));
        assertEquals("a1", grand.getResult(1));
        assertEquals("a2", interleaved.get(CellKey.path("A"), CellKey.EMPTY_PATH).getResult(0));
        assertEquals("b1", interleaved.get(CellKey.path("B"), CellKey.EMPTY_PATH).getResult(0));
    }

    @Test
    public void testPathsAndParents() {
        assertEquals(Arrays.asList(
                CellKey.EMPTY_PATH,
                CellKey.path("East"),
                CellKey.path("East", "NY"),
                CellKey.path("East", "MA"),
                CellKey.path("West"),
                CellKey.path("West", "CA")), cells.getRowPaths());
        assertEquals(Arrays.asList(CellKey.EMPTY_PATH, CellKey.path("Q1"), CellKey.path("Q2")), cells.getColumnPaths());
        assertEquals(CellKey.path("East"), cells.getRowParentPaths().get(CellKey.path("East", "NY")));
        assertEquals(CellKey.EMPTY_PATH, cells.getRowParentPaths().get(CellKey.path("West")));
        assertEquals(CellKey.EMPTY_PATH, cells.getColumnParentPaths().get(CellKey.path("Q2")));
    }

    @Test
    public void testFrozenAfterBuild() {
        CellState grand = cells.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH);
        assertTrue(grand.isFrozen());
        assertSame(Error.CellStateFrozenException, assertThrows(IllegalStateException.class, () -> grand.add(0, 1)));
        assertThrows(IllegalStateException.class, () -> grand.merge(CellState.of(fields, registry)));
        assertThrows(UnsupportedOperationException.class, () -> cells.getCellStates().clear());
    }

    @Test
    public void testBuilderMisuse() {
        CellStateBuilder builder = new CellStateBuilder(fields, registry);
        assertSame(Error.ValueCountMismatchException, assertThrows(IllegalArgumentException.class,
                () -> builder.add(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH, new Object[]{1, 2, 3, 4})));
        PivotCells empty = builder.build();
        assertEquals(1, empty.size());
        assertNull(empty.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResult(0));
        assertEquals(0L, empty.get(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH).getResult(1));
        assertSame(Error.BuilderClosedException, assertThrows(IllegalStateException.class, builder::build));
        assertThrows(IllegalStateException.class,
                () -> builder.add(CellKey.EMPTY_PATH, CellKey.EMPTY_PATH, new Object[0]));
    }

    @Test
    public void testCellStateWithUnresolvedAggregator() {
        List<ValueField> withCustom = Arrays.asList(
                ValueField.of("Revenue", AggregateType.SUM),
                ValueField.of("Mystery", AggregateType.CUSTOM));
        CellState state = CellState.of(withCustom, registry);
        state.accept(new Object[]{5, 6});
        assertEquals(5.0, state.getResult(0));
        assertNull(state.getResult(1));
        assertNull(state.getResult(7));
        assertEquals(Arrays.asList(5.0, null), state.results());
    }

    @Test
    public void testCellKeyEquality() {
        assertEquals(CellKey.of(Arrays.asList("a", null), CellKey.EMPTY_PATH),
                CellKey.of(Arrays.asList("a", null), null));
        assertNotEquals(CellKey.of(CellKey.path("a"), CellKey.EMPTY_PATH),
                CellKey.of(CellKey.EMPTY_PATH, CellKey.path("a")));
        assertEquals(CellKey.path("a"), CellKey.truncate(CellKey.path("a", "b")));
        assertEquals(CellKey.EMPTY_PATH, CellKey.truncate(CellKey.EMPTY_PATH));
    }
}
