package com.pivotcalc.backend.aggregator;

import org.junit.jupiter.api.Test;

import com.pivotcalc.common.Error;

import static org.junit.jupiter.api.Assertions.*;

public class AggregatorRegistryTest {

    @Test
    public void testBuiltInsRegistered() {
        AggregatorRegistry registry = new AggregatorRegistry();
        for (AggregateType type : AggregateType.values()) {
            if(type == AggregateType.CUSTOM) {
                assertNull(registry.get(type));
            } else {
                assertNotNull(registry.get(type), type.name());
                assertEquals(type, registry.get(type).type());
            }
        }
        assertNull(registry.get(null));
    }

    @Test
    public void testRegisterReplaces() {
        AggregatorRegistry registry = new AggregatorRegistry();
        Aggregator max = new MaxAggregator(registry.getNumeric());
        Aggregator replacement = new Aggregator() {
            @Override
            public AggregateType type() {
                return AggregateType.SUM;
            }

            @Override
            public String name() {
                return "Max as Sum";
            }

            @Override
            public AggregationState createState() {
                return max.createState();
            }
        };
        registry.register(replacement);
        assertSame(replacement, registry.get(AggregateType.SUM));
        assertSame(Error.NullAggregatorException,
                assertThrows(IllegalArgumentException.class, () -> registry.register(null)));
    }

    @Test
    public void testParseAggregateType() {
        assertEquals(AggregateType.STD_DEV_P, AggregateType.from("stddevp"));
        assertEquals(AggregateType.STD_DEV_P, AggregateType.from("Std Dev P"));
        assertEquals(AggregateType.COUNT_DISTINCT, AggregateType.from("count_distinct"));
        assertEquals(AggregateType.AVERAGE, AggregateType.from("avg"));
        assertEquals(AggregateType.SUM, AggregateType.from("SUM"));
        assertThrows(IllegalArgumentException.class, () -> AggregateType.from("median"));
        assertThrows(IllegalArgumentException.class, () -> AggregateType.from(null));
    }
}
