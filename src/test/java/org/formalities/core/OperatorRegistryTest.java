package org.formalities.core;

import org.formalities.error.UnknownReferenceException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class OperatorRegistryTest {

    @Test
    public void standardRegistryCoversAllFamilies() {
        OperatorRegistry registry = OperatorRegistry.standard();
        assertEquals(OperatorKind.BOOLEAN, registry.require(OperatorRegistry.XOR).kind());
        assertEquals(OperatorKind.MODAL, registry.require(OperatorRegistry.POSSIBLY).kind());
        assertEquals(OperatorKind.TEMPORAL, registry.require(OperatorRegistry.UNTIL).kind());
        assertEquals(OperatorKind.COMPARISON, registry.require(OperatorRegistry.GE).kind());
    }

    @Test
    public void truthTablesOfBinaryConnectives() {
        OperatorRegistry registry = OperatorRegistry.standard();
        Operator implies = registry.require(OperatorRegistry.IMPLIES);
        assertFalse(implies.applyTruth(List.of(true, false)));
        assertTrue(implies.applyTruth(List.of(false, false)));

        Operator nor = registry.require(OperatorRegistry.NOR);
        assertTrue(nor.applyTruth(List.of(false, false)));
        assertFalse(nor.applyTruth(List.of(true, false)));

        Operator iff = registry.require(OperatorRegistry.IFF);
        assertTrue(iff.applyTruth(List.of(false, false)));
    }

    @Test
    public void naryConnectivesFoldOverOperands() {
        OperatorRegistry registry = OperatorRegistry.standard();
        assertFalse(registry.require(OperatorRegistry.ANDN).applyTruth(List.of(true, true, false)));
        assertTrue(registry.require(OperatorRegistry.ORN).applyTruth(List.of(false, false, true)));
        assertTrue(registry.require(OperatorRegistry.NANDN).applyTruth(List.of(true, false, true)));
    }

    @Test(expected = UnknownReferenceException.class)
    public void unknownOperatorIsRejected() {
        OperatorRegistry.standard().require("SOMETIMES");
    }

    @Test
    public void customRegistryKeepsOnlyItsOperators() {
        Operator and = OperatorRegistry.standard().require(OperatorRegistry.AND);
        OperatorRegistry small = OperatorRegistry.builder().register(and).build();
        assertTrue(small.contains(and));
        assertFalse(small.find(OperatorRegistry.OR).isPresent());
    }
}
