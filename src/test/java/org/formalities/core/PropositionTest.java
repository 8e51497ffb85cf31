package org.formalities.core;

import org.formalities.error.ArityMismatchException;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PropositionTest {

    private final OperatorRegistry operators = OperatorRegistry.standard();
    private final AtomicProposition p = AtomicProposition.named("p");
    private final AtomicProposition q = AtomicProposition.named("q");

    @Test
    public void structurallyEqualPropositionsShareHash() {
        Proposition first = CompoundProposition.of(operators.require(OperatorRegistry.AND), p, q);
        Proposition second = CompoundProposition.of(operators.require(OperatorRegistry.AND),
                AtomicProposition.named("p"), AtomicProposition.named("q"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        Set<Proposition> set = new HashSet<>(List.of(first, second));
        assertEquals(1, set.size());
    }

    @Test
    public void operandOrderMatters() {
        Operator and = operators.require(OperatorRegistry.AND);
        assertNotEquals(CompoundProposition.of(and, p, q), CompoundProposition.of(and, q, p));
    }

    @Test(expected = ArityMismatchException.class)
    public void unaryOperatorRejectsTwoOperands() {
        CompoundProposition.of(operators.require(OperatorRegistry.NOT), p, q);
    }

    @Test
    public void binaryOperatorRejectsThreeOperands() {
        try {
            CompoundProposition.of(operators.require(OperatorRegistry.IMPLIES), p, q, p);
            fail("arità non controllata");
        } catch (ArityMismatchException e) {
            assertTrue(e.getMessage().contains("IMPLIES"));
        }
    }

    @Test
    public void naryOperatorAcceptsManyOperands() {
        Proposition all = CompoundProposition.of(operators.require(OperatorRegistry.ANDN),
                p, q, AtomicProposition.named("r"));
        assertEquals("∧(p, q, r)", all.toCanonicalString());
        assertEquals(2, all.depth());
    }

    @Test
    public void canonicalRenderingOfConnectives() {
        Proposition implication = CompoundProposition.of(operators.require(OperatorRegistry.IMPLIES), p, q);
        assertEquals("(p → q)", implication.toCanonicalString());
        assertEquals("¬(p → q)", implication.negate().toCanonicalString());
        assertEquals("□p", CompoundProposition.of(operators.require(OperatorRegistry.NECESSARILY), p)
                .toCanonicalString());
        assertEquals("ALWAYS p", CompoundProposition.of(operators.require(OperatorRegistry.ALWAYS), p)
                .toCanonicalString());
    }

    @Test
    public void evaluationIsIdempotent() {
        Proposition formula = CompoundProposition.of(operators.require(OperatorRegistry.OR), p, q.negate());
        EvaluationContext context = EvaluationContext.builder().bind("p", false).bind("q", false).build();

        Evaluation first = formula.evaluate(context);
        Evaluation second = formula.evaluate(context);
        assertEquals(first, second);
        assertTrue(first.truthValue());
    }

    @Test
    public void unboundAtomPropagates() {
        Proposition formula = CompoundProposition.of(operators.require(OperatorRegistry.AND), p, q);
        Evaluation result = formula.evaluate(EvaluationContext.builder().bind("p", true).build());
        assertEquals(Evaluation.Kind.UNBOUND, result.kind());
        assertFalse(result.isDefinite());
    }

    @Test
    public void modalOperatorIsNotTruthFunctional() {
        Proposition boxed = CompoundProposition.of(operators.require(OperatorRegistry.NECESSARILY), p);
        Evaluation result = boxed.evaluate(EvaluationContext.builder().bind("p", true).build());
        assertEquals(Evaluation.Kind.FAILED, result.kind());
    }

    @Test
    public void numericComputationRunsOnce() {
        AtomicInteger calls = new AtomicInteger();
        NumericProposition x = NumericProposition.named("x", () -> {
            calls.incrementAndGet();
            return 4.0;
        });
        NumericProposition sum = x.plus(NumericProposition.constant(3));

        assertFalse(x.isComputed());
        assertEquals(7.0, sum.evaluate(EvaluationContext.empty()).numberValue(), 0.0);
        assertEquals(7.0, sum.evaluate(EvaluationContext.empty()).numberValue(), 0.0);
        assertEquals(1, calls.get());
        assertTrue(x.isComputed());
    }

    @Test
    public void comparisonEvaluatesNumbers() {
        NumericProposition three = NumericProposition.constant(3);
        NumericProposition two = NumericProposition.constant(2);

        assertTrue(three.gt(two).evaluate(EvaluationContext.empty()).truthValue());
        assertFalse(three.le(two).evaluate(EvaluationContext.empty()).truthValue());
        assertEquals("(3 > 2)", three.gt(two).toCanonicalString());
    }

    @Test
    public void divisionByZeroFailsWithoutThrowing() {
        NumericProposition broken = NumericProposition.constant(1).dividedBy(NumericProposition.constant(0));
        Evaluation result = broken.evaluate(EvaluationContext.empty());
        assertEquals(Evaluation.Kind.FAILED, result.kind());
        assertTrue(result.reason().contains("divisione per zero"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void comparisonRejectsBooleanOperands() {
        CompoundProposition.of(operators.require(OperatorRegistry.GT), p, q);
    }

    @Test
    public void atomsAndComplement() {
        Proposition formula = CompoundProposition.of(operators.require(OperatorRegistry.IMPLIES), p, q.negate());
        assertEquals(Set.of(p, q), formula.atoms());

        assertEquals(p.negate(), Propositions.complement(p));
        assertEquals(p, Propositions.complement(p.negate()));
        assertSame(p, p.negate().negatedOperand());
        assertNull(formula.negatedOperand());
    }

    @Test
    public void constantsCarryFixedValues() {
        assertSame(AtomicProposition.TRUE, AtomicProposition.constant(true));
        assertTrue(AtomicProposition.TRUE.evaluate(EvaluationContext.empty()).truthValue());
        assertFalse(AtomicProposition.FALSE.evaluate(EvaluationContext.empty()).truthValue());
    }
}
