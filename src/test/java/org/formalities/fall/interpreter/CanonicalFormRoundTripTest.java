package org.formalities.fall.interpreter;

import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.fall.parser.ProgramParser;
import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.assertEquals;

public class CanonicalFormRoundTripTest {

    private static final Set<String> ATOMS = Set.of("p", "q", "r");

    private final ProgramParser parser = new ProgramParser();
    private final ExpressionResolver resolver = new ExpressionResolver(new SymbolTable(), OperatorRegistry.standard());

    private Proposition read(String source) {
        return resolver.resolvePattern(parser.parseExpression(source), ATOMS);
    }

    private void assertRoundTrip(String source) {
        Proposition original = read(source);
        String canonical = original.toCanonicalString();
        assertEquals(canonical, original, read(canonical));
    }

    @Test
    public void booleanConnectives() {
        assertRoundTrip("p AND q OR NOT r");
        assertRoundTrip("p -> q <-> r");
        assertRoundTrip("p XOR q NAND r");
        assertRoundTrip("NOT NOT p NOR TRUE");
        assertRoundTrip("(p IMPLIES q) IMPLIES FALSE");
    }

    @Test
    public void naryConnectives() {
        assertRoundTrip("AND(p, q, r)");
        assertRoundTrip("NOR(p, q AND r, NOT p)");
        assertRoundTrip("↑(p, q)");
    }

    @Test
    public void modalAndTemporalOperators() {
        assertRoundTrip("NECESSARILY p -> POSSIBLY p");
        assertRoundTrip("ALWAYS (p UNTIL q)");
        assertRoundTrip("NOT EVENTUALLY NOT r");
    }

    @Test
    public void canonicalFormIsStable() {
        String canonical = read("p AND (q OR r)").toCanonicalString();
        assertEquals("(p ∧ (q ∨ r))", canonical);
        assertEquals(canonical, read(canonical).toCanonicalString());
    }
}
