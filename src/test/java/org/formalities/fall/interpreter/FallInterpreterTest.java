package org.formalities.fall.interpreter;

import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.error.FrameworkIncompatibleException;
import org.formalities.error.InvalidDefinitionException;
import org.formalities.error.LexicalException;
import org.formalities.fall.ast.Program;
import org.formalities.fall.lexer.SourcePosition;
import org.formalities.fall.parser.ProgramParser;
import org.formalities.framework.Feature;
import org.formalities.selection.FrameworkRequirement;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FallInterpreterTest {

    private final ProgramParser parser = new ProgramParser();

    @Test
    public void frameworkSelectedFromDeclaredRequirement() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        RunReport report = interpreter.run(parser.parse(
                "DEFINE PROPOSITION k AS \"It is necessarily raining\" "
                        + "WHERE \"modal accessibility\" IS REQUIREMENT //\n"
                        + "USING FRAMEWORK FOR k //"));

        assertTrue(report.isSuccessful());
        assertEquals(List.of("modal"), interpreter.frameworkIds());
    }

    @Test
    public void conflictingRequirementsLeaveFrameworksUnchanged() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        RunReport report = interpreter.run(parser.parse(
                "DEFINE PROPOSITION k AS \"x\" WHERE \"modal\" IS REQUIREMENT AND \"temporal\" IS REQUIREMENT //\n"
                        + "USING FRAMEWORK FOR k //"));

        assertFalse(report.result(1).isSuccess());
        assertEquals(List.of("classical"), interpreter.frameworkIds());
    }

    @Test
    public void usingFrameworkPragmaChecksCompatibility() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        RunReport report = interpreter.run(parser.parse(
                "USING FRAMEWORK classical, paraconsistent //\n"
                        + "USING FRAMEWORK classical, modal //\n"
                        + "USING FRAMEWORK nessuno //"));

        assertFalse(report.result(0).isSuccess());
        assertTrue(report.result(1).isSuccess());
        assertFalse(report.result(2).isSuccess());
        assertEquals(List.of("classical", "modal"), interpreter.frameworkIds());
    }

    @Test(expected = FrameworkIncompatibleException.class)
    public void incompatibleInitialFrameworksAreRejected() {
        new FallInterpreter(InterpreterOptions.builder()
                .initialFrameworks("classical", "paraconsistent")
                .build());
    }

    @Test
    public void compatibleInitialFrameworksAreActive() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.builder()
                .initialFrameworks("classical", "modal")
                .build());
        assertEquals(List.of("classical", "modal"), interpreter.frameworkIds());
    }

    @Test
    public void requirementCombinesTagsAndOperators() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        interpreter.run(parser.parse(
                "DEFINE PROPOSITION k AS \"x\" WHERE \"temporal ordering\" IS REQUIREMENT //"));
        Proposition k = interpreter.symbols().requireProposition("k");
        Proposition boxed = CompoundProposition.of(OperatorRegistry.standard().require(OperatorRegistry.NECESSARILY), k);

        assertEquals(FrameworkRequirement.of(Feature.TEMPORAL, Feature.MODAL), FallInterpreter.requirementOf(boxed));
    }

    @Test
    public void factsSurviveAcrossStatements() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        interpreter.run(parser.parse(
                "DEFINE PROPOSITION p AS \"Socrates runs\" WHERE \"Socrates\" IS SUBJECT //\n"
                        + "DEFINE PROPOSITION q AS \"Plato walks\" WHERE \"Plato\" IS SUBJECT //\n"
                        + "ASSERT p //\nASSERT q //"));

        assertEquals(2, interpreter.facts().size());
        assertEquals(ExecutionState.IDLE, interpreter.state());
        assertFalse(interpreter.isBridgeEnabled());
    }

    @Test
    public void builtInAxiomsAreRegistered() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        assertTrue(interpreter.symbols().axiom("ModusPonens").isPresent());
        assertTrue(interpreter.symbols().axiom("DoubleNegationElimination").isPresent());

        RunReport report = interpreter.run(parser.parse("DEFINE AXIOM ModusPonens WHERE P INFER P //"));
        assertFalse(report.result(0).isSuccess());
    }

    @Test
    public void haltedInterpreterRefusesFurtherRuns() {
        FallInterpreter interpreter = new FallInterpreter(InterpreterOptions.defaults());
        RunReport report = interpreter.halt(new LexicalException("Sequenza non riconosciuta: #", "#",
                new SourcePosition(1, 4)));

        assertTrue(report.isHalted());
        assertEquals(ExecutionState.HALTED, interpreter.state());
        assertEquals(1, interpreter.statistics().getFailures());

        try {
            interpreter.run(new Program(List.of()));
            fail("esecuzione accettata dopo l'arresto");
        } catch (IllegalStateException expected) {
            assertEquals(ExecutionState.HALTED, interpreter.state());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void haltRequiresFatalError() {
        new FallInterpreter(InterpreterOptions.defaults()).halt(new InvalidDefinitionException("no"));
    }
}
