package org.formalities.framework;

import org.formalities.bridge.CollaboratorInvoker;
import org.formalities.bridge.ExternalValidator;
import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;
import org.formalities.error.ErrorKind;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ValidationEngineTest {

    private final OperatorRegistry operators = OperatorRegistry.standard();
    private final ValidationEngine engine = ValidationEngine.standard();
    private final AtomicProposition p = AtomicProposition.named("p");

    @Test
    public void pipelineRunsInFixedStageOrder() {
        List<ValidationStrategy> pipeline = engine.pipeline();
        assertEquals(3, pipeline.size());
        assertEquals(ValidationStage.SYNTACTIC, pipeline.get(0).stage());
        assertEquals(ValidationStage.LOGICAL_CONSISTENCY, pipeline.get(1).stage());
        assertEquals(ValidationStage.FRAMEWORK_LAWS, pipeline.get(2).stage());
    }

    @Test
    public void contradictionIsRejectedUnderClassicalLogic() {
        ValidationResult result = engine.validate(p.negate(),
                ValidationContext.of(StandardFrameworks.classical(), Set.of(p)));

        assertFalse(result.isValid());
        assertEquals(Law.NON_CONTRADICTION, result.errors().get(0).law());
        assertEquals(ErrorKind.FRAMEWORK_INCOMPATIBLE, result.errors().get(0).errorKind());
    }

    @Test
    public void contradictionIsFlaggedUnderParaconsistentLogic() {
        ValidationResult result = engine.validate(p.negate(),
                ValidationContext.of(StandardFrameworks.paraconsistent(), Set.of(p)));

        assertTrue(result.isValid());
        assertTrue(result.isFlagged());
        assertEquals(Severity.FLAGGED, result.flags().get(0).severity());
    }

    @Test
    public void validationIsDeterministic() {
        Proposition candidate = p.negate();
        ValidationContext context = ValidationContext.of(StandardFrameworks.classical(), Set.of(p));
        assertEquals(engine.validate(candidate, context).diagnostics(),
                engine.validate(candidate, context).diagnostics());
    }

    @Test
    public void modalOperatorRejectedOutsideModalFramework() {
        Proposition boxed = CompoundProposition.of(operators.require(OperatorRegistry.NECESSARILY), p);

        assertFalse(engine.validate(boxed, StandardFrameworks.classical()).isValid());
        assertTrue(engine.validate(boxed, StandardFrameworks.modal()).isValid());
    }

    @Test
    public void internalContradictionInConjunction() {
        Proposition both = CompoundProposition.of(operators.require(OperatorRegistry.AND), p, p.negate());

        assertFalse(engine.validate(both, StandardFrameworks.classical()).isValid());
        assertTrue(engine.validate(both, StandardFrameworks.paraconsistent()).isFlagged());
    }

    @Test
    public void excludedMiddleIsFlaggedInIntuitionisticLogic() {
        Proposition middle = CompoundProposition.of(operators.require(OperatorRegistry.OR), p, p.negate());

        assertTrue(engine.validate(middle, StandardFrameworks.classical()).diagnostics().isEmpty());
        ValidationResult result = engine.validate(middle, StandardFrameworks.intuitionistic());
        assertTrue(result.isFlagged());
        assertEquals(Law.EXCLUDED_MIDDLE, result.flags().get(0).law());
    }

    @Test
    public void depthLimitIsEnforced() {
        ValidationEngine shallow = ValidationEngine.standard(operators, 2, null, null);
        Proposition deep = p.negate().negate().negate();
        assertFalse(shallow.validate(deep, StandardFrameworks.classical()).isValid());
    }

    @Test
    public void frameworkCompatibility() {
        assertFalse(engine.isCompatible(StandardFrameworks.classical(), StandardFrameworks.paraconsistent()));
        assertFalse(engine.isCompatible(StandardFrameworks.intuitionistic(), StandardFrameworks.modal()));
        assertTrue(engine.isCompatible(StandardFrameworks.classical(), StandardFrameworks.modal()));
        assertTrue(engine.isCompatible(StandardFrameworks.classical(), StandardFrameworks.classical()));
    }

    @Test
    public void combinedValidationAcrossFrameworks() {
        ValidationResult result = engine.validateAll(p.negate(),
                List.of(StandardFrameworks.paraconsistent(), StandardFrameworks.classical()), Set.of(p));
        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals(1, result.flags().size());
    }

    @Test
    public void slowExternalValidatorBecomesTimeoutDiagnostic() {
        ExternalValidator slow = new ExternalValidator() {
            @Override
            public String name() {
                return "lento";
            }

            @Override
            public ValidationResult check(Proposition proposition, String checkKind) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ValidationResult.passed(proposition.toCanonicalString(), "esterno");
            }
        };
        ValidationEngine withExternal = ValidationEngine.standard(operators, SyntacticStrategy.DEFAULT_MAX_DEPTH,
                slow, new CollaboratorInvoker(Duration.ofMillis(50)));

        ValidationResult result = withExternal.validate(p, StandardFrameworks.classical());
        assertTrue(result.hasTimeout());
        assertFalse(result.isValid());
    }

    @Test
    public void failingStrategyBecomesDiagnostic() {
        ValidationStrategy broken = new ValidationStrategy() {
            @Override
            public String name() {
                return "rotta";
            }

            @Override
            public ValidationStage stage() {
                return ValidationStage.SYNTACTIC;
            }

            @Override
            public List<Diagnostic> check(Proposition candidate, ValidationContext context) {
                throw new IllegalStateException("guasto");
            }
        };
        ValidationResult result = new ValidationEngine(List.of(broken)).validate(p, StandardFrameworks.classical());
        assertFalse(result.isValid());
        assertTrue(result.errors().get(0).message().contains("guasto"));
    }
}
