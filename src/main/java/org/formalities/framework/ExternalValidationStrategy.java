package org.formalities.framework;

import org.formalities.bridge.CollaboratorInvoker;
import org.formalities.bridge.ExternalValidator;
import org.formalities.core.Proposition;
import org.formalities.error.CollaboratorTimeoutException;

import java.util.List;

/**
 * Delega a un validatore esterno con timeout. Un timeout diventa una diagnostica TIMEOUT.
 */
public final class ExternalValidationStrategy implements ValidationStrategy {

    private final ExternalValidator validator;
    private final CollaboratorInvoker invoker;
    private final String checkKind;

    public ExternalValidationStrategy(ExternalValidator validator, CollaboratorInvoker invoker, String checkKind) {
        this.validator = validator;
        this.invoker = invoker;
        this.checkKind = checkKind;
    }

    @Override
    public String name() {
        return "external:" + validator.name();
    }

    @Override
    public ValidationStage stage() {
        return ValidationStage.EXTERNAL;
    }

    @Override
    public List<Diagnostic> check(Proposition candidate, ValidationContext context) {
        try {
            ValidationResult response = invoker.invoke(validator.name(), () -> validator.check(candidate, checkKind));
            return response != null ? response.diagnostics() : List.of();
        } catch (CollaboratorTimeoutException e) {
            return List.of(Diagnostic.timeout(this, e.getMessage()));
        }
    }
}
