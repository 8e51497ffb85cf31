package org.formalities.framework;

import org.formalities.error.ErrorKind;

import java.util.Objects;

/**
 * Esito negativo o segnalazione prodotta da una strategia di validazione.
 */
public final class Diagnostic {

    private final String strategy;
    private final ValidationStage stage;
    private final Law law;
    private final String message;
    private final Severity severity;
    private final ErrorKind errorKind;

    private Diagnostic(String strategy, ValidationStage stage, Law law, String message,
                       Severity severity, ErrorKind errorKind) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.stage = Objects.requireNonNull(stage, "stage");
        this.law = law;
        this.message = Objects.requireNonNull(message, "message");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
    }

    public static Diagnostic error(ValidationStrategy source, Law law, String message) {
        return new Diagnostic(source.name(), source.stage(), law, message,
                Severity.ERROR, ErrorKind.FRAMEWORK_INCOMPATIBLE);
    }

    public static Diagnostic flagged(ValidationStrategy source, Law law, String message) {
        return new Diagnostic(source.name(), source.stage(), law, message,
                Severity.FLAGGED, ErrorKind.FRAMEWORK_INCOMPATIBLE);
    }

    /**
     * Diagnostica con gravità dipendente dalla legge: ERROR se il framework la impone.
     */
    public static Diagnostic byLaw(ValidationStrategy source, Framework framework, Law law, String message) {
        return framework.enforces(law) ? error(source, law, message) : flagged(source, law, message);
    }

    public static Diagnostic timeout(ValidationStrategy source, String message) {
        return new Diagnostic(source.name(), source.stage(), null, message, Severity.ERROR, ErrorKind.TIMEOUT);
    }

    /**
     * Diagnostica per una strategia che ha sollevato un'eccezione.
     */
    public static Diagnostic crashed(ValidationStrategy source, RuntimeException e) {
        return new Diagnostic(source.name(), source.stage(), null,
                "strategia fallita: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                Severity.ERROR, ErrorKind.FRAMEWORK_INCOMPATIBLE);
    }

    public String strategy() {
        return strategy;
    }

    public ValidationStage stage() {
        return stage;
    }

    /** @return legge violata, null se la diagnostica non riguarda una legge */
    public Law law() {
        return law;
    }

    public String message() {
        return message;
    }

    public Severity severity() {
        return severity;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return strategy.equals(other.strategy) && stage == other.stage && law == other.law
                && message.equals(other.message) && severity == other.severity && errorKind == other.errorKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, stage, law, message, severity, errorKind);
    }

    @Override
    public String toString() {
        return "[" + severity + "/" + strategy + (law != null ? "/" + law : "") + "] " + message;
    }
}
