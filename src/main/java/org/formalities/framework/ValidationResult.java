package org.formalities.framework;

import org.formalities.error.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RISULTATO DI VALIDAZIONE - Esito completo della pipeline per una proposizione
 *
 * Valida se nessuna diagnostica ha gravità ERROR. Le diagnostiche FLAGGED
 * non invalidano ma restano visibili (contraddizione accettata, terzo escluso segnalato).
 */
public final class ValidationResult {

    private final String subject;
    private final String frameworkId;
    private final List<Diagnostic> diagnostics;

    public ValidationResult(String subject, String frameworkId, List<Diagnostic> diagnostics) {
        this.subject = subject;
        this.frameworkId = frameworkId;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static ValidationResult passed(String subject, String frameworkId) {
        return new ValidationResult(subject, frameworkId, List.of());
    }

    public boolean isValid() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    /**
     * @return true se valida ma con almeno una segnalazione
     */
    public boolean isFlagged() {
        return isValid() && !diagnostics.isEmpty();
    }

    public boolean hasTimeout() {
        return diagnostics.stream().anyMatch(d -> d.errorKind() == ErrorKind.TIMEOUT);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public List<Diagnostic> flags() {
        return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.toList());
    }

    public String subject() {
        return subject;
    }

    public String frameworkId() {
        return frameworkId;
    }

    /**
     * Combina i risultati ottenuti sotto più framework applicati insieme.
     */
    public ValidationResult combinedWith(ValidationResult other) {
        List<Diagnostic> merged = new ArrayList<>(diagnostics);
        other.diagnostics.stream().filter(d -> !merged.contains(d)).forEach(merged::add);
        return new ValidationResult(subject, frameworkId + "+" + other.frameworkId, merged);
    }

    @Override
    public String toString() {
        String outcome = isValid() ? (isFlagged() ? "VALIDA (segnalata)" : "VALIDA") : "NON VALIDA";
        return outcome + " [" + frameworkId + "] " + subject + (diagnostics.isEmpty() ? "" : " " + messages());
    }
}
