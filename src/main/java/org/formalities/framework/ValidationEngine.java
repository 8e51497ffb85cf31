package org.formalities.framework;

import org.formalities.bridge.CollaboratorInvoker;
import org.formalities.bridge.ExternalValidator;
import org.formalities.core.OperatorRegistry;
import org.formalities.core.Proposition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE DI VALIDAZIONE - Pipeline fissa di strategie componibili
 *
 * PIPELINE:
 * 1. SYNTACTIC: buona formazione
 * 2. LOGICAL_CONSISTENCY: confronto con il contesto asserito
 * 3. FRAMEWORK_LAWS: leggi e operatori del framework
 * 4. EXTERNAL: validatore esterno opzionale, con timeout
 *
 * Ogni strategia viene sempre eseguita, nello stesso ordine: le diagnostiche sono
 * riproducibili a parità di input. Un'eccezione di una strategia diventa diagnostica.
 */
public final class ValidationEngine {

    private static final Logger LOGGER = Logger.getLogger(ValidationEngine.class.getName());

    private final List<ValidationStrategy> pipeline;

    public ValidationEngine(List<ValidationStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("Pipeline di validazione vuota");
        }
        List<ValidationStrategy> ordered = new ArrayList<>(strategies);
        // ordinamento stabile: a parità di fase resta l'ordine di dichiarazione
        ordered.sort(Comparator.comparing(ValidationStrategy::stage));
        this.pipeline = List.copyOf(ordered);
    }

    /**
     * Pipeline standard sul registro operatori condiviso.
     */
    public static ValidationEngine standard() {
        return standard(OperatorRegistry.standard(), SyntacticStrategy.DEFAULT_MAX_DEPTH, null, null);
    }

    /**
     * @param externalValidator validatore esterno opzionale (null per escluderlo)
     * @param invoker invocatore con timeout, richiesto se c'è un validatore esterno
     */
    public static ValidationEngine standard(OperatorRegistry operators, int maxDepth,
                                            ExternalValidator externalValidator, CollaboratorInvoker invoker) {
        List<ValidationStrategy> strategies = new ArrayList<>();
        strategies.add(new SyntacticStrategy(operators, maxDepth));
        strategies.add(new LogicalConsistencyStrategy());
        strategies.add(new FrameworkLawStrategy());
        if (externalValidator != null) {
            if (invoker == null) {
                throw new IllegalArgumentException("Validatore esterno senza invocatore con timeout");
            }
            strategies.add(new ExternalValidationStrategy(externalValidator, invoker, "consistency"));
        }
        return new ValidationEngine(strategies);
    }

    public ValidationResult validate(Proposition proposition, Framework framework) {
        return validate(proposition, ValidationContext.of(framework));
    }

    public ValidationResult validate(Proposition proposition, ValidationContext context) {
        String subject = proposition != null ? proposition.toCanonicalString() : "<null>";
        LOGGER.fine("Validazione di " + subject + " sotto " + context.framework().id());

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ValidationStrategy strategy : pipeline) {
            try {
                List<Diagnostic> produced = strategy.check(proposition, context);
                diagnostics.addAll(produced);
                LOGGER.finest("Strategia " + strategy.name() + ": " + produced.size() + " diagnostiche");
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Strategia " + strategy.name() + " fallita su " + subject, e);
                diagnostics.add(Diagnostic.crashed(strategy, e));
            }
        }

        ValidationResult result = new ValidationResult(subject, context.framework().id(), diagnostics);
        LOGGER.fine("Esito validazione: " + result);
        return result;
    }

    /**
     * Valida sotto più framework applicati simultaneamente: il risultato combina le diagnostiche.
     */
    public ValidationResult validateAll(Proposition proposition, Collection<Framework> frameworks,
                                        Collection<? extends Proposition> asserted) {
        ValidationResult combined = null;
        for (Framework framework : frameworks) {
            ValidationResult single = validate(proposition, ValidationContext.of(framework, asserted));
            combined = combined == null ? single : combined.combinedWith(single);
        }
        if (combined == null) {
            throw new IllegalArgumentException("Nessun framework attivo per la validazione");
        }
        return combined;
    }

    /**
     * Due framework sono incompatibili se uno impone una legge che l'altro rifiuta.
     */
    public boolean isCompatible(Framework a, Framework b) {
        for (Law law : a.laws()) {
            if (b.rejects(law)) return false;
        }
        for (Law law : b.laws()) {
            if (a.rejects(law)) return false;
        }
        return true;
    }

    public Set<Law> lawsOf(Framework framework) {
        return framework.laws().isEmpty() ? EnumSet.noneOf(Law.class) : EnumSet.copyOf(framework.laws());
    }

    public List<ValidationStrategy> pipeline() {
        return pipeline;
    }
}
