package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;
import org.formalities.error.InvalidDefinitionException;
import org.formalities.error.UnknownReferenceException;
import org.formalities.fall.ast.RuleDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TABELLE DEI SIMBOLI - Definizioni per nome, una tabella per spazio dei nomi
 *
 * La ridefinizione di un nome nello stesso spazio è un errore di definizione;
 * lo stesso nome in spazi diversi è ammesso ma rende ambigua una QUERY sul nome nudo.
 */
public final class SymbolTable {

    private static final Logger LOGGER = Logger.getLogger(SymbolTable.class.getName());

    public static final String RULES = "RULE";
    public static final String AXIOMS = "AXIOM";
    public static final String PROPOSITIONS = "PROPOSITION";

    private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();
    private final Map<String, Axiom> axioms = new LinkedHashMap<>();
    private final Map<String, Proposition> propositions = new LinkedHashMap<>();

    void defineRule(RuleDefinition rule) {
        checkFree(rules, RULES, rule.name());
        rules.put(rule.name(), rule);
        LOGGER.fine("Regola definita: " + rule.name());
    }

    void defineAxiom(Axiom axiom) {
        checkFree(axioms, AXIOMS, axiom.name());
        axioms.put(axiom.name(), axiom);
        LOGGER.fine("Assioma definito: " + axiom.describe());
    }

    void defineProposition(String name, Proposition proposition) {
        checkFree(propositions, PROPOSITIONS, name);
        propositions.put(name, proposition);
        LOGGER.fine("Proposizione definita: " + name);
    }

    private static void checkFree(Map<String, ?> table, String namespace, String name) {
        if (table.containsKey(name)) {
            throw new InvalidDefinitionException(namespace + " '" + name + "' già definito");
        }
    }

    public Optional<RuleDefinition> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public Optional<Axiom> axiom(String name) {
        return Optional.ofNullable(axioms.get(name));
    }

    public Axiom requireAxiom(String name) {
        Axiom axiom = axioms.get(name);
        if (axiom == null) {
            throw new UnknownReferenceException(name, "Assioma non definito: " + name);
        }
        return axiom;
    }

    public Optional<Proposition> proposition(String name) {
        return Optional.ofNullable(propositions.get(name));
    }

    public Proposition requireProposition(String name) {
        Proposition proposition = propositions.get(name);
        if (proposition == null) {
            throw new UnknownReferenceException(name, "Proposizione non definita: " + name);
        }
        return proposition;
    }

    public boolean isProposition(String name) {
        return propositions.containsKey(name);
    }

    public Collection<RuleDefinition> rules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    public Collection<Axiom> axioms() {
        return Collections.unmodifiableCollection(axioms.values());
    }

    /**
     * Spazi dei nomi in cui il nome è registrato, in ordine fisso.
     */
    public List<String> namespacesOf(String name) {
        List<String> namespaces = new ArrayList<>();
        if (rules.containsKey(name)) namespaces.add(RULES);
        if (axioms.containsKey(name)) namespaces.add(AXIOMS);
        if (propositions.containsKey(name)) namespaces.add(PROPOSITIONS);
        return namespaces;
    }
}
