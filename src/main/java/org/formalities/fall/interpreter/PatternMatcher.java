package org.formalities.fall.interpreter;

import org.formalities.core.AtomicProposition;
import org.formalities.core.CompoundProposition;
import org.formalities.core.Proposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CONFRONTO DI SCHEMI - Unificazione unidirezionale con backtracking
 *
 * ALGORITMO:
 * 1. gli slot delle premesse si assegnano in ordine
 * 2. per ogni slot si prova ogni premessa citata non ancora usata
 * 3. un legame di metavariabile già fissato deve coincidere strutturalmente
 * 4. in caso di fallimento si torna allo slot precedente
 *
 * In caso di insuccesso viene riportato lo slot più profondo non soddisfatto.
 */
final class PatternMatcher {

    private PatternMatcher() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Esito del confronto: legami e premesse nell'ordine degli slot, oppure slot fallito.
     */
    static final class Match {

        private final Map<String, Proposition> bindings;
        private final List<Proposition> premises;
        private final Proposition failedSlot;

        private Match(Map<String, Proposition> bindings, List<Proposition> premises, Proposition failedSlot) {
            this.bindings = bindings;
            this.premises = premises;
            this.failedSlot = failedSlot;
        }

        boolean succeeded() {
            return failedSlot == null;
        }

        Map<String, Proposition> bindings() {
            return bindings;
        }

        List<Proposition> premises() {
            return premises;
        }

        Proposition failedSlot() {
            return failedSlot;
        }
    }

    static Match matchSlots(List<Proposition> slots, List<Proposition> candidates, Set<String> metavariables) {
        int[] deepestFailure = {0};
        List<Proposition> assigned = new ArrayList<>(Collections.nCopies(slots.size(), null));
        Map<String, Proposition> bindings = search(slots, candidates, metavariables, 0,
                new HashMap<>(), new boolean[candidates.size()], assigned, deepestFailure);
        if (bindings != null) {
            return new Match(Map.copyOf(bindings), List.copyOf(assigned), null);
        }
        return new Match(Map.of(), List.of(), slots.get(deepestFailure[0]));
    }

    private static Map<String, Proposition> search(List<Proposition> slots, List<Proposition> candidates,
                                                   Set<String> metavariables, int slot,
                                                   Map<String, Proposition> bindings, boolean[] used,
                                                   List<Proposition> assigned, int[] deepestFailure) {
        if (slot == slots.size()) {
            return bindings;
        }
        for (int i = 0; i < candidates.size(); i++) {
            if (used[i]) {
                continue;
            }
            Map<String, Proposition> attempt = new HashMap<>(bindings);
            if (!matches(slots.get(slot), candidates.get(i), metavariables, attempt)) {
                continue;
            }
            used[i] = true;
            assigned.set(slot, candidates.get(i));
            Map<String, Proposition> result = search(slots, candidates, metavariables, slot + 1,
                    attempt, used, assigned, deepestFailure);
            if (result != null) {
                return result;
            }
            used[i] = false;
            assigned.set(slot, null);
        }
        deepestFailure[0] = Math.max(deepestFailure[0], slot);
        return null;
    }

    /**
     * Confronta uno schema con una proposizione concreta, estendendo {@code bindings}.
     */
    static boolean matches(Proposition pattern, Proposition candidate, Set<String> metavariables,
                           Map<String, Proposition> bindings) {
        if (pattern instanceof AtomicProposition
                && metavariables.contains(((AtomicProposition) pattern).symbol())) {
            String variable = ((AtomicProposition) pattern).symbol();
            Proposition bound = bindings.get(variable);
            if (bound != null) {
                return bound.equals(candidate);
            }
            bindings.put(variable, candidate);
            return true;
        }
        if (pattern instanceof CompoundProposition) {
            if (!(candidate instanceof CompoundProposition)) {
                return false;
            }
            CompoundProposition schema = (CompoundProposition) pattern;
            CompoundProposition concrete = (CompoundProposition) candidate;
            if (!schema.operator().equals(concrete.operator())
                    || schema.components().size() != concrete.components().size()) {
                return false;
            }
            for (int i = 0; i < schema.components().size(); i++) {
                if (!matches(schema.operand(i), concrete.operand(i), metavariables, bindings)) {
                    return false;
                }
            }
            return true;
        }
        return pattern.equals(candidate);
    }

    /**
     * Sostituisce le metavariabili legate; quelle libere restano atomi schema.
     */
    static Proposition instantiate(Proposition pattern, Map<String, Proposition> bindings,
                                   Set<String> metavariables) {
        if (pattern instanceof AtomicProposition
                && metavariables.contains(((AtomicProposition) pattern).symbol())) {
            return bindings.getOrDefault(((AtomicProposition) pattern).symbol(), pattern);
        }
        if (pattern instanceof CompoundProposition) {
            CompoundProposition schema = (CompoundProposition) pattern;
            List<Proposition> operands = new ArrayList<>();
            for (Proposition operand : schema.components()) {
                operands.add(instantiate(operand, bindings, metavariables));
            }
            return CompoundProposition.of(schema.operator(), operands);
        }
        return pattern;
    }
}
