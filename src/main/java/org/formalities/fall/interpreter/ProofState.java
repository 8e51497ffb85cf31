package org.formalities.fall.interpreter;

import org.formalities.core.Proposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * STATO DI PROVA - Memoria di lavoro di un blocco BEGIN PROOF ... END PROOF
 *
 * Collezione ordinata per inserimento di proposizioni stabilite, ciascuna con la
 * propria {@link Justification}. Una proposizione entra solo se tutte le premesse
 * citate dalla giustificazione sono già presenti.
 *
 * Solo l'esecutore modifica lo stato ({@link #establish} è di pacchetto); a fine
 * blocco lo stato viene esportato in sola lettura per le QUERY successive.
 */
public final class ProofState {

    private static final Logger LOGGER = Logger.getLogger(ProofState.class.getName());

    private final Map<Proposition, Justification> established = new LinkedHashMap<>();
    private int lastStep = 0;

    ProofState() {
    }

    /**
     * Registra una proposizione. Una premessa GIVEN può essere promossa ad
     * asserzione; ogni altra proposizione già presente mantiene la prima giustificazione.
     *
     * @return true se lo stato è cambiato
     * @throws IllegalStateException se una premessa citata non è presente
     */
    boolean establish(Proposition proposition, Justification justification) {
        for (Proposition premise : justification.premises()) {
            if (!established.containsKey(premise)) {
                throw new IllegalStateException("Premessa citata assente dallo stato: "
                        + premise.toCanonicalString());
            }
        }

        Justification current = established.get(proposition);
        if (current != null && (current.isAssertion() || !justification.isAssertion())) {
            return false;
        }

        established.put(proposition, justification);
        if (justification.step() > 0) {
            lastStep = justification.step();
        }
        LOGGER.finest("Stabilita " + proposition.toCanonicalString() + " (" + justification.describe() + ")");
        return true;
    }

    public boolean contains(Proposition proposition) {
        return established.containsKey(proposition);
    }

    public Justification justificationOf(Proposition proposition) {
        return established.get(proposition);
    }

    /** Tutte le proposizioni note, premesse comprese, in ordine di inserimento */
    public Set<Proposition> propositions() {
        return Collections.unmodifiableSet(established.keySet());
    }

    /** Proposizioni asserite o dedotte: il contesto dei controlli di consistenza */
    public Set<Proposition> asserted() {
        Set<Proposition> asserted = new LinkedHashSet<>();
        established.forEach((proposition, justification) -> {
            if (justification.isAssertion()) {
                asserted.add(proposition);
            }
        });
        return asserted;
    }

    public int size() {
        return established.size();
    }

    /** Ultimo passo completato con successo (0 se nessuno) */
    public int lastStep() {
        return lastStep;
    }

    /**
     * Catena di derivazione leggibile, una riga per proposizione.
     */
    public List<String> derivation() {
        List<String> lines = new ArrayList<>();
        established.forEach((proposition, justification) ->
                lines.add(proposition.toCanonicalString() + " : " + justification.describe()));
        return lines;
    }

    /**
     * Istantanea compatta usata come "ultimo stato valido" nei report d'errore.
     */
    public String snapshot() {
        return "passo " + lastStep + ", stabilite " + established.size() + ": "
                + String.join("; ", derivation());
    }

    @Override
    public String toString() {
        return snapshot();
    }
}
