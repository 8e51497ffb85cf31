package org.formalities.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * PROPOSIZIONE - Entità logica valutabile in un contesto
 *
 * Tipo chiuso sulle varianti di {@link PropositionKind}: atomica, composta, numerica.
 * Le sottoclassi sono finali e vivono in questo package; l'estensione avviene
 * aggiungendo una variante qui, non derivando liberamente.
 *
 * L'uguaglianza è strutturale: proposizioni logicamente equivalenti ma
 * strutturalmente diverse restano distinte. L'equivalenza semantica è
 * una questione di framework.
 */
public abstract class Proposition implements LogicEntity {

    Proposition() {
    }

    public abstract PropositionKind kind();

    /**
     * Valuta la proposizione. L'esito è sempre definito: UNBOUND o FAILED
     * al posto di valori indefiniti.
     */
    public abstract Evaluation evaluate(EvaluationContext context);

    /**
     * Raccoglie le proposizioni atomiche e numeriche foglia in ordine di apparizione.
     */
    public final Set<Proposition> atoms() {
        Set<Proposition> atoms = new LinkedHashSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    abstract void collectAtoms(Set<Proposition> into);

    /**
     * Profondità dell'albero: 1 per le foglie.
     */
    public abstract int depth();

    /**
     * Costruisce ¬this con l'operatore NOT del registro standard.
     */
    public Proposition negate() {
        return CompoundProposition.of(OperatorRegistry.standard().require(OperatorRegistry.NOT), this);
    }

    /**
     * @return l'operando se this è una negazione, altrimenti null
     */
    public Proposition negatedOperand() {
        return null;
    }

    public boolean isNegation() {
        return negatedOperand() != null;
    }

    @Override
    public LogicType logicType() {
        return LogicType.PROPOSITION;
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
