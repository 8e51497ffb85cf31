package org.formalities.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Utility di attraversamento degli alberi di proposizioni.
 */
public final class Propositions {

    private Propositions() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Visita in pre-ordine ogni nodo dell'albero, radice compresa.
     */
    public static void walk(Proposition root, Consumer<Proposition> visitor) {
        visitor.accept(root);
        if (root instanceof CompoundProposition) {
            for (Proposition operand : ((CompoundProposition) root).components()) {
                walk(operand, visitor);
            }
        }
    }

    /**
     * @return operatori usati nell'albero, in ordine di visita e con ripetizioni
     */
    public static List<Operator> operators(Proposition root) {
        List<Operator> operators = new ArrayList<>();
        walk(root, node -> {
            if (node instanceof CompoundProposition) {
                operators.add(((CompoundProposition) node).operator());
            }
        });
        return operators;
    }

    /**
     * Vero se il nodo è una composta il cui operatore ha il nome indicato.
     */
    public static boolean hasOperator(Proposition node, String... names) {
        if (!(node instanceof CompoundProposition)) {
            return false;
        }
        String actual = ((CompoundProposition) node).operator().name();
        for (String name : names) {
            if (name.equals(actual)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Complemento sintattico: X per ¬X, altrimenti ¬X.
     */
    public static Proposition complement(Proposition proposition) {
        return proposition.isNegation() ? proposition.negatedOperand() : proposition.negate();
    }
}
