package org.formalities.bridge;

import org.formalities.core.Proposition;
import org.formalities.framework.ValidationResult;

/**
 * Strumento esterno di validazione: riceve proposizione e tipo di controllo,
 * risponde con un risultato nella stessa forma della pipeline interna.
 */
public interface ExternalValidator {

    String name();

    ValidationResult check(Proposition proposition, String checkKind);
}
