package org.formalities.error;

import java.util.List;

/**
 * Il nome interrogato corrisponde a più entità registrate in tabelle distinte.
 */
public class AmbiguousQueryException extends FallException {

    private final List<String> candidates;

    public AmbiguousQueryException(String name, List<String> candidates) {
        super(ErrorKind.AMBIGUOUS_QUERY, "Nome ambiguo '" + name + "': registrato come " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    public List<String> candidates() {
        return candidates;
    }
}
