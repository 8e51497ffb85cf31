package org.formalities.error;

import java.util.Objects;

/**
 * REPORT DI ERRORE - Descrizione immutabile di un errore per l'utente
 *
 * CONTENUTO:
 * - categoria e politica di propagazione
 * - costrutto incriminato
 * - ultimo stato valido (snapshot della prova o del contesto)
 * - dettaglio specifico (premessa mancante, token atteso, diagnostiche)
 */
public final class ErrorReport {

    private final ErrorKind kind;
    private final ErrorPolicy policy;
    private final String message;
    private final String construct;
    private final String priorState;
    private final String detail;

    public ErrorReport(ErrorKind kind, ErrorPolicy policy, String message,
                       String construct, String priorState, String detail) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.message = message != null ? message : "";
        this.construct = construct != null ? construct : "";
        this.priorState = priorState != null ? priorState : "";
        this.detail = detail != null ? detail : "";
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorPolicy policy() {
        return policy;
    }

    public String message() {
        return message;
    }

    public String construct() {
        return construct;
    }

    public String priorState() {
        return priorState;
    }

    public String detail() {
        return detail;
    }

    public boolean isHalting() {
        return policy == ErrorPolicy.HALT;
    }

    /**
     * Rendering multilinea per console e log.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(kind).append("] ").append(message).append("\n");
        if (!construct.isEmpty()) {
            sb.append("  costrutto: ").append(construct).append("\n");
        }
        if (!detail.isEmpty()) {
            sb.append("  dettaglio: ").append(detail).append("\n");
        }
        if (!priorState.isEmpty()) {
            sb.append("  ultimo stato valido: ").append(priorState).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
