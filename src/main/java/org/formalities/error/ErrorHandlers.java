package org.formalities.error;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TABELLA DI DISPATCH ERRORI - Associazione esplicita categoria -> gestore
 *
 * La tabella è costruita una volta e consultata per categoria: nessun dispatch
 * basato su stringhe o sul tipo concreto dell'eccezione.
 *
 * GESTORI STANDARD:
 * - LEXICAL, SYNTAX: HALT, con posizione e token attesi
 * - UNJUSTIFIED_INFERENCE: CONTINUE, con la premessa o lo slot mancante
 * - FRAMEWORK_INCOMPATIBLE: CONTINUE, con le diagnostiche della validazione
 * - TIMEOUT, AMBIGUOUS_QUERY, e restanti: CONTINUE
 */
public final class ErrorHandlers {

    private static final Logger LOGGER = Logger.getLogger(ErrorHandlers.class.getName());

    private final Map<ErrorKind, ErrorHandler> table;

    private ErrorHandlers(Map<ErrorKind, ErrorHandler> table) {
        for (ErrorKind kind : ErrorKind.values()) {
            if (!table.containsKey(kind)) {
                throw new IllegalStateException("Nessun gestore registrato per " + kind);
            }
        }
        this.table = new EnumMap<>(table);
    }

    /**
     * Costruisce la tabella standard con un gestore per ogni categoria.
     */
    public static ErrorHandlers standard() {
        Map<ErrorKind, ErrorHandler> table = new EnumMap<>(ErrorKind.class);

        table.put(ErrorKind.LEXICAL, (e, construct, prior) -> {
            LexicalException lex = (LexicalException) e;
            return report(e, ErrorPolicy.HALT, construct, prior,
                    "testo '" + lex.offendingText() + "' a " + lex.position());
        });
        table.put(ErrorKind.SYNTAX, (e, construct, prior) -> {
            SyntaxException syn = (SyntaxException) e;
            String detail = "token '" + syn.offendingToken() + "' a " + syn.position()
                    + (syn.expected() != null ? ", atteso " + syn.expected() : "")
                    + (syn.construct() != null ? " in " + syn.construct() : "");
            return report(e, ErrorPolicy.HALT, construct, prior, detail);
        });
        table.put(ErrorKind.UNJUSTIFIED_INFERENCE, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior,
                        "premessa non giustificata: " + ((UnjustifiedInferenceException) e).missing()));
        table.put(ErrorKind.FRAMEWORK_INCOMPATIBLE, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior,
                        String.join("; ", ((FrameworkIncompatibleException) e).diagnostics())));
        table.put(ErrorKind.TIMEOUT, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior,
                        "collaboratore " + ((CollaboratorTimeoutException) e).collaborator()));
        table.put(ErrorKind.AMBIGUOUS_QUERY, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior,
                        "candidati " + ((AmbiguousQueryException) e).candidates()));
        table.put(ErrorKind.UNKNOWN_REFERENCE, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior,
                        "nome '" + ((UnknownReferenceException) e).name() + "'"));
        table.put(ErrorKind.ARITY_MISMATCH, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior, null));
        table.put(ErrorKind.INVALID_DEFINITION, (e, construct, prior) ->
                report(e, ErrorPolicy.CONTINUE, construct, prior, null));

        return new ErrorHandlers(table);
    }

    private static ErrorReport report(FallException e, ErrorPolicy policy, String construct,
                                      String prior, String detail) {
        return new ErrorReport(e.kind(), policy, e.getMessage(), construct, prior, detail);
    }

    /**
     * Instrada l'errore al gestore della sua categoria.
     */
    public ErrorReport dispatch(FallException error, String construct, String priorState) {
        ErrorReport report = table.get(error.kind()).handle(error, construct, priorState);
        LOGGER.fine("Errore instradato: " + report);
        return report;
    }

    public ErrorPolicy policyOf(ErrorKind kind) {
        return kind.isFatal() ? ErrorPolicy.HALT : ErrorPolicy.CONTINUE;
    }
}
