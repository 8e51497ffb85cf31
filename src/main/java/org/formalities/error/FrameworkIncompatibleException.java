package org.formalities.error;

import java.util.List;

/**
 * Rifiuto della pipeline di validazione, oppure applicazione simultanea di framework in conflitto.
 */
public class FrameworkIncompatibleException extends FallException {

    private final List<String> diagnostics;

    public FrameworkIncompatibleException(String message, List<String> diagnostics) {
        super(ErrorKind.FRAMEWORK_INCOMPATIBLE, message);
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
