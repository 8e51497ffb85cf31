package org.formalities.fall.interpreter;

import org.formalities.error.LexicalException;
import org.formalities.error.SyntaxException;
import org.formalities.fall.ast.Program;
import org.formalities.fall.lexer.Tokenizer;
import org.formalities.fall.parser.ProgramParser;

import java.util.logging.Logger;

/**
 * PIPELINE FALL - Sorgente → token → AST → esecuzione
 *
 * Errori lessicali e sintattici arrestano l'intero programma prima di eseguire
 * qualunque istruzione. Ogni chiamata a {@link #execute} usa un interprete nuovo:
 * esecuzioni distinte non condividono stato.
 */
public final class FallRuntime {

    private static final Logger LOGGER = Logger.getLogger(FallRuntime.class.getName());

    private final InterpreterOptions options;
    private final ProgramParser parser = new ProgramParser();

    public FallRuntime(InterpreterOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Opzioni interprete non possono essere null");
        }
        this.options = options;
    }

    public FallRuntime() {
        this(InterpreterOptions.defaults());
    }

    public RunReport execute(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Sorgente FALL non può essere null");
        }
        FallInterpreter interpreter = new FallInterpreter(options);

        Program program;
        try {
            program = parser.parse(Tokenizer.tokenize(source));
        } catch (LexicalException | SyntaxException e) {
            return interpreter.halt(e);
        }

        LOGGER.fine("Programma analizzato: " + program.size() + " istruzioni");
        return interpreter.run(program);
    }

    public InterpreterOptions options() {
        return options;
    }
}
