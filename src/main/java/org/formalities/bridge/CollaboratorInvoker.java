package org.formalities.bridge;

import org.formalities.error.CollaboratorTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * INVOCATORE CON TIMEOUT - Unico punto di sospensione dell'esecuzione
 *
 * Ogni chiamata a un collaboratore esterno gira su un esecutore dedicato ed è
 * attesa al più per il timeout configurato; l'esecutore viene sempre chiuso.
 *
 * ESITI:
 * - risposta entro il timeout: restituita al chiamante
 * - timeout: {@link CollaboratorTimeoutException}, il task viene interrotto
 * - eccezione del collaboratore: rilanciata come IllegalStateException con causa
 */
public final class CollaboratorInvoker {

    private static final Logger LOGGER = Logger.getLogger(CollaboratorInvoker.class.getName());

    private final Duration timeout;

    public CollaboratorInvoker(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout deve essere positivo: " + timeout);
        }
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> T invoke(String collaborator, Callable<T> call) {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "collaborator-" + collaborator);
            thread.setDaemon(true);
            return thread;
        });

        try {
            Future<T> future = executor.submit(call);
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOGGER.finest("Risposta ricevuta da " + collaborator);
            return result;

        } catch (TimeoutException e) {
            LOGGER.warning("Timeout del collaboratore " + collaborator + " dopo " + timeout.toMillis() + " ms");
            throw new CollaboratorTimeoutException(collaborator, timeout.toMillis());
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Collaboratore " + collaborator + " fallito", e.getCause());
            throw new IllegalStateException("Collaboratore " + collaborator + " fallito: "
                    + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Attesa del collaboratore " + collaborator + " interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
