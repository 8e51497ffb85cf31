package org.formalities.bridge;

import org.formalities.error.CollaboratorTimeoutException;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CollaboratorInvokerTest {

    @Test
    public void fastCallReturnsItsResult() {
        CollaboratorInvoker invoker = new CollaboratorInvoker(Duration.ofSeconds(2));
        assertEquals("pronto", invoker.invoke("veloce", () -> "pronto"));
    }

    @Test
    public void slowCallTimesOut() {
        CollaboratorInvoker invoker = new CollaboratorInvoker(Duration.ofMillis(50));
        try {
            invoker.invoke("lento", () -> {
                Thread.sleep(2000);
                return "troppo tardi";
            });
            fail("timeout non rilevato");
        } catch (CollaboratorTimeoutException e) {
            assertEquals("lento", e.collaborator());
            assertEquals(50, e.timeoutMillis());
        }
    }

    @Test
    public void collaboratorFailureIsWrapped() {
        CollaboratorInvoker invoker = new CollaboratorInvoker(Duration.ofSeconds(2));
        try {
            invoker.invoke("rotto", () -> {
                throw new IllegalArgumentException("input non valido");
            });
            fail("eccezione del collaboratore persa");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("input non valido"));
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroTimeoutIsRejected() {
        new CollaboratorInvoker(Duration.ZERO);
    }
}
