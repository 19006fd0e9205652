package com.folderrag.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.folderrag.error.MalformedResponseException;
import com.folderrag.error.OperationCancelledException;
import com.folderrag.error.ServiceException;
import com.folderrag.error.TransportException;
import com.folderrag.runtime.AppConfig;
import com.folderrag.runtime.CancellationToken;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts, boolean retryServerErrors) {
        return new RetryPolicy(maxAttempts, 100, 2.0, 250, retryServerErrors, sleeps::add);
    }

    @Test
    void shouldRetryTransportFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy(3, true).execute("embed", CancellationToken.none(), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransportException("refused", new IOException("refused"));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransportException.class, () -> policy(2, true).execute("embed", CancellationToken.none(), () -> {
            calls.incrementAndGet();
            throw new TransportException("refused", new IOException("refused"));
        }));

        assertEquals(2, calls.get());
    }

    @Test
    void shouldNotRetryMalformedResponsesOrClientErrors() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = policy(5, true);

        assertThrows(MalformedResponseException.class, () -> policy.execute("embed", CancellationToken.none(), () -> {
            calls.incrementAndGet();
            throw new MalformedResponseException("no embedding");
        }));
        assertThrows(ServiceException.class, () -> policy.execute("embed", CancellationToken.none(), () -> {
            calls.incrementAndGet();
            throw new ServiceException("http://x", 404, "model not found");
        }));

        assertEquals(2, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRetryServerErrorsOnlyWhenEnabled() {
        ServiceException unavailable = new ServiceException("http://x", 503, "");

        assertTrue(policy(3, true).isRetryable(unavailable));
        assertFalse(policy(3, false).isRetryable(unavailable));
    }

    @Test
    void shouldCapExponentialBackoff() {
        RetryPolicy policy = policy(10, true);

        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(250, policy.backoffMillis(3));
        assertEquals(250, policy.backoffMillis(8));
    }

    @Test
    void shouldStopRetryingOnceCancelled() {
        CancellationToken cancellation = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(OperationCancelledException.class, () -> policy(5, true).execute("embed", cancellation, () -> {
            calls.incrementAndGet();
            cancellation.cancel();
            throw new TransportException("refused", new IOException("refused"));
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void shouldDefaultToSingleAttempt() {
        assertEquals(1, RetryPolicy.fromConfig(new AppConfig.RetryConfig()).maxAttempts());
        assertEquals(1, RetryPolicy.none().maxAttempts());
    }
}
