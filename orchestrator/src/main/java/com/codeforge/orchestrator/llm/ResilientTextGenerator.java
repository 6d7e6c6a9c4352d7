package com.codeforge.orchestrator.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a {@link TextGenerationClient} with a per-call timeout and
 * exponential-backoff retry for transient failures.
 *
 * A call that times out or fails transiently is retried up to
 * {@code maxAttempts} times in total, sleeping {@code backoff * 2^(n-1)}
 * between attempts. After the last attempt the failure surfaces as an
 * {@link ExternalServiceException}. Non-retryable failures (4xx other than
 * 408/429, unreadable responses) surface immediately.
 */
public class ResilientTextGenerator implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientTextGenerator.class);

    private static final ExecutorService CALLERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "llm-call");
        t.setDaemon(true);
        return t;
    });

    private final TextGenerationClient delegate;
    private final Duration             timeout;
    private final int                  maxAttempts;
    private final long                 backoffMillis;

    public ResilientTextGenerator(TextGenerationClient delegate, Duration timeout, int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.delegate      = delegate;
        this.timeout       = timeout;
        this.maxAttempts   = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    @Override
    public String complete(String model, List<Message> messages, String systemPrompt) {
        ExternalServiceException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callOnce(model, messages, systemPrompt);
            } catch (ExternalServiceException e) {
                last = e;
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt < maxAttempts) {
                    long sleep = backoffMillis * (1L << (attempt - 1));
                    log.warn("Text generation attempt {}/{} failed ({}); retrying in {} ms",
                            attempt, maxAttempts, e.getMessage(), sleep);
                    pause(sleep);
                }
            }
        }
        throw new ExternalServiceException(
                "Text generation failed after " + maxAttempts + " attempts: " + last.getMessage(), false, last);
    }

    private String callOnce(String model, List<Message> messages, String systemPrompt) {
        CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> delegate.complete(model, messages, systemPrompt), CALLERS);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalServiceException("Text generation timed out after " + timeout.toSeconds() + "s", true, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted waiting for text generation", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException ese) {
                throw ese;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ExternalServiceException("Text generation failed: " + cause, false, cause);
        }
    }

    private static void pause(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted during retry backoff", false, e);
        }
    }
}
