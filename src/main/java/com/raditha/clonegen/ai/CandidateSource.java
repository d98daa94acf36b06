package com.raditha.clonegen.ai;

import com.raditha.clonegen.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls a {@link CandidateGenerator} on a dedicated thread with a bounded
 * wait.
 * <p>
 * Timeouts, generator failures, interruption and blank replies all yield an
 * empty result; nothing is thrown to the caller.
 */
public class CandidateSource implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CandidateSource.class);

    private final CandidateGenerator generator;
    private final Duration timeout;
    private final ExecutorService executor;

    public CandidateSource(CandidateGenerator generator, Duration timeout) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.generator = generator;
        this.timeout = timeout;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "clonegen-candidate");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Ask the generator for a candidate, stripped of markdown code fences.
     */
    public Optional<String> fetch(String source, Language language) {
        Future<String> future;
        try {
            future = executor.submit(() -> generator.propose(source, language));
        } catch (RejectedExecutionException e) {
            logger.warn("Candidate source is closed");
            return Optional.empty();
        }

        try {
            String reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String code = reply == null ? "" : stripCodeFences(reply);
            if (code.isBlank()) {
                logger.warn("Candidate generator returned an empty reply");
                return Optional.empty();
            }
            return Optional.of(code);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Candidate generator timed out after {} ms", timeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Candidate generator failed: {}", cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for a candidate");
        }
        return Optional.empty();
    }

    /**
     * Remove a leading {@code ```lang} line and a trailing {@code ```} line.
     */
    static String stripCodeFences(String reply) {
        String text = reply.strip();
        if (!text.startsWith("```")) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        int from = 1;
        int to = lines.length;
        if (to > from && lines[to - 1].strip().equals("```")) {
            to--;
        }
        StringBuilder body = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) {
                body.append('\n');
            }
            body.append(lines[i]);
        }
        return body.toString().stripTrailing();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
