package caseflow.coordinator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs named sub-steps of a stage concurrently and waits for all of them.
 * A failing branch does not cancel the others; its error is reported instead of a value.
 */
public final class FanOut {

    private static final Logger log = LoggerFactory.getLogger(FanOut.class);

    private final ExecutorService executor;

    public FanOut(ExecutorService executor) {
        this.executor = executor;
    }

    public record Branch<T>(String name, T value, Throwable error) {

        public boolean succeeded() {
            return error == null;
        }
    }

    public <T> List<Branch<T>> runAll(Map<String, Callable<T>> steps) throws InterruptedException {
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        steps.forEach((name, step) -> futures.put(name, CompletableFuture.supplyAsync(() -> {
            try {
                return step.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor)));

        // Branch failures are read per future below
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .exceptionally(e -> null)
                .join();
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted while waiting for fan-out");
        }

        List<Branch<T>> branches = new ArrayList<>();
        futures.forEach((name, future) -> {
            try {
                branches.add(new Branch<>(name, future.join(), null));
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Fan-out branch {} failed: {}", name, cause.getMessage());
                branches.add(new Branch<>(name, null, cause));
            }
        });
        return branches;
    }
}
