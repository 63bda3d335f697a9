package org.aimux.distribution.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    /**
     * Runs a callable on the given executor. Unlike {@link CompletableFuture#supplyAsync(java.util.function.Supplier, Executor)}
     * checked exceptions are propagated as the exceptional completion value without being wrapped, and the callable
     * is not invoked at all if the returned future was completed (e.g. cancelled) before the executor got around to run it.
     *
     * @param <T> The type of the result
     * @param source The callable to run
     * @param executor The executor to run the callable on
     * @return A future completing with the result of the callable
     */
    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers the
     * {@link CompletableFuture} API likes to put around the exception that actually occurred.
     *
     * @param t The throwable to unwrap
     * @return The underlying cause
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Combines a list of futures into a future of a list, retaining the order of the sources.
     * The returned future completes exceptionally as soon as any of the sources does.
     *
     * @param <T> The type of the results
     * @param futures The source futures
     * @return A future of all results
     */
    @NotNull
    public static <T> CompletableFuture<List<T>> allOf(@NotNull List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply((ignored) -> {
            List<T> results = new ArrayList<>(futures.size());
            for (CompletableFuture<T> future : futures) {
                results.add(future.join());
            }
            return results;
        });
    }
}
