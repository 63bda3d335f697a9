package org.aimux.distribution.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link CompletableFuture} that only completes when all source futures complete,
 * exceptionally or not. The resulting future only completes exceptionally if all
 * sources complete exceptionally, otherwise it completes normally with the results of the
 * sources that succeeded, in the order of the sources.
 */
public class StronglyMultiCompletableFuture<T> extends CompletableFuture<List<T>> {

    public static class MultiCompletionException extends CompletionException {
        private static final long serialVersionUID = -5380532367406133478L;

        public MultiCompletionException(@NotNull Throwable[] causes) {
            super("All " + causes.length + " futures completed exceptionally", causes.length == 0 ? null : causes[0]);
            for (int i = 1; i < causes.length; i++) {
                if (causes[i] != null) {
                    this.addSuppressed(causes[i]);
                }
            }
        }
    }

    private final T[] results;
    private final Throwable[] exceptions;
    private final boolean[] done;
    private int completions = 0;
    private int exceptionally = 0;

    @SuppressWarnings("unchecked")
    public StronglyMultiCompletableFuture(@NotNull List<CompletableFuture<T>> sources) {
        this.exceptions = new Throwable[sources.size()];
        this.results = (T[]) new Object[sources.size()];
        this.done = new boolean[sources.size()];
        if (sources.isEmpty()) {
            this.complete(Collections.emptyList());
            return;
        }
        for (int i = 0; i < sources.size(); i++) {
            final int futureIndex = i;
            sources.get(i).whenComplete((result, ex) -> {
                if (ex == null) {
                    this.sourceCompleted(futureIndex, result);
                } else {
                    this.sourceException(futureIndex, ex);
                }
            });
        }
    }

    private void finishIfDone() {
        if (this.completions != this.results.length || this.isDone()) {
            return;
        }
        if (this.exceptionally == this.results.length) {
            this.completeExceptionally(new MultiCompletionException(this.exceptions));
            return;
        }
        List<T> results = new ArrayList<>();
        for (int i = 0; i < this.results.length; i++) {
            if (this.exceptions[i] == null) {
                results.add(this.results[i]);
            }
        }
        this.complete(results);
    }

    private void sourceCompleted(int i, T result) {
        Objects.requireNonNull(result);
        synchronized (this) {
            if (this.done[i]) {
                return;
            }
            this.done[i] = true;
            this.results[i] = result;
            this.completions++;
            this.finishIfDone();
        }
    }

    private void sourceException(int i, Throwable exception) {
        Objects.requireNonNull(exception);
        synchronized (this) {
            if (this.done[i]) {
                return;
            }
            this.done[i] = true;
            this.exceptions[i] = exception;
            this.exceptionally++;
            this.completions++;
            this.finishIfDone();
        }
    }
}
