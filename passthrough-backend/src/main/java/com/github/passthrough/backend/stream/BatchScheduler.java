package com.github.passthrough.backend.stream;

import com.github.passthrough.backend.stream.models.BatchResult;
import com.github.passthrough.backend.stream.models.BatchSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs jobs over a list of items in consecutive batches.
 * A batch is started only when the previous one completed and fewer results than the target have been collected.
 * Each run has its own concurrency limit, concurrent runs don't share permits.
 * Jobs which are still running when the deadline is reached are interrupted.
 */
@Slf4j
@Component
public class BatchScheduler {
    private final Executor executor;
    private final Clock clock;

    public BatchScheduler(@Qualifier("resolverExecutor") Executor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Run the given job over the items.
     * A job which throws or returns {@link Optional#empty()} doesn't contribute a result.
     *
     * @param items    The items to process, in priority order.
     * @param job      The job to run per item.
     * @param settings The settings of this run.
     * @param <T>      The item type.
     * @param <R>      The result type.
     * @return Returns the results in item order together with the number of attempted items.
     */
    public <T, R> BatchResult<R> schedule(List<T> items, Function<T, Optional<R>> job, BatchSettings settings) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(job, "job cannot be null");
        Objects.requireNonNull(settings, "settings cannot be null");
        var batchSize = Math.max(1, settings.getMaxConcurrency());
        var target = settings.getTargetResults();
        var permits = new Semaphore(batchSize);
        var results = new ArrayList<R>();
        var attempted = 0;

        for (var offset = 0; offset < items.size() && results.size() < target; offset += batchSize) {
            if (isDeadlineReached(settings)) {
                log.warn("Deadline reached, skipping the remaining {} items", items.size() - offset);
                break;
            }

            var batch = items.subList(offset, Math.min(offset + batchSize, items.size()));
            var jobs = batch.stream()
                    .map(e -> submit(e, job, permits))
                    .collect(Collectors.toList());
            attempted += batch.size();
            log.debug("Started batch of {} items ({} attempted, {} results)", batch.size(), attempted, results.size());

            var completed = await(jobs, settings);
            for (var batchJob : jobs) {
                if (batchJob.getCompletion().isDone()) {
                    batchJob.getCompletion().getNow(Optional.empty()).ifPresent(results::add);
                } else {
                    log.debug("Interrupting batch job which didn't complete before the deadline");
                    batchJob.cancel(true);
                }
            }

            if (!completed) {
                break;
            }
        }

        var finalResults = results.size() > target ? results.subList(0, target) : results;
        return new BatchResult<>(Collections.unmodifiableList(new ArrayList<>(finalResults)), attempted);
    }

    private <T, R> BatchJob<R> submit(T item, Function<T, Optional<R>> job, Semaphore permits) {
        var batchJob = new BatchJob<R>(() -> run(item, job, permits));

        try {
            executor.execute(batchJob);
        } catch (RejectedExecutionException ex) {
            log.warn("Batch job has been rejected, {}", ex.getMessage());
            batchJob.cancel(false);
        }

        return batchJob;
    }

    private static <T, R> Optional<R> run(T item, Function<T, Optional<R>> job, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        try {
            var result = job.apply(item);
            return result != null ? result : Optional.empty();
        } finally {
            permits.release();
        }
    }

    private <R> boolean await(List<BatchJob<R>> jobs, BatchSettings settings) {
        var all = CompletableFuture.allOf(jobs.stream()
                .map(BatchJob::getCompletion)
                .toArray(CompletableFuture[]::new));

        try {
            var deadline = settings.getDeadline();
            if (deadline.isPresent()) {
                var remaining = Duration.between(clock.instant(), deadline.get());
                all.get(Math.max(0, remaining.toMillis()), TimeUnit.MILLISECONDS);
            } else {
                all.get();
            }
            return true;
        } catch (TimeoutException ex) {
            log.warn("Deadline reached while awaiting the running batch");
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException ex) {
            log.warn("Batch failed, {}", ex.getMessage(), ex);
            return true;
        }
    }

    private boolean isDeadlineReached(BatchSettings settings) {
        return settings.getDeadline()
                .map(e -> !clock.instant().isBefore(e))
                .orElse(false);
    }

    /**
     * A job of a batch which can be interrupted while running.
     * The completion stage always completes, with {@link Optional#empty()} when the job failed or has been cancelled.
     */
    private static class BatchJob<R> extends FutureTask<Optional<R>> {
        private final CompletableFuture<Optional<R>> completion = new CompletableFuture<>();

        BatchJob(Callable<Optional<R>> callable) {
            super(callable);
        }

        CompletableFuture<Optional<R>> getCompletion() {
            return completion;
        }

        @Override
        protected void done() {
            try {
                completion.complete(get());
            } catch (CancellationException ex) {
                completion.complete(Optional.empty());
            } catch (ExecutionException ex) {
                log.warn("Batch job failed, {}", ex.getCause().getMessage(), ex.getCause());
                completion.complete(Optional.empty());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                completion.complete(Optional.empty());
            }
        }
    }
}
