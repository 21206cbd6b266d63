package io.relayq.broker.delivery;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs delivery tasks and keeps track of the ones still in flight.
 * <p>
 * Each task gets its own pooled thread because it blocks on its client's ready signal for as long
 * as the consumer takes to confirm. Launching never waits for the task; the registry only records
 * it so shutdown can report and await outstanding deliveries instead of losing sight of them.
 * Tasks are never interrupted on close.
 * </p>
 */
@Slf4j
public final class DeliveryRegistry implements AutoCloseable {

    private final ExecutorService pool = Executors.newCachedThreadPool(new DeliveryThreadFactory());

    private final Set<CompletableFuture<DeliveryOutcome>> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Starts {@code task} on a delivery thread.
     *
     * @return a future completing with the task's outcome
     */
    public CompletableFuture<DeliveryOutcome> launch(final DeliveryTask task) {
        final CompletableFuture<DeliveryOutcome> future = new CompletableFuture<>();
        inFlight.add(future);
        future.whenComplete((outcome, ex) -> {
            inFlight.remove(future);
            if (ex != null) {
                log.error("Delivery task failed", ex);
            }
        });

        try {
            pool.execute(() -> {
                try {
                    future.complete(task.deliver());
                } catch (final RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (final RejectedExecutionException e) {
            future.completeExceptionally(e);
        }

        return future;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits for every delivery that is in flight right now.
     *
     * @return {@code true} if all of them resolved within {@code timeout}
     */
    public boolean awaitQuiescence(final Duration timeout) throws InterruptedException {
        final CompletableFuture<?>[] snapshot = inFlight.toArray(new CompletableFuture[0]);
        if (snapshot.length == 0) return true;

        try {
            CompletableFuture.allOf(snapshot).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (final TimeoutException e) {
            return false;
        } catch (final ExecutionException e) {
            // individual failures were already logged by the per-task hook
            return inFlight.isEmpty();
        }
    }

    /**
     * Stops accepting tasks. Outstanding deliveries keep running until their client confirms or
     * disconnects.
     */
    @Override
    public void close() {
        pool.shutdown();
        final int outstanding = inFlight.size();
        if (outstanding > 0) {
            log.warn("{} deliveries still awaiting confirmation at shutdown", outstanding);
        }
    }

    private static final class DeliveryThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable r) {
            final Thread t = new Thread(r, "relayq-delivery-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
