package in.smcdesk.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * TradeCoordinator - partitioned routing for trade lifecycle mutations.
 *
 * SINGLE-WRITER PER TRADE:
 * All operations for a tradeId run on the same single-thread partition, so
 * two closes of one trade can never interleave.
 *
 * PARTITIONING:
 * - Partition count = clamp(availableProcessors(), 8, 32) by default
 * - Route by: hash(tradeId) % partitions
 */
public final class TradeCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TradeCoordinator.class);

    private static final int MIN_PARTITIONS = 8;
    private static final int MAX_PARTITIONS = 32;

    private final ExecutorService[] partitions;
    private final int partitionCount;

    public TradeCoordinator() {
        this(calculateOptimalPartitions());
    }

    public TradeCoordinator(int partitionCount) {
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("Partition count must be positive: " + partitionCount);
        }
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(runnable, "trade-coordinator-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("TradeCoordinator initialized with {} partitions (CPUs: {})",
            partitionCount, Runtime.getRuntime().availableProcessors());
    }

    private static int calculateOptimalPartitions() {
        int processors = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_PARTITIONS, Math.min(MAX_PARTITIONS, processors));
    }

    public CompletableFuture<Void> execute(String tradeId, Runnable task) {
        return CompletableFuture.runAsync(task, partitions[getPartition(tradeId)]);
    }

    /**
     * Run a task on the trade's partition. Unchecked exceptions from the task
     * complete the future as they are; checked ones are wrapped.
     */
    public <T> CompletableFuture<T> executeWithResult(String tradeId, Callable<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RuntimeException("Trade operation failed: " + tradeId, e);
            }
        }, partitions[getPartition(tradeId)]);
    }

    /**
     * Run a task on the trade's partition and wait for it, rethrowing the
     * task's own unchecked exception.
     */
    public <T> T executeAndWait(String tradeId, Callable<T> task) {
        try {
            return executeWithResult(tradeId, task).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    int getPartition(String tradeId) {
        return Math.floorMod(tradeId.hashCode(), partitionCount);
    }

    /**
     * Waits up to 30 seconds per partition for pending tasks.
     */
    public void shutdown() {
        log.info("Shutting down TradeCoordinator with {} partitions", partitionCount);

        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        try {
            for (int i = 0; i < partitionCount; i++) {
                if (!partitions[i].awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Partition {} did not terminate in time, forcing shutdown", i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }

        log.info("TradeCoordinator shutdown complete");
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
