package com.bulkresizer.service;

import com.bulkresizer.model.JobOutcome;
import com.bulkresizer.model.ResizeJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Fixed-size pool of workers that runs resize jobs in chunks.
 *
 * A pool belongs to one batch: create it, call {@link #run(List)}, then close it.
 * Each chunk of jobs is one task on the executor, so a slow job only holds up
 * the rest of its own chunk while the other workers keep draining the queue.
 * Workers share no state; each decoded image stays with the thread that read it.
 */
public class ResizeWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResizeWorkerPool.class);

    private final ResizeJobProcessor processor;
    private final int concurrency;
    private final int chunkSize;
    private final ThreadPoolTaskExecutor executor;
    private volatile boolean closed = false;

    /**
     * @param processor   runs a single job
     * @param concurrency number of worker threads, at least 1
     * @param chunkSize   jobs per task, at least 1
     */
    public ResizeWorkerPool(ResizeJobProcessor processor, int concurrency, int chunkSize) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, got " + chunkSize);
        }
        this.processor = processor;
        this.concurrency = concurrency;
        this.chunkSize = chunkSize;

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("resizer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
    }

    /**
     * Runs every job and waits until all of them have finished. Outcomes are
     * returned in job order; the order in which jobs actually complete is
     * unspecified. An interrupt does not cut the wait short; it is restored
     * once all chunks are done.
     *
     * @param jobs jobs to run
     * @return one outcome per job
     * @throws IllegalStateException if a worker died with an Error; thrown only
     *                               after every other chunk has finished
     */
    public List<JobOutcome> run(List<ResizeJob> jobs) {
        if (closed) {
            throw new IllegalStateException("Worker pool is closed");
        }

        List<List<ResizeJob>> chunks = chunk(jobs, chunkSize);
        log.debug("Dispatching {} jobs in {} chunks to {} workers", jobs.size(), chunks.size(), concurrency);

        List<Future<List<JobOutcome>>> futures = new ArrayList<>(chunks.size());
        for (List<ResizeJob> chunk : chunks) {
            futures.add(executor.submit(() -> processChunk(chunk)));
        }

        // Every chunk must finish before run returns, even after a worker has died.
        List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
        IllegalStateException workerFailure = null;
        boolean interrupted = false;
        for (Future<List<JobOutcome>> future : futures) {
            while (true) {
                try {
                    outcomes.addAll(future.get());
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    // processChunk does not throw, so this is an Error from a worker
                    if (workerFailure == null) {
                        workerFailure = new IllegalStateException("Resize worker died", e.getCause());
                    } else {
                        workerFailure.addSuppressed(e.getCause());
                    }
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (workerFailure != null) {
            throw workerFailure;
        }
        return outcomes;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            executor.shutdown();
        }
    }

    private List<JobOutcome> processChunk(List<ResizeJob> chunk) {
        List<JobOutcome> outcomes = new ArrayList<>(chunk.size());
        for (ResizeJob job : chunk) {
            outcomes.add(processor.process(job));
        }
        return outcomes;
    }

    static <T> List<List<T>> chunk(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(items.subList(from, Math.min(from + size, items.size())));
        }
        return chunks;
    }
}
