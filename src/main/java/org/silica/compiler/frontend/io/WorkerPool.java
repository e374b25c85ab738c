package org.silica.compiler.frontend.io;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A small fixed pool that splits an indexed batch of work across threads and blocks
 * until every chunk is done.
 * <p>
 * The pool keeps {@code P-1} daemon threads parked between dispatches. The calling
 * thread processes chunk 0 itself, so the total parallelism is {@code P}.
 * <p>
 * {@link #dispatch(int, ChunkTask)} must only be called by the thread that owns the
 * pool and is not reentrant. {@link #close()} is idempotent.
 */
public class WorkerPool implements AutoCloseable {

    /**
     * Processes the items in {@code [fromInclusive, toExclusive)}.
     */
    @FunctionalInterface
    public interface ChunkTask {
        void run(int fromInclusive, int toExclusive);
    }

    private final Thread[] workers;
    private final int totalThreads;

    private volatile int phase;
    private volatile int workSize;
    private volatile ChunkTask task;
    private volatile boolean stopped;
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicInteger readyWorkers = new AtomicInteger();
    private final AtomicReference<Throwable> workerException = new AtomicReference<>();

    /**
     * Starts {@code parallelism - 1} worker threads and waits until each is ready to park.
     *
     * @param parallelism total number of threads, including the caller. Must be &gt;= 2.
     * @throws IllegalArgumentException if parallelism &lt; 2
     */
    public WorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.totalThreads = parallelism;
        this.workers = new Thread[parallelism - 1];

        for (int i = 0; i < workers.length; i++) {
            int workerIndex = i + 1;
            workers[i] = new Thread(() -> workerLoop(workerIndex), "parse-worker-" + workerIndex);
            workers[i].setDaemon(true);
            workers[i].start();
        }

        // A worker that has not read its phase snapshot yet would miss the first dispatch.
        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    public int getParallelism() {
        return totalThreads;
    }

    /**
     * Runs {@code task} over {@code [0, totalSize)} split into roughly equal chunks and
     * waits for all of them. Once every thread has finished, the first worker failure is
     * rethrown with all other failures attached as suppressed. A failure of the calling
     * thread alone is rethrown as is.
     *
     * @param totalSize the number of work items
     * @param task      the task run on each chunk
     */
    public void dispatch(int totalSize, ChunkTask task) {
        if (totalSize <= 0) return;
        if (stopped) {
            throw new IllegalStateException("Worker pool has been closed");
        }

        this.workSize = totalSize;
        this.task = task;
        workerException.set(null);
        workersCompleted.set(0);

        phase++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        Throwable mainException = null;
        try {
            int chunkSize = (totalSize + totalThreads - 1) / totalThreads;
            task.run(0, Math.min(chunkSize, totalSize));
        } catch (Throwable t) {
            mainException = t;
        }

        while (workersCompleted.get() < workers.length) {
            Thread.onSpinWait();
        }

        Throwable workerEx = workerException.get();
        if (workerEx != null) {
            if (mainException != null) {
                workerEx.addSuppressed(mainException);
            }
            if (workerEx instanceof RuntimeException re) {
                throw re;
            }
            if (workerEx instanceof Error e) {
                throw e;
            }
            throw new RuntimeException("Worker thread failed", workerEx);
        }
        if (mainException != null) {
            if (mainException instanceof RuntimeException re) {
                throw re;
            }
            if (mainException instanceof Error e) {
                throw e;
            }
            throw new RuntimeException("Calling thread failed during dispatch", mainException);
        }
    }

    /**
     * Stops and joins all worker threads, waiting at most 5 seconds for each.
     */
    @Override
    public void close() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void workerLoop(int workerIndex) {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();

            if (stopped) break;

            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                continue; // spurious wakeup
            }
            lastPhase = currentPhase;

            try {
                int chunkSize = (workSize + totalThreads - 1) / totalThreads;
                int from = workerIndex * chunkSize;
                int to = Math.min(from + chunkSize, workSize);
                if (from < workSize) {
                    task.run(from, to);
                }
            } catch (Throwable t) {
                if (!workerException.compareAndSet(null, t)) {
                    workerException.get().addSuppressed(t);
                }
            }

            workersCompleted.incrementAndGet();
        }
    }
}
