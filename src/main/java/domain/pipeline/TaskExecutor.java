package domain.pipeline;

import domain.model.RemapWarning;
import domain.model.RemapWarningSink;
import domain.model.TaskRunResult;
import domain.model.TaskStatus;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link TaskGraph} in dependency order on a fixed pool of workers.
 *
 * <p>A task starts only after every requirement finished successfully. Tasks whose output
 * already exists are skipped. When a task fails, nothing that depends on it runs; those
 * tasks are reported as {@link TaskStatus#UPSTREAM_FAILED}. Independent branches keep
 * running. With one worker tasks run strictly one at a time in topological order.</p>
 */
public final class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final int workers;
    private final RemapWarningSink warningSink;
    private final TaskListener listener;

    public TaskExecutor(int workers) {
        this(workers, RemapWarningSink.none(), TaskListener.none());
    }

    public TaskExecutor(int workers, RemapWarningSink warningSink, TaskListener listener) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        this.workers = workers;
        this.warningSink = warningSink == null ? RemapWarningSink.none() : warningSink;
        this.listener = listener == null ? TaskListener.none() : listener;
    }

    public int getWorkers() {
        return workers;
    }

    public ExecutionReport execute(TaskGraph graph) {
        if (graph == null) throw new IllegalArgumentException("graph is null");

        long t0 = System.nanoTime();
        List<Task> order = graph.topologicalOrder();
        int total = order.size();
        log.info("executing {} tasks with {} worker(s)", total, workers);

        Map<Task, TaskRunResult> results = Collections.synchronizedMap(new IdentityHashMap<>());
        Map<Task, CompletableFuture<Void>> futures = new IdentityHashMap<>();
        AtomicInteger finished = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            for (Task task : order) {
                CompletableFuture<?>[] deps = graph.requirementsOf(task)
                        .stream()
                        .map(futures::get)
                        .toArray(CompletableFuture[]::new);

                CompletableFuture<Void> f = CompletableFuture.allOf(deps)
                        .thenRunAsync(() -> {
                            TaskRunResult r = runOne(task);
                            results.put(task, r);
                            listener.onTaskFinished(r, finished.incrementAndGet(), total);
                            if (r.getStatus() == TaskStatus.FAILED) {
                                throw new CompletionException(r.getError());
                            }
                        }, pool);
                futures.put(task, f);
            }

            // failures are already recorded in results; this only waits for every branch to settle
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .handle((v, e) -> null)
                    .join();
        } finally {
            pool.shutdownNow();
        }

        List<TaskRunResult> ordered = new ArrayList<>(total);
        for (Task task : order) {
            TaskRunResult r = results.get(task);
            if (r == null) {
                r = upstreamFailed(task, graph, results);
                listener.onTaskFinished(r, finished.incrementAndGet(), total);
            }
            ordered.add(r);
        }

        ExecutionReport report = new ExecutionReport(ordered, (System.nanoTime() - t0) / 1_000_000L);
        log.info("execution finished: done={}, skipped={}, failed={}, upstreamFailed={}, elapsed={}ms",
                report.count(TaskStatus.DONE), report.count(TaskStatus.SKIPPED),
                report.count(TaskStatus.FAILED), report.count(TaskStatus.UPSTREAM_FAILED),
                report.getElapsedMs());
        return report;
    }

    private TaskRunResult runOne(Task task) {
        long t0 = System.nanoTime();
        String type = task.getClass().getSimpleName();
        String output = task.output().toString();
        try {
            if (task.complete()) {
                log.info("[{}] already complete, skipping ({})", task.id(), output);
                warningSink.warn(RemapWarning.of(WarningCode.TASK_ALREADY_COMPLETE, task.id(), output));
                return new TaskRunResult(TaskStatus.SKIPPED, task.id(), type, output, ms(t0), "output exists");
            }

            log.info("[{}] running", task.id());
            task.run();

            if (!task.complete()) {
                throw new IllegalStateException("task finished without producing its output: " + output);
            }
            long elapsed = ms(t0);
            log.info("[{}] done in {}ms", task.id(), elapsed);
            return new TaskRunResult(TaskStatus.DONE, task.id(), type, output, elapsed, "");

        } catch (RuntimeException | Error e) {
            log.error("[{}] failed: {}", task.id(), e.getMessage(), e);
            warningSink.warn(new RemapWarning(WarningCode.TASK_FAILED, task.id(),
                    e.getClass().getSimpleName(), e.getMessage()));
            return new TaskRunResult(TaskStatus.FAILED, task.id(), type, output, ms(t0),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private TaskRunResult upstreamFailed(Task task, TaskGraph graph, Map<Task, TaskRunResult> results) {
        String blocker = "";
        for (Task req : graph.requirementsOf(task)) {
            TaskRunResult r = results.get(req);
            if (r == null || !r.getStatus().isSuccess()) {
                blocker = req.id();
                break;
            }
        }
        log.warn("[{}] not run: requirement {} did not succeed", task.id(), blocker);
        warningSink.warn(new RemapWarning(WarningCode.UPSTREAM_FAILED, task.id(), "requirement did not succeed", blocker));
        return new TaskRunResult(TaskStatus.UPSTREAM_FAILED, task.id(), task.getClass().getSimpleName(),
                task.output().toString(), 0L, "upstream failed: " + blocker);
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "remap-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
