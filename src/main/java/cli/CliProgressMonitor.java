package cli;

import domain.model.TaskRunResult;
import domain.pipeline.TaskListener;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * Prints one progress line per finished task.
 */
public final class CliProgressMonitor implements TaskListener {

    private final long loopStartNs;

    public CliProgressMonitor() {
        this.loopStartNs = System.nanoTime();
    }

    @Override
    public synchronized void onTaskFinished(TaskRunResult result, int finished, int total) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        System.out.printf("[PROGRESS] %d/%d %s %s task=%dms elapsed=%dms heap=%d/%dMB%n",
                finished, total, result.getStatus(), result.getTaskId(), result.getElapsedMs(),
                elapsed, usedMb, maxMb);
    }
}
