package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.agent.CodingSession;
import com.codeforge.orchestrator.agent.ExitReason;
import com.codeforge.orchestrator.agent.TaskOutcome;
import com.codeforge.orchestrator.agent.ToolCallingExecutor;
import com.codeforge.orchestrator.model.ErrorKind;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.taskgraph.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dispatches the tasks of a {@link TaskGraph} to the coding loop in waves.
 *
 * A wave is taken from the currently eligible tasks in execution order, capped
 * at the worker-pool size. Eligible tasks never depend on one another (their
 * dependencies are all done), and a task whose file is already claimed by
 * the wave is deferred to a later one, so no two concurrent tasks write the
 * same file. With one worker this degenerates to strict execution order.
 *
 * <p>Dispatch stops when nothing is eligible, when the run is cancelled, when
 * the budget is exhausted, or, unless {@code continueOnTaskFailure} is set,
 * after the wave in which a task failed.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final ToolCallingExecutor executor;
    private final int                 workers;
    private final boolean             continueOnTaskFailure;

    public TaskDispatcher(ToolCallingExecutor executor, int workers, boolean continueOnTaskFailure) {
        this.executor              = executor;
        this.workers               = workers;
        this.continueOnTaskFailure = continueOnTaskFailure;
    }

    /**
     * Run every eligible task until the graph is done or dispatch has to stop.
     *
     * @param onTaskDone called on the dispatching thread after each task completes
     * @return outcomes in completion order (wave by wave, execution order within a wave)
     */
    public List<TaskOutcome> dispatch(TaskGraph graph, CodingSession session, Consumer<Task> onTaskDone) {
        List<TaskOutcome> outcomes = new ArrayList<>();
        ExecutorService pool = workers > 1 ? Executors.newFixedThreadPool(workers, namedThreads()) : null;
        try {
            while (!session.cancellation().isCancelled()) {
                List<Task> wave = nextWave(graph.eligibleTasks());
                if (wave.isEmpty()) {
                    break;
                }
                log.info("Dispatching wave of {}: {}", wave.size(), wave.stream().map(Task::getId).toList());

                List<TaskOutcome> waveOutcomes = pool == null
                        ? List.of(executor.execute(wave.get(0), session))
                        : runConcurrently(pool, wave, session);

                boolean stop = false;
                for (int i = 0; i < wave.size(); i++) {
                    TaskOutcome outcome = waveOutcomes.get(i);
                    outcomes.add(outcome);
                    if (outcome.completed()) {
                        onTaskDone.accept(wave.get(i));
                    } else if (outcome.reason() != ExitReason.CANCELLED) {
                        stop |= !continueOnTaskFailure || outcome.reason() == ExitReason.BUDGET_EXHAUSTED;
                    }
                }
                if (stop) {
                    break;
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
        return outcomes;
    }

    /** Eligible tasks, in order, up to the pool size and without two tasks on the same file. */
    List<Task> nextWave(List<Task> eligible) {
        List<Task> wave = new ArrayList<>();
        Set<String> claimedFiles = new HashSet<>();
        for (Task task : eligible) {
            if (wave.size() >= workers) break;
            if (!claimedFiles.add(task.getFilePath())) {
                log.debug("{} deferred: {} already claimed by this wave", task.getId(), task.getFilePath());
                continue;
            }
            wave.add(task);
        }
        return wave;
    }

    private List<TaskOutcome> runConcurrently(ExecutorService pool, List<Task> wave, CodingSession session) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<TaskOutcome>> futures = new ArrayList<>(wave.size());
        for (Task task : wave) {
            futures.add(pool.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return executor.execute(task, session);
                } finally {
                    MDC.clear();
                }
            }));
        }
        List<TaskOutcome> results = new ArrayList<>(wave.size());
        for (Future<TaskOutcome> f : futures) {
            try {
                results.add(f.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StageFailedException(ErrorKind.INTERRUPTED,
                        "Interrupted while waiting for coding tasks", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Coding task failed unexpectedly", cause);
            }
        }
        return results;
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "coder-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
