package com.newsflow.core.graph;

import com.newsflow.core.interrupt.InterruptProtocolException;
import com.newsflow.core.interrupt.Interrupts;
import com.newsflow.core.interrupt.NodeInterrupt;
import com.newsflow.core.interrupt.ResumeDecision;
import com.newsflow.core.logging.MdcContext;
import com.newsflow.core.model.RunStatus;
import com.newsflow.core.persistence.Checkpoint;
import com.newsflow.core.persistence.CheckpointStore;
import com.newsflow.core.persistence.CheckpointStoreException;
import com.newsflow.core.persistence.PendingInterrupt;
import com.newsflow.core.persistence.PendingTask;
import com.newsflow.core.persistence.TaskWrite;
import com.newsflow.core.retry.RetryPolicyHandler;
import com.newsflow.core.state.Channel;
import com.newsflow.core.state.GraphState;
import com.newsflow.core.state.StateReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Superstep scheduler for a compiled {@link StateGraph}.
 * <p>
 * Each superstep runs every task of the current frontier against one read-only
 * snapshot of the state. Fan-out tasks run concurrently on a bounded pool; plain
 * tasks run one after another on the calling thread. Once every task has finished
 * (the join barrier) their updates are merged in frontier order, the next frontier
 * is derived from the outgoing edges of the nodes that just ran, and a checkpoint
 * is written. A node that fails after its retries are used up contributes one entry
 * to the error field and its successors still fire, whether it ran as a plain or a
 * fan-out task. Listener callbacks that throw are logged and ignored.
 * <p>
 * A node that suspends halts the run: the scheduler checkpoints the superstep as
 * AWAITING, keeping the updates of tasks that already finished, and returns. On
 * {@link #resume} only the unfinished tasks of that superstep are executed again.
 * <p>
 * At most one caller may drive a given run at a time; a second concurrent call
 * is rejected with {@link RunBusyException}.
 */
public class CompiledGraph<S extends GraphState> {

    private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

    private static final AtomicInteger POOL_THREADS = new AtomicInteger();

    private final Function<Map<String, Object>, S> stateFactory;
    private final StateReducer reducer;
    private final Map<String, NodeSpec<S>> nodes;
    private final Map<String, List<Edge<S>>> edges;
    private final Map<String, Set<String>> staticReach;
    private final CheckpointStore store;
    private final RetryPolicyHandler retryHandler;
    private final GraphListener listener;
    private final int maxParallel;
    private final String errorField;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    CompiledGraph(Map<String, Channel> schema,
                  Function<Map<String, Object>, S> stateFactory,
                  Map<String, NodeSpec<S>> nodes,
                  Map<String, List<Edge<S>>> edges,
                  Map<String, Set<String>> staticReach,
                  CompileConfig config) {
        this.stateFactory = stateFactory;
        this.reducer = new StateReducer(schema);
        this.nodes = nodes;
        this.edges = edges;
        this.staticReach = staticReach;
        this.store = config.checkpointStore();
        this.retryHandler = config.retryHandler();
        this.listener = config.listener();
        this.maxParallel = config.maxParallel();
        this.errorField = config.errorField();
    }

    // ── Public operations ─────────────────────────────────────────────────

    /**
     * Starts a new run and drives it until it completes or suspends.
     *
     * @throws GraphRunException if the run id is already in use or routing fails
     * @throws RunBusyException  if another caller is driving the same run id
     */
    public RunResult<S> invoke(Map<String, Object> input, String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return exclusive(runId, () -> {
            if (store.loadLatest(runId).isPresent()) {
                throw new GraphRunException("Run '" + runId + "' already exists; use resume or recover");
            }

            Map<String, Object> initial = reducer.initialize(input != null ? input : Map.of());
            log.info("Starting run {}", runId);
            notifyListener("onRunStarted", () -> listener.onRunStarted(runId));

            List<PendingTask> frontier;
            try {
                frontier = successors(List.of(StateGraph.START), stateFactory.apply(initial));
            } catch (GraphRunException e) {
                throw failRun(runId, 0, 0, initial, List.of(), e);
            }

            RunStatus status = frontier.isEmpty() ? RunStatus.COMPLETED : RunStatus.RUNNING;
            Checkpoint first = checkpoint(runId, 0, 0, status, initial, frontier, null, List.of(), null);
            save(first);
            if (status == RunStatus.COMPLETED) {
                notifyListener("onCompleted", () -> listener.onCompleted(runId, 0));
            }
            return drive(first, null);
        });
    }

    /**
     * Continues a suspended run with the reviewer's decision. The suspended node runs
     * again from the top and its {@link Interrupts#suspend} call returns the decision.
     *
     * @throws InterruptProtocolException if the decision is malformed or the run is not awaiting one
     */
    public RunResult<S> resume(String runId, ResumeDecision decision) {
        ResumeDecision.requireValid(decision);
        return exclusive(runId, () -> {
            Checkpoint latest = store.loadLatest(runId)
                    .orElseThrow(() -> new InterruptProtocolException("No run found with id '" + runId + "'"));
            if (!latest.awaitingResume()) {
                throw new InterruptProtocolException("Run '" + runId
                        + "' has no outstanding interrupt (status " + latest.status() + ")");
            }
            log.info("Resuming run {} at node {} with decision {}",
                    runId, latest.interrupt().node(), decision.action());
            return drive(latest, decision);
        });
    }

    /**
     * Continues a run from its latest committed checkpoint, e.g. after a process
     * restart. Terminal runs are returned unchanged.
     *
     * @throws InterruptProtocolException if the run is waiting for a decision
     */
    public RunResult<S> recover(String runId) {
        return exclusive(runId, () -> {
            Checkpoint latest = store.loadLatest(runId)
                    .orElseThrow(() -> new GraphRunException("No run found with id '" + runId + "'"));
            if (latest.status() == RunStatus.AWAITING) {
                throw new InterruptProtocolException("Run '" + runId
                        + "' is awaiting a decision; use resume instead");
            }
            if (latest.status().terminal()) {
                return RunResult.from(latest, stateFactory);
            }
            log.info("Recovering run {} from checkpoint {} (superstep {})",
                    runId, latest.sequence(), latest.superstep());
            return drive(latest, null);
        });
    }

    /** The run as of its latest checkpoint. */
    public Optional<RunResult<S>> getState(String runId) {
        return store.loadLatest(runId).map(cp -> RunResult.from(cp, stateFactory));
    }

    public boolean isActive(String runId) {
        return activeRuns.contains(runId);
    }

    // ── Run loop ──────────────────────────────────────────────────────────

    private RunResult<S> exclusive(String runId, Supplier<RunResult<S>> body) {
        if (!activeRuns.add(runId)) {
            throw new RunBusyException(runId);
        }
        try {
            MdcContext.setRun(runId);
            return body.get();
        } finally {
            MdcContext.clearSuperstep();
            activeRuns.remove(runId);
        }
    }

    private RunResult<S> drive(Checkpoint start, ResumeDecision decision) {
        Checkpoint current = start;
        ResumeDecision pending = decision;
        try {
            while (current.status() == RunStatus.RUNNING
                    || (current.status() == RunStatus.AWAITING && pending != null)) {
                current = runSuperstep(current, pending);
                pending = null;
            }
        } catch (CheckpointStoreException e) {
            String runId = current.runId();
            log.error("Run {} stopped: checkpoint could not be persisted", runId, e);
            notifyListener("onFailed", () -> listener.onFailed(runId, e.getMessage()));
            throw e;
        }
        return RunResult.from(current, stateFactory);
    }

    private Checkpoint runSuperstep(Checkpoint cp, ResumeDecision decision) {
        String runId = cp.runId();
        int superstep = cp.superstep() + 1;
        List<PendingTask> tasks = cp.frontier();
        Map<String, Object> base = cp.state();
        MdcContext.setSuperstep(runId, superstep);

        for (PendingTask task : tasks) {
            if (!nodes.containsKey(task.node())) {
                throw failRun(runId, cp.sequence() + 1, cp.superstep(), base, tasks,
                        new GraphRunException("Frontier references unknown node '" + task.node() + "'"));
            }
        }

        int resumedIndex = cp.awaitingResume() ? cp.interrupt().taskIndex() : -1;
        TaskOutcome[] outcomes = new TaskOutcome[tasks.size()];
        if (cp.awaitingResume()) {
            for (TaskWrite write : cp.pendingWrites()) {
                outcomes[write.taskIndex()] = TaskOutcome.completed(write.taskIndex(), write.node(), write.update());
            }
        }

        log.debug("Superstep {} of run {}: {}", superstep, runId,
                tasks.stream().map(PendingTask::node).collect(Collectors.joining(", ")));
        long started = System.currentTimeMillis();

        List<Integer> fanOutIndexes = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            if (outcomes[i] == null && tasks.get(i).fanOut()) {
                fanOutIndexes.add(i);
            }
        }

        ExecutorService pool = null;
        Map<Integer, Future<TaskOutcome>> futures = new LinkedHashMap<>();
        try {
            if (!fanOutIndexes.isEmpty()) {
                pool = Executors.newFixedThreadPool(Math.min(fanOutIndexes.size(), maxParallel), fanOutThreads());
                for (int i : fanOutIndexes) {
                    final int index = i;
                    final ResumeDecision taskDecision = index == resumedIndex ? decision : null;
                    futures.put(index, pool.submit(
                            () -> runTask(runId, superstep, index, tasks.get(index), base, taskDecision)));
                }
            }

            boolean suspended = false;
            for (int i = 0; i < tasks.size(); i++) {
                if (outcomes[i] != null || tasks.get(i).fanOut() || suspended) continue;
                outcomes[i] = runTask(runId, superstep, i, tasks.get(i), base, i == resumedIndex ? decision : null);
                suspended = outcomes[i].interrupted();
            }

            for (var entry : futures.entrySet()) {
                int index = entry.getKey();
                outcomes[index] = join(entry.getValue(), index, tasks.get(index).node());
            }
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }

        for (TaskOutcome outcome : outcomes) {
            if (outcome != null && outcome.interrupted()) {
                return suspend(cp, outcome, outcomes);
            }
        }

        List<Map<String, Object>> updates = new ArrayList<>(outcomes.length);
        for (TaskOutcome outcome : outcomes) {
            updates.add(outcome.update());
        }
        Map<String, Object> merged = reducer.merge(base, updates);

        List<PendingTask> next;
        try {
            Set<String> ran = new LinkedHashSet<>();
            tasks.forEach(task -> ran.add(task.node()));
            next = successors(ran, stateFactory.apply(merged));
        } catch (GraphRunException e) {
            throw failRun(runId, cp.sequence() + 1, superstep, merged, List.of(), e);
        }

        RunStatus status = next.isEmpty() ? RunStatus.COMPLETED : RunStatus.RUNNING;
        Checkpoint committed = checkpoint(runId, cp.sequence() + 1, superstep, status, merged, next,
                null, List.of(), null);
        save(committed);

        long elapsed = System.currentTimeMillis() - started;
        log.info("Superstep {} completed: {} task(s) in {} ms, next: {}", superstep, tasks.size(), elapsed,
                next.isEmpty() ? "END" : next.stream().map(PendingTask::node).distinct().collect(Collectors.joining(", ")));
        notifyListener("onSuperstepCompleted",
                () -> listener.onSuperstepCompleted(runId, superstep, tasks.size(), elapsed));
        if (status == RunStatus.COMPLETED) {
            log.info("Run {} completed after {} supersteps", runId, superstep);
            notifyListener("onCompleted", () -> listener.onCompleted(runId, superstep));
        }
        return committed;
    }

    private Checkpoint suspend(Checkpoint cp, TaskOutcome interrupted, TaskOutcome[] outcomes) {
        List<TaskWrite> finished = new ArrayList<>();
        for (TaskOutcome outcome : outcomes) {
            if (outcome != null && !outcome.interrupted()) {
                finished.add(new TaskWrite(outcome.index(), outcome.node(), outcome.update()));
            }
        }
        var pendingInterrupt = new PendingInterrupt(interrupted.index(), interrupted.node(), interrupted.payload());
        Checkpoint awaiting = checkpoint(cp.runId(), cp.sequence() + 1, cp.superstep(), RunStatus.AWAITING,
                cp.state(), cp.frontier(), pendingInterrupt, finished, null);
        save(awaiting);
        log.info("Run {} suspended at node {}", cp.runId(), interrupted.node());
        notifyListener("onInterrupted",
                () -> listener.onInterrupted(cp.runId(), interrupted.node(), interrupted.payload()));
        return awaiting;
    }

    // ── Task execution ────────────────────────────────────────────────────

    private TaskOutcome runTask(String runId, int superstep, int index, PendingTask task,
                                Map<String, Object> base, ResumeDecision decision) {
        NodeSpec<S> spec = nodes.get(task.node());
        Map<String, Object> input = base;
        if (!task.arguments().isEmpty()) {
            input = new HashMap<>(base);
            input.putAll(task.arguments());
        }
        S state = stateFactory.apply(input);

        MdcContext.setNode(runId, superstep, spec.name());
        try {
            Map<String, Object> update = retryHandler.execute(spec.name(), spec.retryPolicy(), () -> {
                try (Interrupts.Scope ignored = Interrupts.open(decision)) {
                    return spec.action().apply(state);
                }
            }, (attempt, error, delay) -> notifyListener("onNodeRetry",
                    () -> listener.onNodeRetry(runId, spec.name(), attempt, error, delay)));
            return TaskOutcome.completed(index, spec.name(), update != null ? update : Map.of());
        } catch (NodeInterrupt interrupt) {
            return TaskOutcome.suspended(index, spec.name(), interrupt.payload());
        } catch (Exception | Error e) {
            log.warn("Node {} failed, recording error and continuing: {}", spec.name(), describe(e));
            notifyListener("onNodeFailed", () -> listener.onNodeFailed(runId, spec.name(), e));
            return failed(index, spec.name(), e);
        } finally {
            MdcContext.clearNode();
        }
    }

    private TaskOutcome join(Future<TaskOutcome> future, int index, String node) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Fan-out branch {} terminated abnormally", node, cause);
            return failed(index, node, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphRunException("Interrupted while waiting for fan-out branch " + node, e);
        }
    }

    private TaskOutcome failed(int index, String node, Throwable e) {
        return TaskOutcome.completed(index, node, Map.of(errorField, List.of(node + ": " + describe(e))));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Listener failures are logged and never change the outcome of a run. */
    private void notifyListener(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Graph listener {} threw: {}", callback, e.getMessage(), e);
        }
    }

    // ── Frontier ──────────────────────────────────────────────────────────

    /**
     * Tasks scheduled by the outgoing edges of {@code sources}, evaluated against {@code state}.
     * Plain targets are scheduled once even if several sources point at them, and a
     * plain target is held back while another scheduled node can still reach it
     * through static edges.
     */
    private List<PendingTask> successors(Iterable<String> sources, S state) {
        List<PendingTask> next = new ArrayList<>();
        Set<String> plain = new LinkedHashSet<>();

        for (String source : sources) {
            for (Edge<S> edge : edges.getOrDefault(source, List.of())) {
                if (edge instanceof Edge.Static<S> s) {
                    schedule(s.target(), next, plain);
                } else if (edge instanceof Edge.Conditional<S> c) {
                    String key = route(source, c, state);
                    String target = c.routes().get(key);
                    if (target == null) {
                        throw new GraphRunException("Router after '" + source + "' returned unknown route '"
                                + key + "'; known routes: " + c.routes().keySet());
                    }
                    schedule(target, next, plain);
                } else if (edge instanceof Edge.FanOut<S> f) {
                    for (Send send : fanOut(source, f, state)) {
                        if (!nodes.containsKey(send.node())) {
                            throw new GraphRunException("Fan-out after '" + source
                                    + "' targets unknown node '" + send.node() + "'");
                        }
                        next.add(PendingTask.fanOut(send.node(), send.arguments()));
                    }
                }
            }
        }

        Set<String> scheduled = new LinkedHashSet<>();
        next.forEach(task -> scheduled.add(task.node()));
        return next.stream()
                .filter(task -> task.fanOut() || !heldBack(task.node(), scheduled))
                .toList();
    }

    private static void schedule(String target, List<PendingTask> next, Set<String> plain) {
        if (!StateGraph.END.equals(target) && plain.add(target)) {
            next.add(PendingTask.plain(target));
        }
    }

    private boolean heldBack(String node, Set<String> scheduled) {
        Set<String> fromNode = staticReach.getOrDefault(node, Set.of());
        for (String other : scheduled) {
            if (other.equals(node)) continue;
            if (staticReach.getOrDefault(other, Set.of()).contains(node) && !fromNode.contains(other)) {
                return true;
            }
        }
        return false;
    }

    private String route(String source, Edge.Conditional<S> edge, S state) {
        try {
            return edge.router().route(state);
        } catch (GraphRunException e) {
            throw e;
        } catch (Exception e) {
            throw new GraphRunException("Router after '" + source + "' failed: " + describe(e), e);
        }
    }

    private List<Send> fanOut(String source, Edge.FanOut<S> edge, S state) {
        try {
            List<Send> sends = edge.fn().apply(state);
            return sends != null ? sends : List.of();
        } catch (GraphRunException e) {
            throw e;
        } catch (Exception e) {
            throw new GraphRunException("Fan-out after '" + source + "' failed: " + describe(e), e);
        }
    }

    // ── Checkpoints ───────────────────────────────────────────────────────

    private Checkpoint checkpoint(String runId, long sequence, int superstep, RunStatus status,
                                  Map<String, Object> state, List<PendingTask> frontier,
                                  PendingInterrupt interrupt, List<TaskWrite> writes, String error) {
        return new Checkpoint(UUID.randomUUID().toString(), runId, sequence, superstep, status,
                state, frontier, interrupt, writes, error, Instant.now());
    }

    private void save(Checkpoint checkpoint) {
        store.save(checkpoint);
    }

    private GraphRunException failRun(String runId, long sequence, int superstep, Map<String, Object> state,
                                      List<PendingTask> frontier, GraphRunException cause) {
        log.error("Run {} failed: {}", runId, cause.getMessage());
        save(checkpoint(runId, sequence, superstep, RunStatus.FAILED, state, frontier, null, List.of(),
                cause.getMessage()));
        notifyListener("onFailed", () -> listener.onFailed(runId, cause.getMessage()));
        return cause;
    }

    private static ThreadFactory fanOutThreads() {
        return runnable -> {
            Thread t = new Thread(runnable, "newsflow-fanout-" + POOL_THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record TaskOutcome(int index, String node, Map<String, Object> update, Map<String, Object> payload) {

        static TaskOutcome completed(int index, String node, Map<String, Object> update) {
            return new TaskOutcome(index, node, update, null);
        }

        static TaskOutcome suspended(int index, String node, Map<String, Object> payload) {
            return new TaskOutcome(index, node, null, payload);
        }

        boolean interrupted() {
            return payload != null;
        }
    }
}
