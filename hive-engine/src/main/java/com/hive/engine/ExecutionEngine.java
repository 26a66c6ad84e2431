package com.hive.engine;

import com.hive.context.ExecutionContext;
import com.hive.context.SessionSnapshot;
import com.hive.context.SessionSnapshots;
import com.hive.engine.mock.MockOutcomes;
import com.hive.engine.node.NodeExecution;
import com.hive.engine.node.NodeExecutor;
import com.hive.engine.node.NodeHandler;
import com.hive.engine.node.NodeHandlerRegistry;
import com.hive.engine.node.NodeInput;
import com.hive.engine.node.NodeInvoker;
import com.hive.engine.node.NodeOutcome;
import com.hive.engine.node.handlers.ConditionalNodeHandler;
import com.hive.engine.node.handlers.MockNodeHandler;
import com.hive.engine.node.handlers.ModelNodeHandler;
import com.hive.engine.node.handlers.PassthroughNodeHandler;
import com.hive.engine.node.handlers.ToolNodeHandler;
import com.hive.engine.routing.EdgeRouter;
import com.hive.graph.model.Goal;
import com.hive.graph.model.GraphDefinition;
import com.hive.graph.model.NodeSpec;
import com.hive.graph.validation.GraphValidator;
import com.hive.graph.validation.StructuralError;
import com.hive.plugin.ModelCapability;
import com.hive.plugin.ToolCapability;
import com.hive.plugin.ToolRegistry;
import com.hive.plugin.credential.CredentialRequirements;
import com.hive.plugin.credential.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drives a run through the graph with a single cursor: pause check, precondition checks, node visit with retries,
 * atomic commit of the produced outputs, terminal check, then routing to exactly one next node.
 * The step budget is checked before every visit, so a cyclic graph stops with {@link RunStatus#BUDGET_EXCEEDED}
 * after exactly {@code budget} steps.
 * <p>
 * One engine serves many concurrent runs: all per-run state lives in the run's own context and counters.
 */
public final class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final EngineSettings settings;
    private final NodeExecutor nodeExecutor;
    private final EdgeRouter router;
    private final CredentialStore credentials;
    private final CredentialRequirements credentialRequirements;
    private final ExecutionListener listener;

    private ExecutionEngine(Builder builder) {
        this.settings = builder.settings;
        List<NodeHandler> handlers = new ArrayList<>();
        handlers.add(new ModelNodeHandler(builder.model));
        handlers.add(new ToolNodeHandler(builder.tools));
        handlers.add(new ConditionalNodeHandler());
        handlers.add(new PassthroughNodeHandler());
        handlers.addAll(builder.handlers);
        if (settings.getMode() == ExecutionMode.MOCK) {
            handlers.add(new MockNodeHandler(builder.mockOutcomes));
        }
        this.nodeExecutor = new NodeExecutor(new NodeInvoker(new NodeHandlerRegistry(handlers)), settings.getRetryPolicy());
        this.router = new EdgeRouter();
        this.credentials = builder.credentials;
        this.credentialRequirements = builder.credentialRequirements;
        this.listener = new ListenerChain(builder.listeners);
    }

    public static Builder builder(EngineSettings settings) {
        return new Builder(settings);
    }

    public EngineSettings getSettings() {
        return settings;
    }

    /** Structural checks; callers should refuse to run a graph for which this is non-empty. */
    public List<StructuralError> validate(GraphDefinition graph) {
        return GraphValidator.validate(graph);
    }

    public RunResult execute(GraphDefinition graph, String goalRef, Map<String, ?> input) {
        return execute(graph, goalRef, input, RunOptions.defaults());
    }

    /**
     * Starts a fresh run at the graph's entry point with {@code input} as the initial context.
     * A graph that fails validation is not run: the result is FAILED with {@link ErrorKind#STRUCTURAL}.
     */
    public RunResult execute(GraphDefinition graph, String goalRef, Map<String, ?> input, RunOptions options) {
        Objects.requireNonNull(graph, "graph");
        RunOptions opts = options != null ? options : RunOptions.defaults();
        String runId = opts.getRunId() != null ? opts.getRunId() : UUID.randomUUID().toString();
        RunState state = new RunState(runId, graph, goalRef, resolveGoal(graph, goalRef), new ExecutionContext(input),
                0, List.of(), Map.of(), graph.getEntryPoint(), false, budgetFor(opts), tokenFor(opts));
        List<StructuralError> errors = validate(graph);
        if (!errors.isEmpty()) {
            return structuralFailure(state, errors);
        }
        log.info("Run {} started: graph={}@{} goal={} mode={} budget={}",
                runId, graph.getName(), graph.getVersion(), goalRef, settings.getMode(), state.budget);
        listener.onRunStarted(runId, graph, false);
        return loop(state);
    }

    public RunResult resume(GraphDefinition graph, SessionSnapshot snapshot, Map<String, ?> additionalInput) {
        return resume(graph, snapshot, additionalInput, RunOptions.defaults());
    }

    /**
     * Continues a paused run at {@link SessionSnapshot#getPausedAt()} after merging {@code additionalInput} into the
     * snapshot's context. The paused node is invoked without pausing again; later entries into pause nodes pause.
     *
     * @throws com.hive.context.SnapshotVersionMismatchException when the graph name or version differs from the snapshot's
     */
    public RunResult resume(GraphDefinition graph, SessionSnapshot snapshot, Map<String, ?> additionalInput,
                            RunOptions options) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(snapshot, "snapshot");
        SessionSnapshots.checkCompatible(snapshot, graph);
        RunOptions opts = options != null ? options : RunOptions.defaults();
        String runId = snapshot.getRunId() != null ? snapshot.getRunId()
                : opts.getRunId() != null ? opts.getRunId() : UUID.randomUUID().toString();
        ExecutionContext context = new ExecutionContext(snapshot.getContext());
        context.merge(additionalInput);
        RunState state = new RunState(runId, graph, snapshot.getGoalRef(), resolveGoal(graph, snapshot.getGoalRef()),
                context, snapshot.getStepsExecuted(), snapshot.getVisitedNodes(), snapshot.getNodeInvocations(),
                snapshot.getPausedAt(), true, budgetFor(opts), tokenFor(opts));
        List<StructuralError> errors = validate(graph);
        if (!errors.isEmpty()) {
            return structuralFailure(state, errors);
        }
        log.info("Run {} resumed at {}: graph={}@{} steps={} mode={}",
                runId, snapshot.getPausedAt(), graph.getName(), graph.getVersion(), snapshot.getStepsExecuted(), settings.getMode());
        listener.onRunStarted(runId, graph, true);
        return loop(state);
    }

    private RunResult loop(RunState s) {
        GraphDefinition graph = s.graph;
        while (true) {
            String current = s.current;
            if (s.token.isCancelled()) {
                return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.CANCELLED, "Run cancelled before node " + current, current), null);
            }
            NodeSpec node = graph.getNode(current);
            if (node == null) {
                return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.STRUCTURAL, "Unknown node " + current, current), null);
            }
            // pausing consumes no step, so it is decided before the budget
            if (graph.isPauseNode(current) && !s.resumeContinuation) {
                return pause(s);
            }
            if (s.steps >= s.budget) {
                log.warn("Run {} exhausted step budget {} before node {}", s.runId, s.budget, current);
                return finish(s, RunStatus.BUDGET_EXCEEDED, RunError.of(ErrorKind.BUDGET_EXCEEDED,
                        "Step budget of " + s.budget + " exhausted before node " + current, current), null);
            }
            s.resumeContinuation = false;

            List<String> missing = s.context.missingKeys(node.getInputKeys());
            if (!missing.isEmpty()) {
                return finish(s, RunStatus.FAILED, new RunError(ErrorKind.MISSING_KEY,
                        "Node " + current + " is missing input keys " + missing, current, missing), null);
            }
            if (settings.getMode() == ExecutionMode.LIVE && node.getType().isExternal()) {
                List<String> missingCredentials = credentialRequirements.missingFor(node.getToolRefs(), credentials);
                if (!missingCredentials.isEmpty()) {
                    return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.MISSING_CREDENTIAL,
                            "Node " + current + " requires unavailable credentials " + missingCredentials, current), null);
                }
            }

            s.visited.add(current);
            listener.onNodeStarted(s.runId, node, s.steps + 1);
            NodeInput input = new NodeInput(s.runId, node, s.context.get(node.getInputKeys()), s.context.snapshot(),
                    s.goal, s.token, timeoutFor(node));
            NodeExecution execution = nodeExecutor.execute(input, s.invocations, listener);
            NodeOutcome outcome = execution.outcome();
            if (outcome.getErrorKind() == ErrorKind.CANCELLED) {
                return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.CANCELLED, outcome.getErrorMessage(), current), null);
            }
            s.steps++;
            if (outcome.isSuccess()) {
                s.context.merge(outcome.getProduced());
            }
            listener.onNodeCompleted(s.runId, node, outcome, execution.attempts(), execution.elapsed());
            log.debug("Run {} step {} node {} -> {} after {} attempt(s)", s.runId, s.steps, current, outcome, execution.attempts());

            if (graph.isTerminalNode(current)) {
                return outcome.isSuccess()
                        ? finish(s, RunStatus.SUCCEEDED, null, null)
                        : finish(s, RunStatus.FAILED, RunError.of(outcome.getErrorKind(), outcome.getErrorMessage(), current), null);
            }
            Optional<String> next = router.select(graph, current, outcome, s.context.snapshot());
            if (next.isEmpty()) {
                String detail = outcome.isSuccess() ? "success"
                        : "failure (" + outcome.getErrorKind() + ": " + outcome.getErrorMessage() + ")";
                log.warn("Run {} has no edge from {} matching {}", s.runId, current, detail);
                return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.NO_MATCHING_EDGE,
                        "No edge from " + current + " matches outcome " + detail, current), null);
            }
            s.current = next.get();
        }
    }

    private RunResult pause(RunState s) {
        SessionSnapshot snapshot = new SessionSnapshot(null, s.runId, s.graph.getName(), s.graph.getVersion(), s.goalRef,
                s.current, s.context.snapshot(), s.steps, s.visited, s.invocations);
        return finish(s, RunStatus.PAUSED, null, snapshot);
    }

    private RunResult structuralFailure(RunState s, List<StructuralError> errors) {
        String message = errors.stream().map(StructuralError::toString).collect(Collectors.joining("; "));
        log.warn("Run {} rejected: graph {}@{} has {} structural error(s): {}",
                s.runId, s.graph.getName(), s.graph.getVersion(), errors.size(), message);
        return finish(s, RunStatus.FAILED, RunError.of(ErrorKind.STRUCTURAL, message, null), null);
    }

    private RunResult finish(RunState s, RunStatus status, RunError error, SessionSnapshot snapshot) {
        Map<String, Object> finalContext = s.context.snapshot();
        Map<String, Object> output = status == RunStatus.SUCCEEDED ? outputOf(s.graph, finalContext) : null;
        RunResult result = new RunResult(s.runId, s.graph.getName(), s.graph.getVersion(), s.goalRef, status, s.steps,
                output, finalContext, error, snapshot, s.visited, settings.getMode());
        if (error != null) {
            log.info("Run {} finished: status={} steps={} error={}", s.runId, status, s.steps, error);
        } else {
            log.info("Run {} finished: status={} steps={}{}", s.runId, status, s.steps,
                    snapshot != null ? " pausedAt=" + snapshot.getPausedAt() : "");
        }
        listener.onRunFinished(result);
        return result;
    }

    private static Map<String, Object> outputOf(GraphDefinition graph, Map<String, Object> context) {
        if (graph.getOutputKeys().isEmpty()) return context;
        Map<String, Object> output = new LinkedHashMap<>();
        for (String key : graph.getOutputKeys()) {
            if (context.containsKey(key)) output.put(key, context.get(key));
        }
        return output;
    }

    private Duration timeoutFor(NodeSpec node) {
        Integer seconds = node.getTimeoutSeconds();
        return seconds != null && seconds > 0 ? Duration.ofSeconds(seconds) : settings.getNodeTimeout();
    }

    private int budgetFor(RunOptions opts) {
        return opts.getStepBudget() != null ? opts.getStepBudget() : settings.getStepBudget();
    }

    private static CancellationToken tokenFor(RunOptions opts) {
        return opts.getCancellationToken() != null ? opts.getCancellationToken() : CancellationToken.none();
    }

    private static Goal resolveGoal(GraphDefinition graph, String goalRef) {
        Goal declared = graph.getGoal();
        if (declared != null && (goalRef == null || goalRef.equals(declared.getId()))) {
            return declared;
        }
        return goalRef != null ? Goal.ofRef(goalRef) : null;
    }

    /** Mutable bookkeeping of one run; never shared between runs. */
    private static final class RunState {
        final String runId;
        final GraphDefinition graph;
        final String goalRef;
        final Goal goal;
        final ExecutionContext context;
        final List<String> visited;
        final Map<String, Integer> invocations;
        final int budget;
        final CancellationToken token;
        int steps;
        String current;
        boolean resumeContinuation;

        RunState(String runId, GraphDefinition graph, String goalRef, Goal goal, ExecutionContext context, int steps,
                 List<String> visited, Map<String, Integer> invocations, String current, boolean resumeContinuation,
                 int budget, CancellationToken token) {
            this.runId = runId;
            this.graph = graph;
            this.goalRef = goalRef;
            this.goal = goal;
            this.context = context;
            this.steps = steps;
            this.visited = new ArrayList<>(visited);
            this.invocations = new LinkedHashMap<>(invocations);
            this.current = current;
            this.resumeContinuation = resumeContinuation;
            this.budget = budget;
            this.token = token;
        }
    }

    public static final class Builder {
        private final EngineSettings settings;
        private ModelCapability model = ModelCapability.unavailable();
        private ToolCapability tools = ToolRegistry.empty();
        private CredentialStore credentials = CredentialStore.none();
        private CredentialRequirements credentialRequirements = CredentialRequirements.none();
        private MockOutcomes mockOutcomes = MockOutcomes.canned();
        private final List<ExecutionListener> listeners = new ArrayList<>();
        private final List<NodeHandler> handlers = new ArrayList<>();

        private Builder(EngineSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
        }

        public Builder modelCapability(ModelCapability model) {
            this.model = Objects.requireNonNull(model, "model");
            return this;
        }

        public Builder toolCapability(ToolCapability tools) {
            this.tools = Objects.requireNonNull(tools, "tools");
            return this;
        }

        public Builder credentials(CredentialStore store, CredentialRequirements requirements) {
            this.credentials = Objects.requireNonNull(store, "store");
            this.credentialRequirements = Objects.requireNonNull(requirements, "requirements");
            return this;
        }

        /** Outcomes for model and tool nodes; only used when the settings select {@link ExecutionMode#MOCK}. */
        public Builder mockOutcomes(MockOutcomes mockOutcomes) {
            this.mockOutcomes = Objects.requireNonNull(mockOutcomes, "mockOutcomes");
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /** Adds or replaces the handler for the kinds it supports. Mock mode still takes precedence for model and tool. */
        public Builder handler(NodeHandler handler) {
            handlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(this);
        }
    }
}
