package xyz.vvrf.canvas.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.DataPropagatorFactory;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatistics;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;
import xyz.vvrf.canvas.flow.core.ExecutionStatusSnapshot;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;
import xyz.vvrf.canvas.flow.core.RetryPolicy;
import xyz.vvrf.canvas.flow.core.ValidationResult;
import xyz.vvrf.canvas.flow.core.VariableResolver;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.history.ExecutionHistory;
import xyz.vvrf.canvas.flow.monitor.CompositeWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.WorkflowMonitorListener;
import xyz.vvrf.canvas.flow.propagation.InMemoryDataPropagator;
import xyz.vvrf.canvas.flow.util.GraphUtils;
import xyz.vvrf.canvas.flow.validation.WorkflowValidator;
import xyz.vvrf.canvas.flow.variable.PatternVariableResolver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * WorkflowEngine 的标准实现。
 * <p>
 * 执行计划是 Kahn 拓扑顺序。每个块对应一个缓存的 Mono，它先等待所有直接前驱结束 (无论成功与否)，
 * 再等待暂停解除，最后检查取消并交给 {@link BlockExecutor}。
 * 按计划顺序以 {@code maxConcurrency} 为并发度订阅这些 Mono；并发度为 1 时块严格依次执行。
 * 最终结果按计划顺序排列，运行取消后从未开始的块记为 SKIPPED。
 */
@Slf4j
public class StandardWorkflowEngine implements WorkflowEngine {

    static final String EXECUTION_ID_PREFIX = "exec_";

    private final WorkflowValidator validator;
    private final DataPropagatorFactory dataPropagatorFactory;
    private final BlockExecutor blockExecutor;
    private final Scheduler executionScheduler;
    private final WorkflowMonitorListener monitorListener;
    private final ExecutionHistory executionHistory;
    private final int defaultMaxConcurrency;

    private final ExecutionRegistry registry = new ExecutionRegistry();
    private final AtomicLong executionCounter = new AtomicLong(0);

    public StandardWorkflowEngine(WorkflowValidator validator,
                                  DataPropagatorFactory dataPropagatorFactory,
                                  BlockExecutor blockExecutor,
                                  Scheduler executionScheduler,
                                  WorkflowMonitorListener monitorListener,
                                  ExecutionHistory executionHistory,
                                  int defaultMaxConcurrency) {
        this.validator = Objects.requireNonNull(validator, "WorkflowValidator cannot be null");
        this.dataPropagatorFactory = Objects.requireNonNull(dataPropagatorFactory, "DataPropagatorFactory cannot be null");
        this.blockExecutor = Objects.requireNonNull(blockExecutor, "BlockExecutor cannot be null");
        this.executionScheduler = Objects.requireNonNull(executionScheduler, "Execution scheduler cannot be null");
        this.monitorListener = Objects.requireNonNull(monitorListener, "WorkflowMonitorListener cannot be null");
        this.executionHistory = executionHistory;
        if (defaultMaxConcurrency <= 0) {
            throw new IllegalArgumentException("Max concurrency must be positive.");
        }
        this.defaultMaxConcurrency = defaultMaxConcurrency;
        log.info("StandardWorkflowEngine initialized. Executor: {}, default max concurrency: {}, history: {}",
                blockExecutor.getClass().getSimpleName(), defaultMaxConcurrency, executionHistory != null ? "enabled" : "disabled");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Mono<ExecutionResult> executeWorkflow(WorkflowGraph graph, ExecutionOptions options) {
        return Mono.defer(() -> start(graph, options).getResult());
    }

    @Override
    public WorkflowExecution start(WorkflowGraph graph, ExecutionOptions options) {
        Objects.requireNonNull(graph, "WorkflowGraph cannot be null");
        final ExecutionOptions effectiveOptions = options != null ? options : ExecutionOptions.DEFAULT;

        ValidationResult validation = validator.validate(graph);
        if (!validation.isValid()) {
            log.warn("Rejecting workflow with {} validation error(s): {}",
                    validation.getErrors().size(), validation.describeErrors());
            throw new WorkflowValidationException(validation);
        }

        List<String> plan = GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections());
        String executionId = nextExecutionId();
        WorkflowExecutionContext context = new WorkflowExecutionContext(
                executionId, graph, effectiveOptions, plan, dataPropagatorFactory.create(graph));
        registry.register(context);
        monitorListener.onExecutionStart(executionId, graph, effectiveOptions);

        Mono<ExecutionResult> result = runPlan(context)
                .doFinally(signal -> registry.remove(executionId))
                .cache();
        result.subscribe(
                r -> log.debug("[ExecutionId: {}] Result published with status {}", executionId, r.getStatus()),
                e -> log.error("[ExecutionId: {}] Execution terminated with unexpected error: {}", executionId, e.getMessage(), e));
        return new WorkflowExecution(executionId, result);
    }

    @Override
    public boolean pauseExecution(String executionId) {
        return registry.find(executionId)
                .map(context -> {
                    boolean paused = context.pause();
                    if (paused) {
                        log.info("[ExecutionId: {}] Execution paused", executionId);
                        monitorListener.onExecutionPaused(executionId);
                    } else {
                        log.debug("[ExecutionId: {}] Pause ignored in status {}", executionId, context.getStatus());
                    }
                    return paused;
                })
                .orElseGet(() -> ignoreUnknown("pause", executionId));
    }

    @Override
    public boolean resumeExecution(String executionId) {
        return registry.find(executionId)
                .map(context -> {
                    boolean resumed = context.resume();
                    if (resumed) {
                        log.info("[ExecutionId: {}] Execution resumed", executionId);
                        monitorListener.onExecutionResumed(executionId);
                    } else {
                        log.debug("[ExecutionId: {}] Resume ignored in status {}", executionId, context.getStatus());
                    }
                    return resumed;
                })
                .orElseGet(() -> ignoreUnknown("resume", executionId));
    }

    @Override
    public boolean cancelExecution(String executionId) {
        return registry.find(executionId)
                .map(context -> {
                    boolean cancelled = context.cancel();
                    if (cancelled) {
                        log.info("[ExecutionId: {}] Execution cancelled", executionId);
                        monitorListener.onExecutionCancelled(executionId);
                    } else {
                        log.debug("[ExecutionId: {}] Cancel ignored in status {}", executionId, context.getStatus());
                    }
                    return cancelled;
                })
                .orElseGet(() -> ignoreUnknown("cancel", executionId));
    }

    @Override
    public Optional<ExecutionStatusSnapshot> getExecutionStatus(String executionId) {
        return registry.find(executionId).map(context -> {
            Instant now = Instant.now();
            return ExecutionStatusSnapshot.builder()
                    .executionId(executionId)
                    .status(context.getStatus())
                    .progress(context.snapshotProgress())
                    .startTime(context.getStartTime())
                    .estimatedCompletion(context.estimateCompletion(now).orElse(null))
                    .build();
        });
    }

    @Override
    public Set<String> getActiveExecutionIds() {
        return registry.activeExecutionIds();
    }

    @Override
    public Optional<ExecutionResult> getExecutionResult(String executionId) {
        if (executionHistory == null || executionId == null) {
            return Optional.empty();
        }
        return executionHistory.find(executionId);
    }

    private Mono<ExecutionResult> runPlan(WorkflowExecutionContext context) {
        final WorkflowGraph graph = context.getGraph();
        final int concurrency = resolveConcurrency(context.getOptions());
        final Set<String> blockIds = graph.blockIds();

        // 计划为拓扑顺序，构建某个块时其前驱的 Mono 已经存在
        Map<String, Mono<Void>> blockMonos = new HashMap<>();
        for (String blockId : context.getPlan()) {
            Block block = graph.findBlock(blockId)
                    .orElseThrow(() -> new IllegalStateException("Planned block disappeared from graph: " + blockId));
            List<Mono<Void>> predecessors = GraphUtils.directPredecessors(blockId, blockIds, graph.getConnections())
                    .stream()
                    .map(blockMonos::get)
                    .collect(Collectors.toList());
            Mono<Void> blockMono = Mono.when(predecessors)
                    .then(Mono.defer(() -> processBlock(block, context)))
                    .cache();
            blockMonos.put(blockId, blockMono);
        }

        log.debug("[ExecutionId: {}] Executing plan {} with concurrency {}",
                context.getExecutionId(), context.getPlan(), concurrency);

        return Flux.fromIterable(context.getPlan())
                .flatMap(blockMonos::get, concurrency)
                .then(Mono.fromCallable(() -> finalizeExecution(context)));
    }

    private Mono<Void> processBlock(Block block, WorkflowExecutionContext context) {
        return context.awaitRunnable()
                .publishOn(executionScheduler)
                .then(Mono.defer(() -> {
                    if (context.isCancelled()) {
                        log.debug("[ExecutionId: {}] Execution cancelled, block '{}' will not start",
                                context.getExecutionId(), block.getNumber());
                        return Mono.<Void>empty();
                    }
                    final long startNanos = System.nanoTime();
                    return blockExecutor.execute(block, context)
                            .onErrorResume(error -> Mono.just(unexpectedFailure(block, context, error, startNanos)))
                            .doOnNext(context::recordResult)
                            .then();
                }));
    }

    /**
     * BlockExecutor 本不应发出错误信号；若发生，则转换为 FAILED 结果，保证运行仍能正常结束。
     */
    private BlockResult unexpectedFailure(Block block, WorkflowExecutionContext context, Throwable error, long startNanos) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("[ExecutionId: {}] BlockExecutor signalled an error for block '{}': {}",
                context.getExecutionId(), block.getNumber(), message, error);
        BlockResult failed = BlockResult.failed(block, message, duration.toMillis(), 0);
        monitorListener.onBlockFailure(context.getExecutionId(), block, failed, error, duration);
        return failed;
    }

    private ExecutionResult finalizeExecution(WorkflowExecutionContext context) {
        final String executionId = context.getExecutionId();
        ExecutionStatus finalStatus = context.complete();
        Instant endTime = Instant.now();

        List<BlockResult> results = new ArrayList<>(context.getPlan().size());
        for (String blockId : context.getPlan()) {
            Optional<BlockResult> recorded = context.findResult(blockId);
            if (recorded.isPresent()) {
                results.add(recorded.get());
            } else {
                Block block = context.getGraph().findBlock(blockId)
                        .orElseThrow(() -> new IllegalStateException("Planned block disappeared from graph: " + blockId));
                results.add(BlockResult.skipped(block));
                monitorListener.onBlockSkipped(executionId, block);
            }
        }

        ExecutionResult result = ExecutionResult.builder()
                .executionId(executionId)
                .status(finalStatus)
                .results(results)
                .statistics(ExecutionStatistics.from(results, context.getStartTime(), endTime))
                .errors(context.getErrors())
                .startTime(context.getStartTime())
                .endTime(endTime)
                .build();

        registry.remove(executionId);
        if (executionHistory != null) {
            executionHistory.record(result);
        }

        Duration totalDuration = Duration.between(context.getStartTime(), endTime);
        log.info("[ExecutionId: {}] Execution finished with status {} in {}ms. Completed: {}, Failed: {}, Skipped: {}",
                executionId, finalStatus, totalDuration.toMillis(),
                result.getStatistics().getCompletedBlocks(),
                result.getStatistics().getFailedBlocks(),
                result.getStatistics().getSkippedBlocks());
        monitorListener.onExecutionComplete(executionId, result, totalDuration);
        return result;
    }

    private int resolveConcurrency(ExecutionOptions options) {
        Integer requested = options.getMaxConcurrency();
        if (requested == null) {
            return defaultMaxConcurrency;
        }
        if (requested <= 0) {
            log.warn("Ignoring non-positive maxConcurrency {}, using default {}", requested, defaultMaxConcurrency);
            return defaultMaxConcurrency;
        }
        return requested;
    }

    private String nextExecutionId() {
        return EXECUTION_ID_PREFIX + System.currentTimeMillis() + "_" + executionCounter.incrementAndGet();
    }

    private static boolean ignoreUnknown(String operation, String executionId) {
        log.debug("Ignoring {} for unknown or finished execution '{}'", operation, executionId);
        return false;
    }

    /**
     * 在非 Spring 环境中组装引擎。除生成调度器外的组件均有默认实现。
     */
    public static final class Builder {
        private VariableResolver variableResolver;
        private GenerationDispatcher generationDispatcher;
        private DataPropagatorFactory dataPropagatorFactory;
        private BlockExecutor blockExecutor;
        private Scheduler scheduler;
        private final List<WorkflowMonitorListener> listeners = new ArrayList<>();
        private ExecutionHistory executionHistory;
        private Duration defaultBlockTimeout = Duration.ofMinutes(5);
        private RetryPolicy defaultRetryPolicy = RetryPolicy.NONE;
        private int maxConcurrency = 1;
        private int connectionWarningThreshold = WorkflowValidator.DEFAULT_CONNECTION_WARNING_THRESHOLD;

        private Builder() {}

        public Builder variableResolver(VariableResolver variableResolver) {
            this.variableResolver = variableResolver;
            return this;
        }

        public Builder generationDispatcher(GenerationDispatcher generationDispatcher) {
            this.generationDispatcher = generationDispatcher;
            return this;
        }

        public Builder dataPropagatorFactory(DataPropagatorFactory dataPropagatorFactory) {
            this.dataPropagatorFactory = dataPropagatorFactory;
            return this;
        }

        /**
         * 替换默认的 {@link StandardBlockExecutor}。设置后 resolver、dispatcher、超时与重试设置不再使用。
         */
        public Builder blockExecutor(BlockExecutor blockExecutor) {
            this.blockExecutor = blockExecutor;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder listener(WorkflowMonitorListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
            return this;
        }

        public Builder listeners(List<? extends WorkflowMonitorListener> listeners) {
            listeners.forEach(this::listener);
            return this;
        }

        public Builder executionHistory(ExecutionHistory executionHistory) {
            this.executionHistory = executionHistory;
            return this;
        }

        public Builder defaultBlockTimeout(Duration defaultBlockTimeout) {
            this.defaultBlockTimeout = defaultBlockTimeout;
            return this;
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder connectionWarningThreshold(int connectionWarningThreshold) {
            this.connectionWarningThreshold = connectionWarningThreshold;
            return this;
        }

        public StandardWorkflowEngine build() {
            VariableResolver resolver = variableResolver != null ? variableResolver : new PatternVariableResolver();
            Scheduler effectiveScheduler = scheduler != null ? scheduler : Schedulers.boundedElastic();
            WorkflowMonitorListener compositeListener = new CompositeWorkflowMonitorListener(listeners);
            BlockExecutor executor = blockExecutor;
            if (executor == null) {
                Objects.requireNonNull(generationDispatcher, "GenerationDispatcher is required when no BlockExecutor is given");
                executor = new StandardBlockExecutor(resolver, generationDispatcher, effectiveScheduler,
                        compositeListener, defaultBlockTimeout, defaultRetryPolicy);
            }
            return new StandardWorkflowEngine(
                    new WorkflowValidator(resolver, connectionWarningThreshold),
                    dataPropagatorFactory != null ? dataPropagatorFactory : InMemoryDataPropagator::new,
                    executor,
                    effectiveScheduler,
                    compositeListener,
                    executionHistory,
                    maxConcurrency);
        }
    }
}
