package xyz.vvrf.canvas.flow.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.DataPropagator;
import xyz.vvrf.canvas.flow.core.ExecutionError;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionProgress;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 封装单次工作流运行的运行时状态。
 * 每个 {@link StandardWorkflowEngine#start} 调用都会创建一个此类的实例，并在运行结束时从注册表移除。
 * <p>
 * 状态是唯一由外部线程 (暂停/恢复/取消) 修改的字段，所有状态迁移都在对象锁内完成。
 * 暂停时创建一次性的恢复信号，恢复或取消时触发，执行流程在信号上等待而不是轮询。
 */
@Slf4j
public class WorkflowExecutionContext {

    @Getter
    private final String executionId;
    @Getter
    private final WorkflowGraph graph;
    @Getter
    private final ExecutionOptions options;
    @Getter
    private final List<String> plan;
    @Getter
    private final DataPropagator dataPropagator;
    @Getter
    private final Instant startTime;

    private final AtomicReference<ExecutionStatus> status = new AtomicReference<>(ExecutionStatus.RUNNING);
    private final AtomicInteger completedCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);
    private final AtomicReference<String> currentBlockNumber = new AtomicReference<>();
    private final Map<String, BlockResult> resultsByBlockId = new ConcurrentHashMap<>();
    private final Queue<ExecutionError> errors = new ConcurrentLinkedQueue<>();

    // guarded by this
    private Sinks.Empty<Void> resumeSignal;

    public WorkflowExecutionContext(String executionId,
                                    WorkflowGraph graph,
                                    ExecutionOptions options,
                                    List<String> plan,
                                    DataPropagator dataPropagator) {
        this.executionId = executionId;
        this.graph = graph;
        this.options = options;
        this.plan = Collections.unmodifiableList(new ArrayList<>(plan));
        this.dataPropagator = dataPropagator;
        this.startTime = Instant.now();
        log.info("[ExecutionId: {}] Created execution context (Blocks: {}, Connections: {})",
                executionId, graph.size(), graph.getConnections().size());
    }

    public ExecutionStatus getStatus() {
        return status.get();
    }

    public boolean isCancelled() {
        return status.get() == ExecutionStatus.CANCELLED;
    }

    /**
     * RUNNING -> PAUSED。
     *
     * @return 是否发生了状态迁移
     */
    public synchronized boolean pause() {
        if (status.get() != ExecutionStatus.RUNNING) {
            return false;
        }
        resumeSignal = Sinks.empty();
        status.set(ExecutionStatus.PAUSED);
        return true;
    }

    /**
     * PAUSED -> RUNNING，并唤醒等待中的执行流程。
     *
     * @return 是否发生了状态迁移
     */
    public synchronized boolean resume() {
        if (status.get() != ExecutionStatus.PAUSED) {
            return false;
        }
        status.set(ExecutionStatus.RUNNING);
        fireResumeSignal();
        return true;
    }

    /**
     * 任意非终止状态 -> CANCELLED。正在执行的生成调用不会被中断。
     *
     * @return 是否发生了状态迁移
     */
    public synchronized boolean cancel() {
        ExecutionStatus current = status.get();
        if (current.isTerminal()) {
            return false;
        }
        status.set(ExecutionStatus.CANCELLED);
        if (current == ExecutionStatus.PAUSED) {
            fireResumeSignal();
        }
        return true;
    }

    /**
     * 计算并设置终止状态: 已取消 > 有失败 > 完成。
     */
    synchronized ExecutionStatus complete() {
        ExecutionStatus current = status.get();
        if (current.isTerminal()) {
            return current;
        }
        ExecutionStatus terminal = failedCount.get() > 0 ? ExecutionStatus.FAILED : ExecutionStatus.COMPLETED;
        status.set(terminal);
        return terminal;
    }

    /**
     * 如果当前处于暂停状态，返回的 Mono 在恢复或取消后完成；否则立即完成。
     * 恢复后会再次检查，以应对紧接着的再次暂停。
     */
    public Mono<Void> awaitRunnable() {
        return Mono.defer(() -> {
            Sinks.Empty<Void> signal = pendingResumeSignal();
            if (signal == null) {
                return Mono.<Void>empty();
            }
            log.debug("[ExecutionId: {}] Paused, waiting for resume signal", executionId);
            return signal.asMono().then(awaitRunnable());
        });
    }

    private synchronized Sinks.Empty<Void> pendingResumeSignal() {
        return status.get() == ExecutionStatus.PAUSED ? resumeSignal : null;
    }

    private void fireResumeSignal() {
        if (resumeSignal != null) {
            resumeSignal.tryEmitEmpty();
            resumeSignal = null;
        }
    }

    void markStarted(Block block) {
        currentBlockNumber.set(block.getNumber());
    }

    /**
     * 记录一个块的最终结果并更新进度。失败的结果同时生成一条 {@link ExecutionError}。
     *
     * @return 如果结果是新记录的，则返回 true
     */
    boolean recordResult(BlockResult result) {
        if (resultsByBlockId.putIfAbsent(result.getBlockId(), result) != null) {
            log.warn("[ExecutionId: {}] Result for block '{}' already recorded, ignoring {}",
                    executionId, result.getBlockNumber(), result.getStatus());
            return false;
        }
        if (result.isCompleted()) {
            completedCount.incrementAndGet();
        } else if (result.isFailed()) {
            failedCount.incrementAndGet();
            errors.add(ExecutionError.builder()
                    .blockId(result.getBlockId())
                    .blockNumber(result.getBlockNumber())
                    .error(result.getError().orElse("Unknown error"))
                    .timestamp(Instant.now())
                    .retryCount(result.getRetryCount())
                    .build());
        }
        log.debug("[ExecutionId: {}] Block '{}' finished with status {}. Progress: {}/{} (failed: {})",
                executionId, result.getBlockNumber(), result.getStatus(),
                completedCount.get(), plan.size(), failedCount.get());
        return true;
    }

    Optional<BlockResult> findResult(String blockId) {
        return Optional.ofNullable(resultsByBlockId.get(blockId));
    }

    List<ExecutionError> getErrors() {
        return new ArrayList<>(errors);
    }

    public ExecutionProgress snapshotProgress() {
        return new ExecutionProgress(plan.size(), completedCount.get(), failedCount.get(), currentBlockNumber.get());
    }

    /**
     * 线性外推预计完成时间: {@code now + (elapsed / completed) * (total - completed)}。
     * 尚无完成的块时返回空。
     */
    public Optional<Instant> estimateCompletion(Instant now) {
        int completed = completedCount.get();
        if (completed == 0) {
            return Optional.empty();
        }
        long elapsedMillis = Duration.between(startTime, now).toMillis();
        long remaining = Math.max(0, plan.size() - completed);
        long estimatedRemainingMillis = Math.round((double) elapsedMillis / completed * remaining);
        return Optional.of(now.plusMillis(estimatedRemainingMillis));
    }
}
