package xyz.vvrf.canvas.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;
import xyz.vvrf.canvas.flow.core.RetryPolicy;
import xyz.vvrf.canvas.flow.core.VariableResolver;
import xyz.vvrf.canvas.flow.monitor.WorkflowMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BlockExecutor 的标准实现。
 * 解析变量后调用生成调度器，对每次尝试应用超时，并按重试策略重试；
 * 成功时发布输出，失败时转换为 FAILED 结果，不向外抛出错误。
 */
@Slf4j
public class StandardBlockExecutor implements BlockExecutor {

    private final VariableResolver variableResolver;
    private final GenerationDispatcher generationDispatcher;
    private final Scheduler blockExecutionScheduler;
    private final WorkflowMonitorListener monitorListener;
    private final Duration defaultBlockTimeout;
    private final RetryPolicy defaultRetryPolicy;

    /**
     * @param variableResolver        变量解析器
     * @param generationDispatcher    生成调度器
     * @param blockExecutionScheduler 生成调用所在的 Reactor Scheduler
     * @param monitorListener         监控监听器 (通常为组合监听器)
     * @param defaultBlockTimeout     选项未指定时的单次尝试超时
     * @param defaultRetryPolicy      选项未指定时的重试策略
     */
    public StandardBlockExecutor(VariableResolver variableResolver,
                                 GenerationDispatcher generationDispatcher,
                                 Scheduler blockExecutionScheduler,
                                 WorkflowMonitorListener monitorListener,
                                 Duration defaultBlockTimeout,
                                 RetryPolicy defaultRetryPolicy) {
        this.variableResolver = Objects.requireNonNull(variableResolver, "VariableResolver cannot be null");
        this.generationDispatcher = Objects.requireNonNull(generationDispatcher, "GenerationDispatcher cannot be null");
        this.blockExecutionScheduler = Objects.requireNonNull(blockExecutionScheduler, "Block execution scheduler cannot be null");
        this.monitorListener = Objects.requireNonNull(monitorListener, "WorkflowMonitorListener cannot be null");
        this.defaultBlockTimeout = Objects.requireNonNull(defaultBlockTimeout, "Default block timeout cannot be null");
        this.defaultRetryPolicy = defaultRetryPolicy != null ? defaultRetryPolicy : RetryPolicy.NONE;
        log.info("StandardBlockExecutor initialized. Default timeout: {}, default retries: {}, scheduler: {}",
                defaultBlockTimeout, this.defaultRetryPolicy.getMaxRetries(), blockExecutionScheduler);
    }

    @Override
    public Mono<BlockResult> execute(Block block, WorkflowExecutionContext context) {
        final String executionId = context.getExecutionId();
        final ExecutionOptions options = context.getOptions();

        return Mono.defer(() -> {
            Instant startTime = Instant.now();
            context.markStarted(block);
            monitorListener.onBlockStart(executionId, block);

            String resolvedPrompt;
            try {
                Map<String, String> upstreamData = context.getDataPropagator().getUpstreamData(block.getId());
                log.debug("[ExecutionId: {}] Block '{}' has {} upstream output(s): {}",
                        executionId, block.getNumber(), upstreamData.size(), upstreamData.keySet());
                resolvedPrompt = variableResolver.resolve(block.getPromptTemplate(), upstreamData);
            } catch (RuntimeException e) {
                log.warn("[ExecutionId: {}] Block '{}' failed while preparing its prompt: {}",
                        executionId, block.getNumber(), e.getMessage());
                return Mono.just(handleFailure(block, context, e, startTime, 0, null));
            }

            Duration timeout = effectiveTimeout(options);
            RetryPolicy retryPolicy = effectiveRetryPolicy(options);
            AtomicInteger retries = new AtomicInteger(0);

            log.debug("[ExecutionId: {}] Dispatching block '{}' (kind: {}, timeout: {}, maxRetries: {})",
                    executionId, block.getNumber(), block.getKind(), timeout, retryPolicy.getMaxRetries());

            return Mono.defer(() -> generationDispatcher.generate(block, resolvedPrompt, options))
                    .subscribeOn(blockExecutionScheduler)
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                            String.format("Generation for block %s returned no output", block.getNumber()))))
                    .timeout(timeout)
                    .doOnError(TimeoutException.class, e -> {
                        log.warn("[ExecutionId: {}] Block '{}' generation attempt timed out after {}",
                                executionId, block.getNumber(), timeout);
                        monitorListener.onBlockTimeout(executionId, block, timeout);
                    })
                    .retryWhen(toRetry(retryPolicy, block, context, retries))
                    .map(output -> handleSuccess(block, context, output, startTime, retries.get()))
                    .onErrorResume(error -> Mono.just(handleFailure(block, context, error, startTime, retries.get(), timeout)));
        });
    }

    private BlockResult handleSuccess(Block block, WorkflowExecutionContext context, String output,
                                      Instant startTime, int retryCount) {
        Duration duration = Duration.between(startTime, Instant.now());
        context.getDataPropagator().propagate(block.getId(), output, block.getKind(), block.getNumber());
        BlockResult result = BlockResult.completed(block, output, duration.toMillis(), retryCount);
        log.debug("[ExecutionId: {}] Block '{}' completed in {}ms after {} retr{}",
                context.getExecutionId(), block.getNumber(), duration.toMillis(), retryCount, retryCount == 1 ? "y" : "ies");
        monitorListener.onBlockSuccess(context.getExecutionId(), block, result, duration);
        return result;
    }

    private BlockResult handleFailure(Block block, WorkflowExecutionContext context, Throwable error,
                                      Instant startTime, int retryCount, Duration timeout) {
        Duration duration = Duration.between(startTime, Instant.now());
        String message = describe(error, timeout);
        BlockResult result = BlockResult.failed(block, message, duration.toMillis(), retryCount);
        log.warn("[ExecutionId: {}] Block '{}' failed after {}ms and {} retr{}: {}",
                context.getExecutionId(), block.getNumber(), duration.toMillis(), retryCount,
                retryCount == 1 ? "y" : "ies", message);
        monitorListener.onBlockFailure(context.getExecutionId(), block, result, error, duration);
        return result;
    }

    /**
     * 按 {@link RetryPolicy} 构造重试规范。运行已取消时不再重试。
     * 每次重试前递增 {@code retries}，用于记录到结果中。
     */
    private Retry toRetry(RetryPolicy policy, Block block, WorkflowExecutionContext context, AtomicInteger retries) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retryIndex = signal.totalRetries();
            if (retryIndex >= policy.getMaxRetries() || context.isCancelled()) {
                return Mono.<Integer>error(failure);
            }
            int retryNumber = retries.incrementAndGet();
            Duration delay = policy.delayForRetry(retryIndex);
            log.debug("[ExecutionId: {}] Retrying block '{}' ({}/{}) in {} after: {}",
                    context.getExecutionId(), block.getNumber(), retryNumber, policy.getMaxRetries(), delay,
                    failure.getMessage());
            monitorListener.onBlockRetry(context.getExecutionId(), block, retryNumber, failure);
            if (delay.isZero()) {
                return Mono.just(retryNumber);
            }
            return Mono.delay(delay, blockExecutionScheduler).thenReturn(retryNumber);
        }));
    }

    private Duration effectiveTimeout(ExecutionOptions options) {
        Duration timeout = options.getBlockTimeout();
        return (timeout != null && !timeout.isZero() && !timeout.isNegative()) ? timeout : defaultBlockTimeout;
    }

    private RetryPolicy effectiveRetryPolicy(ExecutionOptions options) {
        return options.getRetryPolicy() != null ? options.getRetryPolicy() : defaultRetryPolicy;
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException && timeout != null) {
            return String.format("Generation timed out after %dms", timeout.toMillis());
        }
        String message = error.getMessage();
        return (message != null && !message.isEmpty()) ? message : error.getClass().getSimpleName();
    }
}
