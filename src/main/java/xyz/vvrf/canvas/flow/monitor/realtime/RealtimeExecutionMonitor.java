package xyz.vvrf.canvas.flow.monitor.realtime;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;
import xyz.vvrf.canvas.flow.core.NotificationSettings;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.monitor.WorkflowMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 为每次运行维护一个可重放的事件流，供调用方实时订阅进度。
 * <p>
 * 事件是否发布由运行的 {@link NotificationSettings} 决定:
 * onProgress 控制块开始/成功/跳过及暂停恢复事件，onError 控制失败与重试事件，
 * onCompletion 控制结束事件。运行开始事件总是发布。
 * 运行结束后事件流完成，并在保留时间之后被移除。
 */
@Slf4j
public class RealtimeExecutionMonitor implements WorkflowMonitorListener {

    private static final int REPLAY_LIMIT = 512;
    private static final int SUMMARY_LIMIT = 200;

    private final Map<String, Sinks.Many<ExecutionEvent>> sinksByExecutionId = new ConcurrentHashMap<>();
    private final Map<String, NotificationSettings> settingsByExecutionId = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Scheduler cleanupScheduler;

    public RealtimeExecutionMonitor(Duration retention) {
        this(retention, Schedulers.boundedElastic());
    }

    public RealtimeExecutionMonitor(Duration retention, Scheduler cleanupScheduler) {
        this.retention = Objects.requireNonNull(retention, "Retention cannot be null");
        this.cleanupScheduler = Objects.requireNonNull(cleanupScheduler, "Cleanup scheduler cannot be null");
    }

    /**
     * 订阅某次运行的事件流。已发生的事件会被重放；未知的执行 ID 返回空流。
     */
    public Flux<ExecutionEvent> events(String executionId) {
        Sinks.Many<ExecutionEvent> sink = sinksByExecutionId.get(executionId);
        return sink != null ? sink.asFlux() : Flux.empty();
    }

    public boolean isTracking(String executionId) {
        return sinksByExecutionId.containsKey(executionId);
    }

    @Override
    public void onExecutionStart(String executionId, WorkflowGraph graph, ExecutionOptions options) {
        sinksByExecutionId.put(executionId, Sinks.many().replay().limit(REPLAY_LIMIT));
        settingsByExecutionId.put(executionId, options.effectiveNotificationSettings());
        emitEvent(executionId, ExecutionEvent.builder()
                .executionId(executionId)
                .eventType(ExecutionEvent.EventType.EXECUTION_START)
                .executionStatus(ExecutionStatus.RUNNING)
                .build());
    }

    @Override
    public void onExecutionComplete(String executionId, ExecutionResult result, Duration totalDuration) {
        if (settings(executionId).completionEnabled()) {
            emitEvent(executionId, ExecutionEvent.builder()
                    .executionId(executionId)
                    .eventType(ExecutionEvent.EventType.EXECUTION_COMPLETE)
                    .executionStatus(result.getStatus())
                    .statistics(result.getStatistics())
                    .durationMillis(totalDuration.toMillis())
                    .build());
        }
        Sinks.Many<ExecutionEvent> sink = sinksByExecutionId.get(executionId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
        cleanupScheduler.schedule(() -> {
            sinksByExecutionId.remove(executionId);
            settingsByExecutionId.remove(executionId);
            log.debug("Cleaned up realtime monitoring resources for execution {}", executionId);
        }, retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void onExecutionPaused(String executionId) {
        emitStateChange(executionId, ExecutionStatus.PAUSED);
    }

    @Override
    public void onExecutionResumed(String executionId) {
        emitStateChange(executionId, ExecutionStatus.RUNNING);
    }

    @Override
    public void onExecutionCancelled(String executionId) {
        emitStateChange(executionId, ExecutionStatus.CANCELLED);
    }

    @Override
    public void onBlockStart(String executionId, Block block) {
        if (settings(executionId).progressEnabled()) {
            emitEvent(executionId, blockEvent(executionId, block, null).build());
        }
    }

    @Override
    public void onBlockSuccess(String executionId, Block block, BlockResult result, Duration duration) {
        if (settings(executionId).progressEnabled()) {
            emitEvent(executionId, blockEvent(executionId, block, BlockResult.BlockStatus.COMPLETED)
                    .durationMillis(duration.toMillis())
                    .retryNumber(result.getRetryCount())
                    .outputSummary(summarize(result.getOutput().orElse(null)))
                    .build());
        }
    }

    @Override
    public void onBlockFailure(String executionId, Block block, BlockResult result, Throwable error, Duration duration) {
        if (settings(executionId).errorEnabled()) {
            emitEvent(executionId, blockEvent(executionId, block, BlockResult.BlockStatus.FAILED)
                    .durationMillis(duration.toMillis())
                    .retryNumber(result.getRetryCount())
                    .errorSummary(summarize(result.getError().orElse(null)))
                    .build());
        }
    }

    @Override
    public void onBlockRetry(String executionId, Block block, int retryNumber, Throwable cause) {
        if (settings(executionId).errorEnabled()) {
            emitEvent(executionId, blockEvent(executionId, block, null)
                    .eventType(ExecutionEvent.EventType.BLOCK_RETRY)
                    .retryNumber(retryNumber)
                    .errorSummary(summarize(cause != null ? cause.getMessage() : null))
                    .build());
        }
    }

    @Override
    public void onBlockSkipped(String executionId, Block block) {
        if (settings(executionId).progressEnabled()) {
            emitEvent(executionId, blockEvent(executionId, block, BlockResult.BlockStatus.SKIPPED).build());
        }
    }

    private void emitStateChange(String executionId, ExecutionStatus status) {
        if (settings(executionId).progressEnabled()) {
            emitEvent(executionId, ExecutionEvent.builder()
                    .executionId(executionId)
                    .eventType(ExecutionEvent.EventType.EXECUTION_STATE)
                    .executionStatus(status)
                    .build());
        }
    }

    private ExecutionEvent.ExecutionEventBuilder blockEvent(String executionId, Block block, BlockResult.BlockStatus status) {
        return ExecutionEvent.builder()
                .executionId(executionId)
                .eventType(ExecutionEvent.EventType.BLOCK_UPDATE)
                .blockId(block.getId())
                .blockNumber(block.getNumber())
                .blockKind(block.getKind())
                .blockStatus(status);
    }

    private NotificationSettings settings(String executionId) {
        return settingsByExecutionId.getOrDefault(executionId, NotificationSettings.ALL);
    }

    private void emitEvent(String executionId, ExecutionEvent event) {
        Sinks.Many<ExecutionEvent> sink = sinksByExecutionId.get(executionId);
        if (sink == null) {
            log.debug("No realtime sink for execution {}, dropping {} event", executionId, event.getEventType());
            return;
        }
        event.setTimestamp(Instant.now());
        Sinks.EmitResult emitResult;
        // 块事件可能来自多个调度线程
        synchronized (sink) {
            emitResult = sink.tryEmitNext(event);
        }
        if (emitResult.isFailure()) {
            log.warn("Failed to emit {} event for execution {}: {}", event.getEventType(), executionId, emitResult);
        }
    }

    private String summarize(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > SUMMARY_LIMIT ? text.substring(0, SUMMARY_LIMIT - 3) + "..." : text;
    }
}
