package xyz.vvrf.canvas.flow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionResult;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 将块执行事件记录为 Micrometer 指标。
 */
@Slf4j
public class MicrometerWorkflowMonitorListener implements WorkflowMonitorListener {

    // 指标名称
    public static final String METRIC_BLOCK_EXECUTION_TIME = "canvas.flow.block.execution.time";
    public static final String METRIC_BLOCK_EXECUTION_TOTAL = "canvas.flow.block.execution.total";
    public static final String METRIC_BLOCK_TIMEOUT_TOTAL = "canvas.flow.block.timeout.total";
    public static final String METRIC_BLOCK_RETRY_TOTAL = "canvas.flow.block.retry.total";
    public static final String METRIC_EXECUTION_TOTAL = "canvas.flow.execution.total";

    // 标签键
    private static final String TAG_BLOCK_KIND = "block.kind";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_SKIPPED = "SKIPPED";
    private static final String STATUS_TIMEOUT = "TIMEOUT";
    private static final String NO_ERROR = "none";

    private final MeterRegistry meterRegistry;

    public MicrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");
    }

    @Override
    public void onExecutionComplete(String executionId, ExecutionResult result, Duration totalDuration) {
        try {
            Counter.builder(METRIC_EXECUTION_TOTAL)
                    .tag(TAG_STATUS, result.getStatus().name())
                    .description("按最终状态统计的工作流执行次数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加执行计数器指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onBlockSuccess(String executionId, Block block, BlockResult result, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_BLOCK_KIND, block.getKind().name()),
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_ERROR, NO_ERROR)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onBlockFailure(String executionId, Block block, BlockResult result, Throwable error, Duration duration) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        // 显式检查 TimeoutException
        String status = (error instanceof TimeoutException) ? STATUS_TIMEOUT : STATUS_FAILURE;

        Tags tags = Tags.of(
                Tag.of(TAG_BLOCK_KIND, block.getKind().name()),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onBlockSkipped(String executionId, Block block) {
        incrementCounter(Tags.of(
                Tag.of(TAG_BLOCK_KIND, block.getKind().name()),
                Tag.of(TAG_STATUS, STATUS_SKIPPED),
                Tag.of(TAG_ERROR, NO_ERROR)
        ));
    }

    @Override
    public void onBlockRetry(String executionId, Block block, int retryNumber, Throwable cause) {
        try {
            Counter.builder(METRIC_BLOCK_RETRY_TOTAL)
                    .tag(TAG_BLOCK_KIND, block.getKind().name())
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("记录重试计数指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onBlockTimeout(String executionId, Block block, Duration timeout) {
        // 单次尝试超时，最终状态由 onBlockFailure 记录
        try {
            Counter.builder(METRIC_BLOCK_TIMEOUT_TOTAL)
                    .tag(TAG_BLOCK_KIND, block.getKind().name())
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("记录超时计数指标失败: {}", e.getMessage(), e);
        }
        log.debug("Micrometer 监听器捕获到块 {} 的超时事件", block.getNumber());
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_BLOCK_EXECUTION_TIME)
                    .tags(tags)
                    .description("块执行时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_BLOCK_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的块执行总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
