package xyz.vvrf.canvas.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;

import java.time.Duration;

@Slf4j
public class LoggingWorkflowMonitorListener implements WorkflowMonitorListener {

    @Override
    public void onExecutionStart(String executionId, WorkflowGraph graph, ExecutionOptions options) {
        log.info("[MONITOR] 执行:[{}] 开始。 块数:[{}], 连接数:[{}]",
                executionId, graph.size(), graph.getConnections().size());
    }

    @Override
    public void onExecutionComplete(String executionId, ExecutionResult result, Duration totalDuration) {
        log.info("[MONITOR] 执行:[{}] 结束。 状态:[{}], 耗时:[{}ms], 完成:[{}], 失败:[{}], 跳过:[{}]",
                executionId, result.getStatus(), totalDuration.toMillis(),
                result.getStatistics().getCompletedBlocks(),
                result.getStatistics().getFailedBlocks(),
                result.getStatistics().getSkippedBlocks());
    }

    @Override
    public void onExecutionPaused(String executionId) {
        log.info("[MONITOR] 执行:[{}] 已暂停。", executionId);
    }

    @Override
    public void onExecutionResumed(String executionId) {
        log.info("[MONITOR] 执行:[{}] 已恢复。", executionId);
    }

    @Override
    public void onExecutionCancelled(String executionId) {
        log.info("[MONITOR] 执行:[{}] 已取消。", executionId);
    }

    @Override
    public void onBlockStart(String executionId, Block block) {
        log.info("[MONITOR] 执行:[{}] 块:[{}] 开始。 类型:[{}]", executionId, block.getNumber(), block.getKind());
    }

    @Override
    public void onBlockSuccess(String executionId, Block block, BlockResult result, Duration duration) {
        log.info("[MONITOR] 执行:[{}] 块:[{}] 成功。 耗时:[{}ms], 重试:[{}]",
                executionId, block.getNumber(), duration.toMillis(), result.getRetryCount());
    }

    @Override
    public void onBlockFailure(String executionId, Block block, BlockResult result, Throwable error, Duration duration) {
        log.error("[MONITOR] 执行:[{}] 块:[{}] 失败。 耗时:[{}ms], 重试:[{}], 错误:[{}]",
                executionId, block.getNumber(), duration.toMillis(), result.getRetryCount(),
                result.getError().orElse(null), error);
    }

    @Override
    public void onBlockRetry(String executionId, Block block, int retryNumber, Throwable cause) {
        log.warn("[MONITOR] 执行:[{}] 块:[{}] 第 {} 次重试。 原因:[{}]",
                executionId, block.getNumber(), retryNumber, cause.getMessage());
    }

    @Override
    public void onBlockTimeout(String executionId, Block block, Duration timeout) {
        log.warn("[MONITOR] 执行:[{}] 块:[{}] 超时。 配置:[{}ms]", executionId, block.getNumber(), timeout.toMillis());
    }

    @Override
    public void onBlockSkipped(String executionId, Block block) {
        log.info("[MONITOR] 执行:[{}] 块:[{}] 跳过。", executionId, block.getNumber());
    }
}
