package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 运行结束时由结果列表计算出的汇总统计。
 */
@Value
@Builder
public class ExecutionStatistics {
    int totalBlocks;
    int completedBlocks;
    int failedBlocks;
    int skippedBlocks;
    /**
     * 从运行开始到结束的墙钟耗时
     */
    long totalExecutionTimeMs;
    /**
     * 已尝试 (非 SKIPPED) 块的平均耗时
     */
    double averageBlockTimeMs;

    public static ExecutionStatistics from(List<BlockResult> results, Instant startTime, Instant endTime) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        long attemptedTime = 0L;
        for (BlockResult result : results) {
            switch (result.getStatus()) {
                case COMPLETED:
                    completed++;
                    attemptedTime += result.getExecutionTimeMs();
                    break;
                case FAILED:
                    failed++;
                    attemptedTime += result.getExecutionTimeMs();
                    break;
                case SKIPPED:
                default:
                    skipped++;
                    break;
            }
        }
        int attempted = completed + failed;
        return ExecutionStatistics.builder()
                .totalBlocks(results.size())
                .completedBlocks(completed)
                .failedBlocks(failed)
                .skippedBlocks(skipped)
                .totalExecutionTimeMs(Duration.between(startTime, endTime).toMillis())
                .averageBlockTimeMs(attempted > 0 ? (double) attemptedTime / attempted : 0d)
                .build();
    }
}
