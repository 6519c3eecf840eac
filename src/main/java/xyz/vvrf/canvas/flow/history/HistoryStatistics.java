package xyz.vvrf.canvas.flow.history;

import lombok.Builder;
import lombok.Value;

/**
 * 历史记录中所有运行的汇总。
 */
@Value
@Builder
public class HistoryStatistics {
    int totalExecutions;
    int completedExecutions;
    int failedExecutions;
    int cancelledExecutions;
    /**
     * 仅统计 COMPLETED 运行
     */
    double averageDurationMs;
    long totalBlocksProcessed;
    /**
     * 百分比 (0 - 100)
     */
    double successRate;
}
