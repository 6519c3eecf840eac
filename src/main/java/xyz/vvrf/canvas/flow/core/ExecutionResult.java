package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 一次运行的最终结果，运行结束后不可变。
 * {@code results} 按拓扑执行计划排序，每个块恰好一条。
 */
@Value
@Builder
public class ExecutionResult {
    String executionId;
    ExecutionStatus status;
    @Singular
    List<BlockResult> results;
    ExecutionStatistics statistics;
    @Singular
    List<ExecutionError> errors;
    Instant startTime;
    Instant endTime;

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }
}
