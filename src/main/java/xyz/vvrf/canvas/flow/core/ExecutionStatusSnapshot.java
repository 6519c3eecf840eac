package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * {@code getExecutionStatus} 返回的只读快照。
 */
@Value
@Builder
public class ExecutionStatusSnapshot {
    String executionId;
    ExecutionStatus status;
    ExecutionProgress progress;
    Instant startTime;
    Instant estimatedCompletion;

    /**
     * 仅在至少一个块完成后才有预计完成时间。
     */
    public Optional<Instant> getEstimatedCompletion() {
        return Optional.ofNullable(estimatedCompletion);
    }
}
