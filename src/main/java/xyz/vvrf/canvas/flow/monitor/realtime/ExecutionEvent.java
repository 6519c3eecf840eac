package xyz.vvrf.canvas.flow.monitor.realtime;

import lombok.Builder;
import lombok.Data;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatistics;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;

import java.time.Instant;

@Data
@Builder
public class ExecutionEvent {
    private String executionId;
    private EventType eventType;
    private Instant timestamp;

    // Block specific
    private String blockId;
    private String blockNumber;
    private BlockKind blockKind;
    private BlockResult.BlockStatus blockStatus; // null 表示正在执行
    private Integer retryNumber;
    private Long durationMillis;
    private String outputSummary;
    private String errorSummary;

    // Execution specific
    private ExecutionStatus executionStatus;
    private ExecutionStatistics statistics;

    public enum EventType {
        EXECUTION_START, EXECUTION_STATE, BLOCK_UPDATE, BLOCK_RETRY, EXECUTION_COMPLETE
    }
}
