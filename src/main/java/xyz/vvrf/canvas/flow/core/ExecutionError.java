package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 块级失败的记录，与对应的 FAILED {@link BlockResult} 一一对应。
 */
@Value
@Builder
public class ExecutionError {
    String blockId;
    String blockNumber;
    String error;
    Instant timestamp;
    int retryCount;
}
