package xyz.vvrf.canvas.flow.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个块在一次运行中的最终结果。
 * 只能通过静态工厂方法创建: {@link #completed}, {@link #failed}, {@link #skipped}。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BlockResult {

    public enum BlockStatus {
        COMPLETED,
        FAILED,
        /**
         * 运行被取消时从未开始的块
         */
        SKIPPED
    }

    private final String blockId;
    private final String blockNumber;
    private final BlockStatus status;
    private final String output;
    private final String error;
    private final long executionTimeMs;
    private final int retryCount;

    private BlockResult(String blockId, String blockNumber, BlockStatus status,
                        String output, String error, long executionTimeMs, int retryCount) {
        this.blockId = Objects.requireNonNull(blockId, "blockId cannot be null");
        this.blockNumber = Objects.requireNonNull(blockNumber, "blockNumber cannot be null");
        this.status = status;
        this.output = output;
        this.error = error;
        this.executionTimeMs = executionTimeMs;
        this.retryCount = retryCount;
    }

    public static BlockResult completed(Block block, String output, long executionTimeMs, int retryCount) {
        Objects.requireNonNull(output, "Completed result must carry an output");
        return new BlockResult(block.getId(), block.getNumber(), BlockStatus.COMPLETED,
                output, null, executionTimeMs, retryCount);
    }

    public static BlockResult failed(Block block, String error, long executionTimeMs, int retryCount) {
        return new BlockResult(block.getId(), block.getNumber(), BlockStatus.FAILED,
                null, error != null ? error : "Unknown error", executionTimeMs, retryCount);
    }

    public static BlockResult skipped(Block block) {
        return new BlockResult(block.getId(), block.getNumber(), BlockStatus.SKIPPED,
                null, null, 0L, 0);
    }

    public Optional<String> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isCompleted() { return this.status == BlockStatus.COMPLETED; }
    public boolean isFailed() { return this.status == BlockStatus.FAILED; }
    public boolean isSkipped() { return this.status == BlockStatus.SKIPPED; }
}
