package xyz.vvrf.canvas.flow.core;

import lombok.Value;

import java.time.Instant;

/**
 * 某个块发布给下游的最新输出。
 */
@Value
public class BlockData {
    String blockId;
    String blockNumber;
    BlockKind kind;
    String content;
    Instant timestamp;
}
