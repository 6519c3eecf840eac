package xyz.vvrf.canvas.flow.dispatch;

import lombok.Getter;
import xyz.vvrf.canvas.flow.core.BlockKind;

/**
 * 没有生成器可以处理某种块类型时抛出。
 */
@Getter
public class UnsupportedBlockKindException extends RuntimeException {

    private final BlockKind kind;

    public UnsupportedBlockKindException(BlockKind kind) {
        super("Unsupported block type: " + kind);
        this.kind = kind;
    }
}
