package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

/**
 * 图结构校验发现的错误。任何一个错误都会使整个图无法调度。
 */
@Value
@Builder(toBuilder = true)
public class ValidationError {

    public enum Type {
        CIRCULAR_DEPENDENCY,
        INVALID_VARIABLE,
        MISSING_BLOCK,
        TYPE_MISMATCH
    }

    Type type;
    String message;
    String blockId;
    String connectionId;
}
