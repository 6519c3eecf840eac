package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

/**
 * 不影响调度的校验提示。
 */
@Value
@Builder
public class ValidationWarning {

    public enum Type {
        PERFORMANCE,
        COMPATIBILITY,
        BEST_PRACTICE
    }

    Type type;
    String message;
    String blockId;
}
