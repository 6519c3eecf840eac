package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 画布上的一个生成块。
 * <p>
 * {@code number} 是面向用户的编号 (如 "A01")，同时也是下游提示词中变量引用的键。
 * {@code promptTemplate} 可以内嵌对其它块编号的引用，执行前由 {@link VariableResolver} 解析。
 */
@Value
@Builder
public class Block {
    @NonNull
    String id;
    @NonNull
    String number;
    @NonNull
    BlockKind kind;
    String promptTemplate;

    public boolean hasPrompt() {
        return promptTemplate != null && !promptTemplate.trim().isEmpty();
    }
}
