package xyz.vvrf.canvas.flow.core;

import lombok.Value;

/**
 * 进度快照。{@code current} 是最近开始执行的块编号，尚未开始时为 null。
 */
@Value
public class ExecutionProgress {
    int total;
    int completed;
    int failed;
    String current;
}
