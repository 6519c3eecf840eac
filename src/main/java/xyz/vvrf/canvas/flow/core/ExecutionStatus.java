package xyz.vvrf.canvas.flow.core;

/**
 * 工作流执行的状态。
 * COMPLETED / FAILED / CANCELLED 为终止状态。
 */
public enum ExecutionStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
