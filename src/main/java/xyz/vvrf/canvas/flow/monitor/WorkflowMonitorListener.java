package xyz.vvrf.canvas.flow.monitor;

import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;

import java.time.Duration;

/**
 * 用于监控工作流执行事件的监听器接口。
 * 包括运行级别和块级别的事件，所有方法默认为空实现。
 * <p>
 * 监听器在执行线程上被同步调用，抛出的异常会被记录并忽略，不会影响运行。
 */
public interface WorkflowMonitorListener {

    /**
     * 运行开始时调用 (图已通过校验并已注册)。
     *
     * @param executionId 执行 ID
     * @param graph       本次运行的块图
     * @param options     本次运行的选项
     */
    default void onExecutionStart(String executionId, WorkflowGraph graph, ExecutionOptions options) {}

    /**
     * 运行到达终止状态时调用 (COMPLETED / FAILED / CANCELLED)。
     *
     * @param executionId   执行 ID
     * @param result        最终结果
     * @param totalDuration 运行总耗时
     */
    default void onExecutionComplete(String executionId, ExecutionResult result, Duration totalDuration) {}

    default void onExecutionPaused(String executionId) {}

    default void onExecutionResumed(String executionId) {}

    default void onExecutionCancelled(String executionId) {}

    /**
     * 块开始执行时调用。
     */
    default void onBlockStart(String executionId, Block block) {}

    /**
     * 块成功完成时调用。
     *
     * @param duration 包含重试在内的总耗时
     */
    default void onBlockSuccess(String executionId, Block block, BlockResult result, Duration duration) {}

    /**
     * 块在重试耗尽后最终失败时调用。
     *
     * @param error 导致失败的最后一个错误
     */
    default void onBlockFailure(String executionId, Block block, BlockResult result, Throwable error, Duration duration) {}

    /**
     * 块的一次生成尝试失败、即将重试时调用。
     *
     * @param retryNumber 即将进行的重试序号，从 1 开始
     * @param cause       上一次尝试的错误
     */
    default void onBlockRetry(String executionId, Block block, int retryNumber, Throwable cause) {}

    /**
     * 单次生成尝试超时时调用。
     * 超时之后可能重试，最终结果仍通过 onBlockSuccess / onBlockFailure 通知。
     */
    default void onBlockTimeout(String executionId, Block block, Duration timeout) {}

    /**
     * 运行被取消、块从未开始时调用。
     */
    default void onBlockSkipped(String executionId, Block block) {}
}
