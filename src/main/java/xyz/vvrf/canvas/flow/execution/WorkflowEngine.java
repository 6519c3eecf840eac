package xyz.vvrf.canvas.flow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatusSnapshot;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;

import java.util.Optional;
import java.util.Set;

/**
 * 工作流执行引擎接口。
 * <p>
 * 每次运行由引擎生成的执行 ID 标识，控制操作对未知 ID 或非法状态迁移均为无操作，不会抛出异常。
 */
public interface WorkflowEngine {

    /**
     * 校验并执行工作流，在订阅时启动。
     *
     * @param graph   块图
     * @param options 执行选项，可为 null
     * @return 发出最终结果的 Mono；图未通过校验时以 {@link WorkflowValidationException} 结束
     */
    Mono<ExecutionResult> executeWorkflow(WorkflowGraph graph, ExecutionOptions options);

    /**
     * 立即校验并启动工作流，返回可用于控制的句柄。
     *
     * @throws WorkflowValidationException 图未通过校验，此时不会注册任何运行
     */
    WorkflowExecution start(WorkflowGraph graph, ExecutionOptions options);

    /**
     * @return 是否从 RUNNING 迁移到了 PAUSED
     */
    boolean pauseExecution(String executionId);

    /**
     * @return 是否从 PAUSED 迁移到了 RUNNING
     */
    boolean resumeExecution(String executionId);

    /**
     * @return 是否从非终止状态迁移到了 CANCELLED
     */
    boolean cancelExecution(String executionId);

    /**
     * 读取运行中执行的状态快照。已结束或未知的执行返回空。
     */
    Optional<ExecutionStatusSnapshot> getExecutionStatus(String executionId);

    Set<String> getActiveExecutionIds();

    /**
     * 从执行历史中读取已结束运行的结果。未启用历史记录时总是返回空。
     */
    Optional<ExecutionResult> getExecutionResult(String executionId);
}
