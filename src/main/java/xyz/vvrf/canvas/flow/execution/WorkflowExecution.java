package xyz.vvrf.canvas.flow.execution;

import lombok.Getter;
import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.ExecutionResult;

/**
 * 已启动运行的句柄。{@code result} 已被缓存，可以多次订阅。
 */
@Getter
public final class WorkflowExecution {

    private final String executionId;
    private final Mono<ExecutionResult> result;

    WorkflowExecution(String executionId, Mono<ExecutionResult> result) {
        this.executionId = executionId;
        this.result = result;
    }
}
