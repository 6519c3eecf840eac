package xyz.vvrf.canvas.flow.execution;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的执行 ID -> 执行上下文映射。只包含尚未结束的运行。
 */
@Slf4j
public class ExecutionRegistry {

    private final Map<String, WorkflowExecutionContext> contexts = new ConcurrentHashMap<>();

    void register(WorkflowExecutionContext context) {
        if (contexts.putIfAbsent(context.getExecutionId(), context) != null) {
            throw new IllegalStateException("Execution id already registered: " + context.getExecutionId());
        }
        log.debug("[ExecutionId: {}] Registered. Active executions: {}", context.getExecutionId(), contexts.size());
    }

    Optional<WorkflowExecutionContext> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contexts.get(executionId));
    }

    void remove(String executionId) {
        if (contexts.remove(executionId) != null) {
            log.debug("[ExecutionId: {}] Removed from registry. Active executions: {}", executionId, contexts.size());
        }
    }

    public Set<String> activeExecutionIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(contexts.keySet()));
    }

    public int size() {
        return contexts.size();
    }
}
