package xyz.vvrf.canvas.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 将事件依次分发给多个监听器，单个监听器的异常不会影响其它监听器和执行流程。
 */
@Slf4j
public class CompositeWorkflowMonitorListener implements WorkflowMonitorListener {

    private final List<WorkflowMonitorListener> listeners;

    public CompositeWorkflowMonitorListener(List<WorkflowMonitorListener> listeners) {
        this.listeners = (listeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(listeners))
                : Collections.emptyList();
    }

    public List<WorkflowMonitorListener> getListeners() {
        return listeners;
    }

    @Override
    public void onExecutionStart(String executionId, WorkflowGraph graph, ExecutionOptions options) {
        safeNotifyListeners(l -> l.onExecutionStart(executionId, graph, options));
    }

    @Override
    public void onExecutionComplete(String executionId, ExecutionResult result, Duration totalDuration) {
        safeNotifyListeners(l -> l.onExecutionComplete(executionId, result, totalDuration));
    }

    @Override
    public void onExecutionPaused(String executionId) {
        safeNotifyListeners(l -> l.onExecutionPaused(executionId));
    }

    @Override
    public void onExecutionResumed(String executionId) {
        safeNotifyListeners(l -> l.onExecutionResumed(executionId));
    }

    @Override
    public void onExecutionCancelled(String executionId) {
        safeNotifyListeners(l -> l.onExecutionCancelled(executionId));
    }

    @Override
    public void onBlockStart(String executionId, Block block) {
        safeNotifyListeners(l -> l.onBlockStart(executionId, block));
    }

    @Override
    public void onBlockSuccess(String executionId, Block block, BlockResult result, Duration duration) {
        safeNotifyListeners(l -> l.onBlockSuccess(executionId, block, result, duration));
    }

    @Override
    public void onBlockFailure(String executionId, Block block, BlockResult result, Throwable error, Duration duration) {
        safeNotifyListeners(l -> l.onBlockFailure(executionId, block, result, error, duration));
    }

    @Override
    public void onBlockRetry(String executionId, Block block, int retryNumber, Throwable cause) {
        safeNotifyListeners(l -> l.onBlockRetry(executionId, block, retryNumber, cause));
    }

    @Override
    public void onBlockTimeout(String executionId, Block block, Duration timeout) {
        safeNotifyListeners(l -> l.onBlockTimeout(executionId, block, timeout));
    }

    @Override
    public void onBlockSkipped(String executionId, Block block) {
        safeNotifyListeners(l -> l.onBlockSkipped(executionId, block));
    }

    private void safeNotifyListeners(Consumer<WorkflowMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (WorkflowMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Workflow monitor listener {} threw during notification: {}",
                        listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
