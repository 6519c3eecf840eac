package xyz.vvrf.canvas.flow.core;

/**
 * 为每次运行创建独立的 {@link DataPropagator}，避免并发运行之间共享输出。
 */
@FunctionalInterface
public interface DataPropagatorFactory {

    DataPropagator create(WorkflowGraph graph);
}
