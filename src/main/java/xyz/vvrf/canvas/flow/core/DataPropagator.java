package xyz.vvrf.canvas.flow.core;

import java.util.Map;

/**
 * 块输出的发布/读取存储。引擎在执行块之前读取，在块成功之后写入。
 */
public interface DataPropagator {

    /**
     * @param blockId 目标块 ID
     * @return 已发布输出的全部 (传递) 上游块，块编号 -> 输出
     */
    Map<String, String> getUpstreamData(String blockId);

    /**
     * 发布一个块的输出。同一块重复发布时以最后一次为准。
     */
    void propagate(String blockId, String output, BlockKind kind, String blockNumber);
}
