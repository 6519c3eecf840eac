package xyz.vvrf.canvas.flow.propagation;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.BlockData;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.Connection;
import xyz.vvrf.canvas.flow.core.DataPropagator;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.util.GraphUtils;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 单次运行内的输出存储。按图的连接关系计算全部 (传递) 上游，只返回已经发布过输出的上游块。
 */
@Slf4j
public class InMemoryDataPropagator implements DataPropagator {

    private final Set<String> blockIds;
    private final List<Connection> connections;
    private final Map<String, BlockData> published = new ConcurrentHashMap<>();

    public InMemoryDataPropagator(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "WorkflowGraph cannot be null");
        this.blockIds = graph.blockIds();
        this.connections = graph.getConnections();
    }

    @Override
    public Map<String, String> getUpstreamData(String blockId) {
        return GraphUtils.collectUpstream(blockId, blockIds, connections).stream()
                .map(published::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(BlockData::getTimestamp))
                .collect(Collectors.toMap(BlockData::getBlockNumber, BlockData::getContent,
                        (first, second) -> second, LinkedHashMap::new));
    }

    @Override
    public void propagate(String blockId, String output, BlockKind kind, String blockNumber) {
        published.put(blockId, new BlockData(blockId, blockNumber, kind, output, Instant.now()));
        log.trace("Block '{}' ({}) published {} chars", blockNumber, blockId, output != null ? output.length() : 0);
    }

    public Optional<BlockData> getBlockData(String blockId) {
        return Optional.ofNullable(published.get(blockId));
    }

    public void clear() {
        published.clear();
    }
}
