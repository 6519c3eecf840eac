package xyz.vvrf.canvas.flow.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 一次运行所使用的块图。由调用方提供，引擎在运行期间只读。
 * 块的声明顺序会被保留，拓扑排序的入度为零节点按此顺序入队。
 */
@Getter
public final class WorkflowGraph {

    private final List<Block> blocks;
    private final List<Connection> connections;
    private final Map<String, Block> blocksById;

    public WorkflowGraph(List<Block> blocks, List<Connection> connections) {
        Objects.requireNonNull(blocks, "Blocks cannot be null");
        Objects.requireNonNull(connections, "Connections cannot be null");
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.connections = Collections.unmodifiableList(new ArrayList<>(connections));

        Map<String, Block> index = new LinkedHashMap<>();
        Set<String> numbers = new HashSet<>();
        for (Block block : this.blocks) {
            if (index.putIfAbsent(block.getId(), block) != null) {
                throw new IllegalArgumentException("Duplicate block id: " + block.getId());
            }
            // 编号是变量引用的键，必须唯一
            if (!numbers.add(block.getNumber())) {
                throw new IllegalArgumentException("Duplicate block number: " + block.getNumber());
            }
        }
        this.blocksById = Collections.unmodifiableMap(index);
    }

    public static WorkflowGraph of(List<Block> blocks, List<Connection> connections) {
        return new WorkflowGraph(blocks, connections);
    }

    public Optional<Block> findBlock(String blockId) {
        return Optional.ofNullable(blocksById.get(blockId));
    }

    /**
     * @return 按声明顺序排列的块 ID 集合
     */
    public Set<String> blockIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(blocksById.keySet()));
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
