package xyz.vvrf.canvas.flow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.Connection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * 块图的循环检测、拓扑排序与上游闭包计算。
 * 所有方法都只考虑两端均存在于 {@code blockIds} 中的连接，悬空连接由校验器单独报告。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 图中的一条回边，即环路的闭合边。
     */
    public static final class BackEdge {
        private final String fromId;
        private final String toId;

        BackEdge(String fromId, String toId) {
            this.fromId = fromId;
            this.toId = toId;
        }

        public String getFromId() {
            return fromId;
        }

        public String getToId() {
            return toId;
        }

        @Override
        public String toString() {
            return "'" + fromId + "' -> '" + toId + "'";
        }
    }

    /**
     * 使用深度优先搜索 (DFS) 找出图中所有回边。返回空列表表示无环。
     *
     * @param blockIds    图中所有块 ID (声明顺序)
     * @param connections 连接列表
     * @return 按发现顺序排列的回边
     */
    public static List<BackEdge> detectCycles(Set<String> blockIds, List<Connection> connections) {
        Set<String> visited = new HashSet<>(); // 完全访问过的节点
        Set<String> visiting = new HashSet<>(); // 当前递归路径上的节点
        Map<String, List<String>> adj = buildAdjacencyList(blockIds, connections);
        List<BackEdge> backEdges = new ArrayList<>();

        for (String blockId : blockIds) {
            if (!visited.contains(blockId)) {
                collectBackEdgesDFS(blockId, visited, visiting, adj, backEdges);
            }
        }
        if (!backEdges.isEmpty()) {
            log.debug("Cycle detection found {} back edge(s): {}", backEdges.size(), backEdges);
        }
        return backEdges;
    }

    // DFS 辅助方法
    private static void collectBackEdgesDFS(
            String blockId,
            Set<String> visited,
            Set<String> visiting,
            Map<String, List<String>> adj,
            List<BackEdge> backEdges) {

        visited.add(blockId);
        visiting.add(blockId);

        for (String neighbor : adj.getOrDefault(blockId, Collections.emptyList())) {
            if (visiting.contains(neighbor)) {
                backEdges.add(new BackEdge(blockId, neighbor));
            } else if (!visited.contains(neighbor)) {
                collectBackEdgesDFS(neighbor, visited, visiting, adj, backEdges);
            }
        }

        visiting.remove(blockId); // 回溯
    }

    /**
     * 使用 Kahn 算法 (FIFO 就绪队列) 计算拓扑顺序。
     * 入度为零的块按声明顺序入队，后继按连接声明顺序入队。
     *
     * @param blockIds    图中所有块 ID (声明顺序)
     * @param connections 连接列表
     * @return 按拓扑顺序排列的块 ID
     * @throws IllegalStateException 如果队列在所有块输出前耗尽 (图中有环)
     */
    public static List<String> topologicalSort(Set<String> blockIds, List<Connection> connections) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> adj = buildAdjacencyList(blockIds, connections);

        for (String blockId : blockIds) {
            inDegree.put(blockId, 0);
        }
        for (List<String> neighbors : adj.values()) {
            for (String neighbor : neighbors) {
                inDegree.put(neighbor, inDegree.get(neighbor) + 1);
            }
        }

        Queue<String> queue = new LinkedList<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<String> sortedOrder = new ArrayList<>(blockIds.size());
        while (!queue.isEmpty()) {
            String u = queue.poll();
            sortedOrder.add(u);
            for (String v : adj.getOrDefault(u, Collections.emptyList())) {
                int remaining = inDegree.get(v) - 1;
                inDegree.put(v, remaining);
                if (remaining == 0) {
                    queue.offer(v);
                }
            }
        }

        if (sortedOrder.size() != blockIds.size()) {
            Set<String> remainingNodes = new LinkedHashSet<>(blockIds);
            sortedOrder.forEach(remainingNodes::remove);
            throw new IllegalStateException(String.format(
                    "Topological sort failed, graph contains a cycle. Unsorted blocks: %s", remainingNodes));
        }
        return Collections.unmodifiableList(sortedOrder);
    }

    /**
     * 沿连接反向遍历，计算某个块的全部 (传递) 上游块。结果不包含块自身，即使它位于环上。
     */
    public static Set<String> collectUpstream(String blockId, Set<String> blockIds, List<Connection> connections) {
        Map<String, List<String>> reverseAdj = buildReverseAdjacencyList(blockIds, connections);
        Set<String> upstream = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(reverseAdj.getOrDefault(blockId, Collections.emptyList()));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (upstream.add(current)) {
                stack.addAll(reverseAdj.getOrDefault(current, Collections.emptyList()));
            }
        }
        upstream.remove(blockId);
        return upstream;
    }

    /**
     * @return 直接前驱 ID 列表 (去重，保持连接声明顺序)
     */
    public static List<String> directPredecessors(String blockId, Set<String> blockIds, List<Connection> connections) {
        Set<String> predecessors = new LinkedHashSet<>();
        for (Connection connection : connections) {
            if (connection.getToId().equals(blockId) && blockIds.contains(connection.getFromId())) {
                predecessors.add(connection.getFromId());
            }
        }
        return new ArrayList<>(predecessors);
    }

    // 辅助方法：构建邻接表 (From -> List<To>)，忽略悬空连接
    private static Map<String, List<String>> buildAdjacencyList(Set<String> blockIds, List<Connection> connections) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Connection connection : connections) {
            if (blockIds.contains(connection.getFromId()) && blockIds.contains(connection.getToId())) {
                adj.computeIfAbsent(connection.getFromId(), k -> new ArrayList<>()).add(connection.getToId());
            }
        }
        return adj;
    }

    private static Map<String, List<String>> buildReverseAdjacencyList(Set<String> blockIds, List<Connection> connections) {
        Map<String, List<String>> reverseAdj = new LinkedHashMap<>();
        for (Connection connection : connections) {
            if (blockIds.contains(connection.getFromId()) && blockIds.contains(connection.getToId())) {
                reverseAdj.computeIfAbsent(connection.getToId(), k -> new ArrayList<>()).add(connection.getFromId());
            }
        }
        return reverseAdj;
    }
}
