package xyz.vvrf.canvas.flow.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.test.util.TestGraphs;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphUtilsTest {

    @Test
    @DisplayName("拓扑排序: 入度为零的块按输入顺序先出队")
    void topologicalSortFollowsKahnFifoOrder() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "root")
                .text("B1", "other root")
                .image("C1", "{A1}")
                .video("D1", "{C1} {B1}")
                .connect("A1", "C1")
                .connect("C1", "D1")
                .connect("B1", "D1")
                .build();

        List<String> order = GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections());

        assertThat(order).containsExactly("a1", "b1", "c1", "d1");
    }

    @Test
    @DisplayName("拓扑排序: 存在环时抛出异常")
    void topologicalSortRejectsCycles() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "y")
                .connect("A1", "B1")
                .connect("B1", "A1")
                .build();

        assertThatThrownBy(() -> GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Topological sort failed");
    }

    @Test
    @DisplayName("环检测: 返回回边")
    void detectCyclesReportsBackEdge() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "y")
                .text("C1", "z")
                .connect("A1", "B1")
                .connect("B1", "C1")
                .connect("C1", "A1")
                .build();

        List<GraphUtils.BackEdge> backEdges = GraphUtils.detectCycles(graph.blockIds(), graph.getConnections());

        assertThat(backEdges).hasSize(1);
        assertThat(backEdges.get(0).getFromId()).isEqualTo("c1");
        assertThat(backEdges.get(0).getToId()).isEqualTo("a1");
        assertThat(backEdges.get(0)).hasToString("'c1' -> 'a1'");
    }

    @Test
    void selfLoopIsACycle() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .connect("A1", "A1")
                .build();

        assertThat(GraphUtils.detectCycles(graph.blockIds(), graph.getConnections())).hasSize(1);
    }

    @Test
    void danglingConnectionsAreIgnored() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "y")
                .connectIds("ghost", "b1")
                .connect("A1", "B1")
                .build();

        assertThat(GraphUtils.detectCycles(graph.blockIds(), graph.getConnections())).isEmpty();
        assertThat(GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections())).containsExactly("a1", "b1");
        assertThat(GraphUtils.directPredecessors("b1", graph.blockIds(), graph.getConnections())).containsExactly("a1");
    }

    @Test
    @DisplayName("上游收集: 包含间接祖先，不包含自身与下游")
    void collectUpstreamIsTransitive() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "y")
                .text("C1", "z")
                .text("D1", "w")
                .connect("A1", "B1")
                .connect("B1", "C1")
                .connect("C1", "D1")
                .build();

        assertThat(GraphUtils.collectUpstream("c1", graph.blockIds(), graph.getConnections()))
                .containsExactlyInAnyOrder("a1", "b1");
        assertThat(GraphUtils.collectUpstream("a1", graph.blockIds(), graph.getConnections())).isEmpty();
    }

    @Test
    void emptyGraphSortsToEmptyPlan() {
        WorkflowGraph graph = TestGraphs.builder().build();

        assertThat(GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections())).isEmpty();
        assertThat(GraphUtils.detectCycles(graph.blockIds(), graph.getConnections())).isEmpty();
    }

    @Test
    @DisplayName("拓扑排序: 每条连接的起点都排在终点之前，且每个块恰好出现一次")
    void topologicalOrderRespectsEveryConnection() {
        TestGraphs builder = TestGraphs.builder();
        for (int i = 1; i <= 8; i++) {
            builder.text("N" + i, "n" + i);
        }
        builder.connect("N8", "N1")
                .connect("N1", "N3")
                .connect("N2", "N3")
                .connect("N3", "N5")
                .connect("N4", "N5")
                .connect("N8", "N4")
                .connect("N5", "N6")
                .connect("N7", "N6");
        WorkflowGraph graph = builder.build();

        List<String> order = GraphUtils.topologicalSort(graph.blockIds(), graph.getConnections());

        assertThat(order).hasSize(graph.size()).doesNotHaveDuplicates();
        graph.getConnections().forEach(connection ->
                assertThat(order.indexOf(connection.getFromId()))
                        .as("%s must precede %s", connection.getFromId(), connection.getToId())
                        .isLessThan(order.indexOf(connection.getToId())));
    }
}
