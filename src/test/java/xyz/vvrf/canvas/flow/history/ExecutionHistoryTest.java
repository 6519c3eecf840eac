package xyz.vvrf.canvas.flow.history;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatistics;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExecutionHistoryTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    private ExecutionHistory history;

    @BeforeEach
    void setUp() {
        history = new ExecutionHistory(100, Duration.ofHours(1));
    }

    private static ExecutionResult result(String id, ExecutionStatus status, int startOffsetSeconds,
                                          long durationMs, int completedBlocks) {
        Instant start = BASE.plusSeconds(startOffsetSeconds);
        return ExecutionResult.builder()
                .executionId(id)
                .status(status)
                .statistics(ExecutionStatistics.builder()
                        .totalBlocks(completedBlocks)
                        .completedBlocks(completedBlocks)
                        .totalExecutionTimeMs(durationMs)
                        .build())
                .startTime(start)
                .endTime(start.plusMillis(durationMs))
                .build();
    }

    @Test
    void recordsAndFindsByExecutionId() {
        ExecutionResult result = result("exec_1_1", ExecutionStatus.COMPLETED, 0, 100, 2);

        history.record(result);

        assertThat(history.find("exec_1_1")).contains(result);
        assertThat(history.find("exec_missing")).isEmpty();
        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    void listsNewestFirstAndFiltersByStatus() {
        history.record(result("exec_1_1", ExecutionStatus.COMPLETED, 0, 100, 2));
        history.record(result("exec_1_2", ExecutionStatus.FAILED, 10, 100, 1));
        history.record(result("exec_1_3", ExecutionStatus.COMPLETED, 20, 100, 2));

        assertThat(history.list(null))
                .extracting(ExecutionResult::getExecutionId)
                .containsExactly("exec_1_3", "exec_1_2", "exec_1_1");
        assertThat(history.list(ExecutionStatus.COMPLETED))
                .extracting(ExecutionResult::getExecutionId)
                .containsExactly("exec_1_3", "exec_1_1");
        assertThat(history.list(ExecutionStatus.CANCELLED)).isEmpty();
    }

    @Test
    void deleteAndClear() {
        history.record(result("exec_1_1", ExecutionStatus.COMPLETED, 0, 100, 2));
        history.record(result("exec_1_2", ExecutionStatus.FAILED, 10, 100, 1));

        assertThat(history.delete("exec_1_1")).isTrue();
        assertThat(history.delete("exec_1_1")).isFalse();
        assertThat(history.size()).isEqualTo(1);

        history.clear();

        assertThat(history.size()).isZero();
        assertThat(history.list(null)).isEmpty();
    }

    @Test
    void statisticsAggregateAllRecordedRuns() {
        history.record(result("exec_1_1", ExecutionStatus.COMPLETED, 0, 100, 2));
        history.record(result("exec_1_2", ExecutionStatus.COMPLETED, 10, 300, 3));
        history.record(result("exec_1_3", ExecutionStatus.FAILED, 20, 50, 1));
        history.record(result("exec_1_4", ExecutionStatus.CANCELLED, 30, 10, 0));

        HistoryStatistics statistics = history.statistics();

        assertThat(statistics.getTotalExecutions()).isEqualTo(4);
        assertThat(statistics.getCompletedExecutions()).isEqualTo(2);
        assertThat(statistics.getFailedExecutions()).isEqualTo(1);
        assertThat(statistics.getCancelledExecutions()).isEqualTo(1);
        assertThat(statistics.getAverageDurationMs()).isCloseTo(200d, within(0.001));
        assertThat(statistics.getTotalBlocksProcessed()).isEqualTo(6);
        assertThat(statistics.getSuccessRate()).isCloseTo(50d, within(0.001));
    }

    @Test
    void emptyHistoryHasZeroStatistics() {
        HistoryStatistics statistics = history.statistics();

        assertThat(statistics.getTotalExecutions()).isZero();
        assertThat(statistics.getAverageDurationMs()).isZero();
        assertThat(statistics.getSuccessRate()).isZero();
    }

    @Test
    void oldestEntriesAreEvictedBeyondMaximumSize() {
        ExecutionHistory small = new ExecutionHistory(2, Duration.ofHours(1));
        for (int i = 1; i <= 10; i++) {
            small.record(result("exec_1_" + i, ExecutionStatus.COMPLETED, i, 10, 1));
        }

        assertThat(small.size()).isLessThanOrEqualTo(2);
    }
}
