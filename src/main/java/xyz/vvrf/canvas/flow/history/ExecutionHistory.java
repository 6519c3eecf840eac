package xyz.vvrf.canvas.flow.history;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 已结束运行的内存历史记录。
 * 使用 Caffeine 缓存限制条目数量与存活时间，进程重启后不保留。
 */
@Slf4j
public class ExecutionHistory {

    private final Cache<String, ExecutionResult> records;

    public ExecutionHistory(long maximumSize, Duration ttl) {
        Objects.requireNonNull(ttl, "History TTL cannot be null");
        this.records = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
        log.info("ExecutionHistory initialized. maximumSize: {}, ttl: {}", maximumSize, ttl);
    }

    public void record(ExecutionResult result) {
        Objects.requireNonNull(result, "ExecutionResult cannot be null");
        records.put(result.getExecutionId(), result);
        log.debug("[ExecutionId: {}] Recorded terminal result with status {}", result.getExecutionId(), result.getStatus());
    }

    public Optional<ExecutionResult> find(String executionId) {
        return Optional.ofNullable(records.getIfPresent(executionId));
    }

    /**
     * @param status 状态过滤，null 表示全部
     * @return 按开始时间倒序排列的记录
     */
    public List<ExecutionResult> list(ExecutionStatus status) {
        return records.asMap().values().stream()
                .filter(result -> status == null || result.getStatus() == status)
                .sorted(Comparator.comparing(ExecutionResult::getStartTime, Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    public boolean delete(String executionId) {
        return records.asMap().remove(executionId) != null;
    }

    public void clear() {
        records.invalidateAll();
    }

    public long size() {
        records.cleanUp();
        return records.estimatedSize();
    }

    public HistoryStatistics statistics() {
        List<ExecutionResult> all = list(null);
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        long completedDuration = 0L;
        long blocksProcessed = 0L;
        for (ExecutionResult result : all) {
            switch (result.getStatus()) {
                case COMPLETED:
                    completed++;
                    completedDuration += result.getStatistics().getTotalExecutionTimeMs();
                    break;
                case FAILED:
                    failed++;
                    break;
                case CANCELLED:
                    cancelled++;
                    break;
                default:
                    break;
            }
            blocksProcessed += result.getStatistics().getCompletedBlocks();
        }
        return HistoryStatistics.builder()
                .totalExecutions(all.size())
                .completedExecutions(completed)
                .failedExecutions(failed)
                .cancelledExecutions(cancelled)
                .averageDurationMs(completed > 0 ? (double) completedDuration / completed : 0d)
                .totalBlocksProcessed(blocksProcessed)
                .successRate(all.isEmpty() ? 0d : completed * 100d / all.size())
                .build();
    }
}
