package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 块级重试策略。
 * 第 n 次重试 (从 0 开始) 前等待 {@code retryDelay * backoffMultiplier^n}。
 */
@Value
@Builder
public class RetryPolicy {

    public static final RetryPolicy NONE = RetryPolicy.builder().maxRetries(0).retryDelay(Duration.ZERO).build();

    int maxRetries;
    @Builder.Default
    Duration retryDelay = Duration.ZERO;
    @Builder.Default
    double backoffMultiplier = 1.0d;

    public Duration delayForRetry(long retryIndex) {
        if (retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()) {
            return Duration.ZERO;
        }
        double multiplier = backoffMultiplier > 0 ? Math.pow(backoffMultiplier, retryIndex) : 1.0d;
        return Duration.ofMillis(Math.round(retryDelay.toMillis() * multiplier));
    }
}
