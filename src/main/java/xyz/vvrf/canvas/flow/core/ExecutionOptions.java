package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 调用方提供的执行选项。所有字段均可为 null，null 表示使用引擎配置的默认值。
 * 整个对象会原样传递给 {@link GenerationDispatcher}。
 */
@Value
@Builder(toBuilder = true)
public class ExecutionOptions {

    public static final ExecutionOptions DEFAULT = ExecutionOptions.builder().build();

    BatchInputSource batchInput;
    String downloadPath;
    /**
     * 同时执行的最大块数
     */
    Integer maxConcurrency;
    RetryPolicy retryPolicy;
    NotificationSettings notificationSettings;
    /**
     * 单次生成调用的超时时间
     */
    Duration blockTimeout;

    public NotificationSettings effectiveNotificationSettings() {
        return notificationSettings != null ? notificationSettings : NotificationSettings.ALL;
    }
}
