package xyz.vvrf.canvas.flow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.canvas.flow.core.RetryPolicy;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流引擎的配置属性类。
 * 绑定 'canvas.flow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "canvas.flow")
@Validated
public class WorkflowEngineProperties {

    @Valid
    private final Block block = new Block();
    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final RetryProps retry = new RetryProps();
    @Valid
    private final History history = new History();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Block {
        /**
         * 单次生成调用的默认超时时间。视频生成可能很慢，默认值较宽松。
         */
        @NotNull
        private Duration defaultTimeout = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Engine {
        /**
         * 同一运行内同时执行的最大块数。1 表示严格按拓扑顺序依次执行。
         */
        @Min(1)
        private int maxConcurrency = 1;

        /**
         * 连接数超过此值时给出性能警告。
         */
        @Min(0)
        private int connectionWarningThreshold = 20;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "canvas-flow";

        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;

        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;

        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE
    }

    @Getter
    @Setter
    public static class RetryProps {
        /**
         * 执行选项未提供重试策略时的最大重试次数 (0 表示不重试)。
         */
        @Min(0)
        private int maxRetries = 0;

        /**
         * 第一次重试前的等待时间。
         */
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(1);

        /**
         * 每次重试等待时间的倍数，1.0 表示固定间隔。
         */
        @DecimalMin("1.0")
        private double backoffMultiplier = 1.0d;

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                    .maxRetries(maxRetries)
                    .retryDelay(retryDelay)
                    .backoffMultiplier(backoffMultiplier)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class History {
        private boolean enabled = true;

        @Min(1)
        private long maximumSize = 200;

        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监听器。
         */
        private boolean loggingEnabled = true;

        /**
         * 是否注册实时事件流监听器。
         */
        private boolean realtimeEnabled = true;

        /**
         * 运行结束后实时事件流的保留时间。
         */
        @NotNull
        private Duration realtimeRetention = Duration.ofMinutes(5);
    }

    @Override
    public String toString() {
        return "WorkflowEngineProperties{" +
                "block={defaultTimeout=" + block.defaultTimeout +
                "}, engine={maxConcurrency=" + engine.maxConcurrency +
                ", connectionWarningThreshold=" + engine.connectionWarningThreshold +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, retry={maxRetries=" + retry.maxRetries +
                ", retryDelay=" + retry.retryDelay +
                ", backoffMultiplier=" + retry.backoffMultiplier +
                "}, history={enabled=" + history.enabled +
                ", maximumSize=" + history.maximumSize +
                ", ttl=" + history.ttl +
                "}}";
    }
}
