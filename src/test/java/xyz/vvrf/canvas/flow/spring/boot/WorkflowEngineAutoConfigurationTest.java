package xyz.vvrf.canvas.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.ExecutionResult;
import xyz.vvrf.canvas.flow.core.ExecutionStatus;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;
import xyz.vvrf.canvas.flow.dispatch.ContentGenerator;
import xyz.vvrf.canvas.flow.dispatch.RoutingGenerationDispatcher;
import xyz.vvrf.canvas.flow.execution.WorkflowEngine;
import xyz.vvrf.canvas.flow.history.ExecutionHistory;
import xyz.vvrf.canvas.flow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.realtime.RealtimeExecutionMonitor;
import xyz.vvrf.canvas.flow.test.util.ScriptedGenerationDispatcher;
import xyz.vvrf.canvas.flow.test.util.TestGraphs;
import xyz.vvrf.canvas.flow.validation.WorkflowValidator;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WorkflowEngineAutoConfiguration.class));

    @Test
    void registersDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(WorkflowEngine.class);
            assertThat(context).hasSingleBean(WorkflowValidator.class);
            assertThat(context).hasSingleBean(ExecutionHistory.class);
            assertThat(context).hasSingleBean(LoggingWorkflowMonitorListener.class);
            assertThat(context).hasSingleBean(RealtimeExecutionMonitor.class);
            assertThat(context).hasBean(WorkflowEngineAutoConfiguration.SCHEDULER_BEAN_NAME);
            assertThat(context).getBean(GenerationDispatcher.class).isInstanceOf(RoutingGenerationDispatcher.class);
            assertThat(context).doesNotHaveBean(MicrometerWorkflowMonitorListener.class);
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "canvas.flow.engine.max-concurrency=4",
                        "canvas.flow.block.default-timeout=30s",
                        "canvas.flow.retry.max-retries=2",
                        "canvas.flow.retry.backoff-multiplier=2.5",
                        "canvas.flow.scheduler.type=PARALLEL",
                        "canvas.flow.scheduler.parallelism=2",
                        "canvas.flow.history.maximum-size=10")
                .run(context -> {
                    WorkflowEngineProperties properties = context.getBean(WorkflowEngineProperties.class);
                    assertThat(properties.getEngine().getMaxConcurrency()).isEqualTo(4);
                    assertThat(properties.getBlock().getDefaultTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(properties.getRetry().toRetryPolicy().getMaxRetries()).isEqualTo(2);
                    assertThat(properties.getRetry().toRetryPolicy().getBackoffMultiplier()).isEqualTo(2.5d);
                    assertThat(properties.getScheduler().getType()).isEqualTo(WorkflowEngineProperties.SchedulerType.PARALLEL);
                    assertThat(properties.getHistory().getMaximumSize()).isEqualTo(10L);
                    assertThat(context).getBean(WorkflowEngineAutoConfiguration.SCHEDULER_BEAN_NAME, Scheduler.class).isNotNull();
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        contextRunner
                .withPropertyValues("canvas.flow.engine.max-concurrency=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void optionalComponentsCanBeDisabled() {
        contextRunner
                .withPropertyValues(
                        "canvas.flow.history.enabled=false",
                        "canvas.flow.monitor.logging-enabled=false",
                        "canvas.flow.monitor.realtime-enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(WorkflowEngine.class);
                    assertThat(context).doesNotHaveBean(ExecutionHistory.class);
                    assertThat(context).doesNotHaveBean(LoggingWorkflowMonitorListener.class);
                    assertThat(context).doesNotHaveBean(RealtimeExecutionMonitor.class);
                });
    }

    @Test
    void registersMicrometerListenerWhenRegistryPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).hasSingleBean(MicrometerWorkflowMonitorListener.class));
    }

    @Test
    void userDispatcherReplacesDefault() {
        contextRunner
                .withBean(GenerationDispatcher.class, ScriptedGenerationDispatcher::new)
                .run(context -> assertThat(context).getBean(GenerationDispatcher.class)
                        .isInstanceOf(ScriptedGenerationDispatcher.class));
    }

    @Test
    void contentGeneratorBeansDriveTheEngine() {
        contextRunner
                .withUserConfiguration(TextGeneratorConfiguration.class)
                .run(context -> {
                    WorkflowEngine engine = context.getBean(WorkflowEngine.class);
                    ExecutionResult result = engine.executeWorkflow(
                            TestGraphs.builder()
                                    .text("A1", "hello")
                                    .text("B1", "{A1} world")
                                    .connect("A1", "B1")
                                    .build(),
                            ExecutionOptions.DEFAULT).block(Duration.ofSeconds(10));

                    assertThat(result.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
                    assertThat(result.getResults().get(1).getOutput()).contains("echo:echo:hello world");
                    assertThat(engine.getExecutionResult(result.getExecutionId())).isPresent();
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class TextGeneratorConfiguration {

        @Bean
        ContentGenerator echoTextGenerator() {
            return new ContentGenerator() {
                @Override
                public BlockKind kind() {
                    return BlockKind.TEXT;
                }

                @Override
                public Mono<String> generate(Block block, String resolvedPrompt, ExecutionOptions options) {
                    return Mono.just("echo:" + resolvedPrompt);
                }
            };
        }
    }
}
