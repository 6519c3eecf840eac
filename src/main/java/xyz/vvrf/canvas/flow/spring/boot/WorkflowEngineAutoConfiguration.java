package xyz.vvrf.canvas.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.canvas.flow.core.DataPropagatorFactory;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;
import xyz.vvrf.canvas.flow.core.VariableResolver;
import xyz.vvrf.canvas.flow.dispatch.ContentGenerator;
import xyz.vvrf.canvas.flow.dispatch.RoutingGenerationDispatcher;
import xyz.vvrf.canvas.flow.execution.BlockExecutor;
import xyz.vvrf.canvas.flow.execution.StandardBlockExecutor;
import xyz.vvrf.canvas.flow.execution.StandardWorkflowEngine;
import xyz.vvrf.canvas.flow.execution.WorkflowEngine;
import xyz.vvrf.canvas.flow.history.ExecutionHistory;
import xyz.vvrf.canvas.flow.monitor.CompositeWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.WorkflowMonitorListener;
import xyz.vvrf.canvas.flow.monitor.realtime.RealtimeExecutionMonitor;
import xyz.vvrf.canvas.flow.propagation.InMemoryDataPropagator;
import xyz.vvrf.canvas.flow.validation.WorkflowValidator;
import xyz.vvrf.canvas.flow.variable.PatternVariableResolver;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流引擎的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WorkflowEngineProperties}。
 * 2. 提供可由属性配置的块执行 {@link Scheduler} Bean ("canvasFlowScheduler")。
 * 3. 提供变量解析、数据传递、生成调度与图校验的默认实现。
 * 4. 收集所有 {@link WorkflowMonitorListener} Bean，交给执行器与引擎。
 * 5. 提供核心的 {@link WorkflowEngine} Bean。
 * <p>
 * **用户职责:** 为每种需要支持的块类型声明一个 {@link ContentGenerator} Bean，
 * 或者直接提供自己的 {@link GenerationDispatcher} Bean。
 * 以上所有 Bean 都可以通过声明同类型的 Bean 来替换。
 */
@Configuration
@EnableConfigurationProperties(WorkflowEngineProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@Slf4j
public class WorkflowEngineAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "canvasFlowScheduler";

    public WorkflowEngineAutoConfiguration() {
        log.info("Canvas flow 工作流引擎自动配置 (WorkflowEngineAutoConfiguration) 已加载。");
    }

    /**
     * 提供块执行使用的 Reactor Scheduler。
     * 如果已存在名为 "canvasFlowScheduler" 的 Bean，则不创建此默认 Bean。
     */
    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public Scheduler canvasFlowScheduler(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}",
                        SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getParallelism());
                return Schedulers.newParallel(namePrefix, schedulerProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case BOUNDED_ELASTIC:
            default:
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}",
                        SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getThreadCap(), schedulerProps.getQueuedTaskCap());
                return Schedulers.newBoundedElastic(schedulerProps.getThreadCap(), schedulerProps.getQueuedTaskCap(),
                        namePrefix, 60, true);
        }
    }

    @Bean
    @ConditionalOnMissingBean(VariableResolver.class)
    public VariableResolver canvasFlowVariableResolver() {
        return new PatternVariableResolver();
    }

    @Bean
    @ConditionalOnMissingBean(DataPropagatorFactory.class)
    public DataPropagatorFactory canvasFlowDataPropagatorFactory() {
        return InMemoryDataPropagator::new;
    }

    /**
     * 按块类型路由到 {@link ContentGenerator} Bean 的默认调度器。
     * 没有任何生成器时仍会创建，此时所有块都会以 "Unsupported block type" 失败。
     */
    @Bean
    @ConditionalOnMissingBean(GenerationDispatcher.class)
    public GenerationDispatcher canvasFlowGenerationDispatcher(ObjectProvider<ContentGenerator> generatorsProvider) {
        List<ContentGenerator> generators = generatorsProvider.orderedStream().collect(Collectors.toList());
        if (generators.isEmpty()) {
            log.warn("在 Spring 上下文中未找到 ContentGenerator Bean，所有块执行都将失败。");
        }
        return new RoutingGenerationDispatcher(generators);
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowValidator.class)
    public WorkflowValidator canvasFlowWorkflowValidator(VariableResolver variableResolver,
                                                         WorkflowEngineProperties properties) {
        return new WorkflowValidator(variableResolver, properties.getEngine().getConnectionWarningThreshold());
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionHistory.class)
    @ConditionalOnProperty(prefix = "canvas.flow.history", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionHistory canvasFlowExecutionHistory(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.History history = properties.getHistory();
        return new ExecutionHistory(history.getMaximumSize(), history.getTtl());
    }

    @Bean
    @ConditionalOnMissingBean(LoggingWorkflowMonitorListener.class)
    @ConditionalOnProperty(prefix = "canvas.flow.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingWorkflowMonitorListener canvasFlowLoggingMonitorListener() {
        return new LoggingWorkflowMonitorListener();
    }

    @Bean
    @ConditionalOnMissingBean(RealtimeExecutionMonitor.class)
    @ConditionalOnProperty(prefix = "canvas.flow.monitor", name = "realtime-enabled", havingValue = "true", matchIfMissing = true)
    public RealtimeExecutionMonitor canvasFlowRealtimeExecutionMonitor(WorkflowEngineProperties properties) {
        return new RealtimeExecutionMonitor(properties.getMonitor().getRealtimeRetention());
    }

    @Bean
    @ConditionalOnMissingBean(BlockExecutor.class)
    public BlockExecutor canvasFlowBlockExecutor(VariableResolver variableResolver,
                                                 GenerationDispatcher generationDispatcher,
                                                 @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                                 ObjectProvider<WorkflowMonitorListener> listenersProvider,
                                                 WorkflowEngineProperties properties) {
        return new StandardBlockExecutor(
                variableResolver,
                generationDispatcher,
                scheduler,
                collectListeners(listenersProvider),
                properties.getBlock().getDefaultTimeout(),
                properties.getRetry().toRetryPolicy());
    }

    /**
     * 提供核心的 WorkflowEngine Bean。
     */
    @Bean
    @ConditionalOnMissingBean(WorkflowEngine.class)
    public WorkflowEngine canvasFlowWorkflowEngine(WorkflowValidator validator,
                                                   DataPropagatorFactory dataPropagatorFactory,
                                                   BlockExecutor blockExecutor,
                                                   @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                                   ObjectProvider<WorkflowMonitorListener> listenersProvider,
                                                   ObjectProvider<ExecutionHistory> historyProvider,
                                                   WorkflowEngineProperties properties) {
        log.info("正在创建 WorkflowEngine Bean，配置: {}", properties);
        return new StandardWorkflowEngine(
                validator,
                dataPropagatorFactory,
                blockExecutor,
                scheduler,
                collectListeners(listenersProvider),
                historyProvider.getIfAvailable(),
                properties.getEngine().getMaxConcurrency());
    }

    private static CompositeWorkflowMonitorListener collectListeners(ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        List<WorkflowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 WorkflowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 WorkflowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return new CompositeWorkflowMonitorListener(listeners);
    }

    /**
     * 存在 MeterRegistry Bean 时注册 Micrometer 指标监听器。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerWorkflowMonitorListener.class)
        public MicrometerWorkflowMonitorListener canvasFlowMicrometerMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerWorkflowMonitorListener(meterRegistry);
        }
    }
}
