package ai.agentcap.router.autoconfig;

import ai.agentcap.router.config.CapRouterProperties;
import ai.agentcap.router.metrics.MicrometerInvocationMetrics;
import ai.agentcap.router.orch.InvocationOrchestrator;
import ai.agentcap.router.orch.exec.BackgroundTasks;
import ai.agentcap.router.orch.exec.MaintenanceScheduler;
import ai.agentcap.router.orch.policy.PolicyRegistry;
import ai.agentcap.router.orch.policy.PolicyRouter;
import ai.agentcap.router.orch.policy.RouteCatalog;
import ai.agentcap.router.orch.policy.StaticRouteCatalog;
import ai.agentcap.router.signal.CommitmentSignalEmitter;
import ai.agentcap.router.spi.CapabilityExecutor;
import ai.agentcap.router.spi.CapabilityHealthMonitor;
import ai.agentcap.router.spi.CapabilityRegistry;
import ai.agentcap.router.spi.InMemoryCapabilityRegistry;
import ai.agentcap.router.spi.InvocationMetricsCollector;
import ai.agentcap.router.spi.PrefetchInputResolver;
import ai.agentcap.router.spi.SettlementSignalEmitter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Capability router wiring.
 *
 * <p>
 * Every bean backs off when the application defines its own. Executors are every
 * {@link CapabilityExecutor} bean in {@code @Order} order; the health monitor, meter registry and
 * prefetch input resolver are optional.
 */
@AutoConfiguration
@EnableConfigurationProperties(CapRouterProperties.class)
@ConditionalOnProperty(name = "cap.router.enabled", havingValue = "true", matchIfMissing = true)
public class CapRouterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CapabilityRegistry capabilityRegistry() {
        return new InMemoryCapabilityRegistry();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public BackgroundTasks capRouterBackgroundTasks(CapRouterProperties props) {
        return new BackgroundTasks(props.getWorker().getPoolSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public InvocationMetricsCollector invocationMetricsCollector(ObjectProvider<MeterRegistry> registryProvider,
            CapRouterProperties props) {
        if (!props.getMetrics().isEnabled()) {
            return InvocationMetricsCollector.noop();
        }
        return new MicrometerInvocationMetrics(registryProvider.getIfAvailable(), props.getMetrics().getPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public SettlementSignalEmitter settlementSignalEmitter() {
        return new CommitmentSignalEmitter();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public InvocationOrchestrator invocationOrchestrator(CapabilityRegistry registry,
            ObjectProvider<CapabilityExecutor> executors,
            CapRouterProperties props,
            BackgroundTasks backgroundTasks,
            InvocationMetricsCollector metricsCollector,
            SettlementSignalEmitter settlementEmitter,
            ObjectProvider<CapabilityHealthMonitor> healthMonitor,
            ObjectProvider<PrefetchInputResolver> prefetchInputResolver) {
        return InvocationOrchestrator.builder()
                .registry(registry)
                .executors(executors.orderedStream().toList())
                .properties(props)
                .clock(Clock.systemUTC())
                .backgroundTasks(backgroundTasks)
                .metricsCollector(metricsCollector)
                .settlementEmitter(settlementEmitter)
                .healthMonitor(healthMonitor.getIfAvailable())
                .prefetchInputResolver(prefetchInputResolver.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry policyRegistry() {
        return new PolicyRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public RouteCatalog routeCatalog() {
        return new StaticRouteCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyRouter policyRouter(InvocationOrchestrator orchestrator, PolicyRegistry policies, RouteCatalog routes) {
        return new PolicyRouter(orchestrator, policies, routes, Clock.systemUTC());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "cap.router.maintenance.enabled", havingValue = "true")
    public MaintenanceScheduler capRouterMaintenanceScheduler(InvocationOrchestrator orchestrator,
            CapRouterProperties props) {
        return new MaintenanceScheduler(orchestrator, props.getMaintenance().getIntervalMs());
    }
}
