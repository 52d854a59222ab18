package com.clientspaces.quotaservice.config;

import com.clientspaces.observability.MetricFactory;
import com.clientspaces.quota.DenialAuditSink;
import com.clientspaces.quota.InMemoryUsageLedgerStore;
import com.clientspaces.quota.LoggingDenialAuditSink;
import com.clientspaces.quota.PlanLimitResolver;
import com.clientspaces.quota.ProtectedOperationRunner;
import com.clientspaces.quota.QuotaGate;
import com.clientspaces.quota.RateLimiter;
import com.clientspaces.quota.ResourceCountStore;
import com.clientspaces.quota.UsageBudgetTracker;
import com.clientspaces.quota.UsageLedgerStore;
import com.clientspaces.quotaservice.domain.SubscriptionDirectory;
import com.clientspaces.resilience.ErrorClassifier;
import com.clientspaces.resilience.RetryExecutor;
import com.clientspaces.resilience.UpstreamErrorClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the quota and resilience components into the service.
 *
 * <p>The plan catalog is checked against every configured subscription while the context starts;
 * an unresolvable tier stops startup with a {@code PlanConfigurationException}.
 */
@Configuration
public class QuotaConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QuotaConfiguration.class);

    public static final String UPSTREAM_EXECUTOR = "upstreamExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public PlanLimitResolver planLimitResolver(PlansProperties plans, SubscriptionsProperties subscriptions) {
        PlanLimitResolver resolver = plans.toResolver();
        List<String> referenced = new ArrayList<>(subscriptions.tenants().values());
        referenced.add(subscriptions.defaultTier());
        resolver.validate(referenced);
        log.info("Plan catalog loaded: tiers={}, subscriptions={}", resolver.tiers(), subscriptions.tenants().size());
        return resolver;
    }

    @Bean
    public SubscriptionDirectory subscriptionDirectory(SubscriptionsProperties subscriptions) {
        return new SubscriptionDirectory(subscriptions.tenants(), subscriptions.defaultTier());
    }

    @Bean(name = UPSTREAM_EXECUTOR)
    public ThreadPoolTaskExecutor upstreamExecutor(RetryProperties retry) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(retry.workerThreads());
        executor.setMaxPoolSize(retry.workerThreads());
        executor.setThreadNamePrefix("upstream-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new UpstreamErrorClassifier();
    }

    @Bean
    public RetryExecutor retryExecutor(
            ErrorClassifier classifier,
            RetryProperties retry,
            @Qualifier(UPSTREAM_EXECUTOR) Executor upstreamExecutor,
            MetricFactory metrics) {
        return new RetryExecutor(classifier, retry.toPolicy(), upstreamExecutor, metrics);
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock) {
        return new RateLimiter(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "clientspaces.ledger", name = "store", havingValue = "memory", matchIfMissing = true)
    public UsageLedgerStore inMemoryUsageLedgerStore() {
        log.warn("Using in-memory usage ledger; monthly usage is lost on restart");
        return new InMemoryUsageLedgerStore();
    }

    @Bean
    public UsageBudgetTracker usageBudgetTracker(UsageLedgerStore ledger, Clock clock, MetricFactory metrics) {
        return new UsageBudgetTracker(ledger, clock, metrics);
    }

    @Bean
    public DenialAuditSink denialAuditSink(ServiceProperties service, Clock clock) {
        return new LoggingDenialAuditSink(service.name(), clock);
    }

    @Bean
    public QuotaGate quotaGate(
            PlanLimitResolver plans,
            ResourceCountStore resourceCounts,
            RateLimiter rateLimiter,
            UsageBudgetTracker budgets,
            DenialAuditSink auditSink,
            MetricFactory metrics) {
        return new QuotaGate(plans, resourceCounts, rateLimiter, budgets, auditSink, metrics);
    }

    @Bean
    public ProtectedOperationRunner protectedOperationRunner(
            QuotaGate gate, RetryExecutor retryExecutor, UsageBudgetTracker budgets) {
        return new ProtectedOperationRunner(gate, retryExecutor, budgets);
    }
}
