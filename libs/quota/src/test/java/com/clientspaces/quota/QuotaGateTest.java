package com.clientspaces.quota;

import com.clientspaces.observability.MetricFactory;
import com.clientspaces.quota.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuotaGate")
class QuotaGateTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private RateLimiter rateLimiter;
    private UsageBudgetTracker budgets;
    private AtomicLong clientSpaces;
    private List<QuotaDenial> audited;
    private QuotaGate gate;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T09:00:00Z");
        registry = new SimpleMeterRegistry();
        MetricFactory metrics = new MetricFactory(registry, "quota-service");
        rateLimiter = new RateLimiter(clock);
        budgets = new UsageBudgetTracker(new InMemoryUsageLedgerStore(), clock, metrics);
        clientSpaces = new AtomicLong();
        audited = new ArrayList<>();
        PlanLimitResolver plans = new PlanLimitResolver(List.of(
                new PlanLimits("Starter", Limit.of(3), Duration.ofHours(1),
                        Map.of(BudgetKind.AI_MESSAGE, Limit.of(2)),
                        Map.of(ResourceKind.CLIENT_SPACE, Limit.of(5))),
                new PlanLimits("Professional", Limit.UNLIMITED, Duration.ofHours(1), Map.of(), Map.of())),
                Map.of());
        gate = new QuotaGate(plans, (tenant, kind) -> clientSpaces.get(), rateLimiter, budgets,
                audited::add, metrics);
    }

    @Test
    @DisplayName("allows when every check passes")
    void allows() {
        QuotaDecision decision = gate.check("tenant-a", "Starter", BudgetKind.AI_MESSAGE);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo(QuotaDenialReason.OK);
        assertThat(decision.retryAfter()).isEmpty();
        assertThat(audited).isEmpty();
    }

    @Nested
    @DisplayName("static resource cap")
    class StaticCap {

        private final ProtectedOperation createSpace = ProtectedOperation
                .of("tenant-a", "Starter", "CreateClientSpace", BudgetKind.API_CALL)
                .creating(ResourceKind.CLIENT_SPACE);

        @Test
        @DisplayName("denies at the cap before touching the rate limiter")
        void deniesAtCap() {
            clientSpaces.set(5);

            QuotaDecision decision = gate.check(createSpace);

            assertThat(decision.reason()).isEqualTo(QuotaDenialReason.STATIC_LIMIT_EXCEEDED);
            assertThat(decision.denial()).isEqualTo(new OperationError.StaticLimitExceeded(
                    ResourceKind.CLIENT_SPACE, 5, 5, "Starter", "Professional"));
            assertThat(decision.denial().message())
                    .isEqualTo("Client space limit of 5 reached for Starter plan. Upgrade to Professional to add more.");
            assertThat(rateLimiter.status("tenant-a", Limit.of(3), Duration.ofHours(1)).count()).isZero();
        }

        @Test
        @DisplayName("allows below the cap")
        void allowsBelowCap() {
            clientSpaces.set(4);

            assertThat(gate.check(createSpace).allowed()).isTrue();
        }

        @Test
        @DisplayName("ignores the cap for operations that create nothing")
        void ignoresCapForNonCreating() {
            clientSpaces.set(50);

            assertThat(gate.check("tenant-a", "Starter", BudgetKind.API_CALL).allowed()).isTrue();
        }
    }

    @Nested
    @DisplayName("rate limit")
    class RateLimit {

        @Test
        @DisplayName("denies with retry-after once the window is full")
        void deniesWithRetryAfter() {
            for (int i = 0; i < 3; i++) {
                gate.check("tenant-a", "Starter", BudgetKind.API_CALL);
            }
            clock.advance(Duration.ofMinutes(15));

            QuotaDecision decision = gate.check("tenant-a", "Starter", BudgetKind.API_CALL);

            assertThat(decision.reason()).isEqualTo(QuotaDenialReason.RATE_LIMITED);
            assertThat(decision.retryAfter()).contains(Duration.ofMinutes(45));
            assertThat(registry.get("quota.denials").tag("reason", "rate_limited").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("usage budget")
    class UsageBudget {

        @Test
        @DisplayName("denies when spent and keeps the rate slot it took")
        void deniesAndKeepsRateSlot() {
            budgets.commit("tenant-a", BudgetKind.AI_MESSAGE, 2);

            QuotaDecision decision = gate.check("tenant-a", "Starter", BudgetKind.AI_MESSAGE);

            assertThat(decision.denial()).isEqualTo(new OperationError.UsageBudgetExceeded(
                    BudgetKind.AI_MESSAGE, 2, 2, "Starter", "Professional"));
            assertThat(decision.denial().message()).startsWith("Monthly limit of 2 messages exceeded for Starter plan.");
            assertThat(rateLimiter.status("tenant-a", Limit.of(3), Duration.ofHours(1)).count()).isEqualTo(1);
        }

        @Test
        @DisplayName("a plan without the budget kind is unlimited")
        void unlimitedPlan() {
            budgets.commit("tenant-a", BudgetKind.AI_MESSAGE, 10_000);

            assertThat(gate.check("tenant-a", "Professional", BudgetKind.AI_MESSAGE).allowed()).isTrue();
        }
    }

    @Test
    @DisplayName("sends one audit event per denial and survives a failing sink")
    void auditsDenials() {
        budgets.commit("tenant-a", BudgetKind.AI_MESSAGE, 2);
        gate.check("tenant-a", "Starter", BudgetKind.AI_MESSAGE);

        assertThat(audited).singleElement().satisfies(denial -> {
            assertThat(denial.tenantId()).isEqualTo("tenant-a");
            assertThat(denial.reason()).isEqualTo(QuotaDenialReason.USAGE_BUDGET_EXCEEDED);
            assertThat(denial.operationName()).isEqualTo("ai-message");
        });

        QuotaGate failingAudit = new QuotaGate(PlanCatalog.builtIn(), (tenant, kind) -> 100, rateLimiter, budgets,
                denial -> {
                    throw new IllegalStateException("audit down");
                }, new MetricFactory(registry, "quota-service"));
        QuotaDecision decision = failingAudit.check(ProtectedOperation
                .of("tenant-b", "Starter", "CreateClientSpace", BudgetKind.API_CALL)
                .creating(ResourceKind.CLIENT_SPACE));
        assertThat(decision.reason()).isEqualTo(QuotaDenialReason.STATIC_LIMIT_EXCEEDED);
    }

    @Test
    @DisplayName("unknown tier is a programming error")
    void unknownTier() {
        assertThatThrownBy(() -> gate.check("tenant-a", "Platinum", BudgetKind.AI_MESSAGE))
                .isInstanceOf(UnknownPlanTierException.class);
    }
}
