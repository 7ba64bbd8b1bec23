package com.skillpilot.runtime.budget;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetAllocatorTest {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    SimpleMeterRegistry meterRegistry;
    BudgetAllocator allocator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        allocator = new BudgetAllocator(10_000, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void constructor_nonPositiveTotal_throws() {
        assertThatThrownBy(() -> new BudgetAllocator(0, meterRegistry, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // allocate()
    // ------------------------------------------------------------------

    @Test
    void allocate_withinPool_grantsRequest() {
        int granted = allocator.allocate("reflection", 2000);

        assertThat(granted).isEqualTo(2000);
        SkillBudget budget = allocator.getBudget("reflection").orElseThrow();
        assertThat(budget.allocated()).isEqualTo(2000);
        assertThat(budget.used()).isZero();
        assertThat(budget.priority()).isEqualTo(BudgetAllocator.DEFAULT_PRIORITY);
        assertThat(allocator.getAvailable()).isEqualTo(8000);
    }

    @Test
    void allocate_beyondPoolAtDefaultPriority_grantsWhatIsLeft() {
        allocator.allocate("reflection", 2000, 2);

        int granted = allocator.allocate("planner", 9000, 1);

        assertThat(granted).isEqualTo(8000);
        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(2000);
        assertThat(allocator.getTotalAllocated()).isEqualTo(10_000);
    }

    @Test
    void allocate_highPriority_reclaimsUnusedFromLowerPriority() {
        allocator.allocate("a", 6000, 1);
        allocator.allocate("b", 4000, 2);
        allocator.use("a", 1000);

        int granted = allocator.allocate("critical", 3000, 3);

        assertThat(granted).isEqualTo(3000);
        // Lowest priority is drained first.
        assertThat(allocator.getBudget("a").orElseThrow().allocated()).isEqualTo(3000);
        assertThat(allocator.getBudget("b").orElseThrow().allocated()).isEqualTo(4000);
        assertThat(allocator.getTotalAllocated()).isEqualTo(10_000);
        assertThat(meterRegistry.counter("skillpilot.budget.reclaimed").count()).isEqualTo(3000.0);
    }

    @Test
    void allocate_reclaim_neverTakesUsedTokens() {
        allocator.allocate("a", 10_000, 1);
        allocator.use("a", 9000);

        int granted = allocator.allocate("critical", 5000, 2);

        assertThat(granted).isEqualTo(1000);
        SkillBudget a = allocator.getBudget("a").orElseThrow();
        assertThat(a.allocated()).isEqualTo(9000);
        assertThat(a.remaining()).isZero();
    }

    @Test
    void allocate_reclaim_skipsEqualAndHigherPriority() {
        allocator.allocate("peer", 5000, 2);
        allocator.allocate("boss", 5000, 4);

        assertThat(allocator.allocate("newcomer", 1000, 2)).isZero();
    }

    @Test
    void allocate_again_replacesPreviousGrant() {
        allocator.allocate("reflection", 10_000);

        int granted = allocator.allocate("reflection", 4000);

        assertThat(granted).isEqualTo(4000);
        assertThat(allocator.getAllBudgets()).hasSize(1);
        assertThat(allocator.getAvailable()).isEqualTo(6000);
    }

    @Test
    void tryAllocate_nothingAvailable_keepsExistingGrant() {
        allocator.allocate("reflection", 3000, 1);
        allocator.allocate("boss", 10_000, 4);
        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isZero();

        int granted = allocator.tryAllocate("reflection", 2000, 3);

        assertThat(granted).isZero();
        assertThat(allocator.getBudget("reflection").orElseThrow().priority()).isEqualTo(1);
        assertThat(allocator.tryAllocate("newcomer", 1000, 2)).isZero();
        assertThat(allocator.getBudget("newcomer")).isEmpty();
    }

    @Test
    void tryAllocate_whenGranted_behavesLikeAllocate() {
        allocator.allocate("reflection", 3000, 1);

        assertThat(allocator.tryAllocate("reflection", 5000, 2)).isEqualTo(5000);
        assertThat(allocator.getBudget("reflection").orElseThrow().priority()).isEqualTo(2);
        assertThat(allocator.getAvailable()).isEqualTo(5000);
    }

    @Test
    void allocate_nonPositiveRequest_grantsNothing() {
        assertThat(allocator.allocate("reflection", 0)).isZero();
        assertThat(allocator.allocate("reflection", -5)).isZero();
        assertThat(allocator.getBudget("reflection")).isEmpty();
    }

    @Test
    void concurrentAllocations_neverOverCommitPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Integer>> grants = new ArrayList<>();
        try {
            for (int i = 0; i < 50; i++) {
                String name = "skill-" + i;
                int priority = 1 + i % 3;
                grants.add(pool.submit(() -> allocator.allocate(name, 700, priority)));
            }
            for (Future<Integer> g : grants) {
                g.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(allocator.getTotalAllocated()).isLessThanOrEqualTo(10_000);
        assertThat(allocator.getAllBudgets())
                .allSatisfy(b -> assertThat(b.allocated()).isBetween(0, 700));
    }

    // ------------------------------------------------------------------
    // use() / release()
    // ------------------------------------------------------------------

    @Test
    void use_withinGrant_isRecorded() {
        allocator.allocate("reflection", 100);

        assertThat(allocator.use("reflection", 60)).isTrue();
        assertThat(allocator.use("reflection", 40)).isTrue();
        assertThat(allocator.getBudget("reflection").orElseThrow().remaining()).isZero();
        assertThat(allocator.getTotalUsed()).isEqualTo(100);
    }

    @Test
    void use_beyondGrant_isRejectedWithoutChange() {
        allocator.allocate("reflection", 100);

        assertThat(allocator.use("reflection", 150)).isFalse();
        assertThat(allocator.getBudget("reflection").orElseThrow().used()).isZero();
    }

    @Test
    void use_unknownSkillOrNegativeTokens_isRejected() {
        allocator.allocate("reflection", 100);

        assertThat(allocator.use("ghost", 1)).isFalse();
        assertThat(allocator.use("reflection", -1)).isFalse();
    }

    @Test
    void release_returnsTokensAndRecordsHistory() {
        allocator.allocate("reflection", 1000);
        allocator.use("reflection", 250);

        assertThat(allocator.release("reflection")).isTrue();

        assertThat(allocator.getBudget("reflection")).isEmpty();
        assertThat(allocator.getAvailable()).isEqualTo(10_000);
        assertThat(allocator.getUsageHistory()).singleElement().satisfies(r -> {
            assertThat(r.skillName()).isEqualTo("reflection");
            assertThat(r.allocated()).isEqualTo(1000);
            assertThat(r.used()).isEqualTo(250);
            assertThat(r.utilization()).isEqualTo(0.25);
            assertThat(r.releasedAt()).isEqualTo(NOW);
        });
    }

    @Test
    void release_unknownSkill_returnsFalse() {
        assertThat(allocator.release("ghost")).isFalse();
        assertThat(allocator.getUsageHistory()).isEmpty();
    }

    // ------------------------------------------------------------------
    // rebalance()
    // ------------------------------------------------------------------

    @Test
    void rebalance_lowUtilization_shrinksGrant() {
        allocator.allocate("reflection", 2000);
        allocator.use("reflection", 200);

        allocator.rebalance();

        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(1400);
    }

    @Test
    void rebalance_shrunkGrant_isStableOnNextPass() {
        allocator.allocate("reflection", 100);
        allocator.use("reflection", 29);

        allocator.rebalance();

        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(70);

        // 29 / 70 is no longer idle.
        allocator.rebalance();

        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(70);
    }

    @Test
    void rebalance_highUtilization_expandsFromFreePool() {
        allocator.allocate("reflection", 1000);
        allocator.use("reflection", 950);

        allocator.rebalance();

        // min(9000 / 2, 1000)
        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(2000);
    }

    @Test
    void rebalance_expansionCappedByHalfTheFreePool() {
        allocator.allocate("big", 9000);
        allocator.use("big", 8500);

        allocator.rebalance();

        assertThat(allocator.getBudget("big").orElseThrow().allocated()).isEqualTo(9500);
    }

    @Test
    void rebalance_moderateUtilization_leavesGrantAlone() {
        allocator.allocate("reflection", 1000);
        allocator.use("reflection", 500);

        allocator.rebalance();

        assertThat(allocator.getBudget("reflection").orElseThrow().allocated()).isEqualTo(1000);
    }

    @Test
    void rebalance_neverOverCommitsPool() {
        allocator.allocate("a", 5000);
        allocator.allocate("b", 5000);
        allocator.use("a", 5000);
        allocator.use("b", 4900);

        allocator.rebalance();

        assertThat(allocator.getTotalAllocated()).isEqualTo(10_000);
    }
}
