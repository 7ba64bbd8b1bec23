package com.skillpilot.runtime.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically rebalances the {@link BudgetAllocator} so idle grants flow back
 * to the pool and saturated ones can grow without an explicit request.
 *
 * Off unless {@code skillpilot.budget.rebalance-enabled=true}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "skillpilot.budget", name = "rebalance-enabled", havingValue = "true")
public class BudgetRebalanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(BudgetRebalanceScheduler.class);

    private final BudgetAllocator allocator;

    public BudgetRebalanceScheduler(BudgetAllocator allocator) {
        this.allocator = allocator;
    }

    /**
     * fixedDelay: the next rebalance starts one interval after the previous
     * one finished.
     */
    @Scheduled(fixedDelayString = "${skillpilot.budget.rebalance-interval:60s}")
    public void tick() {
        try {
            allocator.rebalance();
        } catch (RuntimeException e) {
            log.error("Budget rebalance failed: {}", e.getMessage(), e);
        }
    }
}
