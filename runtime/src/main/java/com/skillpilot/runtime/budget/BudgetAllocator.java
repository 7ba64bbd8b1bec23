package com.skillpilot.runtime.budget;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Partitions one shared token pool across skills.
 *
 * <ul>
 *   <li>{@link #allocate} grants up to what the pool has left; a request with
 *       priority &gt; 1 that falls short takes unused budget from strictly
 *       lower-priority holders.</li>
 *   <li>{@link #use} draws tokens from a skill's grant.</li>
 *   <li>{@link #release} returns a grant to the pool and records its usage.</li>
 *   <li>{@link #rebalance} shrinks idle grants and grows saturated ones.</li>
 * </ul>
 *
 * Every operation runs under one lock, so the pool read, the reclaim loop and
 * the grant of a single {@code allocate} call happen as one step:
 * {@code Σ allocated ≤ totalBudget} holds whenever the lock is free.
 */
public class BudgetAllocator {

    private static final Logger log = LoggerFactory.getLogger(BudgetAllocator.class);

    public static final int DEFAULT_PRIORITY = 1;

    static final double LOW_UTILIZATION = 0.3;
    static final double HIGH_UTILIZATION = 0.9;
    static final double SHRINK_FACTOR = 0.7;

    /** Mutable record; only touched while holding {@link #lock}. */
    private static final class Entry {
        final String skillName;
        final int    priority;
        int allocated;
        int used;

        Entry(String skillName, int allocated, int priority) {
            this.skillName = skillName;
            this.allocated = allocated;
            this.priority  = priority;
        }

        int remaining() { return allocated - used; }

        double utilization() { return allocated == 0 ? 0.0 : (double) used / allocated; }

        SkillBudget snapshot() { return new SkillBudget(skillName, allocated, used, priority); }
    }

    private final int totalBudget;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // Insertion-ordered so rebalance visits records in allocation order.
    private final Map<String, Entry> budgets = new LinkedHashMap<>();
    private final List<BudgetUsageRecord> usageHistory = new ArrayList<>();

    private final Counter reclaimedTokens;

    public BudgetAllocator(int totalBudget, MeterRegistry meterRegistry, Clock clock) {
        if (totalBudget <= 0) {
            throw new IllegalArgumentException("Total budget must be positive, got " + totalBudget);
        }
        this.totalBudget = totalBudget;
        this.clock = clock;
        this.reclaimedTokens = meterRegistry.counter("skillpilot.budget.reclaimed");
        Gauge.builder("skillpilot.budget.allocated", this, BudgetAllocator::getTotalAllocated)
                .register(meterRegistry);
        Gauge.builder("skillpilot.budget.used", this, BudgetAllocator::getTotalUsed)
                .register(meterRegistry);
        log.info("Budget allocator initialised with {} tokens", totalBudget);
    }

    // ------------------------------------------------------------------
    // Allocation
    // ------------------------------------------------------------------

    public int allocate(String skillName, int requested) {
        return allocate(skillName, requested, DEFAULT_PRIORITY);
    }

    /**
     * Grant up to {@code requested} tokens to a skill, replacing any grant it
     * already holds.
     *
     * @return tokens granted (0 when nothing could be granted or the request is not positive)
     */
    public int allocate(String skillName, int requested, int priority) {
        return allocate(skillName, requested, priority, false);
    }

    /**
     * Like {@link #allocate(String, int, int)}, except that when nothing can be
     * granted the skill's existing grant, if any, is left as it was.
     *
     * @return tokens granted, 0 if the pool (after reclaim) has nothing for this request
     */
    public int tryAllocate(String skillName, int requested, int priority) {
        return allocate(skillName, requested, priority, true);
    }

    private int allocate(String skillName, int requested, int priority, boolean keepOnRefusal) {
        if (requested <= 0) {
            log.debug("Ignoring non-positive budget request {} for '{}'", requested, skillName);
            return 0;
        }
        lock.lock();
        try {
            // The skill's previous grant is replaced, so it counts as free.
            Entry previous = budgets.get(skillName);
            int available = totalBudget - allocatedLocked() + (previous == null ? 0 : previous.allocated);
            int granted = Math.min(requested, Math.max(available, 0));

            if (granted < requested && priority > DEFAULT_PRIORITY) {
                int reclaimed = reclaimLocked(skillName, requested - granted, priority);
                granted += reclaimed;
            }

            // A zero grant reclaimed nothing, so the record is the only thing that would change.
            if (granted == 0 && keepOnRefusal) {
                log.info("Refused {} tokens to '{}' (priority={}), existing grant kept",
                        requested, skillName, priority);
                return 0;
            }

            budgets.remove(skillName);
            budgets.put(skillName, new Entry(skillName, granted, priority));

            log.info("Allocated {}/{} tokens to '{}' (priority={})", granted, requested, skillName, priority);
            return granted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take unused tokens from lower-priority holders, lowest priority first.
     * Only {@code allocated} shrinks; tokens already used are never taken.
     */
    private int reclaimLocked(String requester, int shortfall, int priority) {
        List<Entry> candidates = budgets.values().stream()
                .filter(e -> !e.skillName.equals(requester))
                .filter(e -> e.priority < priority)
                .sorted(Comparator.comparingInt(e -> e.priority))
                .toList();

        int needed = shortfall;
        for (Entry victim : candidates) {
            if (needed <= 0) {
                break;
            }
            int take = Math.min(victim.remaining(), needed);
            if (take <= 0) {
                continue;
            }
            victim.allocated -= take;
            needed -= take;
            log.info("Reclaimed {} tokens from '{}' (priority={}) for '{}' (priority={})",
                    take, victim.skillName, victim.priority, requester, priority);
        }

        int reclaimed = shortfall - needed;
        if (reclaimed > 0) {
            reclaimedTokens.increment(reclaimed);
        }
        return reclaimed;
    }

    // ------------------------------------------------------------------
    // Usage
    // ------------------------------------------------------------------

    /**
     * Draw tokens from a skill's grant.
     *
     * @return false, without changing anything, when the skill has no grant or
     *         fewer than {@code tokens} remain
     */
    public boolean use(String skillName, int tokens) {
        if (tokens < 0) {
            return false;
        }
        lock.lock();
        try {
            Entry entry = budgets.get(skillName);
            if (entry == null) {
                log.debug("Rejected use of {} tokens by '{}': no budget allocated", tokens, skillName);
                return false;
            }
            if (entry.remaining() < tokens) {
                log.debug("Rejected use of {} tokens by '{}': only {} remaining",
                        tokens, skillName, entry.remaining());
                return false;
            }
            entry.used += tokens;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a skill's grant to the pool, keeping its final figures in the
     * usage history.
     *
     * @return false if the skill held no grant
     */
    public boolean release(String skillName) {
        lock.lock();
        try {
            Entry entry = budgets.remove(skillName);
            if (entry == null) {
                return false;
            }
            usageHistory.add(new BudgetUsageRecord(
                    entry.skillName, entry.allocated, entry.used, entry.utilization(), clock.instant()));
            log.info("Released budget of '{}' (allocated={}, used={})",
                    skillName, entry.allocated, entry.used);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Rebalancing
    // ------------------------------------------------------------------

    /**
     * Adjust grants to observed utilization:
     * <ul>
     *   <li>below 30% → shrink to 70% of the grant (never below what is used);</li>
     *   <li>above 90% → grow by min(half the free pool, current grant);</li>
     *   <li>otherwise unchanged.</li>
     * </ul>
     * The free pool is recomputed for every record, so tokens released by an
     * earlier shrink can fund a later expansion in the same pass.
     */
    public void rebalance() {
        lock.lock();
        try {
            int shrunk = 0;
            int expanded = 0;
            for (Entry entry : budgets.values()) {
                double utilization = entry.utilization();
                if (utilization < LOW_UTILIZATION) {
                    int target = Math.max((int) Math.floor(entry.allocated * SHRINK_FACTOR), entry.used);
                    if (target < entry.allocated) {
                        log.debug("Shrinking '{}' from {} to {} tokens (utilization={})",
                                entry.skillName, entry.allocated, target, utilization);
                        entry.allocated = target;
                        shrunk++;
                    }
                } else if (utilization > HIGH_UTILIZATION) {
                    int available = totalBudget - allocatedLocked();
                    int expansion = Math.min(available / 2, entry.allocated);
                    if (expansion > 0) {
                        log.debug("Expanding '{}' by {} tokens (utilization={})",
                                entry.skillName, expansion, utilization);
                        entry.allocated += expansion;
                        expanded++;
                    }
                }
            }
            log.info("Rebalanced {} budgets: {} shrunk, {} expanded, {} tokens allocated",
                    budgets.size(), shrunk, expanded, allocatedLocked());
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<SkillBudget> getBudget(String skillName) {
        lock.lock();
        try {
            Entry entry = budgets.get(skillName);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /** All grants, in allocation order. */
    public List<SkillBudget> getAllBudgets() {
        lock.lock();
        try {
            return budgets.values().stream().map(Entry::snapshot).toList();
        } finally {
            lock.unlock();
        }
    }

    public int getTotalAllocated() {
        lock.lock();
        try {
            return allocatedLocked();
        } finally {
            lock.unlock();
        }
    }

    public int getTotalUsed() {
        lock.lock();
        try {
            return budgets.values().stream().mapToInt(e -> e.used).sum();
        } finally {
            lock.unlock();
        }
    }

    public int getAvailable() {
        return totalBudget - getTotalAllocated();
    }

    public int getTotalBudget() { return totalBudget; }

    public List<BudgetUsageRecord> getUsageHistory() {
        lock.lock();
        try {
            return List.copyOf(usageHistory);
        } finally {
            lock.unlock();
        }
    }

    private int allocatedLocked() {
        return budgets.values().stream().mapToInt(e -> e.allocated).sum();
    }
}
