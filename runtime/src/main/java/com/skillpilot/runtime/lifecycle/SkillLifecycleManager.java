package com.skillpilot.runtime.lifecycle;

import com.skillpilot.runtime.budget.BudgetAllocator;
import com.skillpilot.runtime.skill.SkillContent;
import com.skillpilot.runtime.skill.SkillException;
import com.skillpilot.runtime.skill.SkillNotFoundException;
import com.skillpilot.runtime.skill.SkillSource;
import com.skillpilot.runtime.skill.SkillVersion;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the skill lifecycle state machine (see {@link SkillState}).
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Load/unload skill content, keeping at most {@code maxLoadedSkills}
 *       resident. A full cache evicts the first LOADED (not ACTIVE) skill.</li>
 *   <li>Activate/deactivate skills, keeping at most {@code maxActiveSkills}
 *       active and their allocations within {@code contextBudget}. Room is made
 *       by deactivating the skill whose current activation is oldest.</li>
 *   <li>Hot-reload upgrades within a major version, and rollback to the
 *       version recorded by an earlier upgrade.</li>
 *   <li>Append every transition to the {@link LifecycleEventLog} and notify
 *       registered {@link LifecycleHooks}.</li>
 * </ol>
 *
 * <p>All bookkeeping happens under one lock. Skill source fetches and hooks run
 * outside it, so a slow source never blocks other callers; the result of a
 * fetch is applied atomically once it arrives.
 *
 * <p>Expected failures come back as {@link LifecycleResult}s and are never
 * thrown. Source failures additionally move the skill to {@link SkillState#ERROR}
 * and reach the error hooks.
 *
 * <p>Two token pools exist side by side: this manager's flat {@code contextBudget}
 * and, for priority activations, the {@link BudgetAllocator}'s pool. A priority
 * activation is charged to both: the allocator decides how much is granted and the
 * grant is what this manager counts against the context budget. Callers that also
 * allocate for the same skill directly on the allocator are double counting.
 */
public class SkillLifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SkillLifecycleManager.class);

    private final SkillSource      source;
    private final BudgetAllocator  allocator;   // null: priority activation unsupported
    private final LifecycleLimits  limits;
    private final MeterRegistry    meterRegistry;
    private final ExecutorService  fetchExecutor;

    private final ReentrantLock lock = new ReentrantLock();

    // Insertion-ordered: load eviction takes the first LOADED name.
    private final Map<String, SkillState>   states      = new LinkedHashMap<>();
    private final Map<String, SkillVersion> versions    = new HashMap<>();
    private final Map<String, String>       contents    = new HashMap<>();
    private final Map<String, Integer>      allocations = new LinkedHashMap<>();
    // Active skills whose allocation came from the BudgetAllocator, with their priority.
    private final Map<String, Integer>      priorities  = new HashMap<>();
    private final LifecycleEventLog         events;
    private final LifecycleHooks            hooks = new LifecycleHooks();

    public SkillLifecycleManager(SkillSource source,
                                 BudgetAllocator allocator,
                                 LifecycleLimits limits,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.source        = source;
        this.allocator     = allocator;
        this.limits        = limits;
        this.meterRegistry = meterRegistry;
        this.events        = new LifecycleEventLog(clock);
        this.fetchExecutor = newFetchExecutor();

        Gauge.builder("skillpilot.skill.loaded", this, m -> m.getLoadedSkills().size())
                .register(meterRegistry);
        Gauge.builder("skillpilot.skill.active", this, m -> m.getActiveSkills().size())
                .register(meterRegistry);
        Gauge.builder("skillpilot.context.allocated", this, m -> m.limits.contextBudget() - m.getAvailableBudget())
                .register(meterRegistry);

        log.info("Skill lifecycle manager initialised (maxLoaded={}, maxActive={}, contextBudget={}, defaultAllocation={})",
                limits.maxLoadedSkills(), limits.maxActiveSkills(),
                limits.contextBudget(), limits.defaultAllocation());
    }

    // ------------------------------------------------------------------
    // Hooks
    // ------------------------------------------------------------------

    public void onLoad(LifecycleHooks.LoadHook hook)     { hooks.addLoadHook(hook); }
    public void onUnload(LifecycleHooks.UnloadHook hook) { hooks.addUnloadHook(hook); }
    public void onError(LifecycleHooks.ErrorHook hook)   { hooks.addErrorHook(hook); }

    // ------------------------------------------------------------------
    // Load / unload
    // ------------------------------------------------------------------

    public LifecycleResult load(String skillName) {
        return load(skillName, null);
    }

    /**
     * Bring a skill's content into memory.
     *
     * A no-op if the skill is already LOADED or ACTIVE. When the cache is full,
     * one LOADED skill is unloaded first; if every resident skill is ACTIVE the
     * load fails with {@code CAPACITY_EXCEEDED} and nothing changes.
     *
     * @param version specific version to fetch, or null for the source's current one
     */
    public LifecycleResult load(String skillName, String version) {
        if (skillName == null || skillName.isBlank()) {
            return LifecycleResult.failed(skillName, SkillException.Kind.INVALID_ARGUMENT, "Skill name is blank");
        }
        lock.lock();
        try {
            if (stateOf(skillName).isResident()) {
                log.debug("Skill '{}' already loaded", skillName);
                return LifecycleResult.ok(skillName);
            }
        } finally {
            lock.unlock();
        }

        Fetched fetched;
        try {
            fetched = fetch(skillName, version);
        } catch (SkillException e) {
            return failLoad(skillName, version, e);
        }

        List<Notification> notifications = new ArrayList<>();
        LifecycleResult result;
        lock.lock();
        try {
            result = commitLoadLocked(skillName, fetched, notifications);
        } finally {
            lock.unlock();
        }
        dispatch(notifications);
        return result;
    }

    /**
     * Drop a skill's content, deactivating it first if needed. Always succeeds;
     * a name that was never loaded simply becomes UNLOADED.
     */
    public LifecycleResult unload(String skillName) {
        List<Notification> notifications = new ArrayList<>();
        lock.lock();
        try {
            unloadLocked(skillName, true, null, notifications);
        } finally {
            lock.unlock();
        }
        dispatch(notifications);
        return LifecycleResult.ok(skillName);
    }

    // ------------------------------------------------------------------
    // Activate / deactivate
    // ------------------------------------------------------------------

    public LifecycleResult activate(String skillName) {
        return activate(skillName, null);
    }

    /**
     * Put a skill's instructions into the agent context, loading it if needed.
     *
     * Activating an already active skill with the same allocation changes
     * nothing. With a different allocation the skill is resized in place.
     *
     * @param allocation tokens to reserve, or null for the configured default
     * @return on success, the content to insert into the agent context
     */
    public LifecycleResult activate(String skillName, Integer allocation) {
        return activateInternal(skillName, allocation, null);
    }

    /**
     * Activate with a token grant from the {@link BudgetAllocator}, which may
     * reclaim unused budget from lower-priority skills. The granted amount,
     * possibly less than requested, becomes the skill's context allocation.
     * An already active skill is re-granted in place; if the allocator has
     * nothing for it, it keeps its current allocation and nothing is evicted.
     */
    public LifecycleResult activate(String skillName, int allocation, int priority) {
        return activateInternal(skillName, allocation, priority);
    }

    private LifecycleResult activateInternal(String skillName, Integer requested, Integer priority) {
        int allocation = requested == null ? limits.defaultAllocation() : requested;
        if (allocation <= 0) {
            return LifecycleResult.failed(skillName, SkillException.Kind.INVALID_ALLOCATION,
                    "Allocation must be positive, got " + allocation);
        }
        if (allocation > limits.contextBudget()) {
            log.warn("Refusing to activate '{}': allocation {} exceeds the whole context budget {}",
                    skillName, allocation, limits.contextBudget());
            return LifecycleResult.failed(skillName, SkillException.Kind.BUDGET_EXCEEDED,
                    "Allocation " + allocation + " exceeds context budget " + limits.contextBudget());
        }
        if (priority != null && allocator == null) {
            return LifecycleResult.failed(skillName, SkillException.Kind.UNSUPPORTED,
                    "Priority activation requires a budget allocator");
        }

        boolean resident;
        lock.lock();
        try {
            resident = stateOf(skillName).isResident();
        } finally {
            lock.unlock();
        }
        if (!resident) {
            LifecycleResult loaded = load(skillName);
            if (loaded.isFailure()) {
                return loaded;
            }
        }

        lock.lock();
        try {
            if (!stateOf(skillName).isResident()) {
                // Evicted by a concurrent caller between load and activation.
                return LifecycleResult.failed(skillName, SkillException.Kind.CAPACITY_EXCEEDED,
                        "Skill was evicted before it could be activated");
            }
            return activateLocked(skillName, allocation, priority);
        } finally {
            lock.unlock();
        }
    }

    private LifecycleResult activateLocked(String skillName, int allocation, Integer priority) {
        boolean active = stateOf(skillName) == SkillState.ACTIVE;

        if (active && priority == null && !priorities.containsKey(skillName)
                && allocations.get(skillName) == allocation) {
            log.debug("Skill '{}' already active with {} tokens", skillName, allocation);
            return LifecycleResult.activated(skillName, contents.get(skillName));
        }

        // The allocator is asked before anything is deactivated: a refusal leaves every skill as it was.
        int granted = allocation;
        if (priority != null) {
            granted = allocator.tryAllocate(skillName, allocation, priority);
            if (granted <= 0) {
                log.warn("Budget allocator granted nothing to '{}' (requested={}, priority={})",
                        skillName, allocation, priority);
                return LifecycleResult.failed(skillName, SkillException.Kind.BUDGET_EXCEEDED,
                        "Budget allocator has no tokens for priority " + priority);
            }
        } else if (active && priorities.containsKey(skillName)) {
            // Switching a priority activation to a flat one.
            priorities.remove(skillName);
            allocator.release(skillName);
        }

        if (!active && activeCountLocked() >= limits.maxActiveSkills()) {
            oldestActiveLocked(skillName).ifPresent(oldest -> {
                log.info("Active slots full ({}), deactivating oldest active skill '{}'",
                        limits.maxActiveSkills(), oldest);
                evictions("active_slots");
                deactivateLocked(oldest, true, "active_slots");
            });
        }

        // granted <= contextBudget, so once every other skill is out the request fits.
        int own = active ? allocations.get(skillName) : 0;
        while (usedLocked() - own + granted > limits.contextBudget()) {
            Optional<String> oldest = oldestActiveLocked(skillName);
            if (oldest.isEmpty()) {
                break;
            }
            log.info("Freeing context for '{}' ({} tokens needed, {} available): deactivating '{}'",
                    skillName, granted, limits.contextBudget() - usedLocked() + own, oldest.get());
            evictions("context_budget");
            deactivateLocked(oldest.get(), true, "context_budget");
        }

        if (priority != null) {
            priorities.put(skillName, priority);
        }
        SkillState old = stateOf(skillName);
        allocations.remove(skillName);
        allocations.put(skillName, granted);
        states.put(skillName, SkillState.ACTIVE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(LifecycleEvent.CONTEXT_ALLOCATION, granted);
        if (priority != null) metadata.put(LifecycleEvent.PRIORITY, priority);
        if (active) metadata.put(LifecycleEvent.RESIZED, true);
        recordLocked(skillName, LifecycleEventType.ACTIVATE, old, SkillState.ACTIVE, versionString(skillName), metadata);

        log.info("Skill '{}' activated with {} tokens{}", skillName, granted,
                priority == null ? "" : " (priority " + priority + ")");
        return LifecycleResult.activated(skillName, contents.get(skillName));
    }

    /**
     * Take a skill out of the agent context; it stays LOADED. A no-op for
     * skills that are not active.
     */
    public LifecycleResult deactivate(String skillName) {
        lock.lock();
        try {
            if (!deactivateLocked(skillName, true, null)) {
                log.debug("Skill '{}' not active, nothing to deactivate", skillName);
            }
        } finally {
            lock.unlock();
        }
        return LifecycleResult.ok(skillName);
    }

    // ------------------------------------------------------------------
    // Versioning
    // ------------------------------------------------------------------

    /**
     * Hot-reload a skill at another version of the same major line.
     *
     * The target content is fetched before anything changes; if that fails a
     * resident skill keeps its current version, content and state. On success
     * the skill is unloaded, loaded at the new version and, if it was active,
     * re-activated with its previous allocation, all in one step.
     */
    public LifecycleResult upgrade(String skillName, String targetVersion) {
        SkillVersion target;
        try {
            target = SkillVersion.parse(targetVersion);
        } catch (IllegalArgumentException e) {
            return LifecycleResult.failed(skillName, SkillException.Kind.INVALID_VERSION, e.getMessage());
        }

        SkillVersion current;
        boolean resident;
        lock.lock();
        try {
            current = versions.get(skillName);
            resident = stateOf(skillName).isResident();
        } finally {
            lock.unlock();
        }
        if (current != null && !current.isCompatible(target)) {
            log.warn("Rejected upgrade of '{}': {} -> {} crosses a major version", skillName, current, target);
            return incompatible(skillName, current, target);
        }

        Fetched fetched;
        try {
            fetched = fetch(skillName, target.toString());
        } catch (SkillException e) {
            // Nothing in memory to keep: a failed upgrade of a non-resident skill is a failed load.
            return resident ? failUpgrade(skillName, target, e) : failLoad(skillName, target.toString(), e);
        }

        List<Notification> notifications = new ArrayList<>();
        LifecycleResult result;
        lock.lock();
        try {
            result = commitUpgradeLocked(skillName, target, fetched, notifications);
        } finally {
            lock.unlock();
        }
        dispatch(notifications);
        return result;
    }

    private LifecycleResult commitUpgradeLocked(String skillName,
                                                SkillVersion target,
                                                Fetched fetched,
                                                List<Notification> notifications) {
        SkillVersion current = versions.get(skillName);
        if (current != null && !(current.isCompatible(target) && current.isCompatible(fetched.version()))) {
            SkillVersion offending = current.isCompatible(target) ? fetched.version() : target;
            recordLocked(skillName, LifecycleEventType.UPGRADE_ERROR, stateOf(skillName), stateOf(skillName),
                    offending.toString(), Map.of(LifecycleEvent.ERROR, "incompatible version " + offending));
            return incompatible(skillName, current, offending);
        }

        SkillState before = stateOf(skillName);
        if (!before.isResident()) {
            // Nothing in memory to swap: a plain load at the target version.
            LifecycleResult loaded = commitLoadLocked(skillName, fetched, notifications);
            if (loaded.success()) {
                recordUpgradeLocked(skillName, current);
                log.info("Skill '{}' upgraded {} -> {} (loaded)", skillName,
                        current == null ? "unknown" : current, fetched.version());
            }
            return loaded;
        }

        boolean wasActive = before == SkillState.ACTIVE;
        Integer allocation = allocations.get(skillName);
        Integer priority = priorities.get(skillName);

        unloadLocked(skillName, false, "upgrade", notifications);
        LifecycleResult loaded = commitLoadLocked(skillName, fetched, notifications);
        if (loaded.isFailure()) {
            return loaded;
        }
        if (wasActive) {
            // The slot and tokens freed by the unload are taken back as they were.
            allocations.put(skillName, allocation);
            if (priority != null) {
                priorities.put(skillName, priority);
            }
            states.put(skillName, SkillState.ACTIVE);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(LifecycleEvent.CONTEXT_ALLOCATION, allocation);
            metadata.put(LifecycleEvent.REASON, "upgrade");
            recordLocked(skillName, LifecycleEventType.ACTIVATE, SkillState.LOADED, SkillState.ACTIVE,
                    versionString(skillName), metadata);
        }
        recordUpgradeLocked(skillName, current);
        log.info("Skill '{}' upgraded {} -> {}{}", skillName,
                current == null ? "unknown" : current, fetched.version(), wasActive ? " (still active)" : "");
        return LifecycleResult.ok(skillName);
    }

    public LifecycleResult rollback(String skillName) {
        return rollback(skillName, 1);
    }

    /**
     * Return to the version a skill had before its {@code steps}-th most recent
     * upgrade. The rollback is itself recorded as an upgrade.
     */
    public LifecycleResult rollback(String skillName, int steps) {
        if (steps < 1) {
            return LifecycleResult.failed(skillName, SkillException.Kind.INVALID_ARGUMENT,
                    "Rollback steps must be at least 1, got " + steps);
        }
        Optional<LifecycleEvent> upgradeEvent;
        long recorded;
        lock.lock();
        try {
            upgradeEvent = events.nthLatest(skillName, LifecycleEventType.UPGRADE, steps);
            recorded = events.count(skillName, LifecycleEventType.UPGRADE);
        } finally {
            lock.unlock();
        }

        if (upgradeEvent.isEmpty()) {
            return LifecycleResult.failed(skillName, SkillException.Kind.NO_UPGRADE_HISTORY,
                    "Cannot rollback " + steps + " versions. Only " + recorded + " upgrades recorded.");
        }
        Object fromVersion = upgradeEvent.get().metadata(LifecycleEvent.FROM_VERSION);
        if (fromVersion == null) {
            return LifecycleResult.failed(skillName, SkillException.Kind.NO_UPGRADE_HISTORY,
                    "Upgrade #" + upgradeEvent.get().sequence() + " recorded no prior version");
        }

        LifecycleResult result = upgrade(skillName, fromVersion.toString());
        if (result.success()) {
            log.info("Skill '{}' rolled back to {}", skillName, fromVersion);
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public SkillState getState(String skillName) {
        lock.lock();
        try {
            return stateOf(skillName);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SkillVersion> getVersion(String skillName) {
        lock.lock();
        try {
            return Optional.ofNullable(versions.get(skillName));
        } finally {
            lock.unlock();
        }
    }

    /** Resident content of a skill; empty unless LOADED or ACTIVE. */
    public Optional<String> getContent(String skillName) {
        lock.lock();
        try {
            return Optional.ofNullable(contents.get(skillName));
        } finally {
            lock.unlock();
        }
    }

    /** Allocation of every active skill, in activation order. */
    public Map<String, Integer> getContextUsage() {
        lock.lock();
        try {
            return new LinkedHashMap<>(allocations);
        } finally {
            lock.unlock();
        }
    }

    public int getAvailableBudget() {
        lock.lock();
        try {
            return limits.contextBudget() - usedLocked();
        } finally {
            lock.unlock();
        }
    }

    public List<LifecycleEvent> getEvents() {
        lock.lock();
        try {
            return events.all();
        } finally {
            lock.unlock();
        }
    }

    public List<LifecycleEvent> getEvents(String skillName) {
        if (skillName == null) {
            return getEvents();
        }
        lock.lock();
        try {
            return events.forSkill(skillName);
        } finally {
            lock.unlock();
        }
    }

    /** Names of LOADED and ACTIVE skills. */
    public List<String> getLoadedSkills() {
        lock.lock();
        try {
            return states.entrySet().stream()
                    .filter(e -> e.getValue().isResident())
                    .map(Map.Entry::getKey)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<String> getActiveSkills() {
        lock.lock();
        try {
            return List.copyOf(allocations.keySet());
        } finally {
            lock.unlock();
        }
    }

    public LifecycleLimits getLimits() { return limits; }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Locked helpers (caller holds the lock)
    // ------------------------------------------------------------------

    private SkillState stateOf(String skillName) {
        return states.getOrDefault(skillName, SkillState.DISCOVERED);
    }

    private LifecycleResult commitLoadLocked(String skillName, Fetched fetched, List<Notification> notifications) {
        SkillState old = stateOf(skillName);
        if (old.isResident()) {
            log.debug("Skill '{}' was loaded concurrently, discarding fetched copy", skillName);
            return LifecycleResult.ok(skillName);
        }

        if (loadedCountLocked() >= limits.maxLoadedSkills()) {
            Optional<String> victim = states.entrySet().stream()
                    .filter(e -> e.getValue() == SkillState.LOADED)
                    .map(Map.Entry::getKey)
                    .findFirst();
            if (victim.isEmpty()) {
                log.warn("Cannot load '{}': all {} resident skills are active", skillName, limits.maxLoadedSkills());
                return LifecycleResult.failed(skillName, SkillException.Kind.CAPACITY_EXCEEDED,
                        "All " + limits.maxLoadedSkills() + " loaded skills are active");
            }
            log.info("Loaded skills at capacity ({}), evicting '{}' to load '{}'",
                    limits.maxLoadedSkills(), victim.get(), skillName);
            evictions("loaded_capacity");
            unloadLocked(victim.get(), true, "loaded_capacity", notifications);
        }

        contents.put(skillName, fetched.content());
        versions.put(skillName, fetched.version());
        states.put(skillName, SkillState.LOADED);
        recordLocked(skillName, LifecycleEventType.LOAD, old, SkillState.LOADED, fetched.version().toString(), null);
        notifications.add(Notification.loaded(skillName, fetched.content()));

        log.info("Skill '{}' loaded (v{}, {} chars)", skillName, fetched.version(), fetched.content().length());
        return LifecycleResult.ok(skillName);
    }

    private void unloadLocked(String skillName, boolean releaseBudget, String reason, List<Notification> notifications) {
        deactivateLocked(skillName, releaseBudget, reason);
        SkillState old = stateOf(skillName);
        contents.remove(skillName);
        states.put(skillName, SkillState.UNLOADED);
        recordLocked(skillName, LifecycleEventType.UNLOAD, old, SkillState.UNLOADED, versionString(skillName),
                reason == null ? null : Map.of(LifecycleEvent.REASON, reason));
        notifications.add(Notification.unloaded(skillName));
        log.info("Skill '{}' unloaded{}", skillName, reason == null ? "" : " (" + reason + ")");
    }

    /** @return false if the skill was not active */
    private boolean deactivateLocked(String skillName, boolean releaseBudget, String reason) {
        if (stateOf(skillName) != SkillState.ACTIVE) {
            return false;
        }
        states.put(skillName, SkillState.LOADED);
        Integer freed = allocations.remove(skillName);
        Integer priority = priorities.remove(skillName);
        if (releaseBudget && priority != null) {
            allocator.release(skillName);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(LifecycleEvent.CONTEXT_ALLOCATION, freed);
        if (reason != null) metadata.put(LifecycleEvent.REASON, reason);
        recordLocked(skillName, LifecycleEventType.DEACTIVATE, SkillState.ACTIVE, SkillState.LOADED,
                versionString(skillName), metadata);
        log.info("Skill '{}' deactivated, {} tokens freed{}", skillName, freed,
                reason == null ? "" : " (" + reason + ")");
        return true;
    }

    /**
     * Owner of the earliest ACTIVATE event among currently active skills.
     * Every activation a skill ever had counts, so this is first-in-first-out
     * by first activation; access after activation is not tracked.
     */
    private Optional<String> oldestActiveLocked(String excluding) {
        String oldest = null;
        long oldestSequence = Long.MAX_VALUE;
        for (String name : allocations.keySet()) {
            if (name.equals(excluding)) {
                continue;
            }
            long sequence = events.earliest(name, LifecycleEventType.ACTIVATE)
                    .map(LifecycleEvent::sequence)
                    .orElse(0L);
            if (sequence < oldestSequence) {
                oldest = name;
                oldestSequence = sequence;
            }
        }
        return Optional.ofNullable(oldest);
    }

    private void recordUpgradeLocked(String skillName, SkillVersion from) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(LifecycleEvent.FROM_VERSION, from == null ? null : from.toString());
        SkillState state = stateOf(skillName);
        recordLocked(skillName, LifecycleEventType.UPGRADE, state, state, versionString(skillName), metadata);
    }

    private void recordLocked(String skillName, LifecycleEventType type, SkillState oldState, SkillState newState,
                              String version, Map<String, Object> metadata) {
        events.append(skillName, type, oldState, newState, version, metadata);
        meterRegistry.counter("skillpilot.skill.transitions", "event", type.name().toLowerCase()).increment();
    }

    private long loadedCountLocked() {
        return states.values().stream().filter(SkillState::isResident).count();
    }

    private long activeCountLocked() {
        return states.values().stream().filter(s -> s == SkillState.ACTIVE).count();
    }

    private int usedLocked() {
        return allocations.values().stream().mapToInt(Integer::intValue).sum();
    }

    private String versionString(String skillName) {
        SkillVersion v = versions.get(skillName);
        return v == null ? null : v.toString();
    }

    private void evictions(String reason) {
        meterRegistry.counter("skillpilot.skill.evictions", "reason", reason).increment();
    }

    // ------------------------------------------------------------------
    // Failure paths
    // ------------------------------------------------------------------

    private LifecycleResult failLoad(String skillName, String version, SkillException error) {
        lock.lock();
        try {
            SkillState old = stateOf(skillName);
            if (old.isResident()) {
                // A concurrent load succeeded while this one was fetching.
                return LifecycleResult.ok(skillName);
            }
            states.put(skillName, SkillState.ERROR);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(LifecycleEvent.ERROR, error.getMessage());
            if (version != null) metadata.put("requested_version", version);
            recordLocked(skillName, LifecycleEventType.LOAD_ERROR, old, SkillState.ERROR, version, metadata);
        } finally {
            lock.unlock();
        }
        log.error("Failed to load skill '{}': {}", skillName, error.getMessage());
        hooks.fireError(skillName, error);
        return LifecycleResult.failed(skillName, error);
    }

    private LifecycleResult failUpgrade(String skillName, SkillVersion target, SkillException error) {
        lock.lock();
        try {
            SkillState state = stateOf(skillName);
            recordLocked(skillName, LifecycleEventType.UPGRADE_ERROR, state, state, target.toString(),
                    Map.of(LifecycleEvent.ERROR, error.getMessage()));
        } finally {
            lock.unlock();
        }
        log.error("Failed to upgrade skill '{}' to {}: {}", skillName, target, error.getMessage());
        hooks.fireError(skillName, error);
        return LifecycleResult.failed(skillName, error);
    }

    private static LifecycleResult incompatible(String skillName, SkillVersion current, SkillVersion target) {
        return LifecycleResult.failed(skillName, SkillException.Kind.INCOMPATIBLE_VERSION,
                "Incompatible version upgrade: " + current + " -> " + target + ". Major version must match.");
    }

    // ------------------------------------------------------------------
    // Skill source access
    // ------------------------------------------------------------------

    private record Fetched(String content, SkillVersion version) {}

    /**
     * Fetch content on the fetch executor, bounded by the configured timeout.
     * Every failure is translated into a {@link SkillException}.
     */
    private Fetched fetch(String skillName, String version) {
        Future<Optional<SkillContent>> future = fetchExecutor.submit(() -> source.fetch(skillName, version));
        Optional<SkillContent> content;
        try {
            content = future.get(limits.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SkillException(SkillException.Kind.TIMEOUT,
                    "Fetching '" + skillName + "' took longer than " + limits.fetchTimeout(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SkillException(SkillException.Kind.UNEXPECTED_FAULT,
                    "Interrupted while fetching '" + skillName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SkillException se) {
                throw se;
            }
            throw new SkillException(SkillException.Kind.SOURCE_ERROR,
                    "Skill source failed for '" + skillName + "': " + cause.getMessage(), cause);
        }

        SkillContent found = content.orElseThrow(() -> version == null
                ? new SkillNotFoundException(skillName)
                : new SkillNotFoundException(skillName, version));
        try {
            return new Fetched(found.content(), found.resolveVersion());
        } catch (IllegalArgumentException e) {
            throw new SkillException(SkillException.Kind.SOURCE_ERROR,
                    "Skill '" + skillName + "' declares an invalid version: " + e.getMessage(), e);
        }
    }

    private static ExecutorService newFetchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "skill-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Hook dispatch (outside the lock)
    // ------------------------------------------------------------------

    private record Notification(String skillName, String content, boolean load) {
        static Notification loaded(String skillName, String content) {
            return new Notification(skillName, content, true);
        }

        static Notification unloaded(String skillName) {
            return new Notification(skillName, null, false);
        }
    }

    private void dispatch(List<Notification> notifications) {
        for (Notification n : notifications) {
            List<LifecycleHooks.HookFailure> failures = n.load()
                    ? hooks.fireLoad(n.skillName(), n.content())
                    : hooks.fireUnload(n.skillName());
            for (LifecycleHooks.HookFailure failure : failures) {
                log.warn("{} hook failed for skill '{}': {}",
                        failure.hook(), n.skillName(), failure.error().getMessage(), failure.error());
                lock.lock();
                try {
                    SkillState state = stateOf(n.skillName());
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("hook", failure.hook());
                    metadata.put(LifecycleEvent.ERROR, String.valueOf(failure.error().getMessage()));
                    recordLocked(n.skillName(), LifecycleEventType.HOOK_ERROR, state, state,
                            versionString(n.skillName()), metadata);
                } finally {
                    lock.unlock();
                }
                hooks.fireError(n.skillName(), failure.error());
            }
        }
    }
}
