package com.skillpilot.runtime.config;

import com.skillpilot.runtime.lifecycle.LifecycleLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code skillpilot.*}.
 *
 * <pre>
 *   skillpilot.skills.dir                  directory of skill packages
 *   skillpilot.skills.max-loaded-skills    skills held in memory at once
 *   skillpilot.skills.max-active-skills    skills in the agent context at once
 *   skillpilot.skills.context-budget       tokens shared by active skills
 *   skillpilot.skills.default-allocation   tokens per activation when unspecified
 *   skillpilot.skills.fetch-timeout        bound on one skill source fetch
 *   skillpilot.budget.total-budget         pool of the priority-aware allocator
 *   skillpilot.budget.rebalance-enabled    run periodic rebalancing
 *   skillpilot.budget.rebalance-interval   delay between rebalances
 * </pre>
 */
@ConfigurationProperties(prefix = "skillpilot")
public class SkillRuntimeProperties {

    private Skills skills = new Skills();
    private Budget budget = new Budget();

    public static class Skills {
        private String dir = "skills";
        private int maxLoadedSkills = LifecycleLimits.DEFAULT_MAX_LOADED;
        private int maxActiveSkills = LifecycleLimits.DEFAULT_MAX_ACTIVE;
        private int contextBudget = LifecycleLimits.DEFAULT_CONTEXT_BUDGET;
        private int defaultAllocation = LifecycleLimits.DEFAULT_ALLOCATION;
        private Duration fetchTimeout = LifecycleLimits.DEFAULT_FETCH_TIMEOUT;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public int getMaxLoadedSkills() { return maxLoadedSkills; }
        public void setMaxLoadedSkills(int maxLoadedSkills) { this.maxLoadedSkills = maxLoadedSkills; }
        public int getMaxActiveSkills() { return maxActiveSkills; }
        public void setMaxActiveSkills(int maxActiveSkills) { this.maxActiveSkills = maxActiveSkills; }
        public int getContextBudget() { return contextBudget; }
        public void setContextBudget(int contextBudget) { this.contextBudget = contextBudget; }
        public int getDefaultAllocation() { return defaultAllocation; }
        public void setDefaultAllocation(int defaultAllocation) { this.defaultAllocation = defaultAllocation; }
        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

        /** @throws IllegalArgumentException on non-positive or inconsistent values */
        public LifecycleLimits toLimits() {
            return new LifecycleLimits(maxLoadedSkills, maxActiveSkills, contextBudget, defaultAllocation, fetchTimeout);
        }
    }

    public static class Budget {
        private int totalBudget = LifecycleLimits.DEFAULT_CONTEXT_BUDGET;
        private boolean rebalanceEnabled = false;
        private Duration rebalanceInterval = Duration.ofSeconds(60);

        public int getTotalBudget() { return totalBudget; }
        public void setTotalBudget(int totalBudget) { this.totalBudget = totalBudget; }
        public boolean isRebalanceEnabled() { return rebalanceEnabled; }
        public void setRebalanceEnabled(boolean rebalanceEnabled) { this.rebalanceEnabled = rebalanceEnabled; }
        public Duration getRebalanceInterval() { return rebalanceInterval; }
        public void setRebalanceInterval(Duration rebalanceInterval) { this.rebalanceInterval = rebalanceInterval; }
    }

    public Skills getSkills() { return skills; }
    public void setSkills(Skills skills) { this.skills = skills; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
}
