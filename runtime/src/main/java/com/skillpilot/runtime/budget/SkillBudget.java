package com.skillpilot.runtime.budget;

/**
 * Point-in-time view of one skill's token budget.
 *
 * @param skillName Owner of the budget.
 * @param allocated Tokens granted to the skill.
 * @param used      Tokens the skill has consumed so far.
 * @param priority  Reclaim rank; a request may only take unused budget from
 *                  holders with a strictly lower priority.
 */
public record SkillBudget(String skillName, int allocated, int used, int priority) {

    public int remaining() {
        return allocated - used;
    }

    /** used / allocated, or 0 when nothing is allocated. */
    public double utilization() {
        return allocated == 0 ? 0.0 : (double) used / allocated;
    }
}
