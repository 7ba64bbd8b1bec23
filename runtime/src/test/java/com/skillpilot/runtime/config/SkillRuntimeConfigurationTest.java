package com.skillpilot.runtime.config;

import com.skillpilot.runtime.budget.BudgetAllocator;
import com.skillpilot.runtime.budget.BudgetRebalanceScheduler;
import com.skillpilot.runtime.lifecycle.LifecycleLimits;
import com.skillpilot.runtime.lifecycle.SkillLifecycleManager;
import com.skillpilot.runtime.skill.FileSystemSkillSource;
import com.skillpilot.runtime.skill.SkillContent;
import com.skillpilot.runtime.skill.SkillSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property binding and bean wiring, without starting the web layer.
 */
class SkillRuntimeConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(SkillRuntimeConfiguration.class, BudgetRebalanceScheduler.class)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    void defaults_wireFileSystemSourceAndDefaultLimits() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(SkillLifecycleManager.class);
            assertThat(context).hasSingleBean(BudgetAllocator.class);
            assertThat(context.getBean(SkillSource.class)).isInstanceOf(FileSystemSkillSource.class);
            assertThat(context.getBean(SkillLifecycleManager.class).getLimits())
                    .isEqualTo(LifecycleLimits.defaults());
            assertThat(context.getBean(BudgetAllocator.class).getTotalBudget()).isEqualTo(10_000);
            assertThat(context).doesNotHaveBean(BudgetRebalanceScheduler.class);
        });
    }

    @Test
    void properties_bindIntoLimitsAndSource() {
        runner.withPropertyValues(
                        "skillpilot.skills.dir=/opt/skills",
                        "skillpilot.skills.max-loaded-skills=8",
                        "skillpilot.skills.max-active-skills=3",
                        "skillpilot.skills.context-budget=6000",
                        "skillpilot.skills.default-allocation=1500",
                        "skillpilot.skills.fetch-timeout=5s",
                        "skillpilot.budget.total-budget=4000")
                .run(context -> {
                    assertThat(context.getBean(SkillLifecycleManager.class).getLimits())
                            .isEqualTo(new LifecycleLimits(8, 3, 6000, 1500, Duration.ofSeconds(5)));
                    assertThat(context.getBean(BudgetAllocator.class).getTotalBudget()).isEqualTo(4000);
                    assertThat(((FileSystemSkillSource) context.getBean(SkillSource.class)).getSkillsDir())
                            .isEqualTo(Path.of("/opt/skills").toAbsolutePath().normalize());
                });
    }

    @Test
    void inconsistentLimits_failStartup() {
        runner.withPropertyValues(
                        "skillpilot.skills.context-budget=1000",
                        "skillpilot.skills.default-allocation=2000")
                .run(context -> assertThat(context)
                        .hasFailed()
                        .getFailure()
                        .rootCause()
                        .hasMessageContaining("defaultAllocation"));
    }

    @Test
    void customSkillSource_replacesFileSystemSource() {
        SkillSource custom = (name, version) -> Optional.of(new SkillContent("remote " + name, "1.0.0"));

        runner.withBean(SkillSource.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(SkillSource.class);
                    assertThat(context.getBean(SkillSource.class)).isSameAs(custom);
                    assertThat(context.getBean(SkillLifecycleManager.class).activate("planner").content())
                            .isEqualTo("remote planner");
                });
    }

    @Test
    void rebalanceEnabled_registersScheduler() {
        runner.withPropertyValues("skillpilot.budget.rebalance-enabled=true")
                .run(context -> assertThat(context).hasSingleBean(BudgetRebalanceScheduler.class));
    }
}
