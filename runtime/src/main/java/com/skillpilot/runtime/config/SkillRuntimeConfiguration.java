package com.skillpilot.runtime.config;

import com.skillpilot.runtime.budget.BudgetAllocator;
import com.skillpilot.runtime.skill.FileSystemSkillSource;
import com.skillpilot.runtime.skill.SkillSource;
import com.skillpilot.runtime.lifecycle.SkillLifecycleManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the lifecycle manager and budget allocator as explicitly constructed
 * singletons; callers get them by injection.
 *
 * Applications that keep skills somewhere other than a local directory declare
 * their own {@link SkillSource} bean and the filesystem source backs off.
 */
@Configuration
@EnableConfigurationProperties(SkillRuntimeProperties.class)
public class SkillRuntimeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SkillRuntimeConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(SkillSource.class)
    public SkillSource fileSystemSkillSource(SkillRuntimeProperties properties) {
        Path dir = Path.of(properties.getSkills().getDir());
        log.info("Reading skills from {}", dir.toAbsolutePath());
        return new FileSystemSkillSource(dir);
    }

    @Bean
    public BudgetAllocator budgetAllocator(SkillRuntimeProperties properties,
                                           MeterRegistry meterRegistry,
                                           Clock clock) {
        return new BudgetAllocator(properties.getBudget().getTotalBudget(), meterRegistry, clock);
    }

    @Bean
    public SkillLifecycleManager skillLifecycleManager(SkillSource skillSource,
                                                       BudgetAllocator budgetAllocator,
                                                       SkillRuntimeProperties properties,
                                                       MeterRegistry meterRegistry,
                                                       Clock clock) {
        return new SkillLifecycleManager(skillSource, budgetAllocator,
                properties.getSkills().toLimits(), meterRegistry, clock);
    }
}
