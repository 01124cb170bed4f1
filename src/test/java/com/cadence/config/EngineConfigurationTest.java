package com.cadence.config;

import com.cadence.engine.BehavioralAuthEngine;
import com.cadence.engine.DecisionListener;
import com.cadence.engine.EngineMetrics;
import com.cadence.engine.LoggingDecisionListener;
import com.cadence.engine.SessionRegistry;
import com.cadence.storage.InMemoryProfileStore;
import com.cadence.storage.ProfileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.FilterType;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Engine wiring Tests")
class EngineConfigurationTest {

    @Configuration
    @ComponentScan(basePackageClasses = EngineMetrics.class,
        useDefaultFilters = false,
        includeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE,
            classes = {EngineMetrics.class, SessionRegistry.class, LoggingDecisionListener.class}))
    static class ScannedEngineComponents {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withInitializer(context -> context.getBeanFactory()
            .setConversionService(ApplicationConversionService.getSharedInstance()))
        .withUserConfiguration(ScannedEngineComponents.class, StorageConfiguration.class,
            EngineConfiguration.class);

    @Test
    @DisplayName("Should assemble the engine from scanned components and configured beans")
    void shouldWireEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(BehavioralAuthEngine.class);
            assertThat(context).hasSingleBean(EngineMetrics.class);
            assertThat(context).hasSingleBean(SessionRegistry.class);
            assertThat(context).getBeans(DecisionListener.class)
                .hasSize(1)
                .allSatisfy((name, listener) -> assertThat(listener).isInstanceOf(LoggingDecisionListener.class));
            assertThat(context.getBean(ProfileStore.class)).isInstanceOf(InMemoryProfileStore.class);
        });
    }

    @Test
    @DisplayName("Should bind engine settings from cadence.engine properties")
    void shouldBindProperties() {
        contextRunner
            .withPropertyValues(
                "cadence.engine.confidence-threshold=0.6",
                "cadence.engine.window.size=15s")
            .run(context -> {
                EngineConfig config = context.getBean(EngineConfig.class);
                assertThat(config.getConfidenceThreshold()).isEqualTo(0.6);
                assertThat(config.getWindowSize()).isEqualTo(Duration.ofSeconds(15));
            });
    }
}
