package com.dataworks.orchestrator.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorPropertiesTest {

    @Test
    void defaults() {
        OrchestratorProperties p = new OrchestratorProperties();

        assertThat(p.getWorkspaceRoot()).isEqualTo("/data");
        assertThat(p.getWorkers()).isEqualTo(4);
        assertThat(p.getLoop().getIterationCap()).isEqualTo(20);
        assertThat(p.getLoop().getDeadline()).isEqualTo(Duration.ofMinutes(10));
        assertThat(p.getLoop().getWindowSize()).isEqualTo(20);
        assertThat(p.getLoop().getDecisionRetries()).isEqualTo(3);
        assertThat(p.getCapabilities().getNetworkTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(p.getCapabilities().getProcessTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(p.getCapabilities().getMaxCommandLength()).isEqualTo(4096);
        assertThat(p.getLlm().getModel()).isEqualTo("gpt-4o-mini");
        assertThat(p.getLlm().getTemperature()).isZero();
        assertThat(p.getLlm().hasApiKey()).isFalse();
    }

    @Test
    void binds_kebabCaseAndDurations() {
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
                "dataworks.workspace-root", "/srv/ws",
                "dataworks.loop.iteration-cap", "7",
                "dataworks.loop.deadline", "90s",
                "dataworks.capabilities.timeouts[run_command]", "2m",
                "dataworks.llm.api-key", "abc")));

        OrchestratorProperties p = binder.bind("dataworks", OrchestratorProperties.class).get();

        assertThat(p.getWorkspaceRoot()).isEqualTo("/srv/ws");
        assertThat(p.getLoop().getIterationCap()).isEqualTo(7);
        assertThat(p.getLoop().getDeadline()).isEqualTo(Duration.ofSeconds(90));
        assertThat(p.getCapabilities().getTimeouts()).containsEntry("run_command", Duration.ofMinutes(2));
        assertThat(p.getLlm().hasApiKey()).isTrue();
    }
}
