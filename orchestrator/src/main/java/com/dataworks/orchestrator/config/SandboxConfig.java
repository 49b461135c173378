package com.dataworks.orchestrator.config;

import com.dataworks.orchestrator.sandbox.SandboxPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    /**
     * The workspace root is created if missing and canonicalised here, once.
     * Every later containment check compares against this resolved path.
     */
    @Bean
    public SandboxPolicy sandboxPolicy(OrchestratorProperties properties) {
        SandboxPolicy policy = new SandboxPolicy(
                Path.of(properties.getWorkspaceRoot()),
                properties.getCapabilities().getMaxCommandLength());
        log.info("Workspace root: {} (max command length {})",
                policy.workspaceRoot(), policy.maxCommandLength());
        return policy;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
