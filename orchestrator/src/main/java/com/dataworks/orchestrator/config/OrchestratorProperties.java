package com.dataworks.orchestrator.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide settings bound from {@code dataworks.*} (application.yml + env).
 *
 * Everything here is read once at startup and never changes for the lifetime
 * of the process.
 */
@Validated
@ConfigurationProperties(prefix = "dataworks")
public class OrchestratorProperties {

    /** Directory every filesystem-class capability is confined to. */
    @NotBlank
    private String workspaceRoot = "/data";

    /** Maximum number of tasks running at the same time. */
    @Min(1)
    private int workers = 4;

    private Loop loop = new Loop();
    private Capabilities capabilities = new Capabilities();
    private Llm llm = new Llm();

    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Capabilities getCapabilities() { return capabilities; }
    public void setCapabilities(Capabilities capabilities) { this.capabilities = capabilities; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }

    public static class Loop {
        @Min(1)
        private int iterationCap = 20;
        private Duration deadline = Duration.ofMinutes(10);
        @Min(1)
        private int windowSize = 20;
        @Min(0)
        private int decisionRetries = 3;

        public int getIterationCap() { return iterationCap; }
        public void setIterationCap(int iterationCap) { this.iterationCap = iterationCap; }
        public Duration getDeadline() { return deadline; }
        public void setDeadline(Duration deadline) { this.deadline = deadline; }
        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
        public int getDecisionRetries() { return decisionRetries; }
        public void setDecisionRetries(int decisionRetries) { this.decisionRetries = decisionRetries; }
    }

    public static class Capabilities {
        private Duration networkTimeout = Duration.ofSeconds(30);
        private Duration processTimeout = Duration.ofSeconds(300);
        private Duration defaultTimeout = Duration.ofSeconds(30);
        /** Per-capability overrides keyed by capability name, e.g. {@code run_command: 60s}. */
        private Map<String, Duration> timeouts = new HashMap<>();
        @Min(1)
        private int maxCommandLength = 4096;
        @Min(100)
        private int maxOutputChars = 20_000;

        public Duration getNetworkTimeout() { return networkTimeout; }
        public void setNetworkTimeout(Duration networkTimeout) { this.networkTimeout = networkTimeout; }
        public Duration getProcessTimeout() { return processTimeout; }
        public void setProcessTimeout(Duration processTimeout) { this.processTimeout = processTimeout; }
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public Map<String, Duration> getTimeouts() { return timeouts; }
        public void setTimeouts(Map<String, Duration> timeouts) { this.timeouts = timeouts; }
        public int getMaxCommandLength() { return maxCommandLength; }
        public void setMaxCommandLength(int maxCommandLength) { this.maxCommandLength = maxCommandLength; }
        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    }

    public static class Llm {
        private String baseUrl = "http://aiproxy.sanand.workers.dev/openai/v1/";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private double temperature = 0.0;
        private Duration requestTimeout = Duration.ofSeconds(60);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
