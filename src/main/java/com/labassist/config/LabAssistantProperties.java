package com.labassist.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "labassist")
public class LabAssistantProperties {

    private LlmConfig llm = new LlmConfig();
    private DocsConfig docs = new DocsConfig();
    private WorkerConfig worker = new WorkerConfig();
    private IncidentsConfig incidents = new IncidentsConfig();

    public static class LlmConfig {
        private boolean useLlm = false;
        private String apiKey;
        private String model = "gpt-4";
        private String baseUrl = "https://api.openai.com/v1";
        private Duration timeout = Duration.ofSeconds(30);
        private double temperature = 0.3;

        public boolean isUseLlm() { return useLlm; }
        public void setUseLlm(boolean useLlm) { this.useLlm = useLlm; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }

    public static class DocsConfig {
        private String path = "docs";
        private int maxResults = 5;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
    }

    public static class WorkerConfig {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 10;
        private boolean reaperEnabled = false;
        private Duration staleAfter = Duration.ofMinutes(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public boolean isReaperEnabled() { return reaperEnabled; }
        public void setReaperEnabled(boolean reaperEnabled) { this.reaperEnabled = reaperEnabled; }
        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
    }

    public static class IncidentsConfig {
        private boolean seedOnStartup = true;
        private String seedLocation = "classpath:seed/incidents.json";

        public boolean isSeedOnStartup() { return seedOnStartup; }
        public void setSeedOnStartup(boolean seedOnStartup) { this.seedOnStartup = seedOnStartup; }
        public String getSeedLocation() { return seedLocation; }
        public void setSeedLocation(String seedLocation) { this.seedLocation = seedLocation; }
    }

    public LlmConfig getLlm() {
        return llm;
    }

    public void setLlm(LlmConfig llm) {
        this.llm = llm != null ? llm : new LlmConfig();
    }

    public DocsConfig getDocs() {
        return docs;
    }

    public void setDocs(DocsConfig docs) {
        this.docs = docs != null ? docs : new DocsConfig();
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }

    public IncidentsConfig getIncidents() {
        return incidents;
    }

    public void setIncidents(IncidentsConfig incidents) {
        this.incidents = incidents != null ? incidents : new IncidentsConfig();
    }
}
