package com.bko.ensemble.config;

import com.bko.ensemble.orchestration.ModeConstants;
import com.bko.ensemble.orchestration.model.HistoryMode;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ensemble")
public class EnsembleProperties {

    private int workerConcurrency = 8;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private HistoryMode historyMode = HistoryMode.ALL;
    private OpenAIConfig openai = new OpenAIConfig();
    private Modes modes = new Modes();
    private StreamConfig stream = new StreamConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    /**
     * Resolved into {@code spring.ai.openai.*} by application.yml; keys come from the environment there.
     */
    public static class OpenAIConfig {
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o-mini";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class StreamConfig {
        private String path = "/ws/stream";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }

    /**
     * Defaults used when a request's mode config leaves a value unset.
     */
    public static class Modes {
        private int debateRounds = 3;
        private int councilRounds = 2;
        private int maxConsensusRounds = 5;
        private double consensusThreshold = 0.8;
        private int voteMaxTokens = 150;
        private int routerMaxTokens = 100;
        private List<String> audienceLevels = new ArrayList<>(ModeConstants.DEFAULT_AUDIENCE_LEVELS);

        public int getDebateRounds() { return debateRounds; }
        public void setDebateRounds(int debateRounds) { this.debateRounds = debateRounds; }
        public int getCouncilRounds() { return councilRounds; }
        public void setCouncilRounds(int councilRounds) { this.councilRounds = councilRounds; }
        public int getMaxConsensusRounds() { return maxConsensusRounds; }
        public void setMaxConsensusRounds(int maxConsensusRounds) { this.maxConsensusRounds = maxConsensusRounds; }
        public double getConsensusThreshold() { return consensusThreshold; }
        public void setConsensusThreshold(double consensusThreshold) { this.consensusThreshold = consensusThreshold; }
        public int getVoteMaxTokens() { return voteMaxTokens; }
        public void setVoteMaxTokens(int voteMaxTokens) { this.voteMaxTokens = voteMaxTokens; }
        public int getRouterMaxTokens() { return routerMaxTokens; }
        public void setRouterMaxTokens(int routerMaxTokens) { this.routerMaxTokens = routerMaxTokens; }
        public List<String> getAudienceLevels() { return audienceLevels; }
        public void setAudienceLevels(List<String> audienceLevels) { this.audienceLevels = audienceLevels; }
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public HistoryMode getHistoryMode() {
        return historyMode;
    }

    public void setHistoryMode(HistoryMode historyMode) {
        this.historyMode = historyMode;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public Modes getModes() {
        return modes;
    }

    public void setModes(Modes modes) {
        this.modes = modes;
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream;
    }
}
