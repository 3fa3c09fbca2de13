package com.linlay.taskagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-turn settings of the task chat: which provider answers, how many model rounds a turn may
 * take, and how long a turn may wait for or hold its conversation.
 */
@ConfigurationProperties(prefix = "agent.chat")
public class TaskChatProperties {

    private String providerKey = "openai";
    private String model;
    private Double temperature = 0.2;
    private int maxRounds = 8;
    private long lockTimeoutMs = 5_000L;
    private long turnTimeoutMs = 120_000L;
    private int maxMessageLength = 4_000;
    private String systemPrompt;

    public String getProviderKey() {
        return providerKey;
    }

    public void setProviderKey(String providerKey) {
        this.providerKey = providerKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public void setMaxRounds(int maxRounds) {
        this.maxRounds = maxRounds > 0 ? maxRounds : 8;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public long getTurnTimeoutMs() {
        return turnTimeoutMs;
    }

    public void setTurnTimeoutMs(long turnTimeoutMs) {
        this.turnTimeoutMs = turnTimeoutMs;
    }

    public int getMaxMessageLength() {
        return maxMessageLength;
    }

    public void setMaxMessageLength(int maxMessageLength) {
        this.maxMessageLength = maxMessageLength;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
