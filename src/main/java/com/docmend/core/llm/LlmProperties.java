package com.docmend.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "docmend.llm")
public class LlmProperties {

    private boolean enabled = false;
    private int timeoutSeconds = 30;
    private int maxTokens = 1000;
    private double temperature = 0.3;
    private int maxConcurrentCalls = 4;
    private int contextSections = 5;
    private int maxOutlineChars = 4000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public int getContextSections() {
        return contextSections;
    }

    public void setContextSections(int contextSections) {
        this.contextSections = contextSections;
    }

    public int getMaxOutlineChars() {
        return maxOutlineChars;
    }

    public void setMaxOutlineChars(int maxOutlineChars) {
        this.maxOutlineChars = maxOutlineChars;
    }
}
