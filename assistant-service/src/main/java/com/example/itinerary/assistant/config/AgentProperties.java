package com.example.itinerary.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the editing agent and for itinerary generation, which share pricing.
 */
@Component
@ConfigurationProperties(prefix = "assistant.agent")
public class AgentProperties {
    private int maxContextTokens = 30000;
    private double temperature = 0.3;
    private int maxTokens = 2000;
    private int summaryMaxTokens = 500;
    private double generationTemperature = 0.7;
    private int generationMaxTokens = 16000;
    private int maxDescriptionLength = 2000;
    private double inputPricePerMillion = 0.15;
    private double outputPricePerMillion = 0.60;

    public int getMaxContextTokens() { return maxContextTokens; }
    public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public int getSummaryMaxTokens() { return summaryMaxTokens; }
    public void setSummaryMaxTokens(int summaryMaxTokens) { this.summaryMaxTokens = summaryMaxTokens; }

    public double getGenerationTemperature() { return generationTemperature; }
    public void setGenerationTemperature(double generationTemperature) { this.generationTemperature = generationTemperature; }

    public int getGenerationMaxTokens() { return generationMaxTokens; }
    public void setGenerationMaxTokens(int generationMaxTokens) { this.generationMaxTokens = generationMaxTokens; }

    public int getMaxDescriptionLength() { return maxDescriptionLength; }
    public void setMaxDescriptionLength(int maxDescriptionLength) { this.maxDescriptionLength = maxDescriptionLength; }

    public double getInputPricePerMillion() { return inputPricePerMillion; }
    public void setInputPricePerMillion(double inputPricePerMillion) { this.inputPricePerMillion = inputPricePerMillion; }

    public double getOutputPricePerMillion() { return outputPricePerMillion; }
    public void setOutputPricePerMillion(double outputPricePerMillion) { this.outputPricePerMillion = outputPricePerMillion; }
}
