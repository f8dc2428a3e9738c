package com.example.itinerary.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for single-question answering.
 */
@Component
@ConfigurationProperties(prefix = "assistant.query")
public class QueryProperties {
    private int maxContextTokens = 15000;
    private double temperature = 0.1;
    private int maxTokens = 500;
    private double inputPricePerMillion = 1.0;
    private double outputPricePerMillion = 3.0;
    private Duration cacheTtl = Duration.ofHours(24);

    public int getMaxContextTokens() { return maxContextTokens; }
    public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public double getInputPricePerMillion() { return inputPricePerMillion; }
    public void setInputPricePerMillion(double inputPricePerMillion) { this.inputPricePerMillion = inputPricePerMillion; }

    public double getOutputPricePerMillion() { return outputPricePerMillion; }
    public void setOutputPricePerMillion(double outputPricePerMillion) { this.outputPricePerMillion = outputPricePerMillion; }

    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
}
