package com.example.itinerary.assistant.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat models per use. Sampling settings are fixed at build time, so each call profile gets
 * its own bean. {@code assistant.llm.provider} selects Ollama (default) or an OpenAI-compatible API.
 */
@Configuration
public class LlmModelConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmModelConfig.class);

    private final AssistantLlmProperties llm;
    private final AssistantOllamaProperties ollama;
    private final AssistantOpenAiProperties openAi;

    public LlmModelConfig(AssistantLlmProperties llm, AssistantOllamaProperties ollama, AssistantOpenAiProperties openAi) {
        this.llm = llm;
        this.ollama = ollama;
        this.openAi = openAi;
    }

    @Bean
    public ChatLanguageModel queryChatModel(QueryProperties props) {
        return chatModel(props.getTemperature(), props.getMaxTokens(), false);
    }

    @Bean
    public ChatLanguageModel agentChatModel(AgentProperties props) {
        return chatModel(props.getTemperature(), props.getMaxTokens(), false);
    }

    @Bean
    public ChatLanguageModel agentSummaryChatModel(AgentProperties props) {
        return chatModel(props.getTemperature(), props.getSummaryMaxTokens(), false);
    }

    @Bean
    public ChatLanguageModel generationChatModel(AgentProperties props) {
        return chatModel(props.getGenerationTemperature(), props.getGenerationMaxTokens(), true);
    }

    @Bean
    public StreamingChatLanguageModel generationStreamingModel(AgentProperties props) {
        if (useOpenAi()) {
            return OpenAiStreamingChatModel.builder()
                    .apiKey(openAi.getApiKey())
                    .baseUrl(openAi.getBaseUrl())
                    .modelName(openAi.getModel())
                    .temperature(props.getGenerationTemperature())
                    .maxTokens(props.getGenerationMaxTokens())
                    .responseFormat("json_object")
                    .timeout(Duration.ofMillis(openAi.getRequestTimeoutMs()))
                    .build();
        }
        return OllamaStreamingChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getModel())
                .temperature(props.getGenerationTemperature())
                .numPredict(props.getGenerationMaxTokens())
                .numCtx(ollama.getNumCtx())
                .format("json")
                .timeout(Duration.ofMillis(ollama.getRequestTimeoutMs()))
                .logRequests(ollama.isLogRequests())
                .build();
    }

    private ChatLanguageModel chatModel(double temperature, int maxTokens, boolean json) {
        if (useOpenAi()) {
            log.info("[LlmModelConfig] OpenAI model {} (temperature={}, maxTokens={})", openAi.getModel(), temperature, maxTokens);
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(openAi.getApiKey())
                    .baseUrl(openAi.getBaseUrl())
                    .modelName(openAi.getModel())
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(Duration.ofMillis(openAi.getRequestTimeoutMs()));
            if (json) builder.responseFormat("json_object");
            return builder.build();
        }
        log.info("[LlmModelConfig] Ollama model {} at {} (temperature={}, numPredict={})",
                ollama.getModel(), ollama.getBaseUrl(), temperature, maxTokens);
        OllamaChatModel.OllamaChatModelBuilder builder = OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getModel())
                .temperature(temperature)
                .numPredict(maxTokens)
                .numCtx(ollama.getNumCtx())
                .timeout(Duration.ofMillis(ollama.getRequestTimeoutMs()))
                .logRequests(ollama.isLogRequests());
        if (json) builder.format("json");
        return builder.build();
    }

    private boolean useOpenAi() {
        return "openai".equalsIgnoreCase(llm.getProvider());
    }
}
