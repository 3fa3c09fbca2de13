package com.linlay.taskagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link ChatClient} per configured provider. Providers with incomplete settings are skipped
 * at startup; asking for them later yields an empty result rather than a failure here.
 */
@Component
public class ChatClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChatClientRegistry.class);

    private final Map<String, ChatClient> clients = new LinkedHashMap<>();
    private final AgentProviderProperties properties;

    public ChatClientRegistry(
            AgentProviderProperties properties,
            RestClient.Builder loggingRestClientBuilder,
            WebClient.Builder llmWebClientBuilder
    ) {
        this.properties = properties;
        for (var entry : properties.getProviders().entrySet()) {
            String key = entry.getKey();
            AgentProviderProperties.ProviderConfig config = entry.getValue();
            if (!StringUtils.hasText(key) || config == null) {
                log.warn("Skip invalid provider config entry: key='{}'", key);
                continue;
            }
            try {
                clients.put(key, ChatClient.create(buildChatModel(key, config, loggingRestClientBuilder, llmWebClientBuilder)));
                log.info("Registered ChatClient for provider '{}' model={}", key, config.getModel());
            } catch (IllegalStateException ex) {
                log.warn("Skip provider '{}': {}", key, ex.getMessage());
            }
        }
    }

    public Optional<ChatClient> find(String providerKey) {
        return Optional.ofNullable(providerKey).map(clients::get);
    }

    public Optional<String> defaultModel(String providerKey) {
        return Optional.ofNullable(properties.getProvider(providerKey))
                .map(AgentProviderProperties.ProviderConfig::getModel)
                .filter(StringUtils::hasText);
    }

    private OpenAiChatModel buildChatModel(
            String providerKey,
            AgentProviderProperties.ProviderConfig config,
            RestClient.Builder restClientBuilder,
            WebClient.Builder webClientBuilder
    ) {
        requireText(config.getBaseUrl(), "base-url", providerKey);
        requireText(config.getApiKey(), "api-key", providerKey);
        requireText(config.getModel(), "model", providerKey);

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(config.getBaseUrl())
                .apiKey(config.getApiKey())
                .restClientBuilder(restClientBuilder)
                .webClientBuilder(webClientBuilder)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(config.getModel()).build())
                .build();
    }

    private void requireText(String value, String property, String providerKey) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalStateException("Missing " + property + " for provider '" + providerKey + "'");
        }
    }
}
