package com.linlay.taskagent.config;

import com.linlay.taskagent.gateway.LlmLogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * HTTP clients handed to Spring AI. Chat turns call the model synchronously, so the request and
 * response bodies are logged by the {@link RestClient} interceptor; the {@link WebClient} builder
 * is only required by the OpenAI API builder.
 */
@Configuration
public class SpringAiConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SpringAiConfiguration.class);

    @Bean
    public RestClient.Builder loggingRestClientBuilder(LlmInteractionLogProperties logProperties) {
        RestClient.Builder builder = RestClient.builder();
        if (!logProperties.isEnabled()) {
            return builder;
        }
        return builder.requestInterceptor((request, body, execution) ->
                exchangeWithLogging(request, body, execution, logProperties));
    }

    @Bean
    public WebClient.Builder llmWebClientBuilder() {
        return WebClient.builder();
    }

    private ClientHttpResponse exchangeWithLogging(
            HttpRequest request,
            byte[] body,
            ClientHttpRequestExecution execution,
            LlmInteractionLogProperties logProperties
    ) throws IOException {
        boolean mask = logProperties.isMaskSensitive();
        int limit = logProperties.getMaxBodyChars();
        long startedAt = System.currentTimeMillis();
        log.info("[llm-http][request] {} {} headers={}",
                request.getMethod(), request.getURI(), LlmLogSanitizer.maskHeaders(request.getHeaders(), mask));
        log.info("[llm-http][request-body]\n{}",
                LlmLogSanitizer.abbreviate(LlmLogSanitizer.maskText(new String(body, StandardCharsets.UTF_8), mask), limit));

        ClientHttpResponse response = execution.execute(request, body);
        byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());

        log.info("[llm-http][response] status={} costMs={}",
                response.getStatusCode().value(), System.currentTimeMillis() - startedAt);
        log.info("[llm-http][response-body]\n{}",
                LlmLogSanitizer.abbreviate(LlmLogSanitizer.maskText(new String(responseBody, StandardCharsets.UTF_8), mask), limit));
        return new BufferedClientHttpResponse(response, responseBody);
    }

    private static final class BufferedClientHttpResponse implements ClientHttpResponse {

        private final ClientHttpResponse delegate;
        private final byte[] body;

        private BufferedClientHttpResponse(ClientHttpResponse delegate, byte[] body) {
            this.delegate = delegate;
            this.body = body;
        }

        @Override
        public HttpStatusCode getStatusCode() throws IOException {
            return delegate.getStatusCode();
        }

        @Override
        public String getStatusText() throws IOException {
            return delegate.getStatusText();
        }

        @Override
        public HttpHeaders getHeaders() {
            return delegate.getHeaders();
        }

        @Override
        public InputStream getBody() {
            return new ByteArrayInputStream(body);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
