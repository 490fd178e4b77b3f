package com.duelo.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Applies provider timeouts to every {@code RestClient} built by Spring AI and, when enabled,
 * logs provider traffic on the {@code com.duelo.http.logging} logger.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(AgentEngineProperties properties) {
        AgentEngineProperties.ProviderConfig provider = properties.getProvider();
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(provider.getConnectTimeout());
            requestFactory.setReadTimeout(provider.getReadTimeout());
            restClientBuilder.requestInterceptor(new ProviderRequestInterceptor(provider.isHttpLogging()));
            if (provider.isHttpLogging()) {
                // response body is read twice when logging
                restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(requestFactory));
            } else {
                restClientBuilder.requestFactory(requestFactory);
            }
        };
    }

    static class ProviderRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.duelo.http.logging");

        private final boolean logTraffic;

        ProviderRequestInterceptor(boolean logTraffic) {
            this.logTraffic = logTraffic;
        }

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // Placeholder keys mean "no key": send no bearer token at all
            HttpHeaders headers = request.getHeaders();
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.remove(HttpHeaders.AUTHORIZATION);
                }
            }
            if (!logTraffic) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.info("--- Provider Request ---");
            httpLogger.info("URI: {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.info("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.info("--- Provider Response ---");
            try {
                httpLogger.info("Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.info("Status: Unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.info("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
    }
}
