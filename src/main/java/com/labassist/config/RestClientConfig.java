package com.labassist.config;

import lombok.extern.slf4j.Slf4j;
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
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(LabAssistantProperties properties) {
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(properties.getLlm().getTimeout());
            requestFactory.setReadTimeout(properties.getLlm().getTimeout());
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(requestFactory));
        };
    }

    @Bean
    public RestClient llmRestClient(RestClient.Builder restClientBuilder, LabAssistantProperties properties) {
        return restClientBuilder
                .baseUrl(properties.getLlm().getBaseUrl())
                .build();
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.labassist.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (httpLogger.isDebugEnabled()) {
                logRequest(request, body);
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                logResponse(response);
            }
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--- HTTP Request ---");
            httpLogger.debug("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.debug("Headers: {}", redact(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.debug("--------------------");
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.debug("--- HTTP Response ---");
            try {
                httpLogger.debug("Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("Status: Unknown");
            }
            httpLogger.debug("Headers: {}", response.getHeaders());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.debug("---------------------");
        }

        static HttpHeaders redact(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "Bearer ***");
            }
            return copy;
        }
    }
}
