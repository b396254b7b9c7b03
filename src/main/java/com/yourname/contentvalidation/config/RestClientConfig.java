package com.yourname.contentvalidation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared RestClient for both LLM providers. Socket timeouts here are a backstop; the per-call
 * deadline is enforced by the provider adapter.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient llmRestClient(
        @Value("${http.client.connect-timeout-ms:5000}") int connectTimeoutMs,
        @Value("${http.client.read-timeout-ms:30000}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);

        return RestClient.builder()
            .requestFactory(factory)
            .build();
    }
}
