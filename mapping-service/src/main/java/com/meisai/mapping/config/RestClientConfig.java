package com.meisai.mapping.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Value("${meisai.ingest.base-url:http://localhost:8081}")
    private String ingestBaseUrl;

    @Value("${meisai.ingest.connect-timeout-ms:2000}")
    private long connectTimeoutMs;

    @Value("${meisai.ingest.read-timeout-ms:5000}")
    private long readTimeoutMs;

    @Bean
    public RestTemplate ingestRestTemplate(RestTemplateBuilder builder) {
        return builder
                .rootUri(ingestBaseUrl)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
