package com.taskpilot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Value("${app.model-api.url}")
    private String modelApiUrl;

    @Value("${app.model-api.key:}")
    private String modelApiKey;

    @Bean
    public WebClient modelApiClient() {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(modelApiUrl)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(10 * 1024 * 1024)); // 10MB
        if (StringUtils.hasText(modelApiKey)) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + modelApiKey);
        }
        return builder.build();
    }
}
