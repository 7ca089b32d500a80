package com.budgetpacing.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/** HTTP client for the external collaborators. Each call carries its own timeout. */
@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final PacingProperties properties;

    @Bean
    public RestTemplate collaboratorRestTemplate(RestTemplateBuilder builder) {
        return builder.setConnectTimeout(properties.getCommit().getCallTimeout())
                .setReadTimeout(properties.getCommit().getCallTimeout())
                .build();
    }
}
