package com.ai.intake.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class NotificationConfig {

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder,
                                                 @Value("${telegram.timeout:10s}") Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
