package com.ai.intake.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(IntakePolicyProperties.class)
public class IntakeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
