package com.ai.intake.config;

import com.ai.intake.catalog.SymptomCatalog;
import com.ai.intake.extraction.FieldExtractor;
import com.ai.intake.extraction.LlmFieldExtractor;
import com.ai.intake.extraction.RuleBasedFieldExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Chooses the field extractor. The model-backed one needs {@code intake.extractor.provider=llm}
 * and an API key; anything else falls back to the rule-based extractor.
 */
@Configuration
public class ExtractorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractorConfig.class);

    @Value("${intake.extractor.provider:llm}")
    private String provider;

    @Value("${intake.extractor.base-url:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${intake.extractor.api-key:}")
    private String apiKey;

    @Value("${intake.extractor.model:llama-3.1-8b-instant}")
    private String model;

    @Value("${intake.extractor.connect-timeout:3s}")
    private Duration connectTimeout;

    @Value("${intake.extractor.read-timeout:7s}")
    private Duration readTimeout;

    @Bean
    public FieldExtractor fieldExtractor(RestTemplateBuilder builder, ObjectMapper objectMapper, SymptomCatalog catalog) {
        if ("llm".equalsIgnoreCase(provider) && StringUtils.isNotBlank(apiKey)) {
            RestTemplate restTemplate = builder
                    .setConnectTimeout(connectTimeout)
                    .setReadTimeout(readTimeout)
                    .build();
            log.info("Using language model extractor: {} at {}", model, baseUrl);
            return new LlmFieldExtractor(restTemplate, objectMapper, baseUrl, apiKey, model);
        }
        if ("llm".equalsIgnoreCase(provider)) {
            log.warn("intake.extractor.api-key is not set, falling back to rule-based extraction");
        }
        return new RuleBasedFieldExtractor(catalog);
    }
}
