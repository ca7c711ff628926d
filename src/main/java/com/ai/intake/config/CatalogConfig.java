package com.ai.intake.config;

import com.ai.intake.catalog.SymptomCatalog;
import com.ai.intake.catalog.SymptomCatalogLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

@Configuration
public class CatalogConfig {

    @Bean
    public SymptomCatalog symptomCatalog(ObjectMapper objectMapper,
                                         @Value("${intake.catalog.location:classpath:catalog/symptoms.json}") Resource location) {
        return new SymptomCatalogLoader(objectMapper).load(location);
    }
}
