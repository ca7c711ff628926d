package com.ai.intake.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads the catalog JSON document: {@code {"fallback": {...}, "symptoms": [...]}}.
 */
public class SymptomCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SymptomCatalogLoader.class);

    private final ObjectMapper mapper;

    public SymptomCatalogLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    record CatalogDocument(SymptomEntry fallback, List<SymptomEntry> symptoms) {
    }

    public SymptomCatalog load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            CatalogDocument doc = mapper.readValue(in, CatalogDocument.class);
            List<SymptomEntry> symptoms = doc.symptoms() != null ? doc.symptoms() : List.of();
            SymptomCatalog catalog = new SymptomCatalog(symptoms, doc.fallback());
            log.info("Loaded {} symptoms and {} fallback questions from {}",
                    catalog.size(), catalog.fallback().questions().size(), resource.getDescription());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load symptom catalog from " + resource.getDescription(), e);
        }
    }
}
