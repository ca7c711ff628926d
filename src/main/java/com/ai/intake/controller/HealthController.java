package com.ai.intake.controller;

import com.ai.intake.catalog.SymptomCatalog;
import com.ai.intake.extraction.ExtractionFailureReporter;
import com.ai.intake.extraction.ExtractionGateway;
import com.ai.intake.repository.PatientIntakeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final SymptomCatalog catalog;
    private final ExtractionGateway extraction;
    private final ExtractionFailureReporter failures;
    private final PatientIntakeRepository intakes;

    public HealthController(SymptomCatalog catalog, ExtractionGateway extraction,
                            ExtractionFailureReporter failures, PatientIntakeRepository intakes) {
        this.catalog = catalog;
        this.extraction = extraction;
        this.failures = failures;
        this.intakes = intakes;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "patient-intake");
        body.put("catalogSymptoms", catalog.size());
        body.put("extractor", extraction.extractorName());
        body.put("extractionFailures", failures.failureCounts());
        try {
            body.put("completedIntakes", intakes.count());
            Map<String, Long> bySymptom = new LinkedHashMap<>();
            List<Object[]> rows = intakes.countBySymptom();
            for (Object[] row : rows) {
                bySymptom.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
            }
            body.put("symptomStats", bySymptom);
        } catch (DataAccessException e) {
            log.warn("Health check could not read intake statistics", e);
            body.put("status", "degraded");
        }
        return body;
    }
}
