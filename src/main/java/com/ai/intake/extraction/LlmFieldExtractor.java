package com.ai.intake.extraction;

import com.ai.intake.conversation.IntakeField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts intake fields through an OpenAI-compatible chat completions endpoint
 * (Groq by default). The model is asked for JSON only; anything else is treated
 * as a malformed answer.
 */
public class LlmFieldExtractor implements FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmFieldExtractor.class);

    /** Confidence assigned to a value the model returned without a score. */
    private static final double DEFAULT_CONFIDENCE = 0.8;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public LlmFieldExtractor(RestTemplate restTemplate, ObjectMapper mapper, String baseUrl, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public String name() {
        return "llm:" + model;
    }

    @Override
    public ExtractedFields extract(String text, Set<IntakeField> missingFields) {
        if (StringUtils.isBlank(apiKey)) {
            throw new ExtractionException(ExtractionException.Kind.UNAVAILABLE, "Extractor API key is not set");
        }
        if (StringUtils.isBlank(text)) return ExtractedFields.empty();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0.1);
        body.put("max_tokens", 150);
        body.put("messages", List.of(Map.of("role", "user", "content", buildPrompt(text, missingFields))));

        String content;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(baseUrl + "/chat/completions",
                    new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            content = root.path("choices").path(0).path("message").path("content").asText("");
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ExtractionException(ExtractionException.Kind.TIMEOUT, "Extractor call timed out", e);
            }
            throw new ExtractionException(ExtractionException.Kind.UNAVAILABLE, "Extractor endpoint unreachable", e);
        } catch (RestClientException e) {
            throw new ExtractionException(ExtractionException.Kind.UNAVAILABLE, "Extractor call failed", e);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "Provider envelope is not JSON", e);
        }
        return parseFields(content);
    }

    String buildPrompt(String text, Set<IntakeField> missingFields) {
        String missing = missingFields.isEmpty()
                ? "none"
                : missingFields.stream().map(IntakeField::key).collect(Collectors.joining(", "));
        return "Extract patient information from: \"" + text.replace("\"", "'") + "\"\n\n"
                + "Fields still missing: " + missing + "\n"
                + "Return JSON only, with any of these keys you can fill from the message:\n"
                + "{\"name\": \"full name\", \"email\": \"address\", \"age\": 25, \"gender\": \"Male|Female|Other\", "
                + "\"symptom\": \"main complaint in a few words\", "
                + "\"confidence\": {\"name\": 0.9}}\n"
                + "Leave out any key you cannot determine. Never guess or use placeholders.\n"
                + "If nothing can be extracted, return {}.\n\nJSON:";
    }

    ExtractedFields parseFields(String content) {
        int start = content == null ? -1 : content.indexOf('{');
        int end = content == null ? -1 : content.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "No JSON object in model output");
        }
        JsonNode json;
        try {
            json = mapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "Model output is not valid JSON", e);
        }
        if (!json.isObject()) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "Model output is not a JSON object");
        }

        JsonNode scores = json.path("confidence");
        ExtractedFields.Builder out = ExtractedFields.builder();
        for (IntakeField field : IntakeField.values()) {
            JsonNode node = json.get(field.key());
            if (node == null || node.isNull() || node.isContainerNode()) continue;
            String value = node.asText("");
            if (StringUtils.isBlank(value) || isPlaceholder(value)) continue;
            double confidence = scores.path(field.key()).isNumber()
                    ? Math.max(0.0, Math.min(1.0, scores.path(field.key()).asDouble()))
                    : DEFAULT_CONFIDENCE;
            out.put(field, value, confidence);
        }
        ExtractedFields fields = out.build();
        log.debug("Model extracted fields={}", fields.fields());
        return fields;
    }

    private static boolean isPlaceholder(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("missing") || v.equals("unknown") || v.equals("n/a") || v.equals("none")
                || v.equals("not provided") || v.startsWith("extracted_");
    }
}
