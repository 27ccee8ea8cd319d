package com.bko.ensemble.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON value out of free-form model output: a fenced block, the bare text, or the outermost
 * object/array embedded in prose, in that order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)\\n?```");

    private final ObjectMapper objectMapper;

    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        return parse(label, raw, objectMapper.constructType(type));
    }

    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, TypeReference<T> type) {
        return parse(label, raw, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> @Nullable T parse(String label, @Nullable String raw, JavaType type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        for (String candidate : candidates(raw)) {
            if (candidate == null) {
                continue;
            }
            try {
                return objectMapper.readValue(candidate, type);
            } catch (JsonProcessingException ex) {
                log.debug("Candidate for {} is not valid JSON: {}", label, ex.getOriginalMessage());
            }
        }
        log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
        return null;
    }

    private String[] candidates(String raw) {
        String trimmed = raw.trim();
        String fenced = null;
        Matcher matcher = FENCED_BLOCK.matcher(trimmed);
        if (matcher.find()) {
            fenced = matcher.group(1).trim();
        }
        String bare = trimmed.startsWith("{") || trimmed.startsWith("[") ? trimmed : null;
        return new String[] {fenced, bare, embedded(trimmed, '{', '}'), embedded(trimmed, '[', ']')};
    }

    @Nullable
    private String embedded(String text, char open, char close) {
        int first = text.indexOf(open);
        int last = text.lastIndexOf(close);
        if (first >= 0 && last > first) {
            return text.substring(first, last + 1);
        }
        return null;
    }

    String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {}: {}", value.getClass().getSimpleName(), ex.getOriginalMessage());
            return "{}";
        }
    }
}
