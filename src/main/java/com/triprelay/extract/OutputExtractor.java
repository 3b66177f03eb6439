package com.triprelay.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON value out of free-form reasoning output.
 * Tolerates surrounding commentary, ``` and ~~~ fences (with or without a
 * language tag) and truncated fences. Returns a complete value or fails.
 */
@Slf4j
@Component
public class OutputExtractor {

    private static final Pattern OPENING_FENCE = Pattern.compile("(```|~~~)[ \\t]*[A-Za-z0-9_+-]*[ \\t]*\\r?\\n?");
    private static final int SNIPPET_LENGTH = 100;

    private final ObjectMapper strictMapper;

    public OutputExtractor() {
        this.strictMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Extract the JSON value carried by a reasoning response
     *
     * @throws ExtractionException if no strategy yields valid JSON
     */
    public JsonNode extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new ExtractionException("Empty reasoning response");
        }
        String text = rawText.strip();

        // 1. Direct parse
        Optional<JsonNode> direct = tryParse(text);
        if (direct.isPresent()) {
            return direct.get();
        }

        // 2. Fenced block, only when both fences are present
        String fenced = stripFences(text);
        if (fenced != null) {
            Optional<JsonNode> inFence = tryParse(fenced);
            if (inFence.isPresent()) {
                return inFence.get();
            }
            Optional<JsonNode> bracedInFence = tryBraces(fenced);
            if (bracedInFence.isPresent()) {
                return bracedInFence.get();
            }
        }

        // 3. First '{' to last '}'
        Optional<JsonNode> braced = tryBraces(text);
        if (braced.isPresent()) {
            return braced.get();
        }

        log.error("Could not extract JSON from reasoning response (length: {})", rawText.length());
        log.error("Response snippet (truncated to {} chars): {}", SNIPPET_LENGTH,
                rawText.substring(0, Math.min(SNIPPET_LENGTH, rawText.length())));
        throw new ExtractionException("Could not extract valid JSON from reasoning response");
    }

    /**
     * Content between the first opening fence and its matching closing fence,
     * or null when there is no complete fence pair
     */
    static String stripFences(String text) {
        Matcher opening = OPENING_FENCE.matcher(text);
        if (!opening.find()) {
            return null;
        }
        String marker = opening.group(1);
        int closing = text.indexOf(marker, opening.end());
        if (closing < 0) {
            return null;
        }
        return text.substring(opening.end(), closing).strip();
    }

    private Optional<JsonNode> tryBraces(String text) {
        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        if (first < 0 || last <= first) {
            return Optional.empty();
        }
        return tryParse(text.substring(first, last + 1));
    }

    private Optional<JsonNode> tryParse(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = strictMapper.readTree(candidate);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.debug("JSON parse attempt failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
