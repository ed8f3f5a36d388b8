package com.eainde.policylens.gateway;

import com.eainde.policylens.model.RiskLevel;
import com.eainde.policylens.model.Verdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Validates raw model output into a {@link ReasoningResult}.
 *
 * <p>Every field is checked on its own. A missing or out-of-range field is replaced by a
 * conservative default and the result is tagged {@code COERCED}; output that is not a JSON
 * object at all becomes a NEEDS_REVIEW / MEDIUM / 0.5 result. The raw text is always kept.</p>
 */
@Slf4j
public class ReasoningResponseParser {

    static final double DEFAULT_RISK_SCORE = 0.5;
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final String UNPARSABLE_REASONING =
            "Reasoning output could not be interpreted; manual review required.";

    private final ObjectMapper objectMapper;

    public ReasoningResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReasoningResult parseEvaluation(String rawText) {
        Optional<JsonNode> root = readObject(rawText);
        if (root.isEmpty()) {
            log.warn("Reasoning output is not a JSON object; coercing to NEEDS_REVIEW");
            return new ReasoningResult(ReasoningResult.Kind.COERCED, Verdict.NEEDS_REVIEW, RiskLevel.MEDIUM,
                    DEFAULT_RISK_SCORE, DEFAULT_CONFIDENCE, UNPARSABLE_REASONING, rawText);
        }
        JsonNode node = root.get();
        boolean coerced = false;

        Optional<Verdict> verdict = Verdict.parse(node.path("verdict").asText(null));
        if (verdict.isEmpty()) coerced = true;

        Optional<RiskLevel> level = RiskLevel.parse(node.path("risk_level").asText(null));
        if (level.isEmpty()) coerced = true;

        Double score = unitInterval(node.path("risk_score"));
        if (score == null) coerced = true;

        Double confidence = unitInterval(node.path("confidence"));
        if (confidence == null) coerced = true;

        String reasoning = node.path("reasoning").asText("");
        if (reasoning.isBlank()) {
            coerced = true;
            reasoning = verdict.isPresent() ? "No reasoning provided by model." : UNPARSABLE_REASONING;
        }

        Verdict finalVerdict = verdict.orElse(Verdict.NEEDS_REVIEW);
        if (coerced) {
            log.warn("Reasoning output coerced: verdict={}, risk_level={}, risk_score={}, confidence={}",
                    verdict.isPresent(), level.isPresent(), score != null, confidence != null);
        }
        return new ReasoningResult(
                coerced ? ReasoningResult.Kind.COERCED : ReasoningResult.Kind.VALID,
                finalVerdict,
                level.orElse(defaultLevel(finalVerdict)),
                score != null ? score : DEFAULT_RISK_SCORE,
                confidence != null ? confidence : DEFAULT_CONFIDENCE,
                reasoning,
                rawText);
    }

    public PolicyAnswer parseAnswer(String rawText) {
        Optional<JsonNode> root = readObject(rawText);
        if (root.isEmpty()) {
            // plain prose is still an answer
            return new PolicyAnswer(rawText == null ? "" : rawText.strip(), DEFAULT_CONFIDENCE);
        }
        Double confidence = unitInterval(root.get().path("confidence"));
        return new PolicyAnswer(root.get().path("answer").asText(""),
                confidence != null ? confidence : DEFAULT_CONFIDENCE);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Optional<JsonNode> readObject(String rawText) {
        if (rawText == null || rawText.isBlank()) return Optional.empty();
        String json = stripCodeFence(rawText.strip());
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Unparsable model output: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Models sometimes wrap JSON in a markdown fence despite the response format.
     */
    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) return text;
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) return text;
        return text.substring(firstNewline + 1, lastFence).strip();
    }

    private static Double unitInterval(JsonNode node) {
        if (node == null || !node.isNumber()) return null;
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) return null;
        return value;
    }

    private static RiskLevel defaultLevel(Verdict verdict) {
        switch (verdict) {
            case FLAG:
                return RiskLevel.HIGH;
            case ACCEPTABLE:
                return RiskLevel.LOW;
            default:
                return RiskLevel.MEDIUM;
        }
    }
}
