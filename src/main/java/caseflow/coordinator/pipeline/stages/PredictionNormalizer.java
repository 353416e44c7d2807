package caseflow.coordinator.pipeline.stages;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Coerces a model's prediction into the shape the rest of the pipeline relies on.
 * Out-of-range numbers are clamped, unparseable ones replaced by defaults,
 * and range objects are made non-negative and ordered.
 */
public final class PredictionNormalizer implements UnaryOperator<JsonNode> {

    static final Set<String> LEVELS = Set.of("low", "medium", "high");
    static final String[] PERCENT_FIELDS = {"outcome_prediction_score", "settlement_probability", "case_strength_score"};
    static final String[] RANGE_FIELDS = {"financial_outcome_range", "litigation_cost_range", "resolution_time_range"};
    static final double RANGE_CEILING = 10_000_000;

    @Override
    public JsonNode apply(JsonNode raw) {
        ObjectNode out = raw != null && raw.isObject()
                ? ((ObjectNode) raw).deepCopy()
                : JsonNodeFactory.instance.objectNode();

        for (String field : PERCENT_FIELDS) {
            out.put(field, (int) Math.round(number(out.get(field), 50, 0, 100)));
        }
        out.put("estimated_timeline", (int) Math.round(number(out.get("estimated_timeline"), 12, 1, 60)));
        out.put("risk_level", level(out.get("risk_level")));
        out.put("prediction_confidence", level(out.get("prediction_confidence")));

        for (String field : RANGE_FIELDS) {
            JsonNode range = out.get(field);
            double min = range != null && range.isObject() ? number(range.get("min"), 0, 0, RANGE_CEILING) : 0;
            double max = range != null && range.isObject() ? number(range.get("max"), 100_000, 0, RANGE_CEILING) : 100_000;
            ObjectNode normalized = out.putObject(field);
            normalized.put("min", Math.min(min, max));
            normalized.put("max", Math.max(min, max));
        }
        return out;
    }

    /**
     * Parse a number (numeric or textual), clamp it, or fall back to the default.
     */
    static double number(JsonNode node, double fallback, double min, double max) {
        double value;
        if (node == null || node.isNull()) {
            return fallback;
        } else if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        if (Double.isNaN(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    static String level(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return "medium";
        }
        String value = node.asText().trim().toLowerCase(Locale.ROOT);
        return LEVELS.contains(value) ? value : "medium";
    }

    /**
     * Normalizer for the complexity stage: {@code complexity_score} in 0..100, default 50.
     */
    public static UnaryOperator<JsonNode> complexity() {
        return raw -> {
            ObjectNode out = raw != null && raw.isObject()
                    ? ((ObjectNode) raw).deepCopy()
                    : JsonNodeFactory.instance.objectNode();
            out.put("complexity_score", (int) Math.round(number(out.get("complexity_score"), 50, 0, 100)));
            return out;
        };
    }
}
