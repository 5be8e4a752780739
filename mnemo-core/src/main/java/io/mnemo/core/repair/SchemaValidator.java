package io.mnemo.core.repair;

import com.fasterxml.jackson.databind.JsonNode;
import io.mnemo.core.model.EmotionalContext;
import io.mnemo.core.model.ExtractionResult;
import io.mnemo.core.model.MemoryItem;
import io.mnemo.core.model.Significance;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the plural response contract and builds the typed result. Unknown fields are ignored
 * and dropped, so a validated result re-validates to the same structure.
 */
public final class SchemaValidator {
    public static final int MIN_MEMORIES = 1;
    public static final int MAX_MEMORIES = 10;
    public static final int MIN_CONTENT = 10;
    public static final int MAX_CONTENT = 1200;
    public static final int MAX_SECONDARY_EMOTIONS = 5;
    public static final int MAX_THEMES = 8;
    public static final int MAX_COMPONENTS = 10;
    public static final int MAX_RELATIONSHIP_KEYS = 5;
    public static final int MAX_RELATIONSHIP_STRING = 500;
    public static final int MAX_RATIONALE = 800;

    public static final Set<String> SIGNIFICANCE_COMPONENTS = Set.of(
        "emotional_impact",
        "relationship_significance",
        "personal_growth",
        "milestone_achievement",
        "conflict_resolution",
        "vulnerability_shared",
        "breakthrough_moment",
        "support_impact",
        "memory_durability",
        "life_changing_potential"
    );

    public static final Set<String> RELATIONSHIP_KEYS = Set.of(
        "trust_level",
        "conflict_present",
        "support_given",
        "support_received",
        "boundary_crossed",
        "intimacy_level",
        "power_dynamic",
        "communication_quality",
        "shared_experience",
        "relationship_stage"
    );

    public ValidationResult validate(JsonNode root, String expectedVersion) {
        List<String> errors = new ArrayList<>();
        if (root == null || !root.isObject()) {
            return ValidationResult.invalid(List.of("response is not a JSON object"));
        }
        JsonNode version = root.path("schemaVersion");
        if (!version.isTextual() || !version.asText().equals(expectedVersion)) {
            errors.add("schemaVersion must be " + expectedVersion);
        }
        JsonNode memoriesNode = root.path("memories");
        if (!memoriesNode.isArray()) {
            errors.add("memories must be an array");
            return ValidationResult.invalid(errors);
        }
        if (memoriesNode.size() < MIN_MEMORIES || memoriesNode.size() > MAX_MEMORIES) {
            errors.add("memories must hold between " + MIN_MEMORIES + " and " + MAX_MEMORIES + " items");
        }
        List<MemoryItem> memories = new ArrayList<>();
        for (int i = 0; i < memoriesNode.size(); i++) {
            MemoryItem item = memory(memoriesNode.get(i), "memories[" + i + "]", errors);
            if (item != null) {
                memories.add(item);
            }
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        return ValidationResult.valid(new ExtractionResult(expectedVersion, memories));
    }

    private MemoryItem memory(JsonNode node, String path, List<String> errors) {
        if (!node.isObject()) {
            errors.add(path + " must be an object");
            return null;
        }
        int before = errors.size();

        String id = null;
        if (node.has("id") && !node.get("id").isNull()) {
            if (node.get("id").isTextual()) {
                id = node.get("id").asText();
            } else {
                errors.add(path + ".id must be a string");
            }
        }

        String content = requiredText(node, "content", path, errors);
        if (content != null && (content.length() < MIN_CONTENT || content.length() > MAX_CONTENT)) {
            errors.add(path + ".content length must be " + MIN_CONTENT + ".." + MAX_CONTENT);
        }

        EmotionalContext emotional = emotionalContext(node.path("emotionalContext"), path + ".emotionalContext", errors);
        Significance significance = significance(node.path("significance"), path + ".significance", errors);
        Map<String, Object> dynamics = relationshipDynamics(node.get("relationshipDynamics"), path + ".relationshipDynamics", errors);

        String rationale = null;
        if (node.has("rationale") && !node.get("rationale").isNull()) {
            JsonNode value = node.get("rationale");
            if (!value.isTextual()) {
                errors.add(path + ".rationale must be a string");
            } else if (value.asText().length() > MAX_RATIONALE) {
                errors.add(path + ".rationale exceeds " + MAX_RATIONALE + " characters");
            } else {
                rationale = value.asText();
            }
        }

        double confidence = number(node.path("confidence"), path + ".confidence", 0.0, 1.0, errors);

        if (errors.size() > before) {
            return null;
        }
        return new MemoryItem(id, content, emotional, significance, dynamics, rationale, confidence);
    }

    private EmotionalContext emotionalContext(JsonNode node, String path, List<String> errors) {
        if (!node.isObject()) {
            errors.add(path + " must be an object");
            return null;
        }
        String primary = requiredText(node, "primaryEmotion", path, errors);
        List<String> secondary = stringList(node.path("secondaryEmotions"), path + ".secondaryEmotions", MAX_SECONDARY_EMOTIONS, errors);
        double intensity = number(node.path("intensity"), path + ".intensity", 0.0, 1.0, errors);
        double valence = number(node.path("valence"), path + ".valence", -1.0, 1.0, errors);
        List<String> themes = stringList(node.path("themes"), path + ".themes", MAX_THEMES, errors);
        return new EmotionalContext(primary, secondary, intensity, valence, themes);
    }

    private Significance significance(JsonNode node, String path, List<String> errors) {
        if (!node.isObject()) {
            errors.add(path + " must be an object");
            return null;
        }
        double overall = number(node.path("overall"), path + ".overall", 0.0, 10.0, errors);
        JsonNode componentsNode = node.path("components");
        Map<String, Double> components = new LinkedHashMap<>();
        if (!componentsNode.isObject()) {
            errors.add(path + ".components must be an object");
        } else {
            if (componentsNode.size() > MAX_COMPONENTS) {
                errors.add(path + ".components allows at most " + MAX_COMPONENTS + " keys");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = componentsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!SIGNIFICANCE_COMPONENTS.contains(field.getKey())) {
                    errors.add(path + ".components has unknown key " + field.getKey());
                } else if (!field.getValue().isNumber()) {
                    errors.add(path + ".components." + field.getKey() + " must be a number");
                } else {
                    components.put(field.getKey(), field.getValue().asDouble());
                }
            }
        }
        return new Significance(overall, components);
    }

    private Map<String, Object> relationshipDynamics(JsonNode node, String path, List<String> errors) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            errors.add(path + " must be an object");
            return null;
        }
        if (node.size() > MAX_RELATIONSHIP_KEYS) {
            errors.add(path + " allows at most " + MAX_RELATIONSHIP_KEYS + " keys");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!RELATIONSHIP_KEYS.contains(field.getKey())) {
                errors.add(path + " has unknown key " + field.getKey());
            } else if (value.isTextual() && value.asText().length() <= MAX_RELATIONSHIP_STRING) {
                values.put(field.getKey(), value.asText());
            } else if (value.isBoolean()) {
                values.put(field.getKey(), value.asBoolean());
            } else if (value.isIntegralNumber()) {
                values.put(field.getKey(), value.asLong());
            } else if (value.isNumber()) {
                values.put(field.getKey(), value.asDouble());
            } else {
                errors.add(path + "." + field.getKey() + " must be a string (max " + MAX_RELATIONSHIP_STRING
                    + "), number or boolean");
            }
        }
        return values;
    }

    private String requiredText(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.path(field);
        if (!value.isTextual()) {
            errors.add(path + "." + field + " must be a string");
            return null;
        }
        return value.asText();
    }

    private List<String> stringList(JsonNode node, String path, int max, List<String> errors) {
        if (!node.isArray()) {
            errors.add(path + " must be an array");
            return List.of();
        }
        if (node.size() > max) {
            errors.add(path + " allows at most " + max + " items");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                errors.add(path + " must only hold strings");
                return List.of();
            }
            values.add(item.asText());
        }
        return values;
    }

    private double number(JsonNode node, String path, double min, double max, List<String> errors) {
        if (!node.isNumber()) {
            errors.add(path + " must be a number");
            return 0.0;
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < min || value > max) {
            errors.add(path + " must be within [" + min + ", " + max + "]");
        }
        return value;
    }
}
